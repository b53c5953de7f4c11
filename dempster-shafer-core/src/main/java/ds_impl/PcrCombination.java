package ds_impl;

import java.util.List;

import org.apache.log4j.Logger;

import ds_helper.FrameAlignment;
import ds_helper.MassFunction;
import ds_helper.MassValidationException;
import it.unimi.dsi.fastutil.longs.Long2DoubleOpenHashMap;

/*
 * Proportional conflict redistribution.
 * PCR5 (Smarandache and Dezert 2005) works on two sources, PCR6 (Martin and
 * Osswald 2006) on any number. Both give the product of a conflicting
 * combination back to the focal sets that produced it, in proportion to
 * the masses they were given by their source.
 */
public class PcrCombination {

	private static final Logger LOG = Logger.getLogger(PcrCombination.class);

	public static MassFunction combinePcr5(MassFunction m1, MassFunction m2) {
		FrameAlignment aligned = FrameAlignment.of(m1, m2);
		MassFunction a = aligned.operand(0);
		MassFunction b = aligned.operand(1);
		Long2DoubleOpenHashMap combined = BasicCombination.conjunctiveMasses(a, b);
		double conflict = combined.remove(0L);
		if (conflict == 0.0)
			return aligned.resultBuilder().assignAll(combined).build();

		for (int i = 0; i < a.size(); i++) {
			long x = a.focalSet(i);
			double mx = a.massAt(i);
			for (int j = 0; j < b.size(); j++) {
				long y = b.focalSet(j);
				if ((x & y) != 0L)
					continue;
				double my = b.massAt(j);
				double total = mx + my;
				if (total > 0) {
					combined.addTo(x, mx * my * mx / total);
					combined.addTo(y, mx * my * my / total);
				}
			}
		}
		if (LOG.isDebugEnabled())
			LOG.debug("PCR5: redistributed conflict " + conflict);
		return aligned.resultBuilder().assignAll(combined).build();
	}

	/**
	 * PCR6 over any number of sources.
	 * <br/>
	 * Enumerates every combination of one focal set per source, so the cost is the product of the
	 * sources' focal counts. A combination with a non-empty intersection feeds that intersection;
	 * an empty one gives each chosen focal set X_i the share P * m_i(X_i) / (m_1(X_1) + ... + m_n(X_n))
	 * of its product P. With two sources this is PCR5.
	 */
	public static MassFunction combinePcr6(List<MassFunction> sources) {
		if (sources == null || sources.isEmpty())
			throw new IllegalArgumentException("No mass functions provided");
		if (sources.size() == 1)
			return sources.get(0);
		if (sources.size() == 2)
			return combinePcr5(sources.get(0), sources.get(1));

		FrameAlignment aligned = FrameAlignment.of(sources);
		List<MassFunction> operands = aligned.operands();
		int n = operands.size();
		for (MassFunction m : operands) {
			if (m.size() == 0)
				throw new MassValidationException("PCR6 operands need at least one focal set");
		}
		int[] choice = new int[n];
		long[] chosenSets = new long[n];
		double[] chosenMasses = new double[n];
		Long2DoubleOpenHashMap result = new Long2DoubleOpenHashMap();
		long tuples = 0;
		double conflict = 0.0;

		// odometer over the cartesian product of the focal lists
		while (true) {
			long intersection = aligned.frame().fullMask();
			double product = 1.0;
			double massSum = 0.0;
			for (int s = 0; s < n; s++) {
				MassFunction m = operands.get(s);
				chosenSets[s] = m.focalSet(choice[s]);
				chosenMasses[s] = m.massAt(choice[s]);
				intersection &= chosenSets[s];
				product *= chosenMasses[s];
				massSum += chosenMasses[s];
			}
			tuples++;
			if (intersection != 0L) {
				result.addTo(intersection, product);
			} else if (massSum > 0) {
				conflict += product;
				for (int s = 0; s < n; s++)
					result.addTo(chosenSets[s], product * chosenMasses[s] / massSum);
			}

			int s = n - 1;
			while (s >= 0 && ++choice[s] == operands.get(s).size()) {
				choice[s] = 0;
				s--;
			}
			if (s < 0)
				break;
		}
		if (LOG.isDebugEnabled())
			LOG.debug("PCR6: " + n + " sources, " + tuples + " combinations, conflict " + conflict);
		return aligned.resultBuilder().assignAll(result).build();
	}
}
