package ds_impl;

import org.apache.log4j.Logger;

import ds_helper.FrameAlignment;
import ds_helper.MassFunction;
import ds_helper.TotalConflictException;
import it.unimi.dsi.fastutil.longs.Long2DoubleMap;
import it.unimi.dsi.fastutil.longs.Long2DoubleOpenHashMap;

/*
 * Alternatives to Dempster's normalization. All of them start from the
 * unnormalized conjunctive combination and only differ in where the
 * conflict mass K = m(empty set) ends up.
 */
public class AdvancedCombination {

	private static final Logger LOG = Logger.getLogger(AdvancedCombination.class);

	/**
	 * Yager (1987): the conflict is transferred to the whole frame.
	 */
	public static MassFunction combineYager(MassFunction m1, MassFunction m2) {
		FrameAlignment aligned = FrameAlignment.of(m1, m2);
		Long2DoubleOpenHashMap combined = BasicCombination.conjunctiveMasses(aligned.operand(0), aligned.operand(1));
		double conflict = combined.remove(0L);
		combined.addTo(aligned.frame().fullMask(), conflict);
		if (LOG.isDebugEnabled())
			LOG.debug("Yager: conflict " + conflict + " moved to " + aligned.frame());
		return aligned.resultBuilder().assignAll(combined).build();
	}

	/**
	 * Dubois and Prade (1988): the product of every disjoint pair goes to the union of the pair.
	 */
	public static MassFunction combineDuboisPrade(MassFunction m1, MassFunction m2) {
		FrameAlignment aligned = FrameAlignment.of(m1, m2);
		MassFunction a = aligned.operand(0);
		MassFunction b = aligned.operand(1);
		Long2DoubleOpenHashMap combined = new Long2DoubleOpenHashMap(a.size() * b.size());
		for (int i = 0; i < a.size(); i++) {
			for (int j = 0; j < b.size(); j++) {
				long intersection = a.focalSet(i) & b.focalSet(j);
				long target = intersection != 0L ? intersection : a.focalSet(i) | b.focalSet(j);
				combined.addTo(target, a.massAt(i) * b.massAt(j));
			}
		}
		return aligned.resultBuilder().assignAll(combined).build();
	}

	/**
	 * Conflict redistribution weighted by the sources' plausibilities.
	 * <br/>
	 * Every focal set H of the conjunctive result other than the frame, that is focal in m1 or m2 with
	 * pl1(H) + pl2(H) &gt; 0, receives K * (pl1(H) + pl2(H)) / (pl1(H) + pl2(H)) = K. Plausibilities only
	 * count for sets focal in the respective source. Since several sets may each receive K, the result
	 * is rescaled to 1 afterwards.
	 *
	 * @throws TotalConflictException if the sources are fully contradictory and nothing can absorb the conflict
	 */
	public static MassFunction combineZhang(MassFunction m1, MassFunction m2) {
		FrameAlignment aligned = FrameAlignment.of(m1, m2);
		MassFunction a = aligned.operand(0);
		MassFunction b = aligned.operand(1);
		Long2DoubleOpenHashMap combined = BasicCombination.conjunctiveMasses(a, b);
		double conflict = combined.remove(0L);
		if (combined.isEmpty())
			throw new TotalConflictException(conflict);

		long omega = aligned.frame().fullMask();
		Long2DoubleOpenHashMap redistributed = new Long2DoubleOpenHashMap(combined);
		int receivers = 0;
		for (Long2DoubleMap.Entry e : combined.long2DoubleEntrySet()) {
			long h = e.getLongKey();
			if (h == omega)
				continue;
			double w1 = a.mass(h) > 0 ? a.plausibility(h) : 0.0;
			double w2 = b.mass(h) > 0 ? b.plausibility(h) : 0.0;
			double totalWeight = w1 + w2;
			if (totalWeight > 0) {
				redistributed.addTo(h, conflict * (w1 + w2) / totalWeight);
				receivers++;
			}
		}
		if (LOG.isDebugEnabled())
			LOG.debug("Zhang: conflict " + conflict + " given to " + receivers + " focal sets");
		return aligned.resultBuilder().assignAll(redistributed).build();
	}
}
