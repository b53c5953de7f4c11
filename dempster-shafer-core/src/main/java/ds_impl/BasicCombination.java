package ds_impl;

import java.util.List;

import org.apache.log4j.Logger;

import ds_helper.FrameAlignment;
import ds_helper.MassFunction;
import it.unimi.dsi.fastutil.longs.Long2DoubleOpenHashMap;

/**
 * Conjunctive (Dempster) and disjunctive rules, and the n-ary fold over any binary rule.
 */
public class BasicCombination {

	private static final Logger LOG = Logger.getLogger(BasicCombination.class);

	public static MassFunction combineConjunctive(MassFunction m1, MassFunction m2) {
		return combineConjunctive(m1, m2, true);
	}

	/**
	 * m(A) = sum of m1(B) * m2(C) over B, C with B &cap; C = A, the empty set included.
	 *
	 * @param normalize apply Dempster's normalization, throwing {@link ds_helper.TotalConflictException}
	 *                  when nothing but conflict remains
	 */
	public static MassFunction combineConjunctive(MassFunction m1, MassFunction m2, boolean normalize) {
		FrameAlignment aligned = FrameAlignment.of(m1, m2);
		Long2DoubleOpenHashMap combined = conjunctiveMasses(aligned.operand(0), aligned.operand(1));
		MassFunction raw = aligned.resultBuilder().assignAll(combined).buildRaw();
		if (LOG.isDebugEnabled())
			LOG.debug("Conjunctive combination: " + raw.size() + " focal sets, conflict=" + raw.conflictMass());
		return normalize ? raw.normalize() : raw;
	}

	/**
	 * m(A) = sum of m1(B) * m2(C) over B, C with B &cup; C = A. Never produces conflict.
	 */
	public static MassFunction combineDisjunctive(MassFunction m1, MassFunction m2) {
		FrameAlignment aligned = FrameAlignment.of(m1, m2);
		MassFunction a = aligned.operand(0);
		MassFunction b = aligned.operand(1);
		Long2DoubleOpenHashMap combined = new Long2DoubleOpenHashMap(a.size() * b.size());
		for (int i = 0; i < a.size(); i++) {
			for (int j = 0; j < b.size(); j++)
				combined.addTo(a.focalSet(i) | b.focalSet(j), a.massAt(i) * b.massAt(j));
		}
		return aligned.resultBuilder().assignAll(combined).buildRaw();
	}

	/**
	 * Left fold of the rule over the sources, in the order given. A single source is returned as is.
	 */
	public static MassFunction combineMultiple(List<MassFunction> sources, CombinationRule rule) {
		if (sources == null || sources.isEmpty())
			throw new IllegalArgumentException("No mass functions provided");
		MassFunction result = sources.get(0);
		for (int i = 1; i < sources.size(); i++)
			result = rule.combine(result, sources.get(i));
		return result;
	}

	/**
	 * Mass the unnormalized conjunctive combination would put on the empty set.
	 */
	public static double conflict(MassFunction m1, MassFunction m2) {
		FrameAlignment aligned = FrameAlignment.of(m1, m2);
		MassFunction a = aligned.operand(0);
		MassFunction b = aligned.operand(1);
		double k = 0.0;
		for (int i = 0; i < a.size(); i++) {
			for (int j = 0; j < b.size(); j++) {
				if ((a.focalSet(i) & b.focalSet(j)) == 0L)
					k += a.massAt(i) * b.massAt(j);
			}
		}
		return k;
	}

	/**
	 * Pairwise intersections of two operands that already share a frame.
	 */
	static Long2DoubleOpenHashMap conjunctiveMasses(MassFunction a, MassFunction b) {
		Long2DoubleOpenHashMap combined = new Long2DoubleOpenHashMap(a.size() * b.size());
		for (int i = 0; i < a.size(); i++) {
			for (int j = 0; j < b.size(); j++)
				combined.addTo(a.focalSet(i) & b.focalSet(j), a.massAt(i) * b.massAt(j));
		}
		return combined;
	}
}
