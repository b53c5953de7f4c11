package ds_impl;

import java.util.Collection;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import ds_helper.Frame;
import ds_helper.InvalidPartitionException;
import ds_helper.MassFunction;
import ds_helper.MassValidationException;
import it.unimi.dsi.fastutil.longs.Long2DoubleMap;
import it.unimi.dsi.fastutil.longs.Long2DoubleOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;

/*
 * Contextual discounting (Mercier, Quost and Denoeux 2005).
 *
 * The frame is split into contexts, each with its own discount rate
 * (0 = fully reliable, 1 = fully unreliable). Mass on B spreads over the
 * supersets A of B with the generalization coefficients
 *
 *   G(A,B) = prod over contexts meeting B of (1 - rate)
 *          * prod over contexts meeting A but not B of rate
 *
 * after which zero entries are dropped and the result is rescaled to 1.
 * With one context per frame element this is the element-wise contextual
 * discounting, with the blocks of a partition it is theta-contextual
 * discounting. Supersets are enumerated, so the frame must stay below
 * Frame.MAX_POWERSET_ELEMENTS.
 */
public class ContextualDiscounting {

	private static final Logger LOG = Logger.getLogger(ContextualDiscounting.class);

	/**
	 * @param alphas discount rate per frame element; missing elements are fully reliable
	 */
	public static MassFunction discountContextual(MassFunction m, Map<String, Double> alphas) {
		Frame frame = m.frame();
		checkElementRates(frame, alphas);
		long[] blocks = new long[frame.size()];
		double[] rates = new double[frame.size()];
		for (int i = 0; i < frame.size(); i++) {
			blocks[i] = 1L << i;
			Double rate = alphas.get(frame.element(i));
			rates[i] = rate == null ? 0.0 : rate;
		}
		return generalize(m, blocks, rates);
	}

	/**
	 * @param partition disjoint blocks covering the frame of m
	 * @param alphas discount rate per block; missing blocks are fully reliable
	 * @throws InvalidPartitionException if the blocks overlap, miss part of the frame or a rate names no block
	 */
	public static MassFunction discountThetaContextual(MassFunction m, List<? extends Collection<String>> partition,
			Map<? extends Collection<String>, Double> alphas) {
		Frame frame = m.frame();
		long[] blocks = partitionMasks(frame, partition);
		double[] rates = blockRates(frame, blocks, alphas);
		return generalize(m, blocks, rates);
	}

	/**
	 * G(A,B) for every pair of non-empty subsets B &sube; A of the frame, keyed by A then B.
	 * There are about 3^n pairs.
	 */
	public static Long2ObjectMap<Long2DoubleMap> generalizationMatrix(Frame frame, Map<String, Double> alphas) {
		checkElementRates(frame, alphas);
		long[] blocks = new long[frame.size()];
		double[] rates = new double[frame.size()];
		for (int i = 0; i < frame.size(); i++) {
			blocks[i] = 1L << i;
			Double rate = alphas.get(frame.element(i));
			rates[i] = rate == null ? 0.0 : rate;
		}
		return matrix(frame, blocks, rates);
	}

	public static Long2ObjectMap<Long2DoubleMap> thetaGeneralizationMatrix(Frame frame, List<? extends Collection<String>> partition,
			Map<? extends Collection<String>, Double> alphas) {
		long[] blocks = partitionMasks(frame, partition);
		return matrix(frame, blocks, blockRates(frame, blocks, alphas));
	}

	/**
	 * Sequential discounting by context: for each context C with reliability r, in iteration order,
	 * focal sets inside C keep r * m(A) and pass (1 - r) * m(A) to the frame. Other focal sets are untouched.
	 */
	public static MassFunction discountPerContext(MassFunction m, Map<? extends Collection<String>, Double> reliabilities) {
		Frame frame = m.frame();
		long omega = frame.fullMask();
		Long2DoubleOpenHashMap current = m.toMaskMap();
		for (Map.Entry<? extends Collection<String>, Double> e : reliabilities.entrySet()) {
			long context = frame.maskOf(e.getKey());
			double r = e.getValue();
			ClassicalDiscounting.checkRate("Reliability factor for " + Frame.formatLabels(e.getKey()), r);
			Long2DoubleOpenHashMap next = new Long2DoubleOpenHashMap(current.size() + 1);
			for (Long2DoubleMap.Entry f : current.long2DoubleEntrySet()) {
				long h = f.getLongKey();
				double v = f.getDoubleValue();
				if ((h & ~context) == 0L) {
					next.addTo(h, r * v);
					next.addTo(omega, (1.0 - r) * v);
				} else {
					next.addTo(h, v);
				}
			}
			current = next;
		}
		return MassFunction.builder(frame, m.hasDeclaredFrame()).assignAll(current).buildRaw();
	}

	/**
	 * Discounts only focal sets equal to a keyed hypothesis H: m(H) becomes r * m(H) and (1 - r) * m(H)
	 * moves to the frame. Strict subsets and supersets of H are left alone.
	 */
	public static MassFunction discountPerHypothesis(MassFunction m, Map<? extends Collection<String>, Double> reliabilities) {
		Frame frame = m.frame();
		long omega = frame.fullMask();
		Long2DoubleOpenHashMap result = m.toMaskMap();
		for (Map.Entry<? extends Collection<String>, Double> e : reliabilities.entrySet()) {
			long hypothesis = frame.maskOf(e.getKey());
			double r = e.getValue();
			ClassicalDiscounting.checkRate("Reliability factor for " + Frame.formatLabels(e.getKey()), r);
			if (!result.containsKey(hypothesis))
				continue;
			double v = result.get(hypothesis);
			result.put(hypothesis, r * v);
			result.addTo(omega, (1.0 - r) * v);
		}
		return MassFunction.builder(frame, m.hasDeclaredFrame()).assignAll(result).buildRaw();
	}

	private static MassFunction generalize(MassFunction m, long[] blocks, double[] rates) {
		Frame frame = m.frame();
		if (allEqual(rates, 0.0))
			return m;
		if (allEqual(rates, 1.0))
			return MassFunction.vacuous(frame, m.hasDeclaredFrame());
		frame.requireEnumerable();

		long omega = frame.fullMask();
		Long2DoubleOpenHashMap discounted = new Long2DoubleOpenHashMap();
		for (int i = 0; i < m.size(); i++) {
			long b = m.focalSet(i);
			if (b == 0L)
				continue;
			long rest = omega & ~b;
			long s = rest;
			while (true) {
				long a = b | s;
				double g = coefficient(a, b, blocks, rates);
				if (g > 0)
					discounted.addTo(a, g * m.massAt(i));
				if (s == 0L)
					break;
				s = (s - 1) & rest;
			}
		}

		double total = 0.0;
		for (double v : discounted.values())
			total += v;
		if (!(total > 0)) {
			LOG.debug("Every focal set lies in a fully unreliable context, returning the vacuous mass function");
			return MassFunction.vacuous(frame, m.hasDeclaredFrame());
		}
		return MassFunction.builder(frame, m.hasDeclaredFrame()).assignAll(discounted).build();
	}

	private static double coefficient(long a, long b, long[] blocks, double[] rates) {
		double g = 1.0;
		for (int k = 0; k < blocks.length; k++) {
			if ((blocks[k] & b) != 0L)
				g *= 1.0 - rates[k];
			else if ((blocks[k] & a) != 0L)
				g *= rates[k];
		}
		return g;
	}

	private static Long2ObjectMap<Long2DoubleMap> matrix(Frame frame, long[] blocks, double[] rates) {
		frame.requireEnumerable();
		Long2ObjectMap<Long2DoubleMap> g = new Long2ObjectOpenHashMap<Long2DoubleMap>();
		for (long a = 1; a <= frame.fullMask(); a++) {
			Long2DoubleOpenHashMap row = new Long2DoubleOpenHashMap();
			// non-empty submasks of a
			for (long b = a; b != 0L; b = (b - 1) & a)
				row.put(b, coefficient(a, b, blocks, rates));
			g.put(a, row);
		}
		return g;
	}

	private static void checkElementRates(Frame frame, Map<String, Double> alphas) {
		for (Map.Entry<String, Double> e : alphas.entrySet()) {
			if (!frame.contains(e.getKey()))
				throw new MassValidationException("Element " + e.getKey() + " not in frame of discernment " + frame);
			ClassicalDiscounting.checkRate("Discount rate for " + e.getKey(), e.getValue());
		}
	}

	private static long[] partitionMasks(Frame frame, List<? extends Collection<String>> partition) {
		long[] blocks = new long[partition.size()];
		long covered = 0L;
		for (int k = 0; k < blocks.length; k++) {
			Collection<String> block = partition.get(k);
			if (block.isEmpty())
				throw new InvalidPartitionException("Theta partition must not contain empty blocks");
			for (String label : block) {
				if (!frame.contains(label))
					throw new InvalidPartitionException("Block " + Frame.formatLabels(block) + " has element " + label + " outside " + frame);
			}
			blocks[k] = frame.maskOf(block);
			if ((covered & blocks[k]) != 0L)
				throw new InvalidPartitionException("Theta partition must consist of disjoint subsets, "
						+ Frame.formatLabels(block) + " overlaps an earlier block");
			covered |= blocks[k];
		}
		if (covered != frame.fullMask())
			throw new InvalidPartitionException("Theta partition must cover the entire frame of discernment " + frame
					+ ", missing " + frame.format(frame.fullMask() & ~covered));
		return blocks;
	}

	private static double[] blockRates(Frame frame, long[] blocks, Map<? extends Collection<String>, Double> alphas) {
		double[] rates = new double[blocks.length];
		for (Map.Entry<? extends Collection<String>, Double> e : alphas.entrySet()) {
			int k = indexOfBlock(frame, blocks, e.getKey());
			ClassicalDiscounting.checkRate("Discount rate for " + Frame.formatLabels(e.getKey()), e.getValue());
			rates[k] = e.getValue();
		}
		return rates;
	}

	private static int indexOfBlock(Frame frame, long[] blocks, Collection<String> labels) {
		for (String label : labels) {
			if (!frame.contains(label))
				throw new InvalidPartitionException("Subset " + Frame.formatLabels(labels) + " not in theta partition");
		}
		long mask = frame.maskOf(labels);
		for (int k = 0; k < blocks.length; k++) {
			if (blocks[k] == mask)
				return k;
		}
		throw new InvalidPartitionException("Subset " + Frame.formatLabels(labels) + " not in theta partition");
	}

	private static boolean allEqual(double[] values, double expected) {
		for (double v : values) {
			if (v != expected)
				return false;
		}
		return true;
	}
}
