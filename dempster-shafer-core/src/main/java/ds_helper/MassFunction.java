package ds_helper;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.apache.log4j.Logger;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.longs.Long2DoubleMap;
import it.unimi.dsi.fastutil.longs.Long2DoubleOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import it.unimi.dsi.fastutil.longs.LongLists;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;

/**
 * Basic belief assignment over a frame of discernment.
 * <br/>
 * Immutable. Focal sets are subset masks of {@link #frame()} kept in ascending order, each with a
 * strictly positive finite mass. The frame is either declared by the caller or inferred as the
 * union of the focal sets' labels; rules use the distinction to decide frame compatibility.
 * <br/>
 * Instances are created through {@link #builder()} / {@link #builder(Frame)}:
 * {@link Builder#build()} validates and normalizes, {@link Builder#buildRaw()} validates only.
 */
public final class MassFunction implements Serializable {

	private static final long serialVersionUID = 1L;
	private static final Logger LOG = Logger.getLogger(MassFunction.class);

	/** Tolerance under which a total mass counts as 1. */
	public static final double TOLERANCE = 1e-10;
	/** Magnitude under which reconstructed masses are treated as floating-point noise. */
	public static final double EPSILON = 1e-12;

	private final Frame frame;
	private final boolean frameDeclared;
	private final long[] focalSets;
	private final double[] masses;

	private MassFunction(Frame frame, boolean frameDeclared, Long2DoubleMap accumulated) {
		this.frame = frame;
		this.frameDeclared = frameDeclared;
		LongArrayList keys = new LongArrayList(accumulated.size());
		for (Long2DoubleMap.Entry e : accumulated.long2DoubleEntrySet()) {
			if (e.getDoubleValue() > 0)
				keys.add(e.getLongKey());
		}
		long[] sorted = keys.toLongArray();
		Arrays.sort(sorted);
		this.focalSets = sorted;
		this.masses = new double[sorted.length];
		for (int i = 0; i < sorted.length; i++)
			this.masses[i] = accumulated.get(sorted[i]);
	}

	public static Builder builder() {
		return new Builder(null, false);
	}

	public static Builder builder(Frame frame) {
		return new Builder(frame, true);
	}

	/**
	 * Builder over a known frame whose declared/inferred status is carried over from the operands of a rule.
	 */
	public static Builder builder(Frame frame, boolean frameDeclared) {
		return new Builder(frame, frameDeclared);
	}

	/**
	 * Total ignorance: all mass on the frame itself.
	 */
	public static MassFunction vacuous(Frame frame) {
		return vacuous(frame, true);
	}

	public static MassFunction vacuous(Frame frame, boolean frameDeclared) {
		if (frame.isEmpty())
			throw new MassValidationException("The vacuous mass function needs a non-empty frame");
		return builder(frame, frameDeclared).assign(frame.fullMask(), 1.0).buildRaw();
	}

	public Frame frame() {
		return frame;
	}

	public boolean hasDeclaredFrame() {
		return frameDeclared;
	}

	/**
	 * @return number of focal sets
	 */
	public int size() {
		return focalSets.length;
	}

	public long focalSet(int index) {
		return focalSets[index];
	}

	public double massAt(int index) {
		return masses[index];
	}

	public LongList focalSets() {
		return LongLists.unmodifiable(LongArrayList.wrap(focalSets.clone()));
	}

	public double mass(long subset) {
		int i = Arrays.binarySearch(focalSets, subset);
		return i >= 0 ? masses[i] : 0.0;
	}

	public double mass(Collection<String> labels) {
		return mass(frame.maskOf(labels));
	}

	public double mass(String subsetText) {
		return mass(frame.parse(subsetText));
	}

	/**
	 * @return mass on the empty set
	 */
	public double conflictMass() {
		return mass(0L);
	}

	public double totalMass() {
		double total = 0.0;
		for (double m : masses)
			total += m;
		return total;
	}

	public boolean isNormalized() {
		return conflictMass() == 0.0 && Math.abs(totalMass() - 1.0) < TOLERANCE;
	}

	/**
	 * Sum of the masses of the non-empty focal sets contained in the hypothesis.
	 */
	public double belief(long hypothesis) {
		frame.checkSubset(hypothesis);
		double bel = 0.0;
		for (int i = 0; i < focalSets.length; i++) {
			long a = focalSets[i];
			if (a != 0L && (a & ~hypothesis) == 0L)
				bel += masses[i];
		}
		return bel;
	}

	public double belief(Collection<String> labels) {
		return belief(frame.maskOf(labels));
	}

	public double belief(String subsetText) {
		return belief(frame.parse(subsetText));
	}

	/**
	 * Sum of the masses of the focal sets that intersect the hypothesis.
	 */
	public double plausibility(long hypothesis) {
		frame.checkSubset(hypothesis);
		double pl = 0.0;
		for (int i = 0; i < focalSets.length; i++) {
			if ((focalSets[i] & hypothesis) != 0L)
				pl += masses[i];
		}
		return pl;
	}

	public double plausibility(Collection<String> labels) {
		return plausibility(frame.maskOf(labels));
	}

	public double plausibility(String subsetText) {
		return plausibility(frame.parse(subsetText));
	}

	/**
	 * Sum of the masses of the focal sets containing the hypothesis.
	 */
	public double commonality(long hypothesis) {
		frame.checkSubset(hypothesis);
		double q = 0.0;
		for (int i = 0; i < focalSets.length; i++) {
			if ((hypothesis & ~focalSets[i]) == 0L)
				q += masses[i];
		}
		return q;
	}

	public double commonality(Collection<String> labels) {
		return commonality(frame.maskOf(labels));
	}

	public double commonality(String subsetText) {
		return commonality(frame.parse(subsetText));
	}

	/**
	 * Drops the conflict mass and rescales the rest to 1.
	 *
	 * @throws TotalConflictException if nothing but conflict is left
	 */
	public MassFunction normalize() {
		double conflict = 0.0;
		double total = 0.0;
		Long2DoubleOpenHashMap kept = new Long2DoubleOpenHashMap(focalSets.length);
		for (int i = 0; i < focalSets.length; i++) {
			if (focalSets[i] == 0L) {
				conflict += masses[i];
			} else {
				kept.put(focalSets[i], masses[i]);
				total += masses[i];
			}
		}
		if (kept.isEmpty() || total == 0.0)
			throw new TotalConflictException(conflict);
		if (conflict == 0.0 && Math.abs(total - 1.0) < TOLERANCE)
			return this;
		if (LOG.isDebugEnabled())
			LOG.debug("Normalizing: conflict=" + conflict + ", remaining=" + total);
		for (Long2DoubleMap.Entry e : kept.long2DoubleEntrySet())
			e.setValue(e.getDoubleValue() / total);
		return new MassFunction(frame, frameDeclared, kept);
	}

	/**
	 * Re-expresses the focal sets over another frame that contains every label of this one.
	 */
	public MassFunction reindex(Frame target, boolean declared) {
		if (frame.equals(target))
			return declared == frameDeclared ? this : new MassFunction(target, declared, toMaskMap());
		int[] positions = new int[frame.size()];
		for (int i = 0; i < frame.size(); i++) {
			positions[i] = target.indexOf(frame.element(i));
			if (positions[i] < 0)
				throw new MassValidationException("Element '" + frame.element(i) + "' is not in the frame " + target);
		}
		Long2DoubleOpenHashMap remapped = new Long2DoubleOpenHashMap(focalSets.length);
		for (int i = 0; i < focalSets.length; i++) {
			long mask = 0L;
			long rest = focalSets[i];
			while (rest != 0L) {
				int bit = Long.numberOfTrailingZeros(rest);
				mask |= 1L << positions[bit];
				rest &= rest - 1;
			}
			remapped.addTo(mask, masses[i]);
		}
		return new MassFunction(target, declared, remapped);
	}

	public Long2DoubleOpenHashMap toMaskMap() {
		Long2DoubleOpenHashMap map = new Long2DoubleOpenHashMap(focalSets.length);
		for (int i = 0; i < focalSets.length; i++)
			map.put(focalSets[i], masses[i]);
		return map;
	}

	/**
	 * Focal sets in interchange form, ordered by cardinality then by mask.
	 */
	public Map<String, Double> toTextMap() {
		long[] ordered = focalSets.clone();
		sortByCardinality(ordered);
		Map<String, Double> map = new LinkedHashMap<String, Double>();
		for (long a : ordered)
			map.put(frame.format(a), mass(a));
		return map;
	}

	/**
	 * Compares masses focal set by focal set, after bringing both functions onto the union of their frames.
	 */
	public boolean approximatelyEquals(MassFunction other, double tolerance) {
		Frame union = frame.union(other.frame);
		MassFunction a = this.reindex(union, frameDeclared);
		MassFunction b = other.reindex(union, other.frameDeclared);
		LongOpenHashSet keys = new LongOpenHashSet(a.focalSets);
		keys.addAll(LongArrayList.wrap(b.focalSets));
		for (long k : keys) {
			if (Math.abs(a.mass(k) - b.mass(k)) > tolerance)
				return false;
		}
		return true;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof MassFunction))
			return false;
		MassFunction other = (MassFunction) o;
		return frame.equals(other.frame) && Arrays.equals(focalSets, other.focalSets) && Arrays.equals(masses, other.masses);
	}

	@Override
	public int hashCode() {
		return 31 * (31 * frame.hashCode() + Arrays.hashCode(focalSets)) + Arrays.hashCode(masses);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("{");
		boolean first = true;
		for (Map.Entry<String, Double> e : toTextMap().entrySet()) {
			if (!first)
				sb.append(", ");
			sb.append(e.getKey()).append(": ").append(String.format(Locale.ROOT, "%.4f", e.getValue()));
			first = false;
		}
		return sb.append('}').toString();
	}

	private static void sortByCardinality(long[] masks) {
		// insertion sort, focal lists are short
		for (int i = 1; i < masks.length; i++) {
			long key = masks[i];
			int j = i - 1;
			while (j >= 0 && compareByCardinality(masks[j], key) > 0) {
				masks[j + 1] = masks[j];
				j--;
			}
			masks[j + 1] = key;
		}
	}

	private static int compareByCardinality(long a, long b) {
		int c = Integer.compare(Long.bitCount(a), Long.bitCount(b));
		return c != 0 ? c : Long.compare(a, b);
	}

	public static final class Builder {

		private final Frame frame;
		private final boolean frameDeclared;
		private final Long2DoubleOpenHashMap byMask = new Long2DoubleOpenHashMap();
		private final List<List<String>> pendingLabels = new ArrayList<List<String>>();
		private final DoubleArrayList pendingMasses = new DoubleArrayList();

		private Builder(Frame frame, boolean frameDeclared) {
			this.frame = frame;
			this.frameDeclared = frameDeclared;
		}

		/**
		 * Adds mass to a subset given by labels. Equivalent subsets are merged by summation, zero masses are dropped.
		 */
		public Builder assign(Collection<String> labels, double mass) {
			if (check(mass, labels)) {
				pendingLabels.add(new ArrayList<String>(labels));
				pendingMasses.add(mass);
			}
			return this;
		}

		/**
		 * Adds mass to a subset given in interchange form, e.g. <code>"{a,b}"</code>.
		 */
		public Builder assign(String subsetText, double mass) {
			return assign(Frame.parseLabels(subsetText), mass);
		}

		public Builder assign(long subset, double mass) {
			if (frame == null)
				throw new IllegalStateException("Subset masks need a frame; use builder(Frame)");
			frame.checkSubset(subset);
			if (check(mass, subset))
				byMask.addTo(subset, mass);
			return this;
		}

		public Builder assignAll(Long2DoubleMap masses) {
			for (Long2DoubleMap.Entry e : masses.long2DoubleEntrySet())
				assign(e.getLongKey(), e.getDoubleValue());
			return this;
		}

		/**
		 * Validates the masses and normalizes them when they do not already sum to 1.
		 *
		 * @throws TotalConflictException if normalization is needed and only the empty set holds mass
		 */
		public MassFunction build() {
			MassFunction raw = buildRaw();
			if (raw.size() == 0)
				throw new MassValidationException("A mass function needs at least one positive mass");
			if (Math.abs(raw.totalMass() - 1.0) < TOLERANCE)
				return raw;
			return raw.normalize();
		}

		/**
		 * Validates the masses without rescaling them.
		 */
		public MassFunction buildRaw() {
			Frame target = frame;
			if (target == null) {
				List<String> all = new ArrayList<String>();
				for (List<String> labels : pendingLabels)
					all.addAll(labels);
				target = Frame.of(all);
			}
			Long2DoubleOpenHashMap accumulated = new Long2DoubleOpenHashMap(byMask);
			for (int i = 0; i < pendingLabels.size(); i++)
				accumulated.addTo(target.maskOf(pendingLabels.get(i)), pendingMasses.getDouble(i));
			return new MassFunction(target, frameDeclared, accumulated);
		}

		private static boolean check(double mass, Object subset) {
			if (Double.isNaN(mass) || Double.isInfinite(mass))
				throw new MassValidationException("Mass for " + subset + " must be finite, got " + mass);
			if (mass < 0)
				throw new MassValidationException("Mass for " + subset + " must not be negative, got " + mass);
			return mass > 0;
		}
	}
}
