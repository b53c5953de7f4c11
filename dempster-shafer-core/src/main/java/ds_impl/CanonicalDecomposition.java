package ds_impl;

import org.apache.log4j.Logger;

import ds_helper.DogmaticMassException;
import ds_helper.Frame;
import ds_helper.MassFunction;
import ds_helper.MassValidationException;
import ds_helper.WeightFunction;

/*
 * Canonical conjunctive decomposition (Denoeux 2008).
 *
 * A non-dogmatic mass function m is the unnormalized conjunctive combination
 * of simple support functions A^w(A), one per subset A of the frame other
 * than the frame itself, where A^w puts 1 - w on A and w on the frame.
 *
 *   ln w(A) = - sum over B containing A of (-1)^(|B|-|A|) ln q(B)
 *   ln q(B) = sum over A not containing B of ln w(A)
 *
 * Both directions are Moebius transforms over the whole powerset and run in
 * O(n 2^n) with the usual bit-by-bit superset sums. The two formulas are
 * exact inverses, so min and max of a weight function with itself give back
 * the original mass function.
 */
public class CanonicalDecomposition {

	private static final Logger LOG = Logger.getLogger(CanonicalDecomposition.class);

	/** Reconstructed masses below minus this value are reported as invalid rather than noise. */
	public static final double NEGATIVE_TOLERANCE = 1e-9;

	/**
	 * @throws DogmaticMassException if m has conflict mass or no mass on the frame
	 */
	public static WeightFunction weightFunction(MassFunction m) {
		Frame frame = m.frame();
		if (frame.isEmpty())
			throw new MassValidationException("Cannot decompose a mass function over an empty frame");
		frame.requireEnumerable();
		if (m.conflictMass() > 0)
			throw new DogmaticMassException("Cannot decompose a mass function with conflict mass " + m.conflictMass());

		int n = frame.size();
		int omega = (int) frame.fullMask();
		double[] q = commonalities(m);
		if (!(q[omega] > 0))
			throw new DogmaticMassException("Cannot decompose a mass function without mass on the frame " + frame);

		double[] f = new double[q.length];
		for (int a = 0; a < q.length; a++)
			f[a] = Math.log(q[a]);
		moebiusOverSupersets(f, n);

		double[] w = new double[q.length];
		for (int a = 0; a < q.length; a++)
			w[a] = a == omega ? 1.0 : Math.exp(-f[a]);
		return new WeightFunction(frame, m.hasDeclaredFrame(), w);
	}

	/**
	 * Conjunctive combination of the simple support functions given by the weights, normalized.
	 * <br/>
	 * Weights above 1 (from the bold rule or from non-separable inputs) can yield negative masses.
	 * Those are clamped to zero before normalization.
	 *
	 * @throws ds_helper.TotalConflictException if the reconstruction puts all mass on the empty set
	 */
	public static MassFunction reconstruct(WeightFunction weights) {
		Frame frame = weights.frame();
		int n = frame.size();
		int omega = (int) frame.fullMask();
		double[] w = weights.toArray();

		double[] t = new double[w.length];
		double s = 0.0;
		for (int a = 0; a < w.length; a++) {
			t[a] = a == omega ? 0.0 : Math.log(w[a]);
			s += t[a];
		}
		zetaOverSupersets(t, n);

		double[] mass = new double[w.length];
		for (int b = 0; b < w.length; b++)
			mass[b] = Math.exp(s - t[b]);
		moebiusOverSupersets(mass, n);

		MassFunction.Builder builder = MassFunction.builder(frame, weights.hasDeclaredFrame());
		int clamped = 0;
		double negative = 0.0;
		for (int a = 0; a < mass.length; a++) {
			double v = mass[a];
			if (v < -NEGATIVE_TOLERANCE)
				negative += v;
			if (v < MassFunction.EPSILON) {
				if (v != 0.0)
					clamped++;
				continue;
			}
			builder.assign(a, v);
		}
		if (negative < 0.0)
			LOG.warn("Weights do not describe a mass function, clamped " + negative + " of negative mass over " + frame);
		else if (clamped > 0 && LOG.isDebugEnabled())
			LOG.debug("Reconstruction clamped " + clamped + " near-zero masses");
		return builder.buildRaw().normalize();
	}

	/**
	 * q(A) for every subset A of the frame, indexed by mask.
	 */
	public static double[] commonalities(MassFunction m) {
		Frame frame = m.frame();
		frame.requireEnumerable();
		double[] q = new double[1 << frame.size()];
		for (int i = 0; i < m.size(); i++)
			q[(int) m.focalSet(i)] += m.massAt(i);
		zetaOverSupersets(q, frame.size());
		return q;
	}

	// values[a] becomes the sum of values[b] over supersets b of a
	static void zetaOverSupersets(double[] values, int n) {
		for (int bit = 0; bit < n; bit++) {
			int mask = 1 << bit;
			for (int a = 0; a < values.length; a++) {
				if ((a & mask) == 0)
					values[a] += values[a | mask];
			}
		}
	}

	// inverse of zetaOverSupersets: alternating sum over supersets
	static void moebiusOverSupersets(double[] values, int n) {
		for (int bit = 0; bit < n; bit++) {
			int mask = 1 << bit;
			for (int a = 0; a < values.length; a++) {
				if ((a & mask) == 0)
					values[a] -= values[a | mask];
			}
		}
	}
}
