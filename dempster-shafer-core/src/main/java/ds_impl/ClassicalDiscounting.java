package ds_impl;

import ds_helper.InvalidReliabilityException;
import ds_helper.MassFunction;
import ds_helper.MassValidationException;
import it.unimi.dsi.fastutil.longs.Long2DoubleOpenHashMap;

/**
 * Shafer's discounting: m'(A) = a * m(A) for A other than the frame, m'(frame) = a * m(frame) + (1 - a).
 */
public class ClassicalDiscounting {

	/**
	 * @param reliability a in [0,1]; 1 keeps m, 0 gives the vacuous mass function
	 */
	public static MassFunction discount(MassFunction m, double reliability) {
		checkRate("Reliability factor", reliability);
		if (m.frame().isEmpty())
			throw new MassValidationException("Cannot discount a mass function over an empty frame");
		if (reliability == 1.0)
			return m;
		if (reliability == 0.0)
			return MassFunction.vacuous(m.frame(), m.hasDeclaredFrame());

		long omega = m.frame().fullMask();
		Long2DoubleOpenHashMap discounted = new Long2DoubleOpenHashMap(m.size() + 1);
		for (int i = 0; i < m.size(); i++)
			discounted.addTo(m.focalSet(i), reliability * m.massAt(i));
		discounted.addTo(omega, 1.0 - reliability);
		return MassFunction.builder(m.frame(), m.hasDeclaredFrame()).assignAll(discounted).buildRaw();
	}

	static void checkRate(String what, double rate) {
		if (!(rate >= 0.0 && rate <= 1.0))
			throw new InvalidReliabilityException(what, rate);
	}
}
