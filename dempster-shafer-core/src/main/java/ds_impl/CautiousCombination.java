package ds_impl;

import org.apache.log4j.Logger;

import ds_helper.FrameAlignment;
import ds_helper.MassFunction;
import ds_helper.WeightFunction;

/**
 * Cautious and bold rules for sources that may share evidence. Both are idempotent:
 * combining a mass function with itself returns it unchanged.
 * <br/>
 * The operands are decomposed over their common frame, the weights are combined subset by subset
 * (minimum for the cautious rule, maximum for the bold rule) and the result is rebuilt and normalized.
 * Decomposition enumerates the powerset, so frames are limited to {@link ds_helper.Frame#MAX_POWERSET_ELEMENTS}.
 */
public class CautiousCombination {

	private static final Logger LOG = Logger.getLogger(CautiousCombination.class);

	public static MassFunction combineCautious(MassFunction m1, MassFunction m2) {
		FrameAlignment aligned = FrameAlignment.of(m1, m2);
		WeightFunction w1 = CanonicalDecomposition.weightFunction(aligned.operand(0));
		WeightFunction w2 = CanonicalDecomposition.weightFunction(aligned.operand(1));
		WeightFunction combined = w1.min(w2);
		if (LOG.isDebugEnabled())
			LOG.debug("Cautious weights: " + combined);
		return CanonicalDecomposition.reconstruct(combined);
	}

	public static MassFunction combineBold(MassFunction m1, MassFunction m2) {
		FrameAlignment aligned = FrameAlignment.of(m1, m2);
		WeightFunction w1 = CanonicalDecomposition.weightFunction(aligned.operand(0));
		WeightFunction w2 = CanonicalDecomposition.weightFunction(aligned.operand(1));
		WeightFunction combined = w1.max(w2);
		if (LOG.isDebugEnabled())
			LOG.debug("Bold weights: " + combined);
		return CanonicalDecomposition.reconstruct(combined);
	}
}
