package ds_impl;

import java.io.Serializable;

import ds_helper.MassFunction;

/**
 * A binary rule of combination. Implementations never modify their operands.
 */
public interface CombinationRule extends Serializable {

	MassFunction combine(MassFunction m1, MassFunction m2);
}
