package ds_helper;

import java.io.Serializable;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Weights of the canonical conjunctive decomposition of a non-dogmatic mass function.
 * <br/>
 * One weight per subset of the frame, indexed by mask. The frame itself has weight 1:
 * a weight of 1 stands for "no simple support function on this subset".
 */
public final class WeightFunction implements Serializable {

	private static final long serialVersionUID = 1L;

	private final Frame frame;
	private final boolean frameDeclared;
	private final double[] weights;

	public WeightFunction(Frame frame, boolean frameDeclared, double[] weights) {
		frame.requireEnumerable();
		if (weights.length != 1 << frame.size())
			throw new IllegalArgumentException("Expected " + (1 << frame.size()) + " weights, got " + weights.length);
		this.frame = frame;
		this.frameDeclared = frameDeclared;
		this.weights = weights.clone();
		this.weights[(int) frame.fullMask()] = 1.0;
		for (int a = 0; a < this.weights.length; a++) {
			double w = this.weights[a];
			if (!(w > 0) || Double.isInfinite(w))
				throw new MassValidationException("Weight of " + frame.format(a) + " must be positive and finite, got " + w);
		}
	}

	public Frame frame() {
		return frame;
	}

	public boolean hasDeclaredFrame() {
		return frameDeclared;
	}

	public double weight(long subset) {
		frame.checkSubset(subset);
		return weights[(int) subset];
	}

	public double weight(Collection<String> labels) {
		return weight(frame.maskOf(labels));
	}

	public double weight(String subsetText) {
		return weight(frame.parse(subsetText));
	}

	/**
	 * @return a copy of the weights indexed by subset mask
	 */
	public double[] toArray() {
		return weights.clone();
	}

	/**
	 * Pointwise minimum, the combination used by the cautious rule.
	 */
	public WeightFunction min(WeightFunction other) {
		checkFrame(other);
		double[] combined = new double[weights.length];
		for (int a = 0; a < combined.length; a++)
			combined[a] = Math.min(weights[a], other.weights[a]);
		return new WeightFunction(frame, frameDeclared || other.frameDeclared, combined);
	}

	/**
	 * Pointwise maximum, the combination used by the bold rule.
	 */
	public WeightFunction max(WeightFunction other) {
		checkFrame(other);
		double[] combined = new double[weights.length];
		for (int a = 0; a < combined.length; a++)
			combined[a] = Math.max(weights[a], other.weights[a]);
		return new WeightFunction(frame, frameDeclared || other.frameDeclared, combined);
	}

	/**
	 * Subsets whose weight differs from 1, in interchange form.
	 */
	public Map<String, Double> toTextMap() {
		Map<String, Double> map = new LinkedHashMap<String, Double>();
		for (int a = 0; a < weights.length; a++) {
			if (Math.abs(weights[a] - 1.0) > MassFunction.TOLERANCE)
				map.put(frame.format(a), weights[a]);
		}
		return map;
	}

	private void checkFrame(WeightFunction other) {
		if (!frame.equals(other.frame))
			throw new FrameMismatchException(frame, other.frame);
	}

	@Override
	public String toString() {
		return "WeightFunction" + toTextMap();
	}
}
