package ds_helper;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Operands of a rule brought onto one common frame.
 * <br/>
 * If several operands declare a frame, those frames must be equal. If only some do, the result
 * inherits the declared frame. If none does, the common frame is the union of the inferred ones.
 */
public final class FrameAlignment {

	private final Frame frame;
	private final boolean declared;
	private final List<MassFunction> operands;

	private FrameAlignment(Frame frame, boolean declared, List<MassFunction> operands) {
		this.frame = frame;
		this.declared = declared;
		this.operands = operands;
	}

	public static FrameAlignment of(MassFunction... sources) {
		return of(Arrays.asList(sources));
	}

	public static FrameAlignment of(List<MassFunction> sources) {
		if (sources.isEmpty())
			throw new IllegalArgumentException("No mass functions provided");
		Frame declaredFrame = null;
		for (MassFunction m : sources) {
			if (!m.hasDeclaredFrame())
				continue;
			if (declaredFrame == null)
				declaredFrame = m.frame();
			else if (!declaredFrame.equals(m.frame()))
				throw new FrameMismatchException(declaredFrame, m.frame());
		}

		Frame common = declaredFrame;
		if (common == null) {
			common = sources.get(0).frame();
			for (MassFunction m : sources)
				common = common.union(m.frame());
		}

		List<MassFunction> aligned = new ArrayList<MassFunction>(sources.size());
		for (MassFunction m : sources) {
			if (declaredFrame != null && !m.hasDeclaredFrame() && !containsAll(declaredFrame, m.frame()))
				throw new FrameMismatchException(declaredFrame, m.frame());
			aligned.add(m.reindex(common, declaredFrame != null));
		}
		return new FrameAlignment(common, declaredFrame != null, Collections.unmodifiableList(aligned));
	}

	private static boolean containsAll(Frame outer, Frame inner) {
		for (String label : inner) {
			if (!outer.contains(label))
				return false;
		}
		return true;
	}

	public Frame frame() {
		return frame;
	}

	public boolean isDeclared() {
		return declared;
	}

	public MassFunction operand(int index) {
		return operands.get(index);
	}

	public List<MassFunction> operands() {
		return operands;
	}

	/**
	 * @return a builder for the result of the rule, over the common frame
	 */
	public MassFunction.Builder resultBuilder() {
		return MassFunction.builder(frame, declared);
	}
}
