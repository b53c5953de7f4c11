package ds_helper;

/**
 * Thrown when two operands both declare a frame of discernment and the frames differ.
 */
public class FrameMismatchException extends EvidenceException {

	private static final long serialVersionUID = 1L;

	private final Frame left;
	private final Frame right;

	public FrameMismatchException(Frame left, Frame right) {
		super("Frames of discernment must be compatible: " + left + " vs " + right);
		this.left = left;
		this.right = right;
	}

	public Frame getLeft() {
		return left;
	}

	public Frame getRight() {
		return right;
	}
}
