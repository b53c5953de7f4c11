package ds_helper;

/**
 * A partition handed to theta-contextual discounting does not split the frame into disjoint blocks.
 */
public class InvalidPartitionException extends EvidenceException {

	private static final long serialVersionUID = 1L;

	public InvalidPartitionException(String message) {
		super(message);
	}
}
