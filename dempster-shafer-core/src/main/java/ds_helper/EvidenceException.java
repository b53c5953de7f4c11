package ds_helper;

/**
 * Base class of every caller-visible failure raised by the evidence engine.
 */
public class EvidenceException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public EvidenceException(String message) {
		super(message);
	}

	public EvidenceException(String message, Throwable cause) {
		super(message, cause);
	}
}
