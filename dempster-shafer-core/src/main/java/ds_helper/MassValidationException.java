package ds_helper;

/**
 * Malformed masses (negative, NaN, infinite), unknown labels or unreadable interchange documents.
 */
public class MassValidationException extends EvidenceException {

	private static final long serialVersionUID = 1L;

	public MassValidationException(String message) {
		super(message);
	}

	public MassValidationException(String message, Throwable cause) {
		super(message, cause);
	}
}
