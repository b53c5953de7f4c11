package ds_helper;

/**
 * The canonical decomposition is undefined for the given mass function:
 * it either carries conflict mass or its commonality vanishes on the frame.
 */
public class DogmaticMassException extends EvidenceException {

	private static final long serialVersionUID = 1L;

	public DogmaticMassException(String message) {
		super(message);
	}
}
