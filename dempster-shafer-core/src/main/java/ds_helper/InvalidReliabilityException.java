package ds_helper;

public class InvalidReliabilityException extends EvidenceException {

	private static final long serialVersionUID = 1L;

	private final double rate;

	public InvalidReliabilityException(String what, double rate) {
		super(what + " must be between 0 and 1, got " + rate);
		this.rate = rate;
	}

	public double getRate() {
		return rate;
	}
}
