package ds_helper;

/**
 * Normalization was requested but every unit of mass sits on the empty set.
 * The sources are fully contradictory; this is an evidential outcome, not an arithmetic failure.
 */
public class TotalConflictException extends EvidenceException {

	private static final long serialVersionUID = 1L;

	private final double conflict;

	public TotalConflictException(double conflict) {
		super("Total conflict: all mass (" + conflict + ") is assigned to the empty set");
		this.conflict = conflict;
	}

	public double getConflict() {
		return conflict;
	}
}
