package dsbatch_helper;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.gson.Gson;

import ds_helper.Frame;
import ds_helper.MassFunction;

/**
 * Result of fusing the sources of one DASS document, written as one JSON line.
 */
public class CombinationOutcome implements Serializable {

	private static final long serialVersionUID = 1L;
	private static final Gson GSON = new Gson();

	public enum Status {
		OK, TOTAL_CONFLICT, FAILED
	}

	private String path;
	private String rule;
	private Status status;
	private String message;
	private int sourceCount;
	private List<String> frame;
	private Map<String, Double> bba;
	private Map<String, Double> belief;
	private Map<String, Double> plausibility;
	private double conflict;

	public static CombinationOutcome ok(String path, String rule, int sourceCount, MassFunction fused) {
		CombinationOutcome o = new CombinationOutcome(path, rule, Status.OK);
		o.sourceCount = sourceCount;
		Frame frame = fused.frame();
		o.frame = frame.elements();
		o.bba = fused.toTextMap();
		o.belief = new LinkedHashMap<String, Double>();
		o.plausibility = new LinkedHashMap<String, Double>();
		for (int i = 0; i < frame.size(); i++) {
			long singleton = 1L << i;
			o.belief.put(frame.element(i), fused.belief(singleton));
			o.plausibility.put(frame.element(i), fused.plausibility(singleton));
		}
		o.conflict = fused.conflictMass();
		return o;
	}

	public static CombinationOutcome totalConflict(String path, String rule, int sourceCount, double conflict) {
		CombinationOutcome o = new CombinationOutcome(path, rule, Status.TOTAL_CONFLICT);
		o.sourceCount = sourceCount;
		o.conflict = conflict;
		o.message = "Sources are in total conflict";
		return o;
	}

	public static CombinationOutcome failed(String path, String rule, String message) {
		CombinationOutcome o = new CombinationOutcome(path, rule, Status.FAILED);
		o.message = message;
		return o;
	}

	private CombinationOutcome(String path, String rule, Status status) {
		this.path = path;
		this.rule = rule;
		this.status = status;
	}

	public String getPath() {
		return path;
	}

	public String getRule() {
		return rule;
	}

	public Status getStatus() {
		return status;
	}

	public String getMessage() {
		return message;
	}

	public int getSourceCount() {
		return sourceCount;
	}

	public List<String> getFrame() {
		return frame;
	}

	public Map<String, Double> getBba() {
		return bba;
	}

	public Map<String, Double> getBelief() {
		return belief;
	}

	public Map<String, Double> getPlausibility() {
		return plausibility;
	}

	public double getConflict() {
		return conflict;
	}

	public String toJson() {
		return GSON.toJson(this);
	}

	@Override
	public String toString() {
		return path + " [" + rule + "] " + status + (message == null ? "" : ": " + message);
	}
}
