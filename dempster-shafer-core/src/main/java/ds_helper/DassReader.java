package ds_helper;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.apache.log4j.Logger;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

/**
 * Reads DASS documents:
 * <pre>
 * {"metadata": {...},
 *  "frame_of_discernment": ["A", "B", "C"],
 *  "bba_sources": [{"id": "source_1", "bba": {"{A}": 0.4, "{A,B}": 0.6}}, ...]}
 * </pre>
 * Every problem found in a document is reported in one {@link MassValidationException}.
 */
public class DassReader {

	private static final Logger LOG = Logger.getLogger(DassReader.class);

	private static final Pattern SUBSET = Pattern.compile("^\\{[A-Za-z0-9_,]*\\}$");
	/** Tolerance of a source's total mass before it is normalized. */
	public static final double SUM_TOLERANCE = 0.001;

	public static DassDocument read(String json) {
		try {
			return fromJson(new JSONParser().parse(json));
		} catch (ParseException e) {
			throw new MassValidationException("Invalid JSON: " + e, e);
		}
	}

	public static DassDocument read(Reader reader) throws IOException {
		try {
			return fromJson(new JSONParser().parse(reader));
		} catch (ParseException e) {
			throw new MassValidationException("Invalid JSON: " + e, e);
		}
	}

	/**
	 * Reads one mass function as written by {@link DassWriter#toJson(MassFunction)}.
	 */
	public static MassFunction readMassFunction(String json) {
		Object parsed;
		try {
			parsed = new JSONParser().parse(json);
		} catch (ParseException e) {
			throw new MassValidationException("Invalid JSON: " + e, e);
		}
		if (!(parsed instanceof JSONObject))
			throw new MassValidationException("A mass function must be a JSON object");
		JSONObject obj = (JSONObject) parsed;
		List<String> errors = new ArrayList<String>();
		Frame frame = readFrame(obj.get("frame"), "frame", errors);
		failOn(errors);
		return readBba(obj.get("bba"), frame, "mass function", errors);
	}

	private static DassDocument fromJson(Object parsed) {
		if (!(parsed instanceof JSONObject))
			throw new MassValidationException("A DASS document must be a JSON object");
		JSONObject root = (JSONObject) parsed;
		List<String> errors = new ArrayList<String>();
		for (String field : new String[] { "frame_of_discernment", "bba_sources" }) {
			if (!root.containsKey(field))
				errors.add("Missing required field: " + field);
		}
		failOn(errors);

		Frame frame = readFrame(root.get("frame_of_discernment"), "frame_of_discernment", errors);
		Object sourcesValue = root.get("bba_sources");
		if (!(sourcesValue instanceof JSONArray))
			errors.add("bba_sources must be a list");
		else if (((JSONArray) sourcesValue).isEmpty())
			errors.add("bba_sources must not be empty");
		failOn(errors);

		List<String> ids = new ArrayList<String>();
		List<MassFunction> sources = new ArrayList<MassFunction>();
		JSONArray sourceList = (JSONArray) sourcesValue;
		for (int i = 0; i < sourceList.size(); i++) {
			Object source = sourceList.get(i);
			if (!(source instanceof JSONObject)) {
				errors.add("Source " + i + ": must be an object");
				continue;
			}
			JSONObject s = (JSONObject) source;
			Object id = s.get("id");
			String sourceId = id == null ? "source_" + (i + 1) : id.toString();
			if (!s.containsKey("bba")) {
				errors.add("Source " + i + ": missing field 'bba'");
				continue;
			}
			try {
				sources.add(readBba(s.get("bba"), frame, "Source " + i, new ArrayList<String>()));
				ids.add(sourceId);
			} catch (MassValidationException e) {
				errors.add(e.getMessage());
			}
		}
		failOn(errors);

		Map<String, Object> metadata = new LinkedHashMap<String, Object>();
		Object meta = root.get("metadata");
		if (meta instanceof JSONObject) {
			for (Object key : ((JSONObject) meta).keySet())
				metadata.put(key.toString(), ((JSONObject) meta).get(key));
		}
		if (LOG.isDebugEnabled())
			LOG.debug("Read DASS document: frame " + frame + ", " + sources.size() + " sources");
		return new DassDocument(metadata, frame, ids, sources);
	}

	private static Frame readFrame(Object value, String field, List<String> errors) {
		if (!(value instanceof JSONArray)) {
			errors.add(field + " must be a list");
			return null;
		}
		JSONArray array = (JSONArray) value;
		if (array.isEmpty()) {
			errors.add(field + " must not be empty");
			return null;
		}
		List<String> labels = new ArrayList<String>();
		Set<String> seen = new HashSet<String>();
		for (Object label : array) {
			if (!(label instanceof String)) {
				errors.add(field + " must only contain strings, got " + label);
				continue;
			}
			if (!seen.add((String) label))
				errors.add(field + " contains duplicates: " + label);
			labels.add((String) label);
		}
		if (labels.size() > Frame.MAX_ELEMENTS)
			errors.add(field + " holds at most " + Frame.MAX_ELEMENTS + " elements, got " + labels.size());
		return errors.isEmpty() ? Frame.of(labels) : null;
	}

	private static MassFunction readBba(Object value, Frame frame, String where, List<String> errors) {
		if (!(value instanceof JSONObject))
			throw new MassValidationException(where + ": bba must be an object");
		JSONObject bba = (JSONObject) value;
		MassFunction.Builder builder = MassFunction.builder(frame);
		double total = 0.0;
		for (Object entry : bba.entrySet()) {
			Map.Entry<?, ?> e = (Map.Entry<?, ?>) entry;
			String subset = e.getKey().toString();
			if (!(e.getValue() instanceof Number)) {
				errors.add(where + ": mass for '" + subset + "' must be a number");
				continue;
			}
			double mass = ((Number) e.getValue()).doubleValue();
			if (!(mass >= 0.0 && mass <= 1.0))
				errors.add(where + ": mass for '" + subset + "' must be between 0 and 1, got " + mass);
			if (!SUBSET.matcher(subset).matches()) {
				errors.add(where + ": malformed subset '" + subset + "'");
				continue;
			}
			for (String label : Frame.parseLabels(subset)) {
				if (!frame.contains(label))
					errors.add(where + ": element '" + label + "' of '" + subset + "' is not in the frame");
			}
			total += mass;
			if (errors.isEmpty())
				builder.assign(subset, mass);
		}
		if (errors.isEmpty() && Math.abs(total - 1.0) > SUM_TOLERANCE)
			errors.add(String.format(Locale.ROOT, "%s: masses sum to %.4f, expected 1.0 +/- %s", where, total, SUM_TOLERANCE));
		failOn(errors);
		return builder.build();
	}

	private static void failOn(List<String> errors) {
		if (!errors.isEmpty())
			throw new MassValidationException(String.join("; ", errors));
	}
}
