package ds_helper;

import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * Writes DASS documents and single mass functions with subsets in <code>"{a,b}"</code> form.
 */
public class DassWriter {

	private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

	public static String toJson(DassDocument document) {
		JsonObject root = new JsonObject();
		root.add("metadata", GSON.toJsonTree(document.getMetadata()));
		root.add("frame_of_discernment", labels(document.getFrame()));
		JsonArray sources = new JsonArray();
		for (int i = 0; i < document.getSourceCount(); i++) {
			JsonObject source = new JsonObject();
			source.addProperty("id", document.getSourceIds().get(i));
			source.add("bba", bba(document.getSources().get(i)));
			sources.add(source);
		}
		root.add("bba_sources", sources);
		return GSON.toJson(root);
	}

	public static String toJson(MassFunction m) {
		return GSON.toJson(toJsonTree(m));
	}

	public static JsonObject toJsonTree(MassFunction m) {
		JsonObject obj = new JsonObject();
		obj.add("frame", labels(m.frame()));
		obj.add("bba", bba(m));
		return obj;
	}

	static JsonArray labels(Frame frame) {
		JsonArray array = new JsonArray();
		for (String label : frame)
			array.add(label);
		return array;
	}

	static JsonObject bba(MassFunction m) {
		JsonObject bba = new JsonObject();
		for (Map.Entry<String, Double> e : m.toTextMap().entrySet())
			bba.addProperty(e.getKey(), e.getValue());
		return bba;
	}
}
