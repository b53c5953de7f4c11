package ds_helper;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One fusion problem in DASS form: a frame of discernment and the ordered list of sources to combine.
 */
public class DassDocument implements Serializable {

	private static final long serialVersionUID = 1L;

	private final Map<String, Object> metadata;
	private final Frame frame;
	private final List<String> sourceIds;
	private final List<MassFunction> sources;

	public DassDocument(Map<String, Object> metadata, Frame frame, List<String> sourceIds, List<MassFunction> sources) {
		if (sourceIds.size() != sources.size())
			throw new IllegalArgumentException("Got " + sourceIds.size() + " source ids for " + sources.size() + " sources");
		this.metadata = Collections.unmodifiableMap(new LinkedHashMap<String, Object>(metadata));
		this.frame = frame;
		this.sourceIds = Collections.unmodifiableList(new ArrayList<String>(sourceIds));
		this.sources = Collections.unmodifiableList(new ArrayList<MassFunction>(sources));
	}

	public Map<String, Object> getMetadata() {
		return metadata;
	}

	public Frame getFrame() {
		return frame;
	}

	public List<String> getSourceIds() {
		return sourceIds;
	}

	public List<MassFunction> getSources() {
		return sources;
	}

	public int getSourceCount() {
		return sources.size();
	}
}
