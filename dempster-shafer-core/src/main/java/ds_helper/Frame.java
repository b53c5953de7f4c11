package ds_helper;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.TreeSet;

import it.unimi.dsi.fastutil.longs.LongIterable;
import it.unimi.dsi.fastutil.longs.LongIterator;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Frame of discernment: an immutable, deduplicated set of hypothesis labels.
 * <br/>
 * Labels are kept in natural string order. The position of a label in that order is the
 * bit it occupies in a subset mask, so every subset of the frame is a <code>long</code>.
 */
public final class Frame implements Serializable, Iterable<String> {

	private static final long serialVersionUID = 1L;

	public static final int MAX_ELEMENTS = 63;
	// Decomposition and generalization matrices are dense over the powerset.
	public static final int MAX_POWERSET_ELEMENTS = 24;

	private static final Frame EMPTY = new Frame(new String[0]);

	private final String[] elements;
	private final Object2IntOpenHashMap<String> positions;

	private Frame(String[] sortedElements) {
		if (sortedElements.length > MAX_ELEMENTS)
			throw new IllegalArgumentException("A frame holds at most " + MAX_ELEMENTS + " elements, got " + sortedElements.length);
		this.elements = sortedElements;
		this.positions = new Object2IntOpenHashMap<String>(sortedElements.length);
		this.positions.defaultReturnValue(-1);
		for (int i = 0; i < sortedElements.length; i++)
			this.positions.put(sortedElements[i], i);
	}

	public static Frame of(Collection<String> labels) {
		if (labels == null || labels.isEmpty())
			return EMPTY;
		TreeSet<String> sorted = new TreeSet<String>();
		for (String label : labels) {
			if (label == null)
				throw new MassValidationException("Frame labels must not be null");
			if (label.indexOf(',') >= 0 || label.indexOf('{') >= 0 || label.indexOf('}') >= 0)
				throw new MassValidationException("Frame label '" + label + "' must not contain ',', '{' or '}'");
			sorted.add(label);
		}
		return new Frame(sorted.toArray(new String[sorted.size()]));
	}

	public static Frame of(String... labels) {
		return of(Arrays.asList(labels));
	}

	public static Frame empty() {
		return EMPTY;
	}

	public int size() {
		return elements.length;
	}

	public boolean isEmpty() {
		return elements.length == 0;
	}

	public boolean contains(String label) {
		return positions.containsKey(label);
	}

	/**
	 * @return bit position of the label, or -1 if it is not part of the frame
	 */
	public int indexOf(String label) {
		return positions.getInt(label);
	}

	public String element(int index) {
		return elements[index];
	}

	public List<String> elements() {
		return Collections.unmodifiableList(Arrays.asList(elements));
	}

	@Override
	public Iterator<String> iterator() {
		return elements().iterator();
	}

	/**
	 * @return the mask of the whole frame (total ignorance)
	 */
	public long fullMask() {
		return (1L << elements.length) - 1;
	}

	public boolean isSubset(long mask) {
		return (mask & ~fullMask()) == 0;
	}

	public long maskOf(Collection<String> labels) {
		long mask = 0L;
		for (String label : labels) {
			int position = positions.getInt(label);
			if (position < 0)
				throw new MassValidationException("Element '" + label + "' is not in the frame " + this);
			mask |= 1L << position;
		}
		return mask;
	}

	public long maskOf(String... labels) {
		return maskOf(Arrays.asList(labels));
	}

	public List<String> labelsOf(long mask) {
		checkSubset(mask);
		List<String> labels = new ArrayList<String>(Long.bitCount(mask));
		for (int i = 0; i < elements.length; i++) {
			if ((mask & (1L << i)) != 0)
				labels.add(elements[i]);
		}
		return labels;
	}

	public void checkSubset(long mask) {
		if (!isSubset(mask))
			throw new MassValidationException("Subset mask " + Long.toBinaryString(mask) + " exceeds the frame " + this);
	}

	/**
	 * Interchange form of a subset: sorted labels between braces, <code>"{}"</code> for the empty set.
	 */
	public String format(long mask) {
		return formatLabels(labelsOf(mask));
	}

	public long parse(String text) {
		return maskOf(parseLabels(text));
	}

	public static String formatLabels(Collection<String> labels) {
		StringBuilder sb = new StringBuilder("{");
		boolean first = true;
		for (String label : new TreeSet<String>(labels)) {
			if (!first)
				sb.append(',');
			sb.append(label);
			first = false;
		}
		return sb.append('}').toString();
	}

	public static List<String> parseLabels(String text) {
		if (text == null)
			throw new MassValidationException("Subset text must not be null");
		String trimmed = text.trim();
		if (trimmed.length() < 2 || trimmed.charAt(0) != '{' || trimmed.charAt(trimmed.length() - 1) != '}')
			throw new MassValidationException("Malformed subset '" + text + "', expected {A,B,...}");
		String body = trimmed.substring(1, trimmed.length() - 1).trim();
		List<String> labels = new ArrayList<String>();
		if (body.isEmpty())
			return labels;
		for (String label : body.split(",")) {
			String l = label.trim();
			if (l.isEmpty())
				throw new MassValidationException("Malformed subset '" + text + "', empty label");
			labels.add(l);
		}
		return labels;
	}

	public Frame union(Frame other) {
		if (this.equals(other))
			return this;
		List<String> labels = new ArrayList<String>(elements.length + other.elements.length);
		labels.addAll(Arrays.asList(elements));
		labels.addAll(Arrays.asList(other.elements));
		return of(labels);
	}

	/**
	 * Every subset of the frame, from the empty set to the frame itself, in mask order.
	 * Each call to <code>iterator()</code> starts a fresh enumeration.
	 */
	public LongIterable powerset() {
		final long last = fullMask();
		return new LongIterable() {
			@Override
			public LongIterator iterator() {
				return new LongIterator() {
					private long next = 0L;
					private boolean done = false;

					@Override
					public boolean hasNext() {
						return !done;
					}

					@Override
					public long nextLong() {
						if (done)
							throw new NoSuchElementException();
						long current = next;
						if (current == last)
							done = true;
						else
							next++;
						return current;
					}
				};
			}
		};
	}

	public void requireEnumerable() {
		if (elements.length > MAX_POWERSET_ELEMENTS)
			throw new IllegalArgumentException("Powerset enumeration is limited to frames of " + MAX_POWERSET_ELEMENTS
					+ " elements, got " + elements.length);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof Frame))
			return false;
		return Arrays.equals(elements, ((Frame) o).elements);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(elements);
	}

	@Override
	public String toString() {
		return formatLabels(Arrays.asList(elements));
	}
}
