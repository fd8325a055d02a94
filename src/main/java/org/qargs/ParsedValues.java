package org.qargs;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

import org.qargs.split.InputOrigin;

/** The values bound for one command's arguments, by key, each with the origin it was bound from */
public class ParsedValues {
	/** A bound value */
	public static final class Element {
		private final String theKey;
		private final Object theValue;
		private final InputOrigin theOrigin;

		Element(String key, Object value, InputOrigin origin) {
			theKey = key;
			theValue = value;
			theOrigin = origin;
		}

		/** @return The key the value is bound under */
		public String getKey() {
			return theKey;
		}

		/** @return The bound value */
		public Object getValue() {
			return theValue;
		}

		/** @return Where the value came from */
		public InputOrigin getOrigin() {
			return theOrigin;
		}

		@Override
		public String toString() {
			return theKey + "=" + theValue + "@" + theOrigin;
		}
	}

	private final Map<String, Element> theElements;
	private final List<String> theOriginalInput;

	/** @param originalInput The command line the values were parsed from */
	public ParsedValues(List<String> originalInput) {
		theElements = new LinkedHashMap<>();
		theOriginalInput = originalInput;
	}

	/** @return The command line the values were parsed from */
	public List<String> getOriginalInput() {
		return theOriginalInput;
	}

	/**
	 * Binds a value. The origin is merged with that of any value already bound under the key.
	 *
	 * @param key The key to bind under
	 * @param value The value to bind
	 * @param origin Where the value came from
	 */
	public void set(String key, Object value, InputOrigin origin) {
		Element previous = theElements.get(key);
		theElements.put(key, new Element(key, value, previous == null ? origin : previous.getOrigin().union(origin)));
	}

	/**
	 * Modifies a bound value
	 *
	 * @param key The key to bind under
	 * @param origin The origin of the modification, merged with the existing origin
	 * @param initial The value to modify if nothing is bound under the key yet
	 * @param update Produces the new value from the current one
	 */
	public void update(String key, InputOrigin origin, Object initial, UnaryOperator<Object> update) {
		Element previous = theElements.get(key);
		if (previous == null)
			theElements.put(key, new Element(key, update.apply(initial), origin));
		else
			theElements.put(key, new Element(key, update.apply(previous.getValue()), previous.getOrigin().union(origin)));
	}

	/**
	 * @param key The key to look up
	 * @return The element bound under the key, or null if there is none
	 */
	public Element getElement(String key) {
		return theElements.get(key);
	}

	/**
	 * @param key The key to check
	 * @return Whether a value is bound under the key
	 */
	public boolean contains(String key) {
		return theElements.containsKey(key);
	}

	/**
	 * @param <T> The expected type of the value
	 * @param key The key to look up
	 * @return The value bound under the key, or null if there is none
	 * @throws ClassCastException If the value is not of the expected type
	 */
	public <T> T get(String key) throws ClassCastException {
		Element element = theElements.get(key);
		return element == null ? null : (T) element.getValue();
	}

	/**
	 * @param <T> The expected type of the values
	 * @param key The key to look up
	 * @return The list bound under the key, or an empty list if there is none
	 */
	public <T> List<T> getAll(String key) {
		Element element = theElements.get(key);
		if (element == null || element.getValue() == null)
			return Collections.emptyList();
		else if (element.getValue() instanceof List)
			return (List<T>) element.getValue();
		return Collections.singletonList((T) element.getValue());
	}

	/**
	 * @param key The key to look up
	 * @return Where the value bound under the key came from, or null if nothing is bound
	 */
	public InputOrigin getOrigin(String key) {
		Element element = theElements.get(key);
		return element == null ? null : element.getOrigin();
	}

	/** @return The keys with bound values, in the order they were first bound */
	public Set<String> keySet() {
		return Collections.unmodifiableSet(theElements.keySet());
	}

	@Override
	public String toString() {
		return theElements.values().toString();
	}
}
