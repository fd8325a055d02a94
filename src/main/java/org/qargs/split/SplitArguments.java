package org.qargs.split;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

import org.qargs.StringUtils;

import com.google.common.collect.ImmutableList;

/**
 * The classified elements of a command line, ordered by {@link TokenIndex}. Elements are removed as they are consumed by a parser.
 * Indexes are stable: removing an element never changes the index of another.
 */
public class SplitArguments {
	/** The classification of an element */
	public enum ElementType {
		/** A plain value */
		VALUE,
		/** An option, possibly with a value attached via <code>=</code> */
		OPTION,
		/** The <code>--</code> terminator, after which everything is a value */
		TERMINATOR,
		/** A dash followed by a number, which may be either a negative number or an option such as <code>-1</code> */
		POSSIBLE_NEGATIVE;
	}

	/** A single element of the stream */
	public static final class Element {
		private final TokenIndex theIndex;
		private final ElementType theType;
		private final String theText;
		private final ParsedOption theOption;

		Element(TokenIndex index, ElementType type, String text, ParsedOption option) {
			theIndex = index;
			theType = type;
			theText = text;
			theOption = option;
		}

		/** @return The index of this element */
		public TokenIndex getIndex() {
			return theIndex;
		}

		/** @return This element's classification */
		public ElementType getType() {
			return theType;
		}

		/** @return Whether this is a plain value */
		public boolean isValue() {
			return theType == ElementType.VALUE;
		}

		/** @return Whether this is an option */
		public boolean isOption() {
			return theType == ElementType.OPTION;
		}

		/** @return Whether this is the <code>--</code> terminator */
		public boolean isTerminator() {
			return theType == ElementType.TERMINATOR;
		}

		/** @return Whether this is a dash followed by a number */
		public boolean isPossibleNegative() {
			return theType == ElementType.POSSIBLE_NEGATIVE;
		}

		/** @return Whether this element may be consumed as a value (a plain value or a possible negative number) */
		public boolean isValueLike() {
			return theType == ElementType.VALUE || theType == ElementType.POSSIBLE_NEGATIVE;
		}

		/** @return The text of a value or possible negative number, or null for other elements */
		public String getText() {
			return theText;
		}

		/** @return The option interpretation of an option or possible negative number, or null for other elements */
		public ParsedOption getOption() {
			return theOption;
		}

		@Override
		public String toString() {
			switch (theType) {
			case VALUE:
				return theIndex + ":" + theText;
			case TERMINATOR:
				return theIndex + ":--";
			case POSSIBLE_NEGATIVE:
				return theIndex + ":" + theText + "(?)";
			default:
				return theIndex + ":" + theOption;
			}
		}
	}

	/** A value taken from the stream, along with where it came from */
	public static final class IndexedValue {
		private final TokenIndex theIndex;
		private final String theValue;

		IndexedValue(TokenIndex index, String value) {
			theIndex = index;
			theValue = value;
		}

		/** @return The index of the element the value came from */
		public TokenIndex getIndex() {
			return theIndex;
		}

		/** @return The value text */
		public String getValue() {
			return theValue;
		}

		@Override
		public String toString() {
			return theIndex + ":" + theValue;
		}
	}

	private final List<String> theOriginalInput;
	private final TreeMap<TokenIndex, Element> theElements;

	SplitArguments(List<String> originalInput, Collection<Element> elements) {
		theOriginalInput = ImmutableList.copyOf(originalInput);
		theElements = new TreeMap<>();
		for (Element element : elements)
			theElements.put(element.getIndex(), element);
	}

	private SplitArguments(SplitArguments toCopy) {
		theOriginalInput = toCopy.theOriginalInput;
		theElements = new TreeMap<>(toCopy.theElements);
	}

	/** @return An independent copy of this stream in its current state */
	public SplitArguments copy() {
		return new SplitArguments(this);
	}

	/** @return The raw command line this stream was split from */
	public List<String> getOriginalInput() {
		return theOriginalInput;
	}

	/**
	 * @param index The index of an element
	 * @return The raw input string the element came from
	 */
	public String getOriginalInput(TokenIndex index) {
		return theOriginalInput.get(index.getInputIndex());
	}

	/** @return The remaining elements, in order */
	public Collection<Element> getElements() {
		return Collections.unmodifiableCollection(theElements.values());
	}

	/** @return The number of remaining elements */
	public int size() {
		return theElements.size();
	}

	/** @return Whether all elements have been consumed */
	public boolean isEmpty() {
		return theElements.isEmpty();
	}

	/** @return Whether any element other than a terminator remains */
	public boolean containsNonTerminatorArguments() {
		for (Element element : theElements.values()) {
			if (!element.isTerminator())
				return true;
		}
		return false;
	}

	/**
	 * @param index The index to look up
	 * @return The element at the given index, or null if it has been removed
	 */
	public Element get(TokenIndex index) {
		return theElements.get(index);
	}

	/**
	 * @param index The index to check
	 * @return Whether an element remains at the given index
	 */
	public boolean contains(TokenIndex index) {
		return theElements.containsKey(index);
	}

	/**
	 * @param inputIndex The index of the raw input string
	 * @return The sub-elements remaining for the short-option cluster at the given input index
	 */
	public List<Element> getSubElements(int inputIndex) {
		return new ArrayList<>(theElements.subMap(TokenIndex.sub(inputIndex, 0), true, TokenIndex.complete(inputIndex + 1), false).values());
	}

	/** @return The first remaining element, or null if the stream is empty */
	public Element peekNext() {
		Map.Entry<TokenIndex, Element> first = theElements.firstEntry();
		return first == null ? null : first.getValue();
	}

	/** @return The first remaining element, removed from the stream, or null if the stream is empty */
	public Element popNext() {
		Map.Entry<TokenIndex, Element> first = theElements.pollFirstEntry();
		return first == null ? null : first.getValue();
	}

	/**
	 * Removes and returns the first remaining element if it is value-like. The whole input string is consumed.
	 *
	 * @return The value, or null if the stream is empty or the next element is not a value
	 */
	public IndexedValue popNextElementIfValue() {
		Element next = peekNext();
		if (next == null || !next.isValueLike())
			return null;
		remove(next.getIndex().toComplete());
		return new IndexedValue(next.getIndex(), next.getText());
	}

	/**
	 * Removes and returns the complete element immediately following the given index if it is value-like
	 *
	 * @param after The index to look after
	 * @return The value, or null if the next complete element does not exist or is not a value
	 */
	public IndexedValue popNextElementIfValue(TokenIndex after) {
		Element next = nextComplete(after);
		if (next == null || !next.isValueLike())
			return null;
		remove(next.getIndex());
		return new IndexedValue(next.getIndex(), next.getText());
	}

	/**
	 * Removes and returns the first value-like complete element after the given index, skipping any options in between
	 *
	 * @param after The index to look after
	 * @return The value, or null if there is no remaining value after the index
	 */
	public IndexedValue popNextValue(TokenIndex after) {
		for (Element element : theElements.tailMap(after, false).values()) {
			if (element.getIndex().isComplete() && element.isValueLike()) {
				remove(element.getIndex());
				return new IndexedValue(element.getIndex(), element.getText());
			}
		}
		return null;
	}

	/**
	 * Removes and returns the next complete element after the given index as a value, whatever its classification
	 *
	 * @param after The index to look after
	 * @return The raw input string of the next element, or null if there is none
	 */
	public IndexedValue popNextElementAsValue(TokenIndex after) {
		Element next = nextComplete(after);
		if (next == null)
			return null;
		remove(next.getIndex());
		return new IndexedValue(next.getIndex(), getOriginalInput(next.getIndex()));
	}

	/**
	 * For the first character of a short-option cluster such as <code>-Ddebug</code>, removes the whole cluster and returns the text
	 * following the first character
	 *
	 * @param at The index of the first sub-element of a cluster
	 * @return The joined value, or null if the index is not the first sub-element of a cluster or nothing follows it
	 */
	public IndexedValue extractJoinedElement(TokenIndex at) {
		if (at.getSubIndex() != 0)
			return null;
		String original = getOriginalInput(at);
		if (original.length() <= 2 || !original.startsWith("-"))
			return null;
		TokenIndex complete = at.toComplete();
		remove(complete);
		return new IndexedValue(complete, original.substring(2));
	}

	/**
	 * Removes the element at the given index. Removing a complete index also removes all its sub-elements, but removing a sub-element
	 * leaves its siblings and the complete element in place.
	 *
	 * @param index The index to remove
	 */
	public void remove(TokenIndex index) {
		if (index.isComplete())
			theElements.subMap(index, true, TokenIndex.complete(index.getInputIndex() + 1), false).clear();
		else
			theElements.remove(index);
	}

	/**
	 * Commits a short-option cluster to its option reading: removes the sub-element and the complete element, leaving the sibling
	 * sub-elements in place
	 *
	 * @param sub The index of the consumed sub-element
	 */
	public void removeClusterMember(TokenIndex sub) {
		theElements.remove(sub);
		theElements.remove(sub.toComplete());
	}

	/**
	 * Removes all elements of an origin. Complete indexes are removed with their sub-elements, and consumed sub-elements are removed
	 * with their complete element.
	 *
	 * @param origin The origin to remove
	 */
	public void removeAll(InputOrigin origin) {
		removeAll(origin.getIndexes());
	}

	/**
	 * @param indexes The indexes to remove
	 * @see #removeAll(InputOrigin)
	 */
	public void removeAll(Collection<TokenIndex> indexes) {
		for (TokenIndex index : indexes) {
			if (index.isComplete())
				remove(index);
			else
				removeClusterMember(index);
		}
	}

	/**
	 * @return The remaining values, one per input string. The complete element stands for its input string; sub-elements left over
	 *         after their complete element was consumed are coalesced into one dash-prefixed string.
	 */
	public List<IndexedValue> coalescedExtraElements() {
		List<IndexedValue> result = new ArrayList<>();
		Iterator<Element> iter = theElements.values().iterator();
		Element element = iter.hasNext() ? iter.next() : null;
		while (element != null) {
			int input = element.getIndex().getInputIndex();
			if (element.getIndex().isComplete()) {
				result.add(new IndexedValue(element.getIndex(), getOriginalInput(element.getIndex())));
				element = skipInput(iter, input);
			} else {
				StringBuilder str = new StringBuilder("-");
				TokenIndex first = element.getIndex();
				while (element != null && element.getIndex().getInputIndex() == input) {
					str.append(element.getOption().getName().getValue());
					element = iter.hasNext() ? iter.next() : null;
				}
				result.add(new IndexedValue(first, str.toString()));
			}
		}
		return result;
	}

	private static Element skipInput(Iterator<Element> iter, int input) {
		while (iter.hasNext()) {
			Element next = iter.next();
			if (next.getIndex().getInputIndex() != input)
				return next;
		}
		return null;
	}

	private Element nextComplete(TokenIndex after) {
		NavigableMap<TokenIndex, Element> tail = theElements.tailMap(after, false);
		for (Element element : tail.values()) {
			if (element.getIndex().isComplete())
				return element;
		}
		return null;
	}

	@Override
	public String toString() {
		return StringUtils.print(" ", theElements.values(), Element::toString).toString();
	}
}
