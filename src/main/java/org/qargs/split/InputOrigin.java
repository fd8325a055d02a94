package org.qargs.split;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Where a bound value came from: either the argument's declared default, or a set of elements of the input
 */
public final class InputOrigin implements Iterable<TokenIndex> {
	/** The origin of a value that came from a declared default */
	public static final InputOrigin DEFAULT = new InputOrigin(true, Collections.emptySortedSet());

	private final boolean isDefault;
	private final SortedSet<TokenIndex> theIndexes;

	private InputOrigin(boolean isDefault, SortedSet<TokenIndex> indexes) {
		this.isDefault = isDefault;
		theIndexes = indexes;
	}

	/**
	 * @param indexes The indexes of the input elements
	 * @return An origin for the given input elements
	 */
	public static InputOrigin of(TokenIndex... indexes) {
		TreeSet<TokenIndex> set = new TreeSet<>();
		Collections.addAll(set, indexes);
		return new InputOrigin(false, Collections.unmodifiableSortedSet(set));
	}

	/**
	 * @param indexes The indexes of the input elements
	 * @return An origin for the given input elements
	 */
	public static InputOrigin of(Collection<TokenIndex> indexes) {
		return new InputOrigin(false, Collections.unmodifiableSortedSet(new TreeSet<>(indexes)));
	}

	/** @return Whether this origin represents a declared default */
	public boolean isDefault() {
		return isDefault;
	}

	/** @return The input elements this origin refers to, in input order */
	public SortedSet<TokenIndex> getIndexes() {
		return theIndexes;
	}

	/** @return Whether this origin refers to no input elements */
	public boolean isEmpty() {
		return theIndexes.isEmpty();
	}

	/** @return The first input element this origin refers to, or null if there is none */
	public TokenIndex getFirst() {
		return theIndexes.isEmpty() ? null : theIndexes.first();
	}

	/**
	 * @param index The index to add
	 * @return An origin with the given element added to this one's
	 */
	public InputOrigin with(TokenIndex index) {
		TreeSet<TokenIndex> set = new TreeSet<>(theIndexes);
		set.add(index);
		return new InputOrigin(false, Collections.unmodifiableSortedSet(set));
	}

	/**
	 * A default origin merged with an input origin yields the input origin
	 *
	 * @param other The origin to merge with this one
	 * @return The union of the two origins
	 */
	public InputOrigin union(InputOrigin other) {
		if (other.isDefault)
			return isDefault ? this : (theIndexes.isEmpty() ? other : this);
		else if (isDefault)
			return other;
		TreeSet<TokenIndex> set = new TreeSet<>(theIndexes);
		set.addAll(other.theIndexes);
		return new InputOrigin(false, Collections.unmodifiableSortedSet(set));
	}

	@Override
	public Iterator<TokenIndex> iterator() {
		return theIndexes.iterator();
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof InputOrigin))
			return false;
		return isDefault == ((InputOrigin) obj).isDefault && theIndexes.equals(((InputOrigin) obj).theIndexes);
	}

	@Override
	public int hashCode() {
		return isDefault ? -1 : theIndexes.hashCode();
	}

	@Override
	public String toString() {
		return isDefault ? "default" : theIndexes.toString();
	}
}
