package org.qargs.validate;

import java.util.List;

import com.google.common.collect.ImmutableList;

/** A configuration error found in an argument set by an {@link ArgumentSetValidator} */
public final class ValidationProblem {
	/** The kinds of problem */
	public enum Kind {
		/** Several arguments share a name */
		DUPLICATE_NAME,
		/** A positional is declared after a repeating positional */
		MISPLACED_REPEATING_POSITIONAL,
		/** Arguments are not covered by the command's backing keys */
		MISSING_BACKING_KEY,
		/** Boolean flags default to true with no way to turn them off */
		NONSENSICAL_DEFAULT_FLAG;
	}

	private final Kind theKind;
	private final List<String> theSubjects;
	private final String theDescription;

	/**
	 * @param kind The kind of problem
	 * @param subjects The names or keys of the arguments involved
	 * @param description The description of the problem
	 */
	public ValidationProblem(Kind kind, List<String> subjects, String description) {
		theKind = kind;
		theSubjects = ImmutableList.copyOf(subjects);
		theDescription = description;
	}

	/** @return The kind of problem */
	public Kind getKind() {
		return theKind;
	}

	/** @return The names or keys of the arguments involved */
	public List<String> getSubjects() {
		return theSubjects;
	}

	/** @return The description of the problem */
	public String getDescription() {
		return theDescription;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof ValidationProblem && theKind == ((ValidationProblem) obj).theKind
			&& theDescription.equals(((ValidationProblem) obj).theDescription);
	}

	@Override
	public int hashCode() {
		return theKind.hashCode() * 31 + theDescription.hashCode();
	}

	@Override
	public String toString() {
		return theDescription;
	}
}
