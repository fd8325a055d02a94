package org.qargs.validate;

import java.util.Collection;

import org.qargs.ArgumentSet;

/** Checks an argument set for configuration errors, independent of any command line */
public interface ArgumentSetValidator {
	/**
	 * @param arguments The arguments to check
	 * @param backingKeys The keys the command decodes its values from, or null if the command binds every key
	 * @return The problem found, or null if the arguments pass this check
	 */
	ValidationProblem validate(ArgumentSet arguments, Collection<String> backingKeys);
}
