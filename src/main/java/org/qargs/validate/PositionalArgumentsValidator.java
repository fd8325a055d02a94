package org.qargs.validate;

import java.util.Arrays;
import java.util.Collection;

import org.qargs.ArgumentDefinition;
import org.qargs.ArgumentSet;

/** Ensures a repeating positional argument, if any, is the last positional */
public class PositionalArgumentsValidator implements ArgumentSetValidator {
	@Override
	public ValidationProblem validate(ArgumentSet arguments, Collection<String> backingKeys) {
		ArgumentDefinition repeated = null;
		for (ArgumentDefinition arg : arguments.getPositionals()) {
			if (repeated != null)
				return new ValidationProblem(ValidationProblem.Kind.MISPLACED_REPEATING_POSITIONAL,
					Arrays.asList(repeated.getKey(), arg.getKey()), "Can't have a positional argument '" + arg.getKey()
						+ "' following an array of positional arguments '" + repeated.getKey() + "'.");
			else if (arg.isRepeating())
				repeated = arg;
		}
		return null;
	}
}
