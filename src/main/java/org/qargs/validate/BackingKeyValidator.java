package org.qargs.validate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.qargs.ArgumentDefinition;
import org.qargs.ArgumentSet;
import org.qargs.StringUtils;

/** For a command that decodes from a custom set of keys, ensures every argument's key is among them */
public class BackingKeyValidator implements ArgumentSetValidator {
	@Override
	public ValidationProblem validate(ArgumentSet arguments, Collection<String> backingKeys) {
		if (backingKeys == null)
			return null;
		List<String> missing = new ArrayList<>();
		for (ArgumentDefinition arg : arguments) {
			if (!backingKeys.contains(arg.getKey()) && !missing.contains(arg.getKey()))
				missing.add(arg.getKey());
		}
		if (missing.isEmpty())
			return null;
		return new ValidationProblem(ValidationProblem.Kind.MISSING_BACKING_KEY, missing,
			"Arguments " + StringUtils.print(", ", missing, k -> "'" + k + "'") + " are not covered by the command's backing keys.");
	}
}
