package org.qargs.validate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.qargs.ArgumentDefinition;
import org.qargs.ArgumentDefinition.FlagAction;
import org.qargs.ArgumentDefinition.Kind;
import org.qargs.ArgumentSet;
import org.qargs.StringUtils;

/** Finds boolean flags that default to true and have no inversion, so the user can never turn them off */
public class NonsenseFlagsValidator implements ArgumentSetValidator {
	@Override
	public ValidationProblem validate(ArgumentSet arguments, Collection<String> backingKeys) {
		List<String> flags = new ArrayList<>();
		for (ArgumentDefinition arg : arguments) {
			if (arg.getKind() == Kind.FLAG && arg.getFlagAction() == FlagAction.SET && !arg.isGrouped()
				&& Boolean.TRUE.equals(arg.getDefaultValue()))
				flags.add(arg.getSynopsis());
		}
		if (flags.isEmpty())
			return null;
		return new ValidationProblem(ValidationProblem.Kind.NONSENSICAL_DEFAULT_FLAG, flags,
			"Boolean flags declared with a default of true are always true, whether or not the user gives them."
				+ " Use a default of false or make them invertible. Affected flags: " + StringUtils.print(", ", flags, f -> f));
	}
}
