package org.qargs.validate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.qargs.ArgumentDefinition;
import org.qargs.ArgumentSet;
import org.qargs.split.Name;

import com.google.common.collect.LinkedHashMultiset;
import com.google.common.collect.Multiset;

/** Ensures no two arguments share a name, reporting every collision with its count */
public class UniqueNamesValidator implements ArgumentSetValidator {
	@Override
	public ValidationProblem validate(ArgumentSet arguments, Collection<String> backingKeys) {
		Multiset<String> names = LinkedHashMultiset.create();
		for (ArgumentDefinition arg : arguments) {
			// A name repeated within one argument is not a collision
			Set<String> argNames = new LinkedHashSet<>();
			for (Name name : arg.getNames())
				argNames.add(name.getSynopsis());
			names.addAll(argNames);
		}
		List<String> duplicates = new ArrayList<>();
		StringBuilder descrip = new StringBuilder();
		for (Multiset.Entry<String> entry : names.entrySet()) {
			if (entry.getCount() < 2)
				continue;
			duplicates.add(entry.getElement());
			if (descrip.length() > 0)
				descrip.append('\n');
			descrip.append("Multiple (").append(entry.getCount()).append(") options or flags are named \"").append(entry.getElement())
				.append("\".");
		}
		if (duplicates.isEmpty())
			return null;
		return new ValidationProblem(ValidationProblem.Kind.DUPLICATE_NAME, duplicates, descrip.toString());
	}
}
