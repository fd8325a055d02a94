package org.qargs.validate;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;
import org.qargs.ArgumentSet;
import org.qargs.ArgumentSet.FlagInversion;
import org.qargs.ArgumentValueParser;
import org.qargs.split.Name;

/** Tests the static checks of {@link ArgumentSetValidation} */
public class ArgumentSetValidationTest {
	/** Tests that a consistent argument set passes */
	@Test
	public void testValid() {
		ArgumentSet args = ArgumentSet.build()//
			.addStringOption("name", a -> a.withShortName())//
			.addInvertibleFlag("color", FlagInversion.PREFIXED_NO, a -> a.defaultValue(true))//
			.addStringPositional("input", null)//
			.addArrayPositional("rest", ArgumentValueParser.STRING, null)//
			.build();
		Assert.assertEquals(Collections.emptyList(), ArgumentSetValidation.validate(args, null));
		Assert.assertEquals(Collections.emptyList(), ArgumentSetValidation.validate(args, Arrays.asList("name", "color", "input", "rest")));
	}

	/** Tests that every name collision is reported with its count */
	@Test
	public void testDuplicateNames() {
		ArgumentSet args = ArgumentSet.build()//
			.addStringOption("name", a -> a.withShortName())//
			.addFlag("new", a -> a.withShortName())//
			.addFlag("other", a -> a.named(Name.ofLong("name")))//
			.build();
		ValidationProblem problem = new UniqueNamesValidator().validate(args, null);
		Assert.assertEquals(ValidationProblem.Kind.DUPLICATE_NAME, problem.getKind());
		Assert.assertEquals(Arrays.asList("--name", "-n"), problem.getSubjects());
		Assert.assertEquals("Multiple (2) options or flags are named \"--name\".\nMultiple (2) options or flags are named \"-n\".",
			problem.getDescription());
	}

	/** Tests that a name listed twice by the same argument is not a collision */
	@Test
	public void testRepeatedNameInOneArgument() {
		ArgumentSet args = ArgumentSet.build()//
			.addFlag("debug", a -> a.named(Name.ofLong("debug"), Name.ofLong("debug")))//
			.build();
		Assert.assertNull(new UniqueNamesValidator().validate(args, null));

		args = ArgumentSet.build()//
			.addFlag("debug", a -> a.named(Name.ofLong("debug"), Name.ofLong("debug")))//
			.addFlag("trace", a -> a.named(Name.ofLong("debug")))//
			.build();
		Assert.assertEquals("Multiple (2) options or flags are named \"--debug\".",
			new UniqueNamesValidator().validate(args, null).getDescription());
	}

	/** Tests that a repeating positional must be the last positional */
	@Test
	public void testPositionalOrder() {
		ArgumentSet args = ArgumentSet.build()//
			.addArrayPositional("files", ArgumentValueParser.STRING, null)//
			.addStringOption("name", null)//
			.addStringPositional("out", null)//
			.build();
		ValidationProblem problem = new PositionalArgumentsValidator().validate(args, null);
		Assert.assertEquals(Arrays.asList("files", "out"), problem.getSubjects());
		Assert.assertEquals("Can't have a positional argument 'out' following an array of positional arguments 'files'.",
			problem.getDescription());

		args = ArgumentSet.build()//
			.addArrayPositional("a", ArgumentValueParser.STRING, null)//
			.addArrayPositional("b", ArgumentValueParser.STRING, null)//
			.build();
		Assert.assertEquals(Arrays.asList("a", "b"), new PositionalArgumentsValidator().validate(args, null).getSubjects());
	}

	/** Tests that all arguments must be covered by a command's backing keys */
	@Test
	public void testBackingKeys() {
		ArgumentSet args = ArgumentSet.build()//
			.addStringOption("name", null)//
			.addFlag("verbose", null)//
			.addInvertibleFlag("color", FlagInversion.PREFIXED_NO, null)//
			.build();
		BackingKeyValidator validator = new BackingKeyValidator();
		Assert.assertNull(validator.validate(args, null));
		ValidationProblem problem = validator.validate(args, Arrays.asList("name"));
		Assert.assertEquals(Arrays.asList("verbose", "color"), problem.getSubjects());
		Assert.assertEquals("Arguments 'verbose', 'color' are not covered by the command's backing keys.", problem.getDescription());
	}

	/** Tests that boolean flags defaulting to true without an inversion are reported together */
	@Test
	public void testNonsenseFlags() {
		ArgumentSet args = ArgumentSet.build()//
			.addFlag("verbose", a -> a.defaultValue(true))//
			.addFlag("quiet", a -> a.defaultValue(true))//
			.addFlag("fine", null)//
			.addInvertibleFlag("color", FlagInversion.PREFIXED_NO, a -> a.defaultValue(true))//
			.build();
		ValidationProblem problem = new NonsenseFlagsValidator().validate(args, null);
		Assert.assertEquals(Arrays.asList("--verbose", "--quiet"), problem.getSubjects());
	}

	/** Tests that included groups are checked and problems are not repeated */
	@Test
	public void testGroupsAndAggregation() {
		ArgumentSet group = ArgumentSet.build().addFlag("always", a -> a.defaultValue(true)).build();
		ArgumentSet args = ArgumentSet.build()//
			.include(group)//
			.addFlag("always", null)//
			.build();
		List<ValidationProblem> problems = ArgumentSetValidation.validate(args, null);
		Assert.assertEquals(2, problems.size());
		Assert.assertEquals(ValidationProblem.Kind.DUPLICATE_NAME, problems.get(0).getKind());
		Assert.assertEquals(ValidationProblem.Kind.NONSENSICAL_DEFAULT_FLAG, problems.get(1).getKind());

		try {
			ArgumentSetValidation.validateOrThrow("tool", args, null);
			Assert.fail("Problems not thrown");
		} catch (ArgumentDefinitionException e) {
			Assert.assertEquals(problems, e.getProblems());
			Assert.assertTrue(e.getMessage(), e.getMessage().startsWith("Validation failed for 'tool':\n- Multiple (2)"));
		}
	}
}
