package org.qargs;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;
import org.qargs.ArgumentDefinition.FlagExclusivity;
import org.qargs.ArgumentDefinition.ParsingStrategy;
import org.qargs.ArgumentSet.FlagInversion;
import org.qargs.split.ArgumentTokenizer;
import org.qargs.split.InputOrigin;
import org.qargs.split.Name;
import org.qargs.split.SplitArguments;
import org.qargs.split.TokenIndex;

/** Tests binding of command lines to arguments by {@link ArgumentMatcher} */
public class ArgumentMatcherTest {
	enum Mode {
		STATS, COUNT, LIST
	}

	private static ParsedValues match(ArgumentSet args, String... input) {
		return new ArgumentMatcher(args).match(ArgumentTokenizer.split(input));
	}

	private static ArgumentParseException fail(ArgumentSet args, String... input) {
		try {
			ParsedValues values = match(args, input);
			throw new AssertionError("Expected failure, but got " + values);
		} catch (ArgumentParseException e) {
			return e;
		}
	}

	/** Tests options, flags and positionals together, with defaults */
	@Test
	public void testBasicBinding() {
		ArgumentSet args = ArgumentSet.build()//
			.addStringOption("name", a -> a.withShortName().required())//
			.addIntOption("count", a -> a.defaultValue(1))//
			.addFlag("verbose", a -> a.withShortName())//
			.addStringPositional("file", null)//
			.build();
		ParsedValues values = match(args, "-n", "Bob", "input.txt", "--verbose");
		Assert.assertEquals("Bob", values.get("name"));
		Assert.assertEquals(Integer.valueOf(1), values.get("count"));
		Assert.assertTrue(values.getOrigin("count").isDefault());
		Assert.assertEquals(Boolean.TRUE, values.get("verbose"));
		Assert.assertEquals("input.txt", values.get("file"));
		Assert.assertEquals(InputOrigin.of(TokenIndex.complete(0), TokenIndex.complete(1)), values.getOrigin("name"));

		values = match(args, "--name=Al", "--count", "3", "x");
		Assert.assertEquals("Al", values.get("name"));
		Assert.assertEquals(Integer.valueOf(3), values.get("count"));
		Assert.assertEquals(Boolean.FALSE, values.get("verbose"));
	}

	/** Tests that the matcher removes what it consumed and leaves the rest */
	@Test
	public void testRemainder() {
		ArgumentSet args = ArgumentSet.build().addFlag("verbose", null).build();
		SplitArguments split = ArgumentTokenizer.split("--verbose", "--other", "value");
		new ArgumentMatcher(args).match(split);
		Assert.assertEquals(2, split.size());
		Assert.assertFalse(split.contains(TokenIndex.complete(0)));
		Assert.assertTrue(split.contains(TokenIndex.complete(1)));
	}

	/** Tests that a cluster of short flags binds the same as the flags given separately */
	@Test
	public void testClusterEquivalence() {
		ArgumentSet args = ArgumentSet.build()//
			.addFlag("all", a -> a.withShortName())//
			.addFlag("brief", a -> a.withShortName())//
			.addFlag("color", a -> a.withShortName())//
			.build();
		ParsedValues clustered = match(args, "-abc");
		ParsedValues separate = match(args, "-a", "-b", "-c");
		for (String key : Arrays.asList("all", "brief", "color")) {
			Assert.assertEquals(Boolean.TRUE, clustered.get(key));
			Assert.assertEquals(separate.<Object> get(key), clustered.<Object> get(key));
		}
	}

	/** Tests a valued short option in a cluster taking the next string as its value */
	@Test
	public void testClusterWithValue() {
		ArgumentSet args = ArgumentSet.build()//
			.addFlag("verbose", a -> a.withShortName())//
			.addStringOption("file", a -> a.withShortName())//
			.build();
		ParsedValues values = match(args, "-vf", "out.txt");
		Assert.assertEquals(Boolean.TRUE, values.get("verbose"));
		Assert.assertEquals("out.txt", values.get("file"));
	}

	/** Tests a value joined directly to a short name */
	@Test
	public void testJoinedValue() {
		ArgumentSet args = ArgumentSet.build()//
			.addArrayOption("define", ArgumentValueParser.STRING, a -> a.named(Name.ofShort('D', true)))//
			.build();
		ParsedValues values = match(args, "-Ddebug", "-D", "trace", "-D=info");
		Assert.assertEquals(Arrays.asList("debug", "trace", "info"), values.getAll("define"));
	}

	/** Tests the per-option strategies for finding values */
	@Test
	public void testParsingStrategies() {
		ArgumentSet args = ArgumentSet.build()//
			.addStringOption("scan", a -> a.parsing(ParsingStrategy.SCANNING_FOR_VALUE))//
			.addFlag("flag", null)//
			.build();
		Assert.assertEquals("x", match(args, "--scan", "--flag", "x").get("scan"));

		args = ArgumentSet.build()//
			.addStringOption("name", a -> a.parsing(ParsingStrategy.UNCONDITIONAL))//
			.build();
		Assert.assertEquals("--foo", match(args, "--name", "--foo").get("name"));

		args = ArgumentSet.build()//
			.addArrayOption("single", ArgumentValueParser.INTEGER, null)//
			.addArrayOption("multiple", ArgumentValueParser.INTEGER, a -> a.parsing(ParsingStrategy.UP_TO_NEXT_OPTION))//
			.build();
		ParsedValues values = match(args, "--single", "-1", "--multiple", "-2", "-3");
		Assert.assertEquals(Arrays.asList(-1), values.getAll("single"));
		Assert.assertEquals(Arrays.asList(-2, -3), values.getAll("multiple"));

		args = ArgumentSet.build()//
			.addArrayOption("rest", ArgumentValueParser.STRING, a -> a.parsing(ParsingStrategy.ALL_REMAINING_INPUT))//
			.addFlag("flag", null)//
			.build();
		values = match(args, "--flag", "--rest", "a", "--flag", "-b");
		Assert.assertEquals(Arrays.asList("a", "--flag", "-b"), values.getAll("rest"));
		Assert.assertEquals(Boolean.TRUE, values.get("flag"));
	}

	/** Tests that a next-as-value option without a following value fails */
	@Test
	public void testMissingValue() {
		ArgumentSet args = ArgumentSet.build()//
			.addStringOption("format", a -> a.withShortName())//
			.addFlag("verbose", null)//
			.build();
		ArgumentParseException e = fail(args, "-f", "--verbose");
		Assert.assertEquals(ArgumentParseException.Kind.MISSING_VALUE, e.getKind());
		Assert.assertEquals(Name.ofShort('f'), e.getName());
		e = fail(args, "--format");
		Assert.assertEquals(ArgumentParseException.Kind.MISSING_VALUE, e.getKind());
	}

	/** Tests array options accumulating in order and replacing their defaults */
	@Test
	public void testArrays() {
		ArgumentSet args = ArgumentSet.build()//
			.addArrayOption("tag", ArgumentValueParser.STRING, a -> a.defaultValue(Collections.singletonList("default")))//
			.build();
		Assert.assertEquals(Arrays.asList("default"), match(args).getAll("tag"));
		ParsedValues values = match(args, "--tag", "a", "--tag=b");
		Assert.assertEquals(Arrays.asList("a", "b"), values.getAll("tag"));
		Assert.assertFalse(values.getOrigin("tag").isDefault());
		Assert.assertEquals(3, values.getOrigin("tag").getIndexes().size());
	}

	/** Tests a greedy last positional */
	@Test
	public void testArrayPositional() {
		ArgumentSet args = ArgumentSet.build()//
			.addStringPositional("first", null)//
			.addArrayPositional("rest", ArgumentValueParser.INTEGER, null)//
			.build();
		ParsedValues values = match(args, "-1", "-2", "-3");
		Assert.assertEquals("-1", values.get("first"));
		Assert.assertEquals(Arrays.asList(-2, -3), values.getAll("rest"));
		Assert.assertEquals(Collections.emptyList(), match(args, "a").getAll("rest"));
	}

	/** Tests a positional that captures everything, options included, from the first value on */
	@Test
	public void testCapturingPositional() {
		ArgumentSet args = ArgumentSet.build()//
			.addFlag("verbose", null)//
			.addArrayPositional("command", ArgumentValueParser.STRING, a -> a.parsing(ParsingStrategy.ALL_REMAINING_INPUT))//
			.build();
		ParsedValues values = match(args, "--verbose", "git", "--verbose", "-x");
		Assert.assertEquals(Boolean.TRUE, values.get("verbose"));
		Assert.assertEquals(Arrays.asList("git", "--verbose", "-x"), values.getAll("command"));
	}

	/** Tests that a capturing positional starts with whatever input is left, options included */
	@Test
	public void testCapturingPositionalStartingWithOptions() {
		ArgumentSet args = ArgumentSet.build()//
			.addFlag("verbose", null)//
			.addStringPositional("tool", null)//
			.addArrayPositional("command", ArgumentValueParser.STRING, a -> a.parsing(ParsingStrategy.ALL_REMAINING_INPUT))//
			.build();
		ParsedValues values = match(args, "git", "--verbose", "status");
		Assert.assertEquals("git", values.get("tool"));
		Assert.assertEquals(Boolean.FALSE, values.get("verbose"));
		Assert.assertEquals(Arrays.asList("--verbose", "status"), values.getAll("command"));

		args = ArgumentSet.build()//
			.addArrayPositional("command", ArgumentValueParser.STRING, a -> a.parsing(ParsingStrategy.ALL_REMAINING_INPUT))//
			.build();
		Assert.assertEquals(Arrays.asList("--unknown", "a"), match(args, "--unknown", "a").getAll("command"));
		Assert.assertEquals(Arrays.asList("-xy", "a"), match(args, "-xy", "a").getAll("command"));
		Assert.assertEquals(Arrays.asList("--", "a"), match(args, "--", "a").getAll("command"));

		// A cluster of known flags is still matched before the capture starts
		args = ArgumentSet.build()//
			.addFlag("all", a -> a.withShortName())//
			.addFlag("brief", a -> a.withShortName())//
			.addArrayPositional("command", ArgumentValueParser.STRING, a -> a.parsing(ParsingStrategy.ALL_REMAINING_INPUT))//
			.build();
		values = match(args, "-ab", "-x", "a");
		Assert.assertEquals(Boolean.TRUE, values.get("all"));
		Assert.assertEquals(Boolean.TRUE, values.get("brief"));
		Assert.assertEquals(Arrays.asList("-x", "a"), values.getAll("command"));
	}

	/** Tests negative numbers as positional values */
	@Test
	public void testNegativePositionals() {
		ArgumentSet args = ArgumentSet.build().addIntPositional("number", null).build();
		Assert.assertEquals(Integer.valueOf(-5), match(args, "-5").get("number"));
	}

	/** Tests the order in which a dash followed by digits is tried as flags, then as a number */
	@Test
	public void testNegativeNumbersWithDigitFlags() {
		ArgumentSet args = ArgumentSet.build()//
			.addFlag("four", a -> a.named(Name.ofShort('4')))//
			.addFlag("six", a -> a.named(Name.ofShort('6')))//
			.addFlag("twelve", a -> a.named(Name.ofLongWithSingleDash("12")))//
			.addArrayPositional("values", ArgumentValueParser.INTEGER, null)//
			.build();
		ParsedValues values = match(args, "-35", "-1");
		Assert.assertEquals(Arrays.asList(-35, -1), values.getAll("values"));

		values = match(args, "-45", "-1");
		Assert.assertEquals(Boolean.FALSE, values.get("four"));
		Assert.assertEquals(Arrays.asList(-45, -1), values.getAll("values"));

		values = match(args, "-46", "-1", "-4");
		Assert.assertEquals(Boolean.TRUE, values.get("four"));
		Assert.assertEquals(Boolean.TRUE, values.get("six"));
		Assert.assertEquals(Arrays.asList(-1, -4), values.getAll("values"));

		values = match(args, "-4", "-6", "-46");
		Assert.assertEquals(Arrays.asList(-46), values.getAll("values"));

		values = match(args, "-46", "-1", "-35", "-12", "-34", "-4", "-12");
		Assert.assertEquals(Boolean.TRUE, values.get("twelve"));
		Assert.assertEquals(Arrays.asList(-1, -35, -34, -4, -12), values.getAll("values"));
	}

	/** Tests options named by digits taking negative numbers as values */
	@Test
	public void testNegativeNumbersWithDigitOptions() {
		for (ParsingStrategy strategy : Arrays.asList(ParsingStrategy.NEXT_AS_VALUE, ParsingStrategy.SCANNING_FOR_VALUE,
			ParsingStrategy.UNCONDITIONAL)) {
			ArgumentSet args = ArgumentSet.build()//
				.addIntOption("one", a -> a.named(Name.ofShort('1')).parsing(strategy))//
				.addIntOption("twelve", a -> a.named(Name.ofLongWithSingleDash("12")).parsing(strategy))//
				.addArrayPositional("extra", ArgumentValueParser.INTEGER, null)//
				.build();
			ParsedValues values = match(args, "-1", "-12", "-1", "-3", "-12", "-1");
			Assert.assertEquals(strategy.name(), Integer.valueOf(-12), values.get("one"));
			Assert.assertEquals(strategy.name(), Integer.valueOf(-1), values.get("twelve"));
			Assert.assertEquals(strategy.name(), Arrays.asList(-1, -3), values.getAll("extra"));

			values = match(args, "-1=-12", "-1", "-3", "-12=-1");
			Assert.assertEquals(Integer.valueOf(-12), values.get("one"));
			Assert.assertEquals(Integer.valueOf(-1), values.get("twelve"));
			Assert.assertEquals(Arrays.asList(-1, -3), values.getAll("extra"));
		}
	}

	/** Tests counters */
	@Test
	public void testCounter() {
		ArgumentSet args = ArgumentSet.build().addCounter("verbose", a -> a.withShortName()).build();
		Assert.assertEquals(Integer.valueOf(0), match(args).get("verbose"));
		Assert.assertEquals(Integer.valueOf(3), match(args, "-vvv").get("verbose"));
		Assert.assertEquals(Integer.valueOf(2), match(args, "-v", "--verbose").get("verbose"));
	}

	/** Tests that flags reject attached values */
	@Test
	public void testFlagWithValue() {
		ArgumentSet args = ArgumentSet.build().addFlag("verbose", null).build();
		ArgumentParseException e = fail(args, "--verbose=foo");
		Assert.assertEquals(ArgumentParseException.Kind.UNEXPECTED_VALUE_FOR_OPTION, e.getKind());
		Assert.assertEquals("foo", e.getValue());
		// The same flag twice is fine
		Assert.assertEquals(Boolean.TRUE, match(args, "--verbose", "--verbose").get("verbose"));
	}

	/** Tests invertible flags and their exclusivity */
	@Test
	public void testInvertibleFlags() {
		ArgumentSet args = ArgumentSet.build()//
			.addInvertibleFlag("bool", FlagInversion.PREFIXED_NO, null)//
			.addInvertibleFlag("color", FlagInversion.PREFIXED_ENABLE_DISABLE, a -> a.defaultValue(true))//
			.addInvertibleFlag("last", FlagInversion.PREFIXED_NO, a -> a.exclusivity(FlagExclusivity.CHOOSE_LAST))//
			.build();
		ParsedValues values = match(args);
		Assert.assertEquals(Boolean.FALSE, values.get("bool"));
		Assert.assertEquals(Boolean.TRUE, values.get("color"));

		values = match(args, "--bool", "--disable-color", "--last", "--no-last");
		Assert.assertEquals(Boolean.TRUE, values.get("bool"));
		Assert.assertEquals(Boolean.FALSE, values.get("color"));
		Assert.assertEquals(Boolean.FALSE, values.get("last"));

		ArgumentParseException e = fail(args, "--no-bool", "--bool");
		Assert.assertEquals(ArgumentParseException.Kind.DUPLICATE_EXCLUSIVE_VALUES, e.getKind());
		Assert.assertEquals(TokenIndex.complete(1), e.getOrigin().getFirst());
		Assert.assertEquals(TokenIndex.complete(0), e.getPreviousOrigin().getFirst());
	}

	/** Tests enumerable flag groups */
	@Test
	public void testEnumerableFlags() {
		ArgumentSet args = ArgumentSet.build()//
			.addEnumFlag("mode", Mode.class, g -> g.withShortNames())//
			.addEnumerableFlag("first", g -> g.value("north", null).value("south", null)//
				.exclusivity(FlagExclusivity.CHOOSE_FIRST).defaultValue("south"))//
			.build();
		Assert.assertEquals(ArgumentParseException.Kind.MISSING_ARGUMENT, fail(args).getKind());
		ParsedValues values = match(args, "-c");
		Assert.assertEquals(Mode.COUNT, values.get("mode"));
		Assert.assertEquals("south", values.get("first"));
		Assert.assertEquals("north", match(args, "-s", "--north", "--south").get("first"));

		ArgumentParseException e = fail(args, "-cl");
		Assert.assertEquals(ArgumentParseException.Kind.DUPLICATE_EXCLUSIVE_VALUES, e.getKind());
		Assert.assertEquals(TokenIndex.sub(0, 1), e.getOrigin().getFirst());
		Assert.assertEquals(TokenIndex.sub(0, 0), e.getPreviousOrigin().getFirst());
	}

	/** Tests value parsers and allowed values */
	@Test
	public void testInvalidValues() {
		ArgumentSet args = ArgumentSet.build()//
			.addIntOption("count", null)//
			.addStringOption("format", a -> a.allowedValues("text", "json"))//
			.addOption("mode", null, a -> a.withEnumValues(Mode.class))//
			.build();
		ArgumentParseException e = fail(args, "--count", "many");
		Assert.assertEquals(ArgumentParseException.Kind.INVALID_VALUE, e.getKind());
		Assert.assertEquals("many", e.getValue());
		Assert.assertTrue(e.getCause() instanceof NumberFormatException);

		Assert.assertEquals(ArgumentParseException.Kind.INVALID_VALUE, fail(args, "--format", "png").getKind());
		Assert.assertEquals("json", match(args, "--format", "json").get("format"));
		Assert.assertEquals(Mode.STATS, match(args, "--mode", "stats").get("mode"));
		Assert.assertEquals(ArgumentParseException.Kind.INVALID_VALUE, fail(args, "--mode", "STATS").getKind());
	}

	/** Tests required arguments */
	@Test
	public void testRequired() {
		ArgumentSet args = ArgumentSet.build()//
			.addStringOption("name", a -> a.required())//
			.addStringPositional("file", null)//
			.build();
		ArgumentParseException e = fail(args, "x");
		Assert.assertEquals(ArgumentParseException.Kind.MISSING_ARGUMENT, e.getKind());
		Assert.assertEquals("name", e.getKey());
		e = fail(args, "--name", "x");
		Assert.assertEquals("file", e.getKey());
	}

	/** Tests that matching the same input twice gives the same result */
	@Test
	public void testDeterminism() {
		ArgumentSet args = ArgumentSet.build()//
			.addFlag("four", a -> a.named(Name.ofShort('4')))//
			.addArrayPositional("values", ArgumentValueParser.INTEGER, null)//
			.build();
		List<String> input = Arrays.asList("-4", "-44", "-4");
		ParsedValues first = new ArgumentMatcher(args).match(ArgumentTokenizer.split(input));
		ParsedValues second = new ArgumentMatcher(args).match(ArgumentTokenizer.split(input));
		Assert.assertEquals(first.getAll("values"), second.getAll("values"));
		Assert.assertEquals(Arrays.asList(-44, -4), first.getAll("values"));
		Assert.assertEquals(first.getOrigin("four"), second.getOrigin("four"));
	}
}
