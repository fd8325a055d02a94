package org.qargs;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.log4j.Logger;
import org.qargs.split.ArgumentTokenizer;
import org.qargs.split.Name;
import org.qargs.split.SplitArguments;
import org.qargs.split.SplitArguments.Element;
import org.qargs.split.SplitArguments.IndexedValue;
import org.qargs.validate.ArgumentDefinitionException;

import com.google.common.collect.ImmutableList;

/**
 * Parses command lines against a command hierarchy. Each command level binds what it recognizes in the remaining input, then the next
 * value naming a subcommand (or the default subcommand) selects the next level. Whatever is left at the deepest level is an error.
 */
public class CommandParser {
	private static final Logger log = Logger.getLogger(CommandParser.class);

	/** The name of the pseudo-subcommand printing help for the commands named after it */
	public static final String HELP_SUBCOMMAND = "help";

	private final CommandTree theTree;
	private final List<Name> theHelpNames;
	private final List<Name> theHiddenHelpNames;
	private final List<Name> theVersionNames;
	private final Name theCompletionName;
	private final int theSimilarityFloor;
	private final boolean isHelpSubcommandEnabled;

	private CommandParser(Builder builder) throws ArgumentDefinitionException {
		theTree = CommandTree.of(builder.theRoot);
		theHelpNames = ImmutableList.copyOf(builder.theHelpNames);
		theHiddenHelpNames = ImmutableList.copyOf(builder.theHiddenHelpNames);
		theVersionNames = ImmutableList.copyOf(builder.theVersionNames);
		theCompletionName = builder.theCompletionName;
		theSimilarityFloor = builder.theSimilarityFloor;
		isHelpSubcommandEnabled = builder.isHelpSubcommandEnabled;
	}

	/**
	 * @param root The root command
	 * @return A builder for a parser of the command
	 */
	public static Builder build(CommandDefinition root) {
		return new Builder(root);
	}

	/** @return The command tree this parser parses against */
	public CommandTree getTree() {
		return theTree;
	}

	/**
	 * @param args The command line
	 * @return The result of the parse
	 */
	public ParseResult parse(String... args) {
		return parse(Arrays.asList(args));
	}

	/**
	 * @param args The command line
	 * @return The result of the parse
	 */
	public ParseResult parse(List<String> args) {
		SplitArguments input = ArgumentTokenizer.split(args);
		List<CommandTree.Node> stack = new ArrayList<>();
		List<ParsedValues> values = new ArrayList<>();
		CommandTree.Node current = theTree.getRoot();
		try {
			checkForCompletion(input, current);
			while (true) {
				stack.add(current);
				ParsedValues parsed;
				CommandTree.Node level = current;
				try {
					parsed = level.getMatcher().match(input, level.isLeaf() ? null : name -> isSubcommand(level, name));
				} catch (ArgumentParseException e) {
					checkForHelp(input, stack);
					throw e;
				}
				values.add(parsed);
				CommandTree.Node next = consumeSubcommand(input, current);
				if (next == null) {
					checkForHelp(input, stack);
					checkForVersion(input, stack);
					next = current.getDefaultChild();
				}
				if (next == null) {
					if (current.getDefinition().isSubcommandRequired()) {
						checkForLeftovers(input);
						throw ArgumentParseException.missingSubcommand();
					}
					break;
				}
				current = next;
			}
			checkForLeftovers(input);
			if (log.isDebugEnabled())
				log.debug("Parsed " + args + " as " + stack + ": " + values);
			return ParseResult.ok(stack, values);
		} catch (ParseTermination t) {
			if (log.isDebugEnabled())
				log.debug("Parse of " + args + " terminated: " + t.getResult());
			return t.getResult();
		} catch (ArgumentParseException e) {
			List<ArgumentSet> reachable = new ArrayList<>(stack.size());
			for (int i = stack.size() - 1; i >= 0; i--)
				reachable.add(stack.get(i).getDefinition().getArguments());
			String message = new ErrorMessageGenerator(reachable, input.getOriginalInput(), theSimilarityFloor).makeErrorMessage(e);
			if (log.isDebugEnabled())
				log.debug("Parse of " + args + " failed: " + message, e);
			return ParseResult.error(stack, e, message);
		}
	}

	private boolean isSubcommand(CommandTree.Node node, String name) {
		return node.getChild(name) != null || (isHelpSubcommandEnabled && HELP_SUBCOMMAND.equals(name));
	}

	private CommandTree.Node consumeSubcommand(SplitArguments input, CommandTree.Node current) {
		if (current.isLeaf())
			return null;
		Element first = null;
		for (Element element : input.getElements()) {
			if (element.isTerminator())
				return null;
			else if (element.isValue()) {
				first = element;
				break;
			}
		}
		if (first == null)
			return null;
		CommandTree.Node child = current.getChild(first.getText());
		if (child != null) {
			input.remove(first.getIndex());
			if (log.isDebugEnabled())
				log.debug("Descending from " + current.getName() + " into " + child.getName());
			return child;
		} else if (isHelpSubcommandEnabled && HELP_SUBCOMMAND.equals(first.getText())) {
			input.remove(first.getIndex());
			CommandTree.Node helpFor = current;
			for (Element element : input.getElements()) {
				if (!element.isValue())
					continue;
				CommandTree.Node sub = helpFor.getChild(element.getText());
				if (sub == null)
					break;
				helpFor = sub;
			}
			throw new ParseTermination(ParseResult.helpRequested(helpFor.getPath(), false));
		}
		return null;
	}

	private void checkForCompletion(SplitArguments input, CommandTree.Node root) {
		if (theCompletionName == null)
			return;
		for (Element element : input.getElements()) {
			if (!element.isOption() || !element.getIndex().isComplete() || !element.getOption().getName().equals(theCompletionName))
				continue;
			String shell = element.getOption().getValue();
			if (shell == null) {
				IndexedValue next = input.copy().popNextElementIfValue(element.getIndex());
				shell = next == null ? null : next.getValue();
			}
			throw new ParseTermination(ParseResult.completionRequested(root.getPath(), shell));
		}
	}

	private void checkForHelp(SplitArguments input, List<CommandTree.Node> stack) {
		for (Element element : input.getElements()) {
			if (!element.isOption())
				continue;
			Name name = element.getOption().getName();
			if (theHelpNames.contains(name))
				throw new ParseTermination(ParseResult.helpRequested(stack, false));
			else if (theHiddenHelpNames.contains(name))
				throw new ParseTermination(ParseResult.helpRequested(stack, true));
		}
	}

	private void checkForVersion(SplitArguments input, List<CommandTree.Node> stack) {
		boolean requested = false;
		for (Element element : input.getElements()) {
			if (element.isOption() && theVersionNames.contains(element.getOption().getName())) {
				requested = true;
				break;
			}
		}
		if (!requested)
			return;
		for (int i = stack.size() - 1; i >= 0; i--) {
			String version = stack.get(i).getDefinition().getVersion();
			if (version != null)
				throw new ParseTermination(ParseResult.versionRequested(stack, version));
		}
	}

	private static void checkForLeftovers(SplitArguments input) throws ArgumentParseException {
		for (Element element : input.getElements()) {
			if (!element.isOption())
				continue;
			if (!element.getIndex().isComplete()) {
				// Characters of a number that was left as a value
				Element head = input.get(element.getIndex().toComplete());
				if (head != null && head.isPossibleNegative())
					continue;
			}
			throw ArgumentParseException.unknownOption(element.getIndex(), element.getOption().getName());
		}
		List<IndexedValue> extras = new ArrayList<>();
		for (IndexedValue value : input.coalescedExtraElements()) {
			Element element = input.get(value.getIndex());
			if (element == null || !element.isTerminator())
				extras.add(value);
		}
		if (!extras.isEmpty())
			throw ArgumentParseException.unexpectedValues(extras);
	}

	/** Builds a {@link CommandParser} */
	public static class Builder {
		private final CommandDefinition theRoot;
		private List<Name> theHelpNames;
		private List<Name> theHiddenHelpNames;
		private List<Name> theVersionNames;
		private Name theCompletionName;
		private int theSimilarityFloor;
		private boolean isHelpSubcommandEnabled;

		Builder(CommandDefinition root) {
			theRoot = root;
			theHelpNames = Arrays.asList(Name.ofShort('h'), Name.ofLong("help"));
			theHiddenHelpNames = Arrays.asList(Name.ofLong("help-hidden"));
			theVersionNames = Arrays.asList(Name.ofLong("version"));
			theCompletionName = Name.ofLong("generate-completion-script");
			theSimilarityFloor = ErrorMessageGenerator.DEFAULT_SIMILARITY_FLOOR;
			isHelpSubcommandEnabled = true;
		}

		/**
		 * @param names The names requesting help (default <code>-h</code> and <code>--help</code>)
		 * @return This builder
		 */
		public Builder withHelpNames(Name... names) {
			theHelpNames = Arrays.asList(names);
			return this;
		}

		/**
		 * @param names The names requesting help including hidden arguments (default <code>--help-hidden</code>)
		 * @return This builder
		 */
		public Builder withHiddenHelpNames(Name... names) {
			theHiddenHelpNames = Arrays.asList(names);
			return this;
		}

		/**
		 * @param names The names requesting the version (default <code>--version</code>)
		 * @return This builder
		 */
		public Builder withVersionNames(Name... names) {
			theVersionNames = Arrays.asList(names);
			return this;
		}

		/**
		 * @param name The name requesting a completion script (default <code>--generate-completion-script</code>), or null to disable
		 * @return This builder
		 */
		public Builder withCompletionName(Name name) {
			theCompletionName = name;
			return this;
		}

		/**
		 * @param floor The edit distance below which an unknown option gets a suggestion
		 * @return This builder
		 */
		public Builder withSimilarityFloor(int floor) {
			if (floor < 0)
				throw new IllegalArgumentException("Similarity floor must not be negative: " + floor);
			theSimilarityFloor = floor;
			return this;
		}

		/**
		 * @param enabled Whether <code>help [subcommand...]</code> requests help
		 * @return This builder
		 */
		public Builder withHelpSubcommand(boolean enabled) {
			isHelpSubcommandEnabled = enabled;
			return this;
		}

		/**
		 * @return The parser
		 * @throws ArgumentDefinitionException If the command hierarchy has a cycle or inconsistent arguments
		 */
		public CommandParser build() throws ArgumentDefinitionException {
			return new CommandParser(this);
		}
	}
}
