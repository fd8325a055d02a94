package org.qargs;

import java.text.ParseException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

import org.apache.log4j.Logger;
import org.qargs.ArgumentDefinition.Arity;
import org.qargs.ArgumentDefinition.FlagAction;
import org.qargs.ArgumentDefinition.Kind;
import org.qargs.ArgumentDefinition.ParsingStrategy;
import org.qargs.split.InputOrigin;
import org.qargs.split.Name;
import org.qargs.split.ParsedOption;
import org.qargs.split.SplitArguments;
import org.qargs.split.SplitArguments.Element;
import org.qargs.split.SplitArguments.IndexedValue;
import org.qargs.split.TokenIndex;

/**
 * Binds the elements of a {@link SplitArguments} stream to the arguments of an {@link ArgumentSet}. Consumed elements are removed from
 * the stream, so whatever is left can be passed on to a subcommand or reported.
 */
public class ArgumentMatcher {
	private static final Logger log = Logger.getLogger(ArgumentMatcher.class);

	private final ArgumentSet theArguments;

	/** @param arguments The arguments to bind */
	public ArgumentMatcher(ArgumentSet arguments) {
		theArguments = arguments;
	}

	/** @return The arguments this matcher binds */
	public ArgumentSet getArguments() {
		return theArguments;
	}

	/**
	 * @param input The stream to match. Consumed elements are removed.
	 * @return The bound values
	 * @throws ArgumentParseException If the input cannot be bound to the arguments
	 */
	public ParsedValues match(SplitArguments input) throws ArgumentParseException {
		return match(input, null);
	}

	/**
	 * @param input The stream to match. Consumed elements are removed.
	 * @param subcommand Tests whether a value names a subcommand (may be null). Positional arguments are not bound from such a value
	 *        or anything after it.
	 * @return The bound values
	 * @throws ArgumentParseException If the input cannot be bound to the arguments
	 */
	public ParsedValues match(SplitArguments input, Predicate<String> subcommand) throws ArgumentParseException {
		ParsedValues values = new Matching(input, subcommand).match();
		if (log.isDebugEnabled())
			log.debug("Bound " + values + ", remaining " + input);
		return values;
	}

	private class Matching {
		private final SplitArguments theInput;
		private final Predicate<String> theSubcommand;
		private final SplitArguments theWorking;
		private final ParsedValues theValues;
		/** Arguments bound by user input in this pass */
		private final Set<ArgumentDefinition> theBound;
		/** Flag keys set by user input in this pass */
		private final Set<String> theUserFlagKeys;
		private final List<TokenIndex> theUsed;

		Matching(SplitArguments input, Predicate<String> subcommand) {
			theInput = input;
			theSubcommand = subcommand;
			theWorking = input.copy();
			theValues = new ParsedValues(input.getOriginalInput());
			theBound = Collections.newSetFromMap(new IdentityHashMap<>());
			theUserFlagKeys = new HashSet<>();
			theUsed = new ArrayList<>();
		}

		ParsedValues match() throws ArgumentParseException {
			setInitialValues();
			boolean capturesAll = capturesAll();
			elements: //
			for (Element next = theWorking.popNext(); next != null; next = theWorking.popNext()) {
				switch (next.getType()) {
				case VALUE:
					if (capturesAll)
						break elements;
					break;
				case TERMINATOR:
					break;
				case OPTION:
					ArgumentDefinition arg = theArguments.first(next.getOption().getName());
					if (arg != null)
						apply(arg, next.getOption(), next.getIndex());
					else if (capturesAll && (!next.getIndex().isComplete()
						|| theWorking.getSubElements(next.getIndex().getInputIndex()).isEmpty()))
						break elements; // A cluster is only unrecognized once one of its characters is
					break;
				case POSSIBLE_NEGATIVE:
					if (!matchPossibleNegative(next) && capturesAll)
						break elements;
					break;
				}
			}
			theInput.removeAll(theUsed);
			bindPositionals();
			checkRequired();
			return theValues;
		}

		private void setInitialValues() {
			for (ArgumentDefinition arg : theArguments) {
				if (theValues.contains(arg.getKey()))
					continue;
				if (arg.hasDefault())
					theValues.set(arg.getKey(), arg.getDefaultValue(), InputOrigin.DEFAULT);
				else if (arg.getArity() == Arity.ARRAY && arg.isOptional())
					theValues.set(arg.getKey(), new ArrayList<>(), InputOrigin.DEFAULT);
			}
		}

		private boolean capturesAll() {
			for (ArgumentDefinition arg : theArguments) {
				if (arg.isPositional() && arg.getStrategy() == ParsingStrategy.ALL_REMAINING_INPUT)
					return true;
			}
			return false;
		}

		/**
		 * Tries the option readings of a dash followed by a number, in order: the whole name, then each character of a cluster as a unit.
		 * Each reading only binds arguments not yet bound in this pass.
		 *
		 * @return Whether the element was bound as an option
		 */
		private boolean matchPossibleNegative(Element element) throws ArgumentParseException {
			TokenIndex index = element.getIndex();
			List<Element> subs = theWorking.getSubElements(index.getInputIndex());
			ArgumentDefinition arg = theArguments.first(element.getOption().getName());
			if (arg != null && !theBound.contains(arg)) {
				apply(arg, element.getOption(), index);
				return true;
			}
			theWorking.remove(index);
			if (subs.isEmpty())
				return false;
			List<ArgumentDefinition> subArgs = new ArrayList<>(subs.size());
			Set<ArgumentDefinition> distinct = Collections.newSetFromMap(new IdentityHashMap<>());
			for (Element sub : subs) {
				ArgumentDefinition subArg = theArguments.first(sub.getOption().getName());
				if (subArg == null || theBound.contains(subArg) || !distinct.add(subArg))
					return false;
				subArgs.add(subArg);
			}
			for (int i = 0; i < subs.size(); i++)
				apply(subArgs.get(i), subs.get(i).getOption(), subs.get(i).getIndex());
			return true;
		}

		private void apply(ArgumentDefinition arg, ParsedOption option, TokenIndex index) throws ArgumentParseException {
			theBound.add(arg);
			// The other readings of a cluster are no longer available
			if (index.isComplete())
				theWorking.remove(index);
			InputOrigin origin = InputOrigin.of(index);
			if (arg.getKind() == Kind.FLAG) {
				if (option.hasValue())
					throw ArgumentParseException.unexpectedValueForOption(origin, option.getName(), option.getValue());
				updateFlag(arg, origin);
				theUsed.add(index);
			} else if (arg.getKind() == Kind.OPTION)
				parseValue(arg, option, index, origin);
			else
				throw ArgumentParseException.invalidState("Positional argument " + arg.getKey() + " matched by name");
		}

		private void parseValue(ArgumentDefinition arg, ParsedOption option, TokenIndex index, InputOrigin origin)
			throws ArgumentParseException {
			Name name = option.getName();
			theUsed.add(index);
			if (arg.getStrategy() == ParsingStrategy.ALL_REMAINING_INPUT)
				theValues.set(arg.getKey(), new ArrayList<>(), origin);
			boolean found = false;
			TokenIndex last = index;
			if (option.hasValue()) {
				update(arg, origin, name, option.getValue());
				found = true;
			} else {
				IndexedValue joined = joinedValue(arg, name, index);
				if (joined != null) {
					theUsed.add(joined.getIndex());
					update(arg, origin.with(joined.getIndex()), name, joined.getValue());
					found = true;
					last = joined.getIndex();
				}
			}
			switch (arg.getStrategy()) {
			case NEXT_AS_VALUE:
				if (!found)
					consume(arg, origin, name, theWorking.popNextElementIfValue(index));
				break;
			case SCANNING_FOR_VALUE:
				if (!found)
					consume(arg, origin, name, theWorking.popNextValue(index));
				break;
			case UNCONDITIONAL:
				if (!found)
					consume(arg, origin, name, theWorking.popNextElementAsValue(index));
				break;
			case UP_TO_NEXT_OPTION:
				for (IndexedValue value = theWorking.popNextElementIfValue(); value != null; value = theWorking.popNextElementIfValue()) {
					theUsed.add(value.getIndex());
					update(arg, origin.with(value.getIndex()), name, value.getValue());
					found = true;
				}
				if (!found)
					throw ArgumentParseException.missingValue(origin, arg, name);
				break;
			case ALL_REMAINING_INPUT:
				for (IndexedValue value = theWorking.popNextElementAsValue(last); value != null; value = theWorking
					.popNextElementAsValue(last)) {
					theUsed.add(value.getIndex());
					update(arg, origin.with(value.getIndex()), name, value.getValue());
					last = value.getIndex();
				}
				break;
			}
		}

		private void consume(ArgumentDefinition arg, InputOrigin origin, Name name, IndexedValue value) throws ArgumentParseException {
			if (value == null)
				throw ArgumentParseException.missingValue(origin, arg, name);
			theUsed.add(value.getIndex());
			update(arg, origin.with(value.getIndex()), name, value.getValue());
		}

		private IndexedValue joinedValue(ArgumentDefinition arg, Name name, TokenIndex index) {
			if (!name.isShort() || index.getSubIndex() != 0)
				return null;
			int found = arg.getNames().indexOf(name);
			if (found < 0 || !arg.getNames().get(found).allowsJoinedValue())
				return null;
			return theWorking.extractJoinedElement(index);
		}

		private void update(ArgumentDefinition arg, InputOrigin origin, Name name, String text) throws ArgumentParseException {
			Object parsed = parse(arg, origin, name, text);
			if (arg.getArity() == Arity.ARRAY) {
				ParsedValues.Element previous = theValues.getElement(arg.getKey());
				if (previous == null || previous.getOrigin().isDefault()) {
					List<Object> list = new ArrayList<>();
					list.add(parsed);
					theValues.set(arg.getKey(), list, origin);
				} else {
					theValues.update(arg.getKey(), origin, null, old -> {
						List<Object> list = new ArrayList<>((List<?>) old);
						list.add(parsed);
						return list;
					});
				}
			} else
				theValues.set(arg.getKey(), parsed, origin);
		}

		private Object parse(ArgumentDefinition arg, InputOrigin origin, Name name, String text) throws ArgumentParseException {
			try {
				return arg.parse(text);
			} catch (ParseException | IllegalArgumentException e) {
				throw ArgumentParseException.invalidValue(origin, arg, name, text, e);
			}
		}

		private void updateFlag(ArgumentDefinition arg, InputOrigin origin) throws ArgumentParseException {
			String key = arg.getKey();
			if (arg.getFlagAction() == FlagAction.COUNT) {
				theValues.update(key, origin, 0, old -> ((Integer) old) + 1);
				return;
			}
			Object value = arg.getFlagValue();
			if (theUserFlagKeys.add(key)) {
				theValues.set(key, value, origin);
				return;
			}
			switch (arg.getExclusivity()) {
			case EXCLUSIVE:
				ParsedValues.Element previous = theValues.getElement(key);
				if (!Objects.equals(previous.getValue(), value))
					throw ArgumentParseException.duplicateExclusiveValues(previous.getOrigin(), origin, arg);
				theValues.set(key, value, origin);
				break;
			case CHOOSE_FIRST:
				theValues.update(key, origin, null, old -> old);
				break;
			case CHOOSE_LAST:
				theValues.set(key, value, origin);
				break;
			}
		}

		private void bindPositionals() throws ArgumentParseException {
			Deque<Element> remaining = new ArrayDeque<>();
			for (Element element : theInput.getElements()) {
				if (element.getIndex().isComplete())
					remaining.add(element);
			}
			List<TokenIndex> consumed = new ArrayList<>();
			boolean[] terminated = new boolean[1];
			positionals: //
			for (ArgumentDefinition arg : theArguments.getPositionals()) {
				// Capturing positionals take options and terminators as well
				boolean all = arg.getStrategy() == ParsingStrategy.ALL_REMAINING_INPUT;
				do {
					Element element = all ? remaining.pollFirst() : pollFirstValue(remaining, terminated);
					if (element == null)
						break positionals;
					else if (element.isTerminator())
						terminated[0] = true;
					else if (theSubcommand != null && !terminated[0] && element.isValue() && theSubcommand.test(element.getText()))
						break positionals;
					String text = all ? theInput.getOriginalInput(element.getIndex()) : element.getText();
					update(arg, InputOrigin.of(element.getIndex()), null, text);
					consumed.add(element.getIndex());
				} while (arg.isRepeating());
			}
			theInput.removeAll(consumed);
		}

		private Element pollFirstValue(Deque<Element> remaining, boolean[] terminated) {
			Element element = remaining.pollFirst();
			while (element != null && !element.isValueLike()) {
				if (element.isTerminator())
					terminated[0] = true;
				element = remaining.pollFirst();
			}
			return element;
		}

		private void checkRequired() throws ArgumentParseException {
			Set<String> checked = new HashSet<>();
			for (ArgumentDefinition arg : theArguments) {
				if (checked.add(arg.getKey()) && !arg.isOptional() && !theValues.contains(arg.getKey()))
					throw ArgumentParseException.missingArgument(arg.getKey(), theArguments.withKey(arg.getKey()));
			}
		}
	}
}
