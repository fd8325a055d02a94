package org.qargs;

import java.text.ParseException;
import java.util.Locale;

/**
 * Parses the text given for an argument into its value
 *
 * @param <T> The type of value produced
 */
@FunctionalInterface
public interface ArgumentValueParser<T> {
	/** Binds the text as given */
	ArgumentValueParser<String> STRING = text -> text;
	/** Parses an {@link Integer} */
	ArgumentValueParser<Integer> INTEGER = Integer::valueOf;
	/** Parses a {@link Long} */
	ArgumentValueParser<Long> LONG = Long::valueOf;
	/** Parses a {@link Double} */
	ArgumentValueParser<Double> DOUBLE = Double::valueOf;

	/**
	 * @param text The text representing the value as specified in the command-line argument
	 * @return The parsed value
	 * @throws ParseException If the value cannot be parsed (either this or {@link IllegalArgumentException} may be thrown)
	 * @throws IllegalArgumentException If the value cannot be parsed (either this or {@link ParseException} may be thrown)
	 */
	T parse(String text) throws ParseException, IllegalArgumentException;

	/**
	 * @param <E> The enum type
	 * @param type The enum type
	 * @return A parser accepting the lower-cased names of the enum's constants
	 */
	static <E extends Enum<E>> ArgumentValueParser<E> forEnum(Class<E> type) {
		return text -> {
			for (E value : type.getEnumConstants()) {
				if (enumText(value).equals(text))
					return value;
			}
			throw new IllegalArgumentException("No such " + type.getSimpleName() + ": " + text);
		};
	}

	/**
	 * @param value The enum constant
	 * @return The text by which the constant is specified on the command line
	 */
	static String enumText(Enum<?> value) {
		return value.name().toLowerCase(Locale.ROOT).replace('_', '-');
	}
}
