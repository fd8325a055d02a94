package org.qargs;

import java.util.Iterator;
import java.util.function.BiConsumer;
import java.util.function.Function;

/** Text utilities for printing diagnostics */
public class StringUtils {
	private StringUtils() {}

	/**
	 * Prints a sequence of values to a StringBuilder
	 *
	 * @param <T> The type of values to print
	 * @param delimiter The character sequence to place between each value
	 * @param values The sequence to print
	 * @param format The formatter for the sequence, or null to use {@link String#valueOf(Object)}
	 * @return The printed StringBuilder
	 */
	public static <T> StringBuilder print(CharSequence delimiter, Iterable<? extends T> values,
		Function<? super T, ? extends CharSequence> format) {
		return print(new StringBuilder(), delimiter, values, (v, str) -> str.append(format == null ? String.valueOf(v) : format.apply(v)));
	}

	/**
	 * Prints a sequence of values to a StringBuilder
	 *
	 * @param <T> The type of values to print
	 * @param into The StringBuilder to print into--may be null, in which case a new one will be created
	 * @param delimiter The character sequence to place between each value
	 * @param values The sequence to print
	 * @param format The formatter for the sequence
	 * @return The printed StringBuilder
	 */
	public static <T> StringBuilder print(StringBuilder into, CharSequence delimiter, Iterable<? extends T> values,
		BiConsumer<? super T, ? super StringBuilder> format) {
		if (into == null)
			into = new StringBuilder();
		boolean first = true;
		for (T value : values) {
			if (first)
				first = false;
			else
				into.append(delimiter);
			if (format != null)
				format.accept(value, into);
			else
				into.append(value);
		}
		return into;
	}

	/**
	 * Prints a sequence like "'a', 'b' or 'c'"
	 *
	 * @param values The values to print, each of which will be single-quoted
	 * @param preTerminal The conjunction before the last value, e.g. "or"
	 * @return The printed sequence
	 */
	public static String conversational(Iterable<?> values, String preTerminal) {
		StringBuilder str = new StringBuilder();
		Iterator<?> iter = values.iterator();
		int count = 0;
		while (iter.hasNext()) {
			Object value = iter.next();
			if (count > 0)
				str.append(iter.hasNext() ? ", " : " " + preTerminal + " ");
			str.append('\'').append(value).append('\'');
			count++;
		}
		return str.toString();
	}

	/**
	 * Converts a camel-case name such as <code>firstNumber</code> to kebab case (<code>first-number</code>). Adjacent capitals are treated
	 * as part of the same component, so <code>parseURL</code> becomes <code>parse-url</code>.
	 *
	 * @param name The name to convert
	 * @return The kebab-case name
	 */
	public static String toKebabCase(String name) {
		StringBuilder str = new StringBuilder();
		boolean hadLower = false;
		for (int c = 0; c < name.length(); c++) {
			char ch = name.charAt(c);
			if (Character.isUpperCase(ch)) {
				if (c > 0 && hadLower)
					str.append('-');
				str.append(Character.toLowerCase(ch));
				hadLower = false;
			} else if (ch == '_') {
				str.append('-');
				hadLower = false;
			} else {
				str.append(ch);
				hadLower = true;
			}
		}
		return str.toString();
	}

	/**
	 * @param s1 The first string
	 * @param s2 The second string
	 * @return The Levenshtein distance between the two strings: the number of single-character insertions, deletions or substitutions
	 *         needed to turn one into the other
	 */
	public static int editDistance(CharSequence s1, CharSequence s2) {
		int[] prev = new int[s2.length() + 1];
		int[] curr = new int[s2.length() + 1];
		for (int j = 0; j <= s2.length(); j++)
			prev[j] = j;
		for (int i = 1; i <= s1.length(); i++) {
			curr[0] = i;
			for (int j = 1; j <= s2.length(); j++) {
				int cost = s1.charAt(i - 1) == s2.charAt(j - 1) ? 0 : 1;
				curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
			}
			int[] temp = prev;
			prev = curr;
			curr = temp;
		}
		return prev[s2.length()];
	}
}
