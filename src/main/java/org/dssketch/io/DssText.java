package org.dssketch.io;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/** Small text utilities shared by the DSSketch reader and writer */
public class DssText {
	private DssText() {
	}

	/**
	 * Formats a number the way DSSketch writes it: integral values without a fractional part, others in plain decimal notation
	 *
	 * @param value The value to format
	 * @return The formatted value
	 */
	public static String formatNumber(double value) {
		if (Double.isNaN(value) || Double.isInfinite(value))
			return String.valueOf(value);
		if (value == Math.rint(value) && Math.abs(value) < 1E15)
			return Long.toString((long) value);
		return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
	}

	/**
	 * @param text The text to parse
	 * @return The number represented by the text, or null if it is not a number
	 */
	public static Double parseNumber(String text) {
		if (text == null || text.isEmpty())
			return null;
		char first = text.charAt(0);
		if (first != '-' && first != '+' && first != '.' && !Character.isDigit(first))
			return null;
		for (int i = 1; i < text.length(); i++) {
			char ch = text.charAt(i);
			if (!Character.isDigit(ch) && ch != '.')
				return null;
		}
		try {
			return Double.valueOf(text);
		} catch (NumberFormatException e) {
			return null;
		}
	}

	/**
	 * @param value The value to write
	 * @return The value, surrounded by double quotes if it contains whitespace
	 */
	public static String quoteIfSpaces(String value) {
		for (int i = 0; i < value.length(); i++) {
			if (Character.isWhitespace(value.charAt(i)))
				return '"' + value + '"';
		}
		return value;
	}

	/**
	 * @param value The value to read
	 * @return The value without surrounding double quotes, if it had them
	 */
	public static String unquote(String value) {
		String trimmed = value.trim();
		if (trimmed.length() >= 2 && trimmed.charAt(0) == '"' && trimmed.charAt(trimmed.length() - 1) == '"')
			return trimmed.substring(1, trimmed.length() - 1);
		return trimmed;
	}

	/**
	 * Splits text on a delimiter, ignoring delimiters inside double quotes or brackets
	 *
	 * @param text The text to split
	 * @param delimiter The delimiter character
	 * @return The trimmed parts of the text. Empty parts are retained.
	 */
	public static List<String> split(String text, char delimiter) {
		List<String> parts = new ArrayList<>();
		boolean quoted = false;
		int depth = 0;
		int start = 0;
		for (int i = 0; i < text.length(); i++) {
			char ch = text.charAt(i);
			if (ch == '"')
				quoted = !quoted;
			else if (quoted)
				continue;
			else if (ch == '[' || ch == '(')
				depth++;
			else if (ch == ']' || ch == ')')
				depth--;
			else if (ch == delimiter && depth == 0) {
				parts.add(text.substring(start, i).trim());
				start = i + 1;
			}
		}
		parts.add(text.substring(start).trim());
		return parts;
	}

	/**
	 * Splits text into whitespace-separated words, keeping double-quoted strings (quotes included) together
	 *
	 * @param text The text to split
	 * @return The words of the text
	 */
	public static List<String> words(String text) {
		List<String> words = new ArrayList<>();
		StringBuilder word = new StringBuilder();
		boolean quoted = false;
		for (int i = 0; i < text.length(); i++) {
			char ch = text.charAt(i);
			if (ch == '"')
				quoted = !quoted;
			if (!quoted && Character.isWhitespace(ch)) {
				if (word.length() > 0) {
					words.add(word.toString());
					word.setLength(0);
				}
			} else
				word.append(ch);
		}
		if (word.length() > 0)
			words.add(word.toString());
		return words;
	}

	/**
	 * @param text The text to check
	 * @return Whether the text is a plain identifier: a letter or underscore followed by letters, digits or underscores
	 */
	public static boolean isIdentifier(String text) {
		if (text.isEmpty() || !(Character.isLetter(text.charAt(0)) || text.charAt(0) == '_'))
			return false;
		for (int i = 1; i < text.length(); i++) {
			char ch = text.charAt(i);
			if (!Character.isLetterOrDigit(ch) && ch != '_')
				return false;
		}
		return true;
	}

	/**
	 * Prints a sequence of values to a StringBuilder
	 *
	 * @param <T> The type of values to print
	 * @param delimiter The character sequence to place between each value
	 * @param values The sequence to print
	 * @param format The formatter for each value, or null to use {@link String#valueOf(Object)}
	 * @return The printed StringBuilder
	 */
	public static <T> StringBuilder print(CharSequence delimiter, Iterable<? extends T> values,
		Function<? super T, ? extends CharSequence> format) {
		StringBuilder into = new StringBuilder();
		boolean first = true;
		for (T value : values) {
			if (first)
				first = false;
			else
				into.append(delimiter);
			into.append(format == null ? String.valueOf(value) : format.apply(value));
		}
		return into;
	}

	/**
	 * @param str The string to pad
	 * @param width The minimum width of the result
	 * @return The string, padded with trailing spaces to the given width
	 */
	public static String padRight(String str, int width) {
		if (str.length() >= width)
			return str;
		StringBuilder padded = new StringBuilder(width).append(str);
		while (padded.length() < width)
			padded.append(' ');
		return padded.toString();
	}
}
