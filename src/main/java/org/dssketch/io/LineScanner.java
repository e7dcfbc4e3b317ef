package org.dssketch.io;

import java.util.ArrayList;
import java.util.List;

/** Splits DSSketch text into logical {@link DssLine lines}, dropping blank lines and comments */
public class LineScanner {
	/** The number of columns a tab character counts for in indentation */
	public static final int TAB_WIDTH = 4;

	/** The character that starts a comment, outside of quoted strings */
	public static final char COMMENT_CHAR = '#';

	private LineScanner() {
	}

	/**
	 * @param text The DSSketch text to scan
	 * @return The non-blank lines of the text with comments removed
	 */
	public static List<DssLine> scan(CharSequence text) {
		List<DssLine> lines = new ArrayList<>();
		int lineNumber = 0;
		int start = 0;
		int length = text.length();
		while (start <= length) {
			int end = start;
			while (end < length && text.charAt(end) != '\n')
				end++;
			lineNumber++;
			String raw = text.subSequence(start, end).toString();
			if (raw.endsWith("\r"))
				raw = raw.substring(0, raw.length() - 1);
			DssLine line = scanLine(lineNumber, raw);
			if (line != null)
				lines.add(line);
			start = end + 1;
		}
		return lines;
	}

	/**
	 * @param lineNumber The line number of the line
	 * @param raw The line text
	 * @return The scanned line, or null if the line is blank or only contains a comment
	 */
	public static DssLine scanLine(int lineNumber, String raw) {
		String content = stripComment(raw);
		int indent = 0;
		int i = 0;
		for (; i < content.length(); i++) {
			char ch = content.charAt(i);
			if (ch == ' ')
				indent++;
			else if (ch == '\t')
				indent += TAB_WIDTH;
			else if (!Character.isWhitespace(ch))
				break;
		}
		String text = normalizeWhitespace(content.substring(i));
		if (text.isEmpty())
			return null;
		return new DssLine(lineNumber, indent, text, raw);
	}

	/**
	 * @param line The line to strip
	 * @return The line content before any comment that is not inside double quotes
	 */
	public static String stripComment(String line) {
		boolean quoted = false;
		for (int i = 0; i < line.length(); i++) {
			char ch = line.charAt(i);
			if (ch == '"')
				quoted = !quoted;
			else if (ch == COMMENT_CHAR && !quoted)
				return line.substring(0, i);
		}
		return line;
	}

	/** Collapses runs of unquoted whitespace into single spaces and trims the result */
	static String normalizeWhitespace(String text) {
		StringBuilder str = new StringBuilder(text.length());
		boolean quoted = false;
		boolean pendingSpace = false;
		for (int i = 0; i < text.length(); i++) {
			char ch = text.charAt(i);
			if (!quoted && Character.isWhitespace(ch)) {
				pendingSpace = str.length() > 0;
				continue;
			}
			if (pendingSpace) {
				str.append(' ');
				pendingSpace = false;
			}
			if (ch == '"')
				quoted = !quoted;
			str.append(ch);
		}
		return str.toString();
	}
}
