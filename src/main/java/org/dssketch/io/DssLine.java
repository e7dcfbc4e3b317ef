package org.dssketch.io;

/** A non-blank line of DSSketch text with comments removed */
public class DssLine {
	private final int theLineNumber;
	private final int theIndent;
	private final String theText;
	private final String theRawText;

	/**
	 * @param lineNumber The line number, indexed from one
	 * @param indent The indentation width of the line, with tabs counted as {@link LineScanner#TAB_WIDTH} columns
	 * @param text The content of the line without indentation, trailing whitespace or comment
	 * @param rawText The line as it appeared in the text
	 */
	public DssLine(int lineNumber, int indent, String text, String rawText) {
		theLineNumber = lineNumber;
		theIndent = indent;
		theText = text;
		theRawText = rawText;
	}

	/** @return The line number, indexed from one */
	public int getLineNumber() {
		return theLineNumber;
	}

	/** @return The indentation width of the line */
	public int getIndent() {
		return theIndent;
	}

	/** @return The content of the line */
	public String getText() {
		return theText;
	}

	/** @return The line as it appeared in the text */
	public String getRawText() {
		return theRawText;
	}

	/** @return The first whitespace-delimited word of the line */
	public String getFirstWord() {
		int space = 0;
		while (space < theText.length() && !Character.isWhitespace(theText.charAt(space)))
			space++;
		return theText.substring(0, space);
	}

	/** @return The content after the first word, trimmed */
	public String getRemainder() {
		return theText.substring(getFirstWord().length()).trim();
	}

	/** @return The position of the first character of the content */
	public SourcePosition getPosition() {
		return new SourcePosition(theLineNumber, rawColumn(0));
	}

	/**
	 * @param offset The character offset within {@link #getText()}
	 * @return The position of the character at the given offset
	 */
	public SourcePosition getPosition(int offset) {
		return new SourcePosition(theLineNumber, rawColumn(offset));
	}

	private int rawColumn(int offset) {
		int lead = 0;
		while (lead < theRawText.length() && Character.isWhitespace(theRawText.charAt(lead)))
			lead++;
		return lead + Math.max(0, offset);
	}

	@Override
	public String toString() {
		return theLineNumber + ": " + theText;
	}
}
