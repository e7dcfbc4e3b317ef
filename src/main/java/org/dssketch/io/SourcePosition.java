package org.dssketch.io;

/** The position of a token within a line of DSSketch text */
public class SourcePosition implements Comparable<SourcePosition> {
	/** A position for diagnostics that do not belong to any particular line */
	public static final SourcePosition NONE = new SourcePosition(0, 0);

	private final int theLineNumber;
	private final int theColumn;

	/**
	 * @param lineNumber The line number in the text, indexed from one (zero for no position)
	 * @param column The character number within the line, indexed from zero
	 */
	public SourcePosition(int lineNumber, int column) {
		theLineNumber = lineNumber;
		theColumn = column;
	}

	/** @return The line number in the text, indexed from one, or zero if this position is not in the text */
	public int getLineNumber() {
		return theLineNumber;
	}

	/** @return The character number within the line, indexed from zero */
	public int getColumn() {
		return theColumn;
	}

	/** @return Whether this position refers to an actual line in the text */
	public boolean isKnown() {
		return theLineNumber > 0;
	}

	/**
	 * @param columnOffset The number of characters to move along the line
	 * @return A position on the same line, shifted by the given amount
	 */
	public SourcePosition plus(int columnOffset) {
		if (columnOffset == 0 || !isKnown())
			return this;
		return new SourcePosition(theLineNumber, theColumn + columnOffset);
	}

	@Override
	public int compareTo(SourcePosition o) {
		int comp = Integer.compare(theLineNumber, o.theLineNumber);
		if (comp == 0)
			comp = Integer.compare(theColumn, o.theColumn);
		return comp;
	}

	@Override
	public int hashCode() {
		return theLineNumber * 257 + theColumn;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof SourcePosition && theLineNumber == ((SourcePosition) obj).theLineNumber
			&& theColumn == ((SourcePosition) obj).theColumn;
	}

	@Override
	public String toString() {
		if (!isKnown())
			return "";
		return new StringBuilder("L").append(theLineNumber).append(",C").append(theColumn + 1).toString();
	}
}
