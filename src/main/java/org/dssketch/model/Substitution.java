package org.dssketch.model;

import java.util.Objects;

/** A concrete glyph substitution */
public class Substitution implements Comparable<Substitution> {
	private final String theFrom;
	private final String theTo;

	/**
	 * @param from The name of the glyph to replace
	 * @param to The name of the replacement glyph
	 */
	public Substitution(String from, String to) {
		theFrom = Objects.requireNonNull(from, "from");
		theTo = Objects.requireNonNull(to, "to");
	}

	/** @return The name of the glyph to replace */
	public String getFrom() {
		return theFrom;
	}

	/** @return The name of the replacement glyph */
	public String getTo() {
		return theTo;
	}

	/** @return The suffix the replacement appends to the original glyph name, or null if it is not a suffix replacement */
	public String getSuffix() {
		if (theTo.length() > theFrom.length() + 1 && theTo.startsWith(theFrom) && theTo.charAt(theFrom.length()) == '.')
			return theTo.substring(theFrom.length());
		return null;
	}

	@Override
	public int compareTo(Substitution o) {
		int comp = theFrom.compareTo(o.theFrom);
		if (comp == 0)
			comp = theTo.compareTo(o.theTo);
		return comp;
	}

	@Override
	public int hashCode() {
		return theFrom.hashCode() * 31 + theTo.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Substitution && theFrom.equals(((Substitution) obj).theFrom) && theTo.equals(((Substitution) obj).theTo);
	}

	@Override
	public String toString() {
		return theFrom + " > " + theTo;
	}
}
