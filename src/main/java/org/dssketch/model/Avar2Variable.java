package org.dssketch.model;

import java.util.Objects;

/** A named design-space value that avar2 outputs may refer to as <code>$name</code> */
public class Avar2Variable {
	private final String theName;
	private final double theValue;

	/**
	 * @param name The name of the variable, without the leading '$'
	 * @param value The value of the variable
	 */
	public Avar2Variable(String name, double value) {
		theName = Objects.requireNonNull(name, "name");
		theValue = value;
	}

	/** @return The name of the variable, without the leading '$' */
	public String getName() {
		return theName;
	}

	/** @return The value of the variable */
	public double getValue() {
		return theValue;
	}

	@Override
	public int hashCode() {
		return theName.hashCode() * 31 + Double.hashCode(theValue);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Avar2Variable && theName.equals(((Avar2Variable) obj).theName)
			&& theValue == ((Avar2Variable) obj).theValue;
	}

	@Override
	public String toString() {
		return "$" + theName + " = " + theValue;
	}
}
