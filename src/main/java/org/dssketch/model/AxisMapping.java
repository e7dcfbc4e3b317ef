package org.dssketch.model;

import java.util.Objects;

/** One labeled point on an axis, pairing a user-space value with a design-space value */
public class AxisMapping {
	private final String theLabel;
	private final double theUserValue;
	private final double theDesignValue;
	private final boolean isElidable;

	/**
	 * @param label The label of the point
	 * @param userValue The user-space value of the point
	 * @param designValue The design-space value of the point
	 * @param elidable Whether the label is dropped from generated instance names
	 */
	public AxisMapping(String label, double userValue, double designValue, boolean elidable) {
		theLabel = Objects.requireNonNull(label, "label");
		theUserValue = userValue;
		theDesignValue = designValue;
		isElidable = elidable;
	}

	/** @return The label of the point */
	public String getLabel() {
		return theLabel;
	}

	/** @return The user-space value of the point */
	public double getUserValue() {
		return theUserValue;
	}

	/** @return The design-space value of the point */
	public double getDesignValue() {
		return theDesignValue;
	}

	/** @return Whether the label is dropped from generated instance names */
	public boolean isElidable() {
		return isElidable;
	}

	@Override
	public int hashCode() {
		return Objects.hash(theLabel, theUserValue, theDesignValue, isElidable);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof AxisMapping))
			return false;
		AxisMapping other = (AxisMapping) obj;
		return theLabel.equals(other.theLabel) && theUserValue == other.theUserValue && theDesignValue == other.theDesignValue
			&& isElidable == other.isElidable;
	}

	@Override
	public String toString() {
		return theUserValue + " " + theLabel + " > " + theDesignValue + (isElidable ? " @elidable" : "");
	}
}
