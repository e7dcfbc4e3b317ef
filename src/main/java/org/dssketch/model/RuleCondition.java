package org.dssketch.model;

import java.util.Objects;

/** A design-space range on one axis, either end of which may be open */
public class RuleCondition {
	private final String theAxisTag;
	private final Double theMinimum;
	private final Double theMaximum;

	/**
	 * @param axisTag The tag of the axis the condition tests
	 * @param minimum The inclusive design-space minimum, or null for no lower bound
	 * @param maximum The inclusive design-space maximum, or null for no upper bound
	 */
	public RuleCondition(String axisTag, Double minimum, Double maximum) {
		if (minimum == null && maximum == null)
			throw new IllegalArgumentException("A condition on " + axisTag + " needs at least one bound");
		theAxisTag = Objects.requireNonNull(axisTag, "axisTag");
		theMinimum = minimum;
		theMaximum = maximum;
	}

	/** @return The tag of the axis the condition tests */
	public String getAxisTag() {
		return theAxisTag;
	}

	/** @return The inclusive design-space minimum, or null */
	public Double getMinimum() {
		return theMinimum;
	}

	/** @return The inclusive design-space maximum, or null */
	public Double getMaximum() {
		return theMaximum;
	}

	/** @return Whether this condition matches exactly one value */
	public boolean isExact() {
		return theMinimum != null && theMinimum.equals(theMaximum);
	}

	/**
	 * @param designValue The design-space value to test
	 * @return Whether the value satisfies this condition
	 */
	public boolean matches(double designValue) {
		return (theMinimum == null || designValue >= theMinimum) && (theMaximum == null || designValue <= theMaximum);
	}

	@Override
	public int hashCode() {
		return Objects.hash(theAxisTag, theMinimum, theMaximum);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof RuleCondition))
			return false;
		RuleCondition other = (RuleCondition) obj;
		return theAxisTag.equals(other.theAxisTag) && Objects.equals(theMinimum, other.theMinimum)
			&& Objects.equals(theMaximum, other.theMaximum);
	}

	@Override
	public String toString() {
		if (isExact())
			return theAxisTag + " == " + theMinimum;
		else if (theMinimum == null)
			return theAxisTag + " <= " + theMaximum;
		else if (theMaximum == null)
			return theAxisTag + " >= " + theMinimum;
		else
			return theMinimum + " <= " + theAxisTag + " <= " + theMaximum;
	}
}
