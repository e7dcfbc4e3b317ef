package org.dssketch.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

/**
 * An interpolation dimension of a design space. The minimum, default and maximum are user-space values. The {@link #getMappings()
 * mappings} relate user-space values to the design-space coordinates of the sources.
 */
public class Axis {
	private final String theTag;
	private final String theName;
	private final String theDisplayName;
	private final double theMinimum;
	private final double theDefault;
	private final double theMaximum;
	private final boolean isDiscrete;
	private final boolean isHidden;
	private final ImmutableList<AxisMapping> theMappings;

	/**
	 * @param tag The tag of the axis
	 * @param name The name of the axis
	 * @param displayName The display name of the axis, or null
	 * @param minimum The user-space minimum
	 * @param defaultValue The user-space default
	 * @param maximum The user-space maximum
	 * @param discrete Whether the axis only takes the values of its mappings
	 * @param hidden Whether the axis is hidden from end users
	 * @param mappings The labeled points of the axis
	 */
	public Axis(String tag, String name, String displayName, double minimum, double defaultValue, double maximum, boolean discrete,
		boolean hidden, List<AxisMapping> mappings) {
		theTag = Objects.requireNonNull(tag, "tag");
		theName = name == null ? tag : name;
		theDisplayName = displayName;
		theMinimum = minimum;
		theDefault = defaultValue;
		theMaximum = maximum;
		isDiscrete = discrete;
		isHidden = hidden;
		theMappings = ImmutableList.copyOf(mappings);
	}

	/** @return The tag of the axis */
	public String getTag() {
		return theTag;
	}

	/** @return The name of the axis */
	public String getName() {
		return theName;
	}

	/** @return The display name of the axis, or null */
	public String getDisplayName() {
		return theDisplayName;
	}

	/** @return The registered kind of this axis */
	public AxisKind getKind() {
		AxisKind kind = AxisKind.forTag(theTag);
		return kind != AxisKind.CUSTOM ? kind : AxisKind.forName(theName);
	}

	/** @return The user-space minimum */
	public double getMinimum() {
		return theMinimum;
	}

	/** @return The user-space default */
	public double getDefault() {
		return theDefault;
	}

	/** @return The user-space maximum */
	public double getMaximum() {
		return theMaximum;
	}

	/** @return Whether the axis only takes the values of its mappings */
	public boolean isDiscrete() {
		return isDiscrete;
	}

	/** @return Whether the axis is hidden from end users */
	public boolean isHidden() {
		return isHidden;
	}

	/** @return The labeled points of the axis, in declaration order */
	public List<AxisMapping> getMappings() {
		return theMappings;
	}

	/**
	 * @param hidden Whether the axis should be hidden
	 * @return An axis identical to this one except for its hidden flag
	 */
	public Axis withHidden(boolean hidden) {
		if (hidden == isHidden)
			return this;
		return new Axis(theTag, theName, theDisplayName, theMinimum, theDefault, theMaximum, isDiscrete, hidden, theMappings);
	}

	/**
	 * @param tagOrName The tag or name to test
	 * @return Whether this axis is identified by the given tag or (case-insensitive) name
	 */
	public boolean isIdentifiedBy(String tagOrName) {
		return theTag.equals(tagOrName) || theName.equalsIgnoreCase(tagOrName);
	}

	/**
	 * @param label The label to look for
	 * @return The mapping with the given label, or null
	 */
	public AxisMapping getMapping(String label) {
		for (AxisMapping mapping : theMappings) {
			if (mapping.getLabel().equals(label))
				return mapping;
		}
		return null;
	}

	/**
	 * @param designValue The design-space value to look for
	 * @return The first mapping with the given design value, or null
	 */
	public AxisMapping getMappingForDesign(double designValue) {
		for (AxisMapping mapping : theMappings) {
			if (mapping.getDesignValue() == designValue)
				return mapping;
		}
		return null;
	}

	/**
	 * @param userValue The user-space value to look for
	 * @return The first mapping with the given user value, or null
	 */
	public AxisMapping getMappingForUser(double userValue) {
		for (AxisMapping mapping : theMappings) {
			if (mapping.getUserValue() == userValue)
				return mapping;
		}
		return null;
	}

	/**
	 * Maps a user-space value into design space by piecewise-linear interpolation over the mappings. Values outside the mapped range
	 * take the design value of the nearest end.
	 *
	 * @param userValue The user-space value
	 * @return The design-space value
	 */
	public double mapToDesign(double userValue) {
		return interpolate(userValue, true);
	}

	/**
	 * @param designValue The design-space value
	 * @return The user-space value, the inverse of {@link #mapToDesign(double)}
	 */
	public double mapToUser(double designValue) {
		return interpolate(designValue, false);
	}

	private double interpolate(double value, boolean toDesign) {
		if (theMappings.isEmpty())
			return value;
		List<AxisMapping> sorted = new ArrayList<>(theMappings);
		Comparator<AxisMapping> order = toDesign ? Comparator.comparingDouble(AxisMapping::getUserValue)
			: Comparator.comparingDouble(AxisMapping::getDesignValue);
		sorted.sort(order);
		AxisMapping prev = null;
		for (AxisMapping mapping : sorted) {
			double from = toDesign ? mapping.getUserValue() : mapping.getDesignValue();
			double to = toDesign ? mapping.getDesignValue() : mapping.getUserValue();
			if (value == from)
				return to;
			if (value < from) {
				if (prev == null)
					return to;
				double prevFrom = toDesign ? prev.getUserValue() : prev.getDesignValue();
				double prevTo = toDesign ? prev.getDesignValue() : prev.getUserValue();
				return prevTo + (to - prevTo) * (value - prevFrom) / (from - prevFrom);
			}
			prev = mapping;
		}
		return toDesign ? prev.getDesignValue() : prev.getUserValue();
	}

	/** @return The design-space value of the axis default */
	public double getDefaultDesignValue() {
		return mapToDesign(theDefault);
	}

	/** @return The smallest design value over all mappings, or the user minimum if the axis has no mappings */
	public double getDesignMinimum() {
		if (theMappings.isEmpty())
			return theMinimum;
		double min = Double.POSITIVE_INFINITY;
		for (AxisMapping mapping : theMappings)
			min = Math.min(min, mapping.getDesignValue());
		return min;
	}

	/** @return The largest design value over all mappings, or the user maximum if the axis has no mappings */
	public double getDesignMaximum() {
		if (theMappings.isEmpty())
			return theMaximum;
		double max = Double.NEGATIVE_INFINITY;
		for (AxisMapping mapping : theMappings)
			max = Math.max(max, mapping.getDesignValue());
		return max;
	}

	/**
	 * @param userValue The user-space value to test
	 * @return Whether the value lies within the axis's user-space range
	 */
	public boolean containsUserValue(double userValue) {
		return userValue >= theMinimum && userValue <= theMaximum;
	}

	/**
	 * @param designValue The design-space value to test
	 * @return Whether the value lies within the axis's derived design-space range
	 */
	public boolean containsDesignValue(double designValue) {
		return designValue >= getDesignMinimum() && designValue <= getDesignMaximum();
	}

	@Override
	public int hashCode() {
		return Objects.hash(theTag, theName, theMinimum, theDefault, theMaximum, theMappings);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Axis))
			return false;
		Axis other = (Axis) obj;
		return theTag.equals(other.theTag) && theName.equals(other.theName) && Objects.equals(theDisplayName, other.theDisplayName)
			&& theMinimum == other.theMinimum && theDefault == other.theDefault && theMaximum == other.theMaximum
			&& isDiscrete == other.isDiscrete && isHidden == other.isHidden && theMappings.equals(other.theMappings);
	}

	@Override
	public String toString() {
		return theTag + " " + theMinimum + ":" + theDefault + ":" + theMaximum + (isHidden ? " (hidden)" : "");
	}
}
