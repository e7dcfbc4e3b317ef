package org.dssketch.model;

import java.util.Map;
import java.util.Objects;

import com.google.common.collect.ImmutableMap;

/** A concrete interpolation master backed by a font source file */
public class Source {
	private final String theName;
	private final String theFilename;
	private final ImmutableMap<String, Double> theLocation;
	private final String theLayer;
	private final boolean isBase;

	/**
	 * @param name The name of the source
	 * @param filename The file backing the source, relative to the document's path
	 * @param location The design-space location of the source, keyed by axis tag
	 * @param layer The layer inside the source file, or null for the default layer
	 * @param base Whether this is the base (default) source of the document
	 */
	public Source(String name, String filename, Map<String, Double> location, String layer, boolean base) {
		theName = Objects.requireNonNull(name, "name");
		theFilename = Objects.requireNonNull(filename, "filename");
		theLocation = ImmutableMap.copyOf(location);
		theLayer = layer;
		isBase = base;
	}

	/** @return The name of the source */
	public String getName() {
		return theName;
	}

	/** @return The file backing the source, relative to the document's path */
	public String getFilename() {
		return theFilename;
	}

	/** @return The design-space location of the source, keyed by axis tag */
	public Map<String, Double> getLocation() {
		return theLocation;
	}

	/**
	 * @param axisTag The tag of the axis
	 * @param defaultValue The value to return if the location does not specify the axis
	 * @return The design-space coordinate of this source on the axis
	 */
	public double getCoordinate(String axisTag, double defaultValue) {
		Double value = theLocation.get(axisTag);
		return value == null ? defaultValue : value;
	}

	/** @return The layer inside the source file, or null for the default layer */
	public String getLayer() {
		return theLayer;
	}

	/** @return Whether this is the base (default) source of the document */
	public boolean isBase() {
		return isBase;
	}

	@Override
	public int hashCode() {
		return Objects.hash(theName, theFilename, theLocation, theLayer, isBase);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Source))
			return false;
		Source other = (Source) obj;
		return theName.equals(other.theName) && theFilename.equals(other.theFilename) && theLocation.equals(other.theLocation)
			&& Objects.equals(theLayer, other.theLayer) && isBase == other.isBase;
	}

	@Override
	public String toString() {
		return theName + " " + theLocation + (isBase ? " @base" : "");
	}
}
