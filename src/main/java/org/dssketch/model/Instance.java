package org.dssketch.model;

import java.util.Map;
import java.util.Objects;

import com.google.common.collect.ImmutableMap;

/** A named point in the design space, generated from axis labels or declared explicitly */
public class Instance {
	private final String theFamilyName;
	private final String theStyleName;
	private final ImmutableMap<String, Double> theLocation;
	private final String theFilename;

	/**
	 * @param familyName The family name of the instance
	 * @param styleName The style name of the instance
	 * @param location The design-space location of the instance, keyed by axis tag
	 * @param filename The file the instance is generated into, or null to derive it from the PostScript name
	 */
	public Instance(String familyName, String styleName, Map<String, Double> location, String filename) {
		theFamilyName = familyName == null ? "" : familyName;
		theStyleName = Objects.requireNonNull(styleName, "styleName");
		theLocation = ImmutableMap.copyOf(location);
		theFilename = filename;
	}

	/** @return The family name of the instance */
	public String getFamilyName() {
		return theFamilyName;
	}

	/** @return The style name of the instance */
	public String getStyleName() {
		return theStyleName;
	}

	/** @return The full name of the instance: family and style */
	public String getName() {
		return theFamilyName.isEmpty() ? theStyleName : theFamilyName + " " + theStyleName;
	}

	/** @return The PostScript name of the instance: family and style joined by a hyphen, without spaces */
	public String getPostScriptName() {
		String family = theFamilyName.replace(" ", "");
		String style = theStyleName.replace(" ", "");
		return family.isEmpty() ? style : family + "-" + style;
	}

	/** @return The file the instance is generated into */
	public String getFilename() {
		return theFilename != null ? theFilename : "instances/" + getPostScriptName() + ".ufo";
	}

	/** @return The design-space location of the instance, keyed by axis tag */
	public Map<String, Double> getLocation() {
		return theLocation;
	}

	@Override
	public int hashCode() {
		return Objects.hash(theFamilyName, theStyleName, theLocation);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Instance))
			return false;
		Instance other = (Instance) obj;
		return theFamilyName.equals(other.theFamilyName) && theStyleName.equals(other.theStyleName)
			&& theLocation.equals(other.theLocation);
	}

	@Override
	public String toString() {
		return getName() + " " + theLocation;
	}
}
