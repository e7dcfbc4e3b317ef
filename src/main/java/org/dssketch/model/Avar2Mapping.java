package org.dssketch.model;

import java.util.Map;
import java.util.Objects;

import com.google.common.collect.ImmutableMap;

/**
 * One row of the non-linear axis dependency table: when the user-space input location is requested, the output axes take the
 * given design-space values
 */
public class Avar2Mapping {
	private final String theName;
	private final ImmutableMap<String, Double> theInput;
	private final ImmutableMap<String, Double> theOutput;

	/**
	 * @param name The name of the mapping, or null
	 * @param input The user-space input location, keyed by axis tag
	 * @param output The design-space output values, keyed by axis tag
	 */
	public Avar2Mapping(String name, Map<String, Double> input, Map<String, Double> output) {
		theName = name;
		theInput = ImmutableMap.copyOf(input);
		theOutput = ImmutableMap.copyOf(output);
	}

	/** @return The name of the mapping, or null */
	public String getName() {
		return theName;
	}

	/** @return The user-space input location, keyed by axis tag */
	public Map<String, Double> getInput() {
		return theInput;
	}

	/** @return The design-space output values, keyed by axis tag */
	public Map<String, Double> getOutput() {
		return theOutput;
	}

	@Override
	public int hashCode() {
		return Objects.hash(theName, theInput, theOutput);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Avar2Mapping))
			return false;
		Avar2Mapping other = (Avar2Mapping) obj;
		return Objects.equals(theName, other.theName) && theInput.equals(other.theInput) && theOutput.equals(other.theOutput);
	}

	@Override
	public String toString() {
		return (theName == null ? "" : "\"" + theName + "\" ") + theInput + " > " + theOutput;
	}
}
