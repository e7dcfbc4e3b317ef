package org.dssketch.config;

import org.dssketch.io.ValidationPolicy;

/** Immutable settings for parsing, converting and writing DSSketch documents */
public class DssOptions {
	/** How avar2 mappings are written */
	public enum Avar2Format {
		/** One row per mapping, one column per output axis */
		MATRIX,
		/** One line per mapping */
		LINEAR
	}

	/** The default number of occurrences at which an avar2 output value is extracted into a variable */
	public static final int DEFAULT_VARIABLE_THRESHOLD = 3;

	/** The default options: strict validation, matrix avar2 layout, variable extraction at 3 occurrences, labels where possible */
	public static final DssOptions DEFAULT = new DssOptions(ValidationPolicy.STRICT, Avar2Format.MATRIX, DEFAULT_VARIABLE_THRESHOLD,
		true, true, true);

	private final ValidationPolicy thePolicy;
	private final Avar2Format theAvar2Format;
	private final int theVariableThreshold;
	private final boolean isUsingLabelRanges;
	private final boolean isUsingLabelCoordinates;
	private final boolean isValidatingSources;

	private DssOptions(ValidationPolicy policy, Avar2Format avar2Format, int variableThreshold, boolean labelRanges,
		boolean labelCoordinates, boolean validateSources) {
		thePolicy = policy;
		theAvar2Format = avar2Format;
		theVariableThreshold = variableThreshold;
		isUsingLabelRanges = labelRanges;
		isUsingLabelCoordinates = labelCoordinates;
		isValidatingSources = validateSources;
	}

	/** @return The policy deciding which diagnostics abort processing */
	public ValidationPolicy getPolicy() {
		return thePolicy;
	}

	/** @return How avar2 mappings are written */
	public Avar2Format getAvar2Format() {
		return theAvar2Format;
	}

	/** @return The number of occurrences at which an avar2 output value is extracted into a variable, or 0 for no variables */
	public int getVariableThreshold() {
		return theVariableThreshold;
	}

	/** @return Whether standard axis ranges are written with labels, like <code>Thin:Regular:Black</code> */
	public boolean isUsingLabelRanges() {
		return isUsingLabelRanges;
	}

	/** @return Whether coordinates are written with labels where a mapping matches */
	public boolean isUsingLabelCoordinates() {
		return isUsingLabelCoordinates;
	}

	/** @return Whether the existence of source files is checked */
	public boolean isValidatingSources() {
		return isValidatingSources;
	}

	/**
	 * @param policy The validation policy
	 * @return Options like these, with the given policy
	 */
	public DssOptions withPolicy(ValidationPolicy policy) {
		return new DssOptions(policy, theAvar2Format, theVariableThreshold, isUsingLabelRanges, isUsingLabelCoordinates,
			isValidatingSources);
	}

	/**
	 * @param format The avar2 layout
	 * @return Options like these, with the given avar2 layout
	 */
	public DssOptions withAvar2Format(Avar2Format format) {
		return new DssOptions(thePolicy, format, theVariableThreshold, isUsingLabelRanges, isUsingLabelCoordinates,
			isValidatingSources);
	}

	/**
	 * @param threshold The variable extraction threshold, 0 to disable variables
	 * @return Options like these, with the given threshold
	 */
	public DssOptions withVariableThreshold(int threshold) {
		if (threshold < 0)
			throw new IllegalArgumentException("Variable threshold may not be negative: " + threshold);
		return new DssOptions(thePolicy, theAvar2Format, threshold, isUsingLabelRanges, isUsingLabelCoordinates, isValidatingSources);
	}

	/**
	 * @param labelRanges Whether to write label ranges
	 * @param labelCoordinates Whether to write label coordinates
	 * @return Options like these, with the given label settings
	 */
	public DssOptions withLabels(boolean labelRanges, boolean labelCoordinates) {
		return new DssOptions(thePolicy, theAvar2Format, theVariableThreshold, labelRanges, labelCoordinates, isValidatingSources);
	}

	/**
	 * @param validate Whether to check that source files exist
	 * @return Options like these, with the given source validation setting
	 */
	public DssOptions withSourceValidation(boolean validate) {
		return new DssOptions(thePolicy, theAvar2Format, theVariableThreshold, isUsingLabelRanges, isUsingLabelCoordinates, validate);
	}

	@Override
	public String toString() {
		return thePolicy + ", avar2 " + theAvar2Format.name().toLowerCase() + ", vars "
			+ (theVariableThreshold == 0 ? "off" : String.valueOf(theVariableThreshold));
	}
}
