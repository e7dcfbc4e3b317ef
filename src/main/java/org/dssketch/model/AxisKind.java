package org.dssketch.model;

/** The registered kinds of axis, plus {@link #CUSTOM} for everything else */
public enum AxisKind {
	/** Weight, tag wght */
	WEIGHT("wght", "weight"),
	/** Width, tag wdth */
	WIDTH("wdth", "width"),
	/** Italic, tag ital */
	ITALIC("ital", "italic"),
	/** Slant, tag slnt */
	SLANT("slnt", "slant"),
	/** Optical size, tag opsz */
	OPTICAL("opsz", "optical"),
	/** Any axis that is not registered */
	CUSTOM(null, null);

	/** The registered 4-letter tag, or null for {@link #CUSTOM} */
	public final String tag;
	/** The standard name of the axis, or null for {@link #CUSTOM} */
	public final String standardName;

	private AxisKind(String tag, String standardName) {
		this.tag = tag;
		this.standardName = standardName;
	}

	/** @return Whether this kind has a standard label vocabulary (weight or width) */
	public boolean hasStandardLabels() {
		return this == WEIGHT || this == WIDTH;
	}

	/**
	 * @param tag The axis tag
	 * @return The registered axis kind with the given tag, or {@link #CUSTOM}
	 */
	public static AxisKind forTag(String tag) {
		for (AxisKind kind : values()) {
			if (kind.tag != null && kind.tag.equals(tag))
				return kind;
		}
		return CUSTOM;
	}

	/**
	 * @param name The axis name, in any case
	 * @return The registered axis kind with the given standard name, or {@link #CUSTOM}
	 */
	public static AxisKind forName(String name) {
		String lower = name.toLowerCase();
		if (lower.equals("optical size") || lower.equals("opticalsize"))
			return OPTICAL;
		for (AxisKind kind : values()) {
			if (kind.standardName != null && kind.standardName.equals(lower))
				return kind;
		}
		return CUSTOM;
	}

	/**
	 * @param name The axis name
	 * @return The tag to use for an axis declared only by name: the registered tag if the name is standard, otherwise the first four
	 *         characters of the name in upper case
	 */
	public static String inferTag(String name) {
		AxisKind kind = forName(name);
		if (kind != CUSTOM)
			return kind.tag;
		String upper = name.toUpperCase();
		return upper.length() <= 4 ? upper : upper.substring(0, 4);
	}
}
