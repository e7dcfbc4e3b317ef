package org.dssketch.model;

/** How the instances of a document are determined */
public enum InstanceMode {
	/** All label combinations, minus skipped ones */
	AUTO("auto"),
	/** No instances */
	OFF("off"),
	/** Only the instances listed in the document */
	EXPLICIT(null);

	/** The word following the instances keyword for this mode, or null if there is none */
	public final String keyword;

	private InstanceMode(String keyword) {
		this.keyword = keyword;
	}
}
