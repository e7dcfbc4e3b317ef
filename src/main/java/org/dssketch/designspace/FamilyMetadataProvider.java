package org.dssketch.designspace;

import java.io.IOException;

/** Supplies the family name recorded in a font source, for documents that do not declare one */
public interface FamilyMetadataProvider {
	/**
	 * @param sourceFile The path of the source file, as resolved against the document's directory
	 * @return The family name recorded in the source, or null if it records none
	 * @throws IOException If the source cannot be read
	 */
	String getFamilyName(String sourceFile) throws IOException;
}
