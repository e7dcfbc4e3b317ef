package org.dssketch.rules;

import java.io.IOException;
import java.util.Set;

/** Supplies the glyph names contained in a font source */
public interface GlyphNameProvider {
	/**
	 * @param sourceFile The path of the source file, as resolved against the document's directory
	 * @return The names of the glyphs in the source
	 * @throws IOException If the source is missing or cannot be read
	 */
	Set<String> getGlyphNames(String sourceFile) throws IOException;
}
