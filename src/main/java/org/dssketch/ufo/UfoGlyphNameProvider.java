package org.dssketch.ufo;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import org.apache.log4j.Logger;
import org.dssketch.rules.GlyphNameProvider;

/** Reads the glyph names of UFO sources from the keys of their default layer's <code>glyphs/contents.plist</code> */
public class UfoGlyphNameProvider implements GlyphNameProvider {
	private static final Logger log = Logger.getLogger(UfoGlyphNameProvider.class);

	/** The contents file of a UFO's default glyph layer */
	public static final String CONTENTS_FILE = "glyphs/contents.plist";

	private final Path theBaseDir;

	/** @param baseDir The directory source file paths are resolved against */
	public UfoGlyphNameProvider(Path baseDir) {
		theBaseDir = baseDir;
	}

	@Override
	public Set<String> getGlyphNames(String sourceFile) throws IOException {
		Path ufo = theBaseDir.resolve(sourceFile);
		if (!Files.isDirectory(ufo))
			throw new IOException("UFO source not found: " + ufo);
		Path contents = ufo.resolve(CONTENTS_FILE);
		if (!Files.isRegularFile(contents))
			throw new IOException("UFO source " + ufo + " has no " + CONTENTS_FILE);
		Set<String> names = new LinkedHashSet<>(PlistReader.readDict(contents).keySet());
		log.debug("Read " + names.size() + " glyph names from " + ufo);
		return Collections.unmodifiableSet(names);
	}
}
