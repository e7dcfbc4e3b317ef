package org.dssketch.ufo;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.dssketch.designspace.FamilyMetadataProvider;

/** Reads the family name of a UFO source from its <code>fontinfo.plist</code> */
public class UfoFamilyMetadataProvider implements FamilyMetadataProvider {
	/** The font info file of a UFO */
	public static final String FONT_INFO_FILE = "fontinfo.plist";

	private final Path theBaseDir;

	/** @param baseDir The directory source file paths are resolved against */
	public UfoFamilyMetadataProvider(Path baseDir) {
		theBaseDir = baseDir;
	}

	@Override
	public String getFamilyName(String sourceFile) throws IOException {
		Path info = theBaseDir.resolve(sourceFile).resolve(FONT_INFO_FILE);
		if (!Files.isRegularFile(info))
			return null;
		String family = PlistReader.getString(PlistReader.readDict(info), "familyName");
		return family == null || family.trim().isEmpty() ? null : family.trim();
	}
}
