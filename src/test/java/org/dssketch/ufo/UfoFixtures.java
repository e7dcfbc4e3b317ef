package org.dssketch.ufo;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Writes minimal UFO directories for tests */
public class UfoFixtures {
	private static final String PLIST_HEADER = String.join("\n", //
		"<?xml version=\"1.0\" encoding=\"UTF-8\"?>", //
		"<!DOCTYPE plist PUBLIC \"-//Apple//DTD PLIST 1.0//EN\" \"http://www.apple.com/DTDs/PropertyList-1.0.dtd\">", //
		"<plist version=\"1.0\">", //
		"<dict>", //
		"");

	private UfoFixtures() {
	}

	/**
	 * @param ufo The UFO directory to create
	 * @param family The family name to record in the font info, or null for no font info
	 * @param glyphs The names of the glyphs in the default layer
	 * @return The UFO directory
	 * @throws IOException If the files cannot be written
	 */
	public static Path createUfo(Path ufo, String family, String... glyphs) throws IOException {
		Files.createDirectories(ufo.resolve("glyphs"));
		if (family != null)
			writePlist(ufo.resolve(UfoFamilyMetadataProvider.FONT_INFO_FILE), //
				"\t<key>familyName</key>\n\t<string>" + family + "</string>\n\t<key>unitsPerEm</key>\n\t<integer>1000</integer>\n");
		StringBuilder contents = new StringBuilder();
		for (String glyph : glyphs)
			contents.append("\t<key>").append(glyph).append("</key>\n\t<string>").append(glyph).append(".glif</string>\n");
		writePlist(ufo.resolve(UfoGlyphNameProvider.CONTENTS_FILE), contents.toString());
		return ufo;
	}

	/**
	 * @param file The file to write
	 * @param entries The XML of the dictionary's entries
	 * @throws IOException If the file cannot be written
	 */
	public static void writePlist(Path file, String entries) throws IOException {
		Files.write(file, (PLIST_HEADER + entries + "</dict>\n</plist>\n").getBytes(StandardCharsets.UTF_8));
	}
}
