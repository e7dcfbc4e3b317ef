package org.dssketch;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

import org.apache.log4j.Logger;
import org.dssketch.config.DssOptions;
import org.dssketch.config.StandardLabels;
import org.dssketch.designspace.DesignSpaceConverter;
import org.dssketch.designspace.DesignSpaceReader;
import org.dssketch.io.Diagnostics;
import org.dssketch.io.DssParseException;
import org.dssketch.model.DssDocument;
import org.dssketch.parse.DssParser;
import org.dssketch.ufo.UfoFamilyMetadataProvider;
import org.dssketch.ufo.UfoGlyphNameProvider;
import org.dssketch.ufo.UfoSourceValidator;
import org.dssketch.write.DssWriter;

/**
 * Entry point for converting between the DSSketch notation and designspace XML.
 *
 * <p>
 * Text-level methods work without touching the file system unless a base directory is given. With a base directory, sources are
 * read as UFOs to detect the family name, expand wildcard rules and compress rules back into wildcards.
 * </p>
 */
public class DSSketch {
	private static final Logger log = Logger.getLogger(DSSketch.class);

	/** The preferred extension of DSSketch files */
	public static final String DSS_EXTENSION = ".dssketch";
	/** The short extension of DSSketch files */
	public static final String DSS_SHORT_EXTENSION = ".dss";
	/** The extension of designspace files */
	public static final String DESIGNSPACE_EXTENSION = ".designspace";

	private DSSketch() {
	}

	/**
	 * @param text The DSSketch text
	 * @param options The options to parse with
	 * @return The parsed document
	 * @throws DssParseException If the text is invalid under the options' validation policy
	 */
	public static DssDocument parseDss(String text, DssOptions options) throws DssParseException {
		return parseDss(text, new Diagnostics(options.getPolicy()));
	}

	/**
	 * @param text The DSSketch text
	 * @param diagnostics The diagnostics to collect problems in
	 * @return The parsed document
	 * @throws DssParseException If the text is invalid under the diagnostics' validation policy
	 */
	public static DssDocument parseDss(String text, Diagnostics diagnostics) throws DssParseException {
		return new DssParser(StandardLabels.get(), diagnostics).parse(text);
	}

	/**
	 * @param document The document to convert
	 * @param baseDir The directory the document's sources are relative to, or null to convert without reading sources
	 * @param options The conversion options
	 * @return The designspace XML text
	 * @throws DssParseException If the document cannot be converted under the options' validation policy
	 */
	public static String toDesignSpace(DssDocument document, Path baseDir, DssOptions options) throws DssParseException {
		return toDesignSpace(document, baseDir, options, new Diagnostics(options.getPolicy()));
	}

	/**
	 * @param document The document to convert
	 * @param baseDir The directory the document's sources are relative to, or null to convert without reading sources
	 * @param options The conversion options
	 * @param diagnostics The diagnostics to collect problems in
	 * @return The designspace XML text
	 * @throws DssParseException If the document cannot be converted under the diagnostics' validation policy
	 */
	public static String toDesignSpace(DssDocument document, Path baseDir, DssOptions options, Diagnostics diagnostics)
		throws DssParseException {
		DesignSpaceConverter converter;
		if (baseDir == null)
			converter = new DesignSpaceConverter(diagnostics, null, null);
		else {
			if (options.isValidatingSources())
				new UfoSourceValidator(baseDir, diagnostics).validate(document);
			converter = new DesignSpaceConverter(diagnostics, new UfoGlyphNameProvider(baseDir),
				new UfoFamilyMetadataProvider(baseDir));
		}
		return converter.convert(document).toXmlString();
	}

	/**
	 * @param xml The designspace XML text
	 * @param options The options to read with
	 * @return The document
	 * @throws DssParseException If the XML is not a valid designspace under the options' validation policy
	 */
	public static DssDocument fromDesignSpace(String xml, DssOptions options) throws DssParseException {
		return new DesignSpaceReader(new Diagnostics(options.getPolicy())).readString(xml);
	}

	/**
	 * @param document The document to write
	 * @param options The writing options
	 * @return The DSSketch text
	 */
	public static String writeDss(DssDocument document, DssOptions options) {
		return new DssWriter(options).write(document);
	}

	/**
	 * @param document The document to write
	 * @param baseDir The directory the document's sources are relative to, for reading glyph names to compress rules with
	 * @param options The writing options
	 * @param diagnostics The diagnostics to report unreadable sources to
	 * @return The DSSketch text
	 * @throws DssParseException If the diagnostics policy considers an unreadable source fatal
	 */
	public static String writeDss(DssDocument document, Path baseDir, DssOptions options, Diagnostics diagnostics)
		throws DssParseException {
		Set<String> glyphNames = null;
		if (baseDir != null && !document.getRules().isEmpty())
			glyphNames = new DesignSpaceConverter(diagnostics, new UfoGlyphNameProvider(baseDir), null).collectGlyphNames(document);
		return new DssWriter(options, StandardLabels.get(), glyphNames).write(document);
	}

	/**
	 * Converts a file in either direction, as determined by its extension
	 *
	 * @param input The DSSketch or designspace file to convert
	 * @param output The file to write, or null to write next to the input with the other extension
	 * @param options The conversion options
	 * @return The file written
	 * @throws IOException If a file cannot be read or written, or the input's extension is not recognized
	 * @throws DssParseException If the input is invalid under the options' validation policy
	 */
	public static Path convertFile(Path input, Path output, DssOptions options) throws IOException, DssParseException {
		String fileName = input.getFileName().toString();
		String lower = fileName.toLowerCase(Locale.ROOT);
		Path baseDir = input.toAbsolutePath().getParent();
		Diagnostics diagnostics = new Diagnostics(options.getPolicy());
		String converted;
		Path target;
		if (lower.endsWith(DSS_EXTENSION) || lower.endsWith(DSS_SHORT_EXTENSION)) {
			target = output != null ? output : input.resolveSibling(stem(fileName) + DESIGNSPACE_EXTENSION);
			log.info("Converting " + input + " to " + target);
			DssDocument document = parseDss(new String(Files.readAllBytes(input), StandardCharsets.UTF_8), diagnostics);
			converted = toDesignSpace(document, baseDir, options, diagnostics);
		} else if (lower.endsWith(DESIGNSPACE_EXTENSION)) {
			target = output != null ? output : input.resolveSibling(stem(fileName) + DSS_EXTENSION);
			log.info("Converting " + input + " to " + target);
			DssDocument document = new DesignSpaceReader(diagnostics).read(input);
			converted = writeDss(document, baseDir, options, diagnostics);
		} else
			throw new IOException("Unrecognized file type: " + input + " (expected " + DSS_EXTENSION + ", " + DSS_SHORT_EXTENSION
				+ " or " + DESIGNSPACE_EXTENSION + ")");
		Files.write(target, converted.getBytes(StandardCharsets.UTF_8));
		if (!diagnostics.getIssues().isEmpty())
			log.info(diagnostics.getIssues().size() + " issue(s) reported while converting " + input);
		return target;
	}

	private static String stem(String fileName) {
		int dot = fileName.lastIndexOf('.');
		return dot > 0 ? fileName.substring(0, dot) : fileName;
	}
}
