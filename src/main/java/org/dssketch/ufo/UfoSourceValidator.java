package org.dssketch.ufo;

import java.nio.file.Files;
import java.nio.file.Path;

import org.dssketch.designspace.DesignSpaceWriter;
import org.dssketch.io.Diagnostics;
import org.dssketch.io.DssParseException;
import org.dssketch.io.SourcePosition;
import org.dssketch.io.ValidationPolicy;
import org.dssketch.model.DssDocument;
import org.dssketch.model.Source;

/** Checks that the source files of a document exist. A missing file is a warning, or an error under strict validation. */
public class UfoSourceValidator {
	private final Path theBaseDir;
	private final Diagnostics theDiagnostics;

	/**
	 * @param baseDir The directory source file paths are resolved against
	 * @param diagnostics The diagnostics to report missing files to
	 */
	public UfoSourceValidator(Path baseDir, Diagnostics diagnostics) {
		theBaseDir = baseDir;
		theDiagnostics = diagnostics;
	}

	/**
	 * @param document The document whose sources to check
	 * @return The number of missing source files
	 * @throws DssParseException If a source file is missing and validation is strict
	 */
	public int validate(DssDocument document) throws DssParseException {
		int missing = 0;
		for (Source source : document.getSources()) {
			String file = DesignSpaceWriter.sourcePath(document, source);
			if (Files.exists(theBaseDir.resolve(file)))
				continue;
			missing++;
			String message = "Source file not found: " + file;
			if (theDiagnostics.getPolicy() == ValidationPolicy.STRICT)
				theDiagnostics.error(Diagnostics.Category.CONTENT, SourcePosition.NONE, message);
			else
				theDiagnostics.warn(Diagnostics.Category.ADVISORY, SourcePosition.NONE, message);
		}
		return missing;
	}
}
