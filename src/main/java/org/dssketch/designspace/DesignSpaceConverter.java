package org.dssketch.designspace;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.apache.log4j.Logger;
import org.dssketch.instances.InstanceGenerator;
import org.dssketch.io.Diagnostics;
import org.dssketch.io.DssParseException;
import org.dssketch.io.SourcePosition;
import org.dssketch.model.DssDocument;
import org.dssketch.model.Instance;
import org.dssketch.model.Source;
import org.dssketch.rules.GlyphNameProvider;
import org.dssketch.rules.RuleResolver;

/**
 * Prepares a parsed document for designspace output: fills in the family name from the base source if the document has none,
 * expands wildcard rules against the glyphs of the sources and generates the instances.
 */
public class DesignSpaceConverter {
	private static final Logger log = Logger.getLogger(DesignSpaceConverter.class);

	/** A document ready to be written as designspace XML, with the instances to write */
	public static class Result {
		private final DssDocument theDocument;
		private final List<Instance> theInstances;

		Result(DssDocument document, List<Instance> instances) {
			theDocument = document;
			theInstances = instances;
		}

		/** @return The document, with a family name and resolved rules */
		public DssDocument getDocument() {
			return theDocument;
		}

		/** @return The instances to write */
		public List<Instance> getInstances() {
			return theInstances;
		}

		/** @return The designspace XML document */
		public org.jdom2.Document toXml() {
			return new DesignSpaceWriter().toXml(theDocument, theInstances);
		}

		/** @return The designspace XML text */
		public String toXmlString() {
			return new DesignSpaceWriter().writeToString(theDocument, theInstances);
		}
	}

	private final Diagnostics theDiagnostics;
	private final GlyphNameProvider theGlyphNames;
	private final FamilyMetadataProvider theFamilyMetadata;

	/**
	 * @param diagnostics The diagnostics to report problems to
	 * @param glyphNames Supplies the glyph names of the sources, or null if they are not available
	 * @param familyMetadata Supplies the family name of the base source, or null if it is not available
	 */
	public DesignSpaceConverter(Diagnostics diagnostics, GlyphNameProvider glyphNames, FamilyMetadataProvider familyMetadata) {
		theDiagnostics = diagnostics;
		theGlyphNames = glyphNames;
		theFamilyMetadata = familyMetadata;
	}

	/**
	 * @param document The parsed document
	 * @return The document with its instances, ready to write
	 * @throws DssParseException If no family name can be determined, or the diagnostics policy considers a problem fatal
	 */
	public Result convert(DssDocument document) throws DssParseException {
		DssDocument.Builder builder = document.toBuilder();
		String family = document.getFamily();
		if (family == null) {
			family = detectFamily(document);
			if (family == null)
				theDiagnostics.error(Diagnostics.Category.STRUCTURAL, SourcePosition.NONE,
					"No family name: declare one with 'family' or record it in the base source");
			builder.withFamily(family);
		}

		if (!document.getRules().isEmpty()) {
			Set<String> glyphNames = collectGlyphNames(document);
			builder.withRules(new RuleResolver(glyphNames, theDiagnostics).resolveAll(document.getRules()));
		}
		DssDocument resolved = builder.build();
		List<Instance> instances = new ArrayList<>();
		for (Instance instance : new InstanceGenerator(theDiagnostics).generate(resolved)) {
			if (instance.getFamilyName().isEmpty() && family != null)
				instance = new Instance(family, instance.getStyleName(), instance.getLocation(), null);
			instances.add(instance);
		}
		return new Result(resolved, Collections.unmodifiableList(instances));
	}

	private String detectFamily(DssDocument document) throws DssParseException {
		Source base = document.getBaseSource();
		if (base == null || theFamilyMetadata == null)
			return null;
		String file = DesignSpaceWriter.sourcePath(document, base);
		try {
			String family = theFamilyMetadata.getFamilyName(file);
			if (family != null)
				log.info("Using family name '" + family + "' from " + file);
			return family;
		} catch (IOException e) {
			theDiagnostics.warn(Diagnostics.Category.ADVISORY, SourcePosition.NONE,
				"Could not read the family name from " + file + ": " + e.getMessage());
			return null;
		}
	}

	/**
	 * @param document The document
	 * @return The union of the glyph names of all readable sources, or null if none could be read
	 * @throws DssParseException If the diagnostics policy considers an unreadable source fatal
	 */
	public Set<String> collectGlyphNames(DssDocument document) throws DssParseException {
		if (theGlyphNames == null)
			return null;
		Set<String> names = null;
		for (Source source : document.getSources()) {
			if (source.getLayer() != null)
				continue;
			String file = DesignSpaceWriter.sourcePath(document, source);
			try {
				Set<String> sourceNames = theGlyphNames.getGlyphNames(file);
				if (names == null)
					names = new TreeSet<>();
				names.addAll(sourceNames);
			} catch (IOException e) {
				theDiagnostics.warn(Diagnostics.Category.ADVISORY, SourcePosition.NONE,
					"Could not read the glyph names of " + file + ": " + e.getMessage());
			}
		}
		return names;
	}
}
