package org.dssketch.parse;

import java.util.ArrayList;
import java.util.List;

import org.dssketch.io.Diagnostics;
import org.dssketch.io.DssParseException;
import org.dssketch.io.DssText;
import org.dssketch.io.SourcePosition;
import org.dssketch.model.Axis;
import org.dssketch.model.AxisMapping;
import org.dssketch.model.DssDocument;
import org.dssketch.model.InstanceMode;
import org.dssketch.model.Source;

/**
 * Checks a parsed document for things that are legal but probably mistakes. Everything found here is a warning:
 * <ul>
 * <li>The base source is not at the default location</li>
 * <li>A source coordinate matches none of its axis's labels</li>
 * <li>No source lies at one end of an axis</li>
 * <li>An axis has labels but none is elidable, so every generated instance name carries it</li>
 * </ul>
 */
public class DocumentValidator {
	private final Diagnostics theDiagnostics;

	/** @param diagnostics The diagnostics to report to */
	public DocumentValidator(Diagnostics diagnostics) {
		theDiagnostics = diagnostics;
	}

	/**
	 * @param document The document to check
	 * @throws DssParseException If the diagnostics policy considers a warning fatal
	 */
	public void validate(DssDocument document) throws DssParseException {
		checkBaseLocation(document);
		checkSourceLabels(document);
		checkExtremes(document);
		if (document.getInstanceMode() == InstanceMode.AUTO)
			checkElidable(document);
	}

	private void checkBaseLocation(DssDocument document) throws DssParseException {
		Source base = document.getBaseSource();
		if (base == null)
			return;
		List<String> offsets = new ArrayList<>();
		for (Axis axis : document.getAllAxes()) {
			double value = base.getCoordinate(axis.getTag(), axis.getDefaultDesignValue());
			if (value != axis.getDefaultDesignValue())
				offsets.add(axis.getTag() + "=" + DssText.formatNumber(value) + " (default "
					+ DssText.formatNumber(axis.getDefaultDesignValue()) + ")");
		}
		if (!offsets.isEmpty())
			theDiagnostics.warn(Diagnostics.Category.ADVISORY, SourcePosition.NONE,
				"Base source " + base.getName() + " is not at the default location: " + String.join(", ", offsets));
	}

	private void checkSourceLabels(DssDocument document) throws DssParseException {
		for (Source source : document.getSources()) {
			for (Axis axis : document.getAxes()) {
				if (axis.getMappings().isEmpty())
					continue;
				double value = source.getCoordinate(axis.getTag(), axis.getDefaultDesignValue());
				if (axis.getMappingForDesign(value) == null)
					theDiagnostics.warn(Diagnostics.Category.ADVISORY, SourcePosition.NONE, "Source " + source.getName() + " has "
						+ axis.getTag() + "=" + DssText.formatNumber(value) + ", which matches none of the axis's labels");
			}
		}
	}

	private void checkExtremes(DssDocument document) throws DssParseException {
		if (document.getSources().isEmpty())
			return;
		for (Axis axis : document.getAxes()) {
			boolean hasMin = false;
			boolean hasMax = false;
			for (Source source : document.getSources()) {
				double value = source.getCoordinate(axis.getTag(), axis.getDefaultDesignValue());
				hasMin |= value == axis.getDesignMinimum();
				hasMax |= value == axis.getDesignMaximum();
			}
			if (!hasMin)
				theDiagnostics.warn(Diagnostics.Category.ADVISORY, SourcePosition.NONE, "No source at the minimum of axis "
					+ axis.getTag() + " (" + DssText.formatNumber(axis.getDesignMinimum()) + ")");
			if (!hasMax)
				theDiagnostics.warn(Diagnostics.Category.ADVISORY, SourcePosition.NONE, "No source at the maximum of axis "
					+ axis.getTag() + " (" + DssText.formatNumber(axis.getDesignMaximum()) + ")");
		}
	}

	private void checkElidable(DssDocument document) throws DssParseException {
		for (Axis axis : document.getAxes()) {
			if (axis.getMappings().size() < 2)
				continue;
			boolean elidable = false;
			for (AxisMapping mapping : axis.getMappings())
				elidable |= mapping.isElidable();
			if (!elidable)
				theDiagnostics.warn(Diagnostics.Category.ADVISORY, SourcePosition.NONE, "Axis " + axis.getTag()
					+ " has no @elidable label, so every generated instance name will include one of its labels");
		}
	}
}
