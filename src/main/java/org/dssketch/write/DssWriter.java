package org.dssketch.write;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.dssketch.avar2.Avar2Formatter;
import org.dssketch.avar2.VariableTable;
import org.dssketch.config.DssOptions;
import org.dssketch.config.StandardLabels;
import org.dssketch.io.DssText;
import org.dssketch.model.Axis;
import org.dssketch.model.AxisKind;
import org.dssketch.model.AxisMapping;
import org.dssketch.model.DssDocument;
import org.dssketch.model.Instance;
import org.dssketch.model.InstanceMode;
import org.dssketch.model.Rule;
import org.dssketch.model.RuleCondition;
import org.dssketch.model.Source;
import org.dssketch.model.Substitution;
import org.dssketch.parse.DssParser;
import org.dssketch.parse.TypoChecker;
import org.dssketch.rules.RuleCompressor;

/**
 * Writes a {@link DssDocument} as DSSketch text. The writer prefers the most compact notation that reads back to the same
 * document: standard labels without their user values, labels instead of coordinates, wildcards instead of glyph lists, and
 * variables for repeated avar2 values.
 */
public class DssWriter {
	/** The indentation of one nesting level */
	public static final String INDENT = "    ";

	private final DssOptions theOptions;
	private final StandardLabels theLabels;
	private final Set<String> theGlyphNames;

	/** @param options The options for writing */
	public DssWriter(DssOptions options) {
		this(options, StandardLabels.get(), null);
	}

	/**
	 * @param options The options for writing
	 * @param labels The standard labels, to decide when user values can be omitted
	 * @param glyphNames The glyph names of the sources, used to compress rules into wildcards, or null if unknown
	 */
	public DssWriter(DssOptions options, StandardLabels labels, Set<String> glyphNames) {
		theOptions = options;
		theLabels = labels;
		theGlyphNames = glyphNames;
	}

	/**
	 * @param document The document to write
	 * @return The DSSketch text for the document
	 */
	public String write(DssDocument document) {
		List<String> lines = new ArrayList<>();
		writeHeader(document, lines);
		writeAxes(document, lines);
		writeSources(document, lines);
		writeAvar2(document, lines);
		writeRules(document, lines);
		writeInstances(document, lines);
		StringBuilder text = new StringBuilder();
		for (String line : lines)
			text.append(line).append('\n');
		return text.toString();
	}

	private static void section(List<String> lines) {
		if (!lines.isEmpty())
			lines.add("");
	}

	private void writeHeader(DssDocument document, List<String> lines) {
		if (document.getFamily() != null)
			lines.add("family " + DssText.quoteIfSpaces(document.getFamily()));
		if (document.getSuffix() != null)
			lines.add("suffix " + document.getSuffix());
		if (document.getPath() != null && !document.getPath().isEmpty())
			lines.add("path " + DssText.quoteIfSpaces(document.getPath()));
	}

	/* Axes */

	private void writeAxes(DssDocument document, List<String> lines) {
		section(lines);
		lines.add("axes");
		for (Axis axis : document.getAxes())
			writeAxis(axis, lines);
		if (!document.getHiddenAxes().isEmpty()) {
			lines.add("axes " + DssParser.HIDDEN_MODIFIER);
			for (Axis axis : document.getHiddenAxes())
				writeAxis(axis, lines);
		}
	}

	private void writeAxis(Axis axis, List<String> lines) {
		StringBuilder line = new StringBuilder(INDENT);
		AxisKind kind = axis.getKind();
		if (kind != AxisKind.CUSTOM && AxisKind.forName(axis.getName()) == kind)
			line.append(axis.getTag());
		else if (axis.getName().equals(axis.getTag()) && axis.getTag().equals(axis.getTag().toUpperCase()) && axis.getTag().length() == 4)
			line.append(axis.getTag());
		else
			line.append(DssText.quoteIfSpaces(axis.getName())).append(' ').append(axis.getTag());
		line.append(' ').append(formatRange(axis));
		if (axis.getDisplayName() != null && !axis.getDisplayName().equals(axis.getName()))
			line.append(" \"").append(axis.getDisplayName()).append('"');
		lines.add(line.toString());
		for (int i = 0; i < axis.getMappings().size(); i++)
			lines.add(INDENT + INDENT + formatMapping(axis, axis.getMappings().get(i), i));
	}

	String formatRange(Axis axis) {
		if (axis.isDiscrete()) {
			if (axis.getMinimum() == 0 && axis.getDefault() == 0 && axis.getMaximum() == 1)
				return "discrete";
			return DssText.formatNumber(axis.getMinimum()) + ":" + DssText.formatNumber(axis.getDefault()) + ":"
				+ DssText.formatNumber(axis.getMaximum()) + ":discrete";
		}
		if (theOptions.isUsingLabelRanges() && axis.getKind().hasStandardLabels()) {
			String min = theLabels.getLabelName(axis.getKind(), axis.getMinimum());
			String def = theLabels.getLabelName(axis.getKind(), axis.getDefault());
			String max = theLabels.getLabelName(axis.getKind(), axis.getMaximum());
			if (min != null && def != null && max != null)
				return min + ":" + def + ":" + max;
		}
		return DssText.formatNumber(axis.getMinimum()) + ":" + DssText.formatNumber(axis.getDefault()) + ":"
			+ DssText.formatNumber(axis.getMaximum());
	}

	String formatMapping(Axis axis, AxisMapping mapping, int index) {
		String label = DssText.quoteIfSpaces(mapping.getLabel());
		String flag = mapping.isElidable() ? " " + DssParser.ELIDABLE_FLAG : "";
		Integer discrete = theLabels.getDiscreteValue(axis.getTag(), mapping.getLabel());
		if (axis.isDiscrete() && mapping.getUserValue() == mapping.getDesignValue()
			&& mapping.getDesignValue() == (discrete != null ? discrete : index))
			return label + flag;
		String design = DssText.formatNumber(mapping.getDesignValue());
		if (impliedUserValue(axis, mapping) == mapping.getUserValue())
			return label + " > " + design + flag;
		return DssText.formatNumber(mapping.getUserValue()) + " " + label + " > " + design + flag;
	}

	/** The user value the parser infers for a mapping written without one */
	private double impliedUserValue(Axis axis, AxisMapping mapping) {
		Double standard = axis.getKind().hasStandardLabels() ? theLabels.getUserValue(axis.getKind(), mapping.getLabel()) : null;
		if (standard != null)
			return standard;
		Integer discrete = theLabels.getDiscreteValue(axis.getTag(), mapping.getLabel());
		if (discrete != null)
			return discrete;
		if (axis.getKind().hasStandardLabels()) {
			Set<String> vocabulary = new LinkedHashSet<>(theLabels.getLabelNames(AxisKind.WEIGHT));
			vocabulary.addAll(theLabels.getLabelNames(AxisKind.WIDTH));
			if (TypoChecker.suggest(mapping.getLabel(), vocabulary) != null)
				return Double.NaN; // Would be read as a misspelled standard label
		}
		return mapping.getDesignValue();
	}

	/* Sources */

	private void writeSources(DssDocument document, List<String> lines) {
		section(lines);
		boolean named = !document.getHiddenAxes().isEmpty();
		List<String> order = document.getSourceAxisOrder();
		if (named)
			lines.add("sources");
		else
			lines.add("sources [" + String.join(", ", order) + "]");
		for (Source source : document.getSources()) {
			StringBuilder line = new StringBuilder(INDENT).append(formatSourceName(source));
			String coords = named ? formatNamedLocation(document, source.getLocation())
				: formatPositionalLocation(document, order, source.getLocation());
			if (!coords.isEmpty())
				line.append(' ').append(coords);
			if (source.isBase())
				line.append(' ').append(DssParser.BASE_FLAG);
			if (source.getLayer() != null)
				line.append(' ').append(DssParser.LAYER_FLAG).append("=\"").append(source.getLayer()).append('"');
			lines.add(line.toString());
		}
	}

	static String formatSourceName(Source source) {
		String filename = source.getFilename();
		if (filename.equals(source.getName() + ".ufo"))
			return DssText.quoteIfSpaces(source.getName());
		if (filename.indexOf('/') >= 0 && filename.endsWith(".ufo"))
			return DssText.quoteIfSpaces(filename.substring(0, filename.length() - 4));
		return DssText.quoteIfSpaces(filename);
	}

	private String formatPositionalLocation(DssDocument document, List<String> order, Map<String, Double> location) {
		List<String> values = new ArrayList<>();
		for (String tag : order) {
			Axis axis = document.getAxis(tag);
			Double value = location.get(tag);
			values.add(formatCoordinate(axis, value != null ? value : axis.getDefaultDesignValue()));
		}
		return "[" + String.join(", ", values) + "]";
	}

	private String formatNamedLocation(DssDocument document, Map<String, Double> location) {
		List<String> values = new ArrayList<>();
		for (Axis axis : document.getAllAxes()) {
			Double value = location.get(axis.getTag());
			if (value != null && value != axis.getDefaultDesignValue())
				values.add(axis.getTag() + "=" + formatCoordinate(axis, value));
		}
		return String.join(", ", values);
	}

	private String formatCoordinate(Axis axis, double value) {
		if (theOptions.isUsingLabelCoordinates()) {
			AxisMapping mapping = axis.getMappingForDesign(value);
			if (mapping != null && mapping.getLabel().indexOf(' ') < 0 && DssText.parseNumber(mapping.getLabel()) == null)
				return mapping.getLabel();
		}
		return DssText.formatNumber(value);
	}

	/* Avar2 */

	private void writeAvar2(DssDocument document, List<String> lines) {
		if (document.getAvar2Mappings().isEmpty())
			return;
		VariableTable variables = VariableTable.extract(document, theOptions.getVariableThreshold());
		Avar2Formatter formatter = new Avar2Formatter(document, variables, INDENT);
		List<String> vars = formatter.formatVariables();
		if (!vars.isEmpty()) {
			section(lines);
			lines.addAll(vars);
		}
		section(lines);
		lines.addAll(formatter.formatMappings(theOptions.getAvar2Format()));
	}

	/* Rules */

	private void writeRules(DssDocument document, List<String> lines) {
		if (document.getRules().isEmpty())
			return;
		section(lines);
		lines.add("rules");
		RuleCompressor compressor = new RuleCompressor(theGlyphNames);
		for (Rule rule : document.getRules()) {
			Rule compressed = compressor.compress(rule);
			String suffix = formatConditions(document, compressed.getConditions());
			if (!compressed.isAutoNamed())
				suffix += " \"" + compressed.getName() + "\"";
			if (!compressed.getPatterns().isEmpty())
				lines.add(INDENT + String.join(" ", compressed.getPatterns()) + " > " + compressed.getTarget() + suffix);
			else {
				for (Substitution sub : compressed.getSubstitutions())
					lines.add(INDENT + sub.getFrom() + " > " + sub.getTo() + suffix);
			}
		}
	}

	String formatConditions(DssDocument document, List<RuleCondition> conditions) {
		if (conditions.isEmpty())
			return "";
		List<String> parts = new ArrayList<>();
		for (RuleCondition condition : conditions) {
			Axis axis = document.getAxis(condition.getAxisTag());
			String ref = axis != null && DssText.isIdentifier(axis.getName()) ? axis.getName() : condition.getAxisTag();
			if (condition.isExact())
				parts.add(ref + " == " + formatBound(axis, condition.getMinimum()));
			else if (condition.getMaximum() == null)
				parts.add(ref + " >= " + formatBound(axis, condition.getMinimum()));
			else if (condition.getMinimum() == null)
				parts.add(ref + " <= " + formatBound(axis, condition.getMaximum()));
			else
				parts.add(formatBound(axis, condition.getMinimum()) + " <= " + ref + " <= " + formatBound(axis, condition.getMaximum()));
		}
		return " (" + String.join(" && ", parts) + ")";
	}

	private String formatBound(Axis axis, double value) {
		return axis == null ? DssText.formatNumber(value) : formatCoordinate(axis, value);
	}

	/* Instances */

	private void writeInstances(DssDocument document, List<String> lines) {
		InstanceMode mode = document.getInstanceMode();
		if (mode == InstanceMode.AUTO && document.getSkips().isEmpty())
			return;
		section(lines);
		if (mode != InstanceMode.EXPLICIT) {
			lines.add("instances " + mode.keyword);
			if (!document.getSkips().isEmpty()) {
				lines.add(INDENT + DssParser.SKIP_KEYWORD);
				for (String skip : document.getSkips())
					lines.add(INDENT + INDENT + skip);
			}
			return;
		}
		lines.add("instances");
		boolean named = !document.getHiddenAxes().isEmpty();
		for (Instance instance : document.getInstances()) {
			String coords = named ? "[" + formatNamedLocation(document, instance.getLocation()) + "]"
				: formatPositionalLocation(document, document.getSourceAxisOrder(), instance.getLocation());
			lines.add(INDENT + instance.getStyleName() + " " + coords);
		}
	}
}
