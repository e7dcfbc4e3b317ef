package org.dssketch.avar2;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.dssketch.config.DssOptions;
import org.dssketch.io.DssText;
import org.dssketch.model.Avar2Mapping;
import org.dssketch.model.Avar2Variable;
import org.dssketch.model.Axis;
import org.dssketch.model.AxisMapping;
import org.dssketch.model.DssDocument;

/** Writes the avar2 sections of a document in linear or matrix notation */
public class Avar2Formatter {
	private final DssDocument theDocument;
	private final VariableTable theVariables;
	private final String theIndent;

	/**
	 * @param document The document to write the avar2 mappings of
	 * @param variables The variables to refer to in outputs
	 * @param indent The indentation for lines within a section
	 */
	public Avar2Formatter(DssDocument document, VariableTable variables, String indent) {
		theDocument = document;
		theVariables = variables;
		theIndent = indent;
	}

	/**
	 * @param format The preferred layout
	 * @return The layout to use: matrix only if it is preferred and the document has hidden axes
	 */
	public DssOptions.Avar2Format chooseFormat(DssOptions.Avar2Format format) {
		if (format == DssOptions.Avar2Format.MATRIX && !theDocument.getHiddenAxes().isEmpty())
			return DssOptions.Avar2Format.MATRIX;
		return DssOptions.Avar2Format.LINEAR;
	}

	/** @return The lines of the <code>avar2 vars</code> section, or an empty list if there are no variables */
	public List<String> formatVariables() {
		List<String> lines = new ArrayList<>();
		if (theVariables.getVariables().isEmpty())
			return lines;
		lines.add("avar2 vars");
		for (Avar2Variable var : theVariables.getVariables()) {
			StringBuilder line = new StringBuilder(theIndent).append(Avar2Parser.VARIABLE_PREFIX).append(var.getName()).append(" = ")
				.append(DssText.formatNumber(var.getValue()));
			int usage = theVariables.getUsage(var.getName());
			if (usage > 0)
				line.append("  # used ").append(usage).append(usage == 1 ? " time" : " times");
			lines.add(line.toString());
		}
		return lines;
	}

	/**
	 * @param format The preferred layout
	 * @return The lines of the avar2 mapping section, or an empty list if there are no mappings
	 */
	public List<String> formatMappings(DssOptions.Avar2Format format) {
		if (theDocument.getAvar2Mappings().isEmpty())
			return new ArrayList<>();
		if (chooseFormat(format) == DssOptions.Avar2Format.MATRIX)
			return formatMatrix();
		return formatLinear();
	}

	private List<String> formatLinear() {
		List<String> lines = new ArrayList<>();
		lines.add("avar2");
		for (Avar2Mapping mapping : theDocument.getAvar2Mappings()) {
			StringBuilder line = new StringBuilder(theIndent);
			if (mapping.getName() != null)
				line.append('"').append(mapping.getName()).append("\" ");
			line.append(formatInput(mapping)).append(" > ");
			line.append(DssText.print(", ", mapping.getOutput().entrySet(), //
				output -> output.getKey() + "=" + formatOutput(output.getKey(), output.getValue())));
			lines.add(line.toString());
		}
		return lines;
	}

	private List<String> formatMatrix() {
		Set<String> columns = new LinkedHashSet<>();
		for (Avar2Mapping mapping : theDocument.getAvar2Mappings())
			columns.addAll(mapping.getOutput().keySet());
		List<List<String>> rows = new ArrayList<>();
		List<String> header = new ArrayList<>();
		header.add(Avar2Parser.MATRIX_HEADER);
		header.addAll(columns);
		rows.add(header);
		for (Avar2Mapping mapping : theDocument.getAvar2Mappings()) {
			List<String> row = new ArrayList<>();
			String input = formatInput(mapping);
			row.add(mapping.getName() == null ? input : "\"" + mapping.getName() + "\" " + input);
			for (String column : columns) {
				Double value = mapping.getOutput().get(column);
				row.add(value == null ? Avar2Parser.NO_VALUE : formatOutput(column, value));
			}
			rows.add(row);
		}
		int[] widths = new int[columns.size() + 1];
		for (List<String> row : rows) {
			for (int i = 0; i < row.size(); i++)
				widths[i] = Math.max(widths[i], row.get(i).length());
		}
		List<String> lines = new ArrayList<>();
		lines.add("avar2 matrix");
		for (List<String> row : rows) {
			StringBuilder line = new StringBuilder(theIndent);
			for (int i = 0; i < row.size(); i++) {
				if (i > 0)
					line.append("  ");
				line.append(i == row.size() - 1 ? row.get(i) : DssText.padRight(row.get(i), widths[i]));
			}
			lines.add(line.toString());
		}
		return lines;
	}

	private String formatInput(Avar2Mapping mapping) {
		return "[" + DssText.print(", ", mapping.getInput().entrySet(), input -> input.getKey() + "=" + formatInputValue(input))
			+ "]";
	}

	private String formatInputValue(Map.Entry<String, Double> input) {
		Axis axis = theDocument.getAxis(input.getKey());
		if (axis != null) {
			AxisMapping label = axis.getMappingForUser(input.getValue());
			if (label != null)
				return label.getLabel();
		}
		return DssText.formatNumber(input.getValue());
	}

	private String formatOutput(String tag, double value) {
		if (VariableTable.isDefault(theDocument, tag, value))
			return Avar2Parser.VARIABLE_PREFIX;
		Avar2Variable var = theVariables.lookup(value);
		if (var != null)
			return Avar2Parser.VARIABLE_PREFIX + var.getName();
		return DssText.formatNumber(value);
	}
}
