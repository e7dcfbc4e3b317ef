package org.dssketch.avar2;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.dssketch.io.Diagnostics;
import org.dssketch.io.DssLine;
import org.dssketch.io.DssParseException;
import org.dssketch.io.DssText;
import org.dssketch.io.SourcePosition;
import org.dssketch.model.Avar2Mapping;
import org.dssketch.model.Avar2Variable;
import org.dssketch.model.Axis;
import org.dssketch.model.AxisMapping;
import org.dssketch.model.ScalarRef;

/**
 * <p>
 * Parses avar2 mappings in either of their two notations. Inputs are user-space locations whose values may be axis labels. Outputs
 * are design-space values, where <code>$</code> stands for the axis default and <code>$name</code> for a variable.
 * </p>
 * <p>
 * Linear form, one mapping per line: <code>"name" [opsz=Display, wght=Bold] > XOUC=84, YTUC=$</code>
 * </p>
 * <p>
 * Matrix form, a header of output axes followed by one row per mapping, with <code>-</code> for no output:
 * </p>
 *
 * <pre>
 * outputs     XOUC  YTUC
 * [opsz=144]  84    $
 * [wght=900]  -     $tall
 * </pre>
 */
public class Avar2Parser {
	/** The optional first word of a matrix header */
	public static final String MATRIX_HEADER = "outputs";
	/** The cell value meaning "no output" in a matrix row */
	public static final String NO_VALUE = "-";
	/** The prefix of variable references, and alone, the axis default */
	public static final String VARIABLE_PREFIX = "$";

	private final List<Axis> theAxes;
	private final Map<String, Avar2Variable> theVariables;
	private final Diagnostics theDiagnostics;

	/**
	 * @param axes All axes of the document, visible and hidden
	 * @param variables The variables outputs may refer to
	 * @param diagnostics The diagnostics to report problems to
	 */
	public Avar2Parser(List<Axis> axes, List<Avar2Variable> variables, Diagnostics diagnostics) {
		theAxes = axes;
		theVariables = new LinkedHashMap<>();
		for (Avar2Variable var : variables)
			theVariables.put(var.getName(), var);
		theDiagnostics = diagnostics;
	}

	/**
	 * Parses a variable declaration like <code>$tall = 790</code>
	 *
	 * @param line The line to parse
	 * @param diagnostics The diagnostics to report problems to
	 * @return The variable, or null if the line is not a valid declaration
	 * @throws DssParseException If a fatal problem is found
	 */
	public static Avar2Variable parseVariable(DssLine line, Diagnostics diagnostics) throws DssParseException {
		String text = line.getText();
		int eq = text.indexOf('=');
		if (eq < 0 || !text.startsWith(VARIABLE_PREFIX)) {
			diagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(),
				"Expected a variable declaration like '$name = value': " + text);
			return null;
		}
		String name = text.substring(1, eq).trim();
		if (!DssText.isIdentifier(name)) {
			diagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(), "Invalid variable name '" + name + "'");
			return null;
		}
		String valueText = text.substring(eq + 1).trim();
		Double value = DssText.parseNumber(valueText);
		if (value == null) {
			diagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(eq + 1),
				"Variable $" + name + " needs a numeric value, not '" + valueText + "'");
			return null;
		}
		return new Avar2Variable(name, value);
	}

	/**
	 * @param line A line in the linear notation
	 * @return The mapping, or null if the line could not be parsed
	 * @throws DssParseException If a fatal problem is found
	 */
	public Avar2Mapping parseLinear(DssLine line) throws DssParseException {
		String text = line.getText();
		String name = null;
		if (text.startsWith("\"")) {
			int close = text.indexOf('"', 1);
			if (close < 0) {
				theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(), "Unterminated mapping name");
				return null;
			}
			name = text.substring(1, close);
			text = text.substring(close + 1).trim();
		}
		int close = text.indexOf(']');
		if (!text.startsWith("[") || close < 0) {
			reportBrackets(line, text);
			return null;
		}
		Map<String, Double> input = parseInput(text.substring(1, close), line.getPosition());
		String rest = text.substring(close + 1).trim();
		if (!rest.startsWith(">")) {
			theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(),
				"Expected '>' followed by outputs after the input of an avar2 mapping");
			return null;
		}
		Map<String, Double> output = new LinkedHashMap<>();
		for (String assignment : DssText.split(rest.substring(1).trim(), ',')) {
			int eq = assignment.indexOf('=');
			if (eq <= 0) {
				theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(),
					"Expected 'AXIS=value' in avar2 output, not '" + assignment + "'");
				continue;
			}
			Axis axis = findAxis(assignment.substring(0, eq).trim(), line.getPosition());
			if (axis == null)
				continue;
			String cell = assignment.substring(eq + 1).trim();
			if (cell.equals(NO_VALUE)) {
				theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(),
					"'" + NO_VALUE + "' is only allowed in avar2 matrix rows; leave the axis out of the outputs instead");
				continue;
			}
			Double value = parseOutput(axis, cell, line.getPosition());
			if (value != null)
				output.put(axis.getTag(), value);
		}
		if (input == null || output.isEmpty())
			return null;
		return new Avar2Mapping(name, input, output);
	}

	/**
	 * @param lines The lines of a matrix section: the header, then the rows
	 * @return The mappings of the matrix
	 * @throws DssParseException If a fatal problem is found
	 */
	public List<Avar2Mapping> parseMatrix(List<DssLine> lines) throws DssParseException {
		List<Avar2Mapping> mappings = new ArrayList<>();
		if (lines.isEmpty())
			return mappings;
		DssLine header = lines.get(0);
		List<String> headerWords = DssText.words(header.getText());
		if (!headerWords.isEmpty() && headerWords.get(0).equals(MATRIX_HEADER))
			headerWords = headerWords.subList(1, headerWords.size());
		List<Axis> columns = new ArrayList<>();
		for (String word : headerWords) {
			Axis axis = findAxis(word, header.getPosition());
			columns.add(axis);
		}
		if (columns.isEmpty()) {
			theDiagnostics.error(Diagnostics.Category.CONTENT, header.getPosition(), "The avar2 matrix header names no output axes");
			return mappings;
		}
		for (DssLine row : lines.subList(1, lines.size())) {
			Avar2Mapping mapping = parseRow(row, columns);
			if (mapping != null)
				mappings.add(mapping);
		}
		return mappings;
	}

	private Avar2Mapping parseRow(DssLine row, List<Axis> columns) throws DssParseException {
		String text = row.getText();
		String name = null;
		if (text.startsWith("\"")) {
			int close = text.indexOf('"', 1);
			if (close < 0) {
				theDiagnostics.error(Diagnostics.Category.CONTENT, row.getPosition(), "Unterminated mapping name");
				return null;
			}
			name = text.substring(1, close);
			text = text.substring(close + 1).trim();
		}
		int close = text.indexOf(']');
		if (!text.startsWith("[") || close < 0) {
			reportBrackets(row, text);
			return null;
		}
		Map<String, Double> input = parseInput(text.substring(1, close), row.getPosition());
		List<String> cells = DssText.words(text.substring(close + 1));
		if (cells.size() != columns.size()) {
			theDiagnostics.error(Diagnostics.Category.CONTENT, row.getPosition(),
				"avar2 matrix row has " + cells.size() + " value(s) but the header declares " + columns.size() + " output axes");
			return null;
		}
		Map<String, Double> output = new LinkedHashMap<>();
		for (int i = 0; i < cells.size(); i++) {
			Axis axis = columns.get(i);
			if (axis == null || cells.get(i).equals(NO_VALUE))
				continue;
			Double value = parseOutput(axis, cells.get(i), row.getPosition());
			if (value != null)
				output.put(axis.getTag(), value);
		}
		if (input == null || output.isEmpty())
			return null;
		return new Avar2Mapping(name, input, output);
	}

	private void reportBrackets(DssLine line, String text) throws DssParseException {
		if (text.startsWith("("))
			theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(), "Use [] for avar2 inputs, not ()");
		else
			theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(),
				"Expected an input location in brackets, like [wght=Bold]: " + line.getText());
	}

	private Map<String, Double> parseInput(String content, SourcePosition position) throws DssParseException {
		Map<String, Double> input = new LinkedHashMap<>();
		boolean ok = true;
		for (String part : DssText.split(content, ',')) {
			int eq = part.indexOf('=');
			if (eq <= 0) {
				theDiagnostics.error(Diagnostics.Category.CONTENT, position, "Expected 'axis=value' in avar2 input, not '" + part + "'");
				ok = false;
				continue;
			}
			Axis axis = findAxis(part.substring(0, eq).trim(), position);
			if (axis == null) {
				ok = false;
				continue;
			}
			ScalarRef ref = ScalarRef.parse(part.substring(eq + 1).trim());
			Double value = ref.resolve(label -> {
				AxisMapping mapping = axis.getMapping(label);
				return mapping == null ? null : mapping.getUserValue();
			});
			if (value == null) {
				theDiagnostics.error(Diagnostics.Category.SEMANTIC, position,
					"Unknown label '" + ref + "' for axis " + axis.getTag() + " in avar2 input");
				ok = false;
				continue;
			}
			if (!axis.containsUserValue(value))
				theDiagnostics.error(Diagnostics.Category.CONTENT, position, "avar2 input " + axis.getTag() + "="
					+ DssText.formatNumber(value) + " is outside the axis range " + DssText.formatNumber(axis.getMinimum()) + ":"
					+ DssText.formatNumber(axis.getMaximum()));
			input.put(axis.getTag(), value);
		}
		if (input.isEmpty() && ok) {
			theDiagnostics.error(Diagnostics.Category.CONTENT, position, "avar2 mapping has an empty input");
			return null;
		}
		return ok ? input : null;
	}

	private Double parseOutput(Axis axis, String cell, SourcePosition position) throws DssParseException {
		if (cell.equals(VARIABLE_PREFIX))
			return axis.getDefaultDesignValue();
		if (cell.startsWith(VARIABLE_PREFIX)) {
			Avar2Variable var = theVariables.get(cell.substring(1));
			if (var == null) {
				theDiagnostics.error(Diagnostics.Category.SEMANTIC, position, "Undefined avar2 variable " + cell);
				return null;
			}
			return var.getValue();
		}
		Double value = DssText.parseNumber(cell);
		if (value == null) {
			AxisMapping mapping = axis.getMapping(cell);
			if (mapping != null)
				return mapping.getDesignValue();
			theDiagnostics.error(Diagnostics.Category.CONTENT, position,
				"Invalid avar2 output value '" + cell + "' for axis " + axis.getTag());
		}
		return value;
	}

	private Axis findAxis(String ref, SourcePosition position) throws DssParseException {
		for (Axis axis : theAxes) {
			if (axis.getTag().equals(ref))
				return axis;
		}
		for (Axis axis : theAxes) {
			if (axis.isIdentifiedBy(ref))
				return axis;
		}
		theDiagnostics.error(Diagnostics.Category.SEMANTIC, position, "avar2 mapping references undeclared axis '" + ref + "'");
		return null;
	}
}
