package org.dssketch.avar2;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.dssketch.io.DssText;
import org.dssketch.model.Avar2Mapping;
import org.dssketch.model.Avar2Variable;
import org.dssketch.model.Axis;
import org.dssketch.model.DssDocument;

/** The avar2 variables to write for a document, with the number of outputs that use each one */
public class VariableTable {
	private final List<Avar2Variable> theVariables;
	private final Map<String, Integer> theUsage;

	private VariableTable(List<Avar2Variable> variables, Map<String, Integer> usage) {
		theVariables = Collections.unmodifiableList(variables);
		theUsage = Collections.unmodifiableMap(usage);
	}

	/** @return A table with no variables */
	public static VariableTable empty() {
		return new VariableTable(new ArrayList<>(), new LinkedHashMap<>());
	}

	/**
	 * Builds the variable table for a document. The document's own variables are kept, and any design value which occurs among the
	 * avar2 outputs at least <code>threshold</code> times (not counting outputs equal to their axis default) and which no variable
	 * covers yet is extracted into a new variable.
	 *
	 * @param document The document
	 * @param threshold The number of occurrences at which a value is extracted, or 0 to write no variables at all
	 * @return The variable table
	 */
	public static VariableTable extract(DssDocument document, int threshold) {
		if (threshold <= 0)
			return empty();
		Map<Double, Integer> counts = new LinkedHashMap<>();
		Map<Double, Set<String>> axesByValue = new LinkedHashMap<>();
		for (Avar2Mapping mapping : document.getAvar2Mappings()) {
			for (Map.Entry<String, Double> output : mapping.getOutput().entrySet()) {
				if (isDefault(document, output.getKey(), output.getValue()))
					continue;
				counts.merge(output.getValue(), 1, Integer::sum);
				axesByValue.computeIfAbsent(output.getValue(), v -> new LinkedHashSet<>()).add(output.getKey());
			}
		}
		List<Avar2Variable> variables = new ArrayList<>(document.getVariables());
		Set<String> names = new LinkedHashSet<>();
		Set<Double> covered = new LinkedHashSet<>();
		for (Avar2Variable var : variables) {
			names.add(var.getName());
			covered.add(var.getValue());
		}
		for (Map.Entry<Double, Integer> count : counts.entrySet()) {
			if (count.getValue() < threshold || covered.contains(count.getKey()))
				continue;
			Set<String> axes = axesByValue.get(count.getKey());
			String base = (axes.size() == 1 ? axes.iterator().next() : "val") + "_"
				+ DssText.formatNumber(count.getKey()).replace('.', '_').replace('-', 'm');
			String name = base;
			for (int i = 2; names.contains(name); i++)
				name = base + "_" + i;
			names.add(name);
			covered.add(count.getKey());
			variables.add(new Avar2Variable(name, count.getKey()));
		}
		Map<String, Integer> usage = new LinkedHashMap<>();
		for (Avar2Variable var : variables)
			usage.put(var.getName(), counts.getOrDefault(var.getValue(), 0));
		return new VariableTable(variables, usage);
	}

	static boolean isDefault(DssDocument document, String tag, double value) {
		Axis axis = document.getAxis(tag);
		return axis != null && axis.getDefaultDesignValue() == value;
	}

	/** @return The variables, in declaration order */
	public List<Avar2Variable> getVariables() {
		return theVariables;
	}

	/**
	 * @param variableName The name of the variable
	 * @return The number of outputs with the variable's value
	 */
	public int getUsage(String variableName) {
		Integer usage = theUsage.get(variableName);
		return usage == null ? 0 : usage;
	}

	/**
	 * @param value The design value
	 * @return The first variable with the given value, or null
	 */
	public Avar2Variable lookup(double value) {
		for (Avar2Variable var : theVariables) {
			if (var.getValue() == value)
				return var;
		}
		return null;
	}
}
