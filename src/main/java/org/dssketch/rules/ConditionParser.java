package org.dssketch.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.dssketch.io.Diagnostics;
import org.dssketch.io.DssParseException;
import org.dssketch.io.DssText;
import org.dssketch.io.SourcePosition;
import org.dssketch.model.Axis;
import org.dssketch.model.AxisMapping;
import org.dssketch.model.RuleCondition;
import org.dssketch.model.ScalarRef;

/**
 * Parses rule conditions like <code>weight >= Bold</code>, <code>400 <= wght <= 700</code> or
 * <code>wght >= 600 &amp;&amp; wdth <= 80</code>. Labels resolve to the design-space value of the axis mapping they name.
 */
public class ConditionParser {
	private static final Pattern RANGE = Pattern.compile("^(\\S+)\\s*<=\\s*(\\w+)\\s*<=\\s*(\\S+)$");
	private static final Pattern COMPARISON = Pattern.compile("^(\\w+)\\s*(>=|<=|==)\\s*(\\S+)$");

	private final List<Axis> theAxes;
	private final Diagnostics theDiagnostics;

	/**
	 * @param axes The axes conditions may refer to
	 * @param diagnostics The diagnostics to report problems to
	 */
	public ConditionParser(List<Axis> axes, Diagnostics diagnostics) {
		theAxes = axes;
		theDiagnostics = diagnostics;
	}

	/**
	 * @param text The condition text, without parentheses
	 * @param position The position of the condition in the text
	 * @return The parsed conditions. Conditions that cannot be parsed are reported and left out.
	 * @throws DssParseException If a fatal problem is found
	 */
	public List<RuleCondition> parse(String text, SourcePosition position) throws DssParseException {
		List<RuleCondition> conditions = new ArrayList<>();
		if (text.trim().isEmpty())
			return conditions;
		for (String part : text.split("&&")) {
			part = part.trim();
			RuleCondition condition = parsePart(part, position);
			if (condition != null)
				conditions.add(condition);
		}
		return conditions;
	}

	private RuleCondition parsePart(String part, SourcePosition position) throws DssParseException {
		Matcher m = RANGE.matcher(part);
		if (m.matches()) {
			Axis axis = findAxis(m.group(2), position);
			if (axis == null)
				return null;
			Double min = resolve(axis, m.group(1), position);
			Double max = resolve(axis, m.group(3), position);
			if (min == null || max == null)
				return null;
			if (min > max) {
				theDiagnostics.error(Diagnostics.Category.CONTENT, position,
					"Condition range on " + axis.getTag() + " is inverted: " + DssText.formatNumber(min) + " > " + DssText.formatNumber(max));
				return null;
			}
			return new RuleCondition(axis.getTag(), min, max);
		}
		m = COMPARISON.matcher(part);
		if (m.matches()) {
			Axis axis = findAxis(m.group(1), position);
			if (axis == null)
				return null;
			Double value = resolve(axis, m.group(3), position);
			if (value == null)
				return null;
			switch (m.group(2)) {
			case ">=":
				return new RuleCondition(axis.getTag(), value, null);
			case "<=":
				return new RuleCondition(axis.getTag(), null, value);
			default:
				return new RuleCondition(axis.getTag(), value, value);
			}
		}
		theDiagnostics.error(Diagnostics.Category.CONTENT, position,
			"Cannot parse condition '" + part + "': expected 'axis >= value', 'axis <= value', 'axis == value' or 'min <= axis <= max'");
		return null;
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
		theDiagnostics.error(Diagnostics.Category.SEMANTIC, position, "Rule condition references undeclared axis '" + ref + "'");
		return null;
	}

	private Double resolve(Axis axis, String token, SourcePosition position) throws DssParseException {
		ScalarRef ref = ScalarRef.parse(token);
		Double value = ref.resolve(label -> {
			AxisMapping mapping = axis.getMapping(label);
			return mapping == null ? null : mapping.getDesignValue();
		});
		if (value == null) {
			theDiagnostics.error(Diagnostics.Category.SEMANTIC, position,
				"Unknown label '" + ref + "' for axis " + axis.getTag() + " in rule condition");
			return null;
		}
		if (!axis.containsDesignValue(value)) {
			theDiagnostics.error(Diagnostics.Category.CONTENT, position,
				"Condition value " + DssText.formatNumber(value) + " is outside the design-space range of axis " + axis.getTag() + " ("
					+ DssText.formatNumber(axis.getDesignMinimum()) + " to " + DssText.formatNumber(axis.getDesignMaximum()) + ")");
		}
		return value;
	}
}
