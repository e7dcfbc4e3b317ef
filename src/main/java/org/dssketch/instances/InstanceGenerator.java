package org.dssketch.instances;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.apache.log4j.Logger;
import org.dssketch.io.Diagnostics;
import org.dssketch.io.DssParseException;
import org.dssketch.io.DssText;
import org.dssketch.io.SourcePosition;
import org.dssketch.model.Avar2Mapping;
import org.dssketch.model.Axis;
import org.dssketch.model.AxisKind;
import org.dssketch.model.AxisMapping;
import org.dssketch.model.DssDocument;
import org.dssketch.model.Instance;
import org.dssketch.model.InstanceMode;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * <p>
 * Generates the instances of a document from its axis labels. Every combination of one label per visible axis is an instance. The
 * style name of an instance is its labels in axis order, with elidable labels dropped. If every label of a combination is
 * elidable, the weight label is kept, or failing that the label of the last axis.
 * </p>
 * <p>
 * Combinations whose final style name matches an entry of the document's skip list are left out. Skip entries naming labels that no
 * axis has are errors. Skip entries that never match are reported as warnings, since elision may keep a name from ever appearing.
 * </p>
 */
public class InstanceGenerator {
	private static final Logger log = Logger.getLogger(InstanceGenerator.class);

	/** One labeled point on an axis, as used for instance generation */
	public static class AxisPoint {
		/** The tag of the axis */
		public final String axisTag;
		/** The label of the point */
		public final String label;
		/** The design-space value of the point */
		public final double designValue;
		/** Whether the label may be dropped from style names */
		public final boolean elidable;

		AxisPoint(String axisTag, String label, double designValue, boolean elidable) {
			this.axisTag = axisTag;
			this.label = label;
			this.designValue = designValue;
			this.elidable = elidable;
		}

		@Override
		public String toString() {
			return label;
		}
	}

	private final Diagnostics theDiagnostics;

	/** @param diagnostics The diagnostics to report skip problems to */
	public InstanceGenerator(Diagnostics diagnostics) {
		theDiagnostics = diagnostics;
	}

	/**
	 * @param document The document
	 * @return The document's instances: none if instances are off, the declared ones if explicit, otherwise all generated ones
	 * @throws DssParseException If a skip entry names an unknown label
	 */
	public List<Instance> generate(DssDocument document) throws DssParseException {
		if (document.getInstanceMode() == InstanceMode.OFF)
			return ImmutableList.of();
		else if (document.getInstanceMode() == InstanceMode.EXPLICIT)
			return document.getInstances();
		validateSkips(document);

		List<List<AxisPoint>> pointSets = new ArrayList<>();
		for (Axis axis : document.getAxes())
			pointSets.add(getPoints(axis, document.getAvar2Mappings()));
		Map<String, List<String>> skips = new LinkedHashMap<>();
		for (String skip : document.getSkips())
			skips.put(skip, tokens(skip));
		Set<String> usedSkips = new LinkedHashSet<>();

		List<Instance> instances = new ArrayList<>();
		if (pointSets.isEmpty())
			return instances;
		for (List<AxisPoint> combination : Lists.cartesianProduct(pointSets)) {
			List<String> name = styleName(combination);
			String skipped = null;
			for (Map.Entry<String, List<String>> skip : skips.entrySet()) {
				if (skip.getValue().equals(name)) {
					skipped = skip.getKey();
					break;
				}
			}
			if (skipped != null) {
				usedSkips.add(skipped);
				continue;
			}
			Map<String, Double> location = new LinkedHashMap<>();
			for (AxisPoint point : combination)
				location.put(point.axisTag, point.designValue);
			instances.add(new Instance(document.getFamily(), String.join(" ", name), location, null));
		}
		for (String skip : skips.keySet()) {
			if (!usedSkips.contains(skip))
				theDiagnostics.warn(Diagnostics.Category.ADVISORY, SourcePosition.NONE, "Skip rule '" + skip
					+ "' never matched a generated instance. Check its spelling, and whether elidable labels were removed from the name.");
		}
		log.info("Generated " + instances.size() + " instance(s)"
			+ (usedSkips.isEmpty() ? "" : ", " + usedSkips.size() + " skip rule(s) applied"));
		return instances;
	}

	/**
	 * Checks that every label in the document's skip list belongs to some axis
	 *
	 * @param document The document
	 * @throws DssParseException If a skip entry names an unknown label
	 */
	public void validateSkips(DssDocument document) throws DssParseException {
		if (document.getSkips().isEmpty())
			return;
		Set<String> valid = new TreeSet<>();
		for (Axis axis : document.getAxes()) {
			for (AxisPoint point : getPoints(axis, document.getAvar2Mappings()))
				valid.addAll(tokens(point.label));
		}
		for (String skip : document.getSkips()) {
			for (String token : tokens(skip)) {
				if (!valid.contains(token)) {
					theDiagnostics.error(Diagnostics.Category.SEMANTIC, SourcePosition.NONE,
						"Skip rule '" + skip + "' references unknown label '" + token + "'. Valid labels: " + String.join(", ", valid));
				}
			}
		}
	}

	/**
	 * @param axis The axis
	 * @param avar2Mappings The document's avar2 mappings, whose inputs add points to axes without labels
	 * @return The points of the axis used to generate instances
	 */
	public static List<AxisPoint> getPoints(Axis axis, List<Avar2Mapping> avar2Mappings) {
		List<AxisPoint> points = new ArrayList<>();
		if (!axis.getMappings().isEmpty()) {
			for (AxisMapping mapping : axis.getMappings())
				points.add(new AxisPoint(axis.getTag(), mapping.getLabel(), mapping.getDesignValue(), mapping.isElidable()));
			return points;
		}
		Set<Double> userValues = new TreeSet<>(Arrays.asList(axis.getMinimum(), axis.getDefault(), axis.getMaximum()));
		for (Avar2Mapping mapping : avar2Mappings) {
			Double input = mapping.getInput().get(axis.getTag());
			if (input != null)
				userValues.add(input);
		}
		for (double user : userValues)
			points.add(new AxisPoint(axis.getTag(), axis.getTag() + DssText.formatNumber(user), axis.mapToDesign(user), false));
		return points;
	}

	/**
	 * @param combination One point per visible axis, in axis order
	 * @return The tokens of the style name for the combination, after elision
	 */
	public static List<String> styleName(List<AxisPoint> combination) {
		List<String> tokens = new ArrayList<>();
		for (AxisPoint point : combination) {
			if (!point.elidable)
				tokens.addAll(tokens(point.label));
		}
		if (tokens.isEmpty() && !combination.isEmpty()) {
			AxisPoint kept = combination.get(combination.size() - 1);
			for (AxisPoint point : combination) {
				if (AxisKind.forTag(point.axisTag) == AxisKind.WEIGHT) {
					kept = point;
					break;
				}
			}
			tokens.addAll(tokens(kept.label));
		}
		if (tokens.size() > 1 && tokens.contains("Italic"))
			tokens.remove("Regular");
		return tokens;
	}

	private static List<String> tokens(String name) {
		List<String> tokens = new ArrayList<>();
		for (String token : name.trim().split("\\s+")) {
			if (!token.isEmpty())
				tokens.add(token);
		}
		return tokens;
	}
}
