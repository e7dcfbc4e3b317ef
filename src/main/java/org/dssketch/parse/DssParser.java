package org.dssketch.parse;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;
import org.dssketch.avar2.Avar2Parser;
import org.dssketch.avar2.HiddenAxisInference;
import org.dssketch.config.StandardLabels;
import org.dssketch.instances.InstanceGenerator;
import org.dssketch.io.Diagnostics;
import org.dssketch.io.DssLine;
import org.dssketch.io.DssParseException;
import org.dssketch.io.DssText;
import org.dssketch.io.LineScanner;
import org.dssketch.io.SourcePosition;
import org.dssketch.io.ValidationPolicy;
import org.dssketch.model.Avar2Mapping;
import org.dssketch.model.Avar2Variable;
import org.dssketch.model.Axis;
import org.dssketch.model.AxisKind;
import org.dssketch.model.AxisMapping;
import org.dssketch.model.DssDocument;
import org.dssketch.model.Instance;
import org.dssketch.model.InstanceMode;
import org.dssketch.model.Rule;
import org.dssketch.model.RuleCondition;
import org.dssketch.model.ScalarRef;
import org.dssketch.model.Source;
import org.dssketch.model.Substitution;
import org.dssketch.rules.ConditionParser;
import org.dssketch.rules.RuleResolver;

import com.google.common.collect.ImmutableList;

/**
 * <p>
 * Builds a {@link DssDocument} from DSSketch text. The text is a sequence of sections, each introduced by a keyword line at the
 * top-level indentation and followed by the more deeply indented lines of its body:
 * </p>
 *
 * <pre>
 * family MyFont
 * path sources
 * axes
 *     wght 100:400:900
 *         Thin > 100
 *         Regular > 400 @elidable
 *         Black > 900
 *     ital discrete
 *         Upright @elidable
 *         Italic
 * sources [wght, ital]
 *     MyFont-Thin [Thin, Upright]
 *     MyFont-Regular [Regular, Upright] @base
 * rules
 *     dollar cent > .rvrn (weight >= Bold) "heavy alternates"
 * instances auto
 *     skip
 *         Thin Italic
 * </pre>
 * <p>
 * Sections are processed in dependency order regardless of the order they appear in, so that labels are known before they are
 * referred to. Problems are reported to a {@link Diagnostics} collector, whose policy decides whether parsing stops.
 * </p>
 */
public class DssParser {
	private static final Logger log = Logger.getLogger(DssParser.class);

	/** The flag marking a mapping whose label is left out of instance names */
	public static final String ELIDABLE_FLAG = "@elidable";
	/** The flag marking the base source */
	public static final String BASE_FLAG = "@base";
	/** The flag naming the layer of a source */
	public static final String LAYER_FLAG = "@layer";
	/** The keyword introducing skipped instance names */
	public static final String SKIP_KEYWORD = "skip";
	/** The modifier of the axes section declaring hidden axes */
	public static final String HIDDEN_MODIFIER = "hidden";

	private static final List<String> SOURCE_FLAGS = ImmutableList.of(BASE_FLAG, LAYER_FLAG);
	private static final List<String> INSTANCE_MODES = ImmutableList.of(InstanceMode.AUTO.keyword, InstanceMode.OFF.keyword);
	private static final List<String> DISCRETE_KEYWORDS = ImmutableList.of("discrete", "binary");

	private static class Section {
		final DssLine header;
		final String keyword;
		final String argument;
		final List<DssLine> body;

		Section(DssLine header, String keyword, String argument) {
			this.header = header;
			this.keyword = keyword;
			this.argument = argument;
			body = new ArrayList<>();
		}

		@Override
		public String toString() {
			return header.toString();
		}
	}

	private final StandardLabels theLabels;
	private final TypoChecker theTypos;
	private final Diagnostics theDiagnostics;

	/** @param diagnostics The diagnostics to report problems to */
	public DssParser(Diagnostics diagnostics) {
		this(StandardLabels.get(), diagnostics);
	}

	/**
	 * @param labels The standard label tables to resolve labels with
	 * @param diagnostics The diagnostics to report problems to
	 */
	public DssParser(StandardLabels labels, Diagnostics diagnostics) {
		theLabels = labels;
		theTypos = new TypoChecker(labels);
		theDiagnostics = diagnostics;
	}

	/** @return The diagnostics this parser reports problems to */
	public Diagnostics getDiagnostics() {
		return theDiagnostics;
	}

	/**
	 * @param text The DSSketch text to parse
	 * @param policy The validation policy
	 * @return The parsed document
	 * @throws DssParseException If the text has a problem the policy considers fatal
	 */
	public static DssDocument parse(CharSequence text, ValidationPolicy policy) throws DssParseException {
		return new DssParser(new Diagnostics(policy)).parse(text);
	}

	/**
	 * @param text The DSSketch text to parse
	 * @return The parsed document
	 * @throws DssParseException If the text has a problem the diagnostics' policy considers fatal
	 */
	public DssDocument parse(CharSequence text) throws DssParseException {
		List<DssLine> lines = LineScanner.scan(text);
		if (lines.isEmpty())
			throw new DssParseException("The document is empty", SourcePosition.NONE);
		List<Section> sections = groupSections(lines);

		DssDocument.Builder builder = DssDocument.build();
		Map<String, List<Section>> byKind = new LinkedHashMap<>();
		for (Section section : sections)
			byKind.computeIfAbsent(sectionKind(section), k -> new ArrayList<>()).add(section);

		for (Section section : get(byKind, "family"))
			builder.withFamily(requireValue(section));
		for (Section section : get(byKind, "path"))
			builder.withPath(requireValue(section));
		for (Section section : get(byKind, "suffix"))
			builder.withSuffix(requireValue(section));

		if (get(byKind, "axes").isEmpty())
			theDiagnostics.error(Diagnostics.Category.STRUCTURAL, SourcePosition.NONE, "Missing 'axes' section");
		List<DeclaredAxis> declared = new ArrayList<>();
		for (Section section : get(byKind, "axes"))
			parseAxes(section, false, declared);
		for (Section section : get(byKind, "axes hidden"))
			parseAxes(section, true, declared);
		boolean hasWeight = false, hasWidth = false;
		for (DeclaredAxis axis : declared) {
			if (axis.axis.isHidden())
				continue;
			hasWeight |= axis.axis.getKind() == AxisKind.WEIGHT;
			hasWidth |= axis.axis.getKind() == AxisKind.WIDTH;
		}
		for (DeclaredAxis axis : declared)
			addAxis(axis, hasWeight, hasWidth, builder);
		checkDuplicateLabels(builder);

		for (Section section : get(byKind, "avar2 vars")) {
			for (DssLine line : section.body) {
				Avar2Variable var = Avar2Parser.parseVariable(line, theDiagnostics);
				if (var != null)
					builder.withVariable(var);
			}
		}
		List<Axis> allAxes = new ArrayList<>(builder.getAxes());
		allAxes.addAll(builder.getHiddenAxes());
		Avar2Parser avar2 = new Avar2Parser(allAxes, builder.getVariables(), theDiagnostics);
		for (Section section : get(byKind, "avar2")) {
			if (!section.body.isEmpty() && section.body.get(0).getFirstWord().equals(Avar2Parser.MATRIX_HEADER))
				addAll(builder, avar2.parseMatrix(section.body));
			else {
				for (DssLine line : section.body) {
					Avar2Mapping mapping = avar2.parseLinear(line);
					if (mapping != null)
						builder.withAvar2Mapping(mapping);
				}
			}
		}
		for (Section section : get(byKind, "avar2 matrix"))
			addAll(builder, avar2.parseMatrix(section.body));
		if (!builder.getAvar2Mappings().isEmpty()) {
			Set<String> hidden = new LinkedHashSet<>();
			for (Axis axis : builder.getHiddenAxes())
				hidden.add(axis.getTag());
			Set<String> inferred = HiddenAxisInference.inferHidden(builder.getAvar2Mappings());
			if (!hidden.containsAll(inferred)) {
				hidden.addAll(inferred);
				log.info("Axes used only as avar2 outputs are hidden: " + String.join(", ", hidden));
				builder.withHiddenTags(hidden);
			}
		}

		List<Section> sourceSections = new ArrayList<>(get(byKind, "sources"));
		if (sourceSections.isEmpty())
			theDiagnostics.error(Diagnostics.Category.STRUCTURAL, SourcePosition.NONE, "Missing 'sources' section");
		for (Section section : sourceSections)
			parseSources(section, builder);
		checkBaseSource(builder);

		for (Section section : get(byKind, "rules"))
			parseRules(section, builder);
		for (Section section : get(byKind, "instances"))
			parseInstances(section, builder);

		DssDocument document = builder.build();
		new InstanceGenerator(theDiagnostics).validateSkips(document);
		new DocumentValidator(theDiagnostics).validate(document);
		return document;
	}

	private static List<Section> get(Map<String, List<Section>> byKind, String kind) {
		List<Section> sections = byKind.get(kind);
		return sections == null ? ImmutableList.of() : sections;
	}

	private static void addAll(DssDocument.Builder builder, List<Avar2Mapping> mappings) {
		for (Avar2Mapping mapping : mappings)
			builder.withAvar2Mapping(mapping);
	}

	private List<Section> groupSections(List<DssLine> lines) throws DssParseException {
		int topIndent = lines.get(0).getIndent();
		List<Section> sections = new ArrayList<>();
		Section current = null;
		for (DssLine line : lines) {
			if (line.getIndent() <= topIndent) {
				String keyword = resolveKeyword(line);
				current = keyword == null ? null : new Section(line, keyword, line.getRemainder());
				if (current != null)
					sections.add(current);
			} else if (current != null)
				current.body.add(line);
			else if (sections.isEmpty())
				theDiagnostics.error(Diagnostics.Category.STRUCTURAL, line.getPosition(), "Indented line outside of any section");
		}
		return sections;
	}

	private String resolveKeyword(DssLine line) throws DssParseException {
		String word = line.getFirstWord();
		if (TypoChecker.SECTION_KEYWORDS.contains(word))
			return word.equals("masters") ? "sources" : word;
		if (!DssText.isIdentifier(word)) {
			theDiagnostics.error(Diagnostics.Category.STRUCTURAL, line.getPosition(), "Invalid keyword '" + word + "'");
			return null;
		}
		String suggestion = TypoChecker.suggest(word, TypoChecker.SECTION_KEYWORDS);
		if (suggestion != null) {
			theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(), "Unknown keyword '" + word + "'", suggestion);
			return suggestion.equals("masters") ? "sources" : suggestion;
		}
		theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(), "Unknown keyword '" + word + "'; section ignored");
		return null;
	}

	private String sectionKind(Section section) throws DssParseException {
		switch (section.keyword) {
		case "axes":
			if (section.argument.equals(HIDDEN_MODIFIER))
				return "axes hidden";
			else if (!section.argument.isEmpty())
				unexpectedArgument(section, HIDDEN_MODIFIER);
			return "axes";
		case "avar2":
			if (section.argument.equals("vars") || section.argument.equals("matrix"))
				return "avar2 " + section.argument;
			else if (!section.argument.isEmpty())
				unexpectedArgument(section, "vars", "matrix");
			return "avar2";
		case "rules":
			if (!section.argument.isEmpty())
				unexpectedArgument(section);
			return section.keyword;
		default:
			return section.keyword;
		}
	}

	private void unexpectedArgument(Section section, String... allowed) throws DssParseException {
		String suggestion = allowed.length == 0 ? null : TypoChecker.suggest(section.argument, Arrays.asList(allowed));
		theDiagnostics.error(Diagnostics.Category.CONTENT, section.header.getPosition(),
			"Unexpected '" + section.argument + "' after '" + section.keyword + "'", suggestion);
	}

	private String requireValue(Section section) throws DssParseException {
		String value = DssText.unquote(section.argument);
		if (value.isEmpty()) {
			theDiagnostics.error(Diagnostics.Category.CONTENT, section.header.getPosition(),
				"'" + section.keyword + "' requires a value");
			return null;
		}
		for (DssLine line : section.body)
			theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(),
				"Unexpected indented line under '" + section.keyword + "'");
		return value;
	}

	/* Axes */

	private static class DeclaredAxis {
		final DssLine line;
		final Axis axis;
		final List<DssLine> mappingLines;

		DeclaredAxis(DssLine line, Axis axis, List<DssLine> mappingLines) {
			this.line = line;
			this.axis = axis;
			this.mappingLines = mappingLines;
		}
	}

	private void parseAxes(Section section, boolean hidden, List<DeclaredAxis> declared) throws DssParseException {
		if (section.body.isEmpty())
			return;
		int axisIndent = section.body.get(0).getIndent();
		DssLine axisLine = null;
		List<DssLine> mappingLines = new ArrayList<>();
		for (DssLine line : section.body) {
			if (line.getIndent() <= axisIndent) {
				if (axisLine != null)
					declareAxis(axisLine, mappingLines, hidden, declared);
				axisLine = line;
				mappingLines = new ArrayList<>();
			} else
				mappingLines.add(line);
		}
		declareAxis(axisLine, mappingLines, hidden, declared);
	}

	private void declareAxis(DssLine line, List<DssLine> mappingLines, boolean hidden, List<DeclaredAxis> declared)
		throws DssParseException {
		Axis axis = parseAxis(line, hidden);
		if (axis != null)
			declared.add(new DeclaredAxis(line, axis, mappingLines));
	}

	/* Mappings are checked against the vocabularies of all declared axes, so these are known before any axis is added */
	private void addAxis(DeclaredAxis declared, boolean hasWeight, boolean hasWidth, DssDocument.Builder builder)
		throws DssParseException {
		Axis axis = declared.axis;
		List<Axis> existing = new ArrayList<>(builder.getAxes());
		existing.addAll(builder.getHiddenAxes());
		for (Axis other : existing) {
			if (other.getTag().equals(axis.getTag())) {
				theDiagnostics.error(Diagnostics.Category.SEMANTIC, declared.line.getPosition(), "Duplicate axis " + axis.getTag());
				return;
			}
		}
		boolean weight = hasWeight || axis.getKind() == AxisKind.WEIGHT;
		boolean width = hasWidth || axis.getKind() == AxisKind.WIDTH;
		List<AxisMapping> mappings = new ArrayList<>();
		for (DssLine mappingLine : declared.mappingLines) {
			AxisMapping mapping = parseMapping(mappingLine, axis, mappings, weight, width);
			if (mapping != null)
				mappings.add(mapping);
		}
		builder.withAxis(new Axis(axis.getTag(), axis.getName(), axis.getDisplayName(), axis.getMinimum(), axis.getDefault(),
			axis.getMaximum(), axis.isDiscrete(), axis.isHidden(), mappings));
	}

	/**
	 * Parses an axis declaration without its mappings
	 *
	 * @param line The axis line
	 * @param hidden Whether the axis is declared in the hidden section
	 * @return The axis, or null if the line could not be parsed
	 * @throws DssParseException If a fatal problem is found
	 */
	Axis parseAxis(DssLine line, boolean hidden) throws DssParseException {
		List<String> words = new ArrayList<>(DssText.words(line.getText()));
		String displayName = null;
		if (words.size() > 1 && words.get(words.size() - 1).startsWith("\"")) {
			displayName = DssText.unquote(words.remove(words.size() - 1));
		}
		int rangeIndex = -1;
		for (int i = 0; i < words.size(); i++) {
			if (isRangeToken(words.get(i))) {
				rangeIndex = i;
				break;
			}
		}
		if (rangeIndex < 0) {
			if (words.size() == 1 && (AxisKind.forTag(words.get(0)) == AxisKind.ITALIC || AxisKind.forName(words.get(0)) == AxisKind.ITALIC))
				rangeIndex = 1;
			else {
				theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(),
					"Axis declaration needs a range like 'min:default:max' or 'discrete': " + line.getText());
				return null;
			}
		}
		String tag;
		String name;
		if (rangeIndex == 2) {
			name = DssText.unquote(words.get(0));
			tag = words.get(1);
		} else if (rangeIndex == 1) {
			String id = words.get(0);
			if (AxisKind.forTag(id) != AxisKind.CUSTOM) {
				tag = id;
				name = AxisKind.forTag(id).standardName;
			} else if (AxisKind.forName(id) != AxisKind.CUSTOM) {
				tag = AxisKind.forName(id).tag;
				name = AxisKind.forName(id).standardName;
			} else if (id.length() == 4 && id.equals(id.toUpperCase())) {
				tag = id;
				name = id;
			} else {
				String suggestion = suggestAxis(id);
				if (suggestion != null) {
					theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(), "Unknown axis '" + id + "'", suggestion);
					AxisKind suggested = AxisKind.forTag(suggestion) != AxisKind.CUSTOM ? AxisKind.forTag(suggestion)
						: AxisKind.forName(suggestion);
					tag = suggested.tag;
					name = suggested.standardName;
				} else {
					name = id;
					tag = AxisKind.inferTag(id);
				}
			}
		} else {
			theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(),
				"Axis declaration must be 'name tag range', 'tag range' or 'name range': " + line.getText());
			return null;
		}
		if (!DssText.isIdentifier(tag)) {
			theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(), "Invalid axis tag '" + tag + "'");
			return null;
		}
		AxisKind kind = AxisKind.forTag(tag);
		String range = rangeIndex < words.size() ? words.get(rangeIndex) : "discrete";
		for (String extra : words.subList(Math.min(rangeIndex + 1, words.size()), words.size())) {
			if (DISCRETE_KEYWORDS.contains(extra))
				range += ":discrete";
			else
				theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(),
					"Unexpected '" + extra + "' in declaration of axis " + tag);
		}

		boolean discrete = false;
		double[] values;
		if (DISCRETE_KEYWORDS.contains(range)) {
			discrete = true;
			values = new double[] { 0, 0, 1 };
		} else {
			List<String> parts = new ArrayList<>(Arrays.asList(range.split(":", -1)));
			if (parts.size() > 1 && DISCRETE_KEYWORDS.contains(parts.get(parts.size() - 1))) {
				discrete = true;
				parts.remove(parts.size() - 1);
			}
			if (parts.isEmpty() || parts.size() > 3) {
				theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(), "Invalid range '" + range + "' for axis " + tag);
				return null;
			}
			Double[] resolved = new Double[parts.size()];
			for (int i = 0; i < parts.size(); i++) {
				resolved[i] = resolveRangeValue(parts.get(i), kind, tag, line);
				if (resolved[i] == null)
					return null;
			}
			if (resolved.length == 1) {
				theDiagnostics.error(Diagnostics.Category.SEMANTIC, line.getPosition(),
					"Axis " + tag + " has a single value; give a range like 'min:default:max'");
				values = new double[] { resolved[0], resolved[0], resolved[0] };
			} else if (resolved.length == 2)
				values = new double[] { resolved[0], resolved[0], resolved[1] };
			else
				values = new double[] { resolved[0], resolved[1], resolved[2] };
		}
		if (values[0] > values[1] || values[1] > values[2]) {
			theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(),
				"Range of axis " + tag + " is not ordered as min:default:max: " + range);
		}
		return new Axis(tag, name, displayName, values[0], values[1], values[2], discrete, hidden, ImmutableList.of());
	}

	private static String suggestAxis(String id) {
		String suggestion = TypoChecker.suggest(id, TypoChecker.AXIS_TAGS);
		if (suggestion == null)
			suggestion = TypoChecker.suggest(id, TypoChecker.AXIS_NAMES);
		return suggestion;
	}

	private static boolean isRangeToken(String word) {
		return word.indexOf(':') >= 0 || DISCRETE_KEYWORDS.contains(word) || DssText.parseNumber(word) != null;
	}

	private Double resolveRangeValue(String part, AxisKind kind, String tag, DssLine line) throws DssParseException {
		ScalarRef ref = ScalarRef.parse(part);
		if (!ref.isLabel())
			return ref.resolve(null);
		String label = ((ScalarRef.Label) ref).getLabel();
		if (!kind.hasStandardLabels()) {
			theDiagnostics.error(Diagnostics.Category.SEMANTIC, line.getPosition(),
				"Label '" + label + "' in the range of axis " + tag + ": only weight and width ranges may use labels");
			return null;
		}
		Double value = theLabels.getUserValue(kind, label);
		if (value == null) {
			theDiagnostics.error(Diagnostics.Category.SEMANTIC, line.getPosition(),
				"Unknown " + kind.standardName + " label '" + label + "' in the range of axis " + tag,
				TypoChecker.suggest(label, theLabels.getLabelNames(kind)));
		}
		return value;
	}

	/**
	 * @param line The mapping line
	 * @param axis The axis the mapping belongs to
	 * @param previous The mappings already parsed for the axis
	 * @param hasWeight Whether the document has a weight axis
	 * @param hasWidth Whether the document has a width axis
	 * @return The mapping, or null if it could not be parsed
	 * @throws DssParseException If a fatal problem is found
	 */
	AxisMapping parseMapping(DssLine line, Axis axis, List<AxisMapping> previous, boolean hasWeight, boolean hasWidth)
		throws DssParseException {
		String text = line.getText();
		boolean elidable = false;
		List<String> words = DssText.words(text);
		if (!words.isEmpty() && words.get(words.size() - 1).startsWith("@")) {
			String flag = words.get(words.size() - 1);
			if (flag.equals(ELIDABLE_FLAG))
				elidable = true;
			else
				theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(), "Unknown flag '" + flag + "' on mapping",
					TypoChecker.suggest(flag, ImmutableList.of(ELIDABLE_FLAG)));
			text = text.substring(0, text.lastIndexOf(flag)).trim();
		}
		int arrow = text.indexOf('>');
		String label;
		double user;
		double design;
		if (arrow < 0) {
			label = DssText.unquote(text);
			if (label.isEmpty()) {
				theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(), "Empty mapping on axis " + axis.getTag());
				return null;
			}
			if (!axis.isDiscrete()) {
				theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(),
					"Mapping '" + label + "' on continuous axis " + axis.getTag() + " needs a design value: '" + label + " > value'");
				return null;
			}
			Integer discrete = theLabels.getDiscreteValue(axis.getTag(), label);
			design = discrete != null ? discrete : previous.size();
			user = design;
		} else {
			String left = text.substring(0, arrow).trim();
			String right = text.substring(arrow + 1).trim();
			Double designValue = DssText.parseNumber(right);
			if (designValue == null) {
				theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(arrow + 1),
					"Invalid design value '" + right + "' for mapping on axis " + axis.getTag());
				return null;
			}
			design = designValue;
			List<String> leftWords = DssText.words(left);
			Double explicitUser = leftWords.size() > 1 ? DssText.parseNumber(leftWords.get(0)) : null;
			if (explicitUser != null) {
				user = explicitUser;
				label = DssText.unquote(left.substring(leftWords.get(0).length()).trim());
			} else {
				label = DssText.unquote(left);
				if (label.isEmpty()) {
					theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(), "Mapping on axis " + axis.getTag() + " has no label");
					return null;
				}
				Double standard = axis.getKind().hasStandardLabels() ? theLabels.getUserValue(axis.getKind(), label) : null;
				Integer discrete = standard == null ? theLabels.getDiscreteValue(axis.getTag(), label) : null;
				if (standard != null)
					user = standard;
				else if (discrete != null)
					user = discrete;
				else {
					String suggestion = theTypos.suggestLabel(label, axis.getKind(), hasWeight, hasWidth);
					if (suggestion != null)
						theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(),
							"Unknown " + axis.getKind().standardName + " label '" + label + "'", suggestion);
					user = design;
				}
			}
		}
		if (!axis.containsUserValue(user)) {
			theDiagnostics.error(Diagnostics.Category.SEMANTIC, line.getPosition(),
				"Mapping '" + label + "' has user value " + DssText.formatNumber(user) + ", outside the range of axis " + axis.getTag()
					+ " (" + DssText.formatNumber(axis.getMinimum()) + " to " + DssText.formatNumber(axis.getMaximum()) + ")");
		}
		return new AxisMapping(label, user, design, elidable);
	}

	private void checkDuplicateLabels(DssDocument.Builder builder) throws DssParseException {
		Map<String, String> owners = new LinkedHashMap<>();
		List<Axis> all = new ArrayList<>(builder.getAxes());
		all.addAll(builder.getHiddenAxes());
		for (Axis axis : all) {
			for (AxisMapping mapping : axis.getMappings()) {
				String owner = owners.putIfAbsent(mapping.getLabel(), axis.getTag());
				if (owner != null) {
					theDiagnostics.error(Diagnostics.Category.SEMANTIC, SourcePosition.NONE, "Duplicate label '" + mapping.getLabel() + "' on "
						+ (owner.equals(axis.getTag()) ? "axis " + owner : "axes " + owner + " and " + axis.getTag()));
				}
			}
		}
	}

	/* Sources */

	private void parseSources(Section section, DssDocument.Builder builder) throws DssParseException {
		List<String> order = new ArrayList<>();
		if (!section.argument.isEmpty()) {
			String arg = section.argument;
			if (arg.startsWith("[") && arg.endsWith("]"))
				arg = arg.substring(1, arg.length() - 1);
			else
				theDiagnostics.error(Diagnostics.Category.CONTENT, section.header.getPosition(),
					"The axis order of the sources section belongs in brackets: '" + section.keyword + " [wght, ital]'");
			for (String ref : DssText.split(arg, ',')) {
				Axis axis = findAxis(builder, ref);
				if (axis == null)
					theDiagnostics.error(Diagnostics.Category.SEMANTIC, section.header.getPosition(),
						"Source axis order references undeclared axis '" + ref + "'");
				else
					order.add(axis.getTag());
			}
			builder.withSourceAxisOrder(order);
		} else {
			for (Axis axis : builder.getAxes())
				order.add(axis.getTag());
		}
		for (DssLine line : section.body) {
			Source source = parseSource(line, order, builder);
			if (source != null)
				builder.withSource(source);
		}
	}

	private Source parseSource(DssLine line, List<String> order, DssDocument.Builder builder) throws DssParseException {
		String text = line.getText();
		String name;
		String rest;
		if (text.startsWith("\"")) {
			int close = text.indexOf('"', 1);
			if (close < 0) {
				theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(), "Unterminated source name");
				return null;
			}
			name = text.substring(1, close);
			rest = text.substring(close + 1).trim();
		} else {
			name = line.getFirstWord();
			rest = line.getRemainder();
		}

		boolean base = false;
		String layer = null;
		String coords;
		int open = firstBracket(rest);
		if (open >= 0) {
			char openChar = rest.charAt(open);
			char closeChar = openChar == '[' ? ']' : ')';
			int close = rest.indexOf(closeChar, open);
			if (close < 0) {
				theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(), "Unclosed '" + openChar + "' in source " + name);
				return null;
			}
			if (openChar == '(')
				theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(), "Use [] for coordinates, not ()");
			coords = rest.substring(open + 1, close).trim();
			rest = (rest.substring(0, open) + " " + rest.substring(close + 1)).trim();
		} else
			coords = null;
		StringBuilder unflagged = new StringBuilder();
		for (String word : DssText.words(rest)) {
			if (word.equals(BASE_FLAG))
				base = true;
			else if (word.startsWith(LAYER_FLAG + "="))
				layer = DssText.unquote(word.substring(LAYER_FLAG.length() + 1));
			else if (word.startsWith("@"))
				theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(), "Unknown flag '" + word + "' on source " + name,
					TypoChecker.suggest(word.indexOf('=') > 0 ? word.substring(0, word.indexOf('=')) : word, SOURCE_FLAGS));
			else {
				if (unflagged.length() > 0)
					unflagged.append(' ');
				unflagged.append(word);
			}
		}
		if (coords == null)
			coords = unflagged.toString();
		else if (unflagged.length() > 0)
			theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(),
				"Unexpected '" + unflagged + "' after the coordinates of source " + name);

		Map<String, Double> location = parseLocation(coords, order, builder, line, "source " + name);
		if (location == null)
			return null;

		String filename;
		String lower = name.toLowerCase();
		boolean hasExtension = lower.endsWith(".ufo") || lower.endsWith(".ufoz");
		if (name.indexOf('/') >= 0 || hasExtension) {
			filename = hasExtension ? name : name + ".ufo";
			String stem = name.substring(name.lastIndexOf('/') + 1);
			if (hasExtension)
				stem = stem.substring(0, stem.lastIndexOf('.'));
			name = stem;
		} else
			filename = name + ".ufo";
		return new Source(name, filename, location, layer, base);
	}

	private static int firstBracket(String text) {
		int square = text.indexOf('[');
		int paren = text.indexOf('(');
		if (square < 0)
			return paren;
		else if (paren < 0)
			return square;
		return Math.min(square, paren);
	}

	/**
	 * Parses the coordinates of a source or explicit instance, positional (<code>400, Italic</code> or <code>400 1</code>) or named
	 * (<code>wght=400, XOUC=84</code>). Omitted axes take their default design value.
	 */
	private Map<String, Double> parseLocation(String coords, List<String> order, DssDocument.Builder builder, DssLine line,
		String owner) throws DssParseException {
		Map<String, Double> location = new LinkedHashMap<>();
		List<Axis> all = new ArrayList<>(builder.getAxes());
		all.addAll(builder.getHiddenAxes());
		boolean ok = true;
		if (coords.indexOf('=') >= 0) {
			for (String part : DssText.split(coords, ',')) {
				int eq = part.indexOf('=');
				if (eq <= 0) {
					theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(),
						"Expected 'axis=value' in the coordinates of " + owner + ", not '" + part + "'");
					ok = false;
					continue;
				}
				Axis axis = findAxis(builder, part.substring(0, eq).trim());
				if (axis == null) {
					theDiagnostics.error(Diagnostics.Category.SEMANTIC, line.getPosition(),
						"The coordinates of " + owner + " reference undeclared axis '" + part.substring(0, eq).trim() + "'");
					ok = false;
					continue;
				}
				Double value = resolveCoordinate(axis, part.substring(eq + 1).trim(), line, owner);
				if (value == null)
					ok = false;
				else
					location.put(axis.getTag(), value);
			}
		} else if (!coords.isEmpty()) {
			List<String> values = coords.indexOf(',') >= 0 ? DssText.split(coords, ',') : DssText.words(coords);
			if (values.size() != order.size()) {
				theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(), "The coordinates of " + owner + " have "
					+ values.size() + " value(s), but " + order.size() + " axes are expected (" + String.join(", ", order) + ")");
				return null;
			}
			for (int i = 0; i < values.size(); i++) {
				Axis axis = findAxis(builder, order.get(i));
				Double value = axis == null ? null : resolveCoordinate(axis, values.get(i), line, owner);
				if (value == null)
					ok = false;
				else
					location.put(axis.getTag(), value);
			}
		}
		if (!ok)
			return null;
		Map<String, Double> ordered = new LinkedHashMap<>();
		for (Axis axis : all) {
			Double value = location.get(axis.getTag());
			ordered.put(axis.getTag(), value != null ? value : axis.getDefaultDesignValue());
		}
		return ordered;
	}

	private Double resolveCoordinate(Axis axis, String token, DssLine line, String owner) throws DssParseException {
		if (token.isEmpty()) {
			theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(),
				"Empty coordinate for axis " + axis.getTag() + " in " + owner);
			return null;
		}
		ScalarRef ref = ScalarRef.parse(token);
		Double value = ref.resolve(label -> {
			AxisMapping mapping = axis.getMapping(label);
			return mapping == null ? null : mapping.getDesignValue();
		});
		if (value == null) {
			Set<String> labels = new LinkedHashSet<>();
			for (AxisMapping mapping : axis.getMappings())
				labels.add(mapping.getLabel());
			theDiagnostics.error(Diagnostics.Category.SEMANTIC, line.getPosition(),
				"Unknown label '" + ref + "' for axis " + axis.getTag() + " in " + owner, TypoChecker.suggest(ref.toString(), labels));
		}
		return value;
	}

	private static Axis findAxis(DssDocument.Builder builder, String ref) {
		List<Axis> all = new ArrayList<>(builder.getAxes());
		all.addAll(builder.getHiddenAxes());
		for (Axis axis : all) {
			if (axis.getTag().equals(ref))
				return axis;
		}
		for (Axis axis : all) {
			if (axis.isIdentifiedBy(ref))
				return axis;
		}
		return null;
	}

	private void checkBaseSource(DssDocument.Builder builder) throws DssParseException {
		List<String> bases = new ArrayList<>();
		for (Source source : builder.getSources()) {
			if (source.isBase())
				bases.add(source.getName());
		}
		if (bases.isEmpty())
			theDiagnostics.error(Diagnostics.Category.STRUCTURAL, SourcePosition.NONE,
				"No base source: mark the source at the default location with " + BASE_FLAG);
		else if (bases.size() > 1)
			theDiagnostics.error(Diagnostics.Category.STRUCTURAL, SourcePosition.NONE,
				"Only one source may be marked " + BASE_FLAG + ", but " + bases.size() + " are: " + String.join(", ", bases));
	}

	/* Rules */

	private void parseRules(Section section, DssDocument.Builder builder) throws DssParseException {
		List<Axis> all = new ArrayList<>(builder.getAxes());
		all.addAll(builder.getHiddenAxes());
		ConditionParser conditions = new ConditionParser(all, theDiagnostics);
		for (DssLine line : section.body) {
			Rule rule = parseRule(line, builder.getRules().size() + 1, conditions);
			if (rule != null)
				builder.withRule(rule);
		}
	}

	/**
	 * @param line The rule line
	 * @param index The 1-based index of the rule, for its automatic name
	 * @param conditions The parser for the rule's condition
	 * @return The rule, or null if it could not be parsed
	 * @throws DssParseException If a fatal problem is found
	 */
	Rule parseRule(DssLine line, int index, ConditionParser conditions) throws DssParseException {
		String text = line.getText();
		String name = null;
		if (text.endsWith("\"")) {
			int open = text.lastIndexOf('"', text.length() - 2);
			if (open < 0) {
				theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(), "Unterminated rule name");
				return null;
			}
			name = text.substring(open + 1, text.length() - 1);
			text = text.substring(0, open).trim();
		}
		String conditionText = null;
		if (text.endsWith(")")) {
			int open = text.lastIndexOf('(');
			if (open < 0) {
				theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(), "Unbalanced ')' in rule");
				return null;
			}
			conditionText = text.substring(open + 1, text.length() - 1);
			text = text.substring(0, open).trim();
		} else if (text.indexOf('(') >= 0) {
			theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(), "Unclosed '(' in rule condition");
			return null;
		}
		int arrow = text.indexOf('>');
		if (arrow < 0) {
			theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(),
				"Expected a rule like 'glyphs > target (condition)': " + line.getText());
			return null;
		}
		List<String> patterns = DssText.words(text.substring(0, arrow));
		String target = text.substring(arrow + 1).trim();
		if (patterns.isEmpty() || target.isEmpty() || target.indexOf(' ') >= 0) {
			theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(),
				"A rule needs glyphs before '>' and a single target after it: " + line.getText());
			return null;
		}
		List<RuleCondition> parsedConditions = conditionText == null ? ImmutableList.of()
			: conditions.parse(conditionText, line.getPosition(text.length()));
		if (name == null || name.isEmpty())
			name = Rule.AUTO_NAME_PREFIX + index;
		Rule rule = new Rule(name, patterns, target, parsedConditions, ImmutableList.of());
		if (!rule.hasWildcard()) {
			List<Substitution> subs = new ArrayList<>();
			for (String pattern : patterns)
				subs.add(new Substitution(pattern, RuleResolver.targetFor(rule, pattern)));
			rule = rule.withSubstitutions(subs);
		}
		return rule;
	}

	/* Instances */

	private void parseInstances(Section section, DssDocument.Builder builder) throws DssParseException {
		List<String> words = DssText.words(section.argument);
		String mode = words.isEmpty() ? null : words.get(0);
		if (mode == null) {
			builder.withInstanceMode(section.body.isEmpty() ? InstanceMode.AUTO : InstanceMode.EXPLICIT);
			parseExplicitInstances(section, builder);
			return;
		}
		if (!INSTANCE_MODES.contains(mode)) {
			String suggestion = TypoChecker.suggest(mode, INSTANCE_MODES);
			theDiagnostics.error(Diagnostics.Category.CONTENT, section.header.getPosition(),
				"Unknown instance mode '" + mode + "', expected 'auto' or 'off'", suggestion);
			if (suggestion == null)
				return;
			mode = suggestion;
		}
		if (mode.equals(InstanceMode.OFF.keyword)) {
			builder.withInstanceMode(InstanceMode.OFF);
			for (DssLine line : section.body)
				theDiagnostics.warn(Diagnostics.Category.ADVISORY, line.getPosition(), "Ignoring line under 'instances off'");
			return;
		}
		builder.withInstanceMode(InstanceMode.AUTO);
		if (words.size() > 1) {
			if (words.get(1).equals(SKIP_KEYWORD) && words.size() > 2)
				builder.withSkip(String.join(" ", words.subList(2, words.size())));
			else
				theDiagnostics.error(Diagnostics.Category.CONTENT, section.header.getPosition(),
					"Unexpected '" + String.join(" ", words.subList(1, words.size())) + "' after 'instances auto'");
		}
		int skipIndent = -1;
		for (DssLine line : section.body) {
			if (skipIndent >= 0 && line.getIndent() > skipIndent)
				builder.withSkip(DssText.unquote(line.getText()));
			else if (line.getFirstWord().equals(SKIP_KEYWORD)) {
				skipIndent = line.getIndent();
				if (!line.getRemainder().isEmpty())
					builder.withSkip(DssText.unquote(line.getRemainder()));
			} else {
				skipIndent = -1;
				theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(),
					"Expected '" + SKIP_KEYWORD + "' under 'instances auto', not '" + line.getText() + "'",
					TypoChecker.suggest(line.getFirstWord(), ImmutableList.of(SKIP_KEYWORD)));
			}
		}
	}

	private void parseExplicitInstances(Section section, DssDocument.Builder builder) throws DssParseException {
		for (DssLine line : section.body) {
			String text = line.getText();
			int open = firstBracket(text);
			if (open <= 0) {
				theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(),
					"Expected an instance like 'Style Name [coordinates]': " + text);
				continue;
			}
			char closeChar = text.charAt(open) == '[' ? ']' : ')';
			int close = text.indexOf(closeChar, open);
			if (close < 0) {
				theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(), "Unclosed bracket in instance");
				continue;
			}
			if (closeChar == ')')
				theDiagnostics.error(Diagnostics.Category.CONTENT, line.getPosition(), "Use [] for coordinates, not ()");
			String style = DssText.unquote(text.substring(0, open));
			Map<String, Double> location = parseLocation(text.substring(open + 1, close).trim(), builder.getSourceAxisOrder(),
				builder, line, "instance " + style);
			if (location != null)
				builder.withInstance(new Instance(builder.getFamily(), style, location, null));
		}
	}
}
