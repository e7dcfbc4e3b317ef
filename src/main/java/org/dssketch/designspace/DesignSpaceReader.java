package org.dssketch.designspace;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.apache.log4j.Logger;
import org.dssketch.avar2.HiddenAxisInference;
import org.dssketch.instances.InstanceGenerator;
import org.dssketch.io.Diagnostics;
import org.dssketch.io.DssParseException;
import org.dssketch.io.DssText;
import org.dssketch.io.SourcePosition;
import org.dssketch.io.ValidationPolicy;
import org.dssketch.model.Avar2Mapping;
import org.dssketch.model.Axis;
import org.dssketch.model.AxisMapping;
import org.dssketch.model.DssDocument;
import org.dssketch.model.Instance;
import org.dssketch.model.InstanceMode;
import org.dssketch.model.Rule;
import org.dssketch.model.RuleCondition;
import org.dssketch.model.Source;
import org.dssketch.model.Substitution;
import org.jdom2.Element;
import org.jdom2.JDOMException;
import org.jdom2.Namespace;
import org.jdom2.input.SAXBuilder;
import org.jdom2.input.sax.XMLReaderSAX2Factory;

/**
 * <p>
 * Reads designspace XML (formats 4 and 5) into a document. Beyond a structural mapping of the XML, the reader infers what
 * designspace files leave implicit:
 * </p>
 * <ul>
 * <li>The common directory of the sources, which becomes the document's path</li>
 * <li>Hidden axes, from the <code>hidden</code> attribute or else from the avar2 mappings</li>
 * <li>The base source, the one copying info from its UFO, or else the source at the default location</li>
 * <li>The instance mode: <code>auto</code> if the instances are exactly those that would be generated, <code>off</code> if there
 * are none</li>
 * </ul>
 */
public class DesignSpaceReader {
	private static final Logger log = Logger.getLogger(DesignSpaceReader.class);

	private static final ThreadLocal<SAXBuilder> SAX_BUILDERS = ThreadLocal
		.withInitial(() -> new SAXBuilder(new XMLReaderSAX2Factory(false)));

	private final Diagnostics theDiagnostics;

	/** @param diagnostics The diagnostics to report problems to */
	public DesignSpaceReader(Diagnostics diagnostics) {
		theDiagnostics = diagnostics;
	}

	/**
	 * @param file The designspace file to read
	 * @return The document
	 * @throws IOException If the file cannot be read
	 * @throws DssParseException If the file is not valid designspace XML
	 */
	public DssDocument read(Path file) throws IOException, DssParseException {
		try (InputStream in = Files.newInputStream(file)) {
			return read(in);
		}
	}

	/**
	 * @param in The stream of designspace XML to read
	 * @return The document
	 * @throws IOException If the stream cannot be read
	 * @throws DssParseException If the stream is not valid designspace XML
	 */
	public DssDocument read(InputStream in) throws IOException, DssParseException {
		Element root;
		try {
			root = SAX_BUILDERS.get().build(in).getRootElement();
		} catch (JDOMException e) {
			throw new DssParseException("Could not parse designspace XML: " + e.getMessage(), SourcePosition.NONE, e);
		}
		return read(root);
	}

	/**
	 * @param xml The designspace XML text
	 * @return The document
	 * @throws DssParseException If the text is not valid designspace XML
	 */
	public DssDocument readString(String xml) throws DssParseException {
		Element root;
		try {
			root = SAX_BUILDERS.get().build(new StringReader(xml)).getRootElement();
		} catch (JDOMException | IOException e) {
			throw new DssParseException("Could not parse designspace XML: " + e.getMessage(), SourcePosition.NONE, e);
		}
		return read(root);
	}

	/**
	 * @param root The root element of the designspace XML
	 * @return The document
	 * @throws DssParseException If the XML is not a valid designspace
	 */
	public DssDocument read(Element root) throws DssParseException {
		if (!root.getName().equals("designspace"))
			throw new DssParseException("Not a designspace document: root element is <" + root.getName() + ">", SourcePosition.NONE);
		DssDocument.Builder builder = DssDocument.build();

		Element axesEl = root.getChild("axes");
		if (axesEl == null || axesEl.getChildren("axis").isEmpty())
			theDiagnostics.error(Diagnostics.Category.STRUCTURAL, SourcePosition.NONE, "The designspace declares no axes");
		Map<String, String> tagsByName = new LinkedHashMap<>();
		if (axesEl != null) {
			for (Element axisEl : axesEl.getChildren("axis")) {
				Axis axis = readAxis(axisEl);
				if (axis != null) {
					tagsByName.put(axis.getName(), axis.getTag());
					builder.withAxis(axis);
				}
			}
			Element mappingsEl = axesEl.getChild("mappings");
			if (mappingsEl != null) {
				for (Element mappingEl : mappingsEl.getChildren("mapping")) {
					Map<String, Double> input = readLocation(mappingEl.getChild("input"), tagsByName);
					Map<String, Double> output = readLocation(mappingEl.getChild("output"), tagsByName);
					if (input.isEmpty() || output.isEmpty())
						theDiagnostics.warn(Diagnostics.Category.ADVISORY, SourcePosition.NONE, "Ignoring avar2 mapping without input or output");
					else
						builder.withAvar2Mapping(new Avar2Mapping(mappingEl.getAttributeValue("description"), input, output));
				}
			}
		}
		inferHidden(builder);

		String family = null;
		Element sourcesEl = root.getChild("sources");
		List<Element> sourceEls = sourcesEl == null ? Collections.emptyList() : sourcesEl.getChildren("source");
		if (sourceEls.isEmpty())
			theDiagnostics.error(Diagnostics.Category.STRUCTURAL, SourcePosition.NONE, "The designspace declares no sources");
		String path = commonDirectory(sourceEls);
		if (path != null)
			builder.withPath(path);
		for (Element sourceEl : sourceEls) {
			if (family == null)
				family = sourceEl.getAttributeValue("familyname");
		}
		readSources(sourceEls, path, tagsByName, builder);

		Element rulesEl = root.getChild("rules");
		if (rulesEl != null) {
			for (Element ruleEl : rulesEl.getChildren("rule")) {
				Rule rule = readRule(ruleEl, builder.getRules().size() + 1, tagsByName);
				if (rule != null)
					builder.withRule(rule);
			}
		}

		Element instancesEl = root.getChild("instances");
		List<Element> instanceEls = instancesEl == null ? Collections.emptyList() : instancesEl.getChildren("instance");
		for (Element instanceEl : instanceEls) {
			String instanceFamily = instanceEl.getAttributeValue("familyname");
			if (instanceFamily != null && !instanceFamily.isEmpty()) {
				family = instanceFamily;
				break;
			}
		}
		builder.withFamily(family);
		readSuffix(root, builder);

		List<Instance> instances = new ArrayList<>();
		for (Element instanceEl : instanceEls) {
			String style = instanceEl.getAttributeValue("stylename");
			if (style == null) {
				theDiagnostics.warn(Diagnostics.Category.ADVISORY, SourcePosition.NONE, "Ignoring instance without a style name");
				continue;
			}
			instances.add(new Instance(family, style, fillDefaults(builder, readLocation(instanceEl.getChild("location"), tagsByName)),
				null));
		}
		return withInstances(builder, instances);
	}

	private Axis readAxis(Element axisEl) throws DssParseException {
		String tag = axisEl.getAttributeValue("tag");
		String name = axisEl.getAttributeValue("name");
		if (tag == null || name == null) {
			theDiagnostics.error(Diagnostics.Category.STRUCTURAL, SourcePosition.NONE, "Axis without a tag or name");
			return null;
		}
		boolean discrete = axisEl.getAttributeValue("values") != null;
		double min;
		double max;
		if (discrete) {
			List<Double> values = new ArrayList<>();
			for (String v : axisEl.getAttributeValue("values").trim().split("\\s+"))
				values.add(number(v, "values of axis " + tag));
			min = Collections.min(values);
			max = Collections.max(values);
		} else {
			min = number(axisEl.getAttributeValue("minimum"), "minimum of axis " + tag);
			max = number(axisEl.getAttributeValue("maximum"), "maximum of axis " + tag);
		}
		String defaultText = axisEl.getAttributeValue("default");
		double def = defaultText == null ? min : number(defaultText, "default of axis " + tag);
		boolean hidden = "1".equals(axisEl.getAttributeValue("hidden")) || "true".equals(axisEl.getAttributeValue("hidden"));

		String displayName = null;
		for (Element labelName : axisEl.getChildren("labelname")) {
			String lang = labelName.getAttributeValue("lang", Namespace.XML_NAMESPACE);
			if ((lang == null || lang.equals("en")) && !labelName.getTextTrim().equalsIgnoreCase(name))
				displayName = labelName.getTextTrim();
		}

		TreeMap<Double, Double> map = new TreeMap<>();
		for (Element mapEl : axisEl.getChildren("map"))
			map.put(number(mapEl.getAttributeValue("input"), "map of axis " + tag),
				number(mapEl.getAttributeValue("output"), "map of axis " + tag));
		List<AxisMapping> mappings = new ArrayList<>();
		Set<Double> labeled = new HashSet<>();
		Element labelsEl = axisEl.getChild("labels");
		if (labelsEl != null) {
			for (Element labelEl : labelsEl.getChildren("label")) {
				String label = labelEl.getAttributeValue("name");
				if (label == null)
					continue;
				double user = number(labelEl.getAttributeValue("uservalue"), "label " + label);
				labeled.add(user);
				mappings.add(new AxisMapping(label, user, interpolate(map, user), "true".equals(labelEl.getAttributeValue("elidable"))));
			}
		}
		for (Double user : map.keySet()) {
			if (!labeled.contains(user))
				log.debug("Dropping unlabeled map point " + DssText.formatNumber(user) + " of axis " + tag);
		}
		mappings.sort(Comparator.comparingDouble(AxisMapping::getUserValue));
		return new Axis(tag, name, displayName, min, def, max, discrete, hidden, mappings);
	}

	static double interpolate(TreeMap<Double, Double> map, double user) {
		if (map.isEmpty())
			return user;
		Double exact = map.get(user);
		if (exact != null)
			return exact;
		Map.Entry<Double, Double> below = map.floorEntry(user);
		Map.Entry<Double, Double> above = map.ceilingEntry(user);
		if (below == null)
			return above.getValue();
		else if (above == null)
			return below.getValue();
		double ratio = (user - below.getKey()) / (above.getKey() - below.getKey());
		return below.getValue() + ratio * (above.getValue() - below.getValue());
	}

	private void inferHidden(DssDocument.Builder builder) {
		if (!builder.getHiddenAxes().isEmpty() || builder.getAvar2Mappings().isEmpty())
			return;
		Set<String> hidden = HiddenAxisInference.inferHidden(builder.getAvar2Mappings());
		if (!hidden.isEmpty()) {
			log.info("Inferred hidden axes from avar2 mappings: " + String.join(", ", hidden));
			builder.withHiddenTags(hidden);
		}
	}

	/**
	 * @param sourceEls The source elements
	 * @return The directory shared by all source files, or null if they are not all in the same non-root directory
	 */
	static String commonDirectory(List<Element> sourceEls) {
		Set<String> directories = new LinkedHashSet<>();
		for (Element sourceEl : sourceEls) {
			String filename = sourceEl.getAttributeValue("filename");
			if (filename == null)
				continue;
			filename = filename.replace('\\', '/');
			int slash = filename.lastIndexOf('/');
			directories.add(slash < 0 ? "" : filename.substring(0, slash));
		}
		if (directories.size() != 1)
			return null;
		String dir = directories.iterator().next();
		return dir.isEmpty() ? null : dir;
	}

	private void readSources(List<Element> sourceEls, String path, Map<String, String> tagsByName, DssDocument.Builder builder)
		throws DssParseException {
		List<Source> sources = new ArrayList<>();
		int baseIndex = -1;
		int defaultIndex = -1;
		for (Element sourceEl : sourceEls) {
			String filename = sourceEl.getAttributeValue("filename");
			if (filename == null) {
				theDiagnostics.error(Diagnostics.Category.CONTENT, SourcePosition.NONE,
					"Source " + sourceEl.getAttributeValue("name") + " has no filename");
				continue;
			}
			filename = filename.replace('\\', '/');
			if (path != null && filename.startsWith(path + "/"))
				filename = filename.substring(path.length() + 1);
			String stem = filename.substring(filename.lastIndexOf('/') + 1);
			if (stem.indexOf('.') > 0)
				stem = stem.substring(0, stem.lastIndexOf('.'));
			String layer = sourceEl.getAttributeValue("layer");
			Map<String, Double> location = fillDefaults(builder, readLocation(sourceEl.getChild("location"), tagsByName));
			if (baseIndex < 0 && isCopyingInfo(sourceEl))
				baseIndex = sources.size();
			if (defaultIndex < 0 && layer == null && isDefaultLocation(builder, location))
				defaultIndex = sources.size();
			sources.add(new Source(stem, filename, location, layer, false));
		}
		if (baseIndex < 0)
			baseIndex = defaultIndex;
		if (baseIndex < 0 && !sources.isEmpty())
			theDiagnostics.error(Diagnostics.Category.STRUCTURAL, SourcePosition.NONE,
				"No base source: no source copies info and none is at the default location");
		for (int i = 0; i < sources.size(); i++) {
			Source s = sources.get(i);
			builder.withSource(i == baseIndex ? new Source(s.getName(), s.getFilename(), s.getLocation(), s.getLayer(), true) : s);
		}
	}

	private static boolean isCopyingInfo(Element sourceEl) {
		for (String copied : new String[] { "info", "lib", "groups", "features" }) {
			Element el = sourceEl.getChild(copied);
			if (el != null && "1".equals(el.getAttributeValue("copy")))
				return true;
		}
		return false;
	}

	private static boolean isDefaultLocation(DssDocument.Builder builder, Map<String, Double> location) {
		for (Axis axis : allAxes(builder)) {
			Double value = location.get(axis.getTag());
			if (value != null && value != axis.getDefaultDesignValue())
				return false;
		}
		return true;
	}

	private Rule readRule(Element ruleEl, int index, Map<String, String> tagsByName) throws DssParseException {
		String name = ruleEl.getAttributeValue("name");
		if (name == null || name.isEmpty())
			name = Rule.AUTO_NAME_PREFIX + index;
		List<Element> conditionEls = new ArrayList<>(ruleEl.getChildren("condition"));
		List<Element> sets = ruleEl.getChildren("conditionset");
		if (!sets.isEmpty()) {
			conditionEls.addAll(sets.get(0).getChildren("condition"));
			if (sets.size() > 1)
				theDiagnostics.warn(Diagnostics.Category.ADVISORY, SourcePosition.NONE,
					"Rule " + name + " has " + sets.size() + " condition sets; only the first is kept");
		}
		List<RuleCondition> conditions = new ArrayList<>();
		for (Element conditionEl : conditionEls) {
			String tag = tagFor(conditionEl.getAttributeValue("name"), tagsByName);
			String minText = conditionEl.getAttributeValue("minimum");
			String maxText = conditionEl.getAttributeValue("maximum");
			if (tag == null || (minText == null && maxText == null)) {
				theDiagnostics.error(Diagnostics.Category.SEMANTIC, SourcePosition.NONE,
					"Invalid condition on axis '" + conditionEl.getAttributeValue("name") + "' in rule " + name);
				continue;
			}
			conditions.add(new RuleCondition(tag, minText == null ? null : number(minText, "condition of rule " + name),
				maxText == null ? null : number(maxText, "condition of rule " + name)));
		}
		List<Substitution> subs = new ArrayList<>();
		for (Element subEl : ruleEl.getChildren("sub"))
			subs.add(new Substitution(subEl.getAttributeValue("name"), subEl.getAttributeValue("with")));
		if (subs.isEmpty()) {
			theDiagnostics.warn(Diagnostics.Category.ADVISORY, SourcePosition.NONE, "Skipping rule '" + name + "': no substitutions");
			return null;
		}
		Collections.sort(subs);
		return new Rule(name, Collections.emptyList(), null, conditions, subs);
	}

	private void readSuffix(Element root, DssDocument.Builder builder) {
		Element lib = root.getChild("lib");
		Element dict = lib == null ? null : lib.getChild("dict");
		if (dict == null)
			return;
		List<Element> children = dict.getChildren();
		for (int i = 0; i + 1 < children.size(); i++) {
			if (children.get(i).getName().equals("key") && children.get(i).getTextTrim().equals(DesignSpaceWriter.SUFFIX_KEY))
				builder.withSuffix(children.get(i + 1).getTextTrim());
		}
	}

	/** Settles the instance mode by comparing the instances to the ones that would be generated */
	private DssDocument withInstances(DssDocument.Builder builder, List<Instance> instances) throws DssParseException {
		if (instances.isEmpty()) {
			builder.withInstanceMode(InstanceMode.OFF);
			return builder.build();
		}
		DssDocument auto = builder.build();
		List<Instance> generated = new InstanceGenerator(new Diagnostics(ValidationPolicy.LENIENT)).generate(auto);
		Set<Instance> visible = new HashSet<>();
		for (Instance instance : instances)
			visible.add(visibleOnly(auto, instance));
		if (generated.size() == instances.size() && visible.equals(new HashSet<>(generated))) {
			log.debug("Instances match the generated set; writing instances auto");
			return auto;
		}
		DssDocument.Builder explicit = auto.toBuilder().withInstanceMode(InstanceMode.EXPLICIT);
		for (Instance instance : instances)
			explicit.withInstance(instance);
		return explicit.build();
	}

	private static Instance visibleOnly(DssDocument document, Instance instance) {
		Map<String, Double> location = new LinkedHashMap<>();
		for (Axis axis : document.getAxes())
			location.put(axis.getTag(), instance.getLocation().getOrDefault(axis.getTag(), axis.getDefaultDesignValue()));
		return new Instance(instance.getFamilyName(), instance.getStyleName(), location, null);
	}

	private Map<String, Double> readLocation(Element el, Map<String, String> tagsByName) throws DssParseException {
		Map<String, Double> location = new LinkedHashMap<>();
		if (el == null)
			return location;
		for (Element dim : el.getChildren("dimension")) {
			String tag = tagFor(dim.getAttributeValue("name"), tagsByName);
			if (tag == null) {
				theDiagnostics.error(Diagnostics.Category.SEMANTIC, SourcePosition.NONE,
					"Location references undeclared axis '" + dim.getAttributeValue("name") + "'");
				continue;
			}
			String value = dim.getAttributeValue("xvalue");
			if (value == null)
				value = dim.getAttributeValue("uservalue");
			location.put(tag, number(value, "location on axis " + tag));
		}
		return location;
	}

	private static Map<String, Double> fillDefaults(DssDocument.Builder builder, Map<String, Double> location) {
		Map<String, Double> filled = new LinkedHashMap<>();
		for (Axis axis : allAxes(builder)) {
			Double value = location.get(axis.getTag());
			filled.put(axis.getTag(), value != null ? value : axis.getDefaultDesignValue());
		}
		return filled;
	}

	private static List<Axis> allAxes(DssDocument.Builder builder) {
		List<Axis> all = new ArrayList<>(builder.getAxes());
		all.addAll(builder.getHiddenAxes());
		return all;
	}

	private static String tagFor(String name, Map<String, String> tagsByName) {
		if (name == null)
			return null;
		String tag = tagsByName.get(name);
		if (tag != null)
			return tag;
		return tagsByName.containsValue(name) ? name : null;
	}

	private double number(String text, String what) throws DssParseException {
		Double value = text == null ? null : DssText.parseNumber(text.trim());
		if (value == null) {
			theDiagnostics.error(Diagnostics.Category.STRUCTURAL, SourcePosition.NONE, "Invalid number '" + text + "' for " + what);
			return 0;
		}
		return value;
	}
}
