package org.dssketch.designspace;

import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.util.List;
import java.util.Map;

import org.dssketch.io.DssText;
import org.dssketch.model.Avar2Mapping;
import org.dssketch.model.Axis;
import org.dssketch.model.AxisMapping;
import org.dssketch.model.DssDocument;
import org.dssketch.model.Instance;
import org.dssketch.model.Rule;
import org.dssketch.model.RuleCondition;
import org.dssketch.model.Source;
import org.dssketch.model.Substitution;
import org.jdom2.Document;
import org.jdom2.Element;
import org.jdom2.Namespace;
import org.jdom2.output.Format;
import org.jdom2.output.XMLOutputter;

/**
 * Writes a document as designspace XML, format 5. Rules are written with the concrete substitutions they carry, so they should be
 * resolved against the glyphs of the sources first. Instances are written as given.
 */
public class DesignSpaceWriter {
	/** The designspace format version written */
	public static final String FORMAT_VERSION = "5.0";
	/** The lib key under which the document's glyph suffix is stored */
	public static final String SUFFIX_KEY = "org.dssketch.suffix";

	/**
	 * @param document The document to write
	 * @param instances The instances to write
	 * @return The designspace XML document
	 */
	public Document toXml(DssDocument document, List<Instance> instances) {
		Element root = new Element("designspace");
		root.setAttribute("format", FORMAT_VERSION);

		Element axes = new Element("axes");
		root.addContent(axes);
		for (Axis axis : document.getAllAxes())
			axes.addContent(axisXml(axis));
		if (!document.getAvar2Mappings().isEmpty()) {
			Element mappings = new Element("mappings");
			axes.addContent(mappings);
			for (Avar2Mapping mapping : document.getAvar2Mappings())
				mappings.addContent(avar2Xml(document, mapping));
		}

		if (!document.getRules().isEmpty()) {
			Element rules = new Element("rules");
			for (Rule rule : document.getRules()) {
				if (!rule.getSubstitutions().isEmpty())
					rules.addContent(ruleXml(document, rule));
			}
			if (!rules.getChildren().isEmpty())
				root.addContent(rules);
		}

		Element sources = new Element("sources");
		root.addContent(sources);
		for (Source source : document.getSources())
			sources.addContent(sourceXml(document, source));

		if (!instances.isEmpty()) {
			Element instancesEl = new Element("instances");
			root.addContent(instancesEl);
			for (Instance instance : instances)
				instancesEl.addContent(instanceXml(document, instance));
		}

		if (document.getSuffix() != null) {
			Element dict = new Element("dict");
			dict.addContent(new Element("key").setText(SUFFIX_KEY));
			dict.addContent(new Element("string").setText(document.getSuffix()));
			root.addContent(new Element("lib").addContent(dict));
		}
		return new Document(root);
	}

	/**
	 * @param document The document to write
	 * @param instances The instances to write
	 * @param out The stream to write the XML to
	 * @throws IOException If the stream cannot be written
	 */
	public void write(DssDocument document, List<Instance> instances, OutputStream out) throws IOException {
		createOutputter().output(toXml(document, instances), out);
	}

	/**
	 * @param document The document to write
	 * @param instances The instances to write
	 * @return The designspace XML text
	 */
	public String writeToString(DssDocument document, List<Instance> instances) {
		StringWriter writer = new StringWriter();
		try {
			createOutputter().output(toXml(document, instances), writer);
		} catch (IOException e) {
			throw new IllegalStateException("Could not write to a string", e);
		}
		return writer.toString();
	}

	private static XMLOutputter createOutputter() {
		Format format = Format.getPrettyFormat();
		format.setIndent("\t");
		return new XMLOutputter(format);
	}

	private Element axisXml(Axis axis) {
		Element el = new Element("axis");
		el.setAttribute("tag", axis.getTag());
		el.setAttribute("name", axis.getName());
		if (axis.isDiscrete()) {
			StringBuilder values = new StringBuilder();
			if (axis.getMappings().isEmpty()) {
				for (double v = axis.getMinimum(); v <= axis.getMaximum(); v++)
					values.append(values.length() == 0 ? "" : " ").append(DssText.formatNumber(v));
			} else {
				for (AxisMapping mapping : axis.getMappings())
					values.append(values.length() == 0 ? "" : " ").append(DssText.formatNumber(mapping.getUserValue()));
			}
			el.setAttribute("values", values.toString());
		} else {
			el.setAttribute("minimum", DssText.formatNumber(axis.getMinimum()));
			el.setAttribute("maximum", DssText.formatNumber(axis.getMaximum()));
		}
		el.setAttribute("default", DssText.formatNumber(axis.getDefault()));
		if (axis.isHidden())
			el.setAttribute("hidden", "1");
		if (axis.getDisplayName() != null) {
			Element labelName = new Element("labelname").setText(axis.getDisplayName());
			labelName.setAttribute("lang", "en", Namespace.XML_NAMESPACE);
			el.addContent(labelName);
		}
		for (AxisMapping mapping : axis.getMappings()) {
			if (mapping.getUserValue() != mapping.getDesignValue() || !axis.isDiscrete()) {
				el.addContent(new Element("map")//
					.setAttribute("input", DssText.formatNumber(mapping.getUserValue()))//
					.setAttribute("output", DssText.formatNumber(mapping.getDesignValue())));
			}
		}
		if (!axis.getMappings().isEmpty()) {
			Element labels = new Element("labels");
			el.addContent(labels);
			for (AxisMapping mapping : axis.getMappings()) {
				Element label = new Element("label");
				label.setAttribute("uservalue", DssText.formatNumber(mapping.getUserValue()));
				label.setAttribute("name", mapping.getLabel());
				if (mapping.isElidable())
					label.setAttribute("elidable", "true");
				labels.addContent(label);
			}
		}
		return el;
	}

	private Element avar2Xml(DssDocument document, Avar2Mapping mapping) {
		Element el = new Element("mapping");
		if (mapping.getName() != null)
			el.setAttribute("description", mapping.getName());
		el.addContent(dimensions(document, new Element("input"), mapping.getInput()));
		el.addContent(dimensions(document, new Element("output"), mapping.getOutput()));
		return el;
	}

	private Element ruleXml(DssDocument document, Rule rule) {
		Element el = new Element("rule");
		el.setAttribute("name", rule.getName());
		Element conditions = new Element("conditionset");
		el.addContent(conditions);
		for (RuleCondition condition : rule.getConditions()) {
			Element condEl = new Element("condition");
			condEl.setAttribute("name", axisName(document, condition.getAxisTag()));
			if (condition.getMinimum() != null)
				condEl.setAttribute("minimum", DssText.formatNumber(condition.getMinimum()));
			if (condition.getMaximum() != null)
				condEl.setAttribute("maximum", DssText.formatNumber(condition.getMaximum()));
			conditions.addContent(condEl);
		}
		for (Substitution sub : rule.getSubstitutions())
			el.addContent(new Element("sub").setAttribute("name", sub.getFrom()).setAttribute("with", sub.getTo()));
		return el;
	}

	private Element sourceXml(DssDocument document, Source source) {
		Element el = new Element("source");
		el.setAttribute("filename", sourcePath(document, source));
		el.setAttribute("name", source.getName());
		if (document.getFamily() != null)
			el.setAttribute("familyname", document.getFamily());
		if (source.getLayer() != null)
			el.setAttribute("layer", source.getLayer());
		if (source.isBase()) {
			for (String copied : new String[] { "lib", "groups", "features", "info" })
				el.addContent(new Element(copied).setAttribute("copy", "1"));
		}
		el.addContent(dimensions(document, new Element("location"), source.getLocation()));
		return el;
	}

	/**
	 * @param document The document
	 * @param source The source
	 * @return The path of the source's file relative to the designspace file
	 */
	public static String sourcePath(DssDocument document, Source source) {
		String path = document.getPath();
		if (path == null || path.isEmpty() || path.equals("."))
			return source.getFilename();
		path = path.replace('\\', '/');
		return path.endsWith("/") ? path + source.getFilename() : path + "/" + source.getFilename();
	}

	private Element instanceXml(DssDocument document, Instance instance) {
		Element el = new Element("instance");
		el.setAttribute("name", instance.getName());
		el.setAttribute("familyname", instance.getFamilyName());
		el.setAttribute("stylename", instance.getStyleName());
		el.setAttribute("filename", instance.getFilename());
		el.setAttribute("postscriptfontname", instance.getPostScriptName());
		el.addContent(dimensions(document, new Element("location"), instance.getLocation()));
		return el;
	}

	private Element dimensions(DssDocument document, Element parent, Map<String, Double> location) {
		for (Map.Entry<String, Double> dim : location.entrySet()) {
			parent.addContent(new Element("dimension")//
				.setAttribute("name", axisName(document, dim.getKey()))//
				.setAttribute("xvalue", DssText.formatNumber(dim.getValue())));
		}
		return parent;
	}

	private static String axisName(DssDocument document, String tag) {
		Axis axis = document.getAxis(tag);
		return axis == null ? tag : axis.getName();
	}
}
