package org.dssketch.designspace;

import java.util.Arrays;
import java.util.List;

import org.dssketch.io.Diagnostics;
import org.dssketch.io.DssParseException;
import org.dssketch.io.ValidationPolicy;
import org.dssketch.model.DssDocument;
import org.dssketch.parse.DssParser;
import org.jdom2.Element;
import org.junit.Assert;
import org.junit.Test;

/** Tests {@link DesignSpaceWriter} */
public class DesignSpaceWriterTest {
	static final String FAMILY = String.join("\n", //
		"family \"Test Sans\"", //
		"suffix .alt", //
		"path masters", //
		"axes", //
		"    ital discrete", //
		"        Upright @elidable", //
		"        Italic", //
		"    wght 100:400:900", //
		"        Thin > 20", //
		"        Regular > 80 @elidable", //
		"        Black > 200", //
		"    XOPQ 20:100:200", //
		"avar2", //
		"    \"heavy\" [wght=Black] > XOPQ=180", //
		"sources [ital, wght]", //
		"    TestSans-Thin [Upright, Thin]", //
		"    TestSans-Regular [Upright, Regular] @base", //
		"    TestSans-Black [Upright, Black]", //
		"    TestSans-Italic [Italic, Regular]", //
		"    TestSans-Sketch [Upright, Regular] @layer=\"sketch\"", //
		"rules", //
		"    dollar cent > .rvrn (weight >= Black) \"heavy\"", //
		"");

	static Element write(DssDocument doc) throws DssParseException {
		DesignSpaceConverter.Result result = new DesignSpaceConverter(new Diagnostics(ValidationPolicy.STRICT), null, null).convert(doc);
		return result.toXml().getRootElement();
	}

	private static Element child(Element parent, String name, String attr, String value) {
		for (Element child : parent.getChildren(name)) {
			if (value.equals(child.getAttributeValue(attr)))
				return child;
		}
		Assert.fail("No <" + name + " " + attr + "=\"" + value + "\"> in <" + parent.getName() + ">");
		return null;
	}

	/**
	 * Tests the axes, including labels, maps and hidden axes
	 *
	 * @throws DssParseException If the document is rejected
	 */
	@Test
	public void testAxes() throws DssParseException {
		Element root = write(DssParser.parse(FAMILY, ValidationPolicy.STRICT));
		Assert.assertEquals(DesignSpaceWriter.FORMAT_VERSION, root.getAttributeValue("format"));
		Element axes = root.getChild("axes");
		Assert.assertEquals(3, axes.getChildren("axis").size());

		Element ital = child(axes, "axis", "tag", "ital");
		Assert.assertEquals("italic", ital.getAttributeValue("name"));
		Assert.assertEquals("0 1", ital.getAttributeValue("values"));
		Assert.assertNull(ital.getAttributeValue("minimum"));
		Assert.assertTrue(ital.getChildren("map").isEmpty());

		Element wght = child(axes, "axis", "tag", "wght");
		Assert.assertEquals("100", wght.getAttributeValue("minimum"));
		Assert.assertEquals("400", wght.getAttributeValue("default"));
		Assert.assertEquals("900", wght.getAttributeValue("maximum"));
		Assert.assertEquals("20", child(wght, "map", "input", "100").getAttributeValue("output"));
		Element regular = child(wght.getChild("labels"), "label", "name", "Regular");
		Assert.assertEquals("400", regular.getAttributeValue("uservalue"));
		Assert.assertEquals("true", regular.getAttributeValue("elidable"));

		Element xopq = child(axes, "axis", "tag", "XOPQ");
		Assert.assertEquals("1", xopq.getAttributeValue("hidden"));
		Assert.assertNull(wght.getAttributeValue("hidden"));

		Element mapping = axes.getChild("mappings").getChild("mapping");
		Assert.assertEquals("heavy", mapping.getAttributeValue("description"));
		Element input = mapping.getChild("input").getChild("dimension");
		Assert.assertEquals("weight", input.getAttributeValue("name"));
		Assert.assertEquals("900", input.getAttributeValue("xvalue"));
		Assert.assertEquals("180", mapping.getChild("output").getChild("dimension").getAttributeValue("xvalue"));
	}

	/**
	 * Tests source paths, the base source, layers and locations
	 *
	 * @throws DssParseException If the document is rejected
	 */
	@Test
	public void testSources() throws DssParseException {
		Element sources = write(DssParser.parse(FAMILY, ValidationPolicy.STRICT)).getChild("sources");
		Assert.assertEquals(5, sources.getChildren("source").size());

		Element base = child(sources, "source", "name", "TestSans-Regular");
		Assert.assertEquals("masters/TestSans-Regular.ufo", base.getAttributeValue("filename"));
		Assert.assertEquals("Test Sans", base.getAttributeValue("familyname"));
		Assert.assertEquals("1", base.getChild("info").getAttributeValue("copy"));

		Element black = child(sources, "source", "name", "TestSans-Black");
		Assert.assertNull(black.getChild("info"));
		Assert.assertEquals("200", child(black.getChild("location"), "dimension", "name", "weight").getAttributeValue("xvalue"));
		Assert.assertEquals("100", child(black.getChild("location"), "dimension", "name", "XOPQ").getAttributeValue("xvalue"));

		Element sketch = child(sources, "source", "name", "TestSans-Sketch");
		Assert.assertEquals("sketch", sketch.getAttributeValue("layer"));
		Assert.assertEquals("masters/TestSans-Sketch.ufo", sketch.getAttributeValue("filename"));
	}

	/**
	 * Tests rules, generated instances and the suffix
	 *
	 * @throws DssParseException If the document is rejected
	 */
	@Test
	public void testRulesAndInstances() throws DssParseException {
		Element root = write(DssParser.parse(FAMILY, ValidationPolicy.STRICT));
		Element rule = root.getChild("rules").getChild("rule");
		Assert.assertEquals("heavy", rule.getAttributeValue("name"));
		Element condition = rule.getChild("conditionset").getChild("condition");
		Assert.assertEquals("weight", condition.getAttributeValue("name"));
		Assert.assertEquals("200", condition.getAttributeValue("minimum"));
		Assert.assertNull(condition.getAttributeValue("maximum"));
		List<Element> subs = rule.getChildren("sub");
		Assert.assertEquals(2, subs.size());
		Assert.assertEquals(Arrays.asList("cent", "dollar"),
			Arrays.asList(subs.get(0).getAttributeValue("name"), subs.get(1).getAttributeValue("name")));
		Assert.assertEquals("cent.rvrn", subs.get(0).getAttributeValue("with"));

		List<Element> instances = root.getChild("instances").getChildren("instance");
		Assert.assertEquals(6, instances.size());
		Element italic = child(root.getChild("instances"), "instance", "stylename", "Italic");
		Assert.assertEquals("Test Sans", italic.getAttributeValue("familyname"));
		Assert.assertEquals("TestSans-Italic", italic.getAttributeValue("postscriptfontname"));
		Assert.assertEquals("instances/TestSans-Italic.ufo", italic.getAttributeValue("filename"));
		Assert.assertEquals(2, italic.getChild("location").getChildren("dimension").size());

		Element dict = root.getChild("lib").getChild("dict");
		Assert.assertEquals(DesignSpaceWriter.SUFFIX_KEY, dict.getChildText("key"));
		Assert.assertEquals(".alt", dict.getChildText("string"));
	}

	/**
	 * Tests that sections without content are left out
	 *
	 * @throws DssParseException If the document is rejected
	 */
	@Test
	public void testMinimal() throws DssParseException {
		Element root = write(DssParser.parse(String.join("\n", //
			"family Minimal", //
			"axes", //
			"    wght 100:400:900", //
			"sources", //
			"    Minimal-Regular [400] @base", //
			"instances off", //
			""), ValidationPolicy.STRICT));
		Assert.assertNull(root.getChild("rules"));
		Assert.assertNull(root.getChild("instances"));
		Assert.assertNull(root.getChild("lib"));
		Assert.assertNull(root.getChild("axes").getChild("mappings"));
		Assert.assertEquals("Minimal-Regular.ufo", root.getChild("sources").getChild("source").getAttributeValue("filename"));
	}
}
