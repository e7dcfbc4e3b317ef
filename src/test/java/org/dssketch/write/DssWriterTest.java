package org.dssketch.write;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;

import java.util.Arrays;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

import org.dssketch.config.DssOptions;
import org.dssketch.config.StandardLabels;
import org.dssketch.io.DssParseException;
import org.dssketch.io.ValidationPolicy;
import org.dssketch.model.Axis;
import org.dssketch.model.AxisMapping;
import org.dssketch.model.DssDocument;
import org.dssketch.model.Rule;
import org.dssketch.model.RuleCondition;
import org.dssketch.model.Source;
import org.dssketch.model.Substitution;
import org.dssketch.parse.DssParser;
import org.junit.Assert;
import org.junit.Test;

/** Tests {@link DssWriter} */
public class DssWriterTest {
	private static final String ITALIC_FAMILY = String.join("\n", //
		"family \"Test Sans\"", //
		"path sources", //
		"", //
		"axes", //
		"    ital discrete", //
		"        Upright @elidable", //
		"        Italic", //
		"    wght Thin:Regular:Black", //
		"        Thin > 100", //
		"        Regular > 400 @elidable", //
		"        Black > 900", //
		"", //
		"sources [ital, wght]", //
		"    TestSans-Thin [Upright, Thin]", //
		"    TestSans-Regular [Upright, Regular] @base", //
		"    TestSans-Black [Upright, Black]", //
		"    TestSans-Italic [Italic, Regular]", //
		"", //
		"rules", //
		"    dollar cent > .rvrn (weight >= Black) \"heavy\"", //
		"    * > .ss01 (italic == Italic)", //
		"", //
		"instances auto", //
		"    skip", //
		"        Italic Thin", //
		"");

	private static DssDocument parse(CharSequence text) throws DssParseException {
		return DssParser.parse(text, ValidationPolicy.STRICT);
	}

	/**
	 * A document written in the preferred notation is written back identically
	 *
	 * @throws DssParseException If the document is rejected
	 */
	@Test
	public void testCanonicalText() throws DssParseException {
		Assert.assertEquals(ITALIC_FAMILY, new DssWriter(DssOptions.DEFAULT).write(parse(ITALIC_FAMILY)));
	}

	/**
	 * Tests that writing and re-reading a document yields the same document, for documents using most of the notation
	 *
	 * @throws DssParseException If a document or its written form is rejected
	 */
	@Test
	public void testRoundTrip() throws DssParseException {
		for (String text : Arrays.asList(ITALIC_FAMILY, String.join("\n", //
			"family Mappings", //
			"suffix .alt", //
			"axes", //
			"    wght 100:400:900", //
			"        Thin > 20", //
			"        450 Book > 95", //
			"        Regular > 80 @elidable", //
			"        Bold > 150", //
			"        Black > 200", //
			"    \"Optical Size\" opsz 8:14:144 \"Optical\"", //
			"        8 Caption > 8", //
			"        14 Text > 14 @elidable", //
			"        144 Display > 144", //
			"    contrast 0:100", //
			"    SERF discrete", //
			"        Sans @elidable", //
			"        Serif", //
			"sources [wght, opsz, contrast, SERF]", //
			"    masters/Light [Thin, Caption, 0, Sans]", //
			"    masters/Regular [Regular, Text, 0, Sans] @base", //
			"    \"Heavy Display.ufo\" [Black, Display, 100, Serif]", //
			"    Regular-sketch [Regular, Text, 0, Sans] @layer=\"sketch\"", //
			"rules", //
			"    A > A.alt (100 <= wght <= Bold && contrast >= 50)", //
			"    a > b (opsz == 144)", //
			"instances", //
			"    \"Display Black\" [Black, Display, 100, Serif]", //
			"    Light [40, 8, 0, Sans]", //
			""), String.join("\n", //
				"family Avar", //
				"axes", //
				"    wght 100:400:900", //
				"        Thin > 20", //
				"        Regular > 80 @elidable", //
				"        Black > 200", //
				"    XOPQ 20:100:200", //
				"    XTRA 300:400:500", //
				"avar2 vars", //
				"    $thin = 30", //
				"avar2", //
				"    [wght=Thin] > XOPQ=$thin", //
				"    [wght=Regular] > XOPQ=$, XTRA=$", //
				"    \"heavy\" [weight=Black] > XOPQ=180, XTRA=450", //
				"    [wght=600] > XTRA=420", //
				"sources", //
				"    Avar-Regular wght=Regular @base", //
				"    Avar-Thin wght=Thin", //
				"    Avar-Black wght=Black, XOPQ=180", //
				"instances off", //
				""))) {
			DssDocument doc = parse(text);
			for (DssOptions options : Arrays.asList(DssOptions.DEFAULT, DssOptions.DEFAULT.withLabels(false, false),
				DssOptions.DEFAULT.withAvar2Format(DssOptions.Avar2Format.LINEAR).withVariableThreshold(0))) {
				String written = new DssWriter(options).write(doc);
				DssDocument reparsed = parse(written);
				Assert.assertEquals(written, doc.getAxes(), reparsed.getAxes());
				Assert.assertEquals(written, doc.getHiddenAxes(), reparsed.getHiddenAxes());
				Assert.assertEquals(written, doc.getSources(), reparsed.getSources());
				Assert.assertEquals(written, doc.getRules(), reparsed.getRules());
				Assert.assertEquals(written, doc.getAvar2Mappings(), reparsed.getAvar2Mappings());
				Assert.assertEquals(written, doc.getInstanceMode(), reparsed.getInstanceMode());
				Assert.assertEquals(written, doc.getInstances(), reparsed.getInstances());
				Assert.assertEquals(written, doc.getSkips(), reparsed.getSkips());
				Assert.assertEquals(written, doc.getSuffix(), reparsed.getSuffix());
				Assert.assertEquals(written, written, new DssWriter(options).write(reparsed));
			}
		}
	}

	/**
	 * Without label options, ranges and coordinates are numeric
	 *
	 * @throws DssParseException If the document is rejected
	 */
	@Test
	public void testNumericOutput() throws DssParseException {
		String written = new DssWriter(DssOptions.DEFAULT.withLabels(false, false)).write(parse(ITALIC_FAMILY));
		assertThat(written, containsString("    wght 100:400:900\n"));
		assertThat(written, containsString("    TestSans-Black [0, 900]\n"));
		assertThat(written, containsString("(weight >= 900)"));
	}

	/** Axis mappings omit user values the parser would infer */
	@Test
	public void testMappings() {
		DssWriter writer = new DssWriter(DssOptions.DEFAULT, StandardLabels.load(null), null);
		Axis wght = new Axis("wght", "weight", null, 100, 400, 900, false, false, Collections.<AxisMapping> emptyList());
		Assert.assertEquals("Bold > 680", writer.formatMapping(wght, new AxisMapping("Bold", 700, 680, false), 0));
		Assert.assertEquals("720 Bold > 680", writer.formatMapping(wght, new AxisMapping("Bold", 720, 680, false), 0));
		Assert.assertEquals("Fat > 650", writer.formatMapping(wght, new AxisMapping("Fat", 650, 650, false), 0));
		// Would be read as a misspelling of Bold
		Assert.assertEquals("700 Bolt > 700", writer.formatMapping(wght, new AxisMapping("Bolt", 700, 700, false), 0));
		Assert.assertEquals("600 \"Semi Bold\" > 600 @elidable",
			writer.formatMapping(wght, new AxisMapping("Semi Bold", 600, 600, true), 0));

		Axis serf = new Axis("SERF", "SERF", null, 0, 0, 1, true, false, Collections.<AxisMapping> emptyList());
		Assert.assertEquals("Serif", writer.formatMapping(serf, new AxisMapping("Serif", 1, 1, false), 1));
		Assert.assertEquals("Sans > 1", writer.formatMapping(serf, new AxisMapping("Sans", 1, 1, false), 0));
	}

	/** With the glyph names of the sources, concrete rules read from designspace files are written as wildcards */
	@Test
	public void testRuleCompression() {
		Axis wght = new Axis("wght", "weight", null, 100, 400, 900, false, false,
			Arrays.asList(new AxisMapping("Regular", 400, 400, true), new AxisMapping("Bold", 700, 700, false)));
		DssDocument doc = DssDocument.build().withFamily("Rules").withAxis(wght)
			.withSource(new Source("Rules-Regular", "Rules-Regular.ufo", Collections.singletonMap("wght", 400.0), null, true))
			.withRule(new Rule("rule1", Collections.<String> emptyList(), null, Arrays.asList(new RuleCondition("wght", 700.0, null)),
				Arrays.asList(new Substitution("cent", "cent.rvrn"), new Substitution("dollar", "dollar.rvrn"))))
			.build();
		Set<String> glyphs = new TreeSet<>(Arrays.asList("cent", "cent.rvrn", "dollar", "dollar.rvrn"));
		assertThat(new DssWriter(DssOptions.DEFAULT, StandardLabels.load(null), glyphs).write(doc),
			containsString("    * > .rvrn (weight >= Bold)\n"));

		String withoutGlyphs = new DssWriter(DssOptions.DEFAULT, StandardLabels.load(null), null).write(doc);
		assertThat(withoutGlyphs, containsString("    cent dollar > .rvrn (weight >= Bold)\n"));
		assertThat(withoutGlyphs, not(containsString("rule1")));
	}
}
