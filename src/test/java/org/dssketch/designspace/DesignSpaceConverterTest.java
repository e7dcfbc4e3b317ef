package org.dssketch.designspace;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;

import java.io.FileNotFoundException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.dssketch.io.Diagnostics;
import org.dssketch.io.DssParseException;
import org.dssketch.io.ValidationPolicy;
import org.dssketch.model.DssDocument;
import org.dssketch.model.Substitution;
import org.dssketch.parse.DssParser;
import org.dssketch.rules.GlyphNameProvider;
import org.junit.Assert;
import org.junit.Test;

/** Tests {@link DesignSpaceConverter} */
public class DesignSpaceConverterTest {
	private static final String NO_FAMILY = String.join("\n", //
		"path masters", //
		"axes", //
		"    wght 100:400:900", //
		"        Thin > 100", //
		"        Regular > 400 @elidable", //
		"        Black > 900", //
		"sources", //
		"    Conv-Regular [Regular] @base", //
		"    Conv-Black [Black]", //
		"    Conv-Sketch [Regular] @layer=\"sketch\"", //
		"rules", //
		"    dollar* > .rvrn (weight >= 700)", //
		"");

	private static final Map<String, Set<String>> GLYPHS = new HashMap<>();
	static {
		GLYPHS.put("masters/Conv-Regular.ufo", new TreeSet<>(Arrays.asList("cent", "dollar", "dollar.bold", "dollar.rvrn")));
		GLYPHS.put("masters/Conv-Black.ufo", new TreeSet<>(Arrays.asList("dollar", "dollar.rvrn", "dollar.sc")));
	}

	private static final GlyphNameProvider GLYPH_NAMES = file -> {
		Set<String> names = GLYPHS.get(file);
		if (names == null)
			throw new FileNotFoundException(file);
		return names;
	};

	/**
	 * Tests that the family name comes from the base source and wildcard rules are expanded against every source's glyphs
	 *
	 * @throws DssParseException If the document is rejected
	 */
	@Test
	public void testConvert() throws DssParseException {
		Diagnostics diagnostics = new Diagnostics(ValidationPolicy.STRICT);
		DesignSpaceConverter converter = new DesignSpaceConverter(diagnostics, GLYPH_NAMES,
			file -> file.equals("masters/Conv-Regular.ufo") ? "Converted" : null);
		DesignSpaceConverter.Result result = converter.convert(DssParser.parse(NO_FAMILY, ValidationPolicy.STRICT));

		DssDocument doc = result.getDocument();
		Assert.assertEquals("Converted", doc.getFamily());
		Assert.assertEquals(Arrays.asList(new Substitution("dollar", "dollar.rvrn")), doc.getRules().get(0).getSubstitutions());
		// dollar.bold and dollar.sc have no .rvrn alternate
		Assert.assertEquals(2, diagnostics.getWarnings().size());
		Assert.assertFalse(diagnostics.hasErrors());

		Assert.assertEquals(3, result.getInstances().size());
		Assert.assertEquals("Converted Black", result.getInstances().get(2).getName());
		assertThat(result.toXmlString(), containsString("<sub name=\"dollar\" with=\"dollar.rvrn\" />"));
	}

	/**
	 * Layer sources share the file of another source and are not read for glyph names
	 *
	 * @throws DssParseException If the document is rejected
	 */
	@Test
	public void testCollectGlyphNames() throws DssParseException {
		DssDocument doc = DssParser.parse("family Conv\n" + NO_FAMILY, ValidationPolicy.STRICT);
		Diagnostics diagnostics = new Diagnostics(ValidationPolicy.STRICT);
		Set<String> names = new DesignSpaceConverter(diagnostics, GLYPH_NAMES, null).collectGlyphNames(doc);
		Assert.assertEquals(new TreeSet<>(Arrays.asList("cent", "dollar", "dollar.bold", "dollar.rvrn", "dollar.sc")), names);
		Assert.assertTrue(diagnostics.getIssues().isEmpty());

		Assert.assertNull(new DesignSpaceConverter(diagnostics, null, null).collectGlyphNames(doc));

		GlyphNameProvider missing = file -> {
			throw new FileNotFoundException(file);
		};
		Assert.assertNull(new DesignSpaceConverter(diagnostics, missing, null).collectGlyphNames(doc));
		Assert.assertEquals(2, diagnostics.getWarnings().size());
	}

	/**
	 * Without glyph names, wildcard rules cannot be expanded and are dropped with warnings
	 *
	 * @throws DssParseException If the document is rejected
	 */
	@Test
	public void testNoGlyphNames() throws DssParseException {
		Diagnostics diagnostics = new Diagnostics(ValidationPolicy.LENIENT);
		DesignSpaceConverter.Result result = new DesignSpaceConverter(diagnostics, null, null)
			.convert(DssParser.parse("family Conv\n" + NO_FAMILY, ValidationPolicy.STRICT));
		Assert.assertTrue(result.getDocument().getRules().isEmpty());
		assertThat(diagnostics.getWarnings().get(0).message, containsString("Cannot expand pattern 'dollar*'"));
		Assert.assertNull(result.toXml().getRootElement().getChild("rules"));
	}

	/**
	 * A document without a family name and no way to find one is rejected
	 *
	 * @throws DssParseException If the document is rejected by the parser
	 */
	@Test
	public void testNoFamily() throws DssParseException {
		DssDocument doc = DssParser.parse(NO_FAMILY, ValidationPolicy.STRICT);
		try {
			new DesignSpaceConverter(new Diagnostics(ValidationPolicy.LENIENT), GLYPH_NAMES, file -> null).convert(doc);
			Assert.fail("A document without a family name must be rejected");
		} catch (DssParseException e) {
			assertThat(e.getMessage(), containsString("No family name"));
		}
		Assert.assertEquals(Collections.emptyList(), doc.getInstances());
	}
}
