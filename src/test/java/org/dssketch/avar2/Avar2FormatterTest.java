package org.dssketch.avar2;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.dssketch.config.DssOptions;
import org.dssketch.io.DssParseException;
import org.dssketch.io.ValidationPolicy;
import org.dssketch.model.Avar2Variable;
import org.dssketch.model.DssDocument;
import org.dssketch.parse.DssParser;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/** Tests {@link VariableTable} and {@link Avar2Formatter} */
public class Avar2FormatterTest {
	private static final String AXES = String.join("\n", //
		"family Avar", //
		"axes", //
		"    wght 100:400:900", //
		"        Thin > 100", //
		"        Regular > 400 @elidable", //
		"        Bold > 700", //
		"        Black > 900", //
		"    XOPQ 20:100:200", //
		"avar2 vars", //
		"    $thin = 30", //
		"");
	private static final String SOURCES = String.join("\n", //
		"sources", //
		"    Avar-Regular [Regular] @base", //
		"    Avar-Thin [Thin]", //
		"    Avar-Black [Black]", //
		"");

	private DssDocument theDocument;

	/** @throws DssParseException If the document is rejected */
	@Before
	public void parse() throws DssParseException {
		theDocument = DssParser.parse(AXES + String.join("\n", //
			"avar2", //
			"    [wght=Thin] > XOPQ=$thin", //
			"    [wght=Regular] > XOPQ=$", //
			"    \"heavy\" [wght=Black] > XOPQ=180", //
			"    [wght=750] > XOPQ=180", //
			"") + SOURCES, ValidationPolicy.STRICT);
	}

	@Test
	public void testExtraction() {
		VariableTable table = VariableTable.extract(theDocument, 2);
		Assert.assertEquals(Arrays.asList(new Avar2Variable("thin", 30), new Avar2Variable("XOPQ_180", 180)), table.getVariables());
		Assert.assertEquals(1, table.getUsage("thin"));
		Assert.assertEquals(2, table.getUsage("XOPQ_180"));
		Assert.assertEquals("XOPQ_180", table.lookup(180).getName());
		Assert.assertNull(table.lookup(100));

		Assert.assertEquals(Arrays.asList(new Avar2Variable("thin", 30)), VariableTable.extract(theDocument, 3).getVariables());
		Assert.assertTrue(VariableTable.extract(theDocument, 0).getVariables().isEmpty());
	}

	@Test
	public void testLinear() {
		Avar2Formatter formatter = new Avar2Formatter(theDocument, VariableTable.extract(theDocument, 2), "    ");
		Assert.assertEquals(Arrays.asList(//
			"avar2 vars", //
			"    $thin = 30  # used 1 time", //
			"    $XOPQ_180 = 180  # used 2 times"), formatter.formatVariables());
		Assert.assertEquals(Arrays.asList(//
			"avar2", //
			"    [wght=Thin] > XOPQ=$thin", //
			"    [wght=Regular] > XOPQ=$", //
			"    \"heavy\" [wght=Black] > XOPQ=$XOPQ_180", //
			"    [wght=750] > XOPQ=$XOPQ_180"), formatter.formatMappings(DssOptions.Avar2Format.LINEAR));
	}

	/**
	 * Without variables, outputs are written as numbers, except axis defaults
	 */
	@Test
	public void testNoVariables() {
		Avar2Formatter formatter = new Avar2Formatter(theDocument, VariableTable.empty(), "    ");
		Assert.assertTrue(formatter.formatVariables().isEmpty());
		List<String> lines = formatter.formatMappings(DssOptions.Avar2Format.LINEAR);
		Assert.assertEquals("    [wght=Thin] > XOPQ=30", lines.get(1));
		Assert.assertEquals("    [wght=Regular] > XOPQ=$", lines.get(2));
	}

	/**
	 * The matrix layout is only used when the document has hidden axes, and reads back to the same mappings
	 *
	 * @throws DssParseException If the written matrix is rejected
	 */
	@Test
	public void testMatrix() throws DssParseException {
		VariableTable variables = VariableTable.extract(theDocument, 2);
		Avar2Formatter formatter = new Avar2Formatter(theDocument, variables, "    ");
		Assert.assertEquals(DssOptions.Avar2Format.MATRIX, formatter.chooseFormat(DssOptions.Avar2Format.MATRIX));
		List<String> lines = formatter.formatMappings(DssOptions.Avar2Format.MATRIX);
		Assert.assertEquals("avar2 matrix", lines.get(0));
		Assert.assertEquals("    outputs               XOPQ", lines.get(1));
		Assert.assertEquals("    [wght=Thin]           $thin", lines.get(2));

		StringBuilder text = new StringBuilder(AXES.substring(0, AXES.indexOf("avar2 vars")));
		for (String line : formatter.formatVariables())
			text.append(line).append('\n');
		for (String line : lines)
			text.append(line).append('\n');
		text.append(SOURCES);
		DssDocument reparsed = DssParser.parse(text, ValidationPolicy.STRICT);
		Assert.assertEquals(theDocument.getAvar2Mappings(), reparsed.getAvar2Mappings());
	}

	/** @throws DssParseException If the document is rejected */
	@Test
	public void testLinearWithoutHiddenAxes() throws DssParseException {
		DssDocument doc = DssParser.parse(String.join("\n", //
			"family Visible", //
			"axes", //
			"    wght 100:400:900", //
			"    wdth 75:100:100", //
			"avar2", //
			"    [wght=900] > XOPQ=120, wdth=90", //
			"    [wdth=75] > wght=500", //
			"axes hidden", //
			"    XOPQ 20:100:200", //
			"sources", //
			"    V-Regular [400, 100] @base", //
			""), ValidationPolicy.LENIENT);
		Avar2Formatter formatter = new Avar2Formatter(doc, VariableTable.empty(), "    ");
		Assert.assertEquals(DssOptions.Avar2Format.MATRIX, formatter.chooseFormat(DssOptions.Avar2Format.MATRIX));

		DssDocument noHidden = doc.toBuilder().withHiddenTags(Collections.<String> emptyList()).build();
		Assert.assertEquals(DssOptions.Avar2Format.LINEAR,
			new Avar2Formatter(noHidden, VariableTable.empty(), "    ").chooseFormat(DssOptions.Avar2Format.MATRIX));
	}
}
