package org.dssketch.rules;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.dssketch.io.Diagnostics;
import org.dssketch.io.DssParseException;
import org.dssketch.io.SourcePosition;
import org.dssketch.io.ValidationPolicy;
import org.dssketch.model.Axis;
import org.dssketch.model.AxisMapping;
import org.dssketch.model.RuleCondition;
import org.junit.Assert;
import org.junit.Test;

/** Tests {@link ConditionParser} */
public class ConditionParserTest {
	private static final List<Axis> AXES = Arrays.asList(//
		new Axis("wght", "weight", null, 100, 400, 900, false, false, Arrays.asList(//
			new AxisMapping("Thin", 100, 30, false), //
			new AxisMapping("Regular", 400, 90, true), //
			new AxisMapping("Bold", 700, 160, false), //
			new AxisMapping("Black", 900, 210, false))), //
		new Axis("ital", "italic", null, 0, 0, 1, true, false, Arrays.asList(//
			new AxisMapping("Upright", 0, 0, true), //
			new AxisMapping("Italic", 1, 1, false))));

	/**
	 * Tests the comparison and range forms, with labels resolved to design values
	 *
	 * @throws DssParseException If a condition is rejected
	 */
	@Test
	public void testForms() throws DssParseException {
		ConditionParser parser = new ConditionParser(AXES, new Diagnostics(ValidationPolicy.STRICT));
		Assert.assertEquals(Arrays.asList(new RuleCondition("wght", 160.0, null)), parser.parse("wght >= Bold", SourcePosition.NONE));
		Assert.assertEquals(Arrays.asList(new RuleCondition("wght", null, 100.0)), parser.parse("weight<=100", SourcePosition.NONE));
		Assert.assertEquals(Arrays.asList(new RuleCondition("wght", 90.0, 160.0)),
			parser.parse("Regular <= wght <= Bold", SourcePosition.NONE));
		Assert.assertEquals(Arrays.asList(new RuleCondition("wght", 210.0, 210.0), new RuleCondition("ital", 1.0, 1.0)),
			parser.parse("wght == Black && italic == Italic", SourcePosition.NONE));
		Assert.assertEquals(Collections.emptyList(), parser.parse("  ", SourcePosition.NONE));
	}

	/**
	 * Malformed and inverted conditions are content errors, left out of the result when parsing leniently
	 *
	 * @throws DssParseException If a condition is fatally rejected
	 */
	@Test
	public void testContentErrors() throws DssParseException {
		Diagnostics diagnostics = new Diagnostics(ValidationPolicy.LENIENT);
		ConditionParser parser = new ConditionParser(AXES, diagnostics);
		Assert.assertEquals(Arrays.asList(new RuleCondition("ital", 1.0, null)),
			parser.parse("wght ~ 100 && 160 <= wght <= 90 && ital >= 1", SourcePosition.NONE));
		Assert.assertEquals(2, diagnostics.getErrors().size());
		assertThat(diagnostics.getErrors().get(0).message, containsString("Cannot parse condition 'wght ~ 100'"));
		assertThat(diagnostics.getErrors().get(1).message, containsString("inverted: 160 > 90"));
	}

	/** Conditions are design-space values, so user-space values beyond the design range are errors */
	@Test
	public void testDesignRange() {
		try {
			new ConditionParser(AXES, new Diagnostics(ValidationPolicy.STRICT)).parse("wght >= 700", SourcePosition.NONE);
			Assert.fail("A value outside the design range must be rejected");
		} catch (DssParseException e) {
			assertThat(e.getMessage(), containsString("outside the design-space range of axis wght (30 to 210)"));
		}
	}

	@Test
	public void testSemanticErrors() {
		ConditionParser parser = new ConditionParser(AXES, new Diagnostics(ValidationPolicy.LENIENT));
		try {
			parser.parse("wght >= Heavy", SourcePosition.NONE);
			Assert.fail("Unknown labels must be rejected");
		} catch (DssParseException e) {
			assertThat(e.getMessage(), containsString("Unknown label 'Heavy' for axis wght"));
		}
		try {
			parser.parse("opsz >= 12", SourcePosition.NONE);
			Assert.fail("Undeclared axes must be rejected");
		} catch (DssParseException e) {
			assertThat(e.getMessage(), containsString("undeclared axis 'opsz'"));
		}
	}
}
