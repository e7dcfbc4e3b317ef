package org.dssketch.rules;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.dssketch.io.Diagnostics;
import org.dssketch.io.DssParseException;
import org.dssketch.io.ValidationPolicy;
import org.dssketch.model.Rule;
import org.dssketch.model.RuleCondition;
import org.dssketch.model.Substitution;
import org.junit.Assert;
import org.junit.Test;

/** Tests {@link RuleResolver} */
public class RuleResolverTest {
	private static final List<RuleCondition> HEAVY = Arrays.asList(new RuleCondition("wght", 700.0, null));

	private static Set<String> glyphs(String... names) {
		return new TreeSet<>(Arrays.asList(names));
	}

	private static Rule rule(String target, String... patterns) {
		return new Rule("heavy", Arrays.asList(patterns), target, HEAVY, Collections.emptyList());
	}

	/**
	 * A universal suffix rule substitutes only glyphs whose suffixed form exists, and never glyphs already carrying the suffix
	 *
	 * @throws DssParseException If a warning is fatal, which it should not be
	 */
	@Test
	public void testUniversalSuffix() throws DssParseException {
		Diagnostics diagnostics = new Diagnostics(ValidationPolicy.STRICT);
		Rule resolved = new RuleResolver(glyphs("cent", "cent.rvrn", "dollar"), diagnostics).resolve(rule(".rvrn", "*"));
		Assert.assertEquals(Arrays.asList(new Substitution("cent", "cent.rvrn")), resolved.getSubstitutions());
		Assert.assertEquals(Arrays.asList("*"), resolved.getPatterns());
		Assert.assertEquals(HEAVY, resolved.getConditions());
		Assert.assertEquals(1, diagnostics.getWarnings().size());
		Assert.assertTrue(diagnostics.getWarnings().get(0).message.contains("dollar.rvrn"));
	}

	/** @throws DssParseException If a warning is fatal, which it should not be */
	@Test
	public void testPrefixAndExplicit() throws DssParseException {
		Set<String> names = glyphs("A", "A.alt", "dollar", "dollar.alt", "dollarbar", "dollarbar.alt", "euro");
		Rule resolved = new RuleResolver(names, new Diagnostics(ValidationPolicy.STRICT)).resolve(rule(".alt", "dollar*", "A"));
		Assert.assertEquals(Arrays.asList(new Substitution("A", "A.alt"), new Substitution("dollar", "dollar.alt"),
			new Substitution("dollarbar", "dollarbar.alt")), resolved.getSubstitutions());

		resolved = new RuleResolver(names, new Diagnostics(ValidationPolicy.STRICT)).resolve(rule("euro", "dollar", "dollarbar"));
		Assert.assertEquals(Arrays.asList(new Substitution("dollar", "euro"), new Substitution("dollarbar", "euro")),
			resolved.getSubstitutions());
	}

	/** @throws DssParseException If a warning is fatal, which it should not be */
	@Test
	public void testEmptyRulesDropped() throws DssParseException {
		Diagnostics diagnostics = new Diagnostics(ValidationPolicy.STRICT);
		List<Rule> resolved = new RuleResolver(glyphs("A", "A.alt"), diagnostics).resolveAll(Arrays.asList(//
			rule(".alt", "A"), //
			rule(".alt", "Q")));
		Assert.assertEquals(1, resolved.size());
		Assert.assertEquals(2, diagnostics.getWarnings().size());
		Assert.assertTrue(diagnostics.getWarnings().get(0).message.contains("glyph not found"));
		Assert.assertTrue(diagnostics.getWarnings().get(1).message.contains("no valid substitutions"));
	}

	/**
	 * Without glyph names, explicit substitutions are kept unchecked and wildcards cannot be expanded
	 *
	 * @throws DssParseException If a warning is fatal, which it should not be
	 */
	@Test
	public void testNoGlyphNames() throws DssParseException {
		Diagnostics diagnostics = new Diagnostics(ValidationPolicy.STRICT);
		Rule resolved = new RuleResolver(null, diagnostics).resolve(rule(".alt", "A", "B*"));
		Assert.assertEquals(Arrays.asList(new Substitution("A", "A.alt")), resolved.getSubstitutions());
		Assert.assertTrue(diagnostics.getWarnings().get(0).message.contains("Cannot expand pattern 'B*'"));
	}

	/**
	 * Rules read from designspace XML have substitutions but no patterns and pass through unchanged
	 *
	 * @throws DssParseException If a warning is fatal, which it should not be
	 */
	@Test
	public void testConcreteRule() throws DssParseException {
		Rule concrete = new Rule("swap", Collections.emptyList(), null, HEAVY, Arrays.asList(new Substitution("a", "a.alt")));
		Assert.assertSame(concrete, new RuleResolver(glyphs("a"), new Diagnostics(ValidationPolicy.STRICT)).resolve(concrete));
	}
}
