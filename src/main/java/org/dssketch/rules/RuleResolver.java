package org.dssketch.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.apache.log4j.Logger;
import org.dssketch.io.Diagnostics;
import org.dssketch.io.DssParseException;
import org.dssketch.io.SourcePosition;
import org.dssketch.model.Rule;
import org.dssketch.model.Substitution;

/**
 * Expands the glyph patterns of rules into concrete substitutions against the set of glyph names in the sources. A substitution
 * whose target glyph does not exist is skipped with a warning, as is a rule left without any substitution.
 */
public class RuleResolver {
	private static final Logger log = Logger.getLogger(RuleResolver.class);

	private final Set<String> theGlyphNames;
	private final Diagnostics theDiagnostics;

	/**
	 * @param glyphNames The glyph names available in the sources, or null if they could not be determined
	 * @param diagnostics The diagnostics to report skipped substitutions and rules to
	 */
	public RuleResolver(Set<String> glyphNames, Diagnostics diagnostics) {
		theGlyphNames = glyphNames;
		theDiagnostics = diagnostics;
	}

	/**
	 * @param rules The rules to resolve
	 * @return The resolved rules, without those that have no substitutions
	 * @throws DssParseException If the diagnostics policy considers a skipped substitution fatal
	 */
	public List<Rule> resolveAll(List<Rule> rules) throws DssParseException {
		List<Rule> resolved = new ArrayList<>(rules.size());
		for (Rule rule : rules) {
			Rule r = resolve(rule);
			if (r != null)
				resolved.add(r);
		}
		return resolved;
	}

	/**
	 * @param rule The rule to resolve
	 * @return The rule with its concrete substitutions, sorted by source glyph, or null if the rule has none
	 * @throws DssParseException If the diagnostics policy considers a skipped substitution fatal
	 */
	public Rule resolve(Rule rule) throws DssParseException {
		if (rule.getPatterns().isEmpty()) {
			if (rule.getSubstitutions().isEmpty()) {
				skipEmpty(rule);
				return null;
			}
			return rule;
		}
		Set<Substitution> subs = new TreeSet<>();
		for (String patternText : rule.getPatterns()) {
			GlyphPattern pattern = new GlyphPattern(patternText);
			if (pattern.isWildcard()) {
				if (theGlyphNames == null) {
					theDiagnostics.warn(Diagnostics.Category.ADVISORY, SourcePosition.NONE, "Cannot expand pattern '" + pattern
						+ "' of rule " + rule.getName() + ": the glyph names of the sources are not available");
					continue;
				}
				for (String glyph : pattern.matching(theGlyphNames)) {
					if (rule.isSuffixTarget() && glyph.endsWith(rule.getTarget()))
						continue;
					addIfTargetExists(rule, glyph, subs);
				}
			} else if (theGlyphNames != null && !theGlyphNames.contains(patternText)) {
				theDiagnostics.warn(Diagnostics.Category.ADVISORY, SourcePosition.NONE,
					"Skipping substitution of " + patternText + " in rule " + rule.getName() + ": glyph not found in the sources");
			} else
				addIfTargetExists(rule, patternText, subs);
		}
		if (subs.isEmpty()) {
			skipEmpty(rule);
			return null;
		}
		if (rule.hasWildcard())
			log.debug("Rule " + rule.getName() + " expanded to " + subs.size() + " substitution(s)");
		return rule.withSubstitutions(new ArrayList<>(subs));
	}

	/**
	 * @param rule The rule
	 * @param glyph The glyph to substitute
	 * @return The name of the glyph the rule substitutes for the given glyph
	 */
	public static String targetFor(Rule rule, String glyph) {
		return rule.isSuffixTarget() ? glyph + rule.getTarget() : rule.getTarget();
	}

	private void addIfTargetExists(Rule rule, String glyph, Set<Substitution> subs) throws DssParseException {
		String target = targetFor(rule, glyph);
		if (theGlyphNames != null && !theGlyphNames.contains(target)) {
			theDiagnostics.warn(Diagnostics.Category.ADVISORY, SourcePosition.NONE,
				"Skipping substitution " + glyph + " -> " + target + ": target glyph '" + target + "' not found in the sources");
			return;
		}
		subs.add(new Substitution(glyph, target));
	}

	private void skipEmpty(Rule rule) throws DssParseException {
		theDiagnostics.warn(Diagnostics.Category.ADVISORY, SourcePosition.NONE,
			"Skipping rule '" + rule.getName() + "': no valid substitutions found");
	}
}
