package org.dssketch.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.dssketch.model.Rule;
import org.dssketch.model.Substitution;

/**
 * Turns the concrete substitutions of a rule back into a compact pattern form. Wildcards are only used when a glyph set is known
 * and expanding the wildcard against it yields exactly the original substitutions; otherwise the glyphs are listed.
 */
public class RuleCompressor {
	/** The shortest prefix used for a wildcard */
	public static final int MIN_PREFIX_LENGTH = 3;

	private final Set<String> theGlyphNames;

	/** @param glyphNames The glyph names of the sources, or null if unknown */
	public RuleCompressor(Set<String> glyphNames) {
		theGlyphNames = glyphNames;
	}

	/**
	 * @param rule The rule to compress
	 * @return The rule with patterns and target describing its substitutions, or the rule unchanged if its substitutions have
	 *         neither a common suffix nor a common replacement
	 */
	public Rule compress(Rule rule) {
		if (!rule.getPatterns().isEmpty() || rule.getSubstitutions().isEmpty())
			return rule;
		List<Substitution> subs = rule.getSubstitutions();
		Set<String> from = new TreeSet<>();
		for (Substitution sub : subs)
			from.add(sub.getFrom());
		String suffix = commonSuffix(subs);
		if (suffix != null) {
			List<String> patterns = theGlyphNames == null ? new ArrayList<>(from) : findPatterns(from, suffix);
			return new Rule(rule.getName(), patterns, suffix, rule.getConditions(), subs);
		}
		String target = subs.get(0).getTo();
		for (Substitution sub : subs) {
			if (!sub.getTo().equals(target))
				return rule;
		}
		return new Rule(rule.getName(), new ArrayList<>(from), target, rule.getConditions(), subs);
	}

	static String commonSuffix(List<Substitution> subs) {
		String suffix = null;
		for (Substitution sub : subs) {
			String s = sub.getSuffix();
			if (s == null || (suffix != null && !suffix.equals(s)))
				return null;
			suffix = s;
		}
		return suffix;
	}

	private List<String> findPatterns(Set<String> from, String suffix) {
		if (expand("*", suffix).equals(from))
			return Collections.singletonList("*");
		List<String> patterns = new ArrayList<>();
		Set<String> covered = new TreeSet<>();
		for (String glyph : from) {
			if (covered.contains(glyph))
				continue;
			String wildcard = null;
			for (int len = MIN_PREFIX_LENGTH; len < glyph.length() && wildcard == null; len++) {
				String pattern = glyph.substring(0, len) + "*";
				Set<String> expanded = expand(pattern, suffix);
				if (expanded.size() > 1 && from.containsAll(expanded) && Collections.disjoint(expanded, covered)) {
					wildcard = pattern;
					covered.addAll(expanded);
				}
			}
			if (wildcard != null)
				patterns.add(wildcard);
			else {
				patterns.add(glyph);
				covered.add(glyph);
			}
		}
		return patterns;
	}

	/** Mirrors the expansion {@link RuleResolver} performs for a suffix rule */
	private Set<String> expand(String pattern, String suffix) {
		Set<String> expanded = new TreeSet<>();
		for (String glyph : new GlyphPattern(pattern).matching(theGlyphNames)) {
			if (!glyph.endsWith(suffix) && theGlyphNames.contains(glyph + suffix))
				expanded.add(glyph);
		}
		return expanded;
	}
}
