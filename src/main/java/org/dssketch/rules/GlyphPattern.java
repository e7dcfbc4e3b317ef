package org.dssketch.rules;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

/**
 * A glyph name pattern. An asterisk matches any run of characters, so <code>dollar*</code> matches names starting with "dollar",
 * <code>*Heavy</code> names ending with "Heavy", <code>a.*alt</code> names with both, and a bare <code>*</code> every name.
 */
public class GlyphPattern {
	private final String thePattern;
	private final String thePrefix;
	private final String theSuffix;

	/** @param pattern The pattern text */
	public GlyphPattern(String pattern) {
		thePattern = pattern;
		int star = pattern.indexOf('*');
		if (star < 0) {
			thePrefix = pattern;
			theSuffix = null;
		} else {
			thePrefix = pattern.substring(0, star);
			theSuffix = pattern.substring(pattern.lastIndexOf('*') + 1);
		}
	}

	/** @return Whether this pattern contains a wildcard */
	public boolean isWildcard() {
		return theSuffix != null;
	}

	/** @return Whether this pattern matches every glyph name */
	public boolean isUniversal() {
		return thePattern.equals("*");
	}

	/**
	 * @param glyphName The glyph name to test
	 * @return Whether the name matches this pattern
	 */
	public boolean matches(String glyphName) {
		if (theSuffix == null)
			return glyphName.equals(thePrefix);
		return glyphName.length() >= thePrefix.length() + theSuffix.length() && glyphName.startsWith(thePrefix)
			&& glyphName.endsWith(theSuffix);
	}

	/**
	 * @param glyphNames The glyph names to search
	 * @return The names matching this pattern, sorted
	 */
	public Set<String> matching(Collection<String> glyphNames) {
		Set<String> found = new TreeSet<>();
		for (String name : glyphNames) {
			if (matches(name))
				found.add(name);
		}
		return found;
	}

	/**
	 * @param patterns The patterns
	 * @param glyphNames The glyph names to search
	 * @return All names matching any of the patterns, sorted
	 */
	public static Set<String> matchingAny(Collection<String> patterns, Collection<String> glyphNames) {
		Set<String> found = new TreeSet<>();
		for (String pattern : patterns)
			found.addAll(new GlyphPattern(pattern).matching(glyphNames));
		return found;
	}

	@Override
	public String toString() {
		return thePattern;
	}
}
