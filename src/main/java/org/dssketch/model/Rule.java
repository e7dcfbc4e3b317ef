package org.dssketch.model;

import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

/**
 * A conditional glyph substitution. A rule either carries a glyph pattern and target, to be expanded against the glyphs of the
 * sources, or the concrete substitutions it stands for, or both once expanded.
 */
public class Rule {
	/** The prefix of generated rule names */
	public static final String AUTO_NAME_PREFIX = "rule";

	private final String theName;
	private final ImmutableList<String> thePatterns;
	private final String theTarget;
	private final ImmutableList<RuleCondition> theConditions;
	private final ImmutableList<Substitution> theSubstitutions;

	/**
	 * @param name The name of the rule
	 * @param patterns The glyph patterns of the rule: exact names or wildcards. Empty for a rule known only by its substitutions.
	 * @param target The suffix (starting with '.') or replacement name, or null for a rule known only by its substitutions
	 * @param conditions The conditions, all of which must hold for the substitution to apply
	 * @param substitutions The concrete substitutions of the rule
	 */
	public Rule(String name, List<String> patterns, String target, List<RuleCondition> conditions, List<Substitution> substitutions) {
		theName = Objects.requireNonNull(name, "name");
		thePatterns = ImmutableList.copyOf(patterns);
		theTarget = target;
		theConditions = ImmutableList.copyOf(conditions);
		theSubstitutions = ImmutableList.copyOf(substitutions);
	}

	/** @return The name of the rule */
	public String getName() {
		return theName;
	}

	/** @return Whether the name of this rule was generated rather than given */
	public boolean isAutoNamed() {
		return isAutoName(theName);
	}

	/** @return The glyph patterns of the rule */
	public List<String> getPatterns() {
		return thePatterns;
	}

	/** @return The suffix or replacement name, or null */
	public String getTarget() {
		return theTarget;
	}

	/** @return Whether the target is a suffix to append rather than a replacement name */
	public boolean isSuffixTarget() {
		return theTarget != null && theTarget.startsWith(".");
	}

	/** @return Whether any of the rule's patterns contain a wildcard */
	public boolean hasWildcard() {
		for (String pattern : thePatterns) {
			if (pattern.indexOf('*') >= 0)
				return true;
		}
		return false;
	}

	/** @return The conditions of the rule */
	public List<RuleCondition> getConditions() {
		return theConditions;
	}

	/** @return The concrete substitutions of the rule */
	public List<Substitution> getSubstitutions() {
		return theSubstitutions;
	}

	/**
	 * @param substitutions The concrete substitutions for the rule
	 * @return A rule identical to this one, with the given substitutions
	 */
	public Rule withSubstitutions(List<Substitution> substitutions) {
		return new Rule(theName, thePatterns, theTarget, theConditions, substitutions);
	}

	/**
	 * @param name The rule name to test
	 * @return Whether the name has the form of a generated rule name
	 */
	public static boolean isAutoName(String name) {
		if (!name.startsWith(AUTO_NAME_PREFIX) || name.length() == AUTO_NAME_PREFIX.length())
			return false;
		for (int i = AUTO_NAME_PREFIX.length(); i < name.length(); i++) {
			if (!Character.isDigit(name.charAt(i)))
				return false;
		}
		return true;
	}

	@Override
	public int hashCode() {
		return Objects.hash(theName, thePatterns, theTarget, theConditions, theSubstitutions);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Rule))
			return false;
		Rule other = (Rule) obj;
		return theName.equals(other.theName) && thePatterns.equals(other.thePatterns) && Objects.equals(theTarget, other.theTarget)
			&& theConditions.equals(other.theConditions) && theSubstitutions.equals(other.theSubstitutions);
	}

	@Override
	public String toString() {
		return theName + ": " + (thePatterns.isEmpty() ? theSubstitutions.toString() : String.join(" ", thePatterns) + " > " + theTarget)
			+ " " + theConditions;
	}
}
