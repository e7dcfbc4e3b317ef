package org.dssketch.parse;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.dssketch.config.StandardLabels;
import org.dssketch.model.AxisKind;

import com.google.common.collect.ImmutableList;

/** Edit-distance based correction of misspelled keywords and labels */
public class TypoChecker {
	/** The largest edit distance at which a correction is suggested */
	public static final int MAX_DISTANCE = 2;

	/** The words that may start a section or top-level declaration */
	public static final List<String> SECTION_KEYWORDS = ImmutableList.of("family", "path", "suffix", "axes", "sources", "masters",
		"rules", "instances", "avar2");

	/** The registered axis tags */
	public static final List<String> AXIS_TAGS;
	/** The standard names of the registered axes */
	public static final List<String> AXIS_NAMES;

	static {
		ImmutableList.Builder<String> tags = ImmutableList.builder();
		ImmutableList.Builder<String> names = ImmutableList.builder();
		for (AxisKind kind : AxisKind.values()) {
			if (kind.tag != null) {
				tags.add(kind.tag);
				names.add(kind.standardName);
			}
		}
		AXIS_TAGS = tags.build();
		AXIS_NAMES = names.build();
	}

	private final StandardLabels theLabels;

	/** @param labels The standard label vocabularies to check labels against */
	public TypoChecker(StandardLabels labels) {
		theLabels = labels;
	}

	/**
	 * Computes the number of single-character insertions, deletions and substitutions needed to turn one string into another
	 *
	 * @param a The first string
	 * @param b The second string
	 * @return The edit distance between the strings
	 */
	public static int editDistance(CharSequence a, CharSequence b) {
		int[] prev = new int[b.length() + 1];
		int[] current = new int[b.length() + 1];
		for (int j = 0; j <= b.length(); j++)
			prev[j] = j;
		for (int i = 1; i <= a.length(); i++) {
			current[0] = i;
			for (int j = 1; j <= b.length(); j++) {
				int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
				current[j] = Math.min(Math.min(current[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
			}
			int[] swap = prev;
			prev = current;
			current = swap;
		}
		return prev[b.length()];
	}

	/**
	 * Like {@link #editDistance(CharSequence, CharSequence)}, but a swap of two adjacent characters counts as a single edit
	 *
	 * @param a The first string
	 * @param b The second string
	 * @return The edit distance between the strings, counting transpositions
	 */
	public static int transposedDistance(CharSequence a, CharSequence b) {
		int[][] d = new int[a.length() + 1][b.length() + 1];
		for (int i = 0; i <= a.length(); i++)
			d[i][0] = i;
		for (int j = 0; j <= b.length(); j++)
			d[0][j] = j;
		for (int i = 1; i <= a.length(); i++) {
			for (int j = 1; j <= b.length(); j++) {
				int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
				d[i][j] = Math.min(Math.min(d[i - 1][j] + 1, d[i][j - 1] + 1), d[i - 1][j - 1] + cost);
				if (i > 1 && j > 1 && a.charAt(i - 1) == b.charAt(j - 2) && a.charAt(i - 2) == b.charAt(j - 1))
					d[i][j] = Math.min(d[i][j], d[i - 2][j - 2] + 1);
			}
		}
		return d[a.length()][b.length()];
	}

	/**
	 * @param a The first string
	 * @param b The second string
	 * @return The number of characters in either string that are not matched by a character of the other, ignoring order
	 */
	public static int letterDifference(CharSequence a, CharSequence b) {
		Map<Character, Integer> counts = new HashMap<>();
		for (int i = 0; i < a.length(); i++)
			counts.merge(a.charAt(i), 1, Integer::sum);
		for (int i = 0; i < b.length(); i++)
			counts.merge(b.charAt(i), -1, Integer::sum);
		int diff = 0;
		for (int count : counts.values())
			diff += Math.abs(count);
		return diff;
	}

	/**
	 * @param word The word to correct
	 * @param candidates The valid words
	 * @return The candidates within {@link #MAX_DISTANCE} of the word, closest first, or an empty list if the word is itself a
	 *         candidate. Candidates at the same distance are ordered by how many letters they share with the word.
	 */
	public static List<String> rankSuggestions(String word, Collection<String> candidates) {
		if (candidates.contains(word))
			return Collections.emptyList();
		List<String> close = new ArrayList<>();
		for (String candidate : candidates) {
			if (editDistance(word.toLowerCase(), candidate.toLowerCase()) <= MAX_DISTANCE
				|| editDistance(word, candidate) <= MAX_DISTANCE)
				close.add(candidate);
		}
		close.sort(Comparator.<String> comparingInt(c -> transposedDistance(word, c))
			.thenComparingInt(c -> letterDifference(word, c)).thenComparing(Comparator.naturalOrder()));
		return close;
	}

	/**
	 * @param word The word to correct
	 * @param candidates The valid words
	 * @return The closest candidate within {@link #MAX_DISTANCE} of the word, or null if there is none or the word is itself valid
	 */
	public static String suggest(String word, Collection<String> candidates) {
		List<String> ranked = rankSuggestions(word, candidates);
		return ranked.isEmpty() ? null : ranked.get(0);
	}

	/**
	 * Determines the labels a mapping on an axis of the given kind is checked against. Where a document has both a weight and a
	 * width axis, each is restricted to its own vocabulary. Where it has only one of them, both vocabularies are accepted.
	 *
	 * @param kind The kind of the axis the label is on
	 * @param hasWeight Whether the document has a weight axis
	 * @param hasWidth Whether the document has a width axis
	 * @return The valid labels for the axis
	 */
	public Set<String> getLabelCandidates(AxisKind kind, boolean hasWeight, boolean hasWidth) {
		Set<String> candidates = new LinkedHashSet<>();
		if (!kind.hasStandardLabels())
			return candidates;
		candidates.addAll(theLabels.getLabelNames(kind));
		if (!(hasWeight && hasWidth))
			candidates.addAll(theLabels.getLabelNames(kind == AxisKind.WEIGHT ? AxisKind.WIDTH : AxisKind.WEIGHT));
		return candidates;
	}

	/**
	 * @param label The label to check
	 * @param kind The kind of the axis the label is on
	 * @param hasWeight Whether the document has a weight axis
	 * @param hasWidth Whether the document has a width axis
	 * @return The standard label the given one is probably a misspelling of, or null
	 */
	public String suggestLabel(String label, AxisKind kind, boolean hasWeight, boolean hasWidth) {
		return suggest(label, getLabelCandidates(kind, hasWeight, hasWidth));
	}
}
