package org.dssketch.parse;

import java.util.Arrays;

import org.dssketch.config.StandardLabels;
import org.dssketch.model.AxisKind;
import org.junit.Assert;
import org.junit.Test;

/** Tests {@link TypoChecker} */
public class TypoCheckerTest {
	@Test
	public void testEditDistance() {
		Assert.assertEquals(0, TypoChecker.editDistance("axes", "axes"));
		Assert.assertEquals(1, TypoChecker.editDistance("axs", "axes"));
		Assert.assertEquals(2, TypoChecker.editDistance("soruces", "sources"));
		Assert.assertEquals(3, TypoChecker.editDistance("kitten", "sitting"));
		Assert.assertEquals(4, TypoChecker.editDistance("", "abcd"));
	}

	@Test
	public void testTransposition() {
		Assert.assertEquals(2, TypoChecker.editDistance("wgth", "wght"));
		Assert.assertEquals(1, TypoChecker.transposedDistance("wgth", "wght"));
		Assert.assertEquals(1, TypoChecker.transposedDistance("wgth", "wdth"));
		Assert.assertEquals(0, TypoChecker.letterDifference("wgth", "wght"));
		Assert.assertEquals(2, TypoChecker.letterDifference("wgth", "wdth"));
		Assert.assertEquals("wght", TypoChecker.suggest("wgth", TypoChecker.AXIS_TAGS));
		Assert.assertEquals("optical", TypoChecker.suggest("optcal", TypoChecker.AXIS_NAMES));
		Assert.assertNull(TypoChecker.suggest("contrast", TypoChecker.AXIS_NAMES));
	}

	@Test
	public void testKeywords() {
		Assert.assertEquals("sources", TypoChecker.suggest("soruces", TypoChecker.SECTION_KEYWORDS));
		Assert.assertEquals("instances", TypoChecker.suggest("instanses", TypoChecker.SECTION_KEYWORDS));
		Assert.assertNull(TypoChecker.suggest("axes", TypoChecker.SECTION_KEYWORDS));
		Assert.assertNull(TypoChecker.suggest("glyphs", TypoChecker.SECTION_KEYWORDS));
	}

	@Test
	public void testRanking() {
		Assert.assertEquals(Arrays.asList("Bald", "Bl", "Bold"),
			TypoChecker.rankSuggestions("Bld", Arrays.asList("Bolder", "Bold", "Black", "Bl", "Bald")));
		Assert.assertTrue(TypoChecker.rankSuggestions("Bold", Arrays.asList("Bold", "Bald")).isEmpty());
	}

	/** With only a weight axis, width labels are accepted too, so both vocabularies are offered */
	@Test
	public void testLabelVocabularies() {
		TypoChecker checker = new TypoChecker(StandardLabels.load(null));
		Assert.assertEquals("Regular", checker.suggestLabel("Reguler", AxisKind.WEIGHT, true, false));
		Assert.assertEquals("SemiBold", checker.suggestLabel("SemiBld", AxisKind.WEIGHT, true, true));
		Assert.assertTrue(checker.getLabelCandidates(AxisKind.WEIGHT, true, false).contains("Condensed"));
		Assert.assertFalse(checker.getLabelCandidates(AxisKind.WEIGHT, true, true).contains("Condensed"));
		Assert.assertTrue(checker.getLabelCandidates(AxisKind.ITALIC, true, true).isEmpty());
	}
}
