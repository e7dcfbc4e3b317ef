package org.dssketch.io;

import java.util.Arrays;

import org.junit.Assert;
import org.junit.Test;

/** Tests {@link DssText} */
public class DssTextTest {
	@Test
	public void testFormatNumber() {
		Assert.assertEquals("400", DssText.formatNumber(400.0));
		Assert.assertEquals("-12", DssText.formatNumber(-12));
		Assert.assertEquals("0.5", DssText.formatNumber(0.5));
		Assert.assertEquals("62.5", DssText.formatNumber(62.50));
	}

	@Test
	public void testParseNumber() {
		Assert.assertEquals(Double.valueOf(400), DssText.parseNumber("400"));
		Assert.assertEquals(Double.valueOf(-8.5), DssText.parseNumber("-8.5"));
		Assert.assertNull(DssText.parseNumber("Bold"));
		Assert.assertNull(DssText.parseNumber("4e2"));
		Assert.assertNull(DssText.parseNumber(""));
	}

	@Test
	public void testSplit() {
		Assert.assertEquals(Arrays.asList("a", "b [1, 2]", "\"c, d\"", ""), DssText.split("a, b [1, 2], \"c, d\",", ','));
	}

	@Test
	public void testWords() {
		Assert.assertEquals(Arrays.asList("\"Source Serif\"", "Bold", "[700]"), DssText.words("\"Source Serif\"  Bold [700]"));
	}

	@Test
	public void testQuoting() {
		Assert.assertEquals("Regular", DssText.quoteIfSpaces("Regular"));
		Assert.assertEquals("\"Semi Bold\"", DssText.quoteIfSpaces("Semi Bold"));
		Assert.assertEquals("Semi Bold", DssText.unquote(" \"Semi Bold\" "));
		Assert.assertEquals("plain", DssText.unquote("plain"));
	}

	@Test
	public void testIdentifier() {
		Assert.assertTrue(DssText.isIdentifier("weight"));
		Assert.assertTrue(DssText.isIdentifier("_x2"));
		Assert.assertFalse(DssText.isIdentifier("2x"));
		Assert.assertFalse(DssText.isIdentifier("a-b"));
		Assert.assertFalse(DssText.isIdentifier(""));
	}
}
