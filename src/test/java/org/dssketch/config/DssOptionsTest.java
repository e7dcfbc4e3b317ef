package org.dssketch.config;

import org.dssketch.io.ValidationPolicy;
import org.junit.Assert;
import org.junit.Test;

/** Tests {@link DssOptions} */
public class DssOptionsTest {
	@Test
	public void testDefaults() {
		DssOptions options = DssOptions.DEFAULT;
		Assert.assertSame(ValidationPolicy.STRICT, options.getPolicy());
		Assert.assertEquals(DssOptions.Avar2Format.MATRIX, options.getAvar2Format());
		Assert.assertEquals(3, options.getVariableThreshold());
		Assert.assertTrue(options.isValidatingSources());
	}

	@Test
	public void testImmutable() {
		DssOptions lenient = DssOptions.DEFAULT.withPolicy(ValidationPolicy.LENIENT).withVariableThreshold(0)
			.withAvar2Format(DssOptions.Avar2Format.LINEAR).withSourceValidation(false);
		Assert.assertSame(ValidationPolicy.LENIENT, lenient.getPolicy());
		Assert.assertEquals(0, lenient.getVariableThreshold());
		Assert.assertEquals(DssOptions.Avar2Format.LINEAR, lenient.getAvar2Format());
		Assert.assertFalse(lenient.isValidatingSources());
		Assert.assertSame(ValidationPolicy.STRICT, DssOptions.DEFAULT.getPolicy());
		Assert.assertEquals(3, DssOptions.DEFAULT.getVariableThreshold());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNegativeThreshold() {
		DssOptions.DEFAULT.withVariableThreshold(-1);
	}
}
