package org.qargs;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Assert;
import org.junit.Test;

/** Tests {@link StringUtils} */
public class StringUtilsTest {
	/** Tests {@link StringUtils#editDistance(CharSequence, CharSequence)} */
	@Test
	public void testEditDistance() {
		Assert.assertEquals(0, StringUtils.editDistance("same", "same"));
		Assert.assertEquals(3, StringUtils.editDistance("kitten", "sitting"));
		Assert.assertEquals(3, StringUtils.editDistance("", "abc"));
		Assert.assertEquals(1, StringUtils.editDistance("--nme", "--name"));
		Assert.assertEquals(1, StringUtils.editDistance("-name", "--name"));
		Assert.assertEquals(StringUtils.editDistance("flaw", "lawn"), StringUtils.editDistance("lawn", "flaw"));
	}

	/** Tests {@link StringUtils#toKebabCase(String)} */
	@Test
	public void testKebabCase() {
		Assert.assertEquals("first-number", StringUtils.toKebabCase("firstNumber"));
		Assert.assertEquals("parse-url", StringUtils.toKebabCase("parseURL"));
		Assert.assertEquals("name", StringUtils.toKebabCase("name"));
		Assert.assertEquals("dry-run", StringUtils.toKebabCase("dry_run"));
	}

	/** Tests printing of sequences */
	@Test
	public void testPrinting() {
		Assert.assertEquals("a, b, c", StringUtils.print(", ", Arrays.asList("a", "b", "c"), null).toString());
		Assert.assertEquals("'a', 'b' or 'c'", StringUtils.conversational(Arrays.asList("a", "b", "c"), "or"));
		Assert.assertEquals("'a' or 'b'", StringUtils.conversational(Arrays.asList("a", "b"), "or"));
		Assert.assertEquals("'a'", StringUtils.conversational(Collections.singletonList("a"), "or"));
	}
}
