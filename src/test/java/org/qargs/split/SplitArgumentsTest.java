package org.qargs.split;

import java.util.List;

import org.junit.Assert;
import org.junit.Test;
import org.qargs.split.SplitArguments.IndexedValue;

/** Tests consumption and removal in {@link SplitArguments} */
public class SplitArgumentsTest {
	/** Tests that removing a complete index removes its cluster, but removing one character leaves the rest addressable */
	@Test
	public void testRemoval() {
		SplitArguments split = ArgumentTokenizer.split("-abc", "value");
		Assert.assertEquals(5, split.size());

		split.remove(TokenIndex.sub(0, 1));
		Assert.assertEquals(4, split.size());
		Assert.assertTrue(split.contains(TokenIndex.complete(0)));
		Assert.assertTrue(split.contains(TokenIndex.sub(0, 0)));
		Assert.assertTrue(split.contains(TokenIndex.sub(0, 2)));
		Assert.assertEquals("value", split.get(TokenIndex.complete(1)).getText());

		split.removeClusterMember(TokenIndex.sub(0, 0));
		Assert.assertFalse(split.contains(TokenIndex.complete(0)));
		Assert.assertTrue(split.contains(TokenIndex.sub(0, 2)));

		split.remove(TokenIndex.complete(0));
		Assert.assertFalse(split.contains(TokenIndex.sub(0, 2)));
		Assert.assertEquals(1, split.size());
		Assert.assertTrue(split.contains(TokenIndex.complete(1)));
	}

	/** Tests the ways values are popped relative to an option */
	@Test
	public void testPopValues() {
		SplitArguments split = ArgumentTokenizer.split("--a", "--b", "x", "-3", "y");
		Assert.assertNull(split.popNextElementIfValue(TokenIndex.complete(0)));
		IndexedValue value = split.popNextValue(TokenIndex.complete(0));
		Assert.assertEquals("x", value.getValue());
		Assert.assertEquals(TokenIndex.complete(2), value.getIndex());
		value = split.popNextElementAsValue(TokenIndex.complete(0));
		Assert.assertEquals("--b", value.getValue());
		value = split.popNextElementIfValue(TokenIndex.complete(0));
		Assert.assertEquals("-3", value.getValue());
		Assert.assertFalse(split.contains(TokenIndex.complete(3)));
		Assert.assertEquals(2, split.size());
		Assert.assertNotNull(split.copy().popNext());
		Assert.assertEquals(2, split.size());
	}

	/** Tests extracting a value joined to a short name */
	@Test
	public void testJoined() {
		SplitArguments split = ArgumentTokenizer.split("-Ddebug");
		Assert.assertNull(split.extractJoinedElement(TokenIndex.sub(0, 1)));
		IndexedValue joined = split.extractJoinedElement(TokenIndex.sub(0, 0));
		Assert.assertEquals("debug", joined.getValue());
		Assert.assertEquals(TokenIndex.complete(0), joined.getIndex());
		Assert.assertTrue(split.isEmpty());
	}

	/** Tests that leftovers are reported once per input string */
	@Test
	public void testCoalescedExtras() {
		SplitArguments split = ArgumentTokenizer.split("-abc", "x", "-12");
		split.removeClusterMember(TokenIndex.sub(0, 1));
		List<IndexedValue> extras = split.coalescedExtraElements();
		Assert.assertEquals(3, extras.size());
		Assert.assertEquals("-ac", extras.get(0).getValue());
		Assert.assertEquals("x", extras.get(1).getValue());
		Assert.assertEquals("-12", extras.get(2).getValue());
	}

	/** Tests index ordering */
	@Test
	public void testIndexOrder() {
		Assert.assertTrue(TokenIndex.complete(0).compareTo(TokenIndex.sub(0, 0)) < 0);
		Assert.assertTrue(TokenIndex.sub(0, 5).compareTo(TokenIndex.complete(1)) < 0);
		Assert.assertEquals(TokenIndex.complete(2), TokenIndex.sub(2, 1).toComplete());
		Assert.assertEquals("2.1", TokenIndex.sub(2, 1).toString());
	}
}
