package simulator.paging;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static simulator.paging.SimulatorFixtures.BLOCK;
import static simulator.paging.SimulatorFixtures.table;
import static simulator.paging.SimulatorFixtures.tensor;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import com.google.common.collect.ImmutableSet;

public class BlockAddressIndexTests {

	@Test
	public void testAlignedTensorSpan() {
		BlockAddressIndex index = new BlockAddressIndex(table(tensor(1, 8192, 8192)), BLOCK);
		assertEquals(Arrays.asList(8192L, 12288L), index.blocksForTensor(1));
		assertTrue(index.misalignedTensors().isEmpty());
	}

	@Test
	public void testUnalignedTensorTouchesBoundaryBlocks() {
		// [4000, 8200) touches blocks 0, 4096 and 8192
		BlockAddressIndex index = new BlockAddressIndex(table(tensor(1, 4000, 4200)), BLOCK);
		assertEquals(Arrays.asList(0L, 4096L, 8192L), index.blocksForTensor(1));
		assertEquals(Collections.singletonList(1), index.misalignedTensors());
	}

	@Test
	public void testLastByteOnBoundary() {
		// [0, 4096) ends exactly at the boundary, so it stays in one block
		BlockAddressIndex index = new BlockAddressIndex(table(tensor(1, 0, 4096), tensor(2, 0, 4097)), BLOCK);
		assertEquals(Collections.singletonList(0L), index.blocksForTensor(1));
		assertEquals(Arrays.asList(0L, 4096L), index.blocksForTensor(2));
	}

	@Test
	public void testUnknownTensorSpansNothing() {
		BlockAddressIndex index = new BlockAddressIndex(table(tensor(1, 0, 10)), BLOCK);
		assertFalse(index.contains(7));
		assertTrue(index.blocksForTensor(7).isEmpty());
	}

	@Test
	public void testTensorsOverlapping() {
		BlockAddressIndex index = new BlockAddressIndex(
				table(tensor(1, 0, 100), tensor(2, 1000, 100), tensor(3, 4096, 4096), tensor(4, 3000, 2000)), BLOCK);

		assertEquals(ImmutableSet.of(1, 2, 4), index.tensorsOverlapping(0, 4096));
		assertEquals(ImmutableSet.of(3, 4), index.tensorsOverlapping(4096, 8192));
		assertEquals(ImmutableSet.of(1, 2, 4), index.tensorsInBlock(0));
		assertTrue(index.isShared(4096));

		// unaligned window only picks tensors that reach into it
		assertEquals(ImmutableSet.of(2), index.tensorsOverlapping(1050, 1100));
		assertEquals(ImmutableSet.of(4), index.tensorsOverlapping(4000, 4050));
		assertTrue(index.tensorsOverlapping(200, 900).isEmpty());
		assertTrue(index.tensorsOverlapping(5000, 5000).isEmpty());
	}

	@Test
	public void testSharingStatsWithAliasedTensors() {
		// two 4KB tensors placed at the same address by the allocator
		BlockAddressIndex index = new BlockAddressIndex(table(tensor(1, 0, 4096), tensor(2, 0, 4096)), BLOCK);
		assertEquals(8192, index.totalTensorBytes());
		assertEquals(1, index.uniqueBlockCount());
		assertEquals(4096, index.sharingStats());
	}

	@Test
	public void testSharingStatsCanBeNegative() {
		// padding of a partially used block costs more than the sharing saves
		BlockAddressIndex index = new BlockAddressIndex(table(tensor(1, 0, 100), tensor(2, 1000, 100)), BLOCK);
		assertEquals(1, index.uniqueBlockCount());
		assertEquals(200 - 4096, index.sharingStats());
	}

	@Test
	public void testSmallBlocks() {
		BlockAddressIndex index = new BlockAddressIndex(table(tensor(1, 6, 7)), 4);
		// bytes 6..12 live in blocks 4, 8 and 12
		assertEquals(Arrays.asList(4L, 8L, 12L), index.blocksForTensor(1));
		assertEquals(8, index.blockStart(11));
	}

	@Test(timeout = 5000)
	public void testTopOfAddressSpace() {
		long top = Long.MAX_VALUE - (BLOCK - 1);
		BlockAddressIndex index = new BlockAddressIndex(table(tensor(1, top, 10), tensor(2, top - BLOCK, BLOCK + 1),
				tensor(3, top + 100, BLOCK - 101)), BLOCK);

		assertEquals(Collections.singletonList(top), index.blocksForTensor(1));
		assertEquals(Arrays.asList(top - BLOCK, top), index.blocksForTensor(2));
		assertEquals(ImmutableSet.of(1, 2, 3), index.tensorsInBlock(top));
		assertEquals(ImmutableSet.of(1, 2, 3), index.tensorsOverlapping(top, Long.MAX_VALUE));
		assertEquals(ImmutableSet.of(3), index.tensorsOverlapping(top + 200, Long.MAX_VALUE));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testRejectsTensorPastEndOfAddressSpace() {
		new BlockAddressIndex(table(tensor(1, Long.MAX_VALUE - 5, 10)), BLOCK);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testRejectsNonPositiveBlockSize() {
		new BlockAddressIndex(table(tensor(1, 0, 10)), 0);
	}
}
