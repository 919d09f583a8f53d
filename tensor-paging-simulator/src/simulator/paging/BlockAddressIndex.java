package simulator.paging;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

/**
 * Static translation of tensor byte ranges into block-aligned coverage. Built
 * once per tensor table and block size; nothing here changes while a
 * simulation runs.
 *
 * Blocks are named by their aligned start address. A tensor covering
 * {@code [address, address + size)} spans every block from the one holding its
 * first byte to the one holding its last byte, so unaligned tensors always
 * touch partial blocks at both ends.
 */
public final class BlockAddressIndex {

	private final long blockSize;

	/** Tensor arena, iterated in ascending id order. */
	private final SortedMap<Integer, Tensor> tensors;

	/** tensor id => ascending start addresses of the blocks it spans */
	private final Map<Integer, ImmutableList<Long>> tensorBlocks = new HashMap<>();

	/** block start address => every tensor overlapping that block */
	private final Map<Long, ImmutableSortedSet<Integer>> blockTensors = new HashMap<>();

	private final long totalTensorBytes;
	private final long memorySavedBySharing;

	public BlockAddressIndex(Map<Integer, Tensor> tensorTable, long blockSize) {
		Preconditions.checkArgument(blockSize > 0, "block size must be positive: %s", blockSize);
		this.blockSize = blockSize;
		this.tensors = new TreeMap<>(tensorTable);

		Map<Long, TreeSet<Integer>> sharers = new HashMap<>();
		long bytes = 0;
		for (Tensor t : tensors.values()) {
			Preconditions.checkArgument(t.address() >= 0 && t.address() <= Long.MAX_VALUE - Math.max(0, t.size()),
					"tensor %s at %s with size %s falls outside the address space", t.id(), t.address(), t.size());
			bytes += t.size();
			ImmutableList<Long> span = computeSpan(t);
			tensorBlocks.put(t.id(), span);
			for (long start : span) {
				TreeSet<Integer> ids = sharers.get(start);
				if (ids == null) {
					ids = new TreeSet<Integer>();
					sharers.put(start, ids);
				}
				ids.add(t.id());
			}
		}
		for (Map.Entry<Long, TreeSet<Integer>> e : sharers.entrySet()) {
			blockTensors.put(e.getKey(), ImmutableSortedSet.copyOf(e.getValue()));
		}
		this.totalTensorBytes = bytes;
		this.memorySavedBySharing = totalTensorBytes - blockTensors.size() * blockSize;
	}

	private ImmutableList<Long> computeSpan(Tensor t) {
		if (t.size() <= 0) {
			return ImmutableList.of();
		}
		long first = blockStart(t.address());
		long blocks = (blockStart(t.end() - 1) - first) / blockSize + 1;
		ImmutableList.Builder<Long> span = ImmutableList.builder();
		// count blocks rather than compare addresses, which wrap at the top block
		for (long i = 0; i < blocks; i++) {
			span.add(first + i * blockSize);
		}
		return span.build();
	}

	/** Aligned start address of the block holding the given byte. */
	public long blockStart(long address) {
		return Math.floorDiv(address, blockSize) * blockSize;
	}

	public long blockSize() {
		return blockSize;
	}

	public boolean contains(int tensorId) {
		return tensors.containsKey(tensorId);
	}

	/** @return the tensor, or null if the id is not in the table */
	public Tensor tensor(int tensorId) {
		return tensors.get(tensorId);
	}

	public int tensorCount() {
		return tensors.size();
	}

	/**
	 * The blocks a tensor spans, in ascending address order. Unknown tensors span
	 * nothing.
	 */
	public ImmutableList<Long> blocksForTensor(int tensorId) {
		ImmutableList<Long> span = tensorBlocks.get(tensorId);
		return span == null ? ImmutableList.of() : span;
	}

	/** Tensors sharing the aligned block starting at {@code blockStart}. */
	public ImmutableSortedSet<Integer> tensorsInBlock(long blockStart) {
		ImmutableSortedSet<Integer> ids = blockTensors.get(blockStart);
		return ids == null ? ImmutableSortedSet.of() : ids;
	}

	/**
	 * All tensors whose byte range intersects {@code [blockStart, blockEnd)}. The
	 * window need not be aligned.
	 */
	public ImmutableSortedSet<Integer> tensorsOverlapping(long blockStart, long blockEnd) {
		if (blockEnd <= blockStart) {
			return ImmutableSortedSet.of();
		}
		ImmutableSortedSet.Builder<Integer> result = ImmutableSortedSet.naturalOrder();
		long first = blockStart(blockStart);
		long blocks = (blockStart(blockEnd - 1) - first) / blockSize + 1;
		for (long i = 0; i < blocks; i++) {
			for (int id : tensorsInBlock(first + i * blockSize)) {
				if (tensors.get(id).overlaps(blockStart, blockEnd)) {
					result.add(id);
				}
			}
		}
		return result.build();
	}

	public boolean isShared(long blockStart) {
		return tensorsInBlock(blockStart).size() > 1;
	}

	/** Number of distinct blocks needed to hold every tensor in the table. */
	public int uniqueBlockCount() {
		return blockTensors.size();
	}

	public long totalTensorBytes() {
		return totalTensorBytes;
	}

	/**
	 * Total tensor bytes minus the bytes of the unique blocks covering them. This
	 * depends only on the table and the block size. It goes negative when padding
	 * of partial blocks outweighs aliasing.
	 */
	public long sharingStats() {
		return memorySavedBySharing;
	}

	public boolean isAligned(Tensor t) {
		return t.address() % blockSize == 0;
	}

	/** Ids of tensors not starting on a block boundary, ascending. */
	public List<Integer> misalignedTensors() {
		List<Integer> ids = new ArrayList<>();
		for (Tensor t : tensors.values()) {
			if (!isAligned(t)) {
				ids.add(t.id());
			}
		}
		return ids;
	}
}
