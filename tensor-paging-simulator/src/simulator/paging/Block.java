package simulator.paging;

import com.google.common.collect.ImmutableSortedSet;

/**
 * A resident block. Created when a miss loads it and dropped when it is
 * evicted. The set of tensors it serves is fixed by the address index; only the
 * recency and dirty state change while it is resident.
 */
public final class Block {
	private final long startAddress;
	private final long size;
	private final ImmutableSortedSet<Integer> tensorIds;

	private long lastAccessStep;
	private boolean dirty = false;

	// intrusive LRU links, maintained by ResidentBlockCache
	Block moreRecent;
	Block lessRecent;

	Block(long startAddress, long size, ImmutableSortedSet<Integer> tensorIds, long step) {
		this.startAddress = startAddress;
		this.size = size;
		this.tensorIds = tensorIds;
		this.lastAccessStep = step;
	}

	public long startAddress() {
		return startAddress;
	}

	/** Always the full block size, however little of it a tensor covers. */
	public long size() {
		return size;
	}

	public ImmutableSortedSet<Integer> tensorIds() {
		return tensorIds;
	}

	public boolean shared() {
		return tensorIds.size() > 1;
	}

	/** Lowest tensor id served by this block; -1 if it serves none. */
	public int primaryTensorId() {
		return tensorIds.isEmpty() ? -1 : tensorIds.first();
	}

	public long lastAccessStep() {
		return lastAccessStep;
	}

	void setLastAccessStep(long step) {
		lastAccessStep = step;
	}

	public boolean dirty() {
		return dirty;
	}

	void setDirty() {
		dirty = true;
	}

	@Override
	public String toString() {
		return "Block 0x" + Long.toHexString(startAddress) + " tensors=" + tensorIds + " last=" + lastAccessStep
				+ (dirty ? " dirty" : " clean");
	}
}
