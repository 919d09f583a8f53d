package simulator.paging;

import java.util.Objects;

import com.google.common.collect.ImmutableSortedSet;

public final class MemoryEvent {
	final long step;
	final int nodeIndex;
	final EventType type;
	final int primaryTensorId;
	final long blockAddress;
	final long blockSize;
	/** Other tensors served by the block, excluding the primary one. */
	final ImmutableSortedSet<Integer> sharedTensorIds;
	final boolean isWrite;

	MemoryEvent(long step, int nodeIndex, EventType type, int primaryTensorId, long blockAddress, long blockSize,
			ImmutableSortedSet<Integer> sharedTensorIds, boolean isWrite) {
		this.step = step;
		this.nodeIndex = nodeIndex;
		this.type = type;
		this.primaryTensorId = primaryTensorId;
		this.blockAddress = blockAddress;
		this.blockSize = blockSize;
		this.sharedTensorIds = sharedTensorIds;
		this.isWrite = isWrite;
	}

	public long step() {
		return step;
	}

	public int nodeIndex() {
		return nodeIndex;
	}

	public EventType type() {
		return type;
	}

	public int primaryTensorId() {
		return primaryTensorId;
	}

	public long blockAddress() {
		return blockAddress;
	}

	public long blockSize() {
		return blockSize;
	}

	public ImmutableSortedSet<Integer> sharedTensorIds() {
		return sharedTensorIds;
	}

	public boolean isWrite() {
		return isWrite;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof MemoryEvent)) {
			return false;
		}
		MemoryEvent e = (MemoryEvent) o;
		return step == e.step && nodeIndex == e.nodeIndex && type == e.type && primaryTensorId == e.primaryTensorId
				&& blockAddress == e.blockAddress && blockSize == e.blockSize && isWrite == e.isWrite
				&& sharedTensorIds.equals(e.sharedTensorIds);
	}

	@Override
	public int hashCode() {
		return Objects.hash(step, nodeIndex, type, primaryTensorId, blockAddress, blockSize, sharedTensorIds,
				isWrite);
	}

	/** One line in the format of the chronological event log. */
	@Override
	public String toString() {
		String s = "Node " + nodeIndex + ": " + type.label() + " - Tensor " + primaryTensorId;
		if (!sharedTensorIds.isEmpty()) {
			s += " (shared with tensors " + sharedTensorIds + ")";
		}
		if (type == EventType.ACCESS) {
			s += isWrite ? " (write)" : " (read)";
		}
		return s + " [Block addr: 0x" + Long.toHexString(blockAddress) + ", size: " + blockSize + "]";
	}
}
