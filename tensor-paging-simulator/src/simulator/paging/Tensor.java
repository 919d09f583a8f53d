package simulator.paging;

import java.util.List;

import com.google.common.collect.ImmutableList;

/** A tensor's placement in the simulated address space. Never mutated once built. */
public final class Tensor {
	private final int id;
	private final long address;
	private final long size;
	private final String dataType;
	private final int usageCount;
	private final ImmutableList<Integer> usedByNodes;

	public Tensor(int id, long address, long size, String dataType, int usageCount, List<Integer> usedByNodes) {
		this.id = id;
		this.address = address;
		this.size = size;
		this.dataType = dataType;
		this.usageCount = usageCount;
		this.usedByNodes = ImmutableList.copyOf(usedByNodes);
	}

	public int id() {
		return id;
	}

	public long address() {
		return address;
	}

	public long size() {
		return size;
	}

	/** One past the last byte of this tensor. */
	public long end() {
		return address + size;
	}

	public String dataType() {
		return dataType;
	}

	public int usageCount() {
		return usageCount;
	}

	public ImmutableList<Integer> usedByNodes() {
		return usedByNodes;
	}

	boolean overlaps(long start, long end) {
		return !(end() <= start || address >= end);
	}

	@Override
	public String toString() {
		return "Tensor " + id + " [0x" + Long.toHexString(address) + ", " + size + " bytes, " + dataType + "]";
	}
}
