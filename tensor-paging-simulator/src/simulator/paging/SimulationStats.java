package simulator.paging;

import java.util.Objects;

/**
 * Counters of a finished run. Immutable, so downstream reporting may share it
 * freely.
 */
public final class SimulationStats {
	private final long blockHits;
	private final long blockMisses;
	private final long blockEvictions;
	private final long dirtyEvictions;
	private final long tensorHits;
	private final long tensorMisses;
	private final long totalIO;
	private final long peakMemory;
	private final long sharedBlockAccesses;
	private final long memorySavedSharing;
	private final long skippedAccesses;

	SimulationStats(long blockHits, long blockMisses, long blockEvictions, long dirtyEvictions, long tensorHits,
			long tensorMisses, long totalIO, long peakMemory, long sharedBlockAccesses, long memorySavedSharing,
			long skippedAccesses) {
		this.blockHits = blockHits;
		this.blockMisses = blockMisses;
		this.blockEvictions = blockEvictions;
		this.dirtyEvictions = dirtyEvictions;
		this.tensorHits = tensorHits;
		this.tensorMisses = tensorMisses;
		this.totalIO = totalIO;
		this.peakMemory = peakMemory;
		this.sharedBlockAccesses = sharedBlockAccesses;
		this.memorySavedSharing = memorySavedSharing;
		this.skippedAccesses = skippedAccesses;
	}

	public long blockHits() {
		return blockHits;
	}

	public long blockMisses() {
		return blockMisses;
	}

	public long blockEvictions() {
		return blockEvictions;
	}

	/** Evictions that paid a write-back. */
	public long dirtyEvictions() {
		return dirtyEvictions;
	}

	public long tensorHits() {
		return tensorHits;
	}

	public long tensorMisses() {
		return tensorMisses;
	}

	/** Bytes loaded plus bytes written back. */
	public long totalIO() {
		return totalIO;
	}

	/** Largest resident byte count seen after any access. */
	public long peakMemory() {
		return peakMemory;
	}

	public long sharedBlockAccesses() {
		return sharedBlockAccesses;
	}

	public long memorySavedSharing() {
		return memorySavedSharing;
	}

	/** Plan accesses naming a tensor missing from the table. */
	public long skippedAccesses() {
		return skippedAccesses;
	}

	public HitRatios hitRatios() {
		return new HitRatios(ratio(blockHits, blockHits + blockMisses), ratio(tensorHits, tensorHits + tensorMisses),
				(double) sharedBlockAccesses / Math.max(1, blockHits + blockMisses));
	}

	private static double ratio(long num, long denom) {
		return denom > 0 ? (double) num / denom : 0;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof SimulationStats)) {
			return false;
		}
		SimulationStats s = (SimulationStats) o;
		return blockHits == s.blockHits && blockMisses == s.blockMisses && blockEvictions == s.blockEvictions
				&& dirtyEvictions == s.dirtyEvictions && tensorHits == s.tensorHits && tensorMisses == s.tensorMisses
				&& totalIO == s.totalIO && peakMemory == s.peakMemory && sharedBlockAccesses == s.sharedBlockAccesses
				&& memorySavedSharing == s.memorySavedSharing && skippedAccesses == s.skippedAccesses;
	}

	@Override
	public int hashCode() {
		return Objects.hash(blockHits, blockMisses, blockEvictions, dirtyEvictions, tensorHits, tensorMisses, totalIO,
				peakMemory, sharedBlockAccesses, memorySavedSharing, skippedAccesses);
	}

	@Override
	public String toString() {
		return "blockHits=" + blockHits + " blockMisses=" + blockMisses + " blockEvictions=" + blockEvictions
				+ " dirtyEvictions=" + dirtyEvictions + " tensorHits=" + tensorHits + " tensorMisses=" + tensorMisses
				+ " totalIO=" + totalIO + " peakMemory=" + peakMemory + " sharedBlockAccesses=" + sharedBlockAccesses
				+ " memorySavedSharing=" + memorySavedSharing + " skippedAccesses=" + skippedAccesses;
	}
}
