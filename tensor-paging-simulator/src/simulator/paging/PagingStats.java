package simulator.paging;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/** The live counters of one simulator. Read them through {@link #snapshot()}. */
final class PagingStats {

	/** Every counter, in the order they are dumped. */
	private final List<Counter> allCounters = new ArrayList<>();

	final SumCounter blockHits = new SumCounter("BlockHits", allCounters);
	final SumCounter blockMisses = new SumCounter("BlockMisses", allCounters);
	final SumCounter blockEvictions = new SumCounter("BlockEvictions", allCounters);
	final SumCounter dirtyEvictions = new SumCounter("DirtyEvictions", allCounters);
	final SumCounter tensorHits = new SumCounter("TensorHits", allCounters);
	final SumCounter tensorMisses = new SumCounter("TensorMisses", allCounters);
	final SumCounter totalIO = new SumCounter("TotalIO", allCounters);
	final MaxCounter peakMemory = new MaxCounter("PeakMemory", allCounters);
	final SumCounter sharedBlockAccesses = new SumCounter("SharedBlockAccesses", allCounters);
	final SumCounter skippedAccesses = new SumCounter("SkippedAccesses", allCounters);
	/** Fixed by the address index; set once per run. */
	final SumCounter memorySavedSharing = new SumCounter("MemorySavedSharing", allCounters);

	void reset() {
		for (Counter c : allCounters) {
			c.reset();
		}
	}

	void dumpCounters(Writer wr, String prefix, String suffix) throws IOException {
		for (Counter c : allCounters) {
			c.dump(wr, prefix, suffix);
		}
	}

	SimulationStats snapshot() {
		return new SimulationStats(blockHits.get(), blockMisses.get(), blockEvictions.get(), dirtyEvictions.get(),
				tensorHits.get(), tensorMisses.get(), totalIO.get(), peakMemory.get(), sharedBlockAccesses.get(),
				memorySavedSharing.get(), skippedAccesses.get());
	}
}
