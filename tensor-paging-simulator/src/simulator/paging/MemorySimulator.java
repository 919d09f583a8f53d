package simulator.paging;

import java.io.IOException;
import java.io.PrintStream;
import java.io.Writer;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

/**
 * Replays an execution plan against a block-granular, LRU-paged memory of fixed
 * size. Each node reads its inputs and then writes its outputs. A tensor access
 * touches every block the tensor spans: a resident block is a hit, anything
 * else is loaded on demand after evicting the LRU block if memory is full.
 * Writes dirty a block, and evicting a dirty block costs a write-back.
 *
 * The result depends only on the params, the tensor table and the plan.
 */
public class MemorySimulator {

	final SimulatorParams params;
	private final BlockAddressIndex index;
	private final List<PlanNode> plan;

	private final ResidentBlockCache ram;
	private final PagingStats stats = new PagingStats();
	private final EventLog eventLog;

	/** Unknown tensor ids that have been warned about already */
	private final Set<Integer> reportedMissing = new HashSet<>();

	PrintStream out = System.out;
	PrintStream err = System.err;

	public MemorySimulator(SimulatorParams params, Map<Integer, Tensor> tensorTable, List<PlanNode> plan) {
		this(params, checked(params, tensorTable), plan);
	}

	public MemorySimulator(SimulatorParams params, BlockAddressIndex index, List<PlanNode> plan) {
		params.validate();
		if (index.blockSize() != params.blockSizeBytes()) {
			throw new SimulatorConfigException(
					"Index built for " + index.blockSize() + "-byte blocks, params ask for " + params.blockSizeBytes());
		}
		this.params = params;
		this.index = index;
		this.plan = ImmutableList.copyOf(plan);
		this.ram = new ResidentBlockCache(params.capacity());
		this.eventLog = new EventLog(params.eventCapture());
		stats.memorySavedSharing.set(index.sharingStats());
	}

	private static BlockAddressIndex checked(SimulatorParams params, Map<Integer, Tensor> tensorTable) {
		params.validate();
		return new BlockAddressIndex(tensorTable, params.blockSizeBytes());
	}

	/**
	 * Run the whole plan from an empty memory. Calling this again starts over, so
	 * repeated runs give identical results.
	 */
	public SimulationStats simulate() {
		reset();
		if (params.verbose()) {
			out.println("\nStarting block-based memory simulation with shared memory awareness...");
			out.println("RAM size: " + params.ramSizeBytes() + " bytes, Block size: " + params.blockSizeBytes()
					+ " bytes");
			out.println("Total blocks available: " + ram.capacity());
		}
		List<Integer> misaligned = index.misalignedTensors();
		if (!misaligned.isEmpty()) {
			err.println("Warning: Found " + misaligned.size() + " tensors not aligned to " + params.blockSizeBytes()
					+ "-byte boundaries");
			if (params.verbose()) {
				out.println("Misaligned tensors: " + misaligned);
			}
		}

		long step = 0;
		for (PlanNode node : plan) {
			if (params.verbose()) {
				out.println("\nStep " + step + ": Processing node " + node.nodeIndex() + " (" + node.operator() + ")");
			}
			for (int tensorId : node.inputs()) {
				accessTensor(tensorId, step, node.nodeIndex(), false);
			}
			for (int tensorId : node.outputs()) {
				accessTensor(tensorId, step, node.nodeIndex(), true);
			}
			step++;
		}
		return stats.snapshot();
	}

	private void reset() {
		ram.clear();
		stats.reset();
		stats.memorySavedSharing.set(index.sharingStats());
		eventLog.clear();
		reportedMissing.clear();
	}

	/**
	 * Touch every block of a tensor. Unknown tensors are skipped with a
	 * warning.
	 */
	void accessTensor(int tensorId, long step, int nodeIndex, boolean isWrite) {
		Tensor t = index.tensor(tensorId);
		if (t == null) {
			stats.skippedAccesses.incr();
			if (reportedMissing.add(tensorId)) {
				err.println("Warning: node " + nodeIndex + " references tensor " + tensorId
						+ " absent from the tensor table; access skipped");
			}
			return;
		}
		if (params.verbose()) {
			traceAccess(t, isWrite);
		}

		boolean fullyResident = true;
		for (long start : index.blocksForTensor(tensorId)) {
			Block b = ram.get(start);
			if (b != null) {
				hit(b, tensorId, step, nodeIndex, isWrite);
			} else {
				load(start, step, nodeIndex, isWrite);
				fullyResident = false;
			}
		}

		if (fullyResident) {
			stats.tensorHits.incr();
		} else {
			stats.tensorMisses.incr();
		}
		stats.peakMemory.offer(ram.residentBytes());

		if (PagingSim.XASSERTS) {
			assert ram.verify();
		}
	}

	private void hit(Block b, int tensorId, long step, int nodeIndex, boolean isWrite) {
		b.setLastAccessStep(step);
		if (isWrite) {
			b.setDirty();
		}
		ram.touch(b);
		stats.blockHits.incr();
		if (b.shared()) {
			stats.sharedBlockAccesses.incr();
		}
		eventLog.append(new MemoryEvent(step, nodeIndex, EventType.ACCESS, tensorId, b.startAddress(), b.size(),
				without(b.tensorIds(), tensorId), isWrite));
	}

	private void load(long start, long step, int nodeIndex, boolean isWrite) {
		if (ram.isFull()) {
			evict(step, nodeIndex);
		}
		Block b = new Block(start, params.blockSizeBytes(), index.tensorsInBlock(start), step);
		if (isWrite) {
			b.setDirty();
		}
		ram.insert(b);
		stats.totalIO.incr(b.size());
		stats.blockMisses.incr();
		if (b.shared()) {
			stats.sharedBlockAccesses.incr();
		}
		eventLog.append(new MemoryEvent(step, nodeIndex, EventType.LOAD, b.primaryTensorId(), start, b.size(),
				without(b.tensorIds(), b.primaryTensorId()), isWrite));

		if (params.verbose()) {
			out.println("  Loading block at 0x" + Long.toHexString(start) + " (" + b.size() + " bytes) containing:");
			for (int id : b.tensorIds()) {
				Tensor t = index.tensor(id);
				out.println("    Tensor " + id + " (offset: " + (t.address() - start) + ", size: " + t.size()
						+ " bytes)");
			}
		}
	}

	private void evict(long step, int nodeIndex) {
		Block victim = ram.evictLru();
		if (victim == null) {
			return;
		}
		if (victim.dirty()) {
			stats.totalIO.incr(victim.size());
			stats.dirtyEvictions.incr();
		}
		stats.blockEvictions.incr();
		eventLog.append(new MemoryEvent(step, nodeIndex, EventType.EVICT, victim.primaryTensorId(),
				victim.startAddress(), victim.size(), without(victim.tensorIds(), victim.primaryTensorId()), false));
	}

	private static ImmutableSortedSet<Integer> without(ImmutableSortedSet<Integer> ids, int id) {
		if (!ids.contains(id)) {
			return ids;
		}
		ImmutableSortedSet.Builder<Integer> rest = ImmutableSortedSet.naturalOrder();
		for (int other : ids) {
			if (other != id) {
				rest.add(other);
			}
		}
		return rest.build();
	}

	private void traceAccess(Tensor t, boolean isWrite) {
		ImmutableSortedSet<Integer> sharers = without(index.tensorsInBlock(index.blockStart(t.address())), t.id());
		out.println("  " + (isWrite ? "Writing" : "Reading") + " tensor " + t.id() + " (size: " + t.size()
				+ " bytes, block aligned: " + index.isAligned(t) + ")"
				+ (sharers.isEmpty() ? "" : " (shares block with tensors " + sharers + ")"));
	}

	public HitRatios hitRatios() {
		return stats.snapshot().hitRatios();
	}

	/** Counters so far; after simulate() this equals its return value. */
	public SimulationStats stats() {
		return stats.snapshot();
	}

	public EventLog eventLog() {
		return eventLog;
	}

	public BlockAddressIndex index() {
		return index;
	}

	public SimulatorParams params() {
		return params;
	}

	/** Resident blocks from most to least recently used. */
	public List<Block> residentBlocks() {
		return ram.snapshot();
	}

	public boolean isResident(long blockStart) {
		return ram.contains(blockStart);
	}

	public long residentBytes() {
		return ram.residentBytes();
	}

	public long capacity() {
		return ram.capacity();
	}

	void dumpCounters(Writer wr, String prefix, String suffix) throws IOException {
		stats.dumpCounters(wr, prefix, suffix);
	}

	/** Usage summary of the resident set, listing at most five shared blocks. */
	public void printMemoryState(Writer w) throws IOException {
		List<Block> blocks = ram.snapshot();
		w.write("\nCurrent Memory State:\n");
		w.write(String.format("  RAM Usage: %d/%d bytes (%.1f%%)%n", ram.residentBytes(), params.ramSizeBytes(),
				ram.residentBytes() * 100.0 / params.ramSizeBytes()));
		w.write("  Loaded Blocks: " + blocks.size() + "/" + ram.capacity() + "\n");
		if (!blocks.isEmpty()) {
			long tensors = 0;
			for (Block b : blocks) {
				tensors += b.tensorIds().size();
			}
			w.write(String.format("  Average tensors per block: %.2f%n", (double) tensors / blocks.size()));
		}
		int shown = 0;
		int shared = 0;
		for (Block b : blocks) {
			if (!b.shared()) {
				continue;
			}
			if (shared++ == 0) {
				w.write("\n  Shared Blocks:\n");
			}
			if (shown < 5) {
				w.write("    Block 0x" + Long.toHexString(b.startAddress()) + ": " + b.tensorIds().size()
						+ " tensors " + b.tensorIds() + "\n");
				shown++;
			}
		}
		if (shared > shown) {
			w.write("    ... and " + (shared - shown) + " more shared blocks\n");
		}
	}
}
