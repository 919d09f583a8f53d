package simulator.paging;

/**
 * Arguments to the MemorySimulator ctor. The required values are abstract
 * methods so that we can't forget to initialize one of them; they get
 * initialized by creating an anonymous subclass.
 */
public abstract class SimulatorParams {

	public static final long DEFAULT_BLOCK_SIZE = 4096;

	/** Total simulated memory budget, in bytes */
	public abstract long ramSizeBytes();

	/** Paging granularity, in bytes */
	public long blockSizeBytes() {
		return DEFAULT_BLOCK_SIZE;
	}

	public abstract EventCapture eventCapture();

	/** Print every step and block load as the plan is replayed */
	public boolean verbose() {
		return false;
	}

	/** Number of blocks the budget holds. */
	public final long capacity() {
		return ramSizeBytes() / blockSizeBytes();
	}

	void validate() {
		if (ramSizeBytes() <= 0) {
			throw new SimulatorConfigException("RAM size must be positive: " + ramSizeBytes());
		}
		if (blockSizeBytes() <= 0) {
			throw new SimulatorConfigException("Block size must be positive: " + blockSizeBytes());
		}
		if (ramSizeBytes() < blockSizeBytes()) {
			throw new SimulatorConfigException(
					"RAM size " + ramSizeBytes() + " cannot hold a single " + blockSizeBytes() + "-byte block");
		}
	}
}
