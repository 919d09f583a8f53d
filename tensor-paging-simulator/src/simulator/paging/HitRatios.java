package simulator.paging;

public final class HitRatios {
	private final double blockHitRatio;
	private final double tensorHitRatio;
	private final double sharedAccessRatio;

	HitRatios(double blockHitRatio, double tensorHitRatio, double sharedAccessRatio) {
		this.blockHitRatio = blockHitRatio;
		this.tensorHitRatio = tensorHitRatio;
		this.sharedAccessRatio = sharedAccessRatio;
	}

	public double blockHitRatio() {
		return blockHitRatio;
	}

	public double tensorHitRatio() {
		return tensorHitRatio;
	}

	/** Shared-block accesses over all block accesses. */
	public double sharedAccessRatio() {
		return sharedAccessRatio;
	}

	@Override
	public String toString() {
		return String.format("block=%.4f tensor=%.4f shared=%.4f", blockHitRatio, tensorHitRatio, sharedAccessRatio);
	}
}
