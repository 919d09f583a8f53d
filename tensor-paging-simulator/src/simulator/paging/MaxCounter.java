package simulator.paging;

import java.util.List;

/** A counter holding the largest value it has been offered. */
public final class MaxCounter extends Counter {

	MaxCounter(String name, List<Counter> registry) {
		super(name);
		registry.add(this);
	}

	public void offer(long v) {
		stat = Math.max(stat, v);
	}
}
