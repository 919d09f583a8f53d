package simulator.paging;

import java.util.List;

/** A counter that only accumulates. */
public final class SumCounter extends Counter {

	SumCounter(String name, List<Counter> registry) {
		super(name);
		registry.add(this);
	}

	public void incr() {
		stat++;
	}

	public void incr(long a) {
		assert a >= 0 : name + " incr " + a;
		stat += a;
	}
}
