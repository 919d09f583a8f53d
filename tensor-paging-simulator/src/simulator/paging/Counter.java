package simulator.paging;

import java.io.IOException;
import java.io.Writer;

public abstract class Counter {
	protected final String name;
	protected long stat;

	Counter(String n) {
		this.name = n;
	}

	public long get() {
		return stat;
	}

	void set(long v) {
		stat = v;
	}

	void reset() {
		stat = 0;
	}

	void dump(Writer wr, String prefix, String suffix) throws IOException {
		wr.write(prefix + "'" + name + "': " + stat + suffix);
	}
}
