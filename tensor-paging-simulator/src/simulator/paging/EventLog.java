package simulator.paging;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only record of loads, evictions and hits. Under
 * {@link EventCapture#STATS_ONLY} appends are dropped so that long plans do
 * not grow the log.
 */
public final class EventLog {

	private final EventCapture capture;
	private final List<MemoryEvent> events = new ArrayList<>();

	EventLog(EventCapture capture) {
		this.capture = capture;
	}

	public boolean enabled() {
		return capture == EventCapture.FULL_TRACE;
	}

	void append(MemoryEvent e) {
		if (enabled()) {
			events.add(e);
		}
	}

	void clear() {
		events.clear();
	}

	public int size() {
		return events.size();
	}

	/** Read-only view, in the order the events happened. */
	public List<MemoryEvent> events() {
		return Collections.unmodifiableList(events);
	}

	public long count(EventType type) {
		long n = 0;
		for (MemoryEvent e : events) {
			if (e.type == type) {
				n++;
			}
		}
		return n;
	}

	/** Write the log grouped under one heading per step. */
	public void print(Writer w) throws IOException {
		w.write("\n=== Memory Event Log ===\n");
		if (!enabled()) {
			w.write("  (event capture disabled)\n");
			return;
		}
		long currentStep = -1;
		for (MemoryEvent e : events) {
			if (e.step != currentStep) {
				currentStep = e.step;
				w.write("\nStep " + currentStep + ":\n");
			}
			w.write("  " + e + "\n");
		}
	}
}
