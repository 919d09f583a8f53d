package simulator.paging;

/** Whether a run keeps its event log or only its counters. */
public enum EventCapture {
	FULL_TRACE, STATS_ONLY;

	public static EventCapture of(boolean captureEvents) {
		return captureEvents ? FULL_TRACE : STATS_ONLY;
	}
}
