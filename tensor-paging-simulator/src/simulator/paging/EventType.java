package simulator.paging;

public enum EventType {

	/** A missing block was brought in */
	LOAD("load_block"),
	/** The LRU block was dropped to make room */
	EVICT("evict_block"),
	/** A resident block satisfied an access */
	ACCESS("access_block");

	private final String label;

	private EventType(String label) {
		this.label = label;
	}

	/** Name used in the printed event log. */
	public String label() {
		return label;
	}

}
