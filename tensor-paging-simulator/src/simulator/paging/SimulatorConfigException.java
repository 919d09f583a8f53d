package simulator.paging;

/** Rejected memory budget or block size, raised before any access is replayed. */
public class SimulatorConfigException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	public SimulatorConfigException(String message) {
		super(message);
	}
}
