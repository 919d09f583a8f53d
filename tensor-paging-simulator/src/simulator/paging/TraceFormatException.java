package simulator.paging;

import java.io.IOException;

/** A trace line that does not describe a tensor or a plan node. */
public class TraceFormatException extends IOException {

	private static final long serialVersionUID = 1L;

	public TraceFormatException(String source, int lineNumber, String message) {
		super(source + ":" + lineNumber + ": " + message);
	}
}
