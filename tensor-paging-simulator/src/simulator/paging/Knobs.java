package simulator.paging;

import java.io.IOException;
import java.io.Writer;
import java.util.LinkedList;
import java.util.List;

import com.google.common.base.CaseFormat;

import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;

public class Knobs {

	public static final OptionSpec<Void> Help;
	public static final OptionSpec<Boolean> Xasserts;
	public static final OptionSpec<String> StatsFile;
	public static final OptionSpec<String> TraceFile;

	// memory model
	public static final OptionSpec<Long> RamSize;
	public static final OptionSpec<Long> BlockSize;
	public static final OptionSpec<Boolean> CaptureEvents;

	// output
	public static final OptionSpec<Boolean> PrintReport;
	public static final OptionSpec<Boolean> PrintEvents;
	public static final OptionSpec<Boolean> Verbose;

	public static final OptionParser parser;

	private Knobs() {
	}

	static {
		parser = new OptionParser();
		RegisteredParameters = new LinkedList<OptionSpec<?>>();

		Help = parser.accepts("help", "print this help message").forHelp();
		Xasserts = parser.accepts("xasserts", "enable eXpensive assert checks").withOptionalArg().ofType(Boolean.class)
				.defaultsTo(false);
		StatsFile = parser.accepts("stats-file", "stats file to generate").withRequiredArg().defaultsTo("sim-stats.py");
		TraceFile = register(
				parser.accepts("trace-file", "tensor table and execution plan to replay").withRequiredArg().required());

		RamSize = parser
				.accepts("ram-size", "Memory budget in bytes; a comma-separated list runs one simulation per budget")
				.withRequiredArg().ofType(Long.class).withValuesSeparatedBy(',')
				.defaultsTo(4L * 1024 * 1024 * 1024/* 4GB */);
		BlockSize = register(parser.accepts("block-size", "Paging granularity in bytes").withRequiredArg()
				.ofType(Long.class).defaultsTo(SimulatorParams.DEFAULT_BLOCK_SIZE));
		CaptureEvents = register(parser
				.accepts("capture-events", "Keep the full event log (disable for very long plans)").withRequiredArg()
				.ofType(Boolean.class).defaultsTo(true));

		PrintReport = parser.accepts("print-report", "Print the simulation report after each run").withRequiredArg()
				.ofType(Boolean.class).defaultsTo(true);
		PrintEvents = parser.accepts("print-events", "Include the event log in the report").withOptionalArg()
				.ofType(Boolean.class).defaultsTo(false);
		Verbose = parser.accepts("verbose", "Trace every step and block load").withOptionalArg().ofType(Boolean.class)
				.defaultsTo(false);
	}

	/** True if a boolean knob was given, either bare or with a true value. */
	static boolean enabled(OptionSet options, OptionSpec<Boolean> knob) {
		if (!options.has(knob)) {
			return options.valueOf(knob);
		}
		return !options.hasArgument(knob) || options.valueOf(knob);
	}

	/*
	 * Knobs wrapped in register() are echoed into every stats line under their
	 * UpperCamel name, e.g. --block-size as 'BlockSize'.
	 */

	private static final List<OptionSpec<?>> RegisteredParameters;

	private static <T> OptionSpec<T> register(OptionSpec<T> o) {
		RegisteredParameters.add(o);
		return o;
	}

	static String statName(OptionSpec<?> o) {
		return CaseFormat.LOWER_HYPHEN.to(CaseFormat.UPPER_CAMEL, o.options().get(0));
	}

	public static void dumpRegisteredParams(OptionSet options, Writer w) throws IOException {
		for (OptionSpec<?> os : RegisteredParameters) {
			Object value = options.valueOf(os);
			String text;
			if (value instanceof Boolean) {
				text = (Boolean) value ? "True" : "False";
			} else if (value instanceof String) {
				text = "'" + value + "'";
			} else {
				text = String.valueOf(value);
			}
			w.write("'" + statName(os) + "': " + text + ", ");
		}
	}

}
