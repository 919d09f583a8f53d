package simulator.paging;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.text.DecimalFormat;
import java.util.List;

import joptsimple.OptionException;
import joptsimple.OptionSet;

/**
 * Command-line driver: reads a trace, replays it once per RAM budget and writes
 * one stats file covering every run.
 */
public class PagingSim {

	/** enable checking of computationally expensive asserts */
	public static boolean XASSERTS = true;

	static OptionSet Options;

	public static void main(String[] args) throws IOException {
		try {
			Options = Knobs.parser.parse(args);
		} catch (OptionException oe) {
			System.err.println(oe.getMessage());
			Knobs.parser.printHelpOn(System.err);
			System.exit(1);
			return;
		}
		if (Options.has(Knobs.Help)) {
			Knobs.parser.printHelpOn(System.out);
			return;
		}
		XASSERTS = Knobs.enabled(Options, Knobs.Xasserts);

		Trace trace = TraceReader.read(Paths.get(Options.valueOf(Knobs.TraceFile)));
		List<Long> ramSizes = Options.valuesOf(Knobs.RamSize);
		final long blockSize = Options.valueOf(Knobs.BlockSize);
		final EventCapture capture = EventCapture.of(Options.valueOf(Knobs.CaptureEvents));
		final boolean verbose = Knobs.enabled(Options, Knobs.Verbose);

		String statsFilename = Options.valueOf(Knobs.StatsFile);
		BufferedWriter statsFd = new BufferedWriter(new FileWriter(new File(statsFilename)));
		Writer console = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
		try {
			for (final long ramSize : ramSizes) {
				String prix = "[ram=" + ramSize + "] ";
				SimulatorParams p = new SimulatorParams() {
					@Override
					public long ramSizeBytes() {
						return ramSize;
					}

					@Override
					public long blockSizeBytes() {
						return blockSize;
					}

					@Override
					public EventCapture eventCapture() {
						return capture;
					}

					@Override
					public boolean verbose() {
						return verbose;
					}
				};

				final long startTime = System.currentTimeMillis();
				MemorySimulator sim;
				try {
					sim = new MemorySimulator(p, trace.tensors(), trace.plan());
				} catch (SimulatorConfigException ce) {
					System.err.println(prix + ce.getMessage());
					continue;
				}
				System.out.println(prix + "replaying " + trace.plan().size() + " nodes over "
						+ trace.tensors().size() + " tensors");
				SimulationStats stats = sim.simulate();
				double mins = (System.currentTimeMillis() - startTime) / (double) (1000 * 60);

				if (Knobs.enabled(Options, Knobs.PrintReport)) {
					new SimulationReport(sim).print(console, Knobs.enabled(Options, Knobs.PrintEvents));
				}
				System.out.println(prix + stats);
				generateStats(statsFd, ramSize, mins, sim);
			}
		} finally {
			statsFd.close();
			console.flush();
		}
		System.err.println("finished");
	}

	/** Each stat is dumped as a Python dictionary object, one per line. */
	static void generateStats(Writer statsFd, long ramSize, double simRuntimeMins, MemorySimulator sim)
			throws IOException {
		StringWriter prefix = new StringWriter();
		prefix.write("{'PagingStat':True, 'RamSize': " + ramSize + ", ");
		if (Options != null) {
			Knobs.dumpRegisteredParams(Options, prefix);
		}
		String suffix = "}" + System.getProperty("line.separator");

		sim.dumpCounters(statsFd, prefix.toString(), suffix);

		DecimalFormat fmt = new DecimalFormat("0.0000");
		HitRatios ratios = sim.hitRatios();
		statsFd.write(prefix.toString() + "'BlockHitRatio': " + fmt.format(ratios.blockHitRatio()) + suffix);
		statsFd.write(prefix.toString() + "'TensorHitRatio': " + fmt.format(ratios.tensorHitRatio()) + suffix);
		statsFd.write(prefix.toString() + "'SharedAccessRatio': " + fmt.format(ratios.sharedAccessRatio()) + suffix);
		statsFd.write(prefix.toString() + "'UniqueBlocks': " + sim.index().uniqueBlockCount() + suffix);
		statsFd.write(prefix.toString() + "'Events': " + sim.eventLog().size() + suffix);
		statsFd.write(
				prefix.toString() + "'SimulationRunningTimeMins': " + String.format("%.2f", simRuntimeMins) + suffix);
	}
}
