package simulator.paging;

import static org.junit.Assert.assertTrue;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class PagingSimTests {

	@Rule
	public TemporaryFolder tmp = new TemporaryFolder();

	@After
	public void tearDown() throws Exception {
		// main() turns the expensive checks off by default
		PagingSim.XASSERTS = true;
		PagingSim.Options = null;
	}

	private static boolean hasStat(List<String> lines, String ram, String stat) {
		for (String line : lines) {
			if (line.contains("'RamSize': " + ram + ",") && line.contains(stat)) {
				return true;
			}
		}
		return false;
	}

	@Test
	public void testRamSweepWritesStatsPerBudget() throws Exception {
		File trace = tmp.newFile("model.trace");
		Files.write(trace.toPath(),
				("tensor 1 0 4096 float32 2 0,3\n" + "tensor 2 4096 4096 float32 1 1\n"
						+ "tensor 3 8192 4096 float32 1 2\n" + "node 0 A 1 -\n" + "node 1 B 2 -\n"
						+ "node 2 C 3 -\n" + "node 3 D 1 -\n").getBytes(StandardCharsets.UTF_8));
		File statsFile = new File(tmp.getRoot(), "sim-stats.py");

		PagingSim.main(new String[] { "--trace-file", trace.getPath(), "--ram-size", "8192,65536", "--stats-file",
				statsFile.getPath(), "--print-report", "false" });

		List<String> lines = Files.readAllLines(statsFile.toPath(), StandardCharsets.UTF_8);
		assertTrue(lines.get(0).startsWith("{'PagingStat':True, 'RamSize': 8192, "));
		assertTrue(lines.get(0).contains("'BlockSize': 4096"));
		assertTrue(lines.get(0).contains("'CaptureEvents': True"));
		assertTrue(lines.get(0).contains("'TraceFile': '" + trace.getPath() + "'"));
		assertTrue(hasStat(lines, "8192", "'BlockMisses': 4}"));
		assertTrue(hasStat(lines, "8192", "'BlockEvictions': 2}"));
		assertTrue(hasStat(lines, "8192", "'PeakMemory': 8192}"));
		assertTrue(hasStat(lines, "65536", "'BlockEvictions': 0}"));
		assertTrue(hasStat(lines, "65536", "'BlockHitRatio': 0.2500}"));
	}
}
