package simulator.paging;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static simulator.paging.SimulatorFixtures.params;

import java.io.StringWriter;

import org.junit.Before;
import org.junit.Test;

public class SimulationReportTests {

	MemorySimulator sim;
	SimulationStats stats;

	@Before
	public void setUp() throws Exception {
		Trace trace = TraceReader.read(TraceReaderTests.resource("shared-blocks.trace"), "shared-blocks.trace");
		sim = new MemorySimulator(params(8192), trace.tensors(), trace.plan());
		stats = sim.simulate();
	}

	@Test
	public void testSharedTraceStats() {
		assertEquals(1, stats.blockHits());
		assertEquals(5, stats.blockMisses());
		assertEquals(3, stats.blockEvictions());
		assertEquals(5 * 4096, stats.totalIO());
		assertEquals(8192, stats.peakMemory());
		assertEquals(2, stats.sharedBlockAccesses());
		assertEquals(13312 - 4 * 4096, stats.memorySavedSharing());
		assertTrue(sim.isResident(0x3000));
		assertTrue(sim.residentBlocks().get(0).dirty());
	}

	@Test
	public void testReportSections() throws Exception {
		StringWriter w = new StringWriter();
		new SimulationReport(sim).print(w, false);
		String report = w.toString();

		assertTrue(report.contains("RAM Size: 8192 bytes"));
		assertTrue(report.contains("Total Blocks: 2"));
		assertTrue(report.contains("Block-aligned tensors: 4/5"));
		assertTrue(report.contains("Memory Saved Through Sharing: -3072 bytes"));
		assertTrue(report.contains("Shared Block Access Ratio: 0.3333"));
		assertTrue(report.contains("Block Misses: 5"));
		assertTrue(report.contains("Block Evictions: 3"));
		assertTrue(report.contains("Blocks with 1 tensors: 1"));
		assertTrue(report.contains("Blocks with 2 tensors: 1"));
		assertTrue(report.contains("Block at 0x3000:"));
		assertTrue(report.contains("Tensor 4: offset 512 bytes, size 512 bytes"));
		assertFalse(report.contains("Memory Event Log"));
	}

	@Test
	public void testReportWithEventLog() throws Exception {
		StringWriter w = new StringWriter();
		new SimulationReport(sim).print(w, true);
		String report = w.toString();

		assertTrue(report.contains("=== Memory Event Log ==="));
		assertTrue(report.contains("Step 3:"));
		assertTrue(report.contains("Node 2: evict_block - Tensor 0 [Block addr: 0x0, size: 4096]"));
		assertTrue(report.contains(
				"Node 3: access_block - Tensor 4 (shared with tensors [3]) (write) [Block addr: 0x3000, size: 4096]"));
	}

	@Test
	public void testEventLogDisabled() throws Exception {
		Trace trace = TraceReader.read(TraceReaderTests.resource("shared-blocks.trace"), "shared-blocks.trace");
		MemorySimulator lean = new MemorySimulator(params(8192, 4096, EventCapture.STATS_ONLY), trace.tensors(),
				trace.plan());
		assertEquals(stats, lean.simulate());

		StringWriter w = new StringWriter();
		lean.eventLog().print(w);
		assertTrue(w.toString().contains("event capture disabled"));
	}
}
