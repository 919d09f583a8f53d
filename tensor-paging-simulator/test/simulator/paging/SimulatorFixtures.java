package simulator.paging;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** Builders shared by the simulator tests. */
final class SimulatorFixtures {

	static final long BLOCK = 4096;

	private SimulatorFixtures() {
	}

	static SimulatorParams params(final long ramSize, final long blockSize, final EventCapture capture) {
		return new SimulatorParams() {
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
		};
	}

	static SimulatorParams params(long ramSize) {
		return params(ramSize, BLOCK, EventCapture.FULL_TRACE);
	}

	static Tensor tensor(int id, long address, long size) {
		return new Tensor(id, address, size, "float32", 1, Collections.<Integer>emptyList());
	}

	static Map<Integer, Tensor> table(Tensor... tensors) {
		Map<Integer, Tensor> table = new TreeMap<>();
		for (Tensor t : tensors) {
			table.put(t.id(), t);
		}
		return table;
	}

	static PlanNode reads(int nodeIndex, Integer... inputs) {
		return new PlanNode(nodeIndex, "READ", Arrays.asList(inputs), Collections.<Integer>emptyList());
	}

	static PlanNode writes(int nodeIndex, Integer... outputs) {
		return new PlanNode(nodeIndex, "WRITE", Collections.<Integer>emptyList(), Arrays.asList(outputs));
	}

	static PlanNode node(int nodeIndex, List<Integer> inputs, List<Integer> outputs) {
		return new PlanNode(nodeIndex, "OP", inputs, outputs);
	}
}
