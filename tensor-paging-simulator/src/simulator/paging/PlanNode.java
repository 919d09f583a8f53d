package simulator.paging;

import java.util.List;

import com.google.common.collect.ImmutableList;

/** One entry of the execution plan: the inputs are read, then the outputs written. */
public final class PlanNode {
	private final int nodeIndex;
	private final String operator;
	private final ImmutableList<Integer> inputs;
	private final ImmutableList<Integer> outputs;

	public PlanNode(int nodeIndex, String operator, List<Integer> inputs, List<Integer> outputs) {
		this.nodeIndex = nodeIndex;
		this.operator = operator;
		this.inputs = ImmutableList.copyOf(inputs);
		this.outputs = ImmutableList.copyOf(outputs);
	}

	public int nodeIndex() {
		return nodeIndex;
	}

	public String operator() {
		return operator;
	}

	public ImmutableList<Integer> inputs() {
		return inputs;
	}

	public ImmutableList<Integer> outputs() {
		return outputs;
	}

	@Override
	public String toString() {
		return "node " + nodeIndex + " (" + operator + ") in=" + inputs + " out=" + outputs;
	}
}
