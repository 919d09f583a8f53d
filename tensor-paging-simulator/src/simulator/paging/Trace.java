package simulator.paging;

import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

/** The tensor table and execution plan read from one trace. */
public final class Trace {
	private final ImmutableSortedMap<Integer, Tensor> tensors;
	private final ImmutableList<PlanNode> plan;

	public Trace(Map<Integer, Tensor> tensors, List<PlanNode> plan) {
		this.tensors = ImmutableSortedMap.copyOf(tensors);
		this.plan = ImmutableList.copyOf(plan);
	}

	public ImmutableSortedMap<Integer, Tensor> tensors() {
		return tensors;
	}

	public ImmutableList<PlanNode> plan() {
		return plan;
	}
}
