package anf.ast;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

public final class Program {

	private final List<ProgramItem> items;

	public Program(List<? extends ProgramItem> items) {
		this.items = Lists.newArrayList(items);
	}

	public List<ProgramItem> getItems() {
		return items;
	}

	public ImmutableList<FunctionUnit> getFunctions() {
		ImmutableList.Builder<FunctionUnit> result = ImmutableList.builder();
		for (ProgramItem item : items) {
			if (item instanceof FunctionUnit) {
				result.add((FunctionUnit) item);
			}
		}
		return result.build();
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof Program) {
			return items.equals(((Program) obj).items);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return items.hashCode();
	}

	@Override
	public String toString() {
		return "Program" + items;
	}
}
