package tntc.trans.passes.alias;

import tntc.model.tnt.TntModule;
import tntc.scope.LookupTable;

import java.util.List;

public class TypeAliasInliningResult {
	private final List<TntModule> modules;
	private final LookupTable table;

	public TypeAliasInliningResult(List<TntModule> modules, LookupTable table) {
		this.modules = modules;
		this.table = table;
	}

	public List<TntModule> getModules() {
		return modules;
	}

	public LookupTable getTable() {
		return table;
	}
}
