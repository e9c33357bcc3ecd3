package tntc.trans.passes.flattening;

import tntc.model.tnt.TntModule;
import tntc.scope.LookupTable;
import tntc.scope.LookupTableByModule;

public class FlatteningResult {
	private final TntModule module;
	private final LookupTableByModule tables;

	public FlatteningResult(TntModule module, LookupTableByModule tables) {
		this.module = module;
		this.tables = tables;
	}

	/**
	 * @return the module with every instance replaced by its namespaced definitions
	 */
	public TntModule getModule() {
		return module;
	}

	public LookupTableByModule getTables() {
		return tables;
	}

	/**
	 * @return the flattened module's own table, listing every synthesized definition
	 */
	public LookupTable getTable() {
		return tables.get(module.getName());
	}
}
