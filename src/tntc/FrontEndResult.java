package tntc;

import tntc.model.tnt.TntModule;
import tntc.scope.LookupTable;
import tntc.scope.LookupTableByModule;

import java.util.List;

/**
 * What the name resolution front end hands to type checking: instance-free modules with
 * aliases inlined, and the lookup table of every module.
 */
public class FrontEndResult {
	private final List<TntModule> modules;
	private final String mainModuleName;
	private final LookupTableByModule tables;

	public FrontEndResult(List<TntModule> modules, String mainModuleName, LookupTableByModule tables) {
		this.modules = modules;
		this.mainModuleName = mainModuleName;
		this.tables = tables;
	}

	public List<TntModule> getModules() {
		return modules;
	}

	public TntModule getMainModule() {
		for (TntModule module : modules) {
			if (module.getName().equals(mainModuleName)) {
				return module;
			}
		}
		throw new InternalCompilerError("main module " + mainModuleName + " missing from front end result");
	}

	public LookupTableByModule getTables() {
		return tables;
	}

	public LookupTable getMainTable() {
		return tables.get(mainModuleName);
	}
}
