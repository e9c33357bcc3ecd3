package tntc.trans.passes.collect;

import tntc.model.tnt.TntDeclaration;
import tntc.model.tnt.TntModule;
import tntc.scope.LookupTable;
import tntc.scope.LookupTableByModule;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;

/**
 * Builds one lookup table per module, covering the given module and every module nested in
 * it. Each table starts out as a copy of the builtins. This pass never reports issues:
 * dangling references are left for later passes to find.
 */
public class DefinitionCollectionPass {
	private static final Logger logger = Logger.getLogger(DefinitionCollectionPass.class.getName());

	private DefinitionCollectionPass() {}

	public static LookupTableByModule perform(TntModule module) {
		LookupTableByModule tables = new LookupTableByModule();
		collectModule(tables, new ArrayDeque<>(), module);
		return tables;
	}

	public static LookupTableByModule perform(List<TntModule> modules) {
		LookupTableByModule tables = new LookupTableByModule();
		for (TntModule module : modules) {
			collectModule(tables, new ArrayDeque<>(), module);
		}
		return tables;
	}

	static LookupTable collectModule(LookupTableByModule tables, Deque<String> modulePath, TntModule module) {
		LookupTable table = LookupTable.withBuiltins();
		tables.put(module.getName(), table);
		modulePath.push(module.getName());
		logger.fine("Collecting definitions of module " + String.join("::", modulePath));

		DefinitionCollectionVisitor visitor = new DefinitionCollectionVisitor(tables, modulePath, table);
		for (TntDeclaration declaration : module.getDeclarations()) {
			declaration.accept(visitor);
		}

		modulePath.pop();
		return table;
	}
}
