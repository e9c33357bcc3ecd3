package tntc.trans.passes.alias;

import tntc.InternalCompilerError;
import tntc.model.tnt.TntDeclaration;
import tntc.model.tnt.TntModule;
import tntc.model.tnt.TntModuleDefinition;
import tntc.model.tnt.TntType;
import tntc.scope.DefinitionTable;
import tntc.scope.LookupTable;
import tntc.scope.LookupTableByModule;
import tntc.scope.TypeDefinition;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Replaces references to type aliases with the types they denote, in the modules and in the
 * type definitions of the table. Running the pass on its own output changes nothing.
 *
 * Declarations of a nested module are resolved against that module's own table, looked up by
 * name in the per-module tables. So are the entries the enclosing table holds under the nested
 * module's prefix.
 */
public class TypeAliasInliningPass {
	private static final Logger logger = Logger.getLogger(TypeAliasInliningPass.class.getName());

	private TypeAliasInliningPass() {}

	public static TypeAliasInliningResult perform(List<TntModule> modules, LookupTable table) {
		return perform(modules, table, new LookupTableByModule());
	}

	public static TypeAliasInliningResult perform(List<TntModule> modules, LookupTable table,
	                                              LookupTableByModule moduleTables) {
		AliasInliningDeclarationVisitor visitor = new AliasInliningDeclarationVisitor(table, moduleTables);
		List<TntModule> inlinedModules = new ArrayList<>();
		Map<String, LookupTable> nestedTables = new HashMap<>();
		for (TntModule module : modules) {
			logger.fine("Inlining type aliases of module " + module.getName());
			inlinedModules.add(module.withDeclarations(module.getDeclarations().stream()
					.map(d -> d.accept(visitor))
					.collect(Collectors.toList())));
			for (TntDeclaration declaration : module.getDeclarations()) {
				if (declaration instanceof TntModuleDefinition) {
					String nestedName = ((TntModuleDefinition) declaration).getModule().getName();
					nestedTables.put(nestedName, moduleTables.get(nestedName));
				}
			}
		}
		return new TypeAliasInliningResult(inlinedModules, inlineTable(table, nestedTables));
	}

	private static LookupTable inlineTable(LookupTable table, Map<String, LookupTable> nestedTables) {
		AliasInliningTypeVisitor typeVisitor = new AliasInliningTypeVisitor(table);
		LookupTable inlinedTable = new LookupTable();
		for (Map.Entry<String, DefinitionTable> entry : table.getEntries()) {
			AliasInliningTypeVisitor entryVisitor = typeVisitor;
			int separator = entry.getKey().indexOf("::");
			if (separator != -1 && nestedTables.containsKey(entry.getKey().substring(0, separator))) {
				String nestedName = entry.getKey().substring(0, separator);
				if (nestedTables.get(nestedName) == null) {
					throw new InternalCompilerError("no lookup table for nested module " + nestedName);
				}
				entryVisitor = new AliasInliningTypeVisitor(nestedTables.get(nestedName));
			}
			DefinitionTable definitions = entry.getValue();
			List<TypeDefinition> types = new ArrayList<>();
			for (TypeDefinition definition : definitions.getTypeDefinitions()) {
				types.add(definition.isUninterpreted() ? definition : definition.withType(definition.getType().accept(entryVisitor)));
			}
			inlinedTable.put(entry.getKey(), new DefinitionTable(definitions.getValueDefinitions(), types));
		}
		return inlinedTable;
	}

	public static TntDeclaration inlineAliasesInDeclaration(TntDeclaration declaration, LookupTable table) {
		return declaration.accept(new AliasInliningDeclarationVisitor(table));
	}

	public static TntType inlineAliasesInType(TntType type, LookupTable table) {
		return type.accept(new AliasInliningTypeVisitor(table));
	}
}
