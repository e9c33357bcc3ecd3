package tntc.trans.passes.imports;

import tntc.errors.IssueContext;
import tntc.model.tnt.*;
import tntc.scope.DefinitionKind;
import tntc.scope.DefinitionTable;
import tntc.scope.LookupTable;
import tntc.scope.LookupTableByModule;
import tntc.scope.ValueDefinition;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

public class ImportResolutionVisitor extends TntDeclarationVisitor<Void, RuntimeException> {
	private static final Logger logger = Logger.getLogger(ImportResolutionVisitor.class.getName());

	private final IssueContext ctx;
	private final LookupTableByModule tables;
	private final LookupTable importer;

	public ImportResolutionVisitor(IssueContext ctx, LookupTableByModule tables, LookupTable importer) {
		this.ctx = ctx;
		this.tables = tables;
		this.importer = importer;
	}

	private LookupTable lookupModule(String moduleName, TntDeclaration declaration) {
		LookupTable table = tables.get(moduleName);
		if (table == null) {
			ctx.error(new ModuleNotFoundIssue(moduleName, declaration.getLocation()));
		}
		return table;
	}

	private static boolean isModule(DefinitionTable definitions) {
		return definitions.getValueDefinitions().stream()
				.anyMatch(definition -> definition.getKind() == DefinitionKind.MODULE);
	}

	@Override
	public Void visit(TntConstant tntConstant) throws RuntimeException {
		return null;
	}

	@Override
	public Void visit(TntVariable tntVariable) throws RuntimeException {
		return null;
	}

	@Override
	public Void visit(TntOperatorDefinition tntOperatorDefinition) throws RuntimeException {
		return null;
	}

	@Override
	public Void visit(TntTypeDefinition tntTypeDefinition) throws RuntimeException {
		return null;
	}

	@Override
	public Void visit(TntAssumption tntAssumption) throws RuntimeException {
		return null;
	}

	@Override
	public Void visit(TntImport tntImport) throws RuntimeException {
		LookupTable source = lookupModule(tntImport.getModuleName(), tntImport);
		if (source == null) {
			return null;
		}
		if (tntImport.isWildcard()) {
			importAll(source);
			return null;
		}
		String name = tntImport.getDefinitionName();
		DefinitionTable definitions = source.get(name);
		if (definitions == null) {
			ctx.error(new DefinitionNotFoundIssue(name, tntImport.getModuleName(), tntImport.getLocation()));
			return null;
		}
		importer.put(name, definitions);
		if (isModule(definitions)) {
			importNestedModule(tntImport, source, name);
		}
		return null;
	}

	private void importAll(LookupTable source) {
		for (Map.Entry<String, DefinitionTable> entry : source.getEntries()) {
			if (!entry.getValue().isModuleLevel()) {
				continue;
			}
			DefinitionTable exported = entry.getValue().exported();
			if (!exported.isEmpty()) {
				importer.put(entry.getKey(), exported);
			}
		}
	}

	private void importNestedModule(TntImport tntImport, LookupTable source, String innerName) {
		String prefix = innerName + LookupTable.NAMESPACE_SEPARATOR;
		boolean found = false;
		for (Map.Entry<String, DefinitionTable> entry : source.getEntries()) {
			if (entry.getKey().startsWith(prefix)) {
				importer.put(entry.getKey(), entry.getValue());
				found = true;
			}
		}
		LookupTable inner = tables.get(innerName);
		if (inner == null) {
			if (!found) {
				ctx.error(new DefinitionNotFoundIssue(innerName, tntImport.getModuleName(), tntImport.getLocation()));
			}
			return;
		}
		for (Map.Entry<String, DefinitionTable> entry : inner.getEntries()) {
			DefinitionTable exported = entry.getValue().exported();
			String qualified = LookupTable.qualify(innerName, entry.getKey());
			if (!exported.isEmpty() && !importer.containsKey(qualified)) {
				importer.put(qualified, exported.withPrefix(innerName));
			}
		}
	}

	@Override
	public Void visit(TntInstance tntInstance) throws RuntimeException {
		String protoName = tntInstance.getProtoName();
		LookupTable proto = lookupModule(protoName, tntInstance);
		if (proto == null) {
			return null;
		}

		Set<String> overridden = new HashSet<>();
		for (TntInstance.Override override : tntInstance.getOverrides()) {
			DefinitionTable definitions = proto.get(override.getName());
			DefinitionTable exported = definitions == null ? null : definitions.exported();
			if (exported == null || exported.getValueDefinitions().isEmpty()) {
				ctx.error(new DefinitionNotFoundIssue(override.getName(), protoName, override.getLocation()));
				continue;
			}
			if (exported.getValueDefinitions().stream().noneMatch(d -> d.getKind() == DefinitionKind.CONST)) {
				logger.warning("instance " + tntInstance.getName() + " overrides " + override.getName() +
						", which is not a constant of module " + protoName);
			}
			overridden.add(override.getName());
			String qualified = LookupTable.qualify(tntInstance.getName(), override.getName());
			DefinitionTable replacement = new DefinitionTable();
			replacement.addValueDefinition(new ValueDefinition(
					DefinitionKind.DEF, qualified, override.getExpression().getId()));
			importer.put(qualified, replacement);
		}

		for (Map.Entry<String, DefinitionTable> entry : proto.getEntries()) {
			if (overridden.contains(entry.getKey())) {
				continue;
			}
			DefinitionTable exported = entry.getValue().exported();
			if (!exported.isEmpty()) {
				importer.put(LookupTable.qualify(tntInstance.getName(), entry.getKey()),
						exported.withPrefix(tntInstance.getName()));
			}
		}
		if (!importer.containsKey(tntInstance.getName())) {
			importer.addValueDefinition(new ValueDefinition(
					DefinitionKind.MODULE, tntInstance.getName(), tntInstance.getId()));
		}
		return null;
	}

	@Override
	public Void visit(TntModuleDefinition tntModuleDefinition) throws RuntimeException {
		// the collector already registered the nested module's definitions under its prefix
		return null;
	}
}
