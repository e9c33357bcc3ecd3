package tntc.trans.passes.collect;

import tntc.model.tnt.*;
import tntc.scope.DefinitionKind;
import tntc.scope.DefinitionTable;
import tntc.scope.LookupTable;
import tntc.scope.LookupTableByModule;
import tntc.scope.TypeDefinition;
import tntc.scope.ValueDefinition;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;

public class DefinitionCollectionVisitor extends TntDeclarationVisitor<Void, RuntimeException> {

	public static final String ANONYMOUS = "_";

	private final LookupTableByModule tables;
	private final Deque<String> modulePath;
	private final LookupTable table;
	// innermost lambda or let on top
	private final Deque<Long> scopes;
	private final DefinitionCollectionExpressionVisitor expressionVisitor;

	public DefinitionCollectionVisitor(LookupTableByModule tables, Deque<String> modulePath, LookupTable table) {
		this.tables = tables;
		this.modulePath = modulePath;
		this.table = table;
		this.scopes = new ArrayDeque<>();
		this.expressionVisitor = new DefinitionCollectionExpressionVisitor(this);
	}

	Deque<Long> getScopes() {
		return scopes;
	}

	void define(DefinitionKind kind, String identifier, long reference, Long scope) {
		if (ANONYMOUS.equals(identifier)) {
			return;
		}
		table.addValueDefinition(new ValueDefinition(kind, identifier, reference, scope));
	}

	private void collect(TntExpression expression) {
		expression.accept(expressionVisitor);
	}

	@Override
	public Void visit(TntConstant tntConstant) throws RuntimeException {
		define(DefinitionKind.CONST, tntConstant.getName(), tntConstant.getId(), null);
		return null;
	}

	@Override
	public Void visit(TntVariable tntVariable) throws RuntimeException {
		define(DefinitionKind.VAR, tntVariable.getName(), tntVariable.getId(), null);
		return null;
	}

	@Override
	public Void visit(TntOperatorDefinition tntOperatorDefinition) throws RuntimeException {
		define(DefinitionKind.DEF, tntOperatorDefinition.getName(), tntOperatorDefinition.getId(), scopes.peek());
		collect(tntOperatorDefinition.getBody());
		return null;
	}

	@Override
	public Void visit(TntTypeDefinition tntTypeDefinition) throws RuntimeException {
		if (!ANONYMOUS.equals(tntTypeDefinition.getName())) {
			table.addTypeDefinition(new TypeDefinition(
					tntTypeDefinition.getName(), tntTypeDefinition.getType(), tntTypeDefinition.getId()));
		}
		return null;
	}

	@Override
	public Void visit(TntAssumption tntAssumption) throws RuntimeException {
		define(DefinitionKind.ASSUMPTION, tntAssumption.getName(), tntAssumption.getId(), null);
		collect(tntAssumption.getAssumption());
		return null;
	}

	@Override
	public Void visit(TntImport tntImport) throws RuntimeException {
		// imports are resolved once every module has been collected
		return null;
	}

	@Override
	public Void visit(TntInstance tntInstance) throws RuntimeException {
		define(DefinitionKind.MODULE, tntInstance.getName(), tntInstance.getId(), null);
		for (TntInstance.Override override : tntInstance.getOverrides()) {
			collect(override.getExpression());
		}
		return null;
	}

	@Override
	public Void visit(TntModuleDefinition tntModuleDefinition) throws RuntimeException {
		String innerName = tntModuleDefinition.getName();
		LookupTable inner = DefinitionCollectionPass.collectModule(tables, modulePath, tntModuleDefinition.getModule());
		for (Map.Entry<String, DefinitionTable> entry : inner.getEntries()) {
			DefinitionTable exported = entry.getValue().exported();
			if (!exported.isEmpty()) {
				String qualified = LookupTable.qualify(innerName, entry.getKey());
				table.put(qualified, exported.withPrefix(innerName));
			}
		}
		define(DefinitionKind.MODULE, innerName, tntModuleDefinition.getId(), null);
		return null;
	}
}
