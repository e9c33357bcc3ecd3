package tntc.trans.passes.flattening;

import tntc.model.tnt.*;
import tntc.scope.DefinitionKind;
import tntc.scope.LookupTable;
import tntc.scope.ValueDefinition;
import tntc.trans.passes.collect.DefinitionCollectionVisitor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Copies an expression of a prototype module into an instance namespace. Every node gets a
 * fresh id. Names that resolve to a definition of the prototype are qualified with the
 * namespace; builtins and lambda parameters are left as they are.
 *
 * Names are resolved against the prototype's table using the ids of the original lambdas and
 * lets, while the fresh ids are what the derived table records for the copies.
 */
public class NamespaceAddingExpressionVisitor extends TntExpressionVisitor<TntExpression, RuntimeException> {

	private final String namespace;
	private final LookupTable protoTable;
	private final LookupTable derivedTable;
	private final IdGenerator idGenerator;
	private final NamespaceAddingTypeVisitor typeVisitor;
	// original scope ids, outermost first
	private final List<Long> scopes;
	// fresh scope ids, innermost on top
	private final Deque<Long> freshScopes;

	public NamespaceAddingExpressionVisitor(String namespace, LookupTable protoTable, LookupTable derivedTable,
	                                        IdGenerator idGenerator) {
		this.namespace = namespace;
		this.protoTable = protoTable;
		this.derivedTable = derivedTable;
		this.idGenerator = idGenerator;
		this.typeVisitor = new NamespaceAddingTypeVisitor(namespace, idGenerator);
		this.scopes = new ArrayList<>();
		this.freshScopes = new ArrayDeque<>();
	}

	public NamespaceAddingTypeVisitor getTypeVisitor() {
		return typeVisitor;
	}

	private String qualifyIfNeeded(String name) {
		if (FlatteningPass.shouldAddNamespace(protoTable, name, scopes)) {
			return LookupTable.qualify(namespace, name);
		}
		return name;
	}

	private TntType namespaceType(TntType type) {
		return type == null ? null : type.accept(typeVisitor);
	}

	/**
	 * Copies an operator definition into the namespace and records the copy in the derived
	 * table, scoped to the innermost let being copied, if any.
	 */
	public TntOperatorDefinition namespaceOperatorDefinition(TntOperatorDefinition definition) {
		long id = idGenerator.nextId();
		String name = LookupTable.qualify(namespace, definition.getName());
		ValueDefinition copy = new ValueDefinition(DefinitionKind.DEF, name, id, freshScopes.peek());
		if (copy.isScoped()) {
			derivedTable.addValueDefinition(copy);
		} else {
			derivedTable.redefineValue(copy);
		}
		return new TntOperatorDefinition(definition.getLocation(), id, name, definition.getQualifier(),
				definition.getBody().accept(this), namespaceType(definition.getTypeAnnotation()));
	}

	@Override
	public TntExpression visit(TntName tntName) throws RuntimeException {
		return new TntName(tntName.getLocation(), idGenerator.nextId(), qualifyIfNeeded(tntName.getName()));
	}

	@Override
	public TntExpression visit(TntBool tntBool) throws RuntimeException {
		return new TntBool(tntBool.getLocation(), idGenerator.nextId(), tntBool.getValue());
	}

	@Override
	public TntExpression visit(TntInt tntInt) throws RuntimeException {
		return new TntInt(tntInt.getLocation(), idGenerator.nextId(), tntInt.getValue());
	}

	@Override
	public TntExpression visit(TntStr tntStr) throws RuntimeException {
		return new TntStr(tntStr.getLocation(), idGenerator.nextId(), tntStr.getValue());
	}

	@Override
	public TntExpression visit(TntApp tntApp) throws RuntimeException {
		long id = idGenerator.nextId();
		String opcode = qualifyIfNeeded(tntApp.getOpcode());
		return new TntApp(tntApp.getLocation(), id, opcode,
				tntApp.getArgs().stream().map(a -> a.accept(this)).collect(Collectors.toList()));
	}

	@Override
	public TntExpression visit(TntLambda tntLambda) throws RuntimeException {
		long id = idGenerator.nextId();
		List<TntParameter> params = new ArrayList<>();
		for (TntParameter param : tntLambda.getParams()) {
			TntParameter copy = new TntParameter(param.getLocation(), idGenerator.nextId(), param.getName());
			if (!DefinitionCollectionVisitor.ANONYMOUS.equals(copy.getName())) {
				derivedTable.addValueDefinition(new ValueDefinition(DefinitionKind.PARAM, copy.getName(), copy.getId(), id));
			}
			params.add(copy);
		}
		scopes.add(tntLambda.getId());
		freshScopes.push(id);
		TntExpression body = tntLambda.getBody().accept(this);
		freshScopes.pop();
		scopes.remove(scopes.size() - 1);
		return new TntLambda(tntLambda.getLocation(), id, params, tntLambda.getQualifier(), body);
	}

	@Override
	public TntExpression visit(TntLet tntLet) throws RuntimeException {
		long id = idGenerator.nextId();
		scopes.add(tntLet.getId());
		freshScopes.push(id);
		TntOperatorDefinition definition = namespaceOperatorDefinition(tntLet.getDefinition());
		TntExpression body = tntLet.getBody().accept(this);
		freshScopes.pop();
		scopes.remove(scopes.size() - 1);
		return new TntLet(tntLet.getLocation(), id, definition, body);
	}
}
