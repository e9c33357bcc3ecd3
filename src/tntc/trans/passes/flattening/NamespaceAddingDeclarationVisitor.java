package tntc.trans.passes.flattening;

import tntc.InternalCompilerError;
import tntc.model.tnt.*;
import tntc.scope.DefinitionKind;
import tntc.scope.LookupTable;
import tntc.scope.LookupTableByModule;
import tntc.scope.TypeDefinition;
import tntc.scope.ValueDefinition;
import tntc.trans.passes.collect.DefinitionCollectionVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Produces the namespaced copies of one prototype declaration, registering each copy in the
 * derived table under its fresh id.
 */
public class NamespaceAddingDeclarationVisitor extends TntDeclarationVisitor<List<TntDeclaration>, RuntimeException> {

	private final String namespace;
	private final LookupTableByModule tables;
	private final LookupTable derivedTable;
	private final IdGenerator idGenerator;
	private final NamespaceAddingExpressionVisitor expressionVisitor;

	public NamespaceAddingDeclarationVisitor(String namespace, LookupTableByModule tables, LookupTable protoTable,
	                                         LookupTable derivedTable, IdGenerator idGenerator) {
		this.namespace = namespace;
		this.tables = tables;
		this.derivedTable = derivedTable;
		this.idGenerator = idGenerator;
		this.expressionVisitor = new NamespaceAddingExpressionVisitor(namespace, protoTable, derivedTable, idGenerator);
	}

	private TntType namespaceType(TntType type) {
		return type == null ? null : type.accept(expressionVisitor.getTypeVisitor());
	}

	private void register(DefinitionKind kind, String originalName, String name, long id) {
		if (!DefinitionCollectionVisitor.ANONYMOUS.equals(originalName)) {
			derivedTable.redefineValue(new ValueDefinition(kind, name, id));
		}
	}

	@Override
	public List<TntDeclaration> visit(TntConstant tntConstant) throws RuntimeException {
		long id = idGenerator.nextId();
		String name = LookupTable.qualify(namespace, tntConstant.getName());
		register(DefinitionKind.CONST, tntConstant.getName(), name, id);
		return Collections.singletonList(
				new TntConstant(tntConstant.getLocation(), id, name, namespaceType(tntConstant.getType())));
	}

	@Override
	public List<TntDeclaration> visit(TntVariable tntVariable) throws RuntimeException {
		long id = idGenerator.nextId();
		String name = LookupTable.qualify(namespace, tntVariable.getName());
		register(DefinitionKind.VAR, tntVariable.getName(), name, id);
		return Collections.singletonList(
				new TntVariable(tntVariable.getLocation(), id, name, namespaceType(tntVariable.getType())));
	}

	@Override
	public List<TntDeclaration> visit(TntOperatorDefinition tntOperatorDefinition) throws RuntimeException {
		return Collections.singletonList(expressionVisitor.namespaceOperatorDefinition(tntOperatorDefinition));
	}

	@Override
	public List<TntDeclaration> visit(TntTypeDefinition tntTypeDefinition) throws RuntimeException {
		long id = idGenerator.nextId();
		String name = LookupTable.qualify(namespace, tntTypeDefinition.getName());
		TntType type = namespaceType(tntTypeDefinition.getType());
		if (!DefinitionCollectionVisitor.ANONYMOUS.equals(tntTypeDefinition.getName())) {
			derivedTable.redefineType(new TypeDefinition(name, type, id));
		}
		return Collections.singletonList(new TntTypeDefinition(tntTypeDefinition.getLocation(), id, name, type));
	}

	@Override
	public List<TntDeclaration> visit(TntAssumption tntAssumption) throws RuntimeException {
		long id = idGenerator.nextId();
		String name = LookupTable.qualify(namespace, tntAssumption.getName());
		register(DefinitionKind.ASSUMPTION, tntAssumption.getName(), name, id);
		return Collections.singletonList(new TntAssumption(tntAssumption.getLocation(), id, name,
				tntAssumption.getAssumption().accept(expressionVisitor)));
	}

	@Override
	public List<TntDeclaration> visit(TntImport tntImport) throws RuntimeException {
		// whatever the prototype imported is already part of the instance's table
		return Collections.emptyList();
	}

	@Override
	public List<TntDeclaration> visit(TntInstance tntInstance) throws RuntimeException {
		throw new InternalCompilerError("instance " + tntInstance.getName() + " inside a prototype of " + namespace +
				" should have been flattened already");
	}

	@Override
	public List<TntDeclaration> visit(TntModuleDefinition tntModuleDefinition) throws RuntimeException {
		TntModule inner = tntModuleDefinition.getModule();
		LookupTable innerTable = tables.get(inner.getName());
		if (innerTable == null) {
			throw new InternalCompilerError("no lookup table for nested module " + inner.getName());
		}
		NamespaceAddingDeclarationVisitor innerVisitor = new NamespaceAddingDeclarationVisitor(
				LookupTable.qualify(namespace, inner.getName()), tables, innerTable, derivedTable, idGenerator);
		List<TntDeclaration> result = new ArrayList<>();
		for (TntDeclaration declaration : inner.getDeclarations()) {
			result.addAll(declaration.accept(innerVisitor));
		}
		return result;
	}
}
