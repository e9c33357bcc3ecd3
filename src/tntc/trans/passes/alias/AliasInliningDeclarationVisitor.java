package tntc.trans.passes.alias;

import tntc.InternalCompilerError;
import tntc.model.tnt.*;
import tntc.scope.LookupTable;
import tntc.scope.LookupTableByModule;

import java.util.stream.Collectors;

public class AliasInliningDeclarationVisitor extends TntDeclarationVisitor<TntDeclaration, RuntimeException> {

	// tables of nested modules, whose declarations resolve aliases against their own table
	private final LookupTableByModule moduleTables;
	private final AliasInliningTypeVisitor typeVisitor;
	private final AliasInliningExpressionVisitor expressionVisitor;

	public AliasInliningDeclarationVisitor(LookupTable table) {
		this(table, new LookupTableByModule());
	}

	public AliasInliningDeclarationVisitor(LookupTable table, LookupTableByModule moduleTables) {
		this.moduleTables = moduleTables;
		this.typeVisitor = new AliasInliningTypeVisitor(table);
		this.expressionVisitor = new AliasInliningExpressionVisitor(this);
	}

	private TntType inline(TntType type) {
		return type == null ? null : type.accept(typeVisitor);
	}

	@Override
	public TntDeclaration visit(TntConstant tntConstant) throws RuntimeException {
		return new TntConstant(tntConstant.getLocation(), tntConstant.getId(), tntConstant.getName(),
				inline(tntConstant.getType()));
	}

	@Override
	public TntDeclaration visit(TntVariable tntVariable) throws RuntimeException {
		return new TntVariable(tntVariable.getLocation(), tntVariable.getId(), tntVariable.getName(),
				inline(tntVariable.getType()));
	}

	@Override
	public TntDeclaration visit(TntOperatorDefinition tntOperatorDefinition) throws RuntimeException {
		return new TntOperatorDefinition(tntOperatorDefinition.getLocation(), tntOperatorDefinition.getId(),
				tntOperatorDefinition.getName(), tntOperatorDefinition.getQualifier(),
				tntOperatorDefinition.getBody().accept(expressionVisitor),
				inline(tntOperatorDefinition.getTypeAnnotation()));
	}

	@Override
	public TntDeclaration visit(TntTypeDefinition tntTypeDefinition) throws RuntimeException {
		return new TntTypeDefinition(tntTypeDefinition.getLocation(), tntTypeDefinition.getId(),
				tntTypeDefinition.getName(), inline(tntTypeDefinition.getType()));
	}

	@Override
	public TntDeclaration visit(TntAssumption tntAssumption) throws RuntimeException {
		return new TntAssumption(tntAssumption.getLocation(), tntAssumption.getId(), tntAssumption.getName(),
				tntAssumption.getAssumption().accept(expressionVisitor));
	}

	@Override
	public TntDeclaration visit(TntImport tntImport) throws RuntimeException {
		return tntImport;
	}

	@Override
	public TntDeclaration visit(TntInstance tntInstance) throws RuntimeException {
		return new TntInstance(tntInstance.getLocation(), tntInstance.getId(), tntInstance.getName(),
				tntInstance.getProtoName(),
				tntInstance.getOverrides().stream()
						.map(o -> new TntInstance.Override(o.getLocation(), o.getId(), o.getName(),
								o.getExpression().accept(expressionVisitor)))
						.collect(Collectors.toList()));
	}

	@Override
	public TntDeclaration visit(TntModuleDefinition tntModuleDefinition) throws RuntimeException {
		TntModule inner = tntModuleDefinition.getModule();
		LookupTable innerTable = moduleTables.get(inner.getName());
		if (innerTable == null) {
			throw new InternalCompilerError("no lookup table for nested module " + inner.getName());
		}
		AliasInliningDeclarationVisitor innerVisitor = new AliasInliningDeclarationVisitor(innerTable, moduleTables);
		return new TntModuleDefinition(tntModuleDefinition.getLocation(), tntModuleDefinition.getId(),
				inner.withDeclarations(inner.getDeclarations().stream()
						.map(d -> d.accept(innerVisitor))
						.collect(Collectors.toList())));
	}
}
