package tntc.trans.passes.alias;

import tntc.model.tnt.*;

import java.util.stream.Collectors;

/**
 * Expressions only carry types through the operators bound by let, so those are the only
 * nodes rebuilt here. Ids are kept.
 */
public class AliasInliningExpressionVisitor extends TntExpressionVisitor<TntExpression, RuntimeException> {

	private final AliasInliningDeclarationVisitor declarations;

	public AliasInliningExpressionVisitor(AliasInliningDeclarationVisitor declarations) {
		this.declarations = declarations;
	}

	@Override
	public TntExpression visit(TntName tntName) throws RuntimeException {
		return tntName;
	}

	@Override
	public TntExpression visit(TntBool tntBool) throws RuntimeException {
		return tntBool;
	}

	@Override
	public TntExpression visit(TntInt tntInt) throws RuntimeException {
		return tntInt;
	}

	@Override
	public TntExpression visit(TntStr tntStr) throws RuntimeException {
		return tntStr;
	}

	@Override
	public TntExpression visit(TntApp tntApp) throws RuntimeException {
		return new TntApp(tntApp.getLocation(), tntApp.getId(), tntApp.getOpcode(),
				tntApp.getArgs().stream().map(a -> a.accept(this)).collect(Collectors.toList()));
	}

	@Override
	public TntExpression visit(TntLambda tntLambda) throws RuntimeException {
		return new TntLambda(tntLambda.getLocation(), tntLambda.getId(), tntLambda.getParams(),
				tntLambda.getQualifier(), tntLambda.getBody().accept(this));
	}

	@Override
	public TntExpression visit(TntLet tntLet) throws RuntimeException {
		TntOperatorDefinition definition = (TntOperatorDefinition) tntLet.getDefinition().accept(declarations);
		return new TntLet(tntLet.getLocation(), tntLet.getId(), definition, tntLet.getBody().accept(this));
	}
}
