package tntc.trans.passes.collect;

import tntc.model.tnt.*;
import tntc.scope.DefinitionKind;

public class DefinitionCollectionExpressionVisitor extends TntExpressionVisitor<Void, RuntimeException> {

	private final DefinitionCollectionVisitor declarations;

	public DefinitionCollectionExpressionVisitor(DefinitionCollectionVisitor declarations) {
		this.declarations = declarations;
	}

	@Override
	public Void visit(TntName tntName) throws RuntimeException {
		return null;
	}

	@Override
	public Void visit(TntBool tntBool) throws RuntimeException {
		return null;
	}

	@Override
	public Void visit(TntInt tntInt) throws RuntimeException {
		return null;
	}

	@Override
	public Void visit(TntStr tntStr) throws RuntimeException {
		return null;
	}

	@Override
	public Void visit(TntApp tntApp) throws RuntimeException {
		for (TntExpression arg : tntApp.getArgs()) {
			arg.accept(this);
		}
		return null;
	}

	@Override
	public Void visit(TntLambda tntLambda) throws RuntimeException {
		for (TntParameter param : tntLambda.getParams()) {
			declarations.define(DefinitionKind.PARAM, param.getName(), param.getId(), tntLambda.getId());
		}
		declarations.getScopes().push(tntLambda.getId());
		tntLambda.getBody().accept(this);
		declarations.getScopes().pop();
		return null;
	}

	@Override
	public Void visit(TntLet tntLet) throws RuntimeException {
		declarations.getScopes().push(tntLet.getId());
		tntLet.getDefinition().accept(declarations);
		tntLet.getBody().accept(this);
		declarations.getScopes().pop();
		return null;
	}
}
