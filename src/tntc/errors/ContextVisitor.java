package tntc.errors;

import tntc.trans.intermediate.WhileResolvingModule;

public abstract class ContextVisitor<T, E extends Throwable> {

	public abstract T visit(WhileResolvingModule whileResolvingModule) throws E;

}
