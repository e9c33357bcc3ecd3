package tntc.trans.intermediate;

import tntc.errors.Context;
import tntc.errors.ContextVisitor;

public class WhileResolvingModule extends Context {

	private final String moduleName;

	public WhileResolvingModule(String moduleName) {
		this.moduleName = moduleName;
	}

	public String getModuleName() {
		return moduleName;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
