package tntc.trans.passes.imports;

import tntc.errors.Issue;
import tntc.errors.IssueVisitor;
import tntc.util.SourceLocation;

/**
 * An import or instance names a module no lookup table exists for.
 */
public class ModuleNotFoundIssue extends Issue {

	private final String moduleName;
	private final SourceLocation location;

	public ModuleNotFoundIssue(String moduleName, SourceLocation location) {
		super();
		this.moduleName = moduleName;
		this.location = location;
	}

	public String getModuleName() {
		return moduleName;
	}

	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
