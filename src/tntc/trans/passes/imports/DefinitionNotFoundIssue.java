package tntc.trans.passes.imports;

import tntc.errors.Issue;
import tntc.errors.IssueVisitor;
import tntc.util.SourceLocation;

/**
 * A named import, nested module import or instance override names something the target
 * module does not define.
 */
public class DefinitionNotFoundIssue extends Issue {

	private final String definitionName;
	private final String moduleName;
	private final SourceLocation location;

	public DefinitionNotFoundIssue(String definitionName, String moduleName, SourceLocation location) {
		super();
		this.definitionName = definitionName;
		this.moduleName = moduleName;
		this.location = location;
	}

	public String getDefinitionName() {
		return definitionName;
	}

	/**
	 * @return the module the definition was looked up in
	 */
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
