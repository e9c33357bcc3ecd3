package tntc.trans.passes.imports;

import tntc.InternalCompilerError;
import tntc.errors.Issue;
import tntc.scope.LookupTableByModule;

import java.util.Collections;
import java.util.List;

/**
 * Either the resolved tables, or every issue found while resolving. Never both.
 */
public class ImportResolutionResult {
	private final LookupTableByModule tables;
	private final List<Issue> issues;

	private ImportResolutionResult(LookupTableByModule tables, List<Issue> issues) {
		this.tables = tables;
		this.issues = issues;
	}

	public static ImportResolutionResult ok(LookupTableByModule tables) {
		return new ImportResolutionResult(tables, Collections.emptyList());
	}

	public static ImportResolutionResult error(List<Issue> issues) {
		if (issues.isEmpty()) {
			throw new InternalCompilerError("failed import resolution without issues");
		}
		return new ImportResolutionResult(null, Collections.unmodifiableList(issues));
	}

	public boolean isOk() {
		return tables != null;
	}

	public LookupTableByModule getTables() {
		if (!isOk()) {
			throw new InternalCompilerError("tables of a failed import resolution were requested");
		}
		return tables;
	}

	public List<Issue> getIssues() {
		return issues;
	}
}
