package tntc.errors;

import tntc.trans.passes.imports.DefinitionNotFoundIssue;
import tntc.trans.passes.imports.ModuleNotFoundIssue;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(IssueWithContext issueWithContext) throws E;
	public abstract T visit(ModuleNotFoundIssue moduleNotFoundIssue) throws E;
	public abstract T visit(DefinitionNotFoundIssue definitionNotFoundIssue) throws E;
}
