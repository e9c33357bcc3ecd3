package tntc.formatters;

import tntc.errors.IssueVisitor;
import tntc.errors.IssueWithContext;
import tntc.trans.passes.imports.DefinitionNotFoundIssue;
import tntc.trans.passes.imports.ModuleNotFoundIssue;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(IssueWithContext issueWithContext) throws IOException {
		issueWithContext.getContext().accept(new ContextFormattingVisitor(out));
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			issueWithContext.getIssue().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(ModuleNotFoundIssue moduleNotFoundIssue) throws IOException {
		out.write("could not find module ");
		out.write(moduleNotFoundIssue.getModuleName());
		out.write(" ");
		moduleNotFoundIssue.getLocation().writePretty(out);
		return null;
	}

	@Override
	public Void visit(DefinitionNotFoundIssue definitionNotFoundIssue) throws IOException {
		out.write("could not find definition ");
		out.write(definitionNotFoundIssue.getDefinitionName());
		out.write(" in module ");
		out.write(definitionNotFoundIssue.getModuleName());
		out.write(" ");
		definitionNotFoundIssue.getLocation().writePretty(out);
		return null;
	}
}
