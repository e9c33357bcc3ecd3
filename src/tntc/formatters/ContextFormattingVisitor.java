package tntc.formatters;

import tntc.errors.ContextVisitor;
import tntc.trans.intermediate.WhileResolvingModule;

import java.io.IOException;

public class ContextFormattingVisitor extends ContextVisitor<Void, IOException> {

	private IndentingWriter out;

	public ContextFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(WhileResolvingModule whileResolvingModule) throws IOException {
		out.write("while resolving names of module ");
		out.write(whileResolvingModule.getModuleName());
		return null;
	}

}
