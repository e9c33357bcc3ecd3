package tntc.formatters;

import tntc.model.tnt.*;

import java.io.IOException;

public class TntExpressionFormattingVisitor extends TntExpressionVisitor<Void, IOException> {
	IndentingWriter out;

	public TntExpressionFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(TntName tntName) throws IOException {
		out.write(tntName.getName());
		return null;
	}

	@Override
	public Void visit(TntBool tntBool) throws IOException {
		out.write(tntBool.getValue() ? "true" : "false");
		return null;
	}

	@Override
	public Void visit(TntInt tntInt) throws IOException {
		out.write(tntInt.getValue().toString());
		return null;
	}

	@Override
	public Void visit(TntStr tntStr) throws IOException {
		out.write("\"");
		out.write(tntStr.getValue().replace("\\", "\\\\").replace("\"", "\\\""));
		out.write("\"");
		return null;
	}

	@Override
	public Void visit(TntApp tntApp) throws IOException {
		out.write(tntApp.getOpcode());
		out.write("(");
		FormattingTools.writeCommaSeparated(out, tntApp.getArgs(), arg -> arg.accept(this));
		out.write(")");
		return null;
	}

	@Override
	public Void visit(TntLambda tntLambda) throws IOException {
		out.write("(");
		FormattingTools.writeCommaSeparated(out, tntLambda.getParams(), param -> out.write(param.getName()));
		out.write(") => ");
		tntLambda.getBody().accept(this);
		return null;
	}

	@Override
	public Void visit(TntLet tntLet) throws IOException {
		tntLet.getDefinition().accept(new TntDeclarationFormattingVisitor(out));
		out.write(" { ");
		tntLet.getBody().accept(this);
		out.write(" }");
		return null;
	}
}
