package tntc.formatters;

import tntc.model.tnt.*;

import java.io.IOException;

public class TntNodeFormattingVisitor extends TntNodeVisitor<Void, IOException> {
	IndentingWriter out;

	public TntNodeFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(TntModule tntModule) throws IOException {
		out.write("module ");
		out.write(tntModule.getName());
		out.write(" {");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (TntDeclaration declaration : tntModule.getDeclarations()) {
				out.newLine();
				declaration.accept(new TntDeclarationFormattingVisitor(out));
			}
		}
		out.newLine();
		out.write("}");
		return null;
	}

	@Override
	public Void visit(TntDeclaration tntDeclaration) throws IOException {
		tntDeclaration.accept(new TntDeclarationFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(TntExpression tntExpression) throws IOException {
		tntExpression.accept(new TntExpressionFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(TntType tntType) throws IOException {
		tntType.accept(new TntTypeFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(TntParameter tntParameter) throws IOException {
		out.write(tntParameter.getName());
		return null;
	}

	@Override
	public Void visit(TntInstance.Override override) throws IOException {
		out.write(override.getName());
		out.write(" = ");
		override.getExpression().accept(new TntExpressionFormattingVisitor(out));
		return null;
	}
}
