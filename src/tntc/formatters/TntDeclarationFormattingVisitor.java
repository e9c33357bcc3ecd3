package tntc.formatters;

import java.io.IOException;

import tntc.model.tnt.*;

public class TntDeclarationFormattingVisitor extends TntDeclarationVisitor<Void, IOException> {

	IndentingWriter out;

	public TntDeclarationFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void writeAnnotation(TntType type) throws IOException {
		if (type != null) {
			out.write(": ");
			type.accept(new TntTypeFormattingVisitor(out));
		}
	}

	@Override
	public Void visit(TntConstant tntConstant) throws IOException {
		out.write("const ");
		out.write(tntConstant.getName());
		writeAnnotation(tntConstant.getType());
		return null;
	}

	@Override
	public Void visit(TntVariable tntVariable) throws IOException {
		out.write("var ");
		out.write(tntVariable.getName());
		writeAnnotation(tntVariable.getType());
		return null;
	}

	@Override
	public Void visit(TntOperatorDefinition tntOperatorDefinition) throws IOException {
		out.write(tntOperatorDefinition.getQualifier().getKeyword());
		out.write(" ");
		out.write(tntOperatorDefinition.getName());
		writeAnnotation(tntOperatorDefinition.getTypeAnnotation());
		out.write(" = ");
		tntOperatorDefinition.getBody().accept(new TntExpressionFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(TntTypeDefinition tntTypeDefinition) throws IOException {
		out.write("type ");
		out.write(tntTypeDefinition.getName());
		if (!tntTypeDefinition.isUninterpreted()) {
			out.write(" = ");
			tntTypeDefinition.getType().accept(new TntTypeFormattingVisitor(out));
		}
		return null;
	}

	@Override
	public Void visit(TntAssumption tntAssumption) throws IOException {
		out.write("assume ");
		out.write(tntAssumption.getName());
		out.write(" = ");
		tntAssumption.getAssumption().accept(new TntExpressionFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(TntImport tntImport) throws IOException {
		out.write("import ");
		out.write(tntImport.getModuleName());
		out.write(".");
		out.write(tntImport.getDefinitionName());
		return null;
	}

	@Override
	public Void visit(TntInstance tntInstance) throws IOException {
		out.write("module ");
		out.write(tntInstance.getName());
		out.write(" = ");
		out.write(tntInstance.getProtoName());
		out.write("(");
		FormattingTools.writeCommaSeparated(out, tntInstance.getOverrides(), override ->
				override.accept(new TntNodeFormattingVisitor(out)));
		out.write(")");
		return null;
	}

	@Override
	public Void visit(TntModuleDefinition tntModuleDefinition) throws IOException {
		tntModuleDefinition.getModule().accept(new TntNodeFormattingVisitor(out));
		return null;
	}
}
