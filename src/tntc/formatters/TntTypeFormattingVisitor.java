package tntc.formatters;

import tntc.model.tnt.*;

import java.io.IOException;

public class TntTypeFormattingVisitor extends TntTypeVisitor<Void, IOException> {
	IndentingWriter out;

	public TntTypeFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void writeRow(Row row) throws IOException {
		FormattingTools.writeCommaSeparated(out, row.getFields(), field -> {
			out.write(field.getFieldName());
			out.write(": ");
			field.getFieldType().accept(this);
		});
		if (!row.isClosed()) {
			out.write(" | ");
			out.write(row.getOther());
		}
	}

	@Override
	public Void visit(TntPrimitiveType tntPrimitiveType) throws IOException {
		out.write(tntPrimitiveType.getKind().getKeyword());
		return null;
	}

	@Override
	public Void visit(TntTypeVariable tntTypeVariable) throws IOException {
		out.write(tntTypeVariable.getName());
		return null;
	}

	@Override
	public Void visit(TntConstType tntConstType) throws IOException {
		out.write(tntConstType.getName());
		return null;
	}

	@Override
	public Void visit(TntSetType tntSetType) throws IOException {
		out.write("Set[");
		tntSetType.getElementType().accept(this);
		out.write("]");
		return null;
	}

	@Override
	public Void visit(TntListType tntListType) throws IOException {
		out.write("List[");
		tntListType.getElementType().accept(this);
		out.write("]");
		return null;
	}

	@Override
	public Void visit(TntFunctionType tntFunctionType) throws IOException {
		out.write("(");
		tntFunctionType.getArgument().accept(this);
		out.write(" -> ");
		tntFunctionType.getResult().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(TntOperatorType tntOperatorType) throws IOException {
		out.write("(");
		FormattingTools.writeCommaSeparated(out, tntOperatorType.getArguments(), arg -> arg.accept(this));
		out.write(") => ");
		tntOperatorType.getResult().accept(this);
		return null;
	}

	@Override
	public Void visit(TntTupleType tntTupleType) throws IOException {
		out.write("(");
		FormattingTools.writeCommaSeparated(out, tntTupleType.getFields().getFields(), field ->
				field.getFieldType().accept(this));
		out.write(")");
		return null;
	}

	@Override
	public Void visit(TntRecordType tntRecordType) throws IOException {
		out.write("{ ");
		writeRow(tntRecordType.getFields());
		out.write(" }");
		return null;
	}

	@Override
	public Void visit(TntUnionType tntUnionType) throws IOException {
		FormattingTools.writeSeparated(out, " ", tntUnionType.getRecords(), record -> {
			out.write("| { ");
			out.write(tntUnionType.getTag());
			out.write(": \"");
			out.write(record.getTagValue());
			out.write("\"");
			if (!record.getFields().getFields().isEmpty()) {
				out.write(", ");
				writeRow(record.getFields());
			}
			out.write(" }");
		});
		return null;
	}
}
