package tntc.trans.passes.alias;

import tntc.InternalCompilerError;
import tntc.model.tnt.*;
import tntc.scope.LookupTable;
import tntc.scope.TypeDefinition;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Rebuilds a type with every alias reference replaced by the type the alias stands for,
 * following chains of aliases to their end. Uninterpreted types and names the table does not
 * know are kept. Node ids are preserved.
 */
public class AliasInliningTypeVisitor extends TntTypeVisitor<TntType, RuntimeException> {

	private final LookupTable table;
	// aliases being expanded, innermost on top
	private final Deque<String> expanding;

	public AliasInliningTypeVisitor(LookupTable table) {
		this.table = table;
		this.expanding = new ArrayDeque<>();
	}

	private Row inlineRow(Row row) {
		List<Row.Field> fields = row.getFields().stream()
				.map(f -> new Row.Field(f.getFieldName(), f.getFieldType().accept(this)))
				.collect(Collectors.toList());
		return new Row(fields, row.getOther());
	}

	@Override
	public TntType visit(TntPrimitiveType tntPrimitiveType) throws RuntimeException {
		return tntPrimitiveType;
	}

	@Override
	public TntType visit(TntTypeVariable tntTypeVariable) throws RuntimeException {
		return tntTypeVariable;
	}

	@Override
	public TntType visit(TntConstType tntConstType) throws RuntimeException {
		Optional<TypeDefinition> alias = table.resolveType(tntConstType.getName());
		if (!alias.isPresent() || alias.get().isUninterpreted()) {
			return tntConstType;
		}
		if (expanding.contains(tntConstType.getName())) {
			throw new InternalCompilerError("type alias " + tntConstType.getName() + " is defined in terms of itself");
		}
		expanding.push(tntConstType.getName());
		TntType result = alias.get().getType().accept(this);
		expanding.pop();
		return result;
	}

	@Override
	public TntType visit(TntSetType tntSetType) throws RuntimeException {
		return new TntSetType(tntSetType.getLocation(), tntSetType.getId(), tntSetType.getElementType().accept(this));
	}

	@Override
	public TntType visit(TntListType tntListType) throws RuntimeException {
		return new TntListType(tntListType.getLocation(), tntListType.getId(), tntListType.getElementType().accept(this));
	}

	@Override
	public TntType visit(TntFunctionType tntFunctionType) throws RuntimeException {
		return new TntFunctionType(tntFunctionType.getLocation(), tntFunctionType.getId(),
				tntFunctionType.getArgument().accept(this), tntFunctionType.getResult().accept(this));
	}

	@Override
	public TntType visit(TntOperatorType tntOperatorType) throws RuntimeException {
		return new TntOperatorType(tntOperatorType.getLocation(), tntOperatorType.getId(),
				tntOperatorType.getArguments().stream().map(a -> a.accept(this)).collect(Collectors.toList()),
				tntOperatorType.getResult().accept(this));
	}

	@Override
	public TntType visit(TntTupleType tntTupleType) throws RuntimeException {
		return new TntTupleType(tntTupleType.getLocation(), tntTupleType.getId(), inlineRow(tntTupleType.getFields()));
	}

	@Override
	public TntType visit(TntRecordType tntRecordType) throws RuntimeException {
		return new TntRecordType(tntRecordType.getLocation(), tntRecordType.getId(), inlineRow(tntRecordType.getFields()));
	}

	@Override
	public TntType visit(TntUnionType tntUnionType) throws RuntimeException {
		return new TntUnionType(tntUnionType.getLocation(), tntUnionType.getId(), tntUnionType.getTag(),
				tntUnionType.getRecords().stream()
						.map(r -> new TntUnionType.Record(r.getTagValue(), inlineRow(r.getFields())))
						.collect(Collectors.toList()));
	}
}
