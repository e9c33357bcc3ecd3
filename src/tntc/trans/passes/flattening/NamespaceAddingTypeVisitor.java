package tntc.trans.passes.flattening;

import tntc.model.tnt.*;
import tntc.scope.LookupTable;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Copies a type with fresh ids, qualifying every type alias reference with the instance
 * namespace. Primitive types and type variables keep their names.
 */
public class NamespaceAddingTypeVisitor extends TntTypeVisitor<TntType, RuntimeException> {

	private final String namespace;
	private final IdGenerator idGenerator;

	public NamespaceAddingTypeVisitor(String namespace, IdGenerator idGenerator) {
		this.namespace = namespace;
		this.idGenerator = idGenerator;
	}

	private Row namespaceRow(Row row) {
		List<Row.Field> fields = row.getFields().stream()
				.map(f -> new Row.Field(f.getFieldName(), f.getFieldType().accept(this)))
				.collect(Collectors.toList());
		return new Row(fields, row.getOther());
	}

	@Override
	public TntType visit(TntPrimitiveType tntPrimitiveType) throws RuntimeException {
		return new TntPrimitiveType(tntPrimitiveType.getLocation(), idGenerator.nextId(), tntPrimitiveType.getKind());
	}

	@Override
	public TntType visit(TntTypeVariable tntTypeVariable) throws RuntimeException {
		return new TntTypeVariable(tntTypeVariable.getLocation(), idGenerator.nextId(), tntTypeVariable.getName());
	}

	@Override
	public TntType visit(TntConstType tntConstType) throws RuntimeException {
		return new TntConstType(tntConstType.getLocation(), idGenerator.nextId(),
				LookupTable.qualify(namespace, tntConstType.getName()));
	}

	@Override
	public TntType visit(TntSetType tntSetType) throws RuntimeException {
		return new TntSetType(tntSetType.getLocation(), idGenerator.nextId(), tntSetType.getElementType().accept(this));
	}

	@Override
	public TntType visit(TntListType tntListType) throws RuntimeException {
		return new TntListType(tntListType.getLocation(), idGenerator.nextId(), tntListType.getElementType().accept(this));
	}

	@Override
	public TntType visit(TntFunctionType tntFunctionType) throws RuntimeException {
		return new TntFunctionType(tntFunctionType.getLocation(), idGenerator.nextId(),
				tntFunctionType.getArgument().accept(this), tntFunctionType.getResult().accept(this));
	}

	@Override
	public TntType visit(TntOperatorType tntOperatorType) throws RuntimeException {
		return new TntOperatorType(tntOperatorType.getLocation(), idGenerator.nextId(),
				tntOperatorType.getArguments().stream().map(a -> a.accept(this)).collect(Collectors.toList()),
				tntOperatorType.getResult().accept(this));
	}

	@Override
	public TntType visit(TntTupleType tntTupleType) throws RuntimeException {
		return new TntTupleType(tntTupleType.getLocation(), idGenerator.nextId(), namespaceRow(tntTupleType.getFields()));
	}

	@Override
	public TntType visit(TntRecordType tntRecordType) throws RuntimeException {
		return new TntRecordType(tntRecordType.getLocation(), idGenerator.nextId(), namespaceRow(tntRecordType.getFields()));
	}

	@Override
	public TntType visit(TntUnionType tntUnionType) throws RuntimeException {
		return new TntUnionType(tntUnionType.getLocation(), idGenerator.nextId(), tntUnionType.getTag(),
				tntUnionType.getRecords().stream()
						.map(r -> new TntUnionType.Record(r.getTagValue(), namespaceRow(r.getFields())))
						.collect(Collectors.toList()));
	}
}
