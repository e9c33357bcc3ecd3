package tntc.model.tnt;

public abstract class TntTypeVisitor<T, E extends Throwable> {
	public abstract T visit(TntPrimitiveType tntPrimitiveType) throws E;
	public abstract T visit(TntTypeVariable tntTypeVariable) throws E;
	public abstract T visit(TntConstType tntConstType) throws E;
	public abstract T visit(TntSetType tntSetType) throws E;
	public abstract T visit(TntListType tntListType) throws E;
	public abstract T visit(TntFunctionType tntFunctionType) throws E;
	public abstract T visit(TntOperatorType tntOperatorType) throws E;
	public abstract T visit(TntTupleType tntTupleType) throws E;
	public abstract T visit(TntRecordType tntRecordType) throws E;
	public abstract T visit(TntUnionType tntUnionType) throws E;
}
