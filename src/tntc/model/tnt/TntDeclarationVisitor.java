package tntc.model.tnt;

public abstract class TntDeclarationVisitor<T, E extends Throwable> {
	public abstract T visit(TntConstant tntConstant) throws E;
	public abstract T visit(TntVariable tntVariable) throws E;
	public abstract T visit(TntOperatorDefinition tntOperatorDefinition) throws E;
	public abstract T visit(TntTypeDefinition tntTypeDefinition) throws E;
	public abstract T visit(TntAssumption tntAssumption) throws E;
	public abstract T visit(TntImport tntImport) throws E;
	public abstract T visit(TntInstance tntInstance) throws E;
	public abstract T visit(TntModuleDefinition tntModuleDefinition) throws E;
}
