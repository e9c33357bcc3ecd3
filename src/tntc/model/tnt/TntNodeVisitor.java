package tntc.model.tnt;

public abstract class TntNodeVisitor<T, E extends Throwable> {
	public abstract T visit(TntModule tntModule) throws E;
	public abstract T visit(TntDeclaration tntDeclaration) throws E;
	public abstract T visit(TntExpression tntExpression) throws E;
	public abstract T visit(TntType tntType) throws E;
	public abstract T visit(TntParameter tntParameter) throws E;
	public abstract T visit(TntInstance.Override override) throws E;
}
