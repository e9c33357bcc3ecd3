package tntc.model.tnt;

public abstract class TntExpressionVisitor<T, E extends Throwable> {
	public abstract T visit(TntName tntName) throws E;
	public abstract T visit(TntBool tntBool) throws E;
	public abstract T visit(TntInt tntInt) throws E;
	public abstract T visit(TntStr tntStr) throws E;
	public abstract T visit(TntApp tntApp) throws E;
	public abstract T visit(TntLambda tntLambda) throws E;
	public abstract T visit(TntLet tntLet) throws E;
}
