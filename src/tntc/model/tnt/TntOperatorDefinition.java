package tntc.model.tnt;

import java.util.Objects;

import tntc.util.SourceLocation;

/**
 *
 * TNT AST Node representing a defined operator.
 *
 * pure val x: int = ...
 * def f(a, b) = ...
 *
 * Parameters of operators are carried by a lambda body. The type annotation is optional.
 *
 */
public class TntOperatorDefinition extends TntDeclaration {

	public enum Qualifier {
		PUREVAL("pure val"),
		PUREDEF("pure def"),
		VAL("val"),
		DEF("def"),
		NONDET("nondet"),
		ACTION("action"),
		TEMPORAL("temporal"),
		RUN("run");

		private final String keyword;

		Qualifier(String keyword) {
			this.keyword = keyword;
		}

		public String getKeyword() {
			return keyword;
		}
	}

	private final String name;
	private final Qualifier qualifier;
	private final TntExpression body;
	private final TntType typeAnnotation;

	public TntOperatorDefinition(SourceLocation location, long id, String name, Qualifier qualifier,
	                             TntExpression body, TntType typeAnnotation) {
		super(location, id);
		this.name = name;
		this.qualifier = qualifier;
		this.body = body;
		this.typeAnnotation = typeAnnotation;
	}

	@Override
	public String getName() {
		return name;
	}

	public Qualifier getQualifier() {
		return qualifier;
	}

	public TntExpression getBody() {
		return body;
	}

	/**
	 * @return the declared type, or null when the definition is not annotated
	 */
	public TntType getTypeAnnotation() {
		return typeAnnotation;
	}

	@Override
	public <T, E extends Throwable> T accept(TntDeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((body == null) ? 0 : body.hashCode());
		result = prime * result + ((name == null) ? 0 : name.hashCode());
		result = prime * result + ((qualifier == null) ? 0 : qualifier.hashCode());
		result = prime * result + ((typeAnnotation == null) ? 0 : typeAnnotation.hashCode());
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		TntOperatorDefinition other = (TntOperatorDefinition) obj;
		return Objects.equals(name, other.name) && qualifier == other.qualifier &&
				Objects.equals(body, other.body) && Objects.equals(typeAnnotation, other.typeAnnotation);
	}

}
