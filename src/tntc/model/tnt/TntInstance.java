package tntc.model.tnt;

import java.util.List;
import java.util.Objects;

import tntc.util.SourceLocation;

/**
 *
 * TNT AST Node:
 *
 * module N = M(p1 = <expr>, p2 = <expr>)
 *
 */
public class TntInstance extends TntDeclaration {
	private final String name;
	private final String protoName;
	private final List<Override> overrides;

	public TntInstance(SourceLocation location, long id, String name, String protoName, List<Override> overrides) {
		super(location, id);
		this.name = name;
		this.protoName = protoName;
		this.overrides = overrides;
	}

	/**
	 * One parameter binding of an instance, p = <expr>
	 */
	public static class Override extends TntNode {
		private final String name;
		private final TntExpression expression;

		public Override(SourceLocation location, long id, String name, TntExpression expression) {
			super(location, id);
			this.name = name;
			this.expression = expression;
		}

		public String getName() {
			return name;
		}

		public TntExpression getExpression() {
			return expression;
		}

		@java.lang.Override
		public <T, E extends Throwable> T accept(TntNodeVisitor<T, E> v) throws E {
			return v.visit(this);
		}

		@java.lang.Override
		public int hashCode() {
			return Objects.hash(name, expression);
		}

		@java.lang.Override
		public boolean equals(Object obj) {
			if (this == obj)
				return true;
			if (obj == null)
				return false;
			if (getClass() != obj.getClass())
				return false;
			Override other = (Override) obj;
			return Objects.equals(name, other.name) && Objects.equals(expression, other.expression);
		}
	}

	@java.lang.Override
	public String getName() {
		return name;
	}

	public String getProtoName() {
		return protoName;
	}

	public List<Override> getOverrides() {
		return overrides;
	}

	@java.lang.Override
	public <T, E extends Throwable> T accept(TntDeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@java.lang.Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((name == null) ? 0 : name.hashCode());
		result = prime * result + ((protoName == null) ? 0 : protoName.hashCode());
		result = prime * result + ((overrides == null) ? 0 : overrides.hashCode());
		return result;
	}

	@java.lang.Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		TntInstance other = (TntInstance) obj;
		if (name == null) {
			if (other.name != null)
				return false;
		} else if (!name.equals(other.name))
			return false;
		if (protoName == null) {
			if (other.protoName != null)
				return false;
		} else if (!protoName.equals(other.protoName))
			return false;
		if (overrides == null) {
			return other.overrides == null;
		} else return overrides.equals(other.overrides);
	}

}
