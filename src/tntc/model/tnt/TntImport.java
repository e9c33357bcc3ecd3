package tntc.model.tnt;

import java.util.Objects;

import tntc.util.SourceLocation;

/**
 *
 * TNT AST Node:
 *
 * import M.x
 * import M.*
 * import M.Inner
 *
 */
public class TntImport extends TntDeclaration {

	public static final String WILDCARD = "*";

	private final String moduleName;
	private final String definitionName;

	public TntImport(SourceLocation location, long id, String moduleName, String definitionName) {
		super(location, id);
		this.moduleName = moduleName;
		this.definitionName = definitionName;
	}

	@Override
	public String getName() {
		return moduleName;
	}

	public String getModuleName() {
		return moduleName;
	}

	public String getDefinitionName() {
		return definitionName;
	}

	public boolean isWildcard() {
		return WILDCARD.equals(definitionName);
	}

	@Override
	public <T, E extends Throwable> T accept(TntDeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(moduleName, definitionName);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		TntImport other = (TntImport) obj;
		return Objects.equals(moduleName, other.moduleName) && Objects.equals(definitionName, other.definitionName);
	}

}
