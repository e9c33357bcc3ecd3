package tntc.model.tnt;

import java.util.Objects;

import tntc.util.SourceLocation;

/**
 *
 * A module nested inside another module
 *
 */
public class TntModuleDefinition extends TntDeclaration {

	private final TntModule module;

	public TntModuleDefinition(SourceLocation location, long id, TntModule module) {
		super(location, id);
		this.module = module;
	}

	@Override
	public String getName() {
		return module.getName();
	}

	public TntModule getModule() {
		return module;
	}

	@Override
	public <T, E extends Throwable> T accept(TntDeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(module);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		TntModuleDefinition other = (TntModuleDefinition) obj;
		return Objects.equals(module, other.module);
	}

}
