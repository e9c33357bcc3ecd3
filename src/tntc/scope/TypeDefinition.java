package tntc.scope;

import java.util.Objects;

import tntc.model.tnt.TntType;

/**
 * A defining occurrence of a name in the type namespace. An uninterpreted type has no type.
 */
public class TypeDefinition {
	private final String identifier;
	private final TntType type;
	private final Long reference;

	public TypeDefinition(String identifier, TntType type, Long reference) {
		this.identifier = identifier;
		this.type = type;
		this.reference = reference;
	}

	public String getIdentifier() {
		return identifier;
	}

	public TntType getType() {
		return type;
	}

	public Long getReference() {
		return reference;
	}

	public boolean isUninterpreted() {
		return type == null;
	}

	public TypeDefinition withIdentifier(String newIdentifier) {
		return new TypeDefinition(newIdentifier, type, reference);
	}

	public TypeDefinition withType(TntType newType) {
		return new TypeDefinition(identifier, newType, reference);
	}

	@Override
	public int hashCode() {
		return Objects.hash(identifier, type, reference);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		TypeDefinition other = (TypeDefinition) obj;
		return Objects.equals(identifier, other.identifier) && Objects.equals(type, other.type) &&
				Objects.equals(reference, other.reference);
	}

	@Override
	public String toString() {
		return "TypeDefinition [identifier=" + identifier + ", type=" + type + ", reference=" + reference + "]";
	}
}
