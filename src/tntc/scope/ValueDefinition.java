package tntc.scope;

import java.util.Objects;

/**
 * A defining occurrence of a name in the value namespace.
 *
 * The reference is the id of the node that introduced the name. The scope, when present,
 * is the id of the innermost lambda or let outside of which the name is not visible.
 * Builtins have neither.
 */
public class ValueDefinition {
	private final DefinitionKind kind;
	private final String identifier;
	private final Long reference;
	private final Long scope;

	public ValueDefinition(DefinitionKind kind, String identifier, Long reference, Long scope) {
		this.kind = kind;
		this.identifier = identifier;
		this.reference = reference;
		this.scope = scope;
	}

	public ValueDefinition(DefinitionKind kind, String identifier, Long reference) {
		this(kind, identifier, reference, null);
	}

	public DefinitionKind getKind() {
		return kind;
	}

	public String getIdentifier() {
		return identifier;
	}

	public Long getReference() {
		return reference;
	}

	public Long getScope() {
		return scope;
	}

	public boolean isScoped() {
		return scope != null;
	}

	public ValueDefinition withIdentifier(String newIdentifier) {
		return new ValueDefinition(kind, newIdentifier, reference, scope);
	}

	public ValueDefinition withReference(Long newReference) {
		return new ValueDefinition(kind, identifier, newReference, scope);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, identifier, reference, scope);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ValueDefinition other = (ValueDefinition) obj;
		return kind == other.kind && Objects.equals(identifier, other.identifier) &&
				Objects.equals(reference, other.reference) && Objects.equals(scope, other.scope);
	}

	@Override
	public String toString() {
		return "ValueDefinition [kind=" + kind.getName() + ", identifier=" + identifier + ", reference=" + reference +
				", scope=" + scope + "]";
	}
}
