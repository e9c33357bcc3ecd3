package tntc.scope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import tntc.trans.intermediate.TntBuiltins;

/**
 * Every defining occurrence of one identifier, in the order they were recorded.
 *
 * An identifier may legitimately carry several value definitions at once: one module-level
 * definition plus any number of definitions scoped to lambdas or lets that shadow it.
 */
public class DefinitionTable {
	private final List<ValueDefinition> valueDefinitions;
	private final List<TypeDefinition> typeDefinitions;

	public DefinitionTable() {
		this.valueDefinitions = new ArrayList<>();
		this.typeDefinitions = new ArrayList<>();
	}

	public DefinitionTable(List<ValueDefinition> valueDefinitions, List<TypeDefinition> typeDefinitions) {
		this.valueDefinitions = new ArrayList<>(valueDefinitions);
		this.typeDefinitions = new ArrayList<>(typeDefinitions);
	}

	public List<ValueDefinition> getValueDefinitions() {
		return Collections.unmodifiableList(valueDefinitions);
	}

	public List<TypeDefinition> getTypeDefinitions() {
		return Collections.unmodifiableList(typeDefinitions);
	}

	public void addValueDefinition(ValueDefinition definition) {
		valueDefinitions.add(definition);
	}

	public void addTypeDefinition(TypeDefinition definition) {
		typeDefinitions.add(definition);
	}

	public boolean isEmpty() {
		return valueDefinitions.isEmpty() && typeDefinitions.isEmpty();
	}

	/**
	 * @return true when no value definition of this identifier is confined to a lambda or let
	 */
	public boolean isModuleLevel() {
		return !isEmpty() && valueDefinitions.stream().noneMatch(ValueDefinition::isScoped);
	}

	/**
	 * @return a table holding only the module-level value definitions and all type definitions
	 */
	public DefinitionTable unscoped() {
		DefinitionTable result = new DefinitionTable();
		for (ValueDefinition definition : valueDefinitions) {
			if (!definition.isScoped()) {
				result.addValueDefinition(definition);
			}
		}
		typeDefinitions.forEach(result::addTypeDefinition);
		return result;
	}

	/**
	 * @return what another module sees of this identifier: module-level value definitions other
	 * than the builtin registry's own entries, and all type definitions
	 */
	public DefinitionTable exported() {
		DefinitionTable result = new DefinitionTable();
		for (ValueDefinition definition : valueDefinitions) {
			if (!definition.isScoped() && !TntBuiltins.isBuiltinDefinition(definition)) {
				result.addValueDefinition(definition);
			}
		}
		typeDefinitions.forEach(result::addTypeDefinition);
		return result;
	}

	public DefinitionTable withPrefix(String prefix) {
		DefinitionTable result = new DefinitionTable();
		for (ValueDefinition definition : valueDefinitions) {
			result.addValueDefinition(definition.withIdentifier(LookupTable.qualify(prefix, definition.getIdentifier())));
		}
		for (TypeDefinition definition : typeDefinitions) {
			result.addTypeDefinition(definition.withIdentifier(LookupTable.qualify(prefix, definition.getIdentifier())));
		}
		return result;
	}

	/**
	 * Picks the definition an occurrence refers to.
	 *
	 * @param enclosingScopes ids of the lambdas and lets around the occurrence, outermost first
	 * @return the definition scoped to the nearest enclosing scope, otherwise the latest
	 * module-level definition
	 */
	public Optional<ValueDefinition> resolveValue(List<Long> enclosingScopes) {
		for (int i = enclosingScopes.size() - 1; i >= 0; i--) {
			Long scope = enclosingScopes.get(i);
			for (int j = valueDefinitions.size() - 1; j >= 0; j--) {
				if (scope.equals(valueDefinitions.get(j).getScope())) {
					return Optional.of(valueDefinitions.get(j));
				}
			}
		}
		for (int j = valueDefinitions.size() - 1; j >= 0; j--) {
			if (!valueDefinitions.get(j).isScoped()) {
				return Optional.of(valueDefinitions.get(j));
			}
		}
		return Optional.empty();
	}

	public Optional<TypeDefinition> resolveType() {
		if (typeDefinitions.isEmpty()) {
			return Optional.empty();
		}
		return Optional.of(typeDefinitions.get(typeDefinitions.size() - 1));
	}

	public DefinitionTable copy() {
		return new DefinitionTable(valueDefinitions, typeDefinitions);
	}

	@Override
	public int hashCode() {
		return Objects.hash(valueDefinitions, typeDefinitions);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		DefinitionTable other = (DefinitionTable) obj;
		return valueDefinitions.equals(other.valueDefinitions) && typeDefinitions.equals(other.typeDefinitions);
	}

	@Override
	public String toString() {
		return "DefinitionTable [valueDefinitions=" + valueDefinitions + ", typeDefinitions=" + typeDefinitions + "]";
	}
}
