package tntc.scope;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import tntc.trans.intermediate.TntBuiltins;

/**
 * Maps every identifier visible in one module to its definitions. Iteration follows
 * insertion order, so tables built from the same tree always list names the same way.
 */
public class LookupTable {
	public static final String NAMESPACE_SEPARATOR = "::";

	private final Map<String, DefinitionTable> entries;

	public LookupTable() {
		this.entries = new LinkedHashMap<>();
	}

	private LookupTable(Map<String, DefinitionTable> entries) {
		this.entries = entries;
	}

	/**
	 * @return a fresh table holding exactly the builtin definitions
	 */
	public static LookupTable withBuiltins() {
		LookupTable table = new LookupTable();
		for (ValueDefinition definition : TntBuiltins.getDefinitions()) {
			table.addValueDefinition(definition);
		}
		return table;
	}

	public static String qualify(String prefix, String name) {
		return prefix + NAMESPACE_SEPARATOR + name;
	}

	public DefinitionTable get(String identifier) {
		return entries.get(identifier);
	}

	public boolean containsKey(String identifier) {
		return entries.containsKey(identifier);
	}

	/**
	 * Replaces whatever was known about identifier.
	 */
	public void put(String identifier, DefinitionTable definitions) {
		entries.put(identifier, definitions.copy());
	}

	public void addValueDefinition(ValueDefinition definition) {
		entries.computeIfAbsent(definition.getIdentifier(), k -> new DefinitionTable()).addValueDefinition(definition);
	}

	public void addTypeDefinition(TypeDefinition definition) {
		entries.computeIfAbsent(definition.getIdentifier(), k -> new DefinitionTable()).addTypeDefinition(definition);
	}

	/**
	 * Replaces the module-level value definitions of the identifier, keeping its scoped and
	 * type definitions.
	 */
	public void redefineValue(ValueDefinition definition) {
		DefinitionTable current = entries.get(definition.getIdentifier());
		DefinitionTable result = new DefinitionTable();
		if (current != null) {
			for (ValueDefinition existing : current.getValueDefinitions()) {
				if (existing.isScoped()) {
					result.addValueDefinition(existing);
				}
			}
			current.getTypeDefinitions().forEach(result::addTypeDefinition);
		}
		result.addValueDefinition(definition);
		entries.put(definition.getIdentifier(), result);
	}

	/**
	 * Replaces the type definitions of the identifier, keeping its value definitions.
	 */
	public void redefineType(TypeDefinition definition) {
		DefinitionTable current = entries.get(definition.getIdentifier());
		DefinitionTable result = new DefinitionTable();
		if (current != null) {
			current.getValueDefinitions().forEach(result::addValueDefinition);
		}
		result.addTypeDefinition(definition);
		entries.put(definition.getIdentifier(), result);
	}

	public Set<String> getIdentifiers() {
		return Collections.unmodifiableSet(entries.keySet());
	}

	public Set<Map.Entry<String, DefinitionTable>> getEntries() {
		return Collections.unmodifiableSet(entries.entrySet());
	}

	public int size() {
		return entries.size();
	}

	public Optional<ValueDefinition> resolveValue(String identifier, List<Long> enclosingScopes) {
		DefinitionTable definitions = entries.get(identifier);
		if (definitions == null) {
			return Optional.empty();
		}
		return definitions.resolveValue(enclosingScopes);
	}

	public Optional<TypeDefinition> resolveType(String identifier) {
		DefinitionTable definitions = entries.get(identifier);
		if (definitions == null) {
			return Optional.empty();
		}
		return definitions.resolveType();
	}

	public LookupTable copy() {
		Map<String, DefinitionTable> copied = new LinkedHashMap<>();
		for (Map.Entry<String, DefinitionTable> entry : entries.entrySet()) {
			copied.put(entry.getKey(), entry.getValue().copy());
		}
		return new LookupTable(copied);
	}

	@Override
	public int hashCode() {
		return entries.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		LookupTable other = (LookupTable) obj;
		return entries.equals(other.entries);
	}

	@Override
	public String toString() {
		return "LookupTable " + entries;
	}
}
