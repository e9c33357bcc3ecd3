package tntc.scope;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One lookup table per module, keyed by module name, in the order modules were entered.
 */
public class LookupTableByModule {
	private final Map<String, LookupTable> tables;

	public LookupTableByModule() {
		this.tables = new LinkedHashMap<>();
	}

	public LookupTable get(String moduleName) {
		return tables.get(moduleName);
	}

	public boolean containsModule(String moduleName) {
		return tables.containsKey(moduleName);
	}

	public void put(String moduleName, LookupTable table) {
		tables.put(moduleName, table);
	}

	public Set<String> getModuleNames() {
		return Collections.unmodifiableSet(tables.keySet());
	}

	public LookupTableByModule copy() {
		LookupTableByModule result = new LookupTableByModule();
		for (Map.Entry<String, LookupTable> entry : tables.entrySet()) {
			result.put(entry.getKey(), entry.getValue().copy());
		}
		return result;
	}

	@Override
	public int hashCode() {
		return tables.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		LookupTableByModule other = (LookupTableByModule) obj;
		return tables.equals(other.tables);
	}

	@Override
	public String toString() {
		return "LookupTableByModule " + tables;
	}
}
