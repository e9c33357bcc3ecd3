package tntc.formatters;

import org.json.JSONArray;
import org.json.JSONObject;
import tntc.scope.DefinitionTable;
import tntc.scope.LookupTable;
import tntc.scope.LookupTableByModule;
import tntc.scope.TypeDefinition;
import tntc.scope.ValueDefinition;
import tntc.trans.intermediate.TntBuiltins;

import java.util.Map;

/**
 * Dumps lookup tables as JSON, one object per identifier:
 *
 * {"x": {"values": [{"kind": "const", "reference": 4}], "types": []}}
 *
 * Builtins are left out unless asked for, since every table carries all of them.
 */
public class LookupTableJsonFormatter {
	private final boolean includeBuiltins;

	public LookupTableJsonFormatter(boolean includeBuiltins) {
		this.includeBuiltins = includeBuiltins;
	}

	public JSONObject format(LookupTableByModule tables) {
		JSONObject result = new JSONObject();
		for (String moduleName : tables.getModuleNames()) {
			result.put(moduleName, format(tables.get(moduleName)));
		}
		return result;
	}

	public JSONObject format(LookupTable table) {
		JSONObject result = new JSONObject();
		for (Map.Entry<String, DefinitionTable> entry : table.getEntries()) {
			JSONArray values = new JSONArray();
			for (ValueDefinition definition : entry.getValue().getValueDefinitions()) {
				if (includeBuiltins || !TntBuiltins.isBuiltinDefinition(definition)) {
					values.put(format(definition));
				}
			}
			JSONArray types = new JSONArray();
			for (TypeDefinition definition : entry.getValue().getTypeDefinitions()) {
				types.put(format(definition));
			}
			if (values.length() == 0 && types.length() == 0) {
				continue;
			}
			JSONObject definitions = new JSONObject();
			definitions.put("values", values);
			definitions.put("types", types);
			result.put(entry.getKey(), definitions);
		}
		return result;
	}

	private static JSONObject format(ValueDefinition definition) {
		JSONObject result = new JSONObject();
		result.put("kind", definition.getKind().getName());
		if (definition.getReference() != null) {
			result.put("reference", definition.getReference().longValue());
		}
		if (definition.isScoped()) {
			result.put("scope", definition.getScope().longValue());
		}
		return result;
	}

	private static JSONObject format(TypeDefinition definition) {
		JSONObject result = new JSONObject();
		if (!definition.isUninterpreted()) {
			result.put("type", definition.getType().toString());
		}
		if (definition.getReference() != null) {
			result.put("reference", definition.getReference().longValue());
		}
		return result;
	}
}
