package tntc.trans.intermediate;

import tntc.scope.DefinitionKind;
import tntc.scope.ValueDefinition;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The operators and values every module sees without importing anything.
 */
public class TntBuiltins {
	private TntBuiltins() {}

	private static final Set<String> names = new LinkedHashSet<>();

	private static void addBuiltins(String... operators) {
		names.addAll(Arrays.asList(operators));
	}

	static {
		// booleans
		addBuiltins("not", "and", "or", "iff", "implies", "eq", "neq", "ite");
		// quantifiers
		addBuiltins("exists", "forall", "guess", "exists_const", "forall_const", "choose_const");
		// sets
		addBuiltins("Set", "in", "notin", "union", "contains", "fold", "intersect", "exclude", "subseteq",
				"map", "filter", "powerset", "flatten", "allLists", "seqs", "oneOf", "choose_some", "isFinite",
				"cardinality", "to");
		// maps
		addBuiltins("Map", "get", "put", "keys", "mapOf", "setOfMaps", "update", "updateAs", "applyTo", "setBy");
		// records and tuples
		addBuiltins("Rec", "field", "fields", "with", "Tup", "item", "tuples");
		// sequences
		addBuiltins("List", "append", "concat", "head", "tail", "length", "nth", "indices", "replaceAt",
				"slice", "select", "foldl", "foldr", "range");
		// integers
		addBuiltins("iadd", "isub", "imul", "idiv", "imod", "ipow", "ilt", "igt", "ilte", "igte", "iuminus");
		// actions and temporal operators
		addBuiltins("assign", "actionAll", "actionAny", "then", "reps", "fail", "assert", "always",
				"eventually", "next", "stutter", "nostutter", "enabled", "weakFair", "strongFair", "guarantees");
		// constant sets and values
		addBuiltins("Bool", "Int", "Nat", "TRUE", "FALSE");
	}

	public static boolean isBuiltin(String name) {
		return names.contains(name);
	}

	/**
	 * @return true when definition is the registry's own entry rather than a user definition that
	 * happens to share a builtin's name
	 */
	public static boolean isBuiltinDefinition(ValueDefinition definition) {
		return definition.getReference() == null && !definition.isScoped() && isBuiltin(definition.getIdentifier());
	}

	public static Set<String> getNames() {
		return Collections.unmodifiableSet(names);
	}

	public static List<ValueDefinition> getDefinitions() {
		List<ValueDefinition> result = new ArrayList<>(names.size());
		for (String name : names) {
			result.add(new ValueDefinition(DefinitionKind.DEF, name, null));
		}
		return result;
	}
}
