package tntc.trans.passes.flattening;

import tntc.InternalCompilerError;
import tntc.model.tnt.*;
import tntc.scope.DefinitionKind;
import tntc.scope.LookupTable;
import tntc.scope.LookupTableByModule;
import tntc.scope.ValueDefinition;
import tntc.trans.intermediate.TntBuiltins;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Replaces every instance declaration with namespaced copies of its prototype's
 * definitions.
 *
 * module N = M(p = e) becomes a pure val N::p = e followed by N::x for every other
 * declaration x of M, with references inside the copied bodies rewritten to the namespaced
 * names. Modules nested in the flattened module are flattened first, so an instance of a
 * sibling module sees that module already flattened.
 *
 * Imports must have been resolved before this pass runs: the tables given are expected to
 * hold every name the prototypes refer to.
 */
public class FlatteningPass {
	private static final Logger logger = Logger.getLogger(FlatteningPass.class.getName());

	private FlatteningPass() {}

	public static FlatteningResult perform(TntModule module, LookupTableByModule tables, Map<String, TntModule> modules) {
		List<TntModule> known = new ArrayList<>(modules.values());
		known.add(module);
		IdGenerator idGenerator = new IdGenerator(MaxIdVisitor.maxId(known));

		LookupTableByModule derived = tables.copy();
		TntModule flattened = flattenModule(module, derived, new LinkedHashMap<>(modules), idGenerator);
		return new FlatteningResult(flattened, derived);
	}

	/**
	 * Decides whether a name occurring in a prototype refers to one of the prototype's own
	 * definitions, in which case its copy must be qualified with the instance name.
	 *
	 * @param enclosingScopes ids of the lambdas and lets around the occurrence, outermost first
	 */
	static boolean shouldAddNamespace(LookupTable protoTable, String name, List<Long> enclosingScopes) {
		if (TntBuiltins.isBuiltin(name)) {
			return false;
		}
		Optional<ValueDefinition> definition = protoTable.resolveValue(name, enclosingScopes);
		if (!definition.isPresent()) {
			throw new InternalCompilerError("could not find a definition for " + name + " while flattening");
		}
		return definition.get().getKind() != DefinitionKind.PARAM;
	}

	private static TntModule flattenModule(TntModule module, LookupTableByModule tables, Map<String, TntModule> modules,
	                                       IdGenerator idGenerator) {
		LookupTable table = tables.get(module.getName());
		if (table == null) {
			table = LookupTable.withBuiltins();
			tables.put(module.getName(), table);
		}

		boolean changed = false;
		List<TntDeclaration> declarations = new ArrayList<>();
		for (TntDeclaration declaration : module.getDeclarations()) {
			if (declaration instanceof TntInstance) {
				instantiate((TntInstance) declaration, table, tables, modules, idGenerator, declarations);
				changed = true;
			} else if (declaration instanceof TntModuleDefinition) {
				TntModuleDefinition nested = (TntModuleDefinition) declaration;
				TntModule inner = flattenModule(nested.getModule(), tables, modules, idGenerator);
				modules.put(inner.getName(), inner);
				if (inner != nested.getModule()) {
					declarations.add(new TntModuleDefinition(nested.getLocation(), nested.getId(), inner));
					changed = true;
				} else {
					declarations.add(declaration);
				}
			} else {
				declarations.add(declaration);
			}
		}
		return changed ? module.withDeclarations(declarations) : module;
	}

	private static void instantiate(TntInstance instance, LookupTable table, LookupTableByModule tables,
	                                Map<String, TntModule> modules, IdGenerator idGenerator,
	                                List<TntDeclaration> declarations) {
		String namespace = instance.getName();
		TntModule proto = modules.get(instance.getProtoName());
		LookupTable protoTable = tables.get(instance.getProtoName());
		if (proto == null || protoTable == null) {
			throw new InternalCompilerError("could not find prototype module " + instance.getProtoName() +
					" of instance " + namespace);
		}
		logger.fine("Flattening instance " + namespace + " of module " + proto.getName());

		NamespaceAddingDeclarationVisitor visitor = new NamespaceAddingDeclarationVisitor(
				namespace, tables, protoTable, table, idGenerator);
		NamespaceAddingTypeVisitor typeVisitor = new NamespaceAddingTypeVisitor(namespace, idGenerator);

		Set<String> overridden = new HashSet<>();
		for (TntInstance.Override override : instance.getOverrides()) {
			String name = LookupTable.qualify(namespace, override.getName());
			TntType annotation = findTypeAnnotation(proto, override.getName());
			long id = idGenerator.nextId();
			declarations.add(new TntOperatorDefinition(override.getLocation(), id, name,
					TntOperatorDefinition.Qualifier.PUREVAL, override.getExpression(),
					annotation == null ? null : annotation.accept(typeVisitor)));
			table.redefineValue(new ValueDefinition(DefinitionKind.DEF, name, id));
			overridden.add(override.getName());
		}

		for (TntDeclaration declaration : proto.getDeclarations()) {
			if (overridden.contains(declaration.getName())) {
				continue;
			}
			declarations.addAll(declaration.accept(visitor));
		}
	}

	private static TntType findTypeAnnotation(TntModule proto, String name) {
		for (TntDeclaration declaration : proto.getDeclarations()) {
			if (!name.equals(declaration.getName())) {
				continue;
			}
			if (declaration instanceof TntConstant) {
				return ((TntConstant) declaration).getType();
			} else if (declaration instanceof TntVariable) {
				return ((TntVariable) declaration).getType();
			} else if (declaration instanceof TntOperatorDefinition) {
				return ((TntOperatorDefinition) declaration).getTypeAnnotation();
			}
		}
		return null;
	}
}
