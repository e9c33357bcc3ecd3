package tntc;

import tntc.errors.IssueContext;
import tntc.errors.TopLevelIssueContext;
import tntc.formatters.LookupTableJsonFormatter;
import tntc.model.tnt.TntDeclaration;
import tntc.model.tnt.TntModule;
import tntc.model.tnt.TntModuleDefinition;
import tntc.scope.LookupTableByModule;
import tntc.trans.TntcTransException;
import tntc.trans.intermediate.WhileResolvingModule;
import tntc.trans.passes.alias.TypeAliasInliningPass;
import tntc.trans.passes.alias.TypeAliasInliningResult;
import tntc.trans.passes.collect.DefinitionCollectionPass;
import tntc.trans.passes.flattening.FlatteningPass;
import tntc.trans.passes.flattening.FlatteningResult;
import tntc.trans.passes.imports.ImportResolutionPass;
import tntc.trans.passes.imports.ModuleNotFoundIssue;
import tntc.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the name resolution passes over a set of parsed modules, in order: definition
 * collection, import resolution, instance flattening and type alias inlining.
 *
 * Modules are processed in the order given, so a module must come after every module it
 * imports or instantiates.
 */
public class TntcFrontEnd {
	private static final Logger logger = Logger.getLogger("TntcFrontEnd");

	private TntcFrontEnd() {}

	public static FrontEndResult run(TopLevelIssueContext ctx, List<TntModule> modules, String mainModuleName)
			throws TntcTransException {
		if (modules.stream().noneMatch(m -> m.getName().equals(mainModuleName))) {
			ctx.error(new ModuleNotFoundIssue(mainModuleName, SourceLocation.unknown()));
		}
		checkErrors(ctx);

		logger.info("Collecting definitions");
		LookupTableByModule tables = DefinitionCollectionPass.perform(modules);

		logger.info("Resolving imports");
		for (TntModule module : modules) {
			tables = resolveImports(ctx, module, tables);
		}
		checkErrors(ctx);
		if (logger.isLoggable(Level.FINE)) {
			logger.fine("Resolved lookup tables: " + new LookupTableJsonFormatter(false).format(tables).toString(2));
		}

		logger.info("Flattening instances");
		Map<String, TntModule> flattened = new LinkedHashMap<>();
		for (TntModule module : modules) {
			FlatteningResult result = FlatteningPass.perform(module, tables, flattened);
			tables = result.getTables();
			registerModule(flattened, result.getModule());
		}

		logger.info("Inlining type aliases");
		List<TntModule> inlined = new ArrayList<>();
		LookupTableByModule inlinedTables = tables.copy();
		for (TntModule module : modules) {
			inlined.add(inlineAliases(flattened.get(module.getName()), tables, inlinedTables));
		}

		return new FrontEndResult(inlined, mainModuleName, inlinedTables);
	}

	// nested modules are resolved first, since their enclosing module may import from them
	private static LookupTableByModule resolveImports(IssueContext ctx, TntModule module, LookupTableByModule tables) {
		for (TntDeclaration declaration : module.getDeclarations()) {
			if (declaration instanceof TntModuleDefinition) {
				tables = resolveImports(ctx, ((TntModuleDefinition) declaration).getModule(), tables);
			}
		}
		return ImportResolutionPass.perform(ctx.withContext(new WhileResolvingModule(module.getName())), module, tables);
	}

	// nested modules get their own inlined table as well
	private static TntModule inlineAliases(TntModule module, LookupTableByModule tables,
	                                       LookupTableByModule inlinedTables) {
		for (TntDeclaration declaration : module.getDeclarations()) {
			if (declaration instanceof TntModuleDefinition) {
				inlineAliases(((TntModuleDefinition) declaration).getModule(), tables, inlinedTables);
			}
		}
		TypeAliasInliningResult result = TypeAliasInliningPass.perform(
				Collections.singletonList(module), tables.get(module.getName()), tables);
		inlinedTables.put(module.getName(), result.getTable());
		return result.getModules().get(0);
	}

	private static void registerModule(Map<String, TntModule> modules, TntModule module) {
		modules.put(module.getName(), module);
		for (TntDeclaration declaration : module.getDeclarations()) {
			if (declaration instanceof TntModuleDefinition) {
				registerModule(modules, ((TntModuleDefinition) declaration).getModule());
			}
		}
	}

	private static void checkErrors(TopLevelIssueContext ctx) throws TntcTransException {
		if (ctx.hasErrors()) {
			throw new TntcTransException(ctx.format());
		}
	}
}
