package tntc.trans.passes.imports;

import tntc.errors.IssueContext;
import tntc.errors.TopLevelIssueContext;
import tntc.model.tnt.TntDeclaration;
import tntc.model.tnt.TntModule;
import tntc.scope.LookupTable;
import tntc.scope.LookupTableByModule;

import java.util.logging.Logger;

/**
 * Extends a module's lookup table with everything its imports and instances bring into
 * scope. Every declaration is resolved independently, so one compilation attempt reports
 * every broken import at once.
 */
public class ImportResolutionPass {
	private static final Logger logger = Logger.getLogger(ImportResolutionPass.class.getName());

	private ImportResolutionPass() {}

	public static ImportResolutionResult perform(TntModule module, LookupTableByModule tables) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		LookupTableByModule resolved = perform(ctx, module, tables);
		if (ctx.hasErrors()) {
			return ImportResolutionResult.error(ctx.getIssues());
		}
		return ImportResolutionResult.ok(resolved);
	}

	/**
	 * Resolves module's imports and instances, reporting failures to ctx. The returned tables
	 * are only meaningful when ctx received no errors; the given tables are left untouched.
	 */
	public static LookupTableByModule perform(IssueContext ctx, TntModule module, LookupTableByModule tables) {
		logger.fine("Resolving imports of module " + module.getName());
		LookupTable importer = tables.containsModule(module.getName())
				? tables.get(module.getName()).copy()
				: LookupTable.withBuiltins();

		ImportResolutionVisitor visitor = new ImportResolutionVisitor(ctx, tables, importer);
		for (TntDeclaration declaration : module.getDeclarations()) {
			declaration.accept(visitor);
		}

		LookupTableByModule result = tables.copy();
		result.put(module.getName(), importer);
		return result;
	}
}
