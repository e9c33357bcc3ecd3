package tntc.trans.passes.flattening;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import tntc.InternalCompilerError;
import tntc.model.tnt.TntDeclaration;
import tntc.model.tnt.TntInstance;
import tntc.model.tnt.TntModule;
import tntc.model.tnt.TntModuleDefinition;
import tntc.model.tnt.TntOperatorDefinition;
import tntc.scope.DefinitionKind;
import tntc.scope.LookupTable;
import tntc.scope.LookupTableByModule;
import tntc.scope.ValueDefinition;
import tntc.trans.passes.collect.DefinitionCollectionPass;
import tntc.trans.passes.imports.ImportResolutionPass;

import static tntc.model.tnt.Builder.*;

public class FlatteningPassTest {

	private static TntModule proto() {
		return module("A",
				constant("N", intType()),
				variable("x", intType()),
				opdef("f", lambda(params("p"), app("iadd", name("p"), name("N")))),
				typedef("T", setType(intType())),
				pureval("g", app("f", num(1)), constType("T")),
				opdef("h", let(opdef("tmp", num(1)), app("iadd", name("tmp"), name("x")))));
	}

	private static Map<String, TntModule> modulesOf(TntModule... modules) {
		Map<String, TntModule> result = new LinkedHashMap<>();
		for (TntModule module : modules) {
			result.put(module.getName(), module);
		}
		return result;
	}

	// collects and resolves every module in order, as the front end does
	private static LookupTableByModule resolvedTables(TntModule... modules) {
		LookupTableByModule tables = DefinitionCollectionPass.perform(Arrays.asList(modules));
		for (TntModule module : modules) {
			tables = ImportResolutionPass.perform(module, tables).getTables();
		}
		return tables;
	}

	private static FlatteningResult flatten(TntModule main, TntModule... protos) {
		TntModule[] all = Arrays.copyOf(protos, protos.length + 1);
		all[protos.length] = main;
		return FlatteningPass.perform(main, resolvedTables(all), modulesOf(protos));
	}

	@Test
	public void testInstanceIsReplacedByNamespacedDefinitions() {
		TntModule main = module("Main", instance("I", "A", override("N", num(3))));
		FlatteningResult result = flatten(main, proto());

		TntModule expected = module("Main",
				pureval("I::N", num(3), intType()),
				variable("I::x", intType()),
				opdef("I::f", lambda(params("p"), app("iadd", name("p"), name("I::N")))),
				typedef("I::T", setType(intType())),
				pureval("I::g", app("I::f", num(1)), constType("I::T")),
				opdef("I::h", let(opdef("I::tmp", num(1)), app("iadd", name("I::tmp"), name("I::x")))));
		assertThat(result.getModule(), is(expected));
	}

	@Test
	public void testOverrideKeepsItsExpression() {
		TntModule main = module("Main", constant("M", intType()),
				instance("I", "A", override("N", app("iadd", name("M"), num(1)))));
		TntInstance instance = (TntInstance) main.getDeclarations().get(1);
		FlatteningResult result = flatten(main, proto());

		TntOperatorDefinition n = (TntOperatorDefinition) result.getModule().getDeclarations().get(1);
		assertThat(n.getName(), is("I::N"));
		assertThat(n.getQualifier(), is(TntOperatorDefinition.Qualifier.PUREVAL));
		assertThat(n.getBody(), is(sameInstance(instance.getOverrides().get(0).getExpression())));
	}

	@Test
	public void testNoInstanceRemains() {
		TntModule main = module("Main",
				instance("I", "A", override("N", num(3))),
				instance("J", "A", override("N", num(4))));
		FlatteningResult result = flatten(main, proto());
		for (TntDeclaration declaration : result.getModule().getDeclarations()) {
			assertThat(declaration, not(instanceOf(TntInstance.class)));
		}
		assertThat(result.getModule().getDeclarations().size(), is(12));
	}

	@Test
	public void testFreshIdsAreAboveEveryExistingId() {
		TntModule a = proto();
		TntModule main = module("Main", instance("I", "A", override("N", num(3))));
		long max = MaxIdVisitor.maxId(Arrays.asList(a, main));
		FlatteningResult result = flatten(main, a);

		List<TntDeclaration> declarations = result.getModule().getDeclarations();
		for (TntDeclaration declaration : declarations) {
			assertThat(declaration.getId() > max, is(true));
		}
		TntOperatorDefinition f = (TntOperatorDefinition) declarations.get(2);
		assertThat(f.getBody().getId() > max, is(true));
		assertThat(f.getBody().getId(), not(is(f.getId())));
	}

	@Test
	public void testDerivedTableRecordsSynthesizedDefinitions() {
		TntModule main = module("Main", instance("I", "A", override("N", num(3))));
		FlatteningResult result = flatten(main, proto());
		LookupTable table = result.getTable();
		List<TntDeclaration> declarations = result.getModule().getDeclarations();

		assertThat(table.resolveValue("I::N", Collections.emptyList()).get(),
				is(new ValueDefinition(DefinitionKind.DEF, "I::N", declarations.get(0).getId())));
		assertThat(table.resolveValue("I::x", Collections.emptyList()).get(),
				is(new ValueDefinition(DefinitionKind.VAR, "I::x", declarations.get(1).getId())));
		assertThat(table.resolveValue("I::f", Collections.emptyList()).get().getReference(),
				is(declarations.get(2).getId()));
		assertThat(table.resolveType("I::T").get().getReference(), is(declarations.get(3).getId()));
		assertThat(table.resolveType("I::T").get().getType(), is(setType(intType())));
		assertThat(table.resolveValue("I::tmp", Collections.emptyList()).isPresent(), is(false));
	}

	@Test
	public void testInputTablesAreLeftAlone() {
		TntModule a = proto();
		TntModule main = module("Main", instance("I", "A", override("N", num(3))));
		LookupTableByModule tables = resolvedTables(a, main);
		LookupTableByModule before = tables.copy();
		FlatteningPass.perform(main, tables, modulesOf(a));
		assertThat(tables, is(before));
	}

	@Test
	public void testParametersShadowingPrototypeDefinitionsStayUnqualified() {
		TntModule a = module("A",
				constant("y", intType()),
				opdef("k", lambda(params("y"), app("iadd", name("y"), num(1)))),
				opdef("l", app("k", name("y"))));
		TntModule main = module("Main", instance("I", "A", override("y", num(0))));
		FlatteningResult result = flatten(main, a);

		assertThat(result.getModule(), is(module("Main",
				pureval("I::y", num(0), intType()),
				opdef("I::k", lambda(params("y"), app("iadd", name("y"), num(1)))),
				opdef("I::l", app("I::k", name("I::y"))))));
	}

	@Test
	public void testOverrideTypeIsNamespaced() {
		TntModule a = module("A", typedef("T", intType()), constant("N", listType(constType("T"))));
		TntModule main = module("Main", instance("I", "A", override("N", app("List", num(1)))));
		FlatteningResult result = flatten(main, a);

		TntOperatorDefinition n = (TntOperatorDefinition) result.getModule().getDeclarations().get(0);
		assertThat(n.getTypeAnnotation(), is(listType(constType("I::T"))));
	}

	@Test
	public void testPrototypeImportsAreDropped() {
		TntModule a = module("A", constant("N", intType()));
		TntModule b = module("B", importAll("A"), constant("M", intType()));
		TntModule main = module("Main", instance("J", "B", override("M", num(1))));
		FlatteningResult result = flatten(main, a, b);
		assertThat(result.getModule(), is(module("Main", pureval("J::M", num(1), intType()))));
	}

	@Test
	public void testInstancesInNestedModules() {
		TntModule main = module("Main",
				nested(module("Inner", instance("I", "A", override("N", num(3))))),
				constant("c", intType()));
		FlatteningResult result = flatten(main, proto());

		TntModuleDefinition inner = (TntModuleDefinition) result.getModule().getDeclarations().get(0);
		assertThat(inner.getModule().getDeclarations().size(), is(6));
		assertThat(inner.getModule().getDeclarations().get(0).getName(), is("I::N"));
		assertThat(result.getTables().get("Inner").containsKey("I::f"), is(true));
	}

	@Test
	public void testInstanceOfSiblingNestedModule() {
		TntModule main = module("Main",
				nested(module("P", constant("K", intType()), opdef("twice", app("imul", name("K"), num(2))))),
				instance("I", "P", override("K", num(21))));
		FlatteningResult result = FlatteningPass.perform(main, resolvedTables(main), Collections.emptyMap());

		List<TntDeclaration> declarations = result.getModule().getDeclarations();
		assertThat(declarations.get(1), is(pureval("I::K", num(21), intType())));
		assertThat(declarations.get(2), is(opdef("I::twice", app("imul", name("I::K"), num(2)))));
	}

	@Test
	public void testNestedModuleOfPrototypeIsEmittedUnderBothNamespaces() {
		TntModule a = module("A",
				nested(module("Inner", constant("c", intType()), opdef("d", app("iadd", name("c"), num(1))))),
				opdef("e", name("Inner::d")));
		TntModule main = module("Main", instance("I", "A"));
		FlatteningResult result = flatten(main, a);

		assertThat(result.getModule(), is(module("Main",
				constant("I::Inner::c", intType()),
				opdef("I::Inner::d", app("iadd", name("I::Inner::c"), num(1))),
				opdef("I::e", name("I::Inner::d")))));

		LookupTable table = result.getTable();
		List<TntDeclaration> declarations = result.getModule().getDeclarations();
		assertThat(table.resolveValue("I::Inner::c", Collections.emptyList()).get(),
				is(new ValueDefinition(DefinitionKind.CONST, "I::Inner::c", declarations.get(0).getId())));
		assertThat(table.resolveValue("I::Inner::d", Collections.emptyList()).get(),
				is(new ValueDefinition(DefinitionKind.DEF, "I::Inner::d", declarations.get(1).getId())));
		assertThat(table.resolveValue("I::e", Collections.emptyList()).get(),
				is(new ValueDefinition(DefinitionKind.DEF, "I::e", declarations.get(2).getId())));
	}

	@Test
	public void testModuleWithoutInstancesIsReturnedAsIs() {
		TntModule main = module("Main", constant("N", intType()), nested(module("Inner", variable("v", boolType()))));
		FlatteningResult result = FlatteningPass.perform(main, resolvedTables(main), Collections.emptyMap());
		assertThat(result.getModule(), is(sameInstance(main)));
	}

	@Test
	public void testFlatteningIsIdempotent() {
		TntModule a = proto();
		TntModule main = module("Main", instance("I", "A", override("N", num(3))));
		FlatteningResult once = flatten(main, a);
		FlatteningResult twice = FlatteningPass.perform(once.getModule(), once.getTables(), modulesOf(a));
		assertThat(twice.getModule(), is(once.getModule()));
		assertThat(twice.getTable(), is(once.getTable()));
	}

	@Test(expected = InternalCompilerError.class)
	public void testUnknownPrototype() {
		TntModule a = proto();
		TntModule main = module("Main", instance("I", "A", override("N", num(3))));
		FlatteningPass.perform(main, resolvedTables(a, main), Collections.emptyMap());
	}

	@Test(expected = InternalCompilerError.class)
	public void testInstanceInsidePrototype() {
		TntModule a = proto();
		TntModule b = module("B", instance("I", "A", override("N", num(3))));
		TntModule main = module("Main", instance("J", "B"));
		FlatteningPass.perform(main, resolvedTables(a, b, main), modulesOf(a, b));
	}

	@Test(expected = InternalCompilerError.class)
	public void testDanglingNameInPrototype() {
		TntModule a = module("A", opdef("f", name("nowhere")));
		TntModule main = module("Main", instance("I", "A"));
		flatten(main, a);
	}

	@Test
	public void testShouldAddNamespace() {
		TntModule a = module("A", constant("N", intType()), opdef("f", lambda(params("p"), name("p"))));
		LookupTable table = resolvedTables(a).get("A");
		long lambdaId = ((TntOperatorDefinition) a.getDeclarations().get(1)).getBody().getId();

		assertThat(FlatteningPass.shouldAddNamespace(table, "iadd", Collections.emptyList()), is(false));
		assertThat(FlatteningPass.shouldAddNamespace(table, "N", Collections.emptyList()), is(true));
		assertThat(FlatteningPass.shouldAddNamespace(table, "f", Collections.emptyList()), is(true));
		assertThat(FlatteningPass.shouldAddNamespace(table, "p", Collections.singletonList(lambdaId)), is(false));
	}
}
