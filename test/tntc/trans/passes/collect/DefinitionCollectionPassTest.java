package tntc.trans.passes.collect;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import tntc.model.tnt.TntLambda;
import tntc.model.tnt.TntLet;
import tntc.model.tnt.TntModule;
import tntc.model.tnt.TntModuleDefinition;
import tntc.model.tnt.TntOperatorDefinition;
import tntc.scope.DefinitionKind;
import tntc.scope.LookupTable;
import tntc.scope.LookupTableByModule;
import tntc.scope.ValueDefinition;
import tntc.trans.intermediate.TntBuiltins;

import static tntc.model.tnt.Builder.*;

public class DefinitionCollectionPassTest {

	@Test
	public void testEmptyModuleHasOnlyBuiltins() {
		LookupTableByModule tables = DefinitionCollectionPass.perform(module("Empty"));
		assertThat(tables.getModuleNames(), is(Collections.singleton("Empty")));
		assertThat(tables.get("Empty"), is(LookupTable.withBuiltins()));
	}

	@Test
	public void testModuleLevelDefinitions() {
		TntModule m = module("M",
				constant("N", intType()),
				variable("x", intType()),
				opdef("f", app("iadd", name("N"), num(1))),
				typedef("T", setType(intType())),
				uninterpreted("U"),
				assume("positive", app("igt", name("N"), num(0))));
		LookupTable table = DefinitionCollectionPass.perform(m).get("M");

		ValueDefinition n = table.get("N").getValueDefinitions().get(0);
		assertThat(n.getKind(), is(DefinitionKind.CONST));
		assertThat(n.getReference(), is(m.getDeclarations().get(0).getId()));
		assertThat(n.isScoped(), is(false));
		assertThat(table.get("x").getValueDefinitions().get(0).getKind(), is(DefinitionKind.VAR));
		assertThat(table.get("f").getValueDefinitions().get(0).getKind(), is(DefinitionKind.DEF));
		assertThat(table.get("positive").getValueDefinitions().get(0).getKind(), is(DefinitionKind.ASSUMPTION));
		assertThat(table.resolveType("T").get().getType(), is(setType(intType())));
		assertThat(table.resolveType("U").get().isUninterpreted(), is(true));
		for (String builtin : TntBuiltins.getNames()) {
			assertThat(table.containsKey(builtin), is(true));
		}
	}

	@Test
	public void testLambdaParametersAreScoped() {
		TntLambda body = lambda(params("a", "_"), app("iadd", name("a"), num(1)));
		TntModule m = module("M", opdef("inc", body));
		LookupTable table = DefinitionCollectionPass.perform(m).get("M");

		List<ValueDefinition> as = table.get("a").getValueDefinitions();
		assertThat(as.size(), is(1));
		assertThat(as.get(0).getKind(), is(DefinitionKind.PARAM));
		assertThat(as.get(0).getScope(), is(body.getId()));
		assertThat(as.get(0).getReference(), is(body.getParams().get(0).getId()));
		assertThat(table.containsKey("_"), is(false));
	}

	@Test
	public void testLetBoundOperatorsAreScopedToTheLet() {
		TntLet let = let(opdef("tmp", num(3)), app("imul", name("tmp"), name("tmp")));
		TntLambda outer = lambda(params("p"), let);
		TntModule m = module("M", opdef("g", outer));
		LookupTable table = DefinitionCollectionPass.perform(m).get("M");

		ValueDefinition tmp = table.get("tmp").getValueDefinitions().get(0);
		assertThat(tmp.getScope(), is(let.getId()));
		assertThat(table.get("p").getValueDefinitions().get(0).getScope(), is(outer.getId()));
		assertThat(table.resolveValue("tmp", Collections.emptyList()).isPresent(), is(false));
		assertThat(table.resolveValue("tmp", Arrays.asList(outer.getId(), let.getId())).get(), is(tmp));
	}

	@Test
	public void testShadowingKeepsBothDefinitions() {
		TntLambda body = lambda(params("x"), name("x"));
		TntModule m = module("M", constant("x", intType()), opdef("f", body));
		LookupTable table = DefinitionCollectionPass.perform(m).get("M");

		assertThat(table.get("x").getValueDefinitions().size(), is(2));
		assertThat(table.resolveValue("x", Collections.emptyList()).get().getKind(), is(DefinitionKind.CONST));
		assertThat(table.resolveValue("x", Collections.singletonList(body.getId())).get().getKind(),
				is(DefinitionKind.PARAM));
	}

	@Test
	public void testUnderscoreIsNeverRecorded() {
		TntModule m = module("M",
				opdef("_", num(1)),
				typedef("_", intType()),
				opdef("f", lambda(params("_"), num(0))));
		LookupTable table = DefinitionCollectionPass.perform(m).get("M");
		assertThat(table.containsKey("_"), is(false));
	}

	@Test
	public void testNestedModule() {
		TntModuleDefinition inner = nested(module("Inner",
				constant("c", intType()),
				opdef("d", lambda(params("q"), name("q"))),
				typedef("T", intType())));
		TntModule outer = module("Outer", inner, variable("v", boolType()));
		LookupTableByModule tables = DefinitionCollectionPass.perform(outer);

		assertThat(new ArrayList<>(tables.getModuleNames()), is(Arrays.asList("Outer", "Inner")));
		LookupTable outerTable = tables.get("Outer");
		ValueDefinition d = outerTable.get("Inner::d").getValueDefinitions().get(0);
		assertThat(d.getIdentifier(), is("Inner::d"));
		assertThat(d.getKind(), is(DefinitionKind.DEF));
		assertThat(outerTable.containsKey("Inner::c"), is(true));
		assertThat(outerTable.resolveType("Inner::T").isPresent(), is(true));
		// parameters and builtins stay inside
		assertThat(outerTable.containsKey("Inner::q"), is(false));
		assertThat(outerTable.containsKey("Inner::iadd"), is(false));
		assertThat(outerTable.containsKey("c"), is(false));
		assertThat(outerTable.get("Inner").getValueDefinitions().get(0),
				is(new ValueDefinition(DefinitionKind.MODULE, "Inner", inner.getId())));
		assertThat(tables.get("Inner").containsKey("c"), is(true));
	}

	@Test
	public void testImportsAreIgnoredAndInstancesAreModules() {
		TntOperatorDefinition withLambda = opdef("g", lambda(params("y"), name("y")));
		TntModule m = module("M",
				importAll("A"),
				importDef("B", "x"),
				instance("I", "P", override("N", let(withLambda, name("g")))));
		LookupTable table = DefinitionCollectionPass.perform(m).get("M");

		assertThat(table.size(), is(TntBuiltins.getNames().size() + 3));
		assertThat(table.get("I").getValueDefinitions().get(0).getKind(), is(DefinitionKind.MODULE));
		assertThat(table.get("g").getValueDefinitions().get(0).isScoped(), is(true));
		assertThat(table.containsKey("y"), is(true));
	}

	@Test
	public void testSeveralModules() {
		LookupTableByModule tables = DefinitionCollectionPass.perform(Arrays.asList(
				module("A", constant("a", intType())),
				module("B", constant("b", intType()))));
		assertThat(tables.get("A").containsKey("a"), is(true));
		assertThat(tables.get("A").containsKey("b"), is(false));
		assertThat(tables.get("B").containsKey("b"), is(true));
	}
}
