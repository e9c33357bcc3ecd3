package tntc;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import tntc.errors.TopLevelIssueContext;
import tntc.model.tnt.TntDeclaration;
import tntc.model.tnt.TntInstance;
import tntc.model.tnt.TntModule;
import tntc.scope.DefinitionKind;
import tntc.scope.LookupTable;
import tntc.trans.TntcTransException;

import static tntc.model.tnt.Builder.*;

public class TntcFrontEndTest {

	private static TntModule counter() {
		return module("Counter",
				typedef("Count", intType()),
				constant("Start", constType("Count")),
				variable("n", constType("Count")),
				opdef("init", app("assign", name("n"), name("Start"))),
				opdef("step", app("assign", name("n"), app("iadd", name("n"), num(1)))));
	}

	@Test
	public void testRunsEveryPass() throws TntcTransException {
		TntModule main = module("Main",
				importDef("Counter", "Count"),
				instance("C", "Counter", override("Start", num(0))),
				pureval("zero", num(0), constType("Count")));
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		FrontEndResult result = TntcFrontEnd.run(ctx, Arrays.asList(counter(), main), "Main");

		assertThat(ctx.hasErrors(), is(false));
		TntModule flat = result.getMainModule();
		for (TntDeclaration declaration : flat.getDeclarations()) {
			assertThat(declaration, not(instanceOf(TntInstance.class)));
		}
		assertThat(flat, is(module("Main",
				importDef("Counter", "Count"),
				pureval("C::Start", num(0), intType()),
				typedef("C::Count", intType()),
				variable("C::n", intType()),
				opdef("C::init", app("assign", name("C::n"), name("C::Start"))),
				opdef("C::step", app("assign", name("C::n"), app("iadd", name("C::n"), num(1)))),
				pureval("zero", num(0), intType()))));

		LookupTable table = result.getMainTable();
		assertThat(table.resolveValue("C::n", Collections.emptyList()).get().getKind(), is(DefinitionKind.VAR));
		assertThat(table.resolveType("Count").get().getType(), is(intType()));
		assertThat(result.getModules().size(), is(2));
	}

	@Test
	public void testReportsImportIssues() {
		TntModule main = module("Main", importAll("Nowhere"), importDef("Counter", "missing"));
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		try {
			TntcFrontEnd.run(ctx, Arrays.asList(counter(), main), "Main");
			fail("should have thrown TntcTransException");
		} catch (TntcTransException ex) {
			assertThat(ctx.getIssues().size(), is(2));
			assertThat(ex.getMsg(), containsString("could not find module Nowhere"));
			assertThat(ex.getMsg(), containsString("could not find definition missing in module Counter"));
			assertThat(ex.getMsg(), containsString("while resolving names of module Main"));
		}
	}

	@Test(expected = TntcTransException.class)
	public void testMissingMainModule() throws TntcTransException {
		TntcFrontEnd.run(new TopLevelIssueContext(), Collections.singletonList(counter()), "Main");
	}

	@Test
	public void testNestedModuleImports() throws TntcTransException {
		TntModule outer = module("Outer",
				nested(module("Inner", constant("k", intType()), opdef("twice", app("imul", name("k"), num(2))))),
				importDef("Inner", "twice"),
				opdef("four", app("twice", num(2))));
		FrontEndResult result = TntcFrontEnd.run(new TopLevelIssueContext(), Collections.singletonList(outer), "Outer");

		LookupTable table = result.getMainTable();
		assertThat(table.containsKey("twice"), is(true));
		assertThat(table.containsKey("Inner::twice"), is(true));
		assertThat(table.get("Inner").getValueDefinitions().get(0).getKind(), is(DefinitionKind.MODULE));
	}

	@Test
	public void testNestedModuleAliasesUseTheirOwnTable() throws TntcTransException {
		TntModule outer = module("Outer",
				typedef("T", intType()),
				nested(module("Inner",
						typedef("T", strType()),
						typedef("S", setType(constType("T"))),
						constant("k", constType("S")))));
		FrontEndResult result = TntcFrontEnd.run(new TopLevelIssueContext(), Collections.singletonList(outer), "Outer");

		assertThat(result.getMainModule().getDeclarations().get(1), is(nested(module("Inner",
				typedef("T", strType()),
				typedef("S", setType(strType())),
				constant("k", setType(strType()))))));
		assertThat(result.getTables().get("Inner").resolveType("S").get().getType(), is(setType(strType())));
		assertThat(result.getMainTable().resolveType("Inner::S").get().getType(), is(setType(strType())));
		assertThat(result.getMainTable().resolveType("T").get().getType(), is(intType()));
	}
}
