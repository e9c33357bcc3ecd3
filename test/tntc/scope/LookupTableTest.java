package tntc.scope;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.Collections;

import org.junit.Test;

import tntc.trans.intermediate.TntBuiltins;

import static tntc.model.tnt.Builder.*;

public class LookupTableTest {

	@Test
	public void testWithBuiltins() {
		LookupTable table = LookupTable.withBuiltins();
		assertThat(table.size(), is(TntBuiltins.getNames().size()));
		for (String name : TntBuiltins.getNames()) {
			ValueDefinition definition = table.get(name).getValueDefinitions().get(0);
			assertThat(definition.getKind(), is(DefinitionKind.DEF));
			assertThat(definition.getReference(), is(nullValue()));
			assertThat(definition.isScoped(), is(false));
		}
	}

	@Test
	public void testCopyIsIndependent() {
		LookupTable table = LookupTable.withBuiltins();
		LookupTable copy = table.copy();
		copy.addValueDefinition(new ValueDefinition(DefinitionKind.CONST, "N", 1L));
		copy.get("iadd").addValueDefinition(new ValueDefinition(DefinitionKind.DEF, "iadd", 2L));
		assertThat(table.containsKey("N"), is(false));
		assertThat(table.get("iadd").getValueDefinitions().size(), is(1));
	}

	@Test
	public void testRedefineValueKeepsScopedAndTypeDefinitions() {
		LookupTable table = new LookupTable();
		table.addValueDefinition(new ValueDefinition(DefinitionKind.CONST, "x", 1L));
		table.addValueDefinition(new ValueDefinition(DefinitionKind.PARAM, "x", 3L, 2L));
		table.addTypeDefinition(new TypeDefinition("x", intType(), 4L));

		table.redefineValue(new ValueDefinition(DefinitionKind.DEF, "x", 10L));

		assertThat(table.resolveValue("x", Collections.emptyList()).get().getReference(), is(10L));
		assertThat(table.resolveValue("x", Collections.singletonList(2L)).get().getReference(), is(3L));
		assertThat(table.get("x").getValueDefinitions().size(), is(2));
		assertThat(table.resolveType("x").get().getReference(), is(4L));
	}

	@Test
	public void testRedefineTypeReplacesTypeDefinitions() {
		LookupTable table = new LookupTable();
		table.addTypeDefinition(new TypeDefinition("T", null, 1L));
		table.redefineType(new TypeDefinition("T", boolType(), 2L));
		assertThat(table.get("T").getTypeDefinitions().size(), is(1));
		assertThat(table.resolveType("T").get().getType(), is(boolType()));
	}

	@Test
	public void testResolveUnknownName() {
		LookupTable table = LookupTable.withBuiltins();
		assertThat(table.resolveValue("nope", Collections.emptyList()).isPresent(), is(false));
		assertThat(table.resolveType("nope").isPresent(), is(false));
	}

	@Test
	public void testQualify() {
		assertThat(LookupTable.qualify("A", "x"), is("A::x"));
		assertThat(LookupTable.qualify("A::B", "x"), is("A::B::x"));
	}
}
