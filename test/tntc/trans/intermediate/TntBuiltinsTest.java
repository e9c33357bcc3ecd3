package tntc.trans.intermediate;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import org.junit.Test;

import tntc.scope.DefinitionKind;
import tntc.scope.ValueDefinition;

public class TntBuiltinsTest {

	@Test
	public void testCatalog() {
		for (String name : new String[] {"iadd", "Set", "Map", "forall", "always", "TRUE", "Nat", "foldl"}) {
			assertThat(name, TntBuiltins.isBuiltin(name), is(true));
		}
		assertThat(TntBuiltins.isBuiltin("N"), is(false));
		assertThat(TntBuiltins.getDefinitions().size(), is(TntBuiltins.getNames().size()));
	}

	@Test
	public void testBuiltinDefinitions() {
		for (ValueDefinition definition : TntBuiltins.getDefinitions()) {
			assertThat(definition.getKind(), is(DefinitionKind.DEF));
			assertThat(TntBuiltins.isBuiltinDefinition(definition), is(true));
		}
		assertThat(TntBuiltins.isBuiltinDefinition(new ValueDefinition(DefinitionKind.DEF, "iadd", 3L)), is(false));
		assertThat(TntBuiltins.isBuiltinDefinition(new ValueDefinition(DefinitionKind.PARAM, "iadd", null, 2L)), is(false));
	}
}
