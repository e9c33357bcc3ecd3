package tntc.scope;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;

import org.junit.Test;

import static tntc.model.tnt.Builder.*;

public class DefinitionTableTest {

	private static DefinitionTable shadowedX() {
		DefinitionTable table = new DefinitionTable();
		table.addValueDefinition(new ValueDefinition(DefinitionKind.CONST, "x", 1L));
		table.addValueDefinition(new ValueDefinition(DefinitionKind.PARAM, "x", 5L, 4L));
		table.addValueDefinition(new ValueDefinition(DefinitionKind.DEF, "x", 8L, 7L));
		return table;
	}

	@Test
	public void testResolveWithoutScopesPicksModuleLevel() {
		Optional<ValueDefinition> resolved = shadowedX().resolveValue(Collections.emptyList());
		assertThat(resolved.get().getReference(), is(1L));
	}

	@Test
	public void testResolvePicksNearestEnclosingScope() {
		assertThat(shadowedX().resolveValue(Arrays.asList(4L)).get().getKind(), is(DefinitionKind.PARAM));
		assertThat(shadowedX().resolveValue(Arrays.asList(4L, 7L)).get().getReference(), is(8L));
		assertThat(shadowedX().resolveValue(Arrays.asList(7L, 4L)).get().getReference(), is(5L));
	}

	@Test
	public void testResolveIgnoresScopesNotEnclosingTheOccurrence() {
		assertThat(shadowedX().resolveValue(Arrays.asList(99L)).get().getKind(), is(DefinitionKind.CONST));
	}

	@Test
	public void testResolveOnlyScopedDefinitions() {
		DefinitionTable table = new DefinitionTable();
		table.addValueDefinition(new ValueDefinition(DefinitionKind.PARAM, "y", 5L, 4L));
		assertThat(table.resolveValue(Collections.emptyList()).isPresent(), is(false));
		assertThat(table.isModuleLevel(), is(false));
	}

	@Test
	public void testExportedDropsScopedAndBuiltinDefinitions() {
		DefinitionTable table = shadowedX();
		table.addValueDefinition(new ValueDefinition(DefinitionKind.DEF, "x", null));
		DefinitionTable exported = table.exported();
		assertThat(exported.getValueDefinitions(), is(Collections.singletonList(
				new ValueDefinition(DefinitionKind.CONST, "x", 1L))));
	}

	@Test
	public void testWithPrefix() {
		DefinitionTable table = new DefinitionTable();
		table.addValueDefinition(new ValueDefinition(DefinitionKind.VAR, "v", 3L));
		table.addTypeDefinition(new TypeDefinition("v", intType(), 2L));
		DefinitionTable prefixed = table.withPrefix("M");
		assertThat(prefixed.getValueDefinitions().get(0).getIdentifier(), is("M::v"));
		assertThat(prefixed.getValueDefinitions().get(0).getReference(), is(3L));
		assertThat(prefixed.getTypeDefinitions().get(0).getIdentifier(), is("M::v"));
		assertThat(table.getValueDefinitions().get(0).getIdentifier(), is("v"));
	}

	@Test
	public void testResolveTypePicksLatest() {
		DefinitionTable table = new DefinitionTable();
		assertThat(table.resolveType().isPresent(), is(false));
		table.addTypeDefinition(new TypeDefinition("T", null, 1L));
		table.addTypeDefinition(new TypeDefinition("T", intType(), 2L));
		assertThat(table.resolveType().get().getReference(), is(2L));
		assertThat(table.resolveType().get().isUninterpreted(), is(false));
	}
}
