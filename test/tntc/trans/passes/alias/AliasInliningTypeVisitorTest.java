package tntc.trans.passes.alias;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import tntc.model.tnt.TntType;
import tntc.scope.LookupTable;
import tntc.scope.TypeDefinition;

import static tntc.model.tnt.Builder.*;

@RunWith(Parameterized.class)
public class AliasInliningTypeVisitorTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{constType("T3"), intType()},
				{constType("T1"), intType()},
				{constType("U"), constType("U")},
				{constType("Unknown"), constType("Unknown")},
				{typeVar("a"), typeVar("a")},
				{setType(constType("T1")), setType(intType())},
				{listType(constType("S")), listType(setType(intType()))},
				{funType(constType("T2"), constType("U")), funType(intType(), constType("U"))},
				{operType(Arrays.asList(constType("T1"), boolType()), constType("S")),
						operType(Arrays.asList(intType(), boolType()), setType(intType()))},
				{tupleType(constType("T1"), strType()), tupleType(intType(), strType())},
				{constType("R"), recordType(field("a", intType()), field("b", constType("U")))},
				{unionType("tag", unionRecord("left", field("v", constType("T2"))), unionRecord("right")),
						unionType("tag", unionRecord("left", field("v", intType())), unionRecord("right"))},
		});
	}

	private static LookupTable table() {
		LookupTable table = LookupTable.withBuiltins();
		table.addTypeDefinition(new TypeDefinition("T1", constType("T2"), 1L));
		table.addTypeDefinition(new TypeDefinition("T2", constType("T3"), 2L));
		table.addTypeDefinition(new TypeDefinition("T3", intType(), 3L));
		table.addTypeDefinition(new TypeDefinition("U", null, 4L));
		table.addTypeDefinition(new TypeDefinition("S", setType(constType("T1")), 5L));
		table.addTypeDefinition(new TypeDefinition("R", recordType(field("a", constType("T1")), field("b", constType("U"))), 6L));
		return table;
	}

	private final TntType type;
	private final TntType expected;

	public AliasInliningTypeVisitorTest(TntType type, TntType expected) {
		this.type = type;
		this.expected = expected;
	}

	@Test
	public void test() {
		TntType inlined = TypeAliasInliningPass.inlineAliasesInType(type, table());
		assertThat(inlined, is(expected));
		// inlining is a fixed point
		assertThat(TypeAliasInliningPass.inlineAliasesInType(inlined, table()), is(inlined));
	}
}
