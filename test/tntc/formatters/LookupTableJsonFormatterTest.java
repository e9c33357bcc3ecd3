package tntc.formatters;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.Test;

import tntc.model.tnt.TntLambda;
import tntc.model.tnt.TntModule;
import tntc.scope.LookupTableByModule;
import tntc.trans.intermediate.TntBuiltins;
import tntc.trans.passes.collect.DefinitionCollectionPass;

import static tntc.model.tnt.Builder.*;

public class LookupTableJsonFormatterTest {

	@Test
	public void testFormatsDefinitions() {
		TntLambda body = lambda(params("p"), name("p"));
		TntModule m = module("M", constant("N", intType()), opdef("f", body), typedef("T", setType(intType())),
				uninterpreted("U"));
		LookupTableByModule tables = DefinitionCollectionPass.perform(m);

		JSONObject json = new LookupTableJsonFormatter(false).format(tables).getJSONObject("M");

		JSONObject n = json.getJSONObject("N").getJSONArray("values").getJSONObject(0);
		assertThat(n.getString("kind"), is("const"));
		assertThat(n.getLong("reference"), is(m.getDeclarations().get(0).getId()));
		assertThat(n.has("scope"), is(false));

		JSONObject p = json.getJSONObject("p").getJSONArray("values").getJSONObject(0);
		assertThat(p.getString("kind"), is("param"));
		assertThat(p.getLong("scope"), is(body.getId()));

		JSONArray t = json.getJSONObject("T").getJSONArray("types");
		assertThat(t.getJSONObject(0).getString("type"), is("Set[int]"));
		assertThat(json.getJSONObject("U").getJSONArray("types").getJSONObject(0).has("type"), is(false));
	}

	@Test
	public void testBuiltinsAreOptional() {
		LookupTableByModule tables = DefinitionCollectionPass.perform(module("M"));

		assertThat(new LookupTableJsonFormatter(false).format(tables).getJSONObject("M").length(), is(0));

		JSONObject all = new LookupTableJsonFormatter(true).format(tables).getJSONObject("M");
		assertThat(all.length(), is(TntBuiltins.getNames().size()));
		JSONObject iadd = all.getJSONObject("iadd").getJSONArray("values").getJSONObject(0);
		assertThat(iadd.getString("kind"), is("def"));
		assertThat(iadd.has("reference"), is(false));
	}
}
