package tntc.errors;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import org.junit.Test;

import tntc.trans.intermediate.WhileResolvingModule;
import tntc.trans.passes.imports.DefinitionNotFoundIssue;
import tntc.trans.passes.imports.ModuleNotFoundIssue;
import tntc.util.SourceLocation;

public class TopLevelIssueContextTest {

	@Test
	public void testEmpty() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertThat(ctx.hasErrors(), is(false));
		assertThat(ctx.format(), is("Detected 0 issue(s):"));
	}

	@Test
	public void testFormatsIssuesInReportingOrder() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		ctx.error(new ModuleNotFoundIssue("A", new SourceLocation("main.tnt", 2, 2, 4, 12)));
		ctx.withContext(new WhileResolvingModule("Main"))
				.error(new DefinitionNotFoundIssue("x", "B", SourceLocation.unknown()));

		assertThat(ctx.hasErrors(), is(true));
		assertThat(ctx.getIssues().size(), is(2));
		assertThat(ctx.format(), is(String.join(System.lineSeparator(),
				"Detected 2 issue(s):",
				"could not find module A at 3:5-12 in main.tnt",
				"while resolving names of module Main",
				"    could not find definition x in module B at unknown source location")));
	}
}
