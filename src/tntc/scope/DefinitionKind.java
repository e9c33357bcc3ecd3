package tntc.scope;

/**
 * What kind of declaration introduced a name in the value namespace
 */
public enum DefinitionKind {
	CONST("const"),
	VAR("var"),
	DEF("def"),
	PARAM("param"),
	ASSUMPTION("assumption"),
	MODULE("module");

	private final String name;

	DefinitionKind(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}
}
