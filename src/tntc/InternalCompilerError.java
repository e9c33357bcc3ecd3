package tntc;

/**
 * Raised when a pass finds the tree or table it was handed in a state earlier passes
 * should have ruled out. Never reported to users as an issue.
 */
public class InternalCompilerError extends RuntimeException {
	public InternalCompilerError() {
		super("internal compiler error");
	}

	public InternalCompilerError(String detail) {
		super("internal compiler error: " + detail);
	}

	public InternalCompilerError(Exception e) {
		super("internal compiler error", e);
	}
}
