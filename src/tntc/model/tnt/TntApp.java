package tntc.model.tnt;

import java.util.List;

import tntc.util.SourceLocation;

/**
 *
 * Operator application:
 *
 * opcode(arg1, arg2, ...)
 *
 */
public class TntApp extends TntExpression {

	private final String opcode;
	private final List<TntExpression> args;

	public TntApp(SourceLocation location, long id, String opcode, List<TntExpression> args) {
		super(location, id);
		this.opcode = opcode;
		this.args = args;
	}

	public String getOpcode() {
		return opcode;
	}

	public List<TntExpression> getArgs() {
		return args;
	}

	@Override
	public <T, E extends Throwable> T accept(TntExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((args == null) ? 0 : args.hashCode());
		result = prime * result + ((opcode == null) ? 0 : opcode.hashCode());
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		TntApp other = (TntApp) obj;
		if (args == null) {
			if (other.args != null)
				return false;
		} else if (!args.equals(other.args))
			return false;
		if (opcode == null) {
			return other.opcode == null;
		} else return opcode.equals(other.opcode);
	}

}
