package eqace;

/**
 * Base class of all exceptions thrown by the expression engine.
 */
public class EquationException extends RuntimeException {

	public EquationException(String message) {
		super(message);
	}

	public EquationException(String message, Throwable cause) {
		super(message, cause);
	}
}
