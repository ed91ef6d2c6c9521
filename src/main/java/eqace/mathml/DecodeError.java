package eqace.mathml;

import eqace.EquationException;

/**
 * The content form uses an unsupported tag or operator or contains a malformed element
 */
public class DecodeError extends EquationException {

	public DecodeError(String message) {
		super(message);
	}

	public DecodeError(String message, Throwable cause) {
		super(message, cause);
	}
}
