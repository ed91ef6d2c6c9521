package eqace.rewrite;

import eqace.EquationException;

/**
 * An operation was applied with an operand of the wrong shape, this is a bug at the call site
 */
public class OperationContractViolation extends EquationException {

	public OperationContractViolation(String message) {
		super(message);
	}
}
