package eqace.rewrite;

public enum OperationKind {
	ADD("add", true),
	SUBTRACT("subtract", true),
	MULTIPLY("multiply", true),
	DIVIDE("divide", true),
	EXPONENTIATE("exponentiate", true),
	FUNCTION_APPLY("functionApply", false),
	REWRITE_IDENTITY("rewriteIdentity", true),
	SUBSTITUTE("substitute", true);

	public final String name;

	/**
	 * Does the operation need an operand node?
	 */
	public final boolean needsOperand;

	OperationKind(String name, boolean needsOperand){
		this.name = name;
		this.needsOperand = needsOperand;
	}

	/**
	 * Operations that can be applied to both sides of a relation without changing its truth
	 */
	public boolean isMirrorable(){
		return this != REWRITE_IDENTITY;
	}

	public static OperationKind forName(String name){
		for (OperationKind kind : values()){
			if (kind.name.equals(name)){
				return kind;
			}
		}
		throw new OperationContractViolation(String.format("Unknown operation \"%s\"", name));
	}
}
