package eqace.rewrite;

import java.util.Objects;
import java.util.regex.Pattern;

import eqace.parser.LinearRenderer;

import static eqace.ast.MathAST.*;

/**
 * An algebraic operation that is applied once to a subtree and then discarded, only its effect and its
 * {@link #ruleName()} end up in the step history.
 * <p/>
 * The constructor checks the shape of the operand, an operation that exists is well formed.
 */
public class Operation {

	private static final Pattern FUNCTION_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

	public final OperationKind kind;

	/**
	 * {@code null} for {@link OperationKind#FUNCTION_APPLY}
	 */
	public final ExprNode operand;

	/**
	 * Only set for {@link OperationKind#FUNCTION_APPLY}
	 */
	public final String funcName;

	public Operation(OperationKind kind, ExprNode operand, String funcName) {
		this.kind = Objects.requireNonNull(kind);
		this.operand = operand;
		this.funcName = funcName;
		check();
	}

	public static Operation add(ExprNode operand){
		return new Operation(OperationKind.ADD, operand, null);
	}

	public static Operation subtract(ExprNode operand){
		return new Operation(OperationKind.SUBTRACT, operand, null);
	}

	public static Operation multiply(ExprNode operand){
		return new Operation(OperationKind.MULTIPLY, operand, null);
	}

	public static Operation divide(ExprNode operand){
		return new Operation(OperationKind.DIVIDE, operand, null);
	}

	public static Operation exponentiate(ExprNode operand){
		return new Operation(OperationKind.EXPONENTIATE, operand, null);
	}

	public static Operation functionApply(String funcName){
		return new Operation(OperationKind.FUNCTION_APPLY, null, funcName);
	}

	public static Operation rewriteIdentity(ExprNode replacement){
		return new Operation(OperationKind.REWRITE_IDENTITY, replacement, null);
	}

	/**
	 * @param binding {@code variable = value}
	 */
	public static Operation substitute(ExprNode binding){
		return new Operation(OperationKind.SUBSTITUTE, binding, null);
	}

	public static Operation substitute(String variable, ExprNode value){
		return substitute(new RelationNode(RelationOperator.EQ, new IdentNode(variable), value));
	}

	private void check(){
		if (kind.needsOperand && operand == null){
			throw new OperationContractViolation(String.format("%s needs an operand", kind.name));
		}
		switch (kind){
			case FUNCTION_APPLY:
				if (funcName == null || !FUNCTION_NAME.matcher(funcName).matches()){
					throw new OperationContractViolation(String.format("functionApply needs a function name, got \"%s\"", funcName));
				}
				break;
			case SUBSTITUTE:
				if (!(operand instanceof RelationNode) || ((RelationNode) operand).op != RelationOperator.EQ
						|| !(((RelationNode) operand).left instanceof IdentNode)){
					throw new OperationContractViolation("substitute needs an operand of the form variable = value, got " + operand);
				}
				checkNoRelation(((RelationNode) operand).right);
				break;
			case DIVIDE:
				checkNoRelation(operand);
				if (operand instanceof NumberNode && ((NumberNode) operand).isZero()){
					throw new OperationContractViolation("Division by zero");
				}
				break;
			case REWRITE_IDENTITY:
				// a restatement may replace a whole relation
				break;
			default:
				if (operand != null){
					checkNoRelation(operand);
				}
		}
	}

	private void checkNoRelation(ExprNode node){
		if (node instanceof RelationNode){
			throw new OperationContractViolation(String.format("The operand of %s must not contain a relation: %s", kind.name, node));
		}
		for (ExprNode child : node.children()){
			checkNoRelation(child);
		}
	}

	/**
	 * Human readable name of the rule, stored with the step that this operation produces
	 */
	public String ruleName(){
		switch (kind){
			case ADD:
				return "add " + LinearRenderer.render(operand);
			case SUBTRACT:
				return "subtract " + LinearRenderer.render(operand);
			case MULTIPLY:
				return "multiply by " + LinearRenderer.render(operand);
			case DIVIDE:
				return "divide by " + LinearRenderer.render(operand);
			case EXPONENTIATE:
				return "raise to " + LinearRenderer.render(operand);
			case FUNCTION_APPLY:
				return "apply " + funcName;
			case SUBSTITUTE:
				return "substitute " + LinearRenderer.render(operand);
			default:
				return "rewrite as " + LinearRenderer.render(operand);
		}
	}

	@Override
	public String toString() {
		return ruleName();
	}
}
