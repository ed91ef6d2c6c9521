package eqace.rewrite;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static eqace.ast.MathAST.*;

/**
 * Structural arithmetic on trees with folding of number literals.
 * Folding is exact: integers and decimals of any length are combined with {@link BigDecimal}.
 */
class Arithmetic {

	private Arithmetic(){
	}

	/**
	 * Flattens nested sums into one term list and sums up all number terms into one trailing term
	 * (dropped if it is zero). A single remaining term replaces the sum.
	 */
	static ExprNode add(ExprNode node, ExprNode operand){
		List<ExprNode> terms = new ArrayList<>();
		flattenTerms(node, terms);
		flattenTerms(operand, terms);
		List<ExprNode> result = new ArrayList<>();
		List<NumberNode> numbers = new ArrayList<>();
		BigDecimal sum = BigDecimal.ZERO;
		for (ExprNode term : terms){
			if (term instanceof NumberNode){
				numbers.add((NumberNode) term);
				sum = sum.add(((NumberNode) term).decimalValue());
			} else {
				result.add(term);
			}
		}
		if (sum.signum() != 0){
			// a lone literal is kept as written
			result.add(numbers.size() == 1 ? numbers.get(0) : NumberNode.of(sum));
		}
		if (result.isEmpty()){
			return new NumberNode("0");
		}
		if (result.size() == 1){
			return result.get(0);
		}
		return new AddNode(result);
	}

	/**
	 * Negated literal for numbers, {@code Mul(-1, node)} otherwise
	 */
	static ExprNode negate(ExprNode node){
		if (node instanceof NumberNode){
			return ((NumberNode) node).negate();
		}
		return MulNode.negation(node);
	}

	/**
	 * Flattens nested products and folds all number factors into one leading coefficient
	 */
	static ExprNode multiply(ExprNode node, ExprNode operand){
		List<ExprNode> factors = new ArrayList<>();
		flattenFactors(node, factors);
		flattenFactors(operand, factors);
		return fold(coefficient(factors), factors);
	}

	/**
	 * Divides the coefficient if the operand is an integer that divides it,
	 * multiplies with {@code operand^(-1)} otherwise
	 */
	static ExprNode divide(ExprNode node, ExprNode operand){
		if (isInteger(operand) && !((NumberNode) operand).isZero()){
			BigDecimal divisor = ((NumberNode) operand).decimalValue();
			List<ExprNode> factors = new ArrayList<>();
			flattenFactors(node, factors);
			BigDecimal coefficient = coefficient(factors);
			if (coefficient.remainder(divisor).signum() == 0){
				return fold(coefficient.divide(divisor), factors);
			}
		}
		return multiply(node, new PowerNode(operand, new NumberNode("-1")));
	}

	/**
	 * {@code node ^ operand}, exponent 1 is dropped and integer exponents of powers are multiplied
	 */
	static ExprNode exponentiate(ExprNode node, ExprNode operand){
		if (isInteger(operand) && ((NumberNode) operand).integerValue().equals(BigInteger.ONE)){
			return node;
		}
		if (node instanceof PowerNode && isInteger(((PowerNode) node).exponent) && isInteger(operand)){
			BigInteger inner = ((NumberNode) ((PowerNode) node).exponent).integerValue();
			BigInteger exponent = inner.multiply(((NumberNode) operand).integerValue());
			if (exponent.equals(BigInteger.ONE)){
				return ((PowerNode) node).base;
			}
			return new PowerNode(((PowerNode) node).base, new NumberNode(exponent.toString()));
		}
		return new PowerNode(node, operand);
	}

	/**
	 * Replaces every occurrence of the identifier, untouched subtrees are shared
	 */
	static ExprNode substitute(ExprNode node, String variable, ExprNode value){
		if (node instanceof IdentNode){
			return ((IdentNode) node).name.equals(variable) ? value : node;
		}
		List<ExprNode> children = node.children();
		List<ExprNode> newChildren = new ArrayList<>();
		boolean changed = false;
		for (ExprNode child : children){
			ExprNode newChild = child;
			// the variable of a derivative is a binder and not an occurrence
			if (!(node instanceof DerivativeNode && child == ((DerivativeNode) node).variable)){
				newChild = substitute(child, variable, value);
			}
			changed |= newChild != child;
			newChildren.add(newChild);
		}
		return changed ? node.withChildren(newChildren) : node;
	}

	static boolean isInteger(ExprNode node){
		return node instanceof NumberNode && ((NumberNode) node).isInteger();
	}

	/**
	 * The coefficient followed by the non number factors, 0 and 1 coefficients are simplified
	 */
	private static ExprNode fold(BigDecimal coefficient, List<ExprNode> factors){
		if (coefficient.signum() == 0){
			return new NumberNode("0");
		}
		List<ExprNode> result = new ArrayList<>();
		if (coefficient.compareTo(BigDecimal.ONE) != 0){
			result.add(NumberNode.of(coefficient));
		}
		for (ExprNode factor : factors){
			if (!(factor instanceof NumberNode)){
				result.add(factor);
			}
		}
		if (result.isEmpty()){
			return new NumberNode("1");
		}
		if (result.size() == 1){
			return result.get(0);
		}
		return new MulNode(result);
	}

	/**
	 * Product of the number factors, 1 if there are none
	 */
	private static BigDecimal coefficient(List<ExprNode> factors){
		BigDecimal coefficient = BigDecimal.ONE;
		for (ExprNode factor : factors){
			if (factor instanceof NumberNode){
				coefficient = coefficient.multiply(((NumberNode) factor).decimalValue());
			}
		}
		return coefficient;
	}

	private static void flattenTerms(ExprNode node, List<ExprNode> terms){
		if (node instanceof AddNode){
			for (ExprNode term : ((AddNode) node).terms){
				flattenTerms(term, terms);
			}
		} else {
			terms.add(node);
		}
	}

	private static void flattenFactors(ExprNode node, List<ExprNode> factors){
		if (node instanceof MulNode){
			for (ExprNode factor : ((MulNode) node).factors){
				flattenFactors(factor, factors);
			}
		} else {
			factors.add(node);
		}
	}
}
