package eqace.parser;

import java.util.List;

import static eqace.ast.MathAST.*;

/**
 * Prints trees in the editable linear notation, the inverse of the {@link Parser}.
 * <p/>
 * Negative literals and products starting with {@code -1} are printed with a minus sign, so that the
 * internal encoding of subtraction never shows up: {@code Add(a, Mul(-1, b))} becomes {@code a - b}.
 */
public class LinearRenderer implements NodeVisitor<String> {

	private static final LinearRenderer INSTANCE = new LinearRenderer();

	private LinearRenderer(){
	}

	public static String render(ExprNode node){
		return node.accept(INSTANCE);
	}

	private static String parenthesize(String str){
		return "(" + str + ")";
	}

	private String renderFactors(List<ExprNode> factors){
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < factors.size(); i++){
			ExprNode factor = factors.get(i);
			String rendered = factor.accept(this);
			if (factor instanceof AddNode || factor instanceof RelationNode || (i > 0 && rendered.startsWith("-"))){
				rendered = parenthesize(rendered);
			}
			if (i > 0){
				builder.append("*");
			}
			builder.append(rendered);
		}
		return builder.toString();
	}

	/**
	 * Factors after the leading {@code -1}, parenthesized if they start with a sign themselves
	 */
	private String renderNegated(MulNode mul){
		String rendered = renderFactors(mul.negatedFactors());
		return rendered.startsWith("-") ? parenthesize(rendered) : rendered;
	}

	@Override
	public String visit(IdentNode ident) {
		return ident.name;
	}

	@Override
	public String visit(NumberNode number) {
		return number.literal;
	}

	@Override
	public String visit(PowerNode power) {
		ExprNode base = power.base;
		String baseStr = base.accept(this);
		if (base instanceof AddNode || base instanceof MulNode || base instanceof RelationNode
				|| base instanceof PowerNode || baseStr.startsWith("-")){
			baseStr = parenthesize(baseStr);
		}
		String exponentStr = power.exponent.accept(this);
		if (!power.exponent.isAtom() || exponentStr.startsWith("-")){
			exponentStr = parenthesize(exponentStr);
		}
		return baseStr + "^" + exponentStr;
	}

	@Override
	public String visit(AddNode add) {
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < add.terms.size(); i++){
			ExprNode term = add.terms.get(i);
			String rendered;
			boolean negative;
			if (term instanceof NumberNode && ((NumberNode) term).isNegative()){
				rendered = ((NumberNode) term).abs().literal;
				negative = true;
			} else if (term instanceof MulNode && ((MulNode) term).isNegation()){
				rendered = renderNegated((MulNode) term);
				negative = true;
			} else {
				rendered = term.accept(this);
				if (term instanceof AddNode || term instanceof RelationNode){
					rendered = parenthesize(rendered);
				}
				negative = rendered.startsWith("-");
				if (negative){
					rendered = rendered.substring(1);
				}
			}
			if (i == 0){
				builder.append(negative ? "-" : "");
			} else {
				builder.append(negative ? " - " : " + ");
			}
			builder.append(rendered);
		}
		return builder.toString();
	}

	@Override
	public String visit(MulNode mul) {
		if (mul.isNegation()){
			return "-" + renderNegated(mul);
		}
		return renderFactors(mul.factors);
	}

	@Override
	public String visit(CallNode call) {
		return call.func + parenthesize(call.arg.accept(this));
	}

	@Override
	public String visit(RelationNode relation) {
		return relation.left.accept(this) + " " + relation.op.symbol + " " + relation.right.accept(this);
	}

	@Override
	public String visit(DerivativeNode derivative) {
		return "d/d" + derivative.variable.name + " " + parenthesize(derivative.arg.accept(this));
	}
}
