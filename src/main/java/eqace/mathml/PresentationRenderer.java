package eqace.mathml;

import java.util.ArrayList;
import java.util.List;

import org.w3c.dom.Document;
import org.w3c.dom.Element;

import eqace.ast.StableIds;

import static eqace.ast.MathAST.*;
import static eqace.mathml.MathMLDocuments.*;

/**
 * Renders trees as Presentation MathML in which every element carries the stable id of the node it
 * displays in the {@value #NODE_ID_ATTR} attribute. Elements that only exist for layout (operators,
 * parentheses, wrapping rows) carry the id of the node they belong to.
 * <p/>
 * Terms of a sum that are negative literals or products starting with a negative number are shown with a minus
 * sign instead of {@code + -b}, products use a visible multiplication dot.
 */
public class PresentationRenderer {

	public static final String NODE_ID_ATTR = "data-node-id";

	public static final String TIMES = "·";

	private PresentationRenderer(){
	}

	/**
	 * Renders the tree wrapped in a {@code <math display="block">} root, ids are assigned first if the
	 * tree doesn't have them
	 */
	public static String render(ExprNode tree){
		if (!tree.hasId()){
			tree = StableIds.assign(tree);
		}
		Document doc = newMathDocument();
		Element root = doc.getDocumentElement();
		root.setAttribute("display", "block");
		root.appendChild(tree.accept(new Renderer(doc)));
		return serialize(doc);
	}

	/**
	 * Base of a power that needs explicit parentheses
	 */
	static boolean needsParensAsBase(ExprNode base){
		return base instanceof AddNode || base instanceof RelationNode
				|| (base instanceof MulNode && ((MulNode) base).factors.size() > 1);
	}

	static boolean isNegativeNumber(ExprNode node){
		return node instanceof NumberNode && ((NumberNode) node).isNegative();
	}

	/**
	 * Products like {@code -2·x} that are shown as a subtraction inside sums
	 */
	static boolean hasNegativeCoefficient(MulNode mul){
		return isNegativeNumber(mul.factors.get(0));
	}

	private static class Renderer implements NodeVisitor<Element> {

		private final Document doc;

		Renderer(Document doc) {
			this.doc = doc;
		}

		private Element withId(Element element, String id){
			if (id != null){
				element.setAttribute(NODE_ID_ATTR, id);
			}
			return element;
		}

		private Element node(String name, ExprNode owner){
			return withId(element(doc, name), owner.id);
		}

		private Element mo(String text, ExprNode owner){
			return withId(textElement(doc, "mo", text), owner.id);
		}

		/**
		 * {@code ( inner )} as a row that belongs to the owner
		 */
		private Element parenthesized(Element inner, ExprNode owner){
			Element row = node("mrow", owner);
			row.appendChild(mo("(", owner));
			row.appendChild(inner);
			row.appendChild(mo(")", owner));
			return row;
		}

		/**
		 * Appends the factors separated by dots, sums and relations are parenthesized
		 */
		private void appendFactors(Element row, List<ExprNode> factors, ExprNode owner){
			for (int i = 0; i < factors.size(); i++){
				ExprNode factor = factors.get(i);
				if (i > 0){
					row.appendChild(mo(TIMES, owner));
				}
				Element rendered = factor.accept(this);
				boolean negativeInside = i > 0 && factor instanceof NumberNode && ((NumberNode) factor).isNegative();
				if (factor instanceof AddNode || factor instanceof RelationNode || negativeInside){
					rendered = parenthesized(rendered, factor);
				}
				row.appendChild(rendered);
			}
		}

		@Override
		public Element visit(IdentNode ident) {
			Element mi = node("mi", ident);
			mi.setTextContent(ident.name);
			return mi;
		}

		@Override
		public Element visit(NumberNode number) {
			Element mn = node("mn", number);
			mn.setTextContent(number.literal);
			return mn;
		}

		@Override
		public Element visit(PowerNode power) {
			Element msup = node("msup", power);
			Element base = power.base.accept(this);
			if (needsParensAsBase(power.base)){
				msup.appendChild(parenthesized(base, power.base));
			} else {
				Element row = node("mrow", power.base);
				row.appendChild(base);
				msup.appendChild(row);
			}
			msup.appendChild(power.exponent.accept(this));
			return msup;
		}

		@Override
		public Element visit(AddNode add) {
			Element row = node("mrow", add);
			for (int i = 0; i < add.terms.size(); i++){
				ExprNode term = add.terms.get(i);
				if (term instanceof NumberNode && ((NumberNode) term).isNegative()){
					row.appendChild(mo("-", add));
					row.appendChild(((NumberNode) term).abs().accept(this));
				} else if (term instanceof MulNode && hasNegativeCoefficient((MulNode) term)){
					row.appendChild(mo("-", add));
					List<ExprNode> factors = negatedFactors((MulNode) term);
					Element inner = node("mrow", term);
					appendFactors(inner, factors, term);
					if (isNegativeNumber(factors.get(0))){
						inner = parenthesized(inner, term);
					}
					row.appendChild(inner);
				} else {
					if (i > 0){
						row.appendChild(mo("+", add));
					}
					row.appendChild(term.accept(this));
				}
			}
			return row;
		}

		/**
		 * Factors of {@code -c·x} as {@code c·x}, the {@code -1} of a negation is dropped completely
		 */
		private List<ExprNode> negatedFactors(MulNode mul){
			if (mul.isNegation()){
				return mul.negatedFactors();
			}
			List<ExprNode> factors = new ArrayList<>(mul.factors);
			factors.set(0, ((NumberNode) factors.get(0)).abs());
			return factors;
		}

		@Override
		public Element visit(MulNode mul) {
			Element row = node("mrow", mul);
			appendFactors(row, mul.factors, mul);
			return row;
		}

		@Override
		public Element visit(CallNode call) {
			Element row = node("mrow", call);
			Element name = node("mi", call);
			name.setTextContent(call.func);
			row.appendChild(name);
			row.appendChild(mo("(", call));
			row.appendChild(call.arg.accept(this));
			row.appendChild(mo(")", call));
			return row;
		}

		@Override
		public Element visit(RelationNode relation) {
			Element row = node("mrow", relation);
			row.appendChild(relation.left.accept(this));
			row.appendChild(mo(relation.op.glyph, relation));
			row.appendChild(relation.right.accept(this));
			return row;
		}

		@Override
		public Element visit(DerivativeNode derivative) {
			Element row = node("mrow", derivative);
			Element frac = node("mfrac", derivative);
			Element numerator = node("mi", derivative);
			numerator.setTextContent("d");
			frac.appendChild(numerator);
			Element denominator = node("mrow", derivative);
			Element d = node("mi", derivative);
			d.setTextContent("d");
			denominator.appendChild(d);
			denominator.appendChild(derivative.variable.accept(this));
			frac.appendChild(denominator);
			row.appendChild(frac);
			row.appendChild(mo("\u00A0", derivative));
			row.appendChild(mo("(", derivative));
			row.appendChild(derivative.arg.accept(this));
			row.appendChild(mo(")", derivative));
			return row;
		}
	}
}
