package eqace.mathml;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

import eqace.ast.StableIds;

import static eqace.ast.MathAST.*;
import static eqace.mathml.MathMLDocuments.*;

/**
 * Converts trees to Content MathML and back.
 * <p/>
 * Mapping: identifiers are {@code <ci>}, numbers {@code <cn>}, everything else is an {@code <apply>}
 * with {@code <power/>}, {@code <plus/>}, {@code <times/>}, a relation tag, {@code <diff/>} or the function.
 * Calls of the functions in {@link #KNOWN_FUNCTIONS} use the MathML operator element, others a
 * {@code <ci>} head. {@code decode(encode(t))} equals {@code t} for every tree the parser produces.
 */
public class ContentCodec {

	/**
	 * Functions that have their own Content MathML element, matched case sensitive
	 */
	public static final Set<String> KNOWN_FUNCTIONS = Collections.unmodifiableSet(
			new HashSet<>(Arrays.asList("sin", "cos", "tan", "exp", "ln", "log")));

	private ContentCodec(){
	}

	/**
	 * Encodes the tree wrapped in a {@code <math>} root
	 */
	public static String encode(ExprNode tree){
		Document doc = newMathDocument();
		doc.getDocumentElement().appendChild(tree.accept(new Encoder(doc)));
		return serialize(doc);
	}

	private static class Encoder implements NodeVisitor<Element> {

		private final Document doc;

		Encoder(Document doc) {
			this.doc = doc;
		}

		private Element apply(String head, List<ExprNode> args){
			return apply(element(doc, head), args);
		}

		private Element apply(Element head, List<ExprNode> args){
			Element apply = element(doc, "apply");
			apply.appendChild(head);
			for (ExprNode arg : args){
				apply.appendChild(arg.accept(this));
			}
			return apply;
		}

		@Override
		public Element visit(IdentNode ident) {
			return textElement(doc, "ci", ident.name);
		}

		@Override
		public Element visit(NumberNode number) {
			return textElement(doc, "cn", number.literal);
		}

		@Override
		public Element visit(PowerNode power) {
			return apply("power", power.children());
		}

		@Override
		public Element visit(AddNode add) {
			return apply("plus", add.terms);
		}

		@Override
		public Element visit(MulNode mul) {
			return apply("times", mul.factors);
		}

		@Override
		public Element visit(CallNode call) {
			if (KNOWN_FUNCTIONS.contains(call.func)){
				return apply(call.func, call.children());
			}
			return apply(textElement(doc, "ci", call.func), call.children());
		}

		@Override
		public Element visit(RelationNode relation) {
			return apply(relation.op.contentTag, relation.children());
		}

		@Override
		public Element visit(DerivativeNode derivative) {
			return apply("diff", derivative.children());
		}
	}

	/**
	 * Decodes a content form into a tree without stable ids.
	 * <p/>
	 * Tolerated deviations: a missing {@code <math>} root, unknown elements with a single child element
	 * (decoded as that child) and unknown text only elements (decoded as a number if they consist of
	 * digits, as an identifier otherwise).
	 *
	 * @throws DecodeError for malformed XML, empty or malformed elements and unsupported tags or operators
	 */
	public static ExprNode decode(String content){
		Element root = parseRoot(content).getDocumentElement();
		if (localName(root).equals("math")){
			List<Element> children = childElements(root);
			if (children.size() != 1){
				throw new DecodeError(String.format("<math> has to contain exactly one expression, found %d", children.size()));
			}
			return decodeElement(children.get(0));
		}
		return decodeElement(root);
	}

	/**
	 * Decodes the content form and assigns stable ids
	 */
	public static ExprNode decodeWithIds(String content){
		return StableIds.assign(decode(content));
	}

	private static Document parseRoot(String content){
		if (content == null || content.trim().isEmpty()){
			throw new DecodeError("Empty MathML content");
		}
		try {
			return parse(content);
		} catch (SAXException e) {
			// several top level elements without a root
			try {
				return parse(String.format("<math xmlns=\"%s\">%s</math>", MATH_NS, content));
			} catch (SAXException e2) {
				throw new DecodeError("Invalid MathML content: " + e.getMessage(), e);
			}
		}
	}

	private static ExprNode decodeElement(Element element){
		String tag = localName(element);
		switch (tag){
			case "ci": {
				String name = element.getTextContent().trim();
				if (name.isEmpty()){
					throw new DecodeError("Empty <ci> element");
				}
				return new IdentNode(name);
			}
			case "cn": {
				String literal = element.getTextContent().trim();
				if (!NumberNode.isValidLiteral(literal)){
					throw new DecodeError(String.format("Invalid number \"%s\" in <cn> element", literal));
				}
				return new NumberNode(literal);
			}
			case "apply":
				return decodeApply(element);
			default:
				List<Element> children = childElements(element);
				if (children.size() == 1){
					return decodeElement(children.get(0));
				}
				String text = element.getTextContent().trim();
				if (children.isEmpty() && !text.isEmpty()){
					if (text.matches("[0-9]+")){
						return new NumberNode(text);
					}
					return new IdentNode(text);
				}
				throw new DecodeError(String.format("Unsupported tag: %s", tag));
		}
	}

	private static ExprNode decodeApply(Element apply){
		List<Element> children = childElements(apply);
		if (children.isEmpty()){
			throw new DecodeError("Empty <apply> element");
		}
		Element head = children.get(0);
		String operator = localName(head);
		List<ExprNode> args = new ArrayList<>();
		for (Element child : children.subList(1, children.size())){
			args.add(decodeElement(child));
		}
		switch (operator){
			case "power":
				checkArity(operator, args, 2);
				return new PowerNode(args.get(0), args.get(1));
			case "plus":
				checkNonEmpty(operator, args);
				return new AddNode(args);
			case "times":
				checkNonEmpty(operator, args);
				return new MulNode(args);
			case "diff":
				checkArity(operator, args, 2);
				if (args.get(0) instanceof IdentNode){
					return new DerivativeNode((IdentNode)args.get(0), args.get(1));
				}
				if (args.get(1) instanceof IdentNode){
					return new DerivativeNode((IdentNode)args.get(1), args.get(0));
				}
				throw new DecodeError("Unsupported operator: <diff/> needs an identifier as variable");
			case "ci": {
				checkArity(operator, args, 1);
				String func = head.getTextContent().trim();
				if (func.isEmpty()){
					throw new DecodeError("Empty function name in <ci> element");
				}
				return new CallNode(func, args.get(0));
			}
			default:
				if (KNOWN_FUNCTIONS.contains(operator)){
					checkArity(operator, args, 1);
					return new CallNode(operator, args.get(0));
				}
				RelationOperator relation = RelationOperator.forContentTag(operator);
				if (relation != null){
					checkArity(operator, args, 2);
					return new RelationNode(relation, args.get(0), args.get(1));
				}
				throw new DecodeError(String.format("Unsupported operator: %s", operator));
		}
	}

	private static void checkArity(String operator, List<ExprNode> args, int expected){
		if (args.size() != expected){
			throw new DecodeError(String.format("<%s/> expects %d arguments, got %d", operator, expected, args.size()));
		}
	}

	private static void checkNonEmpty(String operator, List<ExprNode> args){
		if (args.isEmpty()){
			throw new DecodeError(String.format("<%s/> without arguments", operator));
		}
	}
}
