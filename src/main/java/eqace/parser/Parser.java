package eqace.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import eqace.Config;
import eqace.ast.StableIds;
import eqace.lexer.*;

import static eqace.ast.MathAST.*;
import static eqace.lexer.TokenType.*;

/**
 * Recursive descent parser for both input notations.
 * <p/>
 * Grammar:
 * <pre>
 * Expr     := Relation
 * Relation := Add ( relOp Add )?
 * Add      := Mul ( ('+'|'-') Mul )*
 * Mul      := Power ( '*' Power | '/' Power | AdjacentPower )*
 * Power    := Unary ('^' Power)?
 * Unary    := ('+'|'-')? Primary
 * Primary  := Derivative | FunctionCall | Ident | Number | '(' Expr ')'
 * </pre>
 * Unary signs and '/' division only exist in {@link Notation#PLAIN_TEXT}. The nesting depth is limited
 * by {@link Config#getMaxDepth()}, deeper input is reported as a parse error. Subtraction and negation are
 * encoded as {@code Mul(-1, operand)}, division by {@code b} as the factor {@code Power(b, -1)}.
 */
public class Parser {

	public static final Logger LOG = Logger.getLogger("Parser");

	private final Lexer lexer;
	private final Notation notation;
	private final int nearTextLength;
	private final int maxDepth;
	private int depth = 0;

	public Parser(String input, Notation notation) {
		this(input, notation, Config.getNearTextLength(), Config.getMaxDepth());
	}

	/**
	 * @param maxDepth maximum number of nested parentheses, unary signs and powers
	 */
	public Parser(String input, Notation notation, int nearTextLength, int maxDepth) {
		this.lexer = new MathLexer(input, notation);
		this.notation = notation;
		this.nearTextLength = nearTextLength;
		this.maxDepth = maxDepth;
	}

	/**
	 * Parses the input and produces the canonical tree with its content and presentation forms.
	 * Never throws on bad input, errors are returned as {@link ParseResult.Err}.
	 */
	public static ParseResult parse(String input, Notation notation){
		try {
			return ParseResult.ok(StableIds.assign(new Parser(input, notation).parseExpression()));
		} catch (ParserError error) {
			LOG.fine(() -> String.format("Can't parse \"%s\": %s", input, error.getMessage()));
			return ParseResult.error(error.plainMessage, error.index, error.nearText);
		}
	}

	public static ParseResult parse(String input){
		return parse(input, Config.getNotation());
	}

	/**
	 * Parses the whole input into a tree without stable ids
	 *
	 * @throws ParserError if the input isn't a complete expression
	 */
	public ExprNode parseExpression(){
		if (lexer.getInput().trim().isEmpty()){
			throw new ParserError(0, "", "Empty input");
		}
		ExprNode expression = parseRelation();
		if (!cur().is(EOF)){
			throw error("Unexpected input");
		}
		return expression;
	}

	private ExprNode parseRelation(){
		ExprNode left = parseAdd();
		if (cur().type.isRelation()){
			RelationOperator op = RelationOperator.forSymbol(cur().value);
			next();
			ExprNode right = parseAdd();
			if (cur().type.isRelation()){
				throw error("Only one relation per expression is supported");
			}
			return new RelationNode(op, left, right);
		}
		return left;
	}

	private ExprNode parseAdd(){
		ExprNode left = parseMul();
		List<ExprNode> terms = new ArrayList<>();
		terms.add(left);
		while (cur().is(PLUS) || cur().is(MINUS)){
			boolean minus = cur().is(MINUS);
			next();
			ExprNode right = parseMul();
			terms.add(minus ? MulNode.negation(right) : right);
		}
		if (terms.size() == 1){
			return left;
		}
		return new AddNode(terms);
	}

	private ExprNode parseMul(){
		ExprNode left = parsePower();
		List<ExprNode> factors = new ArrayList<>();
		factors.add(left);
		while (true){
			if (cur().is(MULTIPLY)){
				next();
				factors.add(parsePower());
			} else if (cur().is(DIVIDE) && notation.division){
				next();
				factors.add(new PowerNode(parsePower(), new NumberNode("-1")));
			} else if (cur().is(IDENT) || cur().is(NUMBER) || cur().is(LPAREN)){
				// implicit multiplication: 2x, x(y), )(
				factors.add(parsePower());
			} else {
				break;
			}
		}
		if (factors.size() == 1){
			return left;
		}
		return new MulNode(factors);
	}

	private ExprNode parsePower(){
		enter();
		try {
			ExprNode base = parseUnary();
			if (cur().is(CARET)){
				next();
				return new PowerNode(base, parsePower());
			}
			return base;
		} finally {
			depth--;
		}
	}

	private ExprNode parseUnary(){
		enter();
		try {
			if (notation.unarySigns){
				if (cur().is(PLUS)){
					next();
					return parseUnary();
				}
				if (cur().is(MINUS)){
					next();
					return MulNode.negation(parseUnary());
				}
			}
			return parsePrimary();
		} finally {
			depth--;
		}
	}

	/**
	 * Every recursion of the grammar passes here, so the depth bounds the stack usage
	 */
	private void enter(){
		if (++depth > maxDepth){
			depth--;
			throw error("Expression is nested too deeply");
		}
	}

	private ExprNode parsePrimary(){
		Token token = cur();
		switch (token.type){
			case IDENT:
				if (isDerivativeStart()){
					return parseDerivative();
				}
				next();
				if (cur().is(LPAREN)){
					next();
					ExprNode arg = parseRelation();
					expect(RPAREN);
					return new CallNode(token.value, arg);
				}
				return new IdentNode(token.value);
			case NUMBER:
				next();
				return new NumberNode(token.value);
			case LPAREN:
				next();
				ExprNode expression = parseRelation();
				expect(RPAREN);
				return expression;
			case EOF:
				throw error("Unexpected end of input, expected an operand");
			default:
				throw error(String.format("Expected an operand but got \"%s\"", token.value));
		}
	}

	/**
	 * {@code d / d<var>} with a letter only variable name
	 */
	private boolean isDerivativeStart(){
		Token d = cur();
		Token slash = lexer.lookahead(1);
		Token dVar = lexer.lookahead(2);
		return d.value.equalsIgnoreCase("d") && slash.is(DIVIDE) && dVar.is(IDENT)
				&& dVar.value.length() >= 2 && Character.toLowerCase(dVar.value.charAt(0)) == 'd'
				&& Notation.isLetters(dVar.value.substring(1));
	}

	/**
	 * The argument is either a parenthesized expression or a single power, so that {@code d/dx x^2} works
	 */
	private ExprNode parseDerivative(){
		next();
		next();
		IdentNode variable = new IdentNode(cur().value.substring(1));
		next();
		ExprNode arg;
		if (cur().is(LPAREN)){
			next();
			arg = parseRelation();
			expect(RPAREN);
		} else {
			arg = parsePower();
		}
		return new DerivativeNode(variable, arg);
	}

	private void expect(TokenType type){
		if (!cur().is(type)){
			throw error(String.format("Expected \"%s\"", type.representation));
		}
		next();
	}

	private Token cur(){
		return lexer.cur();
	}

	private void next(){
		lexer.next();
	}

	private ParserError error(String message){
		return ParserError.at(cur(), lexer.getInput(), nearTextLength, message);
	}
}
