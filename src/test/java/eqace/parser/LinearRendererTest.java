package eqace.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import eqace.lexer.Notation;

import static eqace.ast.MathAST.*;
import static eqace.parser.ParserTest.parse;
import static org.junit.jupiter.api.Assertions.*;

public class LinearRendererTest {

	@ParameterizedTest
	@CsvSource(delimiter = '|', value = {
			"1 - cos(x)^2   | 1 - cos(x)^2",
			"(a+b)^2        | (a + b)^2",
			"x+2=7          | x + 2 = 7",
			"2x             | 2*x",
			"a - b - c      | a - b - c",
			"2(a + b)       | 2*(a + b)",
			"sin(x)         | sin(x)",
			"d/dx x^2       | d/dx (x^2)",
			"a <= b         | a <= b",
			"(x^2)^3        | (x^2)^3"
	})
	public void testAsciiMath(String input, String expected){
		assertEquals(expected, LinearRenderer.render(parse(input, Notation.ASCII_MATH)));
	}

	@ParameterizedTest
	@ValueSource(strings = {"1 - cos(x)^2", "(a + b)^2", "x + 2 = 7", "a - b*c", "d/dx (x^2 + 1)", "f(x)^(a + 1)"})
	public void testReparse(String input){
		ExprNode tree = parse(input, Notation.ASCII_MATH);
		assertEquals(tree, parse(LinearRenderer.render(tree), Notation.ASCII_MATH));
	}

	@Test
	public void testDivision(){
		assertEquals("a*b^(-1)", LinearRenderer.render(parse("a / b", Notation.PLAIN_TEXT)));
	}

	@Test
	public void testNegativeLiteralTerm(){
		assertEquals("x - 3", LinearRenderer.render(new AddNode(new IdentNode("x"), new NumberNode("-3"))));
	}

	@Test
	public void testNoDoubleSigns(){
		ExprNode tree = new AddNode(new IdentNode("a"), MulNode.negation(new NumberNode("-3")));
		String rendered = LinearRenderer.render(tree);
		assertEquals("a - (-3)", rendered);
		assertFalse(rendered.contains("+ -"));
		assertFalse(rendered.contains("--"));
	}

	@Test
	public void testNegativeFactor(){
		assertEquals("x*(-2)", LinearRenderer.render(new MulNode(new IdentNode("x"), new NumberNode("-2"))));
	}

	@Test
	public void testNoDoubleStars(){
		String rendered = LinearRenderer.render(parse("2x^2", Notation.ASCII_MATH));
		assertEquals("2*x^2", rendered);
		assertFalse(rendered.contains("**"));
	}
}
