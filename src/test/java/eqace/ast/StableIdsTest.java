package eqace.ast;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import eqace.lexer.Notation;

import static eqace.ast.MathAST.*;
import static eqace.parser.ParserTest.parse;
import static org.junit.jupiter.api.Assertions.*;

public class StableIdsTest {

	@Test
	public void testHash(){
		assertEquals("1505", StableIds.hash(""));
		assertEquals("2b606", StableIds.hash("a"));
	}

	@ParameterizedTest
	@CsvSource(delimiter = '|', value = {
			"x^2        | power(ident:x,number:2)",
			"a - b      | add(ident:a,mul(number:-1,ident:b))",
			"sin(x) = 1 | rel:eq(call:sin(ident:x),number:1)",
			"d/dx x     | diff(ident:x,ident:x)"
	})
	public void testSignature(String input, String signature){
		assertEquals(signature, StableIds.signature(parse(input, Notation.ASCII_MATH)));
	}

	@Test
	public void testNamesAreEscaped(){
		assertEquals("ident:a\\,b\\(\\)", StableIds.signature(new IdentNode("a,b()")));
		assertNotEquals(StableIds.idOf(new CallNode("f", new IdentNode("x"))),
				StableIds.idOf(new IdentNode("f(ident:x)")));
	}

	@Test
	public void testDeterministic(){
		ExprNode first = parse("x^2 + 2x + 1 = 0", Notation.ASCII_MATH);
		ExprNode second = StableIds.assign(first);
		assertEquals(first.toPrettyString(), second.toPrettyString());
	}

	@Test
	public void testEqualSubtreesShareIds(){
		AddNode add = (AddNode) parse("x*x + x", Notation.ASCII_MATH);
		MulNode mul = (MulNode) add.terms.get(0);
		assertEquals(mul.factors.get(0).id, mul.factors.get(1).id);
		assertEquals(mul.factors.get(0).id, add.terms.get(1).id);
	}

	@Test
	public void testIdsDontDependOnTheContext(){
		PowerNode power = (PowerNode) parse("(a+b)^2", Notation.ASCII_MATH);
		assertEquals(parse("a+b", Notation.ASCII_MATH).id, power.base.id);
	}

	@Test
	public void testDifferentStructureDifferentId(){
		assertNotEquals(parse("a+b", Notation.ASCII_MATH).id, parse("b+a", Notation.ASCII_MATH).id);
		assertNotEquals(parse("a<b", Notation.ASCII_MATH).id, parse("a<=b", Notation.ASCII_MATH).id);
	}

	@Test
	public void testAssignDoesntModifyTheInput(){
		ExprNode tree = new PowerNode(new IdentNode("x"), new NumberNode("2"));
		ExprNode assigned = StableIds.assign(tree);
		assertNull(tree.id);
		assertEquals(tree, assigned);
		assertTrue(assigned.hasId());
	}
}
