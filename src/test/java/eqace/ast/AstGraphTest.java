package eqace.ast;

import org.junit.jupiter.api.Test;

import eqace.lexer.Notation;

import static eqace.ast.MathAST.*;
import static eqace.parser.ParserTest.parse;
import static org.junit.jupiter.api.Assertions.*;

public class AstGraphTest {

	@Test
	public void testDot(){
		ExprNode tree = parse("x^2 = 4", Notation.ASCII_MATH);
		String dot = new AstGraph("test", tree).toDot();
		assertTrue(dot.contains("digraph"));
		assertTrue(dot.contains(tree.id));
		assertTrue(dot.contains("rel:eq"));
	}

	@Test
	public void testLabel(){
		assertEquals("ident x", AstGraph.label(new IdentNode("x")));
		assertEquals("number 2\n#" + StableIds.hash("number:2"), AstGraph.label(StableIds.assign(new NumberNode("2"))));
		assertEquals("call:sin", AstGraph.label(new CallNode("sin", new IdentNode("x"))));
	}
}
