package eqace.mathml;

import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

import eqace.ast.StableIds;
import eqace.lexer.Notation;
import eqace.parser.LinearRenderer;

import static eqace.ast.MathAST.*;
import static eqace.parser.ParserTest.parse;
import static org.junit.jupiter.api.Assertions.*;

public class PresentationRendererTest {

	static String render(String input){
		return PresentationRenderer.render(parse(input, Notation.ASCII_MATH));
	}

	@Test
	public void testRoot(){
		String presentation = render("x");
		assertTrue(presentation.startsWith("<math"));
		assertTrue(presentation.contains("display=\"block\""));
	}

	@Test
	public void testEveryElementCarriesAnId() throws Exception {
		String presentation = render("d/dx (x^2 - 3) = 2(x + 1)");
		Element root = MathMLDocuments.parse(presentation).getDocumentElement();
		for (Element child : MathMLDocuments.childElements(root)){
			assertAllHaveIds(child);
		}
	}

	@Test
	public void testBareNegationCarriesIds() throws Exception {
		String presentation = PresentationRenderer.render(new AddNode(new IdentNode("x"), new MulNode(new NumberNode("-1"))));
		Element root = MathMLDocuments.parse(presentation).getDocumentElement();
		for (Element child : MathMLDocuments.childElements(root)){
			assertAllHaveIds(child);
		}
		assertTrue(presentation.contains(">1</mn>"));
	}

	private void assertAllHaveIds(Element element){
		assertTrue(element.hasAttribute(PresentationRenderer.NODE_ID_ATTR), () -> "no id on <" + element.getTagName() + ">");
		for (Element child : MathMLDocuments.childElements(element)){
			assertAllHaveIds(child);
		}
	}

	@Test
	public void testIdsMatchTheTree(){
		assertTrue(render("x + 2").contains(String.format("%s=\"%s\"", PresentationRenderer.NODE_ID_ATTR,
				StableIds.idOf(new IdentNode("x")))));
	}

	@Test
	public void testIdsAreAssignedIfMissing(){
		String presentation = PresentationRenderer.render(new IdentNode("x"));
		assertTrue(presentation.contains(StableIds.idOf(new IdentNode("x"))));
	}

	@Test
	public void testSubtractionUsesMinus(){
		String presentation = render("x - 3");
		assertTrue(presentation.contains(">-</mo>"));
		assertFalse(presentation.contains(">+</mo>"));
		assertFalse(presentation.contains("-1"));
	}

	@Test
	public void testNegativeLiteralTerm(){
		String presentation = PresentationRenderer.render(new AddNode(new IdentNode("x"), new NumberNode("-3")));
		assertTrue(presentation.contains(">-</mo>"));
		assertTrue(presentation.contains(">3</mn>"));
		assertFalse(presentation.contains(">+</mo>"));
	}

	@Test
	public void testNegativeCoefficientTerm(){
		ExprNode sum = new AddNode(new IdentNode("x"), new MulNode(new NumberNode("-2"), new IdentNode("x")));
		String presentation = PresentationRenderer.render(sum);
		assertTrue(presentation.contains(">-</mo>"));
		assertTrue(presentation.contains(">2</mn>"));
		assertFalse(presentation.contains(">+</mo>"));
		assertFalse(presentation.contains("-2"));
		assertEquals("x - 2*x", LinearRenderer.render(sum));
	}

	@Test
	public void testPower(){
		String presentation = render("(a+b)^2");
		assertTrue(presentation.contains("<msup"));
		assertTrue(presentation.contains(">(</mo>"));
	}

	@Test
	public void testRelationGlyphs(){
		assertTrue(render("a < b").contains("&lt;"));
		assertTrue(render("a <= b").contains("≤"));
		assertTrue(render("a >= b").contains("≥"));
	}

	@Test
	public void testMultiplicationDot(){
		assertTrue(render("2x").contains(">" + PresentationRenderer.TIMES + "</mo>"));
	}

	@Test
	public void testDerivative(){
		String presentation = render("d/dx x^2");
		assertTrue(presentation.contains("<mfrac"));
		assertTrue(presentation.contains(">d</mi>"));
	}
}
