package eqace.session;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import eqace.EquationException;
import eqace.lexer.Notation;
import eqace.mathml.ContentCodec;
import eqace.parser.LinearRenderer;
import eqace.parser.ParseResult;
import eqace.parser.Parser;
import eqace.rewrite.*;

import static eqace.ast.MathAST.*;
import static org.junit.jupiter.api.Assertions.*;

public class DerivationTest {

	static Derivation derivation(String input, boolean mirrored){
		Derivation derivation = new Derivation(Notation.ASCII_MATH, new RewriteEngine(mirrored));
		assertTrue(derivation.begin(input).isOk());
		return derivation;
	}

	static String current(Derivation derivation){
		return LinearRenderer.render(derivation.current().tree);
	}

	@Test
	public void testBegin(){
		Derivation derivation = new Derivation(Notation.ASCII_MATH, new RewriteEngine(false));
		ParseResult result = derivation.begin("(a+b");
		assertFalse(result.isOk());
		assertTrue(derivation.getHistory().isEmpty());
		assertTrue(derivation.begin("x + 2 = 7").isOk());
		assertEquals("step-1", derivation.current().id);
		assertThrows(EquationException.class, () -> derivation.begin("y"));
	}

	@Test
	public void testNotStarted(){
		Derivation derivation = new Derivation(Notation.ASCII_MATH, new RewriteEngine(false));
		assertThrows(EquationException.class, () -> derivation.select("x"));
		assertThrows(EquationException.class, () -> derivation.apply(Operation.add(new NumberNode("1"))));
	}

	@Test
	public void testSolveLinearEquation(){
		Derivation derivation = derivation("2x + 4 = 10", true);
		derivation.apply(Operation.subtract(new NumberNode("4")));
		assertEquals("2*x = 6", current(derivation));
		Step step = derivation.apply(Operation.divide(new NumberNode("2")));
		assertEquals("x = 3", current(derivation));
		assertEquals("divide by 2", step.appliedRuleName);
		assertEquals("step-2", step.parentId);
		assertEquals(3, derivation.getHistory().size());
	}

	@Test
	public void testSelection(){
		Derivation derivation = derivation("x + 2 = 7", false);
		RelationNode tree = (RelationNode) derivation.current().tree;
		assertTrue(derivation.select(tree.left.id));
		assertEquals("x + 2", derivation.selectionAsText());
		assertFalse(derivation.select("nope"));
		assertNull(derivation.getSelection());
		assertNull(derivation.selectionAsText());
		assertEquals("7", derivation.linearEcho(tree.right.id));
		assertNull(derivation.linearEcho("nope"));
	}

	@Test
	public void testApplyToSelection(){
		Derivation derivation = derivation("x + 2 = 7", false);
		RelationNode tree = (RelationNode) derivation.current().tree;
		derivation.select(tree.left.id);
		Step step = derivation.apply(Operation.add(new NumberNode("3")));
		assertEquals("x + 5 = 7", current(derivation));
		assertEquals(tree.left.id, step.selection);
		// the selected node doesn't exist anymore
		assertNull(derivation.getSelection());
	}

	@Test
	public void testSelectionSurvivesIfTheNodeDoes(){
		Derivation derivation = derivation("x + 2 = 7", false);
		RelationNode tree = (RelationNode) derivation.current().tree;
		String seven = tree.right.id;
		derivation.select(seven);
		derivation.apply(Operation.rewriteIdentity(new NumberNode("7")));
		assertEquals(seven, derivation.getSelection());
	}

	@Test
	public void testMirrorToggle(){
		Derivation derivation = derivation("x + 2 = 7", false);
		assertThrows(OperationContractViolation.class, () -> derivation.apply(Operation.add(new NumberNode("3"))));
		assertEquals(1, derivation.getHistory().size());
		derivation.setMirrored(true);
		assertTrue(derivation.isMirrored());
		derivation.apply(Operation.add(new NumberNode("3")));
		assertEquals("x + 5 = 10", current(derivation));
	}

	@Test
	public void testRewriteOptions() throws IOException {
		Derivation derivation = derivation("(a+b)^2 = c", true);
		assertThrows(EquationException.class, () -> derivation.requestOptions(request -> Collections.emptyList()));
		String left = ((RelationNode) derivation.current().tree).left.id;
		derivation.select(left);
		List<RewriteOptionsRequest> requests = new ArrayList<>();
		RewriteOptionsProvider provider = request -> {
			requests.add(request);
			ExprNode expanded = Parser.parse("a^2 + 2a*b + b^2", Notation.ASCII_MATH).asOk().tree;
			return Collections.singletonList(new RewriteOption("opt-1", "Expand", "binomial expansion",
					ContentCodec.encode(expanded), null));
		};
		List<RewriteOption> options = derivation.requestOptions(provider);
		assertEquals(1, requests.size());
		assertEquals(left, requests.get(0).selectedNodeId);
		assertEquals(derivation.current().contentForm, requests.get(0).contentForm);
		Step step = derivation.applyOption(options.get(0));
		assertEquals("a^2 + 2*a*b + b^2 = c", current(derivation));
		assertEquals("binomial expansion", step.appliedRuleName);
	}

	@Test
	public void testApplyOptionNeedsSelection(){
		Derivation derivation = derivation("x", false);
		RewriteOption option = new RewriteOption("opt-1", "y", "rename", "<ci>y</ci>", null);
		assertThrows(EquationException.class, () -> derivation.applyOption(option));
	}
}
