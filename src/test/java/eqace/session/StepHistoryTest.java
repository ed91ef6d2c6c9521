package eqace.session;

import org.junit.jupiter.api.Test;

import eqace.EquationException;
import eqace.ast.StableIds;
import eqace.mathml.ContentCodec;

import static eqace.ast.MathAST.*;
import static org.junit.jupiter.api.Assertions.*;

public class StepHistoryTest {

	@Test
	public void testAppend(){
		StepHistory history = new StepHistory();
		assertTrue(history.isEmpty());
		assertNull(history.current());
		Step first = history.append(new IdentNode("x"), null, null);
		assertEquals("step-1", first.id);
		assertNull(first.parentId);
		assertEquals(StableIds.idOf(new IdentNode("x")), first.tree.id);
		assertEquals(ContentCodec.encode(first.tree), first.contentForm);
		assertTrue(first.presentationForm.contains("data-node-id"));
		Step second = history.append(first.id, new NumberNode("2"), first.tree.id, "rewrite as 2");
		assertEquals("step-2", second.id);
		assertEquals("step-1", second.parentId);
		assertEquals("rewrite as 2", second.appliedRuleName);
		assertSame(second, history.current());
		assertSame(first, history.get("step-1"));
		assertNull(history.get("step-3"));
		assertEquals(2, history.size());
	}

	@Test
	public void testOnlyLinearHistories(){
		StepHistory history = new StepHistory();
		assertThrows(EquationException.class, () -> history.append("step-1", new IdentNode("x"), null, null));
		Step first = history.append(null, new IdentNode("x"), null, null);
		history.append(first.id, new IdentNode("y"), null, null);
		assertThrows(EquationException.class, () -> history.append(first.id, new IdentNode("z"), null, null));
		assertEquals(2, history.size());
	}

	@Test
	public void testStepsAreReadOnly(){
		StepHistory history = new StepHistory();
		history.append(new IdentNode("x"), null, null);
		assertThrows(UnsupportedOperationException.class, () -> history.steps().clear());
	}
}
