package eqace;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest {

	private final PrintStream out = System.out;
	private final PrintStream err = System.err;
	private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
	private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

	@BeforeEach
	public void redirect(){
		System.setOut(new PrintStream(outBytes, true));
		System.setErr(new PrintStream(errBytes, true));
	}

	@AfterEach
	public void restore(){
		System.setOut(out);
		System.setErr(err);
	}

	private String out(){
		return new String(outBytes.toByteArray());
	}

	private String err(){
		return new String(errBytes.toByteArray());
	}

	@Test
	public void testPrintsAllForms(){
		assertEquals(0, Main.run(new String[]{"x", "+", "2", "=", "7"}));
		assertTrue(out().startsWith("x + 2 = 7"));
		assertTrue(out().contains("<apply>"));
		assertTrue(out().contains("data-node-id"));
	}

	@Test
	public void testPlainText(){
		assertEquals(0, Main.run(new String[]{"--plain", "a/b"}));
		assertTrue(out().startsWith("a*b^(-1)"));
	}

	@Test
	public void testDot(){
		assertEquals(0, Main.run(new String[]{"--dot", "x^2"}));
		assertTrue(out().contains("digraph"));
	}

	@Test
	public void testError(){
		assertEquals(1, Main.run(new String[]{"(a+b"}));
		String[] lines = err().split("\\R");
		assertEquals("(a+b", lines[0]);
		assertEquals("    ^", lines[1]);
		assertTrue(lines[2].startsWith("Expected \")\" at 4"));
	}

	@Test
	public void testUsage(){
		assertEquals(2, Main.run(new String[0]));
		assertTrue(err().startsWith("Usage: eqace.Main [--plain|--ascii] [--dot] <expression>"));
	}

	@Test
	public void testCaretLine(){
		assertEquals("^", Main.caretLine(0));
		assertEquals("  ^", Main.caretLine(2));
	}
}
