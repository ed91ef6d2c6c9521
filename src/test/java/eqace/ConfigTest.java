package eqace;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import eqace.lexer.Notation;
import eqace.parser.Parser;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigTest {

	@AfterEach
	public void reset(){
		Config.reset();
	}

	@Test
	public void testDefaults(){
		assertEquals(Notation.ASCII_MATH, Config.getNotation());
		assertFalse(Config.mirrorByDefault());
		assertEquals(5, Config.getNearTextLength());
		assertEquals(500, Config.getMaxDepth());
	}

	@Test
	public void testLoad(@TempDir Path dir) throws IOException {
		Path file = dir.resolve("eqace.ini");
		Files.write(file, Arrays.asList("# settings", "notation = plaintext", "mirror = yes", "nearTextLength = 2", "unknown = 1"));
		Config.load(file);
		assertEquals(Notation.PLAIN_TEXT, Config.getNotation());
		assertTrue(Config.mirrorByDefault());
		assertEquals(2, Config.getNearTextLength());
		assertTrue(Parser.parse("-x").isOk());
		assertEquals("$ ", Parser.parse("x $ y").asErr().nearText);
	}

	@Test
	public void testInvalidNearTextLength(){
		Config.set("nearTextLength", "many");
		assertEquals(5, Config.getNearTextLength());
	}

	@Test
	public void testUnknownKey(){
		assertThrows(EquationException.class, () -> Config.set("colour", "red"));
	}

	@Test
	public void testMaxDepth(){
		Config.set("maxDepth", "3");
		assertEquals(3, Config.getMaxDepth());
		assertFalse(Parser.parse("(((x)))").isOk());
		Config.set("maxDepth", "deep");
		assertEquals(500, Config.getMaxDepth());
	}
}
