package eqace.lexer;

/**
 * A simple interface for a pull lexer with lookahead.
 */
public interface Lexer {

	/**
	 * Get the current token, the end of input is signaled by an {@link TokenType#EOF} token.
	 */
	Token cur();

	/**
	 * Advance to the next token and return the new current token.
	 */
	Token next();

	/**
	 * Returns the token {@code offset} positions after the current one, or the EOF token.
	 */
	Token lookahead(int offset);

	/**
	 * The lexed input
	 */
	String getInput();
}
