package eqace.parser;

import eqace.LocatedEquationException;
import eqace.lexer.Token;

/**
 * An error thrown after encountering a syntax error
 */
public class ParserError extends LocatedEquationException {

	/**
	 * The message without the location prefix
	 */
	public final String plainMessage;

	public ParserError(int index, String nearText, String message) {
		super(index, nearText, String.format("Error at %d: %s", index, message));
		this.plainMessage = message;
	}

	public static ParserError at(Token errorToken, String input, int nearTextLength, String message){
		int index = Math.min(errorToken.index, input.length());
		return new ParserError(index, input.substring(index, Math.min(input.length(), index + nearTextLength)), message);
	}
}
