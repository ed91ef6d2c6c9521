package eqace.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Lexer for both notations. It never fails: characters it doesn't know become
 * {@link TokenType#UNKNOWN} tokens, so that the parser can report them at their exact offset.
 */
public class MathLexer implements Lexer {

	private final String input;
	private final List<Token> tokens;
	private final Token eof;
	private int index = 0;

	public MathLexer(String input, Notation notation){
		this.input = input;
		this.tokens = tokenize(input, notation);
		this.eof = new Token(TokenType.EOF, "", input.length());
	}

	@Override
	public Token cur() {
		return lookahead(0);
	}

	@Override
	public Token next() {
		if (index < tokens.size()){
			index++;
		}
		return cur();
	}

	@Override
	public Token lookahead(int offset) {
		if (index + offset < tokens.size()){
			return tokens.get(index + offset);
		}
		return eof;
	}

	@Override
	public String getInput() {
		return input;
	}

	/**
	 * Splits the input into tokens, whitespace is skipped. The returned list doesn't contain an EOF token.
	 */
	public static List<Token> tokenize(String input, Notation notation){
		List<Token> tokens = new ArrayList<>();
		int i = 0;
		while (i < input.length()){
			char c = input.charAt(i);
			if (Character.isWhitespace(c)){
				i++;
				continue;
			}
			if ((c == '<' || c == '>') && i + 1 < input.length() && input.charAt(i + 1) == '='){
				tokens.add(new Token(c == '<' ? TokenType.LOWER_EQUALS : TokenType.GREATER_EQUALS, c + "=", i));
				i += 2;
				continue;
			}
			TokenType operator = TokenType.forOperatorChar(c);
			if (operator != null){
				tokens.add(new Token(operator, Character.toString(c), i));
				i++;
				continue;
			}
			if (Notation.isDigit(c)){
				int j = i + 1;
				while (j < input.length() && Notation.isDigit(input.charAt(j))){
					j++;
				}
				tokens.add(new Token(TokenType.NUMBER, input.substring(i, j), i));
				i = j;
				continue;
			}
			if (notation.isIdentifierStart(c)){
				int j = i + 1;
				while (j < input.length() && notation.isIdentifierPart(input.charAt(j))){
					j++;
				}
				tokens.add(new Token(TokenType.IDENT, input.substring(i, j), i));
				i = j;
				continue;
			}
			tokens.add(new Token(TokenType.UNKNOWN, Character.toString(c), i));
			i++;
		}
		return Collections.unmodifiableList(tokens);
	}
}
