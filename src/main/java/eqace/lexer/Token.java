package eqace.lexer;

import java.util.Objects;

public class Token {

	/**
	 * Type of the token.
	 */
	public final TokenType type;

	/**
	 * Matched text.
	 */
	public final String value;

	/**
	 * 0-based offset of the first matched character in the input
	 */
	public final int index;

	public Token(TokenType type, String value, int index){
		this.type = type;
		this.value = value;
		this.index = index;
	}

	public boolean is(TokenType type){
		return this.type == type;
	}

	@Override
	public String toString() {
		return type + "[" + index + "](" + value + ")";
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Token)){
			return false;
		}
		Token other = (Token)obj;
		return type == other.type && index == other.index && value.equals(other.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, value, index);
	}
}
