package eqace.lexer;

/**
 * Types of the tokens produced by the {@link MathLexer}
 */
public enum TokenType {
	EOF("<end of input>"),
	IDENT("<identifier>"),
	NUMBER("<number>"),
	CARET("^"),
	LPAREN("("),
	RPAREN(")"),
	PLUS("+"),
	MINUS("-"),
	MULTIPLY("*"),
	DIVIDE("/"),
	LOWER_EQUALS("<="),
	GREATER_EQUALS(">="),
	EQUALS("="),
	LOWER("<"),
	GREATER(">"),
	/**
	 * Any other character, reported by the parser and not by the lexer
	 */
	UNKNOWN("<unknown>");

	public final String representation;

	TokenType(String representation){
		this.representation = representation;
	}

	public boolean isRelation(){
		switch (this){
			case EQUALS:
			case LOWER:
			case GREATER:
			case LOWER_EQUALS:
			case GREATER_EQUALS:
				return true;
			default:
				return false;
		}
	}

	/**
	 * Token type for single character operators, {@code null} if the character isn't one
	 */
	static TokenType forOperatorChar(char c){
		switch (c){
			case '^':
				return CARET;
			case '(':
				return LPAREN;
			case ')':
				return RPAREN;
			case '+':
				return PLUS;
			case '-':
				return MINUS;
			case '*':
				return MULTIPLY;
			case '/':
				return DIVIDE;
			case '=':
				return EQUALS;
			case '<':
				return LOWER;
			case '>':
				return GREATER;
			default:
				return null;
		}
	}
}
