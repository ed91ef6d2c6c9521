package eqace.lexer;

import java.util.regex.Pattern;

import eqace.EquationException;

/**
 * The textual input notations. Both share one grammar, they differ in the identifier syntax and
 * in a few primary expression extras.
 */
public enum Notation {
	/**
	 * AsciiMath subset: letter-only identifiers, no unary signs, '/' only in {@code d/dx}
	 */
	ASCII_MATH("asciimath", false, false),
	/**
	 * Plain text: identifiers may contain digits and underscores, unary signs and '/' division
	 */
	PLAIN_TEXT("plaintext", true, true);

	public final String name;

	/**
	 * Allows {@code +x} and {@code -x}
	 */
	public final boolean unarySigns;

	/**
	 * Allows {@code a / b}, parsed as {@code a * b^(-1)}
	 */
	public final boolean division;

	Notation(String name, boolean unarySigns, boolean division){
		this.name = name;
		this.unarySigns = unarySigns;
		this.division = division;
	}

	boolean isIdentifierStart(char c){
		if (this == PLAIN_TEXT){
			return isLetter(c) || c == '_';
		}
		return isLetter(c);
	}

	boolean isIdentifierPart(char c){
		if (this == PLAIN_TEXT){
			return isLetter(c) || isDigit(c) || c == '_';
		}
		return isLetter(c);
	}

	static boolean isLetter(char c){
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
	}

	static boolean isDigit(char c){
		return c >= '0' && c <= '9';
	}

	private static final Pattern LETTERS = Pattern.compile("[A-Za-z]+");

	public static boolean isLetters(String str){
		return LETTERS.matcher(str).matches();
	}

	public static Notation forName(String name){
		for (Notation notation : values()){
			if (notation.name.equalsIgnoreCase(name.trim())){
				return notation;
			}
		}
		throw new EquationException(String.format("Unknown notation \"%s\"", name));
	}
}
