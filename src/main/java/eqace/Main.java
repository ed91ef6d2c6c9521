package eqace;

import java.util.ArrayList;
import java.util.List;

import eqace.ast.AstGraph;
import eqace.lexer.Notation;
import eqace.parser.LinearRenderer;
import eqace.parser.ParseResult;
import eqace.parser.Parser;

/**
 * Command line entry point: parses an expression and prints its content form, presentation form
 * and linear echo.
 * <p/>
 * Usage: {@code eqace.Main [--plain|--ascii] [--dot] <expression>}, the notation defaults to the configured one
 */
public class Main {

	public static void main(String[] args) {
		System.exit(run(args));
	}

	static int run(String[] args){
		Notation notation = Config.getNotation();
		boolean dot = false;
		List<String> rest = new ArrayList<>();
		for (String arg : args){
			switch (arg){
				case "--plain":
					notation = Notation.PLAIN_TEXT;
					break;
				case "--ascii":
					notation = Notation.ASCII_MATH;
					break;
				case "--dot":
					dot = true;
					break;
				default:
					rest.add(arg);
			}
		}
		if (rest.isEmpty()){
			System.err.println("Usage: eqace.Main [--plain|--ascii] [--dot] <expression>");
			return 2;
		}
		String input = String.join(" ", rest);
		ParseResult result = Parser.parse(input, notation);
		if (!result.isOk()){
			ParseResult.Err err = result.asErr();
			System.err.println(input);
			System.err.println(caretLine(err.index));
			System.err.println(String.format("%s at %d near \"%s\"", err.message, err.index, err.nearText));
			return 1;
		}
		ParseResult.Ok ok = result.asOk();
		System.out.println(LinearRenderer.render(ok.tree));
		System.out.println(ok.contentForm);
		System.out.println(ok.presentationForm);
		if (dot){
			System.out.println(new AstGraph("expression", ok.tree).toDot());
		}
		return 0;
	}

	static String caretLine(int index){
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < index; i++){
			builder.append(' ');
		}
		return builder.append('^').toString();
	}
}
