package eqace.parser;

import eqace.mathml.ContentCodec;
import eqace.mathml.PresentationRenderer;

import static eqace.ast.MathAST.ExprNode;

/**
 * Outcome of parsing a textual expression: either the canonical tree with its content and
 * presentation form, or an error with the offending position.
 */
public abstract class ParseResult {

	private ParseResult(){
	}

	public abstract boolean isOk();

	public Ok asOk(){
		throw new IllegalStateException("Not a successful parse result: " + this);
	}

	public Err asErr(){
		throw new IllegalStateException("Not a failed parse result: " + this);
	}

	/**
	 * @param tree tree with assigned stable ids
	 */
	public static Ok ok(ExprNode tree){
		return new Ok(tree, ContentCodec.encode(tree), PresentationRenderer.render(tree));
	}

	public static Err error(String message, int index, String nearText){
		return new Err(message, index, nearText);
	}

	public static class Ok extends ParseResult {

		public final ExprNode tree;
		public final String contentForm;
		public final String presentationForm;

		private Ok(ExprNode tree, String contentForm, String presentationForm) {
			this.tree = tree;
			this.contentForm = contentForm;
			this.presentationForm = presentationForm;
		}

		@Override
		public boolean isOk() {
			return true;
		}

		@Override
		public Ok asOk() {
			return this;
		}

		@Override
		public String toString() {
			return "Ok(" + tree + ")";
		}
	}

	public static class Err extends ParseResult {

		public final String message;

		/**
		 * 0-based offset into the input, the input length if the input ended too early
		 */
		public final int index;

		/**
		 * Short slice of the input starting at the index
		 */
		public final String nearText;

		private Err(String message, int index, String nearText) {
			this.message = message;
			this.index = index;
			this.nearText = nearText;
		}

		@Override
		public boolean isOk() {
			return false;
		}

		@Override
		public Err asErr() {
			return this;
		}

		@Override
		public String toString() {
			return String.format("Err(%s at %d near \"%s\")", message, index, nearText);
		}
	}
}
