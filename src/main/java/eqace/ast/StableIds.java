package eqace.ast;

import java.util.ArrayList;
import java.util.List;

import eqace.util.Pair;

import static eqace.ast.MathAST.*;

/**
 * Assigns content addressed ids to the nodes of a tree.
 * <p/>
 * The id of a node is the hex digest of the djb2 hash of its canonical signature, a whitespace free
 * textual encoding like {@code power(ident:x,number:2)} that is built from the signatures of the
 * children and never from their ids. Structurally equal subtrees therefore get equal ids in every tree.
 */
public class StableIds {

	private StableIds(){
	}

	/**
	 * Returns a copy of the tree in which every node carries its stable id
	 */
	public static ExprNode assign(ExprNode tree){
		return tree.accept(new Assigner()).first;
	}

	/**
	 * Canonical signature of the passed subtree
	 */
	public static String signature(ExprNode node){
		return node.accept(new Assigner()).second;
	}

	/**
	 * The id that {@link #assign(ExprNode)} gives the passed node
	 */
	public static String idOf(ExprNode node){
		return hash(signature(node));
	}

	/**
	 * 32 bit djb2 hash, as unsigned lower case hex
	 */
	public static String hash(String str){
		int hash = 5381;
		for (int i = 0; i < str.length(); i++){
			hash = ((hash << 5) + hash) + str.charAt(i);
		}
		return Integer.toHexString(hash);
	}

	/**
	 * Escapes the characters that structure signatures, so that names can't forge them
	 */
	static String escape(String str){
		StringBuilder builder = new StringBuilder();
		for (char c : str.toCharArray()){
			if (c == '\\' || c == ',' || c == '(' || c == ')' || c == ':'){
				builder.append('\\');
			}
			builder.append(c);
		}
		return builder.toString();
	}

	/**
	 * Rebuilds the tree bottom up and returns each node with its id together with its signature
	 */
	private static class Assigner implements NodeVisitor<Pair<ExprNode, String>> {

		private Pair<ExprNode, String> withId(ExprNode node, String signature){
			return Pair.of(node.withId(hash(signature)), signature);
		}

		private Pair<List<ExprNode>, String> visitAll(List<ExprNode> nodes){
			List<ExprNode> assigned = new ArrayList<>();
			List<String> signatures = new ArrayList<>();
			for (ExprNode node : nodes){
				Pair<ExprNode, String> pair = node.accept(this);
				assigned.add(pair.first);
				signatures.add(pair.second);
			}
			return Pair.of(assigned, String.join(",", signatures));
		}

		@Override
		public Pair<ExprNode, String> visit(IdentNode ident) {
			return withId(ident, "ident:" + escape(ident.name));
		}

		@Override
		public Pair<ExprNode, String> visit(NumberNode number) {
			return withId(number, "number:" + escape(number.literal));
		}

		@Override
		public Pair<ExprNode, String> visit(PowerNode power) {
			Pair<ExprNode, String> base = power.base.accept(this);
			Pair<ExprNode, String> exponent = power.exponent.accept(this);
			return withId(new PowerNode(base.first, exponent.first),
					"power(" + base.second + "," + exponent.second + ")");
		}

		@Override
		public Pair<ExprNode, String> visit(AddNode add) {
			Pair<List<ExprNode>, String> terms = visitAll(add.terms);
			return withId(new AddNode(terms.first), "add(" + terms.second + ")");
		}

		@Override
		public Pair<ExprNode, String> visit(MulNode mul) {
			Pair<List<ExprNode>, String> factors = visitAll(mul.factors);
			return withId(new MulNode(factors.first), "mul(" + factors.second + ")");
		}

		@Override
		public Pair<ExprNode, String> visit(CallNode call) {
			Pair<ExprNode, String> arg = call.arg.accept(this);
			return withId(new CallNode(call.func, arg.first), "call:" + escape(call.func) + "(" + arg.second + ")");
		}

		@Override
		public Pair<ExprNode, String> visit(RelationNode relation) {
			Pair<ExprNode, String> left = relation.left.accept(this);
			Pair<ExprNode, String> right = relation.right.accept(this);
			return withId(new RelationNode(relation.op, left.first, right.first),
					"rel:" + relation.op.name + "(" + left.second + "," + right.second + ")");
		}

		@Override
		public Pair<ExprNode, String> visit(DerivativeNode derivative) {
			Pair<ExprNode, String> variable = derivative.variable.accept(this);
			Pair<ExprNode, String> arg = derivative.arg.accept(this);
			return withId(new DerivativeNode((IdentNode)variable.first, arg.first),
					"diff(" + variable.second + "," + arg.second + ")");
		}
	}
}
