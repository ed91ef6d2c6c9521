package eqace.ast;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

import eqace.EquationException;

/**
 * Nodes of the symbolic expression tree.
 * <p/>
 * Trees are immutable: every edit builds a new tree that may share untouched subtrees with the old one.
 * Each node can carry a stable id (see {@link StableIds}), equality of nodes ignores these ids and
 * compares the structure only.
 */
public class MathAST {

	/**
	 * Visitor over all node kinds, every method has to be implemented, so adding a node kind
	 * breaks the build of every component that doesn't handle it.
	 */
	public interface NodeVisitor<R> {

		R visit(IdentNode ident);

		R visit(NumberNode number);

		R visit(PowerNode power);

		R visit(AddNode add);

		R visit(MulNode mul);

		R visit(CallNode call);

		R visit(RelationNode relation);

		R visit(DerivativeNode derivative);
	}

	/**
	 * Base class of all nodes
	 */
	public static abstract class ExprNode {

		/**
		 * Stable id, {@code null} if none has been assigned
		 */
		public final String id;

		protected ExprNode(String id) {
			this.id = id;
		}

		public abstract <R> R accept(NodeVisitor<R> visitor);

		/**
		 * Direct children in their natural order
		 */
		public List<ExprNode> children(){
			return Collections.emptyList();
		}

		/**
		 * Copy of this node with the passed children (same count and order as {@link #children()})
		 * and without an id
		 */
		public abstract ExprNode withChildren(List<ExprNode> children);

		/**
		 * Copy of this node (with the same children) that carries the passed id
		 */
		public abstract ExprNode withId(String id);

		public boolean hasId(){
			return id != null;
		}

		public abstract String type();

		/**
		 * Atoms are identifiers and number literals
		 */
		public boolean isAtom(){
			return false;
		}

		protected boolean sameStructure(ExprNode other){
			return children().equals(other.children());
		}

		@Override
		public boolean equals(Object obj) {
			if (this == obj){
				return true;
			}
			if (obj == null || obj.getClass() != getClass()){
				return false;
			}
			return sameStructure((ExprNode)obj);
		}

		@Override
		public int hashCode() {
			return Objects.hash(type(), children());
		}

		@Override
		public String toString() {
			StringBuilder builder = new StringBuilder();
			builder.append("(").append(type());
			for (ExprNode child : children()){
				builder.append(" ").append(child);
			}
			builder.append(")");
			return builder.toString();
		}

		public String toPrettyString(){
			return toPrettyString("", "\t");
		}

		public String toPrettyString(String indent, String incr){
			StringBuilder builder = new StringBuilder();
			builder.append(indent).append("(").append(type());
			if (id != null){
				builder.append(" #").append(id);
			}
			for (ExprNode child : children()){
				builder.append("\n").append(child.toPrettyString(indent + incr, incr));
			}
			builder.append(")");
			return builder.toString();
		}

		protected void checkChildCount(List<ExprNode> children, int expected){
			if (children.size() != expected){
				throw new EquationException(String.format("%s expects %d children, got %d", type(), expected, children.size()));
			}
		}
	}

	public static class IdentNode extends ExprNode {

		public final String name;

		public IdentNode(String name) {
			this(name, null);
		}

		public IdentNode(String name, String id) {
			super(id);
			this.name = Objects.requireNonNull(name);
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visit(this);
		}

		@Override
		public ExprNode withChildren(List<ExprNode> children) {
			checkChildCount(children, 0);
			return new IdentNode(name);
		}

		@Override
		public IdentNode withId(String id) {
			return new IdentNode(name, id);
		}

		@Override
		public String type() {
			return "ident";
		}

		@Override
		public boolean isAtom() {
			return true;
		}

		@Override
		protected boolean sameStructure(ExprNode other) {
			return name.equals(((IdentNode)other).name);
		}

		@Override
		public int hashCode() {
			return name.hashCode();
		}

		@Override
		public String toString() {
			return name;
		}
	}

	/**
	 * A number literal, kept as its textual form
	 */
	public static class NumberNode extends ExprNode {

		private static final Pattern INTEGER = Pattern.compile("-?[0-9]+");
		private static final Pattern DECIMAL = Pattern.compile("-?[0-9]+(\\.[0-9]+)?");

		public final String literal;

		public NumberNode(String literal) {
			this(literal, null);
		}

		/**
		 * @throws EquationException if the literal isn't a (possibly negative) decimal number
		 */
		public NumberNode(String literal, String id) {
			super(id);
			this.literal = Objects.requireNonNull(literal);
			if (!isValidLiteral(literal)){
				throw new EquationException(String.format("Invalid number literal \"%s\"", literal));
			}
		}

		/**
		 * Shortest literal of the value, without exponent and trailing zeros
		 */
		public static NumberNode of(BigDecimal value){
			if (value.signum() == 0){
				return new NumberNode("0");
			}
			return new NumberNode(value.stripTrailingZeros().toPlainString());
		}

		public static boolean isValidLiteral(String literal){
			return DECIMAL.matcher(literal).matches();
		}

		/**
		 * Is this an (optionally negative) integer literal?
		 */
		public boolean isInteger(){
			return INTEGER.matcher(literal).matches();
		}

		public BigInteger integerValue(){
			return new BigInteger(literal);
		}

		public BigDecimal decimalValue(){
			return new BigDecimal(literal);
		}

		public boolean isZero(){
			return decimalValue().signum() == 0;
		}

		public boolean isNegative(){
			return literal.startsWith("-");
		}

		public boolean isMinusOne(){
			return literal.equals("-1");
		}

		/**
		 * Literal without its leading minus sign, keeps the id
		 */
		public NumberNode abs(){
			return isNegative() ? new NumberNode(literal.substring(1), id) : this;
		}

		public NumberNode negate(){
			if (isNegative()){
				return new NumberNode(literal.substring(1));
			}
			if (isZero()){
				return new NumberNode("0");
			}
			return new NumberNode("-" + literal);
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visit(this);
		}

		@Override
		public ExprNode withChildren(List<ExprNode> children) {
			checkChildCount(children, 0);
			return new NumberNode(literal);
		}

		@Override
		public NumberNode withId(String id) {
			return new NumberNode(literal, id);
		}

		@Override
		public String type() {
			return "number";
		}

		@Override
		public boolean isAtom() {
			return true;
		}

		@Override
		protected boolean sameStructure(ExprNode other) {
			return literal.equals(((NumberNode)other).literal);
		}

		@Override
		public int hashCode() {
			return literal.hashCode();
		}

		@Override
		public String toString() {
			return literal;
		}
	}

	/**
	 * {@code base ^ exponent}
	 */
	public static class PowerNode extends ExprNode {

		public final ExprNode base;
		public final ExprNode exponent;

		public PowerNode(ExprNode base, ExprNode exponent) {
			this(base, exponent, null);
		}

		public PowerNode(ExprNode base, ExprNode exponent, String id) {
			super(id);
			this.base = Objects.requireNonNull(base);
			this.exponent = Objects.requireNonNull(exponent);
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visit(this);
		}

		@Override
		public List<ExprNode> children() {
			return Arrays.asList(base, exponent);
		}

		@Override
		public ExprNode withChildren(List<ExprNode> children) {
			checkChildCount(children, 2);
			return new PowerNode(children.get(0), children.get(1));
		}

		@Override
		public PowerNode withId(String id) {
			return new PowerNode(base, exponent, id);
		}

		@Override
		public String type() {
			return "power";
		}
	}

	/**
	 * n-ary sum, subtraction is encoded as the addition of {@code Mul(-1, term)}
	 */
	public static class AddNode extends ExprNode {

		public final List<ExprNode> terms;

		public AddNode(List<? extends ExprNode> terms) {
			this(terms, null);
		}

		public AddNode(List<? extends ExprNode> terms, String id) {
			super(id);
			if (terms.isEmpty()){
				throw new EquationException("A sum needs at least one term");
			}
			this.terms = Collections.unmodifiableList(new ArrayList<>(terms));
		}

		public AddNode(ExprNode... terms){
			this(Arrays.asList(terms));
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visit(this);
		}

		@Override
		public List<ExprNode> children() {
			return terms;
		}

		@Override
		public ExprNode withChildren(List<ExprNode> children) {
			return new AddNode(children);
		}

		@Override
		public AddNode withId(String id) {
			return new AddNode(terms, id);
		}

		@Override
		public String type() {
			return "add";
		}
	}

	/**
	 * n-ary product
	 */
	public static class MulNode extends ExprNode {

		public final List<ExprNode> factors;

		public MulNode(List<? extends ExprNode> factors) {
			this(factors, null);
		}

		public MulNode(List<? extends ExprNode> factors, String id) {
			super(id);
			if (factors.isEmpty()){
				throw new EquationException("A product needs at least one factor");
			}
			this.factors = Collections.unmodifiableList(new ArrayList<>(factors));
		}

		public MulNode(ExprNode... factors){
			this(Arrays.asList(factors));
		}

		/**
		 * {@code Mul(-1, x)}, the encoding of {@code -x}
		 */
		public static MulNode negation(ExprNode node){
			return new MulNode(new NumberNode("-1"), node);
		}

		/**
		 * Is the first factor the literal {@code -1}?
		 */
		public boolean isNegation(){
			ExprNode first = factors.get(0);
			return first instanceof NumberNode && ((NumberNode) first).isMinusOne();
		}

		/**
		 * The factors without the leading {@code -1}, a literal 1 with the id of this node if nothing remains
		 */
		public List<ExprNode> negatedFactors(){
			if (factors.size() == 1){
				return Collections.singletonList(new NumberNode("1", id));
			}
			return factors.subList(1, factors.size());
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visit(this);
		}

		@Override
		public List<ExprNode> children() {
			return factors;
		}

		@Override
		public ExprNode withChildren(List<ExprNode> children) {
			return new MulNode(children);
		}

		@Override
		public MulNode withId(String id) {
			return new MulNode(factors, id);
		}

		@Override
		public String type() {
			return "mul";
		}
	}

	/**
	 * Application of a named function to a single argument
	 */
	public static class CallNode extends ExprNode {

		public final String func;
		public final ExprNode arg;

		public CallNode(String func, ExprNode arg) {
			this(func, arg, null);
		}

		public CallNode(String func, ExprNode arg, String id) {
			super(id);
			this.func = Objects.requireNonNull(func);
			this.arg = Objects.requireNonNull(arg);
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visit(this);
		}

		@Override
		public List<ExprNode> children() {
			return Collections.singletonList(arg);
		}

		@Override
		public ExprNode withChildren(List<ExprNode> children) {
			checkChildCount(children, 1);
			return new CallNode(func, children.get(0));
		}

		@Override
		public CallNode withId(String id) {
			return new CallNode(func, arg, id);
		}

		@Override
		public String type() {
			return "call:" + func;
		}

		@Override
		protected boolean sameStructure(ExprNode other) {
			return func.equals(((CallNode)other).func) && super.sameStructure(other);
		}
	}

	public enum RelationOperator {
		EQ("eq", "=", "=", "eq"),
		LT("lt", "<", "<", "lt"),
		LE("le", "<=", "≤", "leq"),
		GT("gt", ">", ">", "gt"),
		GE("ge", ">=", "≥", "geq");

		/**
		 * Name used in canonical signatures
		 */
		public final String name;

		/**
		 * Symbol in the linear notation
		 */
		public final String symbol;

		/**
		 * Glyph in the presentation form
		 */
		public final String glyph;

		/**
		 * Element name in the content form
		 */
		public final String contentTag;

		RelationOperator(String name, String symbol, String glyph, String contentTag){
			this.name = name;
			this.symbol = symbol;
			this.glyph = glyph;
			this.contentTag = contentTag;
		}

		public static RelationOperator forSymbol(String symbol){
			for (RelationOperator op : values()){
				if (op.symbol.equals(symbol)){
					return op;
				}
			}
			throw new EquationException(String.format("Unknown relation \"%s\"", symbol));
		}

		/**
		 * @return {@code null} if the tag doesn't denote a relation
		 */
		public static RelationOperator forContentTag(String tag){
			for (RelationOperator op : values()){
				if (op.contentTag.equals(tag)){
					return op;
				}
			}
			return null;
		}
	}

	/**
	 * An equation or inequality, at most one per expression
	 */
	public static class RelationNode extends ExprNode {

		public final RelationOperator op;
		public final ExprNode left;
		public final ExprNode right;

		public RelationNode(RelationOperator op, ExprNode left, ExprNode right) {
			this(op, left, right, null);
		}

		public RelationNode(RelationOperator op, ExprNode left, ExprNode right, String id) {
			super(id);
			this.op = Objects.requireNonNull(op);
			this.left = Objects.requireNonNull(left);
			this.right = Objects.requireNonNull(right);
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visit(this);
		}

		@Override
		public List<ExprNode> children() {
			return Arrays.asList(left, right);
		}

		@Override
		public ExprNode withChildren(List<ExprNode> children) {
			checkChildCount(children, 2);
			return new RelationNode(op, children.get(0), children.get(1));
		}

		@Override
		public RelationNode withId(String id) {
			return new RelationNode(op, left, right, id);
		}

		@Override
		public String type() {
			return "rel:" + op.name;
		}

		@Override
		protected boolean sameStructure(ExprNode other) {
			return op == ((RelationNode)other).op && super.sameStructure(other);
		}
	}

	/**
	 * {@code d/d<variable> arg}
	 */
	public static class DerivativeNode extends ExprNode {

		public final IdentNode variable;
		public final ExprNode arg;

		public DerivativeNode(IdentNode variable, ExprNode arg) {
			this(variable, arg, null);
		}

		public DerivativeNode(IdentNode variable, ExprNode arg, String id) {
			super(id);
			this.variable = Objects.requireNonNull(variable);
			this.arg = Objects.requireNonNull(arg);
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visit(this);
		}

		@Override
		public List<ExprNode> children() {
			return Arrays.asList(variable, arg);
		}

		@Override
		public ExprNode withChildren(List<ExprNode> children) {
			checkChildCount(children, 2);
			if (!(children.get(0) instanceof IdentNode)){
				throw new EquationException("The variable of a derivative has to be an identifier, got " + children.get(0));
			}
			return new DerivativeNode((IdentNode)children.get(0), children.get(1));
		}

		@Override
		public DerivativeNode withId(String id) {
			return new DerivativeNode(variable, arg, id);
		}

		@Override
		public String type() {
			return "diff";
		}
	}
}
