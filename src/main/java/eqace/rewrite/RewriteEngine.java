package eqace.rewrite;

import java.util.logging.Logger;

import eqace.Config;
import eqace.ast.NodeAddressing;
import eqace.ast.StableIds;
import eqace.mathml.ContentCodec;

import static eqace.ast.MathAST.*;

/**
 * Applies operations to subtrees, either single sided or mirrored across both sides of a relation.
 * <p/>
 * In the mirrored state an operation on a tree whose root is a relation is applied to the left and the
 * right side independently. Identity rewrites are never mirrored, they restate one subtree only.
 * Every result is a new tree with freshly assigned stable ids, the input tree is never modified.
 */
public class RewriteEngine {

	public static final Logger LOG = Logger.getLogger("Rewrite");

	private boolean mirrored;

	public RewriteEngine() {
		this(Config.mirrorByDefault());
	}

	public RewriteEngine(boolean mirrored) {
		this.mirrored = mirrored;
	}

	public boolean isMirrored() {
		return mirrored;
	}

	public void setMirrored(boolean mirrored) {
		this.mirrored = mirrored;
	}

	public boolean toggleMirrored(){
		mirrored = !mirrored;
		return mirrored;
	}

	/**
	 * Applies the operation to the node with the target id.
	 *
	 * @param tree canonical tree (with stable ids)
	 * @return the passed tree if the target id doesn't occur in it (and the operation isn't mirrored)
	 * @throws OperationContractViolation if an arithmetic operation targets a relation single sided
	 */
	public ExprNode apply(ExprNode tree, String targetId, Operation operation){
		if (mirrored && operation.kind.isMirrorable() && tree instanceof RelationNode){
			RelationNode relation = (RelationNode) tree;
			LOG.fine(() -> String.format("%s on both sides of %s", operation.ruleName(), relation));
			return StableIds.assign(new RelationNode(relation.op,
					applySingle(relation.left, operation), applySingle(relation.right, operation)));
		}
		ExprNode target = NodeAddressing.findNodeById(tree, targetId);
		if (target == null){
			LOG.fine(() -> String.format("No node with id %s, %s not applied", targetId, operation.ruleName()));
			return tree;
		}
		// identity rewrites and substitutions may replace a whole relation
		if (target instanceof RelationNode && operation.kind.isMirrorable() && operation.kind != OperationKind.SUBSTITUTE){
			throw new OperationContractViolation(String.format(
					"Can't %s a relation single sided, enable mirroring to apply it to both sides", operation.kind.name));
		}
		LOG.fine(() -> String.format("%s at %s", operation.ruleName(), targetId));
		return StableIds.assign(NodeAddressing.findAndReplaceById(tree, targetId, applySingle(target, operation)));
	}

	/**
	 * Replaces the node with the target id by the decoded replacement of the option
	 *
	 * @throws eqace.mathml.DecodeError if the replacement isn't valid content MathML
	 */
	public ExprNode applyOption(ExprNode tree, String targetId, RewriteOption option){
		return apply(tree, targetId, Operation.rewriteIdentity(ContentCodec.decode(option.replacementContentForm)));
	}

	/**
	 * Result of the operation on a single node, without stable ids
	 */
	public static ExprNode applySingle(ExprNode node, Operation operation){
		switch (operation.kind){
			case ADD:
				return Arithmetic.add(node, operation.operand);
			case SUBTRACT:
				return Arithmetic.add(node, Arithmetic.negate(operation.operand));
			case MULTIPLY:
				return Arithmetic.multiply(node, operation.operand);
			case DIVIDE:
				return Arithmetic.divide(node, operation.operand);
			case EXPONENTIATE:
				return Arithmetic.exponentiate(node, operation.operand);
			case FUNCTION_APPLY:
				return new CallNode(operation.funcName, node);
			case SUBSTITUTE: {
				RelationNode binding = (RelationNode) operation.operand;
				return Arithmetic.substitute(node, ((IdentNode) binding.left).name, binding.right);
			}
			case REWRITE_IDENTITY:
				return operation.operand;
			default:
				throw new OperationContractViolation("Unsupported operation " + operation.kind);
		}
	}
}
