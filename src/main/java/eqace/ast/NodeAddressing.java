package eqace.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import static eqace.ast.MathAST.*;

/**
 * Lookup and replacement of subtrees by their stable id.
 * <p/>
 * Equal subtrees share an id, in this case the first match in pre-order wins.
 * A missing id is a valid outcome (ids go stale after edits) and not an error.
 */
public class NodeAddressing {

	public static final Logger LOG = Logger.getLogger("Addressing");

	private NodeAddressing(){
	}

	/**
	 * @return the first node in pre-order with the passed id or {@code null}
	 */
	public static ExprNode findNodeById(ExprNode tree, String id){
		if (id == null){
			return null;
		}
		if (id.equals(tree.id)){
			return tree;
		}
		for (ExprNode child : tree.children()){
			ExprNode found = findNodeById(child, id);
			if (found != null){
				return found;
			}
		}
		return null;
	}

	public static boolean contains(ExprNode tree, String id){
		return findNodeById(tree, id) != null;
	}

	/**
	 * Replaces the first node in pre-order with the passed id. Only the path from the root to the match
	 * is copied, all other subtrees are shared with the passed tree. The copied nodes lose their ids,
	 * run {@link StableIds#assign(ExprNode)} on the result to get them back.
	 *
	 * @return the passed tree itself if no node has the id
	 */
	public static ExprNode findAndReplaceById(ExprNode tree, String id, ExprNode replacement){
		ExprNode result = replace(tree, id, replacement);
		if (result == null){
			LOG.fine(() -> String.format("No node with id %s, tree unchanged", id));
			return tree;
		}
		return result;
	}

	/**
	 * @return {@code null} if the subtree doesn't contain the id
	 */
	private static ExprNode replace(ExprNode node, String id, ExprNode replacement){
		if (id != null && id.equals(node.id)){
			return replacement;
		}
		List<ExprNode> children = node.children();
		for (int i = 0; i < children.size(); i++){
			ExprNode replaced = replace(children.get(i), id, replacement);
			if (replaced != null){
				List<ExprNode> newChildren = new ArrayList<>(children);
				newChildren.set(i, replaced);
				return node.withChildren(newChildren);
			}
		}
		return null;
	}
}
