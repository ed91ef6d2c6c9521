package eqace.ast;

import guru.nidi.graphviz.attribute.*;
import guru.nidi.graphviz.model.*;

import static eqace.ast.MathAST.*;
import static guru.nidi.graphviz.model.Factory.*;

/**
 * Graphviz view of an expression tree, every node is labelled with its kind and its stable id.
 * Useful to see why two subtrees share an id.
 */
public class AstGraph {

	private final MutableGraph graph;
	private int nodeCounter = 0;

	public AstGraph(String name, ExprNode tree) {
		graph = mutGraph(name).setDirected(true);
		graph.nodeAttrs().add(Font.name("Helvetica"));
		graph.graphAttrs().add(Font.name("Helvetica"));
		graph.add(createNode(tree));
	}

	private MutableNode createNode(ExprNode node){
		MutableNode graphNode = mutNode("n" + nodeCounter++).add(Label.of(label(node)));
		if (node.isAtom()){
			graphNode.add(Shape.BOX);
		}
		for (ExprNode child : node.children()){
			graphNode.addLink(createNode(child));
		}
		return graphNode;
	}

	static String label(ExprNode node){
		String text = node.isAtom() ? node.type() + " " + node : node.type();
		return node.hasId() ? text + "\n#" + node.id : text;
	}

	/**
	 * Graph in the dot language
	 */
	public String toDot(){
		return graph.toString();
	}
}
