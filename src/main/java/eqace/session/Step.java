package eqace.session;

import java.util.Objects;

import eqace.mathml.ContentCodec;
import eqace.mathml.PresentationRenderer;

import static eqace.ast.MathAST.ExprNode;

/**
 * One immutable entry of a derivation. The content and presentation forms are both derived from
 * {@link #tree}, so they are always consistent with each other.
 */
public class Step {

	public final String id;

	/**
	 * {@code null} for the first step
	 */
	public final String parentId;

	public final ExprNode tree;
	public final String contentForm;
	public final String presentationForm;

	/**
	 * Id of the node that was selected when the step was created, may be {@code null}
	 */
	public final String selection;

	/**
	 * Name of the rule that produced this step, {@code null} for the first step
	 */
	public final String appliedRuleName;

	Step(String id, String parentId, ExprNode tree, String selection, String appliedRuleName) {
		this.id = Objects.requireNonNull(id);
		this.parentId = parentId;
		this.tree = Objects.requireNonNull(tree);
		this.contentForm = ContentCodec.encode(tree);
		this.presentationForm = PresentationRenderer.render(tree);
		this.selection = selection;
		this.appliedRuleName = appliedRuleName;
	}

	@Override
	public String toString() {
		return String.format("Step(%s <- %s, %s, %s)", id, parentId, tree, appliedRuleName);
	}
}
