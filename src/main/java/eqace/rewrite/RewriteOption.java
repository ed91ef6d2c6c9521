package eqace.rewrite;

import java.util.Objects;

/**
 * A candidate rewrite for a selected node, as supplied by a {@link RewriteOptionsProvider}
 */
public class RewriteOption {

	public final String id;
	public final String label;
	public final String ruleName;

	/**
	 * Content MathML of the subtree that replaces the selected node
	 */
	public final String replacementContentForm;

	public final String replacementPresentationForm;

	public RewriteOption(String id, String label, String ruleName, String replacementContentForm,
	                     String replacementPresentationForm) {
		this.id = Objects.requireNonNull(id);
		this.label = label;
		this.ruleName = ruleName;
		this.replacementContentForm = Objects.requireNonNull(replacementContentForm);
		this.replacementPresentationForm = replacementPresentationForm;
	}

	@Override
	public String toString() {
		return String.format("RewriteOption(%s, %s, %s)", id, label, ruleName);
	}
}
