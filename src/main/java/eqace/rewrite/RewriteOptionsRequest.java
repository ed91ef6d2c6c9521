package eqace.rewrite;

import java.util.Objects;

public class RewriteOptionsRequest {

	public final String contentForm;
	public final String selectedNodeId;

	public RewriteOptionsRequest(String contentForm, String selectedNodeId) {
		this.contentForm = Objects.requireNonNull(contentForm);
		this.selectedNodeId = Objects.requireNonNull(selectedNodeId);
	}
}
