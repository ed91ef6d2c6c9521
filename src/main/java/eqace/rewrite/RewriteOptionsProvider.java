package eqace.rewrite;

import java.io.IOException;
import java.util.List;

/**
 * The external service that knows which rewrites apply to a selected node.
 * The engine only consumes its answers, it doesn't implement it.
 */
public interface RewriteOptionsProvider {

	/**
	 * @return options in the order in which they should be offered
	 * @throws IOException if the service can't be reached
	 */
	List<RewriteOption> rewriteOptions(RewriteOptionsRequest request) throws IOException;
}
