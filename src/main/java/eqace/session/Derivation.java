package eqace.session;

import java.io.IOException;
import java.util.List;
import java.util.logging.Logger;

import eqace.Config;
import eqace.EquationException;
import eqace.ast.NodeAddressing;
import eqace.lexer.Notation;
import eqace.parser.LinearRenderer;
import eqace.parser.ParseResult;
import eqace.parser.Parser;
import eqace.rewrite.*;

import static eqace.ast.MathAST.ExprNode;

/**
 * A derivation: the parsed start expression followed by the steps produced by rewrites.
 * <p/>
 * Holds the selection (a stable id of a node in the current step) and the mirror toggle of its
 * {@link RewriteEngine}. Not thread safe, but the trees it hands out are immutable.
 */
public class Derivation {

	public static final Logger LOG = Logger.getLogger("Derivation");

	private final Notation notation;
	private final RewriteEngine engine;
	private final StepHistory history = new StepHistory();
	private String selection;

	public Derivation() {
		this(Config.getNotation(), new RewriteEngine());
	}

	public Derivation(Notation notation, RewriteEngine engine) {
		this.notation = notation;
		this.engine = engine;
	}

	/**
	 * Parses the start expression and records it as the first step.
	 * A failed parse leaves the derivation untouched and is returned as is.
	 */
	public ParseResult begin(String input){
		if (!history.isEmpty()){
			throw new EquationException("The derivation has already been started");
		}
		ParseResult result = Parser.parse(input, notation);
		if (result.isOk()){
			history.append(result.asOk().tree, null, null);
		}
		return result;
	}

	/**
	 * Selects the node with the passed id in the current step
	 *
	 * @return false if the current step has no such node, the selection is cleared in this case
	 */
	public boolean select(String nodeId){
		Step current = requireCurrent();
		if (NodeAddressing.contains(current.tree, nodeId)){
			selection = nodeId;
			return true;
		}
		selection = null;
		return false;
	}

	public String getSelection() {
		return selection;
	}

	/**
	 * Linear notation of the selected node, for the editable echo
	 *
	 * @return {@code null} if nothing is selected
	 */
	public String selectionAsText(){
		if (selection == null){
			return null;
		}
		return linearEcho(selection);
	}

	/**
	 * Linear notation of the node with the passed id in the current step
	 *
	 * @return {@code null} if the current step has no such node
	 */
	public String linearEcho(String nodeId){
		ExprNode node = NodeAddressing.findNodeById(requireCurrent().tree, nodeId);
		return node == null ? null : LinearRenderer.render(node);
	}

	/**
	 * Applies the operation to the selected node (or the whole expression if nothing is selected)
	 * and appends the result as a new step
	 */
	public Step apply(Operation operation){
		Step current = requireCurrent();
		String target = selection != null ? selection : current.tree.id;
		ExprNode result = engine.apply(current.tree, target, operation);
		return append(current, result, target, operation.ruleName());
	}

	/**
	 * Applies a rewrite option to the selected node and appends the result as a new step
	 */
	public Step applyOption(RewriteOption option){
		Step current = requireCurrent();
		if (selection == null){
			throw new EquationException("Select a node before applying a rewrite option");
		}
		ExprNode result = engine.applyOption(current.tree, selection, option);
		return append(current, result, selection, option.ruleName);
	}

	/**
	 * Asks the provider for the rewrite options of the selected node
	 */
	public List<RewriteOption> requestOptions(RewriteOptionsProvider provider) throws IOException {
		Step current = requireCurrent();
		if (selection == null){
			throw new EquationException("Select a node before requesting rewrite options");
		}
		return provider.rewriteOptions(new RewriteOptionsRequest(current.contentForm, selection));
	}

	private Step append(Step current, ExprNode result, String target, String ruleName){
		Step step = history.append(current.id, result, target, ruleName);
		LOG.fine(() -> String.format("%s: %s -> %s", ruleName, LinearRenderer.render(current.tree), LinearRenderer.render(result)));
		// the old selection is only kept if the node survived the rewrite
		if (selection != null && !NodeAddressing.contains(result, selection)){
			selection = null;
		}
		return step;
	}

	private Step requireCurrent(){
		Step current = history.current();
		if (current == null){
			throw new EquationException("The derivation hasn't been started");
		}
		return current;
	}

	public Step current(){
		return history.current();
	}

	public StepHistory getHistory() {
		return history;
	}

	public boolean isMirrored(){
		return engine.isMirrored();
	}

	public void setMirrored(boolean mirrored){
		engine.setMirrored(mirrored);
	}
}
