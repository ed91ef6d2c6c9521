package eqace.session;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import eqace.EquationException;
import eqace.ast.StableIds;

import static eqace.ast.MathAST.ExprNode;

/**
 * Append only, linear history of steps: every new step continues the current last step.
 */
public class StepHistory {

	private final List<Step> steps = new ArrayList<>();
	private int idCounter = 0;

	/**
	 * Adds a step after the current last one
	 *
	 * @param tree tree of the new step, stable ids are assigned if it doesn't have them
	 */
	public Step append(ExprNode tree, String selection, String appliedRuleName){
		if (!tree.hasId()){
			tree = StableIds.assign(tree);
		}
		Step parent = current();
		Step step = new Step("step-" + (++idCounter), parent == null ? null : parent.id, tree, selection, appliedRuleName);
		steps.add(step);
		return step;
	}

	/**
	 * Adds a step after the passed parent, which has to be the current last step
	 */
	public Step append(String parentId, ExprNode tree, String selection, String appliedRuleName){
		Step parent = current();
		if (parent == null ? parentId != null : !parent.id.equals(parentId)){
			throw new EquationException(String.format("Steps can only be appended to the last step %s, not to %s",
					parent == null ? "<none>" : parent.id, parentId));
		}
		return append(tree, selection, appliedRuleName);
	}

	/**
	 * @return the last step or {@code null} if the history is empty
	 */
	public Step current(){
		return steps.isEmpty() ? null : steps.get(steps.size() - 1);
	}

	/**
	 * @return {@code null} if there is no step with this id
	 */
	public Step get(String id){
		for (Step step : steps){
			if (step.id.equals(id)){
				return step;
			}
		}
		return null;
	}

	public List<Step> steps(){
		return Collections.unmodifiableList(steps);
	}

	public int size(){
		return steps.size();
	}

	public boolean isEmpty(){
		return steps.isEmpty();
	}
}
