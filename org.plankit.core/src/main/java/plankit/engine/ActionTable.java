/* 
 * Plankit -- Copyright (c) 2024-present, the Plankit authors
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package plankit.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import plankit.model.Action;
import plankit.plans.ActionInstance;

/**
 * The actions produced by a compilation, each identified by an integer
 * handle, with the original action it stands for, or none for a synthetic
 * action. Produced actions may still be modified after being recorded; the
 * table refers to them by handle and name, never by their contents.
 */
public final class ActionTable {

	private final List<Action> actions = new ArrayList<Action>();
	private final List<Action> originals = new ArrayList<Action>();
	private final Map<String,Integer> handles = new HashMap<String,Integer>();

	/**
	 * Records a produced action.
	 * 
	 * @param original
	 *            the original action, or null for a synthetic one.
	 * @return the handle of the produced action.
	 * @throws IllegalArgumentException
	 *             if an action with the same name was already recorded.
	 */
	public int add(Action produced, Action original) {
		if (handles.containsKey(produced.name()))
			throw new IllegalArgumentException("Action " + produced.name() + " is already recorded");
		int handle = actions.size();
		actions.add(produced);
		originals.add(original);
		handles.put(produced.name(), handle);
		return handle;
	}

	public int size() {
		return actions.size();
	}

	public Action action(int handle) {
		return actions.get(handle);
	}

	/** @return the original action of the given handle, or null for a synthetic one. */
	public Action original(int handle) {
		return originals.get(handle);
	}

	/**
	 * @return the handle of the given action.
	 * @throws IllegalArgumentException
	 *             if the action was not recorded.
	 */
	public int handle(Action produced) {
		Integer h = handles.get(produced.name());
		if (h == null || actions.get(h) != produced)
			throw new IllegalArgumentException("Action " + produced.name() + " was not produced by this compilation");
		return h;
	}

	/** @return the produced actions that stand for an original action. */
	public List<Action> meaningfulActions() {
		List<Action> res = new ArrayList<Action>();
		for (int i = 0; i < actions.size(); i++)
			if (originals.get(i) != null)
				res.add(actions.get(i));
		return res;
	}

	/**
	 * Returns a function mapping instances of the recorded actions to
	 * instances of their originals, with the same actual parameters, and
	 * instances of synthetic actions to null. The function works on a
	 * snapshot of the table.
	 */
	public Function<ActionInstance,ActionInstance> translator() {
		final List<Action> acts = Collections.unmodifiableList(new ArrayList<Action>(actions));
		final List<Action> origs = Collections.unmodifiableList(new ArrayList<Action>(originals));
		final Map<String,Integer> hs = Collections.unmodifiableMap(new HashMap<String,Integer>(handles));
		return ai -> {
			Integer h = hs.get(ai.action().name());
			if (h == null || acts.get(h) != ai.action())
				throw new IllegalArgumentException("Unknown action " + ai.action().name());
			Action original = origs.get(h);
			return original == null ? null : new ActionInstance(original, ai.actualParameters());
		};
	}
}
