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
package plankit.model;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * The set of features a problem uses, or an engine accepts.
 */
public final class ProblemKind {

	/** Groups of related features. */
	public enum Category {
		PROBLEM_CLASS, TYPING, NUMBERS, PROBLEM_TYPE, FLUENTS_TYPE, CONDITIONS_KIND, EFFECTS_KIND, TIME,
		SIMULATED_ENTITIES, QUALITY_METRICS
	}

	public enum Feature {
		ACTION_BASED(Category.PROBLEM_CLASS),
		FLAT_TYPING(Category.TYPING),
		HIERARCHICAL_TYPING(Category.TYPING),
		CONTINUOUS_NUMBERS(Category.NUMBERS),
		DISCRETE_NUMBERS(Category.NUMBERS),
		SIMPLE_NUMERIC_PLANNING(Category.PROBLEM_TYPE),
		GENERAL_NUMERIC_PLANNING(Category.PROBLEM_TYPE),
		NUMERIC_FLUENTS(Category.FLUENTS_TYPE),
		OBJECT_FLUENTS(Category.FLUENTS_TYPE),
		NEGATIVE_CONDITIONS(Category.CONDITIONS_KIND),
		DISJUNCTIVE_CONDITIONS(Category.CONDITIONS_KIND),
		EQUALITY(Category.CONDITIONS_KIND),
		EXISTENTIAL_CONDITIONS(Category.CONDITIONS_KIND),
		UNIVERSAL_CONDITIONS(Category.CONDITIONS_KIND),
		CONDITIONAL_EFFECTS(Category.EFFECTS_KIND),
		INCREASE_EFFECTS(Category.EFFECTS_KIND),
		DECREASE_EFFECTS(Category.EFFECTS_KIND),
		CONTINUOUS_TIME(Category.TIME),
		DISCRETE_TIME(Category.TIME),
		INTERMEDIATE_CONDITIONS_AND_EFFECTS(Category.TIME),
		TIMED_EFFECT(Category.TIME),
		TIMED_GOALS(Category.TIME),
		DURATION_INEQUALITIES(Category.TIME),
		SIMULATED_EFFECTS(Category.SIMULATED_ENTITIES),
		PLAN_LENGTH(Category.QUALITY_METRICS),
		MAKESPAN(Category.QUALITY_METRICS);

		private final Category category;

		private Feature(Category category) {
			this.category = category;
		}

		public Category category() {
			return category;
		}
	}

	private final EnumSet<Feature> features;

	public ProblemKind() {
		this.features = EnumSet.noneOf(Feature.class);
	}

	public ProblemKind(Collection<Feature> features) {
		this();
		this.features.addAll(features);
	}

	public ProblemKind set(Feature... fs) {
		Collections.addAll(features, fs);
		return this;
	}

	public ProblemKind unset(Feature feature) {
		features.remove(feature);
		return this;
	}

	public boolean has(Feature feature) {
		return features.contains(feature);
	}

	public Set<Feature> features() {
		return Collections.unmodifiableSet(features);
	}

	/**
	 * Returns true if every feature of this kind is also a feature of the
	 * given one.
	 */
	public boolean isSubsetOf(ProblemKind other) {
		return other.features.containsAll(features);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof ProblemKind && features.equals(((ProblemKind) o).features);
	}

	@Override
	public int hashCode() {
		return features.hashCode();
	}

	public String toString() {
		return features.toString();
	}
}
