package org.plankit.compilers.disjunctive;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import plankit.ast.Expression;
import plankit.engine.NameAllocator;
import plankit.engine.normal.Dnf;
import plankit.engine.normal.Simplifier;
import plankit.model.DurativeAction;
import plankit.model.Effect;
import plankit.model.TimeInterval;
import plankit.model.Timing;
import plankit.util.CartesianProduct;

/**
 * Splits a durative action into one variant per combination of disjuncts,
 * one disjunct chosen for every interval the action has conditions on.
 * Combinations are enumerated lazily.
 */
final class DurativeConditionSplitter {

    private final Dnf dnf;
    private final Simplifier simplifier;
    private final NameAllocator names;
    private final ConditionSplitter effects;

    DurativeConditionSplitter(Dnf dnf, Simplifier simplifier, NameAllocator names, ConditionSplitter effects) {
        this.dnf = dnf;
        this.simplifier = simplifier;
        this.names = names;
        this.effects = effects;
    }

    List<DurativeAction> split(DurativeAction action) {
        List<TimeInterval> intervals = new ArrayList<>();
        List<List<Expression>> alternatives = new ArrayList<>();
        for (Map.Entry<TimeInterval,List<Expression>> e : action.conditions().entrySet()) {
            intervals.add(e.getKey());
            alternatives.add(Dnf.disjuncts(dnf.dnf(action.manager().and(e.getValue()))));
        }
        List<DurativeAction> variants = new ArrayList<>();
        for (List<Expression> combination : new CartesianProduct<>(alternatives)) {
            DurativeAction variant = variant(action, intervals, combination);
            if (variant != null)
                variants.add(variant);
        }
        return variants;
    }

    private DurativeAction variant(DurativeAction action, List<TimeInterval> intervals, List<Expression> combination) {
        List<Expression> conditions = new ArrayList<>(combination.size());
        for (Expression c : combination) {
            Expression condition = simplifier.simplify(c);
            if (condition.isFalse())
                return null;
            conditions.add(condition);
        }
        DurativeAction variant = action.copy(names.fresh(action.name()));
        variant.clearConditions();
        for (int i = 0; i < intervals.size(); i++)
            for (Expression c : ConditionSplitter.conjuncts(conditions.get(i)))
                variant.addCondition(intervals.get(i), c);
        variant.clearEffects();
        for (Map.Entry<Timing,List<Effect>> e : action.effects().entrySet())
            for (Effect effect : e.getValue())
                for (Effect r : effects.rebuild(effect))
                    variant.addEffect(e.getKey(), r);
        return variant.allEffects().isEmpty() ? null : variant;
    }
}
