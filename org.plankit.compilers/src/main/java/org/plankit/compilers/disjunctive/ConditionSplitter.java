package org.plankit.compilers.disjunctive;

import java.util.ArrayList;
import java.util.List;

import plankit.ast.Expression;
import plankit.engine.NameAllocator;
import plankit.engine.normal.Dnf;
import plankit.engine.normal.Simplifier;
import plankit.model.Effect;
import plankit.model.InstantaneousAction;

/**
 * Splits an instantaneous action into one variant per disjunct of its
 * preconditions. Each variant has the conjuncts of its disjunct as
 * preconditions and no disjunction in its effect guards.
 */
final class ConditionSplitter {

    private final Dnf dnf;
    private final Simplifier simplifier;
    private final NameAllocator names;

    ConditionSplitter(Dnf dnf, Simplifier simplifier, NameAllocator names) {
        this.dnf = dnf;
        this.simplifier = simplifier;
        this.names = names;
    }

    /**
     * Returns the variants of the given action, in the order of the disjuncts
     * of its preconditions. Contradictory variants and variants left without
     * effects are omitted.
     */
    List<InstantaneousAction> split(InstantaneousAction action) {
        Expression precondition = dnf.dnf(action.manager().and(action.preconditions()));
        List<InstantaneousAction> variants = new ArrayList<>();
        for (Expression disjunct : Dnf.disjuncts(precondition)) {
            InstantaneousAction variant = variant(action, disjunct);
            if (variant != null)
                variants.add(variant);
        }
        return variants;
    }

    /**
     * Returns a copy of the given action, under a fresh name, with the given
     * conjunction as precondition, or null if the conjunction is
     * contradictory or the copy has no effect left.
     */
    InstantaneousAction variant(InstantaneousAction action, Expression conjunction) {
        Expression precondition = simplifier.simplify(conjunction);
        if (precondition.isFalse())
            return null;
        InstantaneousAction variant = action.copy(names.fresh(action.name()));
        variant.clearPreconditions();
        for (Expression c : conjuncts(precondition))
            variant.addPrecondition(c);
        variant.clearEffects();
        for (Effect e : action.effects())
            for (Effect r : rebuild(e))
                variant.addEffect(r);
        return variant.effects().isEmpty() ? null : variant;
    }

    /**
     * Returns the effects replacing the given one: the effect itself if it
     * is unconditional, otherwise one copy per satisfiable disjunct of its
     * guard.
     */
    List<Effect> rebuild(Effect effect) {
        if (!effect.isConditional())
            return List.of(effect);
        Expression guard = simplifier.simplify(dnf.dnf(effect.condition()));
        if (guard.isFalse())
            return List.of();
        if (!guard.isOr())
            return List.of(effect.withCondition(guard));
        List<Effect> res = new ArrayList<>(guard.args().size());
        for (Expression disjunct : guard.args())
            if (!disjunct.isFalse())
                res.add(effect.withCondition(disjunct));
        return res;
    }

    static List<Expression> conjuncts(Expression e) {
        return e.isAnd() ? e.args() : List.of(e);
    }
}
