package org.plankit.compilers.disjunctive;

import java.util.List;

import plankit.ast.ExpressionManager;
import plankit.engine.UnsupportedConstructException;
import plankit.model.Action;
import plankit.model.DurativeAction;
import plankit.model.Fluent;
import plankit.model.InstantaneousAction;
import plankit.model.Timing;

/**
 * Makes every action that changes the world clear the goal flags, so that a
 * flag only holds if its goal is witnessed after the last such action.
 * Durative actions clear the flags at each of their effect timings.
 */
final class FlagResetInjector {

    private final ExpressionManager em;

    FlagResetInjector(ExpressionManager em) {
        this.em = em;
    }

    void inject(List<Fluent> flags, List<Action> actions) {
        if (flags.isEmpty())
            return;
        for (Action a : actions) {
            if (a instanceof InstantaneousAction) {
                InstantaneousAction ia = (InstantaneousAction) a;
                for (Fluent flag : flags)
                    ia.addEffect(em.fluentExp(flag), em.FALSE());
            } else if (a instanceof DurativeAction) {
                DurativeAction da = (DurativeAction) a;
                for (Timing t : da.effects().keySet())
                    for (Fluent flag : flags)
                        da.addEffect(t, em.fluentExp(flag), em.FALSE());
            } else {
                throw new UnsupportedConstructException("Cannot reset flags in action " + a.name() + " of "
                        + a.getClass().getSimpleName());
            }
        }
    }
}
