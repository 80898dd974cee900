package org.plankit.compilers.disjunctive;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import plankit.ast.Expression;
import plankit.ast.ExpressionManager;
import plankit.engine.ActionTable;
import plankit.engine.NameAllocator;
import plankit.engine.config.Reporter;
import plankit.engine.normal.Dnf;
import plankit.model.Fluent;
import plankit.model.InstantaneousAction;
import plankit.model.Problem;
import plankit.model.TimeInterval;
import plankit.model.Type;

/**
 * Replaces disjunctive goals by a flag fluent. For a goal whose normal form
 * is a disjunction, a fresh boolean flag becomes the goal, and one witness
 * action per disjunct sets the flag when its disjunct holds. Other goals are
 * installed unchanged.
 */
final class GoalDisjunctionEliminator {

    private final String prefix;
    private final Problem problem;
    private final NameAllocator names;
    private final ActionTable table;
    private final Dnf dnf;
    private final ConditionSplitter splitter;
    private final Reporter reporter;
    private final List<Fluent> flags = new ArrayList<>();

    GoalDisjunctionEliminator(String prefix, Problem problem, NameAllocator names, ActionTable table, Dnf dnf,
                              ConditionSplitter splitter, Reporter reporter) {
        this.prefix = prefix;
        this.problem = problem;
        this.names = names;
        this.table = table;
        this.dnf = dnf;
        this.splitter = splitter;
        this.reporter = reporter;
    }

    /**
     * Installs the conjunction of the given goals in the problem, as its goal
     * or as a timed goal.
     *
     * @param interval the interval of the timed goals, or null for the plain
     *            goals.
     */
    void eliminate(List<Expression> goals, TimeInterval interval) {
        ExpressionManager em = problem.manager();
        Expression goal = dnf.dnf(em.and(goals));
        if (!goal.isOr()) {
            install(goal, interval);
            return;
        }
        String base = interval == null ? prefix : prefix + "_timed";
        Fluent flag = new Fluent(names.fresh(base + "_fake_goal"), Type.BOOL);
        InstantaneousAction witness = new InstantaneousAction(base + "_fake_action", em);
        witness.addEffect(em.fluentExp(flag), em.TRUE());
        int witnesses = 0;
        for (Expression disjunct : goal.args()) {
            InstantaneousAction variant = splitter.variant(witness, disjunct);
            if (variant != null) {
                problem.addAction(variant);
                table.add(variant, null);
                witnesses++;
            }
        }
        problem.addFluent(flag, Boolean.FALSE);
        flags.add(flag);
        install(em.fluentExp(flag), interval);
        reporter.eliminatedGoal(interval, flag, witnesses);
    }

    private void install(Expression goal, TimeInterval interval) {
        if (interval == null)
            problem.addGoal(goal);
        else
            problem.addTimedGoal(interval, goal);
    }

    /** @return the flags created so far, in creation order. */
    List<Fluent> flags() {
        return Collections.unmodifiableList(flags);
    }
}
