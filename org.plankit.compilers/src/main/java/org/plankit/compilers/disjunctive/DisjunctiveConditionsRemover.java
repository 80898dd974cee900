package org.plankit.compilers.disjunctive;

import static plankit.model.ProblemKind.Feature.*;

import java.util.List;
import java.util.Map;

import aQute.bnd.annotation.spi.ServiceProvider;
import plankit.ast.Expression;
import plankit.engine.AbstractCompiler;
import plankit.engine.ActionTable;
import plankit.engine.CompilationKind;
import plankit.engine.Compiler;
import plankit.engine.CompilerResult;
import plankit.engine.NameAllocator;
import plankit.engine.UnsupportedConstructException;
import plankit.engine.config.Options;
import plankit.engine.normal.Dnf;
import plankit.engine.normal.Simplifier;
import plankit.model.Action;
import plankit.model.DurativeAction;
import plankit.model.InstantaneousAction;
import plankit.model.Problem;
import plankit.model.ProblemKind;
import plankit.model.TimeInterval;

/**
 * Compiles a problem into an equivalent one without disjunctive conditions.
 * <p>
 * Every action is split into variants whose preconditions, or durative
 * conditions, are conjunctions: one variant per disjunct of the disjunctive
 * normal form of its conditions. Conditional effects are split the same way
 * on their guards. A disjunctive goal is replaced by a fresh flag fluent,
 * set by one witness action per disjunct of the goal and cleared by every
 * other action, so that a plan reaching the flag ends in a state satisfying
 * the goal.
 * <p>
 * Plans of the compiled problem are translated back by mapping each variant
 * to its original action and dropping the witness actions.
 */
@ServiceProvider(Compiler.class)
public class DisjunctiveConditionsRemover extends AbstractCompiler {

    public static final String NAME = "dcrm";

    private static final ProblemKind SUPPORTED_KIND = new ProblemKind().set(
            ACTION_BASED,
            FLAT_TYPING, HIERARCHICAL_TYPING,
            CONTINUOUS_NUMBERS, DISCRETE_NUMBERS,
            SIMPLE_NUMERIC_PLANNING, GENERAL_NUMERIC_PLANNING,
            NUMERIC_FLUENTS, OBJECT_FLUENTS,
            NEGATIVE_CONDITIONS, DISJUNCTIVE_CONDITIONS, EQUALITY, EXISTENTIAL_CONDITIONS, UNIVERSAL_CONDITIONS,
            CONDITIONAL_EFFECTS, INCREASE_EFFECTS, DECREASE_EFFECTS,
            CONTINUOUS_TIME, DISCRETE_TIME, INTERMEDIATE_CONDITIONS_AND_EFFECTS, TIMED_EFFECT, TIMED_GOALS,
            DURATION_INEQUALITIES,
            SIMULATED_EFFECTS);

    public DisjunctiveConditionsRemover() {
        this(new Options());
    }

    public DisjunctiveConditionsRemover(Options options) {
        super(options);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ProblemKind supportedKind() {
        return new ProblemKind(SUPPORTED_KIND.features());
    }

    @Override
    public boolean supportsCompilation(CompilationKind compilationKind) {
        return compilationKind == CompilationKind.DISJUNCTIVE_CONDITIONS_REMOVING;
    }

    @Override
    public CompilationKind defaultCompilationKind() {
        return CompilationKind.DISJUNCTIVE_CONDITIONS_REMOVING;
    }

    @Override
    public ProblemKind resultingProblemKind(ProblemKind kind, CompilationKind compilationKind) {
        return new ProblemKind(kind.features()).unset(DISJUNCTIVE_CONDITIONS);
    }

    @Override
    protected CompilerResult doCompile(Problem problem, CompilationKind compilationKind) {
        Problem compiled = problem.copy();
        compiled.setName(NAME + "_" + problem.name());
        compiled.clearActions();
        compiled.clearGoals();
        compiled.clearTimedGoals();

        NameAllocator names = new NameAllocator(compiled);
        ActionTable table = new ActionTable();
        Dnf dnf = new Dnf(compiled.manager());
        Simplifier simplifier = new Simplifier(compiled.manager());
        ConditionSplitter splitter = new ConditionSplitter(dnf, simplifier, names);
        DurativeConditionSplitter durativeSplitter = new DurativeConditionSplitter(dnf, simplifier, names, splitter);

        for (Action a : problem.actions()) {
            List<? extends Action> variants;
            if (a instanceof InstantaneousAction)
                variants = splitter.split((InstantaneousAction) a);
            else if (a instanceof DurativeAction)
                variants = durativeSplitter.split((DurativeAction) a);
            else
                throw new UnsupportedConstructException(name() + " cannot compile action " + a.name() + " of "
                        + a.getClass().getSimpleName());
            for (Action v : variants) {
                compiled.addAction(v);
                table.add(v, a);
            }
            options.reporter().splitAction(a, variants.size());
        }
        List<Action> meaningful = table.meaningfulActions();

        GoalDisjunctionEliminator goals = new GoalDisjunctionEliminator(NAME, compiled, names, table, dnf, splitter,
                options.reporter());
        goals.eliminate(problem.goals(), null);
        for (Map.Entry<TimeInterval,List<Expression>> e : problem.timedGoals().entrySet())
            goals.eliminate(e.getValue(), e.getKey());

        new FlagResetInjector(compiled.manager()).inject(goals.flags(), meaningful);
        options.reporter().compiled(name(), compiled);

        return new CompilerResult(compiled, table.translator(), name());
    }
}
