package org.plankit.compilers.disjunctive;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.Timeout;

import plankit.ast.Expression;
import plankit.ast.ExpressionManager;
import plankit.ast.FluentExpression;
import plankit.engine.CompilationKind;
import plankit.engine.Compiler;
import plankit.engine.CompilerResult;
import plankit.engine.Compilers;
import plankit.engine.Evaluator;
import plankit.engine.UnsupportedConstructException;
import plankit.engine.UsageException;
import plankit.engine.config.AbstractReporter;
import plankit.engine.config.Options;
import plankit.model.Action;
import plankit.model.DurativeAction;
import plankit.model.Effect;
import plankit.model.Fluent;
import plankit.model.InstantaneousAction;
import plankit.model.Problem;
import plankit.model.ProblemKind;
import plankit.model.QualityMetric;
import plankit.model.TimeInterval;
import plankit.model.Timing;
import plankit.plans.ActionInstance;
import plankit.plans.SequentialPlan;

public class DisjunctiveConditionsRemoverTest {

    @Rule
    public Timeout globalTimeout = Timeout.seconds(30);

    private Problem problem;
    private ExpressionManager em;
    private FluentExpression p, q, r, s, x, y;
    private RecordingReporter reporter;
    private DisjunctiveConditionsRemover remover;

    @Before
    public void setUp() {
        problem = new Problem("basic");
        em = problem.manager();
        for (String n : new String[] { "p", "q", "r", "s", "x", "y" })
            problem.addFluent(new Fluent(n), false);
        p = em.fluentExp(problem.fluent("p"));
        q = em.fluentExp(problem.fluent("q"));
        r = em.fluentExp(problem.fluent("r"));
        s = em.fluentExp(problem.fluent("s"));
        x = em.fluentExp(problem.fluent("x"));
        y = em.fluentExp(problem.fluent("y"));
        reporter = new RecordingReporter();
        Options options = new Options();
        options.setReporter(reporter);
        remover = new DisjunctiveConditionsRemover(options);
    }

    private InstantaneousAction action(String name, Expression precondition, FluentExpression effect) {
        InstantaneousAction a = new InstantaneousAction(name, em);
        a.addPrecondition(precondition);
        a.addEffect(effect, true);
        problem.addAction(a);
        return a;
    }

    private static List<String> names(List<Action> actions) {
        List<String> res = new ArrayList<>();
        for (Action a : actions)
            res.add(a.name());
        return res;
    }

    private static InstantaneousAction instantaneous(Problem problem, String name) {
        return (InstantaneousAction) problem.action(name);
    }

    @Test
    public void testSplitsDisjunctivePrecondition() {
        InstantaneousAction a = action("a", em.or(em.and(p, q), r), s);
        problem.addGoal(s);

        CompilerResult res = remover.compile(problem);
        Problem compiled = res.problem();

        assertEquals("dcrm_basic", compiled.name());
        assertEquals("dcrm", res.engineName());
        assertEquals(List.of("a", "a_0"), names(compiled.actions()));
        assertEquals(List.of(p, q), instantaneous(compiled, "a").preconditions());
        assertEquals(List.of(r), instantaneous(compiled, "a_0").preconditions());
        for (Action v : compiled.actions()) {
            assertEquals(a.effects(), ((InstantaneousAction) v).effects());
            assertSame(a, res.mapBackActionInstance().apply(new ActionInstance(v)).action());
        }
        assertEquals(List.of(s), compiled.goals());
        assertEquals(Map.of(a, 2), reporter.splits);
        assertFalse(compiled.kind().has(ProblemKind.Feature.DISJUNCTIVE_CONDITIONS));
    }

    @Test
    public void testDisjunctiveGoalBecomesFlag() {
        InstantaneousAction a = action("a", p, s);
        problem.addGoal(em.or(x, y));

        CompilerResult res = remover.compile(problem);
        Problem compiled = res.problem();

        Fluent flag = compiled.fluent("dcrm_fake_goal");
        FluentExpression flagExp = em.fluentExp(flag);
        assertSame(em.FALSE(), compiled.fluentDefault(flag));
        assertEquals(List.of(flagExp), compiled.goals());
        assertEquals(List.of("a", "dcrm_fake_action", "dcrm_fake_action_0"), names(compiled.actions()));

        InstantaneousAction w0 = instantaneous(compiled, "dcrm_fake_action");
        InstantaneousAction w1 = instantaneous(compiled, "dcrm_fake_action_0");
        assertEquals(List.of(x), w0.preconditions());
        assertEquals(List.of(y), w1.preconditions());
        assertEquals(List.of(new Effect(flagExp, em.TRUE())), w0.effects());
        assertEquals(List.of(new Effect(flagExp, em.TRUE())), w1.effects());
        assertNull(res.mapBackActionInstance().apply(new ActionInstance(w0)));

        List<Effect> expected = new ArrayList<>(a.effects());
        expected.add(new Effect(flagExp, em.FALSE()));
        assertEquals(expected, instantaneous(compiled, "a").effects());
        assertEquals(List.of(flag), reporter.flags);
    }

    @Test
    public void testConjunctiveGoalsAreKept() {
        action("a", p, s);
        problem.addGoal(x);
        problem.addGoal(y);
        Problem compiled = remover.compile(problem).problem();
        assertEquals(List.of(em.and(x, y)), compiled.goals());
        assertFalse(compiled.hasFluent("dcrm_fake_goal"));
    }

    @Test
    public void testContradictionRemovesAction() {
        InstantaneousAction a = action("a", em.and(p, em.not(p)), s);
        Problem compiled = remover.compile(problem).problem();
        assertTrue(compiled.actions().isEmpty());
        assertEquals(Map.of(a, 0), reporter.splits);
    }

    @Test
    public void testTrueDisjunctGivesUnconditionedVariant() {
        action("a", em.or(p, em.not(em.FALSE())), s);
        Problem compiled = remover.compile(problem).problem();
        assertEquals(List.of("a", "a_0"), names(compiled.actions()));
        assertEquals(List.of(p), instantaneous(compiled, "a").preconditions());
        assertTrue(instantaneous(compiled, "a_0").preconditions().isEmpty());
    }

    @Test
    public void testConditionalEffectsAreSplit() {
        InstantaneousAction a = new InstantaneousAction("a", em);
        a.addPrecondition(p);
        a.addEffect(s, true, em.or(q, r));
        a.addEffect(x, true, em.and(q, em.not(q)));
        a.addEffect(y, true, em.and(q, em.TRUE()));
        problem.addAction(a);

        InstantaneousAction v = instantaneous(remover.compile(problem).problem(), "a");
        assertEquals(List.of(
                new Effect(s, em.TRUE(), q, Effect.Kind.ASSIGN),
                new Effect(s, em.TRUE(), r, Effect.Kind.ASSIGN),
                new Effect(y, em.TRUE(), q, Effect.Kind.ASSIGN)), v.effects());
    }

    @Test
    public void testVariantWithoutEffectsIsDropped() {
        InstantaneousAction a = new InstantaneousAction("a", em);
        a.addPrecondition(em.or(p, q));
        a.addEffect(x, true, em.and(r, em.not(r)));
        problem.addAction(a);
        assertTrue(remover.compile(problem).problem().actions().isEmpty());
    }

    @Test
    public void testPreconditionsAreEquivalent() {
        InstantaneousAction a = action("a", em.not(em.and(em.implies(p, q), em.or(r, em.not(s)))), x);
        Problem compiled = remover.compile(problem).problem();
        for (int bits = 0; bits < 16; bits++) {
            Map<FluentExpression,Expression> state = new HashMap<>();
            state.put(p, em.bool((bits & 1) != 0));
            state.put(q, em.bool((bits & 2) != 0));
            state.put(r, em.bool((bits & 4) != 0));
            state.put(s, em.bool((bits & 8) != 0));
            Evaluator ev = new Evaluator(problem, state);
            boolean applicable = ev.holds(em.and(a.preconditions()), Map.of());
            boolean someVariant = false;
            for (Action v : compiled.actions()) {
                InstantaneousAction ia = (InstantaneousAction) v;
                for (Expression c : ia.preconditions())
                    assertFalse(c + " is disjunctive", c.isOr());
                if (ev.holds(em.and(ia.preconditions()), Map.of())) {
                    someVariant = true;
                    assertEquals(ev.apply(a.effects(), Map.of()), ev.apply(ia.effects(), Map.of()));
                }
            }
            assertEquals("state " + bits, applicable, someVariant);
        }
    }

    @Test
    public void testDurativeCombinations() {
        DurativeAction d = new DurativeAction("d", em);
        d.setFixedDuration(3);
        TimeInterval overall = TimeInterval.closed(Timing.START, Timing.END);
        d.addCondition(Timing.START, em.or(p, q));
        d.addCondition(overall, em.or(r, em.and(s, x)));
        d.addEffect(Timing.END, y, true);
        problem.addAction(d);

        CompilerResult res = remover.compile(problem);
        Problem compiled = res.problem();
        assertEquals(List.of("d", "d_0", "d_1", "d_2"), names(compiled.actions()));
        DurativeAction third = (DurativeAction) compiled.action("d_1");
        assertEquals(Map.of(TimeInterval.at(Timing.START), List.of(q), overall, List.of(r)), third.conditions());
        DurativeAction second = (DurativeAction) compiled.action("d_0");
        assertEquals(Map.of(TimeInterval.at(Timing.START), List.of(p), overall, List.of(s, x)), second.conditions());
        for (Action v : compiled.actions()) {
            assertEquals(d.duration(), ((DurativeAction) v).duration());
            assertEquals(d.effects(), ((DurativeAction) v).effects());
            assertSame(d, res.mapBackActionInstance().apply(new ActionInstance(v)).action());
        }
    }

    @Test
    public void testDurativeContradictionDropsCombination() {
        DurativeAction d = new DurativeAction("d", em);
        d.addCondition(Timing.START, em.or(p, em.and(q, em.not(q))));
        d.addCondition(Timing.END, em.or(r, s));
        d.addEffect(Timing.END, y, true);
        problem.addAction(d);

        Problem compiled = remover.compile(problem).problem();
        assertEquals(2, compiled.actions().size());
        for (Action v : compiled.actions())
            assertEquals(List.of(p), ((DurativeAction) v).conditions().get(TimeInterval.at(Timing.START)));
    }

    @Test
    public void testDurativeConditionalEffects() {
        DurativeAction d = new DurativeAction("d", em);
        d.addCondition(Timing.START, p);
        d.addEffect(Timing.START, y, true, em.or(q, r));
        d.addEffect(Timing.END, x, true, em.and(q, em.not(q)));
        problem.addAction(d);

        DurativeAction v = (DurativeAction) remover.compile(problem).problem().action("d");
        assertEquals(Map.of(Timing.START, List.of(
                new Effect(y, em.TRUE(), q, Effect.Kind.ASSIGN),
                new Effect(y, em.TRUE(), r, Effect.Kind.ASSIGN))), v.effects());
    }

    @Test
    public void testDurativeWithoutEffectsIsDropped() {
        DurativeAction d = new DurativeAction("d", em);
        d.addCondition(Timing.START, p);
        d.addEffect(Timing.END, y, true, em.FALSE());
        problem.addAction(d);
        assertTrue(remover.compile(problem).problem().actions().isEmpty());
        assertEquals(Map.of(d, 0), reporter.splits);
    }

    @Test
    public void testDurativeContradictionTakesNoName() {
        DurativeAction d = new DurativeAction("d", em);
        d.addCondition(Timing.START, em.or(em.and(q, em.not(q)), p));
        d.addEffect(Timing.END, y, true);
        problem.addAction(d);

        Problem compiled = remover.compile(problem).problem();
        assertEquals(List.of("d"), names(compiled.actions()));
        assertEquals(List.of(p), ((DurativeAction) compiled.action("d")).conditions().get(TimeInterval.at(Timing.START)));
    }

    @Test
    public void testContradictoryGoalDisjunct() {
        action("a", p, s);
        problem.addGoal(em.or(em.and(x, em.not(x)), y));

        Problem compiled = remover.compile(problem).problem();
        assertEquals(List.of("a", "dcrm_fake_action"), names(compiled.actions()));
        assertEquals(List.of(y), instantaneous(compiled, "dcrm_fake_action").preconditions());
        assertEquals(List.of(1), reporter.witnesses);
    }

    @Test
    public void testDurativeWithoutConditions() {
        DurativeAction d = new DurativeAction("d", em);
        d.addEffect(Timing.START, y, true);
        problem.addAction(d);
        Problem compiled = remover.compile(problem).problem();
        assertEquals(List.of("d"), names(compiled.actions()));
        assertTrue(((DurativeAction) compiled.action("d")).conditions().isEmpty());
    }

    @Test
    public void testFlagsAreResetAtEveryEffectTiming() {
        DurativeAction d = new DurativeAction("d", em);
        d.addCondition(Timing.START, p);
        d.addEffect(Timing.START, x, false);
        d.addEffect(Timing.start(2), y, true);
        d.addEffect(Timing.END, s, true);
        problem.addAction(d);
        problem.addGoal(em.or(x, y));
        problem.addTimedGoal(Timing.GLOBAL_END, em.or(r, s));

        Problem compiled = remover.compile(problem).problem();
        FluentExpression flag = em.fluentExp(compiled.fluent("dcrm_fake_goal"));
        FluentExpression timedFlag = em.fluentExp(compiled.fluent("dcrm_timed_fake_goal"));
        DurativeAction v = (DurativeAction) compiled.action("d");
        assertEquals(3, v.effects().size());
        for (List<Effect> effects : v.effects().values()) {
            assertEquals(3, effects.size());
            assertEquals(new Effect(flag, em.FALSE()), effects.get(1));
            assertEquals(new Effect(timedFlag, em.FALSE()), effects.get(2));
        }
        assertEquals(Map.of(TimeInterval.at(Timing.GLOBAL_END), List.of(timedFlag)), compiled.timedGoals());
        assertEquals(List.of(flag), compiled.goals());
        assertTrue(compiled.hasAction("dcrm_timed_fake_action"));
        assertTrue(compiled.hasAction("dcrm_timed_fake_action_0"));
        assertEquals(1, instantaneous(compiled, "dcrm_timed_fake_action").effects().size());
    }

    @Test
    public void testSeveralTimedGoals() {
        action("a", p, s);
        TimeInterval first = TimeInterval.at(Timing.globalStart(5));
        TimeInterval second = TimeInterval.closed(Timing.globalStart(6), Timing.GLOBAL_END);
        problem.addTimedGoal(first, em.or(x, y));
        problem.addTimedGoal(second, em.or(r, q));
        problem.addTimedGoal(second, s);

        Problem compiled = remover.compile(problem).problem();
        FluentExpression f0 = em.fluentExp(compiled.fluent("dcrm_timed_fake_goal"));
        FluentExpression f1 = em.fluentExp(compiled.fluent("dcrm_timed_fake_goal_0"));
        assertEquals(List.of(f0), compiled.timedGoals().get(first));
        assertEquals(List.of(f1), compiled.timedGoals().get(second));
        assertEquals(List.of("a", "dcrm_timed_fake_action", "dcrm_timed_fake_action_0", "dcrm_timed_fake_action_1",
                "dcrm_timed_fake_action_2"), names(compiled.actions()));
        assertEquals(List.of(r, s), instantaneous(compiled, "dcrm_timed_fake_action_1").preconditions());
        assertEquals(3, instantaneous(compiled, "a").effects().size());
        assertEquals(2, reporter.flags.size());
    }

    @Test
    public void testMapBackPlan() {
        action("a", em.or(p, q), s);
        action("b", r, x);
        problem.addGoal(em.or(s, x));
        CompilerResult res = remover.compile(problem);
        Problem compiled = res.problem();
        assertSame(compiled, reporter.compiled);

        SequentialPlan plan = new SequentialPlan(List.of(
                new ActionInstance(compiled.action("a_0")),
                new ActionInstance(compiled.action("b")),
                new ActionInstance(compiled.action("dcrm_fake_action_0"))));
        SequentialPlan back = res.mapBack(plan);
        assertEquals(List.of(new ActionInstance(problem.action("a")), new ActionInstance(problem.action("b"))),
                back.actions());
    }

    @Test
    public void testOriginalProblemIsUntouched() {
        InstantaneousAction a = action("a", em.or(p, q), s);
        problem.addGoal(em.or(x, y));
        remover.compile(problem);
        assertEquals("basic", problem.name());
        assertEquals(List.of(a), problem.actions());
        assertEquals(List.of(em.or(p, q)), a.preconditions());
        assertEquals(1, a.effects().size());
        assertEquals(List.of(em.or(x, y)), problem.goals());
        assertFalse(problem.hasFluent("dcrm_fake_goal"));
    }

    @Test
    public void testResultingKind() {
        action("a", em.or(em.and(p, q), em.not(r)), s);
        problem.addGoal(em.or(x, y));
        ProblemKind input = problem.kind();
        assertTrue(input.has(ProblemKind.Feature.DISJUNCTIVE_CONDITIONS));
        Problem compiled = remover.compile(problem).problem();
        ProblemKind expected = remover.resultingProblemKind(input, CompilationKind.DISJUNCTIVE_CONDITIONS_REMOVING);
        assertFalse(expected.has(ProblemKind.Feature.DISJUNCTIVE_CONDITIONS));
        assertTrue(compiled.kind().isSubsetOf(expected));
    }

    @Test(expected = UsageException.class)
    public void testWrongCompilationKind() {
        remover.compile(problem, CompilationKind.GROUNDING);
    }

    @Test(expected = UsageException.class)
    public void testUnsupportedMetric() {
        action("a", p, s);
        problem.addQualityMetric(QualityMetric.MINIMIZE_MAKESPAN);
        remover.compile(problem);
    }

    @Test
    public void testFailedChecksAsWarnings() {
        action("a", em.or(p, q), s);
        problem.addQualityMetric(QualityMetric.MINIMIZE_SEQUENTIAL_PLAN_LENGTH);
        remover.options().setErrorOnFailedChecks(false);
        Problem compiled = remover.compile(problem).problem();
        assertEquals(2, compiled.actions().size());
        assertEquals(1, reporter.warnings.size());
        assertTrue(reporter.warnings.get(0).contains("PLAN_LENGTH"));
    }

    @Test
    public void testSkipChecks() {
        action("a", p, s);
        problem.addQualityMetric(QualityMetric.MINIMIZE_MAKESPAN);
        remover.options().setSkipChecks(true);
        assertEquals(1, remover.compile(problem).problem().actions().size());
        assertTrue(reporter.warnings.isEmpty());
    }

    @Test(expected = UnsupportedConstructException.class)
    public void testUnknownActionClass() {
        problem.addAction(new EventAction("tick", em));
        remover.compile(problem);
    }

    @Test
    public void testCapabilities() {
        assertTrue(remover.supportsCompilation(CompilationKind.DISJUNCTIVE_CONDITIONS_REMOVING));
        assertFalse(remover.supportsCompilation(CompilationKind.QUANTIFIERS_REMOVING));
        assertEquals(CompilationKind.DISJUNCTIVE_CONDITIONS_REMOVING, remover.defaultCompilationKind());
        assertTrue(remover.supportedKind().has(ProblemKind.Feature.TIMED_GOALS));
        assertFalse(remover.supportedKind().has(ProblemKind.Feature.MAKESPAN));
        assertFalse(remover.supports(new ProblemKind().set(ProblemKind.Feature.PLAN_LENGTH)));
    }

    @Test
    public void testServiceLookup() {
        Compiler c = Compilers.forKind(CompilationKind.DISJUNCTIVE_CONDITIONS_REMOVING);
        assertTrue(c instanceof DisjunctiveConditionsRemover);
        assertEquals("dcrm", c.name());
    }

    @Test(expected = UsageException.class)
    public void testNoServiceForKind() {
        Compilers.forKind(CompilationKind.GROUNDING);
    }

    private static final class RecordingReporter extends AbstractReporter {
        final Map<Action,Integer> splits = new HashMap<>();
        final List<Fluent> flags = new ArrayList<>();
        final List<Integer> witnesses = new ArrayList<>();
        final List<String> warnings = new ArrayList<>();
        Problem compiled;

        @Override
        public void splitAction(Action original, int variants) {
            splits.put(original, variants);
        }

        @Override
        public void eliminatedGoal(TimeInterval interval, Fluent flag, int witnesses) {
            flags.add(flag);
            this.witnesses.add(witnesses);
        }

        @Override
        public void compiled(String compiler, Problem result) {
            compiled = result;
        }

        @Override
        public void warning(String message) {
            warnings.add(message);
        }
    }

    /** An action kind the compiler knows nothing about. */
    private static final class EventAction extends Action {
        EventAction(String name, ExpressionManager manager) {
            super(name, List.of(), manager);
        }

        @Override
        public Action copy(String name) {
            return new EventAction(name, manager);
        }

        @Override
        public List<Effect> allEffects() {
            return List.of();
        }

        @Override
        public List<Expression> allConditions() {
            return List.of();
        }
    }
}
