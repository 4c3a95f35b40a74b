package org.pltl.eval;

import org.junit.jupiter.api.Test;
import org.pltl.formula.Formula;
import org.pltl.formula.FormulaParser;
import org.pltl.trace.Trace;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

class TraceEvaluatorTest {

    static final List<String> PQ = List.of("p", "q");
    static final Formula P = Formula.atom("p");
    static final Formula Q = Formula.atom("q");

    static TraceEvaluator evaluator(String data) {
        return new TraceEvaluator(Trace.parse(data, "test", PQ));
    }

    static boolean holdsAtStart(String data, String formula) {
        return evaluator(data).holdsAtStart(FormulaParser.parse(formula));
    }

    // --- Scenarios ---

    @Test void globallyTrueAcrossLasso() {
        assertTrue(holdsAtStart("0,1;1,1;1,1", "G(q)"));
    }

    @Test void globallyFalseWhenFirstStateFails() {
        assertFalse(holdsAtStart("0,1;1,1;1,1", "G(p)"));
    }

    @Test void nextAtLastStateWrapsToLasso() {
        assertTrue(evaluator("1,0;0,0").holds(Formula.next(P), 1));
    }

    @Test void eventuallySatisfiedImmediately() {
        assertTrue(evaluator("1,0;0,0").holds(Formula.eventually(P), 0));
    }

    @Test void eventuallyExhaustsLoopAndFails() {
        assertFalse(evaluator("0,0;0,0").holds(Formula.eventually(P), 0));
    }

    @Test void yesterdayAtStartIsFalse() {
        assertFalse(evaluator("1,1;1,1").holds(Formula.yesterday(P), 0));
        assertFalse(evaluator("0,0;0,0").holds(Formula.yesterday(Formula.TRUE), 0));
    }

    // --- Boolean connectives ---

    @Test void constantsAndConnectives() {
        TraceEvaluator evaluator = evaluator("1,0");
        assertTrue(evaluator.holds(Formula.TRUE, 0));
        assertFalse(evaluator.holds(Formula.FALSE, 0));
        assertTrue(evaluator.holds(P, 0));
        assertFalse(evaluator.holds(Formula.not(P), 0));
        assertFalse(evaluator.holds(Formula.and(P, Q), 0));
        assertTrue(evaluator.holds(Formula.or(P, Q), 0));
        assertFalse(evaluator.holds(Formula.implies(P, Q), 0));
        assertTrue(evaluator.holds(Formula.implies(Q, P), 0));
    }

    // --- Past operators ---

    @Test void yesterdayReadsPreviousState() {
        TraceEvaluator evaluator = evaluator("1,0;0,0;0,0");
        assertTrue(evaluator.holds(Formula.yesterday(P), 1));
        assertFalse(evaluator.holds(Formula.yesterday(P), 2));
    }

    @Test void onceLooksBackToStart() {
        TraceEvaluator evaluator = evaluator("1,0;0,0;0,0");
        assertTrue(evaluator.holds(Formula.once(P), 2));
        assertFalse(evaluator.holds(Formula.once(Q), 2));
    }

    @Test void historicallyRequiresEveryPastState() {
        TraceEvaluator evaluator = evaluator("1,0;1,0;0,0");
        assertTrue(evaluator.holds(Formula.historically(P), 0));
        assertTrue(evaluator.holds(Formula.historically(P), 1));
        assertFalse(evaluator.holds(Formula.historically(P), 2));
    }

    @Test void sinceHoldsUntilLeftBreaks() {
        // q S p: p all'istante 0, q negli istanti 1 e 2, poi più nulla
        TraceEvaluator evaluator = evaluator("1,0;0,1;0,1;0,0");
        Formula since = Formula.since(Q, P);
        assertTrue(evaluator.holds(since, 0));
        assertTrue(evaluator.holds(since, 1));
        assertTrue(evaluator.holds(since, 2));
        assertFalse(evaluator.holds(since, 3));
    }

    @Test void sinceAtStartOnlyChecksRight() {
        assertTrue(evaluator("0,1;0,1").holds(Formula.since(P, Q), 0));
        assertFalse(evaluator("1,0;1,0").holds(Formula.since(P, Q), 0));
    }

    // --- Future operators ---

    @Test void untilReachesRightOperand() {
        assertTrue(holdsAtStart("1,0;1,0;0,1", "U(p,q)"));
    }

    @Test void untilFailsWhenLeftBreaksFirst() {
        assertFalse(holdsAtStart("1,0;0,0;0,1", "U(p,q)"));
    }

    @Test void untilFindsRightOperandThroughLasso() {
        // dall'istante 1 si torna all'istante 0, dove vale q
        assertTrue(evaluator("0,1;1,0").holds(Formula.until(P, Q), 1));
    }

    @Test void untilWithLoopAlreadyTakenStopsAtLastState() {
        TraceEvaluator evaluator = evaluator("0,1;1,0");
        assertFalse(evaluator.holds(Formula.until(P, Q), TracePosition.of(1, true)));
        assertTrue(evaluator.holds(Formula.until(P, Q), TracePosition.of(1, false)));
    }

    @Test void nextHonoursLassoIndex() {
        TraceEvaluator evaluator = new TraceEvaluator(Trace.parse("0;1;0::1", "t", List.of("p")));
        assertTrue(evaluator.holds(Formula.next(P), 2));
        assertFalse(evaluator.holds(Formula.next(P), TracePosition.of(2, true)));
    }

    @Test void eventuallyOnlyRevisitsLoopBody() {
        // lasso sull'istante 2: l'unico p all'istante 1 non è raggiungibile da 2
        TraceEvaluator evaluator = new TraceEvaluator(Trace.parse("0;1;0::2", "t", List.of("p")));
        assertTrue(evaluator.holds(Formula.eventually(P), 0));
        assertFalse(evaluator.holds(Formula.eventually(P), 2));
    }

    @Test void nextOfGloballyInsideLoop() {
        assertTrue(new TraceEvaluator(Trace.parse("0;1;1::1", "t", List.of("p")))
                .holdsAtStart(FormulaParser.parse("X(G(p))")));
    }

    @Test void siblingFutureOperatorsDoNotShareLoop() {
        // ognuna delle due F deve attraversare il lasso per trovare il proprio atomo
        assertTrue(evaluator("1,1;0,0").holds(FormulaParser.parse("&(F(p),F(q))"), 1));
    }

    // --- Properties ---

    @Test void evaluationIsDeterministic() {
        TraceEvaluator evaluator = evaluator("1,0;0,1;1,1::1");
        for (Formula formula : sampleFormulas()) {
            for (int i = 0; i < 3; i++) {
                assertEquals(evaluator.holds(formula, i), evaluator.holds(formula, i), formula + " @ " + i);
            }
        }
    }

    @Test void negationIsDual() {
        for (TraceEvaluator evaluator : sampleEvaluators()) {
            for (Formula formula : sampleFormulas()) {
                for (int i = 0; i < evaluator.getTrace().length(); i++) {
                    assertEquals(!evaluator.holds(formula, i), evaluator.holds(Formula.not(formula), i),
                            formula + " @ " + i + " su " + evaluator.getTrace());
                }
            }
        }
    }

    @Test void derivedOperatorsMatchTheirExpansion() {
        for (TraceEvaluator evaluator : sampleEvaluators()) {
            for (Formula formula : sampleFormulas()) {
                for (int i = 0; i < evaluator.getTrace().length(); i++) {
                    assertEquals(!evaluator.holds(Formula.eventually(Formula.not(formula)), i),
                            evaluator.holds(Formula.globally(formula), i), "G " + formula + " @ " + i);
                    assertEquals(evaluator.holds(Formula.until(Formula.TRUE, formula), i),
                            evaluator.holds(Formula.eventually(formula), i), "F " + formula + " @ " + i);
                }
            }
        }
    }

    @Test void untilUnrollsOneStep() {
        List<Formula> operands = List.of(P, Q, Formula.not(P), Formula.once(Q), Formula.next(P));
        for (TraceEvaluator evaluator : sampleEvaluators()) {
            Trace trace = evaluator.getTrace();
            for (Formula a : operands) {
                for (Formula b : operands) {
                    Formula until = Formula.until(a, b);
                    for (int i = 0; i < trace.length(); i++) {
                        for (boolean loopTaken : new boolean[] {false, true}) {
                            TracePosition position = TracePosition.of(i, loopTaken);
                            TracePosition next = position.next(trace);
                            boolean unrolled = evaluator.holds(b, position)
                                    || (evaluator.holds(a, position) && next != null && evaluator.holds(until, next));
                            assertEquals(unrolled, evaluator.holds(until, position), until + " @ " + position);
                        }
                    }
                }
            }
        }
    }

    @Test void futureFormulasTerminateOnEveryLasso() {
        for (int lasso = 0; lasso < 4; lasso++) {
            TraceEvaluator evaluator = new TraceEvaluator(Trace.parse("1;1;1;1::" + lasso, "t", List.of("p")));
            for (int i = 0; i < 4; i++) {
                assertFalse(evaluator.holds(Formula.next(Formula.FALSE), TracePosition.of(3, true)));
                assertFalse(evaluator.holds(Formula.eventually(Formula.FALSE), i));
                assertFalse(evaluator.holds(Formula.until(P, Formula.FALSE), i));
                assertTrue(evaluator.holds(Formula.globally(P), i));
            }
        }
    }

    @Test void throughoutIsConjunctionOverIndices() {
        for (TraceEvaluator evaluator : sampleEvaluators()) {
            for (Formula formula : sampleFormulas()) {
                boolean all = IntStream.range(0, evaluator.getTrace().length())
                        .allMatch(i -> evaluator.holds(formula, i));
                assertEquals(all, evaluator.holdsThroughout(formula), formula.toString());
            }
        }
    }

    @Test void atStartMatchesIndexZero() {
        TraceEvaluator evaluator = evaluator("0,1;1,0;1,1::1");
        for (Formula formula : sampleFormulas()) {
            assertEquals(evaluator.holds(formula, 0), evaluator.holdsAtStart(formula));
        }
    }

    @Test void concurrentQueriesAgree() {
        TraceEvaluator evaluator = evaluator("1,0;0,1;0,0;1,1::2");
        List<Formula> formulas = sampleFormulas();
        List<Boolean> sequential = new ArrayList<>();
        for (Formula formula : formulas) {
            sequential.add(evaluator.holdsAtStart(formula));
        }
        List<Boolean> parallel = formulas.parallelStream().map(evaluator::holdsAtStart).toList();
        assertEquals(sequential, parallel);
    }

    // --- Errors ---

    @Test void unknownAtomFailsLoudly() {
        TraceEvaluator evaluator = evaluator("1,0");
        UnknownAtomException e = assertThrows(UnknownAtomException.class,
                () -> evaluator.holds(Formula.atom("r"), 0));
        assertEquals("r", e.getAtom());
        assertEquals("test", e.getTraceId());
        assertEquals(0, e.getIndex());
    }

    @Test void unknownAtomIsNotHiddenByShortCircuit() {
        TraceEvaluator evaluator = evaluator("1,0");
        assertThrows(UnknownAtomException.class,
                () -> evaluator.holds(Formula.or(Formula.TRUE, Formula.atom("r")), 0));
    }

    @Test void indexOutOfRangeIsRejected() {
        TraceEvaluator evaluator = evaluator("1,0;0,1");
        IndexOutOfRangeException e = assertThrows(IndexOutOfRangeException.class, () -> evaluator.holds(P, 2));
        assertEquals(2, e.getIndex());
        assertEquals(2, e.getLength());
        assertThrows(IndexOutOfRangeException.class, () -> evaluator.holds(P, -1));
    }

    // --- Fixtures ---

    static List<TraceEvaluator> sampleEvaluators() {
        return List.of(
                evaluator("0,1;1,1;1,1"),
                evaluator("1,0;0,0"),
                evaluator("0,0;0,0"),
                evaluator("1,0;0,1;0,0;1,1::2"),
                evaluator("0,1;1,0;1,1;0,0::3"),
                evaluator("1,1"));
    }

    static List<Formula> sampleFormulas() {
        List<Formula> leaves = List.of(P, Q, Formula.TRUE, Formula.FALSE);
        List<Formula> formulas = new ArrayList<>(leaves);
        for (Formula a : leaves) {
            formulas.add(Formula.not(a));
            formulas.add(Formula.yesterday(a));
            formulas.add(Formula.once(a));
            formulas.add(Formula.historically(a));
            formulas.add(Formula.next(a));
            formulas.add(Formula.eventually(a));
            formulas.add(Formula.globally(a));
            for (Formula b : List.of(P, Q)) {
                formulas.add(Formula.and(a, b));
                formulas.add(Formula.implies(a, b));
                formulas.add(Formula.since(a, b));
                formulas.add(Formula.until(a, b));
            }
        }
        formulas.add(FormulaParser.parse("G(=>(p, F(q)))"));
        formulas.add(FormulaParser.parse("U(O(p), X(q))"));
        formulas.add(FormulaParser.parse("S(F(p), H(!(q)))"));
        formulas.add(FormulaParser.parse("X(U(p, G(q)))"));
        return formulas;
    }
}
