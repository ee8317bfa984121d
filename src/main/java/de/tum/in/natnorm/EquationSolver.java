/*
 * This file is part of NatNorm.
 * Copyright (c) 2023 Tobias Meggendorfer.
 *
 * NatNorm is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * NatNorm is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with NatNorm. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.natnorm;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Decides a set of equations by a worklist fixpoint iteration.
 *
 * <p>The solver maintains an accumulated substitution, an active queue and a list of parked
 * equations. Each step applies the substitution to both sides of the next active equation and
 * unifies them. A {@link UnifyResult.Kind#WIN} yields evidence for the equation, a
 * {@link UnifyResult.Kind#LOSE} terminates with a contradiction, a draw with bindings extends the
 * substitution and re-examines the equation, and a draw without bindings parks it. Whenever progress
 * is made, all parked equations are activated again. The iteration stops once the active queue is
 * empty; equations which are still parked are undecided.</p>
 *
 * <p>Bindings which are only sufficient for a wanted equation are tentative. A refutation which
 * depends on them is not reported; instead the iteration starts over without those bindings, and
 * the step count accumulates over all such runs.</p>
 *
 * <p>Each binding eliminates one variable from the system, so the number of progress rounds of a run
 * is at most the number of distinct variables. Instances are stateless apart from their
 * configuration.</p>
 */
public final class EquationSolver {
    private static final Logger logger = Logger.getLogger(EquationSolver.class.getName());

    private final SolverConfiguration configuration;
    private final Unifier unifier;

    EquationSolver(SolverConfiguration configuration, Unifier unifier) {
        this.configuration = configuration;
        this.unifier = unifier;
    }

    public SolverConfiguration configuration() {
        return configuration;
    }

    public <H> SolveResult<H> solve(List<Equation<H>> equations) {
        boolean anyWanted = false;
        for (Equation<H> equation : equations) {
            if (equation.isWanted()) {
                anyWanted = true;
                break;
            }
        }
        if (!anyWanted) {
            // Nothing to decide, givens on their own are never inspected
            return new SolveResult.Solved<>(Substitution.empty(), ImmutableList.of(), ImmutableList.of(), 0, 0);
        }
        logger.log(Level.FINE, "Solving {0} equations", equations.size());

        Set<Equation<H>> necessaryOnly = Collections.newSetFromMap(new IdentityHashMap<>());
        int steps = 0;
        while (true) {
            Run<H> run = new Run<>(equations, necessaryOnly, steps);
            SolveResult<H> result = run.solve();
            if (result != null) {
                return result;
            }
            logger.log(Level.FINE, "Retracting sufficient bindings of {0}", run.retracted);
            necessaryOnly.addAll(run.retracted);
            steps = run.steps;
        }
    }

    /**
     * A single fixpoint iteration. Sufficient bindings are choices: every bound variable records the
     * equations whose sufficient bindings it depends on. If an equation is refuted only under such
     * choices, the run is abandoned and the solver starts over without them. Each restart excludes at
     * least one more equation from sufficient bindings, so there are at most as many restarts as
     * wanted equations.
     */
    private final class Run<H> {
        private final List<Equation<H>> equations;
        private final Set<Equation<H>> necessaryOnly;
        private final Map<Variable, Set<Equation<H>>> assumptions = new HashMap<>();
        private final Set<Equation<H>> retracted = Collections.newSetFromMap(new IdentityHashMap<>());
        private Substitution<H> substitution = Substitution.empty();
        private int steps;
        private int progressRounds = 0;

        Run(List<Equation<H>> equations, Set<Equation<H>> necessaryOnly, int steps) {
            this.equations = equations;
            this.necessaryOnly = necessaryOnly;
            this.steps = steps;
        }

        /**
         * Runs the iteration to its fixpoint.
         *
         * @return The result, or {@code null} if a refutation depends on sufficient bindings, which
         *     are then listed in {@link #retracted}.
         */
        @Nullable
        SolveResult<H> solve() {
            List<Evidence<H>> evidence = new ArrayList<>();
            Deque<Equation<H>> active = new ArrayDeque<>(equations);
            List<Equation<H>> parked = new ArrayList<>();

            while (!active.isEmpty()) {
                if (steps >= configuration.maximumSteps()) {
                    logger.log(Level.WARNING, "Step limit of {0} reached with {1} pending equations",
                            new Object[] {configuration.maximumSteps(), active.size()});
                    parked.addAll(active);
                    active.clear();
                    break;
                }
                steps += 1;

                Equation<H> equation = active.removeFirst();
                Sop lhs = substitution.apply(equation.lhs());
                Sop rhs = substitution.apply(equation.rhs());
                boolean sufficient = configuration.cancelCommonFactors() && !necessaryOnly.contains(equation);
                UnifyResult<H> result = unifier.unify(equation.handle(), equation.origin(), lhs, rhs, sufficient);
                if (logger.isLoggable(Level.FINER)) {
                    logger.log(Level.FINER, "{0}: {1} == {2} gives {3}",
                            new Object[] {equation.handle(), lhs, rhs, result});
                }

                switch (result.kind()) {
                    case WIN:
                        if (equation.isWanted()) {
                            evidence.add(new Evidence<>(equation, substitution));
                        }
                        activate(parked, active);
                        break;
                    case LOSE:
                        Set<Equation<H>> dependencies = assumptionsOf(equation);
                        if (!dependencies.isEmpty()) {
                            retracted.addAll(dependencies);
                            return null;
                        }
                        logger.log(Level.FINE, "Contradiction in {0}", equation);
                        return new SolveResult.Contradiction<>(equation, steps, progressRounds);
                    case DRAW:
                        if (result.bindings().isEmpty()) {
                            parked.add(equation);
                        } else {
                            logger.log(Level.FINE, "New bindings {0}", result.bindings());
                            bind(equation, result.bindings());
                            progressRounds += 1;
                            activate(parked, active);
                            active.addFirst(equation);
                        }
                        break;
                    default:
                        throw new IllegalStateException("Unknown result " + result);
                }
            }

            Level summaryLevel = configuration.logStatistics() ? Level.INFO : Level.FINE;
            logger.log(summaryLevel, "Solved {0} of {1} equations in {2} steps and {3} progress rounds, {4} undecided",
                    new Object[] {evidence.size(), equations.size(), steps, progressRounds, parked.size()});
            return new SolveResult.Solved<>(substitution.restrictTo(Origin.WANTED), evidence, parked, steps,
                    progressRounds);
        }

        private void bind(Equation<H> equation, List<SubstItem<H>> bindings) {
            Set<Equation<H>> inherited = assumptionsOf(equation);
            for (SubstItem<H> binding : bindings) {
                Set<Equation<H>> dependencies = Collections.newSetFromMap(new IdentityHashMap<>());
                dependencies.addAll(inherited);
                if (binding.isSufficient()) {
                    dependencies.add(equation);
                }
                if (dependencies.isEmpty()) {
                    continue;
                }
                // Older replacements mentioning the variable are rewritten by the composition below
                for (SubstItem<H> item : substitution.items()) {
                    if (item.replacement().contains(binding.variable())) {
                        assumptions.computeIfAbsent(item.variable(),
                                k -> Collections.newSetFromMap(new IdentityHashMap<>())).addAll(dependencies);
                    }
                }
                assumptions.put(binding.variable(), dependencies);
            }
            substitution = Substitution.compose(Substitution.of(bindings), substitution);
        }

        private Set<Equation<H>> assumptionsOf(Equation<H> equation) {
            Set<Equation<H>> dependencies = Collections.newSetFromMap(new IdentityHashMap<>());
            if (assumptions.isEmpty()) {
                return dependencies;
            }
            for (Sop side : List.of(equation.lhs(), equation.rhs())) {
                for (Variable variable : side.variables()) {
                    Set<Equation<H>> choices = assumptions.get(variable);
                    if (choices != null) {
                        dependencies.addAll(choices);
                    }
                }
            }
            return dependencies;
        }
    }

    /**
     * Moves all parked equations to the front of the active queue, keeping their order.
     */
    private static <H> void activate(List<Equation<H>> parked, Deque<Equation<H>> active) {
        for (int i = parked.size() - 1; i >= 0; i--) {
            active.addFirst(parked.get(i));
        }
        parked.clear();
    }

    @Override
    public String toString() {
        return "EquationSolver" + configuration;
    }
}
