package com.example.groceryopt.solver;

import com.example.groceryopt.model.SolveStatus;
import com.example.groceryopt.services.ConfigurationException;
import com.google.ortools.Loader;
import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPObjective;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPVariable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Solves a {@link MilpModel} with an OR-Tools {@link MPSolver}. Each call translates the model
 * into a fresh native solver and releases it afterwards, so nothing is shared between requests.
 */
public class OrToolsMilpSolver implements MilpSolver {
    private static final Logger log = LoggerFactory.getLogger(OrToolsMilpSolver.class);

    static {
        Loader.loadNativeLibraries();
    }

    private final String solverId;
    private final long timeLimitMillis;

    public OrToolsMilpSolver() { this("SCIP", 0); }

    /** @param timeLimitMillis zero or negative for no limit */
    public OrToolsMilpSolver(String solverId, long timeLimitMillis) {
        this.solverId = solverId;
        this.timeLimitMillis = timeLimitMillis;
    }

    @Override
    public MilpSolution solve(MilpModel model) {
        MPSolver solver = MPSolver.createSolver(solverId);
        if (solver == null) {
            throw new ConfigurationException("Could not create solver " + solverId);
        }
        try {
            if (timeLimitMillis > 0) solver.setTimeLimit(timeLimitMillis);

            MPVariable[] vars = new MPVariable[model.numVariables()];
            for (MilpVariable v : model.variables()) {
                vars[v.index] = v.integer
                        ? solver.makeIntVar(v.lowerBound, v.upperBound, v.name)
                        : solver.makeNumVar(v.lowerBound, v.upperBound, v.name);
            }
            for (MilpConstraint c : model.constraints()) {
                MPConstraint ct = solver.makeConstraint(c.lowerBound, c.upperBound, c.name);
                for (var t : c.terms().entrySet()) ct.setCoefficient(vars[t.getKey().index], t.getValue());
            }
            MPObjective objective = solver.objective();
            for (MilpVariable v : model.variables()) {
                double coef = model.getObjectiveCoefficient(v);
                if (coef != 0.0) objective.setCoefficient(vars[v.index], coef);
            }
            objective.setMinimization();

            log.debug("Solving {} with {}: {} variables, {} constraints",
                    model.name, solverId, solver.numVariables(), solver.numConstraints());
            final MPSolver.ResultStatus resultStatus = solver.solve();
            SolveStatus status = map(resultStatus);
            log.info("Solver {} finished {} with {} in {} ms, {} branch-and-bound nodes",
                    solverId, model.name, resultStatus, solver.wallTime(), solver.nodes());

            if (status != SolveStatus.OPTIMAL) {
                return MilpSolution.withoutValues(status, solver.wallTime());
            }
            double[] values = new double[vars.length];
            for (int i = 0; i < vars.length; i++) values[i] = vars[i].solutionValue();
            return new MilpSolution(status, objective.value(), values, solver.wallTime(), solver.nodes());
        } finally {
            solver.delete();
        }
    }

    /** A FEASIBLE result was stopped before optimality was proven, so it is reported as not solved. */
    static SolveStatus map(MPSolver.ResultStatus s) {
        switch (s) {
            case OPTIMAL: return SolveStatus.OPTIMAL;
            case INFEASIBLE: return SolveStatus.INFEASIBLE;
            case UNBOUNDED: return SolveStatus.UNBOUNDED;
            case FEASIBLE:
            case NOT_SOLVED: return SolveStatus.NOT_SOLVED;
            default: return SolveStatus.UNDEFINED;
        }
    }
}
