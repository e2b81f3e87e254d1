/*
 * Copyright (c) 2026, CircuitWright contributors.
 * All rights reserved.
 *
 * This file is part of CircuitWright.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */

package com.circuitwright.sat;

import com.circuitwright.util.Params;
import com.google.ortools.Loader;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.CpSolverStatus;
import com.google.ortools.sat.Literal;

/**
 * In-process SAT oracle backed by the OR-Tools CP-SAT solver. Each call builds
 * a fresh model with one Boolean variable per CNF variable and one
 * {@code BoolOr} constraint per clause.
 */
public class CpSatSolver implements SatSolver {

    private final int timeoutSeconds;

    public CpSatSolver() {
        this(Params.getSolverTimeoutSeconds());
    }

    /**
     * @param timeoutSeconds Limit per call, 0 or less for none.
     */
    public CpSatSolver(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public SolverResult solve(Cnf cnf, int[] assumptions) {
        loadNativeLibraries();
        CpModel model = new CpModel();
        int numVars = cnf.getNumVariables();
        Literal[] vars = new Literal[numVars + 1];
        for (int v = 1; v <= numVars; v++) {
            vars[v] = model.newBoolVar("v" + v);
        }
        for (int[] clause : cnf.getClauses()) {
            model.addBoolOr(toLiterals(vars, clause));
        }
        for (int lit : assumptions) {
            model.addBoolOr(toLiterals(vars, new int[] {lit}));
        }

        CpSolver solver = new CpSolver();
        if (timeoutSeconds > 0) {
            solver.getParameters().setMaxTimeInSeconds(timeoutSeconds);
        }
        CpSolverStatus status = solver.solve(model);

        if (status == CpSolverStatus.FEASIBLE || status == CpSolverStatus.OPTIMAL) {
            boolean[] values = new boolean[numVars + 1];
            for (int v = 1; v <= numVars; v++) {
                values[v] = solver.booleanValue(vars[v]);
            }
            return SolverResult.satisfiable(values);
        } else if (status == CpSolverStatus.INFEASIBLE) {
            return SolverResult.unsatisfiable();
        }
        throw new SolverException("CP-SAT returned status " + status + " for a formula with "
                + numVars + " variables and " + cnf.getNumClauses() + " clauses");
    }

    /**
     * Loads the OR-Tools native libraries, which is a no-op once they are loaded.
     * @throws SolverException if the libraries for this platform can't be loaded.
     */
    public static void loadNativeLibraries() {
        try {
            Loader.loadNativeLibraries();
        } catch (UnsatisfiedLinkError | RuntimeException e) {
            throw new SolverException("Couldn't load the OR-Tools native libraries: " + e.getMessage(), e);
        }
    }

    private static Literal[] toLiterals(Literal[] vars, int[] clause) {
        Literal[] lits = new Literal[clause.length];
        for (int i = 0; i < clause.length; i++) {
            int lit = clause[i];
            if (lit == 0 || Math.abs(lit) >= vars.length) {
                throw new IllegalArgumentException("Invalid literal " + lit);
            }
            lits[i] = lit > 0 ? vars[lit] : vars[-lit].not();
        }
        return lits;
    }
}
