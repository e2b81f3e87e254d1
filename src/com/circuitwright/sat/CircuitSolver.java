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

import java.math.BigInteger;
import java.util.Map;

import com.circuitwright.circuit.Circuit;
import com.circuitwright.util.Params;

/**
 * Answers satisfiability and counting questions about circuits by encoding
 * them with {@link CnfEncoder} and handing them to the configured oracles.
 * Counts are projected on the circuit's startpoints.
 */
public class CircuitSolver {

    private final SatSolver satSolver;

    private final ModelCounter modelCounter;

    private final ApproxModelCounter approxModelCounter;

    public CircuitSolver(SatSolver satSolver, ModelCounter modelCounter, ApproxModelCounter approxModelCounter) {
        this.satSolver = satSolver;
        this.modelCounter = modelCounter;
        this.approxModelCounter = approxModelCounter;
    }

    /**
     * Uses the SAT oracle for exact counting by enumeration and ApproxMC for
     * approximate counting.
     */
    public CircuitSolver(SatSolver satSolver) {
        this(satSolver, new BlockingClauseModelCounter(satSolver), new ApproxMcCounter(satSolver));
    }

    /**
     * Creates a solver backed by the in-process CP-SAT solver, or by the
     * external executable named by {@code CW_SAT_SOLVER} if that parameter is set.
     */
    public static CircuitSolver createDefault() {
        if (Params.isParamSet(Params.CW_SAT_SOLVER_NAME)) {
            return new CircuitSolver(new ExternalSatSolver());
        }
        return new CircuitSolver(new CpSatSolver());
    }

    public SatSolver getSatSolver() {
        return satSolver;
    }

    /**
     * Finds values for every node consistent with the circuit and the assumptions.
     * @param c The circuit.
     * @param assumptions Required node values, may be null or empty.
     * @return The value of every node, or null if there is no such assignment.
     * @throws com.circuitwright.circuit.StructuralException if an assumption
     *         names a node the circuit does not have.
     * @throws SolverException if the oracle fails.
     */
    public Map<String, Boolean> solve(Circuit c, Map<String, Boolean> assumptions) {
        CircuitCnf encoding = CnfEncoder.encode(c);
        SolverResult result = satSolver.solve(encoding.getCnf(), encoding.toLiterals(assumptions));
        return result.isSatisfiable() ? encoding.getNodeValues(result) : null;
    }

    /**
     * Counts the startpoint assignments under which the assumptions hold.
     */
    public BigInteger modelCount(Circuit c, Map<String, Boolean> assumptions) {
        CircuitCnf encoding = CnfEncoder.encode(c);
        return modelCounter.count(encoding.getCnf(), encoding.toLiterals(assumptions),
                encoding.getVariables(c.startpoints()));
    }

    /**
     * Estimates the number of startpoint assignments under which the
     * assumptions hold.
     * @param epsilon Tolerance of the estimate.
     * @param delta Probability that the estimate is outside the tolerance.
     */
    public BigInteger approxModelCount(Circuit c, Map<String, Boolean> assumptions, double epsilon, double delta) {
        CircuitCnf encoding = CnfEncoder.encode(c);
        return approxModelCounter.count(encoding.getCnf(), encoding.toLiterals(assumptions),
                encoding.getVariables(c.startpoints()), epsilon, delta);
    }
}
