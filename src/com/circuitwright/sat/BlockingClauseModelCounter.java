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
import java.util.Collection;

/**
 * Exact projected model counting by enumeration: each model found is blocked
 * on the projection variables until the formula becomes unsatisfiable. The
 * number of oracle calls is one more than the count, so this is only suited to
 * small projections.
 */
public class BlockingClauseModelCounter implements ModelCounter {

    private final SatSolver solver;

    public BlockingClauseModelCounter(SatSolver solver) {
        this.solver = solver;
    }

    @Override
    public BigInteger count(Cnf cnf, int[] assumptions, Collection<Integer> projection) {
        Cnf working = new Cnf(cnf);
        int[] vars = projection.stream().mapToInt(Integer::intValue).distinct().toArray();
        BigInteger count = BigInteger.ZERO;
        while (true) {
            SolverResult result = solver.solve(working, assumptions);
            if (!result.isSatisfiable()) {
                return count;
            }
            count = count.add(BigInteger.ONE);
            if (vars.length == 0) {
                return count;
            }
            int[] block = new int[vars.length];
            for (int i = 0; i < vars.length; i++) {
                block[i] = result.getValue(vars[i]) ? -vars[i] : vars[i];
            }
            working.addClause(block);
        }
    }
}
