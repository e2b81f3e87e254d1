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
import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TestBlockingClauseModelCounter {

    private static Cnf createOrFormula() {
        // v3 = v1 | v2, asserted
        Cnf cnf = new Cnf();
        for (int i = 0; i < 3; i++) cnf.newVariable();
        cnf.addClause(-1, 3);
        cnf.addClause(-2, 3);
        cnf.addClause(1, 2, -3);
        cnf.addClause(3);
        return cnf;
    }

    @Test
    public void testCount() {
        ModelCounter counter = new BlockingClauseModelCounter(new DpllSolver());
        Cnf cnf = createOrFormula();
        Assertions.assertEquals(BigInteger.valueOf(3), counter.count(cnf, new int[0], Arrays.asList(1, 2)));
        Assertions.assertEquals(BigInteger.valueOf(2), counter.count(cnf, new int[0], Arrays.asList(1)));
        Assertions.assertEquals(BigInteger.ONE, counter.count(cnf, new int[] { -1 }, Arrays.asList(1, 2)));
        Assertions.assertEquals(BigInteger.ZERO, counter.count(cnf, new int[] { -1, -2 }, Arrays.asList(1, 2)));
        // The input formula is left unchanged
        Assertions.assertEquals(4, cnf.getNumClauses());
    }

    @Test
    public void testOneCallPerModel() {
        DpllSolver sat = new DpllSolver();
        ModelCounter counter = new BlockingClauseModelCounter(sat);
        counter.count(createOrFormula(), new int[0], Arrays.asList(1, 2));
        // Three models and the final unsatisfiable call
        Assertions.assertEquals(4, sat.getCalls());
    }

    @Test
    public void testDuplicateAndEmptyProjection() {
        ModelCounter counter = new BlockingClauseModelCounter(new DpllSolver());
        Cnf cnf = createOrFormula();
        Assertions.assertEquals(BigInteger.valueOf(3), counter.count(cnf, new int[0], Arrays.asList(1, 2, 1)));
        Assertions.assertEquals(BigInteger.ONE, counter.count(cnf, new int[0], Collections.emptyList()));
    }
}
