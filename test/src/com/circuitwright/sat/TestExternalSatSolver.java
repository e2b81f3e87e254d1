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

import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;

import com.circuitwright.util.FileTools;

public class TestExternalSatSolver {

    @Test
    public void testParseSatisfiable() {
        SolverResult result = ExternalSatSolver.parseOutput(Arrays.asList(
                "c comment line",
                "s SATISFIABLE",
                "v 1 -2 3",
                "v -4 0"), 4);
        Assertions.assertTrue(result.isSatisfiable());
        Assertions.assertTrue(result.getValue(1));
        Assertions.assertFalse(result.getValue(2));
        Assertions.assertTrue(result.getValue(3));
        Assertions.assertFalse(result.getValue(4));
        Assertions.assertTrue(result.isTrue(-4));
    }

    @Test
    public void testParseUnsatisfiable() {
        SolverResult result = ExternalSatSolver.parseOutput(Collections.singletonList("s UNSATISFIABLE"), 3);
        Assertions.assertFalse(result.isSatisfiable());
        Assertions.assertEquals(SolverResult.Status.UNSATISFIABLE, result.getStatus());
    }

    @Test
    public void testParseNoAnswer() {
        Assertions.assertThrows(SolverException.class,
                () -> ExternalSatSolver.parseOutput(Collections.singletonList("s UNKNOWN"), 1));
        Assertions.assertThrows(SolverException.class,
                () -> ExternalSatSolver.parseOutput(Collections.singletonList("c interrupted"), 1));
        Assertions.assertThrows(SolverException.class,
                () -> ExternalSatSolver.parseOutput(Arrays.asList("s SATISFIABLE", "v 1 x 0"), 1));
    }

    @Test
    public void testSolve() {
        ExternalSatSolver solver = new ExternalSatSolver();
        Assumptions.assumeTrue(FileTools.isExecutableOnPath(solver.getExecutable()));
        Cnf cnf = new Cnf();
        cnf.newVariable();
        cnf.newVariable();
        cnf.addClause(1, 2);
        cnf.addClause(-1);
        SolverResult result = solver.solve(cnf, new int[0]);
        Assertions.assertTrue(result.isSatisfiable());
        Assertions.assertTrue(result.getValue(2));
        Assertions.assertFalse(solver.solve(cnf, new int[] { -2 }).isSatisfiable());
    }

    @Test
    public void testMissingExecutable() {
        ExternalSatSolver solver = new ExternalSatSolver("/nonexistent/cadical_missing", 5);
        Cnf cnf = new Cnf();
        cnf.newVariable();
        SolverException e = Assertions.assertThrows(SolverException.class, () -> solver.solve(cnf, new int[0]));
        Assertions.assertTrue(e.getMessage().contains("/nonexistent/cadical_missing"));
        Assertions.assertTrue(e.getCause() instanceof UncheckedIOException);
    }
}
