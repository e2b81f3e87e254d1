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


package com.circuitwright.analysis;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.circuitwright.circuit.Circuit;
import com.circuitwright.circuit.CircuitTools;
import com.circuitwright.circuit.GateType;
import com.circuitwright.sat.TestCircuitSolver;
import com.circuitwright.support.CircuitFixtures;
import com.circuitwright.transform.CircuitTransforms;

public class TestCircuitAnalysis {

    private static final double EPS = 1e-9;

    private final CircuitAnalysis analysis = new CircuitAnalysis(TestCircuitSolver.createTestSolver());

    private static Circuit createXorTree() {
        Circuit c = new Circuit("tree");
        for (String x : Arrays.asList("x1", "x2", "x3", "x4")) {
            c.add(x, GateType.INPUT);
        }
        c.add("t1", GateType.XOR, "x1", "x2");
        c.add("t2", GateType.XOR, "x3", "x4");
        c.add("out", GateType.AND, "t1", "t2");
        c.setOutput("out", true);
        return c;
    }

    private static Circuit createMajority() {
        Circuit c = new Circuit("maj");
        c.add("a", GateType.INPUT);
        c.add("b", GateType.INPUT);
        c.add("c", GateType.INPUT);
        c.add("ab", GateType.AND, "a", "b");
        c.add("ac", GateType.AND, "a", "c");
        c.add("bc", GateType.AND, "b", "c");
        c.add("m", GateType.OR, "ab", "ac", "bc");
        c.setOutput("m", true);
        return c;
    }

    /**
     * Counts by simulation the fraction of assignments of n's startpoints under
     * which complementing s complements n.
     */
    private static double bruteForceInfluence(Circuit c, String n, String s) {
        Circuit cone = CircuitTransforms.cone(c, n);
        List<String> sp = new ArrayList<>(cone.startpoints());
        int flips = 0;
        for (int v = 0; v < (1 << sp.size()); v++) {
            boolean[] bits = CircuitTools.toBinary(v, sp.size());
            Map<String, Boolean> in = new HashMap<>();
            for (int i = 0; i < bits.length; i++) {
                in.put(sp.get(i), bits[i]);
            }
            boolean before = CircuitTools.simulate(cone, in).get(n);
            in.put(s, !in.get(s));
            boolean after = CircuitTools.simulate(cone, in).get(n);
            if (before != after) flips++;
        }
        return (double) flips / (1 << sp.size());
    }

    @Test
    public void testSensitivity() {
        Circuit c = new Circuit("xor2");
        c.add("a", GateType.INPUT);
        c.add("b", GateType.INPUT);
        c.add("y", GateType.XOR, "a", "b");
        c.add("k", GateType.CONST1);
        c.add("z", GateType.NOT, "k");
        Assertions.assertEquals(2, analysis.sensitivity(c, "y"));
        Assertions.assertEquals(1, analysis.sensitivity(c, "a"));
        Assertions.assertEquals(0, analysis.sensitivity(c, "z"));
    }

    @Test
    public void testSensitivityBelowStartpointCount() {
        // No assignment makes all three majority inputs sensitive
        Assertions.assertEquals(2, analysis.sensitivity(createMajority(), "m"));
        Assertions.assertEquals(4, analysis.sensitivity(createXorTree(), "out"));
    }

    @Test
    public void testSensitivityC17() {
        Circuit c = CircuitFixtures.read("c17.v");
        Assertions.assertEquals(3, analysis.sensitivity(c, "G22"));
        Assertions.assertEquals(2, analysis.sensitivity(c, "G10"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"G1", "G2", "G3", "G6", "G7", "G10", "G11", "G16", "G19", "G22", "G23"})
    public void testSensitivityBoundedByStartpoints(String n) {
        Circuit c = CircuitFixtures.read("c17.v");
        Assertions.assertEquals(11, c.size());
        int sensitivity = analysis.sensitivity(c, n);
        Assertions.assertTrue(sensitivity >= 0, n + ": " + sensitivity);
        Assertions.assertTrue(sensitivity <= c.startpoints(n).size(), n + ": " + sensitivity);
        // Each node of c17 depends on all of its startpoints
        Assertions.assertTrue(sensitivity >= 1, n + ": " + sensitivity);
    }

    @Test
    public void testInfluence() {
        Map<String, Double> infl = analysis.influence(createMajority(), "m", false);
        Assertions.assertEquals(3, infl.size());
        for (double v : infl.values()) {
            Assertions.assertEquals(0.5, v, EPS);
        }
        Assertions.assertEquals(1.5, analysis.avgSensitivity(createMajority(), "m", false), EPS);
        Assertions.assertEquals(1.5, analysis.avgSensitivity(createMajority(), "m", true), EPS);
    }

    @Test
    public void testInfluenceOfStartpoint() {
        Circuit c = createMajority();
        Assertions.assertEquals(Collections.singletonMap("a", 1.0), analysis.influence(c, "a", false));
    }

    @ParameterizedTest
    @ValueSource(strings = {"G22", "G23", "G16"})
    public void testInfluenceMatchesSimulation(String n) {
        Circuit c = CircuitFixtures.read("c17.v");
        Map<String, Double> infl = analysis.influence(c, n, false);
        Assertions.assertEquals(c.startpoints(n), infl.keySet());
        for (Map.Entry<String, Double> e : infl.entrySet()) {
            Assertions.assertEquals(bruteForceInfluence(c, n, e.getKey()), e.getValue(), EPS, e.getKey());
        }
    }

    @Test
    public void testInfluenceWithSupergates() {
        Circuit c = createXorTree();
        Map<String, Double> exact = analysis.influence(c, "out", false, false,
                CircuitAnalysis.DEFAULT_EPSILON, CircuitAnalysis.DEFAULT_DELTA);
        Map<String, Double> sg = analysis.influence(c, "out", true, false,
                CircuitAnalysis.DEFAULT_EPSILON, CircuitAnalysis.DEFAULT_DELTA);
        Assertions.assertEquals(exact.keySet(), sg.keySet());
        for (String s : exact.keySet()) {
            Assertions.assertEquals(0.5, exact.get(s), EPS);
            Assertions.assertEquals(exact.get(s), sg.get(s), EPS);
        }
        Assertions.assertEquals(2.0, analysis.avgSensitivity(c, "out", true, false,
                CircuitAnalysis.DEFAULT_EPSILON, CircuitAnalysis.DEFAULT_DELTA), EPS);
    }

    @Test
    public void testInfluenceApprox() {
        // The test solver's approximate counts are exact
        Circuit c = createXorTree();
        Map<String, Double> infl = analysis.influence(c, "out", true);
        for (double v : infl.values()) {
            Assertions.assertEquals(0.5, v, EPS);
        }
    }

    @Test
    public void testSignalProbability() {
        Circuit adder = CircuitTools.adder(2, false, true);
        Assertions.assertEquals(0.5, analysis.signalProbability(adder, "out_0", false), EPS);
        Assertions.assertEquals(0.375, analysis.signalProbability(adder, "cout", false), EPS);

        Circuit and3 = new Circuit("and3");
        and3.add("a", GateType.INPUT);
        and3.add("b", GateType.INPUT);
        and3.add("c", GateType.INPUT);
        and3.add("y", GateType.AND, "a", "b", "c");
        Assertions.assertEquals(0.125, analysis.signalProbability(and3, "y", false), EPS);
        Assertions.assertEquals(0.125, analysis.signalProbability(and3, "y", true), EPS);
    }

    @Test
    public void testSensitize() {
        Circuit c = CircuitFixtures.read("c17.v");
        Map<String, Boolean> witness = analysis.sensitize(c, "G16", null);
        Assertions.assertNotNull(witness);
        Assertions.assertEquals(c.inputs(), witness.keySet());

        Map<String, Boolean> before = CircuitTools.simulate(c, witness);
        Circuit flipped = c.copy();
        flipped.setType("G16", GateType.AND);
        Map<String, Boolean> after = CircuitTools.simulate(flipped, witness);
        Assertions.assertTrue(!before.get("G22").equals(after.get("G22"))
                || !before.get("G23").equals(after.get("G23")));
    }

    @Test
    public void testSensitizeWithAssumptions() {
        Circuit c = new Circuit("and2");
        c.add("a", GateType.INPUT);
        c.add("b", GateType.INPUT);
        c.add("y", GateType.AND, "a", "b");
        c.setOutput("y", true);
        Assertions.assertNull(analysis.sensitize(c, "a", Collections.singletonMap("b", false)));
        Map<String, Boolean> witness = analysis.sensitize(c, "a", null);
        Assertions.assertTrue(witness.get("b"));
    }

    @Test
    public void testBlackBoxOutputsAreFree() {
        // Flop outputs count as startpoints once the flops are stripped
        Circuit c = CircuitFixtures.read("counter.v");
        Assertions.assertEquals(2, analysis.sensitivity(c, "d0"));
        Assertions.assertEquals(1.0, analysis.avgSensitivity(c, "d1", false)
                - analysis.influence(c, "d1", false).get("q1_reg.Q"), EPS);
    }

    @Test
    public void testLevelize() {
        Circuit c = CircuitFixtures.read("c17.v");
        Map<String, Integer> levels = CircuitAnalysis.levelize(c);
        Assertions.assertEquals(c.size(), levels.size());
        Assertions.assertEquals(0, levels.get("G1").intValue());
        Assertions.assertEquals(1, levels.get("G10").intValue());
        Assertions.assertEquals(1, levels.get("G11").intValue());
        Assertions.assertEquals(2, levels.get("G16").intValue());
        Assertions.assertEquals(3, levels.get("G22").intValue());
        Assertions.assertEquals(3, levels.get("G23").intValue());
    }
}
