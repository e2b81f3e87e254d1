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

package com.circuitwright.transform;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import com.circuitwright.circuit.BlackBox;
import com.circuitwright.circuit.Circuit;
import com.circuitwright.circuit.CircuitTools;
import com.circuitwright.circuit.GateType;
import com.circuitwright.circuit.StructuralException;
import com.circuitwright.sat.CircuitSolver;
import com.circuitwright.sat.TestCircuitSolver;
import com.circuitwright.support.CircuitFixtures;

public class TestCircuitTransforms {

    private final CircuitSolver solver = TestCircuitSolver.createTestSolver();

    private static Set<String> set(String... names) {
        return new HashSet<>(Arrays.asList(names));
    }

    private static Circuit createXor2() {
        Circuit c = new Circuit("xor2");
        c.add("a", GateType.INPUT);
        c.add("b", GateType.INPUT);
        c.add("y", GateType.XOR, Arrays.asList("a", "b"), Collections.emptyList(), true);
        return c;
    }

    private static Circuit createWide() {
        Circuit c = new Circuit("wide");
        String[] in = new String[7];
        for (int i = 0; i < in.length; i++) {
            in[i] = "i" + i;
            c.add(in[i], GateType.INPUT);
        }
        for (GateType t : new GateType[] { GateType.AND, GateType.NAND, GateType.OR, GateType.NOR,
                GateType.XOR, GateType.XNOR }) {
            c.add("y_" + t.getShortName(), t, Arrays.asList(in), Collections.emptyList(), true);
        }
        return c;
    }

    @Test
    public void testSubcircuit() {
        Circuit c = CircuitFixtures.read("c17.v");
        Circuit sc = CircuitTransforms.subcircuit(c, Arrays.asList("G11", "G16", "G19"), true);
        Assertions.assertEquals(3, sc.size());
        Assertions.assertEquals(set("G11"), sc.inputs());
        Assertions.assertEquals(set("G16", "G19"), sc.outputs());
        Assertions.assertEquals(set("G11"), sc.fanin("G16"));

        Circuit plain = CircuitTransforms.subcircuit(c, Arrays.asList("G11", "G16"));
        Assertions.assertEquals(GateType.NAND, plain.getType("G11"));
        Assertions.assertTrue(plain.outputs().isEmpty());
        Assertions.assertThrows(StructuralException.class,
                () -> CircuitTransforms.subcircuit(c, Arrays.asList("G11", "missing")));
    }

    @Test
    public void testCone() {
        Circuit c = CircuitFixtures.read("c17.v");
        Circuit cone = CircuitTransforms.cone(c, "G22");
        Assertions.assertEquals(set("G1", "G2", "G3", "G6", "G10", "G11", "G16", "G22"), cone.getNodeNames());
        Assertions.assertEquals(set("G22"), cone.outputs());
        cone.validate();
    }

    @Test
    public void testStripIo() {
        Circuit s = CircuitTransforms.stripIo(CircuitTools.halfAdder());
        Assertions.assertTrue(s.inputs().isEmpty());
        Assertions.assertTrue(s.outputs().isEmpty());
        Assertions.assertEquals(GateType.BUF, s.getType("x"));
    }

    @Test
    public void testStripBlackBoxes() {
        Circuit c = CircuitFixtures.read("counter.v");
        Circuit s = CircuitTransforms.stripBlackBoxes(c);
        Assertions.assertTrue(s.getBlackBoxes().isEmpty());
        Assertions.assertFalse(c.getBlackBoxes().isEmpty());
        Assertions.assertEquals(GateType.INPUT, s.getType("q0_reg.Q"));
        Assertions.assertEquals(set("q0_reg.Q"), s.fanin("q0"));
        Assertions.assertEquals(GateType.BUF, s.getType("q1_reg.D"));
        Assertions.assertTrue(s.isOutput("q1_reg.D"));
        Assertions.assertEquals(set("d1"), s.fanin("q1_reg.D"));
        Assertions.assertEquals(set("clk", "en", "q0_reg.Q", "q1_reg.Q"), s.inputs());
        Assertions.assertEquals(set("en", "q0_reg.Q", "q1_reg.Q"), s.startpoints("d1"));
        s.validate();
    }

    @Test
    public void testStripUndrivenBlackBoxInput() {
        Circuit c = new Circuit("bb");
        Map<String, String> conn = new HashMap<>();
        conn.put("Q", "q");
        c.addBlackBox(BlackBox.DFF, "ff", conn);
        c.setOutput("q", true);
        Circuit s = CircuitTransforms.stripBlackBoxes(c);
        Assertions.assertFalse(s.contains("ff.D"));
        Assertions.assertFalse(s.contains("ff.CK"));
        Assertions.assertEquals(set("ff.Q"), s.inputs());
    }

    @ParameterizedTest
    @ValueSource(ints = { 2, 3, 4 })
    public void testLimitFanin(int k) {
        Circuit c = createWide();
        Circuit limited = CircuitTransforms.limitFanin(c, k);
        for (String n : limited.getNodeNames()) {
            Assertions.assertTrue(limited.fanin(n).size() <= k);
        }
        for (String o : c.outputs()) {
            Assertions.assertArrayEquals(CircuitTools.truthTable(c, o), CircuitTools.truthTable(limited, o), o);
        }
        Assertions.assertEquals(7, c.fanin("y_and").size());
    }

    @Test
    public void testLimitFaninInvalid() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> CircuitTransforms.limitFanin(createWide(), 1));
    }

    @Test
    public void testMiterOfEqualCircuits() {
        Circuit c = CircuitFixtures.read("c17.v");
        Circuit m = CircuitTransforms.miter(c);
        Assertions.assertEquals(set(CircuitTransforms.SAT), m.outputs());
        Assertions.assertEquals(set("G1", "G2", "G3", "G6", "G7"), m.inputs());
        Assertions.assertEquals(set("c0_G22", "c1_G22"), m.fanin("dif_G22"));
        Assertions.assertNull(solver.solve(m, Collections.singletonMap(CircuitTransforms.SAT, true)));
    }

    @Test
    public void testMiterOfDifferentCircuits() {
        Circuit xor = createXor2();
        Circuit or = new Circuit("or2");
        or.add("a", GateType.INPUT);
        or.add("b", GateType.INPUT);
        or.add("y", GateType.OR, Arrays.asList("a", "b"), Collections.emptyList(), true);
        Circuit m = CircuitTransforms.miter(xor, or);
        Assertions.assertEquals(GateType.BUF, m.getType(CircuitTransforms.SAT));
        Map<String, Boolean> witness = solver.solve(m, Collections.singletonMap(CircuitTransforms.SAT, true));
        Assertions.assertTrue(witness.get("a"));
        Assertions.assertTrue(witness.get("b"));
        Assertions.assertEquals(BigInteger.ONE, solver.modelCount(m, Collections.singletonMap(CircuitTransforms.SAT,
                true)));
    }

    @Test
    public void testMiterPartialTie() {
        Circuit xor = createXor2();
        Circuit m = CircuitTransforms.miter(xor, xor, Collections.singletonList("a"), null);
        Assertions.assertEquals(set("a", "c0_b", "c1_b"), m.inputs());
        // The copies differ whenever their free inputs differ
        Assertions.assertEquals(BigInteger.valueOf(4), solver.modelCount(m,
                Collections.singletonMap(CircuitTransforms.SAT, true)));
    }

    @Test
    public void testMiterErrors() {
        Circuit xor = createXor2();
        Assertions.assertThrows(StructuralException.class,
                () -> CircuitTransforms.miter(xor, xor, Collections.singletonList("y"), null));
        Assertions.assertThrows(StructuralException.class,
                () -> CircuitTransforms.miter(xor, xor, null, Collections.singletonList("missing")));
        Circuit noOutputs = CircuitTransforms.stripIo(xor);
        Assertions.assertThrows(StructuralException.class, () -> CircuitTransforms.miter(noOutputs));
        Assertions.assertThrows(StructuralException.class,
                () -> CircuitTransforms.miter(CircuitFixtures.read("counter.v")));
    }

    @Test
    public void testSensitivityTransform() {
        Circuit c = CircuitFixtures.read("c17.v");
        Circuit sen = CircuitTransforms.sensitivityTransform(c, "G22");
        Assertions.assertEquals(set("G1", "G2", "G3", "G6"), sen.inputs());
        Assertions.assertEquals(GateType.NOT, sen.getType("inv_G3_G3"));
        Assertions.assertEquals(GateType.BUF, sen.getType("inv_G3_G1"));
        for (int o = 0; o < 3; o++) {
            Assertions.assertTrue(sen.isOutput(CircuitTransforms.SEN_OUT + o));
        }
        Assertions.assertFalse(sen.contains(CircuitTransforms.SEN_OUT + 3));
        sen.validate();

        // Each assignment's output bus holds the number of sensitive startpoints
        Map<String, Boolean> in = new HashMap<>();
        for (String s : sen.inputs()) in.put(s, false);
        Map<String, Boolean> values = CircuitTools.simulate(sen, in);
        int count = 0;
        for (int o = 0; o < 3; o++) {
            if (values.get(CircuitTransforms.SEN_OUT + o)) count |= 1 << o;
        }
        // G22 = ~(~(G1 & G3) & ~(G2 & ~(G3 & G6))) is 0 at all-zero and only G2 flips it
        Assertions.assertEquals(1, count);
    }

    @Test
    public void testSensitivityTransformWithoutStartpoints() {
        Circuit c = new Circuit("const");
        c.add("one", GateType.CONST1);
        c.add("y", GateType.NOT, Arrays.asList("one"), Collections.emptyList(), true);
        Assertions.assertThrows(StructuralException.class, () -> CircuitTransforms.sensitivityTransform(c, "y"));
    }

    @Test
    public void testInfluenceTransform() {
        Circuit c = CircuitTools.mux(2);
        Circuit inf = CircuitTransforms.influenceTransform(c, "out", "sel_0");
        Assertions.assertEquals(set("in_0", "in_1", "sel_0"), inf.inputs());
        Assertions.assertEquals(GateType.CONST0, inf.getType("c0_sel_0"));
        Assertions.assertEquals(GateType.CONST1, inf.getType("c1_sel_0"));
        // The select matters exactly when the data inputs differ: 2 of 4 data values, times 2 for sel_0
        Assertions.assertEquals(BigInteger.valueOf(4), solver.modelCount(inf,
                Collections.singletonMap(CircuitTransforms.SAT, true)));

        Assertions.assertThrows(StructuralException.class,
                () -> CircuitTransforms.influenceTransform(c, "and_0", "in_1"));
    }

    /**
     * The value given to s itself must not decide whether flipping s changes n.
     */
    @ParameterizedTest
    @CsvSource({ "mux, out, sel_0", "mux, out, in_1", "c17.v, G22, G3", "c17.v, G23, G7", "c17.v, G16, G2" })
    public void testInfluenceIgnoresValueOfFlippedInput(String circuit, String n, String s) {
        Circuit c = circuit.equals("mux") ? CircuitTools.mux(2) : CircuitFixtures.read(circuit);
        Circuit inf = CircuitTransforms.influenceTransform(c, n, s);
        List<String> inputs = new ArrayList<>(inf.inputs());
        Assertions.assertEquals(c.startpoints(n), new HashSet<>(inputs));
        int influential = 0;
        for (int k = 0; k < (1 << inputs.size()); k++) {
            Map<String, Boolean> assignment = new HashMap<>();
            for (int j = 0; j < inputs.size(); j++) {
                assignment.put(inputs.get(j), ((k >> j) & 1) == 1);
            }
            assignment.put(CircuitTransforms.SAT, true);
            boolean sat = solver.solve(inf, assignment) != null;
            assignment.put(s, !assignment.get(s));
            boolean flippedSat = solver.solve(inf, assignment) != null;
            Assertions.assertEquals(sat, flippedSat, "assignment " + k);
            if (sat) influential++;
        }
        // s changes n under some assignment in each of these circuits
        Assertions.assertTrue(influential > 0);
    }

    @Test
    public void testSensitizationTransform() {
        Circuit c = CircuitFixtures.read("c17.v");
        Circuit sens = CircuitTransforms.sensitizationTransform(c, "G11");
        Assertions.assertEquals("c17_sensitize_G11", sens.getName());
        Assertions.assertTrue(sens.isOutput(CircuitTransforms.SENSITIZE));
        Assertions.assertEquals(GateType.NOT, sens.getType("c1_G11"));
        Assertions.assertEquals(set("c0_G11"), sens.fanin("c1_G11"));

        Map<String, Boolean> witness = solver.solve(sens, Collections.singletonMap(CircuitTransforms.SENSITIZE,
                true));
        Assertions.assertNotNull(witness);
        Map<String, Boolean> in = new HashMap<>();
        for (String s : c.inputs()) in.put(s, witness.get(s));
        Map<String, Boolean> before = CircuitTools.simulate(c, in);

        Circuit flipped = c.copy();
        flipped.setType("G11", GateType.AND);
        Map<String, Boolean> after = CircuitTools.simulate(flipped, in);
        Assertions.assertTrue(!before.get("G22").equals(after.get("G22"))
                || !before.get("G23").equals(after.get("G23")));
    }

    @Test
    public void testSensitizationTransformEndpoints() {
        Circuit c = CircuitFixtures.read("c17.v");
        Circuit sens = CircuitTransforms.sensitizationTransform(c, "G10", Collections.singletonList("G22"));
        Assertions.assertFalse(sens.contains("c0_G23"));
        Assertions.assertEquals(set("c0_G22", "c1_G22"), sens.fanin("dif_G22"));
        Assertions.assertThrows(StructuralException.class,
                () -> CircuitTransforms.sensitizationTransform(c, "G10", Collections.singletonList("G23")));
    }
}
