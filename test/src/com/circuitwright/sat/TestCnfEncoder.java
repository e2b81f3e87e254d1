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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.circuitwright.circuit.BlackBox;
import com.circuitwright.circuit.Circuit;
import com.circuitwright.circuit.CircuitTools;
import com.circuitwright.circuit.GateType;
import com.circuitwright.circuit.StructuralException;

public class TestCnfEncoder {

    private final DpllSolver solver = new DpllSolver();

    @ParameterizedTest
    @EnumSource(value = GateType.class, names = { "AND", "OR", "NAND", "NOR", "XOR", "XNOR", "NOT", "BUF" })
    public void testGateEncoding(GateType type) {
        int maxInputs = type.getMaxFanin() == 1 ? 1 : 4;
        for (int width = 1; width <= maxInputs; width++) {
            Circuit c = new Circuit("gate");
            List<String> inputs = new ArrayList<>();
            for (int i = 0; i < width; i++) {
                c.add("i" + i, GateType.INPUT);
                inputs.add("i" + i);
            }
            c.add("g", type, inputs.toArray(new String[0]));
            CircuitCnf encoding = CnfEncoder.encodeUncached(c);
            for (int k = 0; k < (1 << width); k++) {
                List<Boolean> values = new ArrayList<>();
                int[] assumptions = new int[width + 1];
                for (int i = 0; i < width; i++) {
                    boolean v = ((k >> i) & 1) == 1;
                    values.add(v);
                    assumptions[i] = v ? encoding.getVariable("i" + i) : -encoding.getVariable("i" + i);
                }
                boolean expected = type.evaluate(values);
                int g = encoding.getVariable("g");
                assumptions[width] = expected ? g : -g;
                Assertions.assertTrue(solver.solve(encoding.getCnf(), assumptions).isSatisfiable());
                assumptions[width] = -assumptions[width];
                Assertions.assertFalse(solver.solve(encoding.getCnf(), assumptions).isSatisfiable(),
                        type + " with " + width + " inputs, assignment " + k);
            }
        }
    }

    @Test
    public void testConstantsAndFreeNodes() {
        Circuit c = new Circuit("consts");
        c.add("zero", GateType.CONST0);
        c.add("one", GateType.CONST1);
        c.add("unknown", GateType.X);
        CircuitCnf encoding = CnfEncoder.encodeUncached(c);
        Cnf cnf = encoding.getCnf();
        Assertions.assertFalse(solver.solve(cnf, new int[] { encoding.getVariable("zero") }).isSatisfiable());
        Assertions.assertFalse(solver.solve(cnf, new int[] { -encoding.getVariable("one") }).isSatisfiable());
        Assertions.assertTrue(solver.solve(cnf, new int[] { encoding.getVariable("unknown") }).isSatisfiable());
        Assertions.assertTrue(solver.solve(cnf, new int[] { -encoding.getVariable("unknown") }).isSatisfiable());
    }

    @Test
    public void testBlackBoxPins() {
        Circuit c = new Circuit("bb");
        c.add("a", GateType.INPUT);
        Map<String, String> conn = new HashMap<>();
        conn.put("D", "a");
        conn.put("Q", "q");
        c.addBlackBox(BlackBox.DFF, "ff", conn);
        CircuitCnf encoding = CnfEncoder.encodeUncached(c);
        int a = encoding.getVariable("a");
        int d = encoding.getVariable("ff.D");
        int q = encoding.getVariable("q");
        Assertions.assertFalse(solver.solve(encoding.getCnf(), new int[] { a, -d }).isSatisfiable());
        // The flop output is unconstrained by its input
        Assertions.assertTrue(solver.solve(encoding.getCnf(), new int[] { a, -q }).isSatisfiable());
        Assertions.assertTrue(solver.solve(encoding.getCnf(), new int[] { -a, q }).isSatisfiable());
    }

    @Test
    public void testVariables() {
        Circuit c = CircuitTools.halfAdder();
        CircuitCnf encoding = CnfEncoder.encodeUncached(c);
        Assertions.assertEquals(1, encoding.getVariable("x"));
        Assertions.assertEquals(4, encoding.getVariable("s"));
        Assertions.assertEquals("c", encoding.getNodeName(3));
        Assertions.assertNull(encoding.getNodeName(99));
        Assertions.assertEquals(4, encoding.getVariables().size());
        Assertions.assertThrows(StructuralException.class, () -> encoding.getVariable("nope"));
        Assertions.assertEquals(0, encoding.toLiterals(null).length);

        Map<String, Boolean> assumptions = new HashMap<>();
        assumptions.put("x", true);
        assumptions.put("y", false);
        SolverResult result = solver.solve(encoding.getCnf(), encoding.toLiterals(assumptions));
        Map<String, Boolean> values = encoding.getNodeValues(result);
        Assertions.assertTrue(values.get("s"));
        Assertions.assertFalse(values.get("c"));
    }

    @Test
    public void testCache() {
        Circuit c = CircuitTools.halfAdder();
        CircuitCnf first = CnfEncoder.encode(c);
        Assertions.assertSame(first, CnfEncoder.encode(c));
        c.add("z", GateType.NOT, "s");
        CircuitCnf second = CnfEncoder.encode(c);
        Assertions.assertNotSame(first, second);
        Assertions.assertEquals(5, second.getVariables().size());
    }

    @Test
    public void testIncompleteCircuit() {
        Circuit c = new Circuit("incomplete");
        c.addUnconnected("g", GateType.AND);
        Assertions.assertThrows(StructuralException.class, () -> CnfEncoder.encode(c));
    }
}
