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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.circuitwright.circuit.Circuit;
import com.circuitwright.circuit.CircuitTools;
import com.circuitwright.circuit.GateType;
import com.circuitwright.circuit.StructuralException;
import com.circuitwright.support.CircuitFixtures;

public class TestSupergates {

    private static Set<String> set(String... names) {
        return new HashSet<>(Arrays.asList(names));
    }

    /**
     * out = (x1 ^ x2) & (x3 ^ x4)
     */
    private static Circuit createTree() {
        Circuit c = new Circuit("tree");
        for (int i = 1; i <= 4; i++) {
            c.add("x" + i, GateType.INPUT);
        }
        c.add("t1", GateType.XOR, "x1", "x2");
        c.add("t2", GateType.XOR, "x3", "x4");
        c.add("out", GateType.AND, Arrays.asList("t1", "t2"), Collections.emptyList(), true);
        return c;
    }

    @Test
    public void testTree() {
        List<Supergate> sgs = Supergates.compute(createTree(), "out");
        Assertions.assertEquals(3, sgs.size());
        Assertions.assertEquals("t1", sgs.get(0).getRoot());
        Assertions.assertEquals("t2", sgs.get(1).getRoot());
        Assertions.assertEquals("out", sgs.get(2).getRoot());
        Assertions.assertEquals(Arrays.asList("t1", "t2"), sgs.get(2).getInputs());
        Assertions.assertEquals(Arrays.asList("x1", "x2"), sgs.get(0).getInputs());
        Assertions.assertEquals(set("out"), sgs.get(2).getNodes());
    }

    @Test
    public void testReconvergence() {
        Circuit c = CircuitFixtures.read("c17.v");
        List<Supergate> sgs = Supergates.compute(c, "G22");
        Assertions.assertEquals(1, sgs.size());
        Supergate sg = sgs.get(0);
        Assertions.assertEquals(Arrays.asList("G1", "G2", "G3", "G6"), sg.getInputs());
        Assertions.assertEquals(set("G22", "G16", "G10", "G11"), sg.getNodes());

        Circuit sc = sg.getCircuit();
        Assertions.assertEquals("sg_G22", sc.getName());
        Assertions.assertEquals(set("G22"), sc.outputs());
        Assertions.assertArrayEquals(CircuitTools.truthTable(c, "G22"), CircuitTools.truthTable(sc, "G22"));
    }

    @Test
    public void testCuts() {
        Circuit c = CircuitFixtures.read("c17.v");
        List<Supergate> sgs = Supergates.compute(c, "G22", Collections.singleton("G11"));
        Assertions.assertEquals(4, sgs.size());
        Supergate root = sgs.get(sgs.size() - 1);
        Assertions.assertEquals("G22", root.getRoot());
        Assertions.assertEquals(Arrays.asList("G10", "G16"), root.getInputs());
        Set<String> roots = new HashSet<>();
        for (Supergate sg : sgs) {
            roots.add(sg.getRoot());
            if (sg.getRoot().equals("G16")) {
                Assertions.assertEquals(Arrays.asList("G2", "G11"), sg.getInputs());
            }
        }
        // The cut node is the root of its own supergate
        Assertions.assertEquals(set("G10", "G11", "G16", "G22"), roots);
    }

    @Test
    public void testConstantsAreAbsorbed() {
        Circuit c = new Circuit("consts");
        c.add("a", GateType.INPUT);
        c.add("b", GateType.INPUT);
        c.add("k", GateType.CONST1);
        c.add("nk", GateType.NOT, "k");
        c.add("y", GateType.OR, Arrays.asList("a", "b", "nk"), Collections.emptyList(), true);
        List<Supergate> sgs = Supergates.compute(c, "y");
        Assertions.assertEquals(1, sgs.size());
        Assertions.assertEquals(Arrays.asList("a", "b"), sgs.get(0).getInputs());
        Assertions.assertEquals(set("y", "nk", "k"), sgs.get(0).getNodes());
        Assertions.assertArrayEquals(CircuitTools.truthTable(c, "y"),
                CircuitTools.truthTable(sgs.get(0).getCircuit(), "y"));
    }

    @Test
    public void testStartpoint() {
        Assertions.assertTrue(Supergates.compute(createTree(), "x1").isEmpty());
        Assertions.assertThrows(StructuralException.class, () -> Supergates.compute(createTree(), "nope"));
    }
}
