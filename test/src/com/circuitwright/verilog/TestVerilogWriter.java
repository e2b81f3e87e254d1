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

package com.circuitwright.verilog;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.circuitwright.circuit.BlackBox;
import com.circuitwright.circuit.Circuit;
import com.circuitwright.circuit.CircuitTools;
import com.circuitwright.circuit.GateType;
import com.circuitwright.support.CircuitFixtures;

public class TestVerilogWriter {

    /**
     * Checks that two circuits with the same inputs compute the same outputs
     * for every input assignment.
     */
    private static void assertEquivalent(Circuit expected, Circuit actual) {
        Assertions.assertEquals(expected.inputs(), actual.inputs());
        Assertions.assertEquals(expected.outputs(), actual.outputs());
        List<String> inputs = new ArrayList<>(expected.inputs());
        for (int k = 0; k < (1 << inputs.size()); k++) {
            Map<String, Boolean> in = new HashMap<>();
            for (int j = 0; j < inputs.size(); j++) {
                in.put(inputs.get(j), ((k >> j) & 1) == 1);
            }
            Map<String, Boolean> e = CircuitTools.simulate(expected, in);
            Map<String, Boolean> a = CircuitTools.simulate(actual, in);
            for (String o : expected.outputs()) {
                Assertions.assertEquals(e.get(o), a.get(o), "output " + o + " for assignment " + k);
            }
        }
    }

    @ParameterizedTest
    @ValueSource(strings = { "c17.v", "vectors.v" })
    public void testRoundTrip(String fileName) {
        Circuit c = CircuitFixtures.read(fileName);
        String text = VerilogTools.toVerilog(c);
        Circuit reparsed = VerilogTools.parseVerilog(text);
        Assertions.assertEquals(c.getName(), reparsed.getName());
        assertEquivalent(c, reparsed);
    }

    @Test
    public void testVectorDeclarations() {
        String text = VerilogTools.toVerilog(CircuitFixtures.read("vectors.v"));
        Assertions.assertTrue(text.contains("input [3:0] a;"));
        Assertions.assertTrue(text.contains("output [1:0] hi;"));
        Assertions.assertTrue(text.contains("wire [3:0] m;"));
    }

    @Test
    public void testGenerated() {
        Circuit adder = CircuitTools.adder(2, true, true);
        Circuit reparsed = VerilogTools.parseVerilog(VerilogTools.toVerilog(adder));
        assertEquivalent(adder, reparsed);
    }

    @Test
    public void testFlipFlopsRoundTrip() {
        Circuit c = CircuitFixtures.read("counter.v");
        String text = new VerilogWriter(c).setWriteBlackBoxModules(false).toVerilog();
        Assertions.assertFalse(text.contains("module dff"));
        Circuit reparsed = VerilogTools.parseVerilog(text);
        Assertions.assertEquals(c.getBlackBoxes(), reparsed.getBlackBoxes());
        Assertions.assertEquals(c.fanin("q0_reg.D"), reparsed.fanin("q0_reg.D"));
        Assertions.assertEquals(c.fanin("q0"), reparsed.fanin("q0"));

        // A supplied definition takes precedence over the stub module
        String withStubs = VerilogTools.toVerilog(c);
        Assertions.assertTrue(withStubs.contains("module dff(D, CK, Q);"));
        reparsed = VerilogTools.parseVerilog(withStubs, Collections.singletonList(BlackBox.DFF));
        Assertions.assertEquals("counter", reparsed.getName());
        Assertions.assertTrue(reparsed.getBlackBox("q1_reg").isSequential());
    }

    @Test
    public void testHierarchyStubs() {
        Circuit c = CircuitFixtures.read("hierarchy.v");
        String text = VerilogTools.toVerilog(c);
        Assertions.assertTrue(text.contains("half_adder ha0(.a(a), .b(b), .s(t), .c(z));"));
        Circuit reparsed = VerilogTools.parseVerilog(text);
        Assertions.assertEquals(c.getBlackBox("ha0"), reparsed.getBlackBox("ha0"));
        Assertions.assertEquals(c.startpoints("y"), reparsed.startpoints("y"));
    }

    @Test
    public void testSequentialStubRoundTrip() {
        BlackBox myreg = new BlackBox("myreg", Arrays.asList("D"), Arrays.asList("Q"), true);
        Circuit c = new Circuit("loop");
        c.add("a", GateType.INPUT);
        c.addBlackBox(myreg, "r0", Collections.singletonMap("Q", "q"));
        c.add("y", GateType.XOR, "a", "q");
        c.connect("y", "r0.D");
        c.setOutput("y", true);
        c.validate();

        String text = VerilogTools.toVerilog(c);
        Assertions.assertTrue(text.contains("always @(posedge D) " + VerilogWriter.STATE_REG + " <= D;"));
        // The loop through r0 only parses if the stub reads back as sequential
        Circuit reparsed = VerilogTools.parseVerilog(text);
        Assertions.assertTrue(reparsed.getBlackBox("r0").isSequential());
        Assertions.assertEquals(myreg, reparsed.getBlackBox("r0"));
        Assertions.assertEquals(c.startpoints("y"), reparsed.startpoints("y"));
        Assertions.assertEquals(c.fanin("r0.D"), reparsed.fanin("r0.D"));
    }

    @Test
    public void testEscapedNames() {
        Assertions.assertEquals("abc", VerilogWriter.escape("abc"));
        Assertions.assertEquals("\\wire ", VerilogWriter.escape("wire"));
        Assertions.assertEquals("\\ff.Q ", VerilogWriter.escape("ff.Q"));

        Circuit c = new Circuit("escaped");
        c.add("in.0", GateType.INPUT);
        c.add("and", GateType.INPUT);
        c.add("out$1", GateType.NAND, Arrays.asList("in.0", "and"), Collections.emptyList(), true);
        Circuit reparsed = VerilogTools.parseVerilog(VerilogTools.toVerilog(c));
        Assertions.assertEquals(GateType.NAND, reparsed.getType("out$1"));
        assertEquivalent(c, reparsed);
    }

    @Test
    public void testInputAlsoOutput() {
        Circuit c = new Circuit("feedthrough");
        c.add("a", GateType.INPUT);
        c.setOutput("a", true);
        c.add("b", GateType.NOT, Arrays.asList("a"), Collections.emptyList(), true);
        c.add("u", GateType.X);
        c.setOutput("u", true);
        String text = VerilogTools.toVerilog(c);
        Assertions.assertTrue(text.contains("output a_out;"));
        Assertions.assertTrue(text.contains("assign u = 1'bx;"));
        Circuit reparsed = VerilogTools.parseVerilog(text);
        Assertions.assertEquals(Collections.singleton("a"), reparsed.fanin("a_out"));
        Assertions.assertEquals(GateType.X, reparsed.getType("u"));
    }

    @Test
    public void testWriteFile(@TempDir Path tempDir) {
        Circuit c = CircuitFixtures.read("c17.v");
        Path out = tempDir.resolve("c17_out" + VerilogTools.VERILOG_EXTENSION);
        VerilogTools.writeVerilogFile(c, out);
        assertEquivalent(c, VerilogTools.readVerilogFile(out));
    }
}
