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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.circuitwright.circuit.BlackBox;
import com.circuitwright.circuit.Circuit;
import com.circuitwright.circuit.CircuitTools;
import com.circuitwright.circuit.GateType;
import com.circuitwright.support.CircuitFixtures;

public class TestVerilogParser {

    private static Set<String> set(String... names) {
        return new HashSet<>(Arrays.asList(names));
    }

    @Test
    public void testC17() {
        Circuit c = CircuitFixtures.read("c17.v");
        Assertions.assertEquals("c17", c.getName());
        Assertions.assertEquals(11, c.size());
        Assertions.assertEquals(set("G1", "G2", "G3", "G6", "G7"), c.inputs());
        Assertions.assertEquals(set("G22", "G23"), c.outputs());
        Assertions.assertEquals(GateType.NAND, c.getType("G10"));
        Assertions.assertEquals(set("G1", "G3"), c.fanin("G10"));
        Assertions.assertEquals(set("G1", "G2", "G3", "G6"), c.startpoints("G22"));
        Assertions.assertEquals(set("G2", "G3", "G6", "G7"), c.startpoints("G23"));
        Assertions.assertEquals(set("G22", "G23"), c.endpoints("G3"));
    }

    @Test
    public void testVectors() {
        Circuit c = CircuitFixtures.read("vectors.v");
        Assertions.assertTrue(c.contains("a[3]"));
        Assertions.assertEquals(GateType.INPUT, c.getType("b[0]"));
        Assertions.assertTrue(c.isOutput("y[2]"));
        Assertions.assertTrue(c.isOutput("hi[1]"));
        Assertions.assertEquals(set("a[3]"), c.fanin("hi[1]"));

        Map<String, Boolean> in = new HashMap<>();
        boolean[] a = CircuitTools.toBinary(0b1100, 4);
        boolean[] b = CircuitTools.toBinary(0b0100, 4);
        for (int i = 0; i < 4; i++) {
            in.put("a[" + i + "]", a[i]);
            in.put("b[" + i + "]", b[i]);
        }
        in.put("sel", true);
        Map<String, Boolean> values = CircuitTools.simulate(c, in);
        Assertions.assertEquals(0b1000, word(values, "y", 4));
        Assertions.assertTrue(values.get("any"));
        Assertions.assertEquals(0b11, word(values, "hi", 2));

        in.put("sel", false);
        values = CircuitTools.simulate(c, in);
        Assertions.assertEquals(0b1010, word(values, "y", 4));

        for (int i = 0; i < 4; i++) {
            in.put("b[" + i + "]", a[i]);
        }
        values = CircuitTools.simulate(c, in);
        Assertions.assertFalse(values.get("any"));
    }

    private static int word(Map<String, Boolean> values, String base, int width) {
        int result = 0;
        for (int i = 0; i < width; i++) {
            if (values.get(base + "[" + i + "]")) result |= 1 << i;
        }
        return result;
    }

    @Test
    public void testFlipFlops() {
        Circuit c = CircuitFixtures.read("counter.v");
        Assertions.assertEquals(2, c.getBlackBoxes().size());
        Assertions.assertEquals(BlackBox.DFF, c.getBlackBox("q0_reg"));
        Assertions.assertEquals(BlackBox.DFF, c.getBlackBox("q1_reg"));
        Assertions.assertEquals(set("q0_reg.Q"), c.fanin("q0"));
        Assertions.assertEquals(set("d1"), c.fanin("q1_reg.D"));
        Assertions.assertEquals(set("clk"), c.fanin("q0_reg.CK"));
        Assertions.assertEquals(set("q1"), c.fanin("count[1]"));
        Assertions.assertEquals(GateType.XOR, c.getType("d0"));
        Assertions.assertFalse(c.isCyclic());
        // The flop outputs cut the cone of d1
        Assertions.assertEquals(set("en"), c.startpoints("d1"));
    }

    @Test
    public void testHierarchyAsBlackBox() {
        Circuit c = CircuitFixtures.read("hierarchy.v");
        Assertions.assertEquals("top", c.getName());
        BlackBox ha = c.getBlackBox("ha0");
        Assertions.assertEquals("half_adder", ha.getName());
        Assertions.assertEquals(Arrays.asList("a", "b"), ha.getInputs());
        Assertions.assertEquals(Arrays.asList("s", "c"), ha.getOutputs());
        Assertions.assertFalse(ha.isSequential());
        Assertions.assertEquals(set("ha0.c"), c.fanin("z"));
        Assertions.assertEquals(set("c"), c.startpoints("y"));

        Map<String, Circuit> all = VerilogTools.readVerilogFileAll(CircuitFixtures.getString("hierarchy.v"),
                Collections.emptyList());
        Assertions.assertEquals(Arrays.asList("top", "half_adder"), Arrays.asList(all.keySet().toArray()));
        c.fillBlackBox("ha0", all.get("half_adder"));
        Assertions.assertEquals(set("a", "b", "c"), c.startpoints("y"));
        for (int k = 0; k < 8; k++) {
            Map<String, Boolean> in = new HashMap<>();
            in.put("a", (k & 1) == 1);
            in.put("b", (k & 2) == 2);
            in.put("c", (k & 4) == 4);
            Map<String, Boolean> values = CircuitTools.simulate(c, in);
            Assertions.assertEquals(Integer.bitCount(k) % 2 == 1, values.get("y"));
            Assertions.assertEquals((k & 3) == 3, values.get("z"));
        }
    }

    @Test
    public void testSuppliedBlackBoxTakesPrecedence() {
        BlackBox seq = new BlackBox("half_adder", Arrays.asList("a", "b"), Arrays.asList("s", "c"), true);
        Circuit c = VerilogTools.readVerilogFile(CircuitFixtures.getString("hierarchy.v"),
                Collections.singletonList(seq));
        Assertions.assertTrue(c.getBlackBox("ha0").isSequential());
    }

    @Test
    public void testTopModule() {
        VerilogParser parser = new VerilogParser(CircuitFixtures.getText("hierarchy.v"));
        Assertions.assertEquals(Arrays.asList("top", "half_adder"), parser.getModuleNames());
        Assertions.assertEquals("top", parser.getTopModuleName());
        Assertions.assertEquals("half_adder", parser.parse("half_adder").getName());
        Assertions.assertThrows(VerilogParseException.class, () -> parser.parse("missing"));

        VerilogParser twoTops = new VerilogParser("module a(x); input x; endmodule\n"
                + "module b(y); input y; endmodule");
        Assertions.assertThrows(VerilogParseException.class, () -> twoTops.getTopModuleName());
    }

    @Test
    public void testUndefinedModuleIsInferred() {
        String text = "module m(a, b, y);\n"
                + "  input a, b;\n"
                + "  output y;\n"
                + "  wire t;\n"
                + "  mystery u0 (.i0(a), .i1(b), .o(t));\n"
                + "  assign y = ~t;\n"
                + "endmodule\n";
        Circuit c = VerilogTools.parseVerilog(text);
        BlackBox def = c.getBlackBox("u0");
        Assertions.assertEquals(Arrays.asList("i0", "i1"), def.getInputs());
        Assertions.assertEquals(Arrays.asList("o"), def.getOutputs());
        Assertions.assertEquals(set("u0.o"), c.fanin("t"));
    }

    @Test
    public void testUndrivenNetIsUnknown() {
        String text = "module m(a, y, z);\n"
                + "  input a;\n"
                + "  output y, z;\n"
                + "  wire floating, unused;\n"
                + "  assign y = a & floating;\n"
                + "endmodule\n";
        Circuit c = VerilogTools.parseVerilog(text);
        Assertions.assertEquals(GateType.X, c.getType("floating"));
        Assertions.assertEquals(GateType.X, c.getType("z"));
        Assertions.assertFalse(c.contains("unused"));
    }

    @Test
    public void testGatePrimitivesAndConstants() {
        String text = "module m(a, b, y0, y1, y2, y3);\n"
                + "  input a, b;\n"
                + "  output y0, y1, y2, y3;\n"
                + "  xnor #1 g0 (y0, a, b);\n"
                + "  buf (y1, a);\n"
                + "  assign y2 = 1'b1;\n"
                + "  assign y3 = {2{a}} == 2'b11 ? 1'b0 : 1'b1;\n"
                + "endmodule\n";
        Assertions.assertThrows(UnsupportedConstructException.class, () -> VerilogTools.parseVerilog(text));

        String supported = text.replace("{2{a}} == 2'b11 ? 1'b0 : 1'b1", "a ? 1'b0 : b");
        Circuit c = VerilogTools.parseVerilog(supported);
        Assertions.assertEquals(GateType.XNOR, c.getType("y0"));
        Assertions.assertEquals(set("a"), c.fanin("y1"));
        Assertions.assertEquals(GateType.CONST1, c.getType("y2"));
        Assertions.assertArrayEquals(new boolean[] { false, false, true, false }, CircuitTools.truthTable(c, "y3"));
    }

    @Test
    public void testConcatenationAndReplication() {
        String text = "module m(input a, input b, output [3:0] y, output p);\n"
                + "  assign y = {a, {2{b}}, 1'b0};\n"
                + "  assign p = ^y;\n"
                + "endmodule\n";
        Circuit c = VerilogTools.parseVerilog(text);
        Assertions.assertEquals(GateType.CONST0, c.getType("y[0]"));
        Assertions.assertEquals(set("b"), c.fanin("y[1]"));
        Assertions.assertEquals(set("b"), c.fanin("y[2]"));
        Assertions.assertEquals(set("a"), c.fanin("y[3]"));
        Assertions.assertArrayEquals(new boolean[] { false, true, false, true }, CircuitTools.truthTable(c, "p"));
    }

    @Test
    public void testMultiDriverNet() {
        String text = "module m(a, b, y);\n"
                + "  input a, b;\n"
                + "  output y;\n"
                + "  assign y = a;\n"
                + "  assign y = b;\n"
                + "endmodule\n";
        UnsupportedConstructException e = Assertions.assertThrows(UnsupportedConstructException.class,
                () -> VerilogTools.parseVerilog(text));
        Assertions.assertTrue(e.getConstruct().startsWith("multi-driver net"));
    }

    @Test
    public void testVectorFlipFlop() {
        String text = "module m(clk, d, q);\n"
                + "  input clk;\n"
                + "  input [1:0] d;\n"
                + "  output [1:0] q;\n"
                + "  reg [1:0] q;\n"
                + "  always @(posedge clk) q <= d;\n"
                + "endmodule\n";
        UnsupportedConstructException e = Assertions.assertThrows(UnsupportedConstructException.class,
                () -> VerilogTools.parseVerilog(text));
        Assertions.assertTrue(e.getConstruct().startsWith("vector flip-flop"));
        Assertions.assertEquals(6, e.getLine());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "assign y[1:0] = a;",
        "assign {y, z} = a;",
        "always @(a) y = a;",
        "always @(posedge a) if (a) y <= a;",
        "initial y = 1'b0;",
        "assign y = a + a;",
        "assign y = !a;",
        "assign y = $random;",
        "parameter W = 2;",
        "tri t;",
        "bufif0 (y, a, a);",
    })
    public void testUnsupportedConstructs(String item) {
        String text = "module m(a, y, z);\n"
                + "  input a;\n"
                + "  output [1:0] y;\n"
                + "  output z;\n"
                + "  " + item + "\n"
                + "endmodule\n";
        UnsupportedConstructException e = Assertions.assertThrows(UnsupportedConstructException.class,
                () -> VerilogTools.parseVerilog(text));
        Assertions.assertEquals(5, e.getLine());
    }

    @Test
    public void testSyntaxErrorLocation() {
        String text = "module m(a, y);\n"
                + "  input a;\n"
                + "  output y;\n"
                + "  assign y = a\n"
                + "endmodule\n";
        VerilogParseException e = Assertions.assertThrows(VerilogParseException.class,
                () -> VerilogTools.parseVerilog(text));
        Assertions.assertEquals(5, e.getLine());

        Assertions.assertThrows(VerilogParseException.class,
                () -> VerilogTools.parseVerilog("module m(a); input a;"));
        Assertions.assertThrows(VerilogParseException.class,
                () -> VerilogTools.parseVerilog("wire w;"));
    }
}
