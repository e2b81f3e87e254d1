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

package com.circuitwright.circuit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Generic methods to build library circuits (adders, muxes, population
 * counters) and to evaluate circuits by simulation.
 */
public class CircuitTools {

    /** Largest cone for which {@link #truthTable(Circuit, String)} enumerates all patterns */
    public static final int MAX_TRUTH_TABLE_INPUTS = 20;

    /**
     * Computes ceil(log2(n)), the number of bits needed to index n items.
     * @param n A positive integer.
     * @return 0 for n = 1, otherwise the smallest w with 2^w >= n.
     */
    public static int clog2(int n) {
        if (n < 1) throw new IllegalArgumentException("clog2 of non-positive value " + n);
        return 32 - Integer.numberOfLeadingZeros(n - 1);
    }

    /**
     * Creates an AND/XOR half adder with inputs x, y and outputs s (sum) and c (carry).
     */
    public static Circuit halfAdder() {
        Circuit c = new Circuit("half_adder");
        c.add("x", GateType.INPUT);
        c.add("y", GateType.INPUT);
        c.add("c", GateType.AND, Arrays.asList("x", "y"), Arrays.asList(), true);
        c.add("s", GateType.XOR, Arrays.asList("x", "y"), Arrays.asList(), true);
        return c;
    }

    /**
     * Creates a full adder from two half adders, with inputs x, y, cin and
     * outputs s and cout.
     */
    public static Circuit fullAdder() {
        Circuit c = new Circuit("full_adder");
        c.add("x", GateType.INPUT);
        c.add("y", GateType.INPUT);
        c.add("cin", GateType.INPUT);

        c.addSubcircuit(halfAdder(), "x_y_ha", connections("x", "x", "y", "y"));
        c.addSubcircuit(halfAdder(), "cin_s_ha", connections("x", "x_y_ha_s", "y", "cin"));

        c.add("cout", GateType.OR, Arrays.asList("x_y_ha_c", "cin_s_ha_c"), Arrays.asList(), true);
        c.add("s", GateType.BUF, Arrays.asList("cin_s_ha_s"), Arrays.asList(), true);
        return c;
    }

    /**
     * Creates a ripple carry adder with inputs a_i, b_i and outputs out_i.
     * @param width Input width of the adder.
     * @param carryIn If true, adds a carry input cin, otherwise cin is tied to 0.
     * @param carryOut If true, adds a carry output cout.
     * @return The adder circuit.
     */
    public static Circuit adder(int width, boolean carryIn, boolean carryOut) {
        if (width < 1) throw new IllegalArgumentException("Adder width must be positive: " + width);
        Circuit c = new Circuit("adder");
        c.add("cin", carryIn ? GateType.INPUT : GateType.CONST0);
        String carry = "cin";
        for (int bit = 0; bit < width; bit++) {
            String a = "a_" + bit;
            String b = "b_" + bit;
            String out = "out_" + bit;
            c.add(a, GateType.INPUT);
            c.add(b, GateType.INPUT);
            c.addUnconnected(out, GateType.BUF, true);
            Map<String, String> conn = new LinkedHashMap<>();
            conn.put("x", a);
            conn.put("y", b);
            conn.put("cin", carry);
            conn.put("s", out);
            c.addSubcircuit(fullAdder(), "fa_" + bit, conn);
            carry = "fa_" + bit + "_cout";
        }
        if (carryOut) {
            c.add("cout", GateType.BUF, Arrays.asList(carry), Arrays.asList(), true);
        }
        return c;
    }

    /**
     * Creates a one-hot AND/OR mux with data inputs in_i, select inputs sel_j
     * (sel_0 is the least significant) and output out.
     * @param width Number of data inputs.
     */
    public static Circuit mux(int width) {
        if (width < 1) throw new IllegalArgumentException("Mux width must be positive: " + width);
        Circuit c = new Circuit("mux");
        for (int i = 0; i < width; i++) {
            c.add("in_" + i, GateType.INPUT);
        }
        int selWidth = clog2(width);
        for (int j = 0; j < selWidth; j++) {
            c.add("sel_" + j, GateType.INPUT);
            c.add("not_sel_" + j, GateType.NOT, "sel_" + j);
        }
        c.addUnconnected("out", GateType.OR, true);
        for (int i = 0; i < width; i++) {
            List<String> fanin = new ArrayList<>();
            for (int j = 0; j < selWidth; j++) {
                fanin.add(((i >> j) & 1) == 1 ? "sel_" + j : "not_sel_" + j);
            }
            fanin.add("in_" + i);
            c.add("and_" + i, GateType.AND, fanin, Arrays.asList("out"), false);
        }
        return c;
    }

    /**
     * Creates a population count circuit: a tree of adders summing the inputs
     * in_i into the binary number out_0 (least significant) ... out_k. There
     * are at least clog2(width + 1) outputs.
     * @param width Number of inputs.
     */
    public static Circuit popcount(int width) {
        if (width < 1) throw new IllegalArgumentException("Popcount width must be positive: " + width);
        Circuit c = new Circuit("popcount");
        List<List<String>> ps = new ArrayList<>();
        for (int i = 0; i < width; i++) {
            c.add("in_" + i, GateType.INPUT);
            List<String> p = new ArrayList<>();
            p.add("in_" + i);
            ps.add(p);
        }
        c.add("tie0", GateType.CONST0);

        int i = 0;
        while (ps.size() > 1) {
            List<String> ns = ps.remove(0);
            List<String> ms = ps.remove(0);

            int aw = Math.max(ns.size(), ms.size());
            while (ms.size() < aw) ms.add("tie0");
            while (ns.size() < aw) ns.add("tie0");

            String add = "add_" + i;
            c.addSubcircuit(adder(aw, false, true), add);
            c.relabel(add + "_cout", add + "_out_" + aw);
            for (int j = 0; j < aw; j++) {
                c.connect(ns.get(j), add + "_a_" + j);
                c.connect(ms.get(j), add + "_b_" + j);
            }

            List<String> sum = new ArrayList<>();
            for (int j = 0; j <= aw; j++) {
                sum.add(add + "_out_" + j);
            }
            ps.add(sum);
            i++;
        }

        List<String> result = ps.get(0);
        for (int o = 0; o < result.size(); o++) {
            c.add("out_" + o, GateType.BUF, Arrays.asList(result.get(o)), Arrays.asList(), true);
        }
        if (c.fanout("tie0").isEmpty()) {
            c.remove("tie0");
        }
        return c;
    }

    /**
     * Splits an integer into its low bits, least significant first.
     */
    public static boolean[] toBinary(long value, int width) {
        boolean[] bits = new boolean[width];
        for (int i = 0; i < width; i++) {
            bits[i] = ((value >> i) & 1) == 1;
        }
        return bits;
    }

    /**
     * Evaluates every node of the circuit for one assignment of its startpoints.
     * Unknown (x) nodes evaluate to false.
     * @param c The circuit to simulate.
     * @param startpointValues A value for each startpoint (input or blackbox output).
     * @return The value of every node.
     * @throws IllegalArgumentException if a startpoint has no value.
     */
    public static Map<String, Boolean> simulate(Circuit c, Map<String, Boolean> startpointValues) {
        Map<String, Boolean> values = new HashMap<>();
        for (String n : c.topologicalOrder()) {
            CircuitNode node = c.getNode(n);
            if (node.isStartpoint()) {
                Boolean v = startpointValues.get(n);
                if (v == null) {
                    throw new IllegalArgumentException("No value given for startpoint '" + n + "'");
                }
                values.put(n, v);
                continue;
            }
            List<Boolean> in = new ArrayList<>(node.getFanin().size());
            for (CircuitNode d : node.getFanin()) {
                in.add(values.get(d.getName()));
            }
            values.put(n, node.getType().evaluate(in));
        }
        return values;
    }

    /**
     * Enumerates the function of a node over its own startpoints.
     * @param c The circuit.
     * @param n The node.
     * @return Entry k holds the value of n when startpoint j of
     *         {@link Circuit#startpoints(String)} (in its iteration order) is
     *         set to bit j of k.
     */
    public static boolean[] truthTable(Circuit c, String n) {
        List<String> sp = new ArrayList<>(c.startpoints(n));
        if (sp.size() > MAX_TRUTH_TABLE_INPUTS) {
            throw new IllegalArgumentException("Node '" + n + "' has " + sp.size()
                    + " startpoints, too many to enumerate");
        }
        Set<String> all = c.startpoints();
        boolean[] table = new boolean[1 << sp.size()];
        Map<String, Boolean> assignment = new HashMap<>();
        for (String s : all) {
            assignment.put(s, false);
        }
        for (int k = 0; k < table.length; k++) {
            for (int j = 0; j < sp.size(); j++) {
                assignment.put(sp.get(j), ((k >> j) & 1) == 1);
            }
            table[k] = simulate(c, assignment).get(n);
        }
        return table;
    }

    private static Map<String, String> connections(String... pairs) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return map;
    }
}
