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

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.WeakHashMap;

import com.circuitwright.circuit.Circuit;
import com.circuitwright.circuit.CircuitNode;
import com.circuitwright.circuit.GateType;

/**
 * Tseitin encoding of circuits. Each node gets one variable, numbered in node
 * creation order, and each gate kind contributes the clauses that make its
 * variable equal to its function of its drivers' variables. Inputs, unknowns
 * and blackbox outputs are left unconstrained.
 */
public class CnfEncoder {

    /**
     * Clause template of one gate kind.
     */
    @FunctionalInterface
    public interface GateEncoding {
        /**
         * @param cnf Formula to add the clauses to.
         * @param out Literal of the gate output.
         * @param in Literals of the gate inputs.
         */
        void encode(Cnf cnf, int out, int[] in);
    }

    private static final Map<GateType, GateEncoding> ENCODINGS = new EnumMap<>(GateType.class);

    private static final GateEncoding FREE = (cnf, out, in) -> { };

    static {
        ENCODINGS.put(GateType.AND, CnfEncoder::and);
        ENCODINGS.put(GateType.NAND, (cnf, out, in) -> and(cnf, -out, in));
        ENCODINGS.put(GateType.OR, CnfEncoder::or);
        ENCODINGS.put(GateType.NOR, (cnf, out, in) -> or(cnf, -out, in));
        ENCODINGS.put(GateType.XOR, CnfEncoder::xor);
        ENCODINGS.put(GateType.XNOR, (cnf, out, in) -> xor(cnf, -out, in));
        ENCODINGS.put(GateType.BUF, CnfEncoder::buf);
        ENCODINGS.put(GateType.NOT, (cnf, out, in) -> buf(cnf, -out, in));
        ENCODINGS.put(GateType.CONST0, (cnf, out, in) -> cnf.addClause(-out));
        ENCODINGS.put(GateType.CONST1, (cnf, out, in) -> cnf.addClause(out));
        ENCODINGS.put(GateType.INPUT, FREE);
        ENCODINGS.put(GateType.X, FREE);
        ENCODINGS.put(GateType.BB_OUTPUT, FREE);
        // An input pin follows its driver, if it has one
        ENCODINGS.put(GateType.BB_INPUT, (cnf, out, in) -> {
            if (in.length > 0) buf(cnf, out, in);
        });
    }

    private static class CacheEntry {
        final long modCount;
        final CircuitCnf encoding;

        CacheEntry(long modCount, CircuitCnf encoding) {
            this.modCount = modCount;
            this.encoding = encoding;
        }
    }

    private static final Map<Circuit, CacheEntry> cache = new WeakHashMap<>();

    /**
     * Gets the encoding of a circuit, reusing the previous one if the circuit
     * has not changed since.
     * @throws com.circuitwright.circuit.StructuralException if the circuit is
     *         not complete, see {@link Circuit#validate()}.
     */
    public static CircuitCnf encode(Circuit c) {
        long modCount = c.getModificationCount();
        synchronized (cache) {
            CacheEntry entry = cache.get(c);
            if (entry != null && entry.modCount == modCount) {
                return entry.encoding;
            }
        }
        CircuitCnf encoding = encodeUncached(c);
        synchronized (cache) {
            cache.put(c, new CacheEntry(modCount, encoding));
        }
        return encoding;
    }

    /**
     * Encodes a circuit without consulting the cache.
     */
    public static CircuitCnf encodeUncached(Circuit c) {
        c.validate();
        Cnf cnf = new Cnf();
        Map<String, Integer> variables = new LinkedHashMap<>();
        for (CircuitNode n : c.getNodes()) {
            variables.put(n.getName(), cnf.newVariable());
        }
        for (CircuitNode n : c.getNodes()) {
            int[] in = new int[n.getFanin().size()];
            int i = 0;
            for (CircuitNode d : n.getFanin()) {
                in[i++] = variables.get(d.getName());
            }
            ENCODINGS.get(n.getType()).encode(cnf, variables.get(n.getName()), in);
        }
        return new CircuitCnf(c.getName(), cnf, variables);
    }

    private static void and(Cnf cnf, int out, int[] in) {
        int[] big = new int[in.length + 1];
        for (int i = 0; i < in.length; i++) {
            cnf.addClause(-out, in[i]);
            big[i] = -in[i];
        }
        big[in.length] = out;
        cnf.addClause(big);
    }

    private static void or(Cnf cnf, int out, int[] in) {
        int[] big = new int[in.length + 1];
        for (int i = 0; i < in.length; i++) {
            cnf.addClause(out, -in[i]);
            big[i] = in[i];
        }
        big[in.length] = -out;
        cnf.addClause(big);
    }

    private static void buf(Cnf cnf, int out, int[] in) {
        cnf.addClause(-out, in[0]);
        cnf.addClause(out, -in[0]);
    }

    /**
     * Chains two-input XORs through auxiliary variables.
     */
    private static void xor(Cnf cnf, int out, int[] in) {
        if (in.length == 1) {
            buf(cnf, out, in);
            return;
        }
        int acc = in[0];
        for (int i = 1; i < in.length - 1; i++) {
            int t = cnf.newVariable();
            xor2(cnf, t, acc, in[i]);
            acc = t;
        }
        xor2(cnf, out, acc, in[in.length - 1]);
    }

    private static void xor2(Cnf cnf, int out, int a, int b) {
        cnf.addClause(-out, a, b);
        cnf.addClause(-out, -a, -b);
        cnf.addClause(out, -a, b);
        cnf.addClause(out, a, -b);
    }
}
