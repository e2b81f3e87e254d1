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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.circuitwright.circuit.GateType;

/**
 * Syntax tree of one parsed module: its port order, net declarations and
 * structural statements, before elaboration into a circuit.
 */
class VerilogModule {

    enum Direction {
        INPUT,
        OUTPUT,
        WIRE
    }

    /**
     * A declared net, scalar or vector.
     */
    static class NetDecl {
        final String name;
        Direction direction;
        boolean vector;
        int msb;
        int lsb;
        final int line;

        NetDecl(String name, Direction direction, boolean vector, int msb, int lsb, int line) {
            this.name = name;
            this.direction = direction;
            this.vector = vector;
            this.msb = msb;
            this.lsb = lsb;
            this.line = line;
        }

        int getWidth() {
            return vector ? Math.abs(msb - lsb) + 1 : 1;
        }

        boolean containsIndex(int index) {
            return vector && index >= Math.min(msb, lsb) && index <= Math.max(msb, lsb);
        }

        /**
         * Gets the names of the bits of this net, least significant first.
         */
        List<String> getBitNames() {
            List<String> bits = new ArrayList<>();
            if (!vector) {
                bits.add(name);
                return bits;
            }
            int step = msb >= lsb ? 1 : -1;
            for (int i = lsb; ; i += step) {
                bits.add(bitName(name, i));
                if (i == msb) break;
            }
            return bits;
        }
    }

    abstract static class Statement {
        final int line;

        Statement(int line) {
            this.line = line;
        }
    }

    /** {@code assign lhs = rhs;} or a net declaration assignment */
    static class Assign extends Statement {
        final VerilogExpr lhs;
        final VerilogExpr rhs;

        Assign(VerilogExpr lhs, VerilogExpr rhs, int line) {
            super(line);
            this.lhs = lhs;
            this.rhs = rhs;
        }
    }

    /** Gate primitive instance; terminals are outputs first, then inputs */
    static class GateInstance extends Statement {
        final GateType type;
        final String instance;
        final List<VerilogExpr> terminals;

        GateInstance(GateType type, String instance, List<VerilogExpr> terminals, int line) {
            super(line);
            this.type = type;
            this.instance = instance;
            this.terminals = terminals;
        }

        int getOutputCount() {
            return type.isSingleDriver() ? terminals.size() - 1 : 1;
        }
    }

    /** Instance of a module or blackbox; exactly one of positional and named is used */
    static class ModuleInstance extends Statement {
        final String module;
        final String instance;
        /** Positional connections, null entries for skipped positions */
        final List<VerilogExpr> positional = new ArrayList<>();
        /** Named connections in written order, null values for {@code .port()} */
        final Map<String, VerilogExpr> named = new LinkedHashMap<>();

        ModuleInstance(String module, String instance, int line) {
            super(line);
            this.module = module;
            this.instance = instance;
        }

        boolean isNamed() {
            return !named.isEmpty();
        }
    }

    /** The recognized {@code always @(posedge clk) q <= d;} idiom */
    static class FlipFlop extends Statement {
        final VerilogExpr clock;
        final VerilogExpr q;
        final VerilogExpr d;

        FlipFlop(VerilogExpr clock, VerilogExpr q, VerilogExpr d, int line) {
            super(line);
            this.clock = clock;
            this.q = q;
            this.d = d;
        }
    }

    final String name;
    final int line;
    final List<String> ports = new ArrayList<>();
    final Map<String, NetDecl> nets = new LinkedHashMap<>();
    final List<Statement> statements = new ArrayList<>();
    /** Every identifier the module body refers to */
    final Set<String> identifiers = new LinkedHashSet<>();

    VerilogModule(String name, int line) {
        this.name = name;
        this.line = line;
    }

    /**
     * Gets the names of the modules this module instantiates.
     */
    Set<String> getInstantiatedModules() {
        Set<String> result = new LinkedHashSet<>();
        for (Statement s : statements) {
            if (s instanceof ModuleInstance) {
                result.add(((ModuleInstance) s).module);
            }
        }
        return result;
    }

    boolean hasFlipFlops() {
        for (Statement s : statements) {
            if (s instanceof FlipFlop) return true;
        }
        return false;
    }

    static String bitName(String net, int index) {
        return net + "[" + index + "]";
    }
}
