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

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The closed set of node kinds a {@link Circuit} can hold. Each kind carries
 * its fanin arity rule, the Verilog primitive keyword it corresponds to (if
 * any) and its Boolean function.
 * <p>
 * Blackbox pins ({@link #BB_INPUT}, {@link #BB_OUTPUT}) carry no logic; they
 * are the boundary between the combinational graph and a {@link BlackBox}
 * instance. Whether a node is a primary output is a node attribute, not a kind.
 */
public enum GateType {
    INPUT("input", null, 0, 0),
    AND("and", "and", 1, Integer.MAX_VALUE),
    OR("or", "or", 1, Integer.MAX_VALUE),
    NAND("nand", "nand", 1, Integer.MAX_VALUE),
    NOR("nor", "nor", 1, Integer.MAX_VALUE),
    XOR("xor", "xor", 1, Integer.MAX_VALUE),
    XNOR("xnor", "xnor", 1, Integer.MAX_VALUE),
    NOT("not", "not", 1, 1),
    BUF("buf", "buf", 1, 1),
    CONST0("0", null, 0, 0),
    CONST1("1", null, 0, 0),
    X("x", null, 0, 0),
    BB_INPUT("bb_input", null, 0, 1),
    BB_OUTPUT("bb_output", null, 0, 0);

    private final String shortName;
    private final String primitive;
    private final int minFanin;
    private final int maxFanin;

    private static final Map<String, GateType> primitiveMap;
    private static final Map<String, GateType> shortNameMap;

    static {
        primitiveMap = new HashMap<>();
        shortNameMap = new HashMap<>();
        for (GateType t : values()) {
            if (t.primitive != null) {
                primitiveMap.put(t.primitive, t);
            }
            shortNameMap.put(t.shortName, t);
        }
    }

    GateType(String shortName, String primitive, int minFanin, int maxFanin) {
        this.shortName = shortName;
        this.primitive = primitive;
        this.minFanin = minFanin;
        this.maxFanin = maxFanin;
    }

    /**
     * Gets the short, lower case name of this kind ("and", "bb_input", "0", ...).
     */
    public String getShortName() {
        return shortName;
    }

    /**
     * Gets the Verilog gate primitive keyword of this kind.
     * @return The keyword or null if there is no corresponding primitive.
     */
    public String getVerilogPrimitive() {
        return primitive;
    }

    /**
     * Fewest drivers a fully-built node of this kind may have.
     */
    public int getMinFanin() {
        return minFanin;
    }

    /**
     * Most drivers a node of this kind may have, {@link Integer#MAX_VALUE} if unbounded.
     */
    public int getMaxFanin() {
        return maxFanin;
    }

    /** True for kinds that never take a driver. */
    public boolean isNullary() {
        return maxFanin == 0;
    }

    /** True for kinds limited to a single driver (including {@link #BB_INPUT}). */
    public boolean isSingleDriver() {
        return maxFanin == 1;
    }

    public boolean isBlackBoxPin() {
        return this == BB_INPUT || this == BB_OUTPUT;
    }

    public boolean isConstant() {
        return this == CONST0 || this == CONST1;
    }

    /**
     * True for the kinds whose function is the complement of another kind's.
     */
    public boolean isInverting() {
        return this == NAND || this == NOR || this == XNOR || this == NOT;
    }

    /**
     * Gets the kind computing the complement of this kind's function, for the
     * logic kinds that have one.
     * @return The complementary kind or null.
     */
    public GateType getComplement() {
        switch (this) {
            case AND: return NAND;
            case NAND: return AND;
            case OR: return NOR;
            case NOR: return OR;
            case XOR: return XNOR;
            case XNOR: return XOR;
            case BUF: return NOT;
            case NOT: return BUF;
            case CONST0: return CONST1;
            case CONST1: return CONST0;
            default: return null;
        }
    }

    /**
     * Evaluates this kind's Boolean function. Nullary kinds other than constants
     * (inputs, unknowns and blackbox outputs) have no function of their own and
     * evaluate to false here; simulation assigns their values directly.
     * @param values The values of the node's drivers.
     * @return The node value.
     */
    public boolean evaluate(List<Boolean> values) {
        switch (this) {
            case AND:
            case NAND: {
                boolean r = true;
                for (boolean v : values) r &= v;
                return this == AND ? r : !r;
            }
            case OR:
            case NOR: {
                boolean r = false;
                for (boolean v : values) r |= v;
                return this == OR ? r : !r;
            }
            case XOR:
            case XNOR: {
                boolean r = false;
                for (boolean v : values) r ^= v;
                return this == XOR ? r : !r;
            }
            case BUF:
            case BB_INPUT:
                return !values.isEmpty() && values.get(0);
            case NOT:
                return !values.get(0);
            case CONST1:
                return true;
            default:
                return false;
        }
    }

    /**
     * Looks up a kind by its Verilog primitive keyword ("and", "nor", "buf", ...).
     * @return The kind or null if the keyword is not a gate primitive.
     */
    public static GateType fromVerilogPrimitive(String keyword) {
        return primitiveMap.get(keyword);
    }

    /**
     * Looks up a kind by its short name as returned by {@link #getShortName()}.
     * @return The kind or null if there is none by that name.
     */
    public static GateType fromShortName(String name) {
        return shortNameMap.get(name);
    }
}
