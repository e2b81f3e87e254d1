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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.circuitwright.circuit.GateType;

/**
 * Parsed right-hand-side expression of the structural subset.
 */
class VerilogExpr {

    enum Kind {
        IDENTIFIER,
        BIT_SELECT,
        PART_SELECT,
        CONSTANT,
        NOT,
        BINARY,
        REDUCTION,
        TERNARY,
        CONCAT
    }

    final Kind kind;
    final int line;
    /** Net name for identifiers and selects */
    final String name;
    /** Select bounds; a bit-select uses msb only */
    final int msb;
    final int lsb;
    /** Constant value, least significant bit first, over '0', '1' and 'x' */
    final String bits;
    /** False for unsized constants, which take the width of their context */
    final boolean sized;
    /** Operator of binary and reduction expressions */
    final GateType op;
    final List<VerilogExpr> operands;

    private VerilogExpr(Kind kind, int line, String name, int msb, int lsb, String bits, boolean sized,
            GateType op, List<VerilogExpr> operands) {
        this.kind = kind;
        this.line = line;
        this.name = name;
        this.msb = msb;
        this.lsb = lsb;
        this.bits = bits;
        this.sized = sized;
        this.op = op;
        this.operands = operands;
    }

    static VerilogExpr identifier(String name, int line) {
        return new VerilogExpr(Kind.IDENTIFIER, line, name, 0, 0, null, false, null, Collections.emptyList());
    }

    static VerilogExpr bitSelect(String name, int index, int line) {
        return new VerilogExpr(Kind.BIT_SELECT, line, name, index, index, null, false, null, Collections.emptyList());
    }

    static VerilogExpr partSelect(String name, int msb, int lsb, int line) {
        return new VerilogExpr(Kind.PART_SELECT, line, name, msb, lsb, null, false, null, Collections.emptyList());
    }

    static VerilogExpr not(VerilogExpr operand) {
        return new VerilogExpr(Kind.NOT, operand.line, null, 0, 0, null, false, GateType.NOT,
                Collections.singletonList(operand));
    }

    static VerilogExpr binary(GateType op, VerilogExpr left, VerilogExpr right) {
        return new VerilogExpr(Kind.BINARY, left.line, null, 0, 0, null, false, op, Arrays.asList(left, right));
    }

    static VerilogExpr reduction(GateType op, VerilogExpr operand) {
        return new VerilogExpr(Kind.REDUCTION, operand.line, null, 0, 0, null, false, op,
                Collections.singletonList(operand));
    }

    static VerilogExpr ternary(VerilogExpr cond, VerilogExpr ifTrue, VerilogExpr ifFalse) {
        return new VerilogExpr(Kind.TERNARY, cond.line, null, 0, 0, null, false, null,
                Arrays.asList(cond, ifTrue, ifFalse));
    }

    /**
     * @param parts Concatenated expressions, most significant first as written.
     */
    static VerilogExpr concat(List<VerilogExpr> parts, int line) {
        return new VerilogExpr(Kind.CONCAT, line, null, 0, 0, null, false, null, new ArrayList<>(parts));
    }

    static VerilogExpr constant(String bits, boolean sized, int line) {
        return new VerilogExpr(Kind.CONSTANT, line, null, 0, 0, bits, sized, null, Collections.emptyList());
    }

    /**
     * Creates a constant from a number token such as {@code 1'b0}, {@code 4'hA},
     * {@code 'bx} or {@code 12}. z digits are treated as unknown.
     */
    static VerilogExpr constant(VerilogToken token) {
        String text = token.text.replace("_", "");
        int tick = text.indexOf('\'');
        if (tick < 0) {
            return constant(new StringBuilder(new BigInteger(text).toString(2)).reverse().toString(), false,
                    token.line);
        }
        boolean sized = tick > 0;
        int size = sized ? Integer.parseInt(text.substring(0, tick)) : -1;
        if (sized && size < 1) {
            throw new VerilogParseException("Parsing Error: Constant size must be positive: " + token.text, token);
        }
        char base = text.charAt(tick + 1);
        String digits = text.substring(tick + 2).toLowerCase();
        StringBuilder msbFirst = new StringBuilder();
        if (base == 'd') {
            if (digits.matches("[xz?]+")) {
                msbFirst.append('x');
            } else if (digits.matches("[0-9]+")) {
                msbFirst.append(new BigInteger(digits).toString(2));
            } else {
                throw new VerilogParseException("Parsing Error: Malformed decimal constant " + token.text, token);
            }
        } else {
            int bitsPerDigit = base == 'b' ? 1 : base == 'o' ? 3 : 4;
            int radix = 1 << bitsPerDigit;
            for (char c : digits.toCharArray()) {
                if (c == 'x' || c == 'z' || c == '?') {
                    for (int i = 0; i < bitsPerDigit; i++) msbFirst.append('x');
                    continue;
                }
                int v = Character.digit(c, radix);
                if (v < 0) {
                    throw new VerilogParseException("Parsing Error: Malformed constant " + token.text, token);
                }
                for (int i = bitsPerDigit - 1; i >= 0; i--) {
                    msbFirst.append(((v >> i) & 1) == 1 ? '1' : '0');
                }
            }
        }
        String lsbFirst = msbFirst.reverse().toString();
        if (sized) {
            lsbFirst = resize(lsbFirst, size);
        }
        return constant(lsbFirst, sized, token.line);
    }

    /**
     * Extends (with 0, or x if the top bit is x) or truncates constant bits to a width.
     */
    static String resize(String lsbFirst, int width) {
        if (lsbFirst.length() >= width) {
            return lsbFirst.substring(0, width);
        }
        char fill = lsbFirst.charAt(lsbFirst.length() - 1) == 'x' ? 'x' : '0';
        StringBuilder sb = new StringBuilder(lsbFirst);
        while (sb.length() < width) sb.append(fill);
        return sb.toString();
    }

    /**
     * True for plain references to a net or a single bit of one.
     */
    boolean isReference() {
        return kind == Kind.IDENTIFIER || kind == Kind.BIT_SELECT || kind == Kind.PART_SELECT;
    }

    @Override
    public String toString() {
        switch (kind) {
            case IDENTIFIER: return name;
            case BIT_SELECT: return name + "[" + msb + "]";
            case PART_SELECT: return name + "[" + msb + ":" + lsb + "]";
            case CONSTANT: return (sized ? bits.length() + "'b" : "'b") + new StringBuilder(bits).reverse();
            case NOT: return "~" + operands.get(0);
            case REDUCTION: return op.getShortName() + "(" + operands.get(0) + ")";
            case TERNARY: return "(" + operands.get(0) + " ? " + operands.get(1) + " : " + operands.get(2) + ")";
            case CONCAT: return "{" + operands + "}";
            default: return "(" + operands.get(0) + " " + op.getShortName() + " " + operands.get(1) + ")";
        }
    }
}
