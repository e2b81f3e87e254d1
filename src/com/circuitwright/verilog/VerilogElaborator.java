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
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.circuitwright.circuit.BlackBox;
import com.circuitwright.circuit.Circuit;
import com.circuitwright.circuit.GateType;
import com.circuitwright.util.MessageGenerator;
import com.circuitwright.verilog.VerilogModule.Direction;

/**
 * Turns the syntax tree of one module into a {@link Circuit}. Every bit of a
 * declared net becomes a node named after it ({@code a}, {@code b[3]}).
 * Nets start out as driverless buf placeholders; a statement driving a net
 * either turns the placeholder into the gate computing it or connects a
 * driver to it. Expression operators that need their own node get fresh names
 * derived from the net they drive.
 */
class VerilogElaborator {

    private static final String TIE0 = "tie0";
    private static final String TIE1 = "tie1";
    private static final String TIEX = "tiex";

    /**
     * One bit of a blasted expression: a reference to a node, a constant or a
     * gate over other bits that has not been built yet.
     */
    private static class Bit {
        final String node;
        final char constant;
        final GateType type;
        final List<Bit> operands;

        private Bit(String node, char constant, GateType type, List<Bit> operands) {
            this.node = node;
            this.constant = constant;
            this.type = type;
            this.operands = operands;
        }

        static Bit ref(String node) {
            return new Bit(node, ' ', null, Collections.emptyList());
        }

        static Bit constant(char c) {
            return new Bit(null, c, null, Collections.emptyList());
        }

        static Bit gate(GateType type, List<Bit> operands) {
            return new Bit(null, ' ', type, operands);
        }

        boolean isConstant() {
            return node == null && type == null;
        }

        boolean isGate() {
            return type != null;
        }
    }

    private final VerilogModule module;

    private final Map<String, BlackBoxPorts> definitions;

    private final Map<String, BlackBoxPorts> inferred = new HashMap<>();

    private final Circuit circuit;

    /** Names that anonymous nodes must not take */
    private final Set<String> reserved = new HashSet<>();

    /** Net bits that still are, or started as, driverless placeholders */
    private final Set<String> placeholders = new LinkedHashSet<>();

    /** Driven net bits with the line of their driving statement */
    private final Map<String, Integer> drivers = new HashMap<>();

    /** Shared constant nodes by value */
    private final Map<Character, String> ties = new HashMap<>();

    /** Nodes built for gate bits */
    private final Map<Bit, String> built = new IdentityHashMap<>();

    VerilogElaborator(VerilogModule module, Map<String, BlackBoxPorts> definitions) {
        this.module = module;
        this.definitions = definitions;
        this.circuit = new Circuit(module.name);
    }

    Circuit elaborate() {
        for (String p : module.ports) {
            VerilogModule.NetDecl decl = module.nets.get(p);
            if (decl == null || decl.direction == Direction.WIRE) {
                throw new VerilogParseException("Parsing Error: Port '" + p + "' of module " + module.name
                        + " has no direction", module.line, 1);
            }
        }
        for (VerilogModule.NetDecl decl : module.nets.values()) {
            if (decl.direction != Direction.WIRE && !module.ports.contains(decl.name)) {
                throw new VerilogParseException("Parsing Error: '" + decl.name + "' is declared "
                        + decl.direction.name().toLowerCase() + " but is not a port of module " + module.name,
                        decl.line, 1);
            }
        }
        reserved.addAll(module.identifiers);
        for (VerilogModule.Statement s : module.statements) {
            if (s instanceof VerilogModule.ModuleInstance) {
                reserved.add(((VerilogModule.ModuleInstance) s).instance);
            }
        }
        for (VerilogModule.NetDecl decl : module.nets.values()) {
            reserved.addAll(decl.getBitNames());
        }
        for (VerilogModule.NetDecl decl : new ArrayList<>(module.nets.values())) {
            createNet(decl);
        }

        collectDrivers();

        for (VerilogModule.Statement s : module.statements) {
            if (s instanceof VerilogModule.Assign) {
                buildAssign((VerilogModule.Assign) s);
            } else if (s instanceof VerilogModule.GateInstance) {
                buildGate((VerilogModule.GateInstance) s);
            } else if (s instanceof VerilogModule.FlipFlop) {
                buildFlipFlop((VerilogModule.FlipFlop) s);
            } else {
                buildInstance((VerilogModule.ModuleInstance) s);
            }
        }

        for (String p : placeholders) {
            if (!circuit.contains(p) || circuit.getType(p) != GateType.BUF || !circuit.fanin(p).isEmpty()) {
                continue;
            }
            if (circuit.fanout(p).isEmpty() && !circuit.isOutput(p)) {
                circuit.remove(p);
            } else {
                MessageGenerator.warning("Net '" + p + "' in module " + module.name
                        + " has no driver, its value is unknown");
                circuit.setType(p, GateType.X);
            }
        }
        circuit.validate();
        return circuit;
    }

    //------------------------------------------------------------------------
    // Nets
    //------------------------------------------------------------------------

    private void createNet(VerilogModule.NetDecl decl) {
        for (String bit : decl.getBitNames()) {
            if (decl.direction == Direction.INPUT) {
                circuit.add(bit, GateType.INPUT);
            } else {
                circuit.addUnconnected(bit, GateType.BUF);
                placeholders.add(bit);
                if (decl.direction == Direction.OUTPUT) {
                    circuit.setOutput(bit, true);
                }
            }
        }
    }

    private VerilogModule.NetDecl getNet(String name, int line) {
        VerilogModule.NetDecl decl = module.nets.get(name);
        if (decl == null) {
            // Implicit scalar net
            decl = new VerilogModule.NetDecl(name, Direction.WIRE, false, 0, 0, line);
            module.nets.put(name, decl);
            reserved.add(name);
            createNet(decl);
        }
        return decl;
    }

    /**
     * Resolves a net reference to the names of its bits, least significant first.
     */
    private List<String> referenceBits(VerilogExpr ref) {
        VerilogModule.NetDecl decl = getNet(ref.name, ref.line);
        switch (ref.kind) {
            case IDENTIFIER:
                return decl.getBitNames();
            case BIT_SELECT:
                checkIndex(decl, ref.msb, ref);
                return Collections.singletonList(VerilogModule.bitName(ref.name, ref.msb));
            default: {
                checkIndex(decl, ref.msb, ref);
                checkIndex(decl, ref.lsb, ref);
                if ((ref.msb >= ref.lsb) != (decl.msb >= decl.lsb) && ref.msb != ref.lsb) {
                    throw new VerilogParseException("Parsing Error: Part-select " + ref
                            + " runs against the declared range of '" + ref.name + "'", ref.line, 1);
                }
                List<String> bits = new ArrayList<>();
                int step = ref.msb >= ref.lsb ? 1 : -1;
                for (int i = ref.lsb; ; i += step) {
                    bits.add(VerilogModule.bitName(ref.name, i));
                    if (i == ref.msb) break;
                }
                return bits;
            }
        }
    }

    private static void checkIndex(VerilogModule.NetDecl decl, int index, VerilogExpr ref) {
        if (!decl.vector) {
            throw new VerilogParseException("Parsing Error: Cannot select bits of scalar net '" + decl.name + "'",
                    ref.line, 1);
        }
        if (!decl.containsIndex(index)) {
            throw new VerilogParseException("Parsing Error: Index " + index + " is out of range for '"
                    + decl.name + "[" + decl.msb + ":" + decl.lsb + "]'", ref.line, 1);
        }
    }

    //------------------------------------------------------------------------
    // Drivers
    //------------------------------------------------------------------------

    private void collectDrivers() {
        List<VerilogModule.ModuleInstance> undefined = new ArrayList<>();
        for (VerilogModule.Statement s : module.statements) {
            if (s instanceof VerilogModule.Assign) {
                drive(referenceBits(((VerilogModule.Assign) s).lhs), s.line);
            } else if (s instanceof VerilogModule.FlipFlop) {
                drive(referenceBits(((VerilogModule.FlipFlop) s).q), s.line);
            } else if (s instanceof VerilogModule.GateInstance) {
                VerilogModule.GateInstance g = (VerilogModule.GateInstance) s;
                for (int i = 0; i < g.getOutputCount(); i++) {
                    drive(outputTerminal(g, g.terminals.get(i)), s.line);
                }
            }
        }
        for (VerilogModule.Statement s : module.statements) {
            if (!(s instanceof VerilogModule.ModuleInstance)) continue;
            VerilogModule.ModuleInstance mi = (VerilogModule.ModuleInstance) s;
            BlackBoxPorts def = definitions.get(mi.module);
            if (def == null) {
                undefined.add(mi);
                continue;
            }
            for (Map.Entry<String, VerilogExpr> e : connections(mi, def).entrySet()) {
                if (e.getValue() != null && def.def.isOutput(def.ports.get(e.getKey()).get(0))) {
                    drive(outputConnection(mi, e.getKey(), e.getValue()), s.line);
                }
            }
        }
        for (VerilogModule.ModuleInstance mi : undefined) {
            BlackBoxPorts def = inferDefinition(mi);
            for (Map.Entry<String, VerilogExpr> e : connections(mi, def).entrySet()) {
                if (e.getValue() != null && def.def.isOutput(def.ports.get(e.getKey()).get(0))) {
                    drive(outputConnection(mi, e.getKey(), e.getValue()), mi.line);
                }
            }
        }
    }

    private void drive(List<String> bits, int line) {
        for (String bit : bits) {
            if (circuit.getType(bit) == GateType.INPUT) {
                throw new UnsupportedConstructException("multi-driver net: input '" + bit + "' is driven", line);
            }
            Integer previous = drivers.put(bit, line);
            if (previous != null) {
                throw new UnsupportedConstructException("multi-driver net: '" + bit
                        + "' is also driven on line " + previous, line);
            }
        }
    }

    private boolean isDriven(List<String> bits) {
        for (String bit : bits) {
            if (drivers.containsKey(bit) || circuit.getType(bit) == GateType.INPUT) return true;
        }
        return false;
    }

    private List<String> outputTerminal(VerilogModule.GateInstance g, VerilogExpr terminal) {
        if (!terminal.isReference()) {
            throw new VerilogParseException("Parsing Error: Output of gate " + g.type.getVerilogPrimitive()
                    + " must be a net, encountered: " + terminal, terminal.line, 1);
        }
        List<String> bits = referenceBits(terminal);
        if (bits.size() != 1) {
            throw new UnsupportedConstructException("vector gate terminal " + terminal, terminal.line);
        }
        return bits;
    }

    private List<String> outputConnection(VerilogModule.ModuleInstance mi, String port, VerilogExpr expr) {
        if (!expr.isReference()) {
            throw new UnsupportedConstructException("expression on output port '" + port + "' of instance "
                    + mi.instance, mi.line);
        }
        return referenceBits(expr);
    }

    //------------------------------------------------------------------------
    // Blackbox definitions
    //------------------------------------------------------------------------

    /**
     * Maps port groups to connected expressions, resolving positional connections.
     */
    private Map<String, VerilogExpr> connections(VerilogModule.ModuleInstance mi, BlackBoxPorts def) {
        Map<String, VerilogExpr> result = new LinkedHashMap<>();
        if (mi.isNamed()) {
            for (Map.Entry<String, VerilogExpr> e : mi.named.entrySet()) {
                if (!def.ports.containsKey(e.getKey())) {
                    throw new VerilogParseException("Parsing Error: Module " + mi.module + " has no port '"
                            + e.getKey() + "' (instance " + mi.instance + ")", mi.line, 1);
                }
                result.put(e.getKey(), e.getValue());
            }
            return result;
        }
        List<String> groups = new ArrayList<>(def.ports.keySet());
        if (mi.positional.size() > groups.size()) {
            throw new VerilogParseException("Parsing Error: Instance " + mi.instance + " connects "
                    + mi.positional.size() + " ports, module " + mi.module + " has " + groups.size(), mi.line, 1);
        }
        for (int i = 0; i < mi.positional.size(); i++) {
            result.put(groups.get(i), mi.positional.get(i));
        }
        return result;
    }

    /**
     * Infers the ports of a module that has no definition from the way its
     * first instance is connected: a port connected to nets nothing else
     * drives is an output, any other port is an input.
     */
    private BlackBoxPorts inferDefinition(VerilogModule.ModuleInstance mi) {
        BlackBoxPorts def = inferred.get(mi.module);
        if (def != null) return def;
        MessageGenerator.warning("Module " + mi.module + " is not defined, inferring its ports from instance "
                + mi.instance);
        Map<String, VerilogExpr> conns = new LinkedHashMap<>();
        if (mi.isNamed()) {
            conns.putAll(mi.named);
        } else {
            for (int i = 0; i < mi.positional.size(); i++) {
                conns.put("p" + i, mi.positional.get(i));
            }
        }
        List<String> inputs = new ArrayList<>();
        List<String> outputs = new ArrayList<>();
        Map<String, List<String>> groups = new LinkedHashMap<>();
        for (Map.Entry<String, VerilogExpr> e : conns.entrySet()) {
            VerilogExpr expr = e.getValue();
            int width = expr == null ? 1 : width(expr);
            List<String> ports = new ArrayList<>();
            for (int i = 0; i < width; i++) {
                ports.add(width == 1 ? e.getKey() : VerilogModule.bitName(e.getKey(), i));
            }
            boolean output = expr != null && expr.isReference() && !isDriven(referenceBits(expr));
            (output ? outputs : inputs).addAll(ports);
            groups.put(e.getKey(), ports);
        }
        def = BlackBoxPorts.of(new BlackBox(mi.module, inputs, outputs, false), groups);
        inferred.put(mi.module, def);
        return def;
    }

    //------------------------------------------------------------------------
    // Statements
    //------------------------------------------------------------------------

    private void buildAssign(VerilogModule.Assign a) {
        List<String> targets = referenceBits(a.lhs);
        List<Bit> bits = blast(a.rhs, targets.size());
        for (int i = 0; i < targets.size(); i++) {
            buildInto(bits.get(i), targets.get(i));
        }
    }

    private void buildGate(VerilogModule.GateInstance g) {
        int outputs = g.getOutputCount();
        List<Bit> inputs = new ArrayList<>();
        for (int i = outputs; i < g.terminals.size(); i++) {
            VerilogExpr t = g.terminals.get(i);
            if (width(t) != 1 && !(t.kind == VerilogExpr.Kind.CONSTANT && !t.sized)) {
                throw new UnsupportedConstructException("vector gate terminal " + t, t.line);
            }
            inputs.add(blast(t, 1).get(0));
        }
        for (int i = 0; i < outputs; i++) {
            String target = outputTerminal(g, g.terminals.get(i)).get(0);
            buildInto(Bit.gate(g.type, inputs), target);
        }
    }

    private void buildFlipFlop(VerilogModule.FlipFlop ff) {
        List<String> clock = referenceBits(ff.clock);
        if (clock.size() != 1) {
            throw new UnsupportedConstructException("vector clock " + ff.clock, ff.line);
        }
        List<String> q = referenceBits(ff.q);
        if (q.size() != 1) {
            throw new UnsupportedConstructException("vector flip-flop " + ff.q, ff.line);
        }
        String bit = q.get(0);
        Bit d = blast(ff.d, 1).get(0);
        String instance = uid(sanitize(bit) + "_reg");
        reserved.add(instance);
        Map<String, String> conns = new LinkedHashMap<>();
        conns.put("D", build(d, sanitize(bit) + "_d"));
        conns.put("CK", clock.get(0));
        conns.put("Q", bit);
        circuit.addBlackBox(BlackBox.DFF, instance, conns);
    }

    private void buildInstance(VerilogModule.ModuleInstance mi) {
        BlackBoxPorts def = definitions.get(mi.module);
        if (def == null) def = inferred.get(mi.module);
        Map<String, String> conns = new LinkedHashMap<>();
        for (Map.Entry<String, VerilogExpr> e : connections(mi, def).entrySet()) {
            if (e.getValue() == null) continue;
            List<String> ports = def.ports.get(e.getKey());
            if (def.def.isOutput(ports.get(0))) {
                List<String> bits = outputConnection(mi, e.getKey(), e.getValue());
                checkPortWidth(mi, e.getKey(), ports.size(), bits.size());
                for (int i = 0; i < ports.size(); i++) {
                    conns.put(ports.get(i), bits.get(i));
                }
            } else {
                VerilogExpr expr = e.getValue();
                if (!(expr.kind == VerilogExpr.Kind.CONSTANT && !expr.sized)) {
                    checkPortWidth(mi, e.getKey(), ports.size(), width(expr));
                }
                List<Bit> bits = blast(expr, ports.size());
                for (int i = 0; i < ports.size(); i++) {
                    conns.put(ports.get(i), build(bits.get(i), sanitize(mi.instance + "_" + ports.get(i))));
                }
            }
        }
        circuit.addBlackBox(def.def, mi.instance, conns);
    }

    private static void checkPortWidth(VerilogModule.ModuleInstance mi, String port, int expected, int actual) {
        if (expected != actual) {
            throw new UnsupportedConstructException("width mismatch on port '" + port + "' of instance "
                    + mi.instance + ": " + actual + " bits connected to " + expected, mi.line);
        }
    }

    //------------------------------------------------------------------------
    // Expressions
    //------------------------------------------------------------------------

    /**
     * Gets the self-determined width of an expression.
     */
    private int width(VerilogExpr e) {
        switch (e.kind) {
            case IDENTIFIER:
            case BIT_SELECT:
            case PART_SELECT:
                return referenceBits(e).size();
            case CONSTANT:
                return e.bits.length();
            case NOT:
                return width(e.operands.get(0));
            case REDUCTION:
                return 1;
            case TERNARY:
                return Math.max(width(e.operands.get(1)), width(e.operands.get(2)));
            case CONCAT: {
                int w = 0;
                for (VerilogExpr p : e.operands) w += width(p);
                return w;
            }
            default:
                return Math.max(width(e.operands.get(0)), width(e.operands.get(1)));
        }
    }

    /**
     * Splits an expression into one {@link Bit} per result bit.
     * @param width The width the context requires.
     * @return width bits, least significant first.
     */
    private List<Bit> blast(VerilogExpr e, int width) {
        switch (e.kind) {
            case CONSTANT: {
                if (e.sized && e.bits.length() > width) {
                    throw widthMismatch(e, width);
                }
                List<Bit> bits = new ArrayList<>();
                String value = e.sized ? e.bits + repeat('0', width - e.bits.length()) : VerilogExpr.resize(e.bits,
                        width);
                for (char c : value.toCharArray()) bits.add(Bit.constant(c));
                return bits;
            }
            case IDENTIFIER:
            case BIT_SELECT:
            case PART_SELECT: {
                List<String> names = referenceBits(e);
                if (names.size() != width) throw widthMismatch(e, width);
                List<Bit> bits = new ArrayList<>();
                for (String n : names) bits.add(Bit.ref(n));
                return bits;
            }
            case NOT: {
                List<Bit> bits = new ArrayList<>();
                for (Bit b : blast(e.operands.get(0), width)) bits.add(not(b));
                return bits;
            }
            case BINARY: {
                List<Bit> left = blast(e.operands.get(0), width);
                List<Bit> right = blast(e.operands.get(1), width);
                List<Bit> bits = new ArrayList<>();
                for (int i = 0; i < width; i++) bits.add(binary(e.op, left.get(i), right.get(i)));
                return bits;
            }
            case REDUCTION: {
                if (width != 1) throw widthMismatch(e, width);
                VerilogExpr operand = e.operands.get(0);
                List<Bit> bits = blast(operand, width(operand));
                if (bits.size() == 1) {
                    return Collections.singletonList(e.op.isInverting() ? not(bits.get(0)) : bits.get(0));
                }
                return Collections.singletonList(Bit.gate(e.op, bits));
            }
            case TERNARY: {
                VerilogExpr cond = e.operands.get(0);
                List<Bit> condBits = blast(cond, width(cond));
                Bit s = condBits.size() == 1 ? condBits.get(0) : Bit.gate(GateType.OR, condBits);
                List<Bit> ifTrue = blast(e.operands.get(1), width);
                List<Bit> ifFalse = blast(e.operands.get(2), width);
                Bit notS = not(s);
                List<Bit> bits = new ArrayList<>();
                for (int i = 0; i < width; i++) {
                    bits.add(Bit.gate(GateType.OR, Arrays.asList(
                            Bit.gate(GateType.AND, Arrays.asList(s, ifTrue.get(i))),
                            Bit.gate(GateType.AND, Arrays.asList(notS, ifFalse.get(i))))));
                }
                return bits;
            }
            default: {
                // Concatenation, parts are written most significant first
                List<Bit> bits = new ArrayList<>();
                for (int i = e.operands.size() - 1; i >= 0; i--) {
                    VerilogExpr part = e.operands.get(i);
                    bits.addAll(blast(part, width(part)));
                }
                if (bits.size() != width) throw widthMismatch(e, width);
                return bits;
            }
        }
    }

    private UnsupportedConstructException widthMismatch(VerilogExpr e, int width) {
        return new UnsupportedConstructException("width mismatch: " + e + " is " + width(e)
                + " bits wide where " + width + " are needed", e.line);
    }

    private static String repeat(char c, int count) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) sb.append(c);
        return sb.toString();
    }

    private static Bit not(Bit b) {
        if (b.isConstant()) {
            return Bit.constant(b.constant == '0' ? '1' : b.constant == '1' ? '0' : 'x');
        }
        if (b.isGate()) {
            if (b.type == GateType.NOT) return b.operands.get(0);
            if (b.type.getComplement() != null) return Bit.gate(b.type.getComplement(), b.operands);
        }
        return Bit.gate(GateType.NOT, Collections.singletonList(b));
    }

    private static Bit binary(GateType op, Bit left, Bit right) {
        List<Bit> operands = new ArrayList<>();
        for (Bit b : Arrays.asList(left, right)) {
            boolean associative = op == GateType.AND || op == GateType.OR || op == GateType.XOR;
            if (associative && b.isGate() && b.type == op) {
                operands.addAll(b.operands);
            } else {
                operands.add(b);
            }
        }
        return Bit.gate(op, operands);
    }

    //------------------------------------------------------------------------
    // Node construction
    //------------------------------------------------------------------------

    /**
     * Makes the placeholder of a net bit compute the given bit.
     */
    private void buildInto(Bit b, String target) {
        if (b.isConstant()) {
            circuit.setType(target, constantType(b.constant));
            return;
        }
        if (!b.isGate() || built.containsKey(b)) {
            circuit.connect(b.isGate() ? built.get(b) : b.node, target);
            return;
        }
        List<String> operands = buildOperands(b, sanitize(target));
        if (b.type == GateType.BUF) {
            circuit.connect(operands.get(0), target);
        } else {
            circuit.setType(target, b.type);
            for (String o : operands) circuit.connect(o, target);
        }
        built.put(b, target);
    }

    /**
     * Gets the node computing a bit, building new nodes where needed.
     * @param base Name stem for new nodes.
     */
    private String build(Bit b, String base) {
        if (b.isConstant()) {
            return tie(b.constant);
        }
        if (!b.isGate()) {
            return b.node;
        }
        String existing = built.get(b);
        if (existing != null) return existing;
        List<String> operands = buildOperands(b, base);
        String name = uid(base + "_" + b.type.getShortName());
        circuit.addUnconnected(name, b.type);
        for (String o : operands) circuit.connect(o, name);
        built.put(b, name);
        return name;
    }

    private List<String> buildOperands(Bit b, String base) {
        List<String> operands = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Bit o : b.operands) {
            String n = build(o, base);
            if (!seen.add(n)) {
                // A node drives a gate at most once, repeated operands go through a buf
                String copy = uid(base + "_buf");
                circuit.add(copy, GateType.BUF, n);
                n = copy;
            }
            operands.add(n);
        }
        return operands;
    }

    private String tie(char c) {
        return ties.computeIfAbsent(c, k -> {
            String name = uid(c == '0' ? TIE0 : c == '1' ? TIE1 : TIEX);
            circuit.add(name, constantType(c));
            return name;
        });
    }

    private static GateType constantType(char c) {
        return c == '0' ? GateType.CONST0 : c == '1' ? GateType.CONST1 : GateType.X;
    }

    /**
     * Gets a node name starting with base that is neither used nor reserved.
     */
    private String uid(String base) {
        String name = base;
        int i = 0;
        while (reserved.contains(name) || circuit.contains(name) || circuit.getBlackBox(name) != null) {
            name = base + "_" + i++;
        }
        return name;
    }

    private static String sanitize(String name) {
        StringBuilder sb = new StringBuilder();
        for (char c : name.toCharArray()) {
            sb.append(Character.isLetterOrDigit(c) || c == '_' ? c : '_');
        }
        while (sb.length() > 1 && sb.charAt(sb.length() - 1) == '_') {
            sb.setLength(sb.length() - 1);
        }
        if (sb.length() == 0 || Character.isDigit(sb.charAt(0))) sb.insert(0, 'n');
        return sb.toString();
    }
}
