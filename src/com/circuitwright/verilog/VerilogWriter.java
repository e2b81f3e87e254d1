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

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.circuitwright.circuit.BlackBox;
import com.circuitwright.circuit.Circuit;
import com.circuitwright.circuit.CircuitNode;
import com.circuitwright.circuit.GateType;
import com.circuitwright.util.MessageGenerator;

/**
 * Writes a {@link Circuit} as a structural Verilog module with one continuous
 * assignment per gate and one named-port instance per blackbox, followed by an
 * empty module for each blackbox definition used. Nodes named {@code base[i]}
 * whose bits form a contiguous range of the same kind are declared as a
 * vector; other names that are not simple identifiers are written as escaped
 * identifiers. Reading the text back yields a circuit with the same node names
 * and connections.
 */
public class VerilogWriter {

    public static final String INDENT = "    ";

    /** State register of the stub module of a sequential blackbox */
    public static final String STATE_REG = "cw_state";

    private static final Pattern SIMPLE_ID = Pattern.compile("[A-Za-z_][A-Za-z0-9_$]*");

    private static final Pattern BIT_NAME = Pattern.compile("([A-Za-z_][A-Za-z0-9_$]*)\\[(\\d+)\\]");

    private static final Set<String> KEYWORDS = new HashSet<>(Arrays.asList(
            "always", "and", "assign", "automatic", "begin", "buf", "bufif0", "bufif1", "case", "casex", "casez",
            "cell", "cmos", "config", "deassign", "default", "defparam", "design", "disable", "edge", "else",
            "end", "endcase", "endconfig", "endfunction", "endgenerate", "endmodule", "endprimitive",
            "endspecify", "endtable", "endtask", "event", "for", "force", "forever", "fork", "function",
            "generate", "genvar", "highz0", "highz1", "if", "ifnone", "incdir", "include", "initial", "inout",
            "input", "instance", "integer", "join", "large", "liblist", "library", "localparam", "logic",
            "macromodule", "medium", "module", "nand", "negedge", "nmos", "nor", "noshowcancelled", "not",
            "notif0", "notif1", "or", "output", "parameter", "pmos", "posedge", "primitive", "pull0", "pull1",
            "pulldown", "pullup", "pulsestyle_onevent", "pulsestyle_ondetect", "rcmos", "real", "realtime",
            "reg", "release", "repeat", "rnmos", "rpmos", "rtran", "rtranif0", "rtranif1", "scalared",
            "showcancelled", "signed", "small", "specify", "specparam", "strong0", "strong1", "supply0",
            "supply1", "table", "task", "time", "tran", "tranif0", "tranif1", "tri", "tri0", "tri1", "triand",
            "trior", "trireg", "unsigned", "use", "uwire", "vectored", "wait", "wand", "weak0", "weak1",
            "while", "wire", "wor", "xnor", "xor"));

    private enum Role {
        INPUT,
        OUTPUT,
        WIRE
    }

    /** A declared net: a scalar node or a vector of nodes named base[i] */
    private static class Net {
        final String name;
        final Role role;
        final int msb;
        final int lsb;
        final boolean vector;

        Net(String name, Role role, boolean vector, int msb, int lsb) {
            this.name = name;
            this.role = role;
            this.vector = vector;
            this.msb = msb;
            this.lsb = lsb;
        }
    }

    private final Circuit circuit;

    private boolean writeBlackBoxModules = true;

    /** Nodes written as a bit of a vector, by node name */
    private final Map<String, String> vectorBits = new HashMap<>();

    private final List<Net> nets = new ArrayList<>();

    /** Extra output ports for inputs that are also outputs, by input name */
    private final Map<String, String> feedthroughs = new LinkedHashMap<>();

    public VerilogWriter(Circuit circuit) {
        this.circuit = circuit;
    }

    /**
     * Sets whether an empty module is written for each blackbox definition the
     * circuit uses (the default).
     */
    public VerilogWriter setWriteBlackBoxModules(boolean writeBlackBoxModules) {
        this.writeBlackBoxModules = writeBlackBoxModules;
        return this;
    }

    /**
     * Writes the circuit.
     * @throws com.circuitwright.circuit.StructuralException if the circuit is not
     *         complete, see {@link Circuit#validate()}.
     */
    public void write(Writer out) throws IOException {
        circuit.validate();
        collectNets();
        String moduleName = circuit.getName() == null || circuit.getName().isEmpty() ? "circuit"
                : circuit.getName();

        List<String> ports = new ArrayList<>();
        for (Net n : nets) {
            if (n.role != Role.WIRE) ports.add(escape(n.name));
        }
        ports.addAll(feedthroughs.values());
        out.write("module " + escape(moduleName) + "(" + String.join(", ", ports) + ");\n");
        for (Role role : Arrays.asList(Role.INPUT, Role.OUTPUT, Role.WIRE)) {
            for (Net n : nets) {
                if (n.role != role) continue;
                out.write(INDENT + role.name().toLowerCase() + " ");
                if (n.vector) out.write("[" + n.msb + ":" + n.lsb + "] ");
                out.write(escape(n.name) + ";\n");
            }
            if (role == Role.OUTPUT) {
                for (String f : feedthroughs.values()) {
                    out.write(INDENT + "output " + f + ";\n");
                }
            }
        }
        out.write("\n");

        for (CircuitNode n : circuit.getNodes()) {
            String rhs = getAssignment(n);
            if (rhs != null) {
                out.write(INDENT + "assign " + ref(n.getName()) + " = " + rhs + ";\n");
            }
        }
        for (Map.Entry<String, String> e : feedthroughs.entrySet()) {
            out.write(INDENT + "assign " + e.getValue() + " = " + ref(e.getKey()) + ";\n");
        }

        Map<String, BlackBox> definitions = new LinkedHashMap<>();
        for (Map.Entry<String, BlackBox> e : circuit.getBlackBoxes().entrySet()) {
            BlackBox def = e.getValue();
            BlackBox previous = definitions.putIfAbsent(def.getName(), def);
            if (previous != null && !previous.equals(def)) {
                throw new IllegalStateException("Blackbox definition " + def.getName()
                        + " is used with different ports");
            }
            writeInstance(out, e.getKey(), def);
        }
        out.write("endmodule\n");

        if (writeBlackBoxModules) {
            for (BlackBox def : definitions.values()) {
                writeBlackBoxModule(out, def);
            }
        }
        out.flush();
    }

    /**
     * Gets the Verilog text of the circuit.
     */
    public String toVerilog() {
        StringWriter sw = new StringWriter();
        try {
            write(sw);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return sw.toString();
    }

    //------------------------------------------------------------------------
    // Declarations
    //------------------------------------------------------------------------

    private Role getRole(CircuitNode n) {
        if (n.getType() == GateType.INPUT) return Role.INPUT;
        return n.isOutput() ? Role.OUTPUT : Role.WIRE;
    }

    private void collectNets() {
        nets.clear();
        vectorBits.clear();
        feedthroughs.clear();
        Map<String, TreeMap<Integer, CircuitNode>> buses = new LinkedHashMap<>();
        for (CircuitNode n : circuit.getNodes()) {
            if (n.getType().isBlackBoxPin()) continue;
            Matcher m = BIT_NAME.matcher(n.getName());
            if (m.matches() && !KEYWORDS.contains(m.group(1))) {
                buses.computeIfAbsent(m.group(1), k -> new TreeMap<>()).put(Integer.parseInt(m.group(2)), n);
            }
        }
        Set<String> vectorBases = new HashSet<>();
        for (Map.Entry<String, TreeMap<Integer, CircuitNode>> e : buses.entrySet()) {
            TreeMap<Integer, CircuitNode> bits = e.getValue();
            if (circuit.contains(e.getKey()) || bits.lastKey() - bits.firstKey() + 1 != bits.size()) continue;
            Role role = getRole(bits.firstEntry().getValue());
            boolean uniform = true;
            for (CircuitNode n : bits.values()) {
                uniform &= getRole(n) == role && !isFeedthrough(n);
            }
            if (!uniform) continue;
            vectorBases.add(e.getKey());
            for (CircuitNode n : bits.values()) {
                vectorBits.put(n.getName(), e.getKey());
            }
        }
        Set<String> declared = new HashSet<>();
        Set<String> names = circuit.getNodeNames();
        for (CircuitNode n : circuit.getNodes()) {
            if (n.getType().isBlackBoxPin()) continue;
            String base = vectorBits.get(n.getName());
            if (base == null) {
                nets.add(new Net(n.getName(), getRole(n), false, 0, 0));
            } else if (declared.add(base)) {
                TreeMap<Integer, CircuitNode> bits = buses.get(base);
                nets.add(new Net(base, getRole(n), true, bits.lastKey(), bits.firstKey()));
            }
            if (isFeedthrough(n)) {
                String port = n.getName() + "_out";
                for (int i = 0; names.contains(port) || vectorBases.contains(port)
                        || feedthroughs.containsValue(escape(port)); i++) {
                    port = n.getName() + "_out_" + i;
                }
                MessageGenerator.warning("Input '" + n.getName() + "' is also an output, written as output port "
                        + port);
                feedthroughs.put(n.getName(), escape(port));
            }
        }
    }

    private static boolean isFeedthrough(CircuitNode n) {
        return n.getType() == GateType.INPUT && n.isOutput();
    }

    //------------------------------------------------------------------------
    // Statements
    //------------------------------------------------------------------------

    /**
     * Gets the right-hand side computing a node, or null if the node is not
     * driven by an assignment.
     */
    private String getAssignment(CircuitNode n) {
        List<String> in = new ArrayList<>();
        for (CircuitNode d : n.getFanin()) {
            if (d.getType() == GateType.BB_OUTPUT) return null;
            in.add(ref(d.getName()));
        }
        switch (n.getType()) {
            case AND: return String.join(" & ", in);
            case OR: return String.join(" | ", in);
            case XOR: return String.join(" ^ ", in);
            case NAND: return "~(" + String.join(" & ", in) + ")";
            case NOR: return "~(" + String.join(" | ", in) + ")";
            case XNOR: return "~(" + String.join(" ^ ", in) + ")";
            case NOT: return "~" + in.get(0);
            case BUF: return in.get(0);
            case CONST0: return "1'b0";
            case CONST1: return "1'b1";
            case X: return "1'bx";
            default: return null;
        }
    }

    private void writeInstance(Writer out, String instance, BlackBox def) throws IOException {
        List<String> conns = new ArrayList<>();
        for (Map.Entry<String, List<String>> e : BlackBoxPorts.of(def).ports.entrySet()) {
            List<String> bits = new ArrayList<>();
            boolean connected = false;
            for (String port : e.getValue()) {
                CircuitNode pin = circuit.getNode(BlackBox.getPinName(instance, port));
                String net = getPinNet(pin);
                connected |= net != null;
                bits.add(net);
            }
            if (!connected) {
                conns.add("." + escape(e.getKey()) + "()");
                continue;
            }
            List<String> msbFirst = new ArrayList<>();
            for (int i = bits.size() - 1; i >= 0; i--) {
                if (bits.get(i) != null) {
                    msbFirst.add(bits.get(i));
                } else if (def.isInput(e.getValue().get(i))) {
                    msbFirst.add("1'bx");
                } else {
                    throw new IllegalStateException("Output bits of port " + e.getKey() + " of instance "
                            + instance + " are partially connected and cannot be written");
                }
            }
            String expr = msbFirst.size() == 1 ? msbFirst.get(0) : "{" + String.join(", ", msbFirst) + "}";
            conns.add("." + escape(e.getKey()) + "(" + expr + ")");
        }
        out.write(INDENT + escape(def.getName()) + " " + escape(instance) + "(");
        out.write(String.join(", ", conns));
        out.write(");\n");
    }

    /**
     * Gets the net a blackbox pin is connected to: the driver of an input pin
     * or the buffer an output pin drives.
     */
    private String getPinNet(CircuitNode pin) {
        if (pin.getType() == GateType.BB_INPUT) {
            return pin.getFanin().isEmpty() ? null : ref(pin.getFanin().iterator().next().getName());
        }
        return pin.getFanout().isEmpty() ? null : ref(pin.getFanout().iterator().next().getName());
    }

    private void writeBlackBoxModule(Writer out, BlackBox def) throws IOException {
        Map<String, List<String>> groups = BlackBoxPorts.of(def).ports;
        List<String> ports = new ArrayList<>();
        for (String g : groups.keySet()) ports.add(escape(g));
        out.write("\nmodule " + escape(def.getName()) + "(" + String.join(", ", ports) + ");\n");
        for (Map.Entry<String, List<String>> e : groups.entrySet()) {
            List<String> bits = e.getValue();
            out.write(INDENT + (def.isInput(bits.get(0)) ? "input " : "output "));
            if (!bits.get(0).equals(e.getKey())) {
                Matcher lsb = Pattern.compile(".*\\[(-?\\d+)\\]").matcher(bits.get(0));
                Matcher msb = Pattern.compile(".*\\[(-?\\d+)\\]").matcher(bits.get(bits.size() - 1));
                if (lsb.matches() && msb.matches()) {
                    out.write("[" + msb.group(1) + ":" + lsb.group(1) + "] ");
                }
            }
            out.write(escape(e.getKey()) + ";\n");
        }
        if (def.isSequential()) {
            writeStateFlipFlop(out, groups, def);
        }
        out.write("endmodule\n");
    }

    /**
     * Gives the stub of a sequential definition a flip-flop clocked by its
     * first input, so that the parser classifies the module as sequential.
     * Definitions without inputs cannot close a combinational cycle and get
     * none.
     */
    private void writeStateFlipFlop(Writer out, Map<String, List<String>> groups, BlackBox def)
            throws IOException {
        String clock = null;
        for (Map.Entry<String, List<String>> e : groups.entrySet()) {
            String bit = e.getValue().get(0);
            if (def.isInput(bit)) {
                clock = escape(e.getKey()) + bit.substring(e.getKey().length());
                break;
            }
        }
        if (clock == null) return;
        String state = STATE_REG;
        while (groups.containsKey(state)) {
            state = state + "_";
        }
        out.write(INDENT + "reg " + state + ";\n");
        out.write(INDENT + "always @(posedge " + clock + ") " + state + " <= " + clock + ";\n");
    }

    //------------------------------------------------------------------------
    // Names
    //------------------------------------------------------------------------

    /**
     * Gets the expression referring to a node.
     */
    private String ref(String node) {
        String base = vectorBits.get(node);
        if (base != null) {
            return escape(base) + node.substring(base.length());
        }
        return escape(node);
    }

    /**
     * Writes a name as is if it is a simple identifier, otherwise as an escaped
     * identifier.
     */
    public static String escape(String name) {
        if (SIMPLE_ID.matcher(name).matches() && !KEYWORDS.contains(name)) {
            return name;
        }
        return "\\" + name + " ";
    }
}
