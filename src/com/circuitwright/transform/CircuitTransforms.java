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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.circuitwright.circuit.BlackBox;
import com.circuitwright.circuit.Circuit;
import com.circuitwright.circuit.CircuitNode;
import com.circuitwright.circuit.CircuitTools;
import com.circuitwright.circuit.GateType;
import com.circuitwright.circuit.StructuralException;

/**
 * Circuit-to-circuit transforms. Every transform leaves its input untouched
 * and returns a new circuit. Copies of the input are named with a fixed
 * prefix ({@code orig_}, {@code inv_<startpoint>_}, {@code c0_}, {@code c1_})
 * while shared startpoints keep their original names, so assumptions written
 * against the input circuit's startpoints apply to the result unchanged.
 */
public class CircuitTransforms {

    /** Output of {@link #miter} and {@link #influenceTransform} */
    public static final String SAT = "sat";

    /** Output of {@link #sensitizationTransform} */
    public static final String SENSITIZE = "sensitize";

    /** Prefix of the sensitivity count bus, bit 0 least significant */
    public static final String SEN_OUT = "sen_out_";

    private static final Map<GateType, GateType> LIMIT_FANIN_TYPES = new EnumMap<>(GateType.class);

    static {
        LIMIT_FANIN_TYPES.put(GateType.AND, GateType.AND);
        LIMIT_FANIN_TYPES.put(GateType.NAND, GateType.AND);
        LIMIT_FANIN_TYPES.put(GateType.OR, GateType.OR);
        LIMIT_FANIN_TYPES.put(GateType.NOR, GateType.OR);
        LIMIT_FANIN_TYPES.put(GateType.XOR, GateType.XOR);
        // Parity is associative, the inversion stays on the original node
        LIMIT_FANIN_TYPES.put(GateType.XNOR, GateType.XOR);
    }

    //------------------------------------------------------------------------
    // Structural transforms
    //------------------------------------------------------------------------

    /**
     * Copies a set of nodes and the edges between them.
     * @param c The source circuit.
     * @param nodes Names of the nodes to keep.
     * @param modifyIo If true, copied nodes left without drivers (other than
     *                 constants and unknowns) become inputs, and copied nodes
     *                 left without loads become outputs.
     * @return The subcircuit. Nodes keep their output flags.
     * @throws StructuralException if a node does not exist or is a blackbox pin.
     */
    public static Circuit subcircuit(Circuit c, Collection<String> nodes, boolean modifyIo) {
        Set<String> keep = new LinkedHashSet<>(nodes);
        Circuit sc = new Circuit(c.getName());
        for (CircuitNode n : c.getNodes()) {
            if (!keep.contains(n.getName())) continue;
            if (n.getType().isBlackBoxPin()) {
                throw new StructuralException("Cannot create a subcircuit containing blackbox pin '"
                        + n.getName() + "'");
            }
            sc.addUnconnected(n.getName(), n.getType(), n.isOutput());
        }
        for (String n : keep) {
            if (!sc.contains(n)) {
                throw new StructuralException("Node '" + n + "' does not exist in circuit '" + c.getName() + "'");
            }
        }
        for (CircuitNode n : c.getNodes()) {
            if (!keep.contains(n.getName())) continue;
            for (CircuitNode l : n.getFanout()) {
                if (keep.contains(l.getName())) {
                    sc.connect(n.getName(), l.getName());
                }
            }
        }
        if (modifyIo) {
            for (CircuitNode n : new ArrayList<>(sc.getNodes())) {
                GateType t = n.getType();
                if (!t.isConstant() && t != GateType.X && t != GateType.INPUT && n.getFanin().isEmpty()) {
                    sc.setType(n.getName(), GateType.INPUT);
                }
                if (n.getFanout().isEmpty()) {
                    sc.setOutput(n.getName(), true);
                }
            }
        }
        return sc;
    }

    public static Circuit subcircuit(Circuit c, Collection<String> nodes) {
        return subcircuit(c, nodes, false);
    }

    /**
     * Copies the fanin cone of a node, the node included.
     */
    public static Circuit cone(Circuit c, String n) {
        Set<String> nodes = new LinkedHashSet<>(c.transitiveFanin(n));
        nodes.add(n);
        return subcircuit(c, nodes, false);
    }

    /**
     * Copies a circuit with its inputs turned into buffers and its outputs
     * unmarked, ready to be driven as part of a larger circuit.
     */
    public static Circuit stripIo(Circuit c) {
        Circuit s = c.copy();
        for (String i : s.inputs()) {
            s.setType(i, GateType.BUF);
        }
        for (String o : s.outputs()) {
            s.setOutput(o, false);
        }
        return s;
    }

    /**
     * Copies a circuit with every blackbox instance replaced by free values.
     * Each connected output pin becomes an input of the same name, each
     * driven input pin becomes an output buffer of the same name. Input pins
     * nothing drives are dropped.
     */
    public static Circuit stripBlackBoxes(Circuit c) {
        Circuit s = c.copy();
        for (String instance : new ArrayList<>(s.getBlackBoxes().keySet())) {
            BlackBox def = s.getBlackBox(instance);
            Map<String, String> drivers = new HashMap<>();
            Map<String, String> loads = new HashMap<>();
            for (String port : def.getInputs()) {
                Set<String> fi = s.fanin(BlackBox.getPinName(instance, port));
                if (!fi.isEmpty()) drivers.put(port, fi.iterator().next());
            }
            for (String port : def.getOutputs()) {
                Set<String> fo = s.fanout(BlackBox.getPinName(instance, port));
                if (!fo.isEmpty()) loads.put(port, fo.iterator().next());
            }
            s.removeBlackBox(instance);
            for (String port : def.getOutputs()) {
                String pin = BlackBox.getPinName(instance, port);
                s.add(pin, GateType.INPUT);
                if (loads.containsKey(port)) {
                    s.connect(pin, loads.get(port));
                }
            }
            for (String port : def.getInputs()) {
                if (!drivers.containsKey(port)) continue;
                s.add(BlackBox.getPinName(instance, port), GateType.BUF,
                        Collections.singletonList(drivers.get(port)), Collections.emptyList(), true);
            }
        }
        return s;
    }

    private static Circuit withoutBlackBoxes(Circuit c) {
        return c.getBlackBoxes().isEmpty() ? c : stripBlackBoxes(c);
    }

    /**
     * Copies a circuit with every gate of more than k drivers split into a
     * tree of gates of at most k drivers computing the same function.
     * @throws IllegalArgumentException if k is less than 2.
     */
    public static Circuit limitFanin(Circuit c, int k) {
        if (k < 2) {
            throw new IllegalArgumentException("Fanin limit must be at least 2, not " + k);
        }
        Circuit ck = c.copy();
        for (String n : c.getNodeNames()) {
            int i = 0;
            while (ck.fanin(n).size() > k) {
                List<String> fi = new ArrayList<>(ck.fanin(n));
                String f0 = fi.get(0);
                String f1 = fi.get(1);
                ck.disconnect(f0, n);
                ck.disconnect(f1, n);
                String split = ck.uniqueName(n + "_limit_fanin_" + i);
                ck.add(split, LIMIT_FANIN_TYPES.get(ck.getType(n)), f0, f1);
                ck.connect(split, n);
                i++;
            }
        }
        return ck;
    }

    //------------------------------------------------------------------------
    // Miters
    //------------------------------------------------------------------------

    /**
     * Miters a circuit with itself.
     * @see #miter(Circuit, Circuit, Collection, Collection)
     */
    public static Circuit miter(Circuit c0) {
        return miter(c0, null, null, null);
    }

    public static Circuit miter(Circuit c0, Circuit c1) {
        return miter(c0, c1, null, null);
    }

    /**
     * Builds a circuit whose output {@code sat} is true exactly when the two
     * circuits disagree on some compared endpoint while their tied startpoints
     * are equal. The copies are prefixed {@code c0_} and {@code c1_}; tied
     * startpoints keep their names; startpoints that are not tied stay free
     * inputs of their copy. Endpoint {@code e} is compared by {@code dif_<e>}.
     * @param c0 First circuit.
     * @param c1 Second circuit, or null to miter c0 with itself.
     * @param startpoints Inputs of both circuits to tie, or null for all
     *                    common inputs.
     * @param endpoints Nodes of both circuits to compare, or null for all
     *                  common outputs.
     * @throws StructuralException if either circuit has blackboxes, a tied
     *         node is not an input of both circuits, a compared node is
     *         missing, or there is nothing to compare.
     */
    public static Circuit miter(Circuit c0, Circuit c1, Collection<String> startpoints,
            Collection<String> endpoints) {
        if (c1 == null) c1 = c0;
        for (Circuit c : new Circuit[] {c0, c1}) {
            if (!c.getBlackBoxes().isEmpty()) {
                throw new StructuralException("Cannot miter circuit '" + c.getName() + "', it contains blackboxes");
            }
        }
        Set<String> sp = new LinkedHashSet<>();
        if (startpoints == null) {
            sp.addAll(c0.startpoints());
            sp.retainAll(c1.startpoints());
        } else {
            sp.addAll(startpoints);
        }
        Set<String> ep = new LinkedHashSet<>();
        if (endpoints == null) {
            ep.addAll(c0.endpoints());
            ep.retainAll(c1.endpoints());
        } else {
            ep.addAll(endpoints);
        }
        if (ep.isEmpty()) {
            throw new StructuralException("Circuits '" + c0.getName() + "' and '" + c1.getName()
                    + "' have no endpoints to compare");
        }
        for (String s : sp) {
            if (!c0.contains(s) || c0.getType(s) != GateType.INPUT
                    || !c1.contains(s) || c1.getType(s) != GateType.INPUT) {
                throw new StructuralException("Cannot tie '" + s + "', it is not an input of both circuits");
            }
        }
        for (String e : ep) {
            if (!c0.contains(e) || !c1.contains(e)) {
                throw new StructuralException("Cannot compare '" + e + "', it is not in both circuits");
            }
        }

        Circuit m = new Circuit("miter_" + c0.getName() + "_" + c1.getName());
        m.addSubcircuit(c0, "c0");
        m.addSubcircuit(c1, "c1");
        for (String s : sp) {
            m.add(s, GateType.INPUT, Collections.emptyList(), Arrays.asList("c0_" + s, "c1_" + s), false);
        }
        // Untied inputs remain free
        for (String i : c0.inputs()) {
            if (!sp.contains(i)) m.setType("c0_" + i, GateType.INPUT);
        }
        for (String i : c1.inputs()) {
            if (!sp.contains(i)) m.setType("c1_" + i, GateType.INPUT);
        }

        m.addUnconnected(SAT, ep.size() > 1 ? GateType.OR : GateType.BUF, true);
        for (String e : ep) {
            m.add("dif_" + e, GateType.XOR, Arrays.asList("c0_" + e, "c1_" + e), Arrays.asList(SAT), false);
        }
        return m;
    }

    //------------------------------------------------------------------------
    // Analysis transforms
    //------------------------------------------------------------------------

    /**
     * Builds a circuit that counts, for an assignment of the startpoints of
     * n, how many single startpoint flips change n. The cone of n is copied
     * once as {@code orig_} and once per startpoint s as {@code inv_<s>_} with
     * s inverted; {@code dif_out_<s>} compares each flipped copy with the
     * original and a population count drives the output bus
     * {@code sen_out_0 ... sen_out_<w-1>}, where w is clog2(|startpoints| + 1).
     * Blackboxes are stripped first.
     * @throws StructuralException if n has no startpoints.
     */
    public static Circuit sensitivityTransform(Circuit c, String n) {
        c = withoutBlackBoxes(c);
        List<String> sp = new ArrayList<>(c.startpoints(n));
        if (sp.isEmpty()) {
            throw new StructuralException("Node '" + n + "' has no startpoints");
        }
        Circuit cone = cone(c, n);

        Circuit sen = new Circuit(c.getName() + "_sensitivity");
        sen.addSubcircuit(cone, "orig");
        for (String s : sp) {
            sen.add(s, GateType.INPUT, Collections.emptyList(), Arrays.asList("orig_" + s), false);
        }
        sen.addSubcircuit(CircuitTools.popcount(sp.size()), "pc");

        for (int i = 0; i < sp.size(); i++) {
            String s0 = sp.get(i);
            String prefix = "inv_" + s0;
            sen.addSubcircuit(cone, prefix);
            for (String s1 : sp) {
                String copy = prefix + "_" + s1;
                if (s1.equals(s0)) {
                    sen.setType(copy, GateType.NOT);
                }
                sen.connect(s1, copy);
            }
            sen.add("dif_out_" + s0, GateType.XOR, Arrays.asList("orig_" + n, prefix + "_" + n), Arrays.asList("pc_in_" + i),
                    true);
        }

        int width = CircuitTools.clog2(sp.size() + 1);
        for (int o = 0; o < width; o++) {
            sen.add(SEN_OUT + o, GateType.BUF, Arrays.asList("pc_out_" + o), Collections.emptyList(), true);
        }
        return sen;
    }

    /**
     * Builds a circuit whose output {@code sat} is true exactly when flipping
     * startpoint s changes n. Two copies of the cone of n ({@code c0_},
     * {@code c1_}) share every startpoint but s, which is tied to 0 in the
     * first and to 1 in the second. s remains an unloaded input so that the
     * result's startpoints are those of n. Blackboxes are stripped first.
     * @throws StructuralException if s is not a startpoint of n.
     */
    public static Circuit influenceTransform(Circuit c, String n, String s) {
        c = withoutBlackBoxes(c);
        Set<String> sp = c.startpoints(n);
        if (!sp.contains(s)) {
            throw new StructuralException("'" + s + "' is not a startpoint of '" + n + "'");
        }
        Circuit cone = cone(c, n);

        Circuit inf = new Circuit(c.getName() + "_influence");
        for (String t : sp) {
            inf.add(t, GateType.INPUT);
        }
        inf.addSubcircuit(cone, "c0");
        inf.addSubcircuit(cone, "c1");
        for (String t : sp) {
            if (t.equals(s)) continue;
            inf.connect(t, "c0_" + t);
            inf.connect(t, "c1_" + t);
        }
        inf.setType("c0_" + s, GateType.CONST0);
        inf.setType("c1_" + s, GateType.CONST1);
        inf.add(SAT, GateType.XOR, Arrays.asList("c0_" + n, "c1_" + n), Collections.emptyList(), true);
        return inf;
    }

    /**
     * Builds a circuit whose output {@code sensitize} is true exactly when
     * complementing n changes some endpoint.
     * @see #sensitizationTransform(Circuit, String, Collection)
     */
    public static Circuit sensitizationTransform(Circuit c, String n) {
        return sensitizationTransform(c, n, null);
    }

    /**
     * Builds a miter of the circuit with itself in which the second copy's
     * {@code c1_<n>} is replaced by the complement of {@code c0_<n>}. The
     * output {@code sensitize} is true exactly when the flip at n propagates
     * to one of the endpoints. Blackboxes are stripped first.
     * @param endpoints Endpoints to observe, or null for every output.
     * @throws StructuralException if n is not in the fanin of the endpoints.
     */
    public static Circuit sensitizationTransform(Circuit c, String n, Collection<String> endpoints) {
        c = withoutBlackBoxes(c);
        if (!c.contains(n)) {
            throw new StructuralException("Node '" + n + "' does not exist in circuit '" + c.getName() + "'");
        }
        Circuit subc = c;
        if (endpoints != null && !endpoints.isEmpty()) {
            Set<String> ep = new LinkedHashSet<>(endpoints);
            Set<String> nodes = new LinkedHashSet<>(c.transitiveFanin(ep, Collections.emptySet()));
            nodes.addAll(ep);
            if (!nodes.contains(n)) {
                throw new StructuralException("'" + n + "' is not in the fanin of " + ep);
            }
            subc = subcircuit(c, nodes, false);
            for (String node : subc.getNodeNames()) {
                subc.setOutput(node, ep.contains(node));
            }
        }

        Circuit m = miter(subc);
        String flipped = "c1_" + n;
        for (String d : m.fanin(flipped)) {
            m.disconnect(d, flipped);
        }
        m.setType(flipped, GateType.NOT);
        m.connect("c0_" + n, flipped);
        m.relabel(SAT, SENSITIZE);
        m.setName(c.getName() + "_sensitize_" + n);
        return m;
    }
}
