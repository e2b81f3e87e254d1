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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.circuitwright.circuit.Circuit;
import com.circuitwright.circuit.CircuitNode;
import com.circuitwright.circuit.GateType;
import com.circuitwright.circuit.StructuralException;

/**
 * Decomposes the fanin cone of a node into supergates (Seth and Agrawal,
 * "A new model for computation of probabilistic testability in combinational
 * circuits", Integration 7.1, 1989).
 * <p>
 * Starting from a root, a region grows backward until its inputs have pairwise
 * disjoint support, where the support of a node is the set of boundary nodes
 * (inputs, blackbox outputs and cut nodes) it depends on. Whenever two inputs
 * share support, the highest-level input that is not itself a boundary is
 * pulled into the region. Logic that depends on no boundary (constants and
 * gates over constants only) is absorbed into every region that reads it.
 * Every input that is not a startpoint is the root of another supergate.
 * Without cut nodes each node is an input of at most one supergate, so the
 * supergates form a tree rooted at the cone's node.
 */
public class Supergates {

    private final Circuit c;

    private final Set<String> cuts;

    private final Map<String, Set<String>> supports = new HashMap<>();

    private final Map<String, Integer> levels = new HashMap<>();

    private Supergates(Circuit c, Set<String> cuts) {
        this.c = c;
        this.cuts = cuts;
    }

    /**
     * Computes the supergates of the fanin cone of n.
     * @param c The circuit, left unchanged.
     * @param n Root of the cone.
     * @param cuts Nodes that bound supergates in addition to startpoints, may
     *             be null.
     * @return The supergates in topological order, producers first, the one
     *         rooted at n last. Empty if n is a startpoint.
     * @throws StructuralException if n does not exist.
     */
    public static List<Supergate> compute(Circuit c, String n, Set<String> cuts) {
        if (!c.contains(n)) {
            throw new StructuralException("Node '" + n + "' does not exist in circuit '" + c.getName() + "'");
        }
        Supergates sg = new Supergates(c, cuts == null ? Collections.emptySet() : cuts);
        return sg.compute(n);
    }

    public static List<Supergate> compute(Circuit c, String n) {
        return compute(c, n, null);
    }

    private List<Supergate> compute(String n) {
        List<Supergate> result = new ArrayList<>();
        if (isStartpoint(n)) return result;
        Set<String> visited = new HashSet<>();
        Deque<String> roots = new ArrayDeque<>();
        roots.add(n);
        visited.add(n);
        while (!roots.isEmpty()) {
            Supergate sg = build(roots.poll());
            result.add(sg);
            for (String i : sg.getInputs()) {
                if (!isStartpoint(i) && visited.add(i)) {
                    roots.add(i);
                }
            }
        }
        result.sort(Comparator.comparingInt((Supergate s) -> level(s.getRoot()))
                .thenComparingInt(s -> c.getNode(s.getRoot()).getIndex()));
        return result;
    }

    private Supergate build(String root) {
        Set<String> region = new LinkedHashSet<>();
        region.add(root);
        while (true) {
            List<String> inputs = inputs(region);
            String pull = null;
            for (int i = 0; i < inputs.size(); i++) {
                for (int j = i + 1; j < inputs.size(); j++) {
                    String a = inputs.get(i);
                    String b = inputs.get(j);
                    if (Collections.disjoint(support(a), support(b))) continue;
                    for (String x : new String[] {a, b}) {
                        if (isBoundary(x)) continue;
                        if (pull == null || level(x) > level(pull)) pull = x;
                    }
                }
            }
            if (pull == null) {
                return new Supergate(root, region, inputs, toCircuit(root, region, inputs));
            }
            region.add(pull);
        }
    }

    /**
     * Gets the drivers of a region from outside it, absorbing drivers with
     * empty support into the region.
     */
    private List<String> inputs(Set<String> region) {
        Set<String> inputs = new HashSet<>();
        Deque<String> todo = new ArrayDeque<>(region);
        while (!todo.isEmpty()) {
            String x = todo.pop();
            for (CircuitNode d : c.getNode(x).getFanin()) {
                String dn = d.getName();
                if (region.contains(dn)) continue;
                if (support(dn).isEmpty()) {
                    region.add(dn);
                    todo.push(dn);
                } else {
                    inputs.add(dn);
                }
            }
        }
        List<String> sorted = new ArrayList<>(inputs);
        sorted.sort(Comparator.comparingInt(x -> c.getNode(x).getIndex()));
        return sorted;
    }

    private Circuit toCircuit(String root, Set<String> region, List<String> inputs) {
        Circuit sc = new Circuit("sg_" + root);
        for (String i : inputs) {
            sc.add(i, GateType.INPUT);
        }
        for (CircuitNode node : c.getNodes()) {
            if (region.contains(node.getName())) {
                sc.addUnconnected(node.getName(), node.getType());
            }
        }
        for (CircuitNode node : c.getNodes()) {
            if (!region.contains(node.getName())) continue;
            for (CircuitNode d : node.getFanin()) {
                sc.connect(d.getName(), node.getName());
            }
        }
        sc.setOutput(root, true);
        return sc;
    }

    private boolean isStartpoint(String n) {
        GateType t = c.getType(n);
        return t == GateType.INPUT || t == GateType.BB_OUTPUT;
    }

    private boolean isBoundary(String n) {
        return isStartpoint(n) || cuts.contains(n);
    }

    /**
     * Gets the boundary nodes n depends on, n itself if it is a boundary.
     */
    private Set<String> support(String n) {
        Set<String> s = supports.get(n);
        if (s != null) return s;
        if (isBoundary(n)) {
            s = Collections.singleton(n);
        } else {
            s = new HashSet<>();
            Deque<String> stack = new ArrayDeque<>();
            Set<String> seen = new HashSet<>();
            stack.push(n);
            while (!stack.isEmpty()) {
                for (CircuitNode d : c.getNode(stack.pop()).getFanin()) {
                    String dn = d.getName();
                    if (!seen.add(dn)) continue;
                    if (isBoundary(dn)) {
                        s.add(dn);
                    } else {
                        stack.push(dn);
                    }
                }
            }
        }
        supports.put(n, s);
        return s;
    }

    /**
     * Longest path from a boundary or source node.
     */
    private int level(String n) {
        Integer l = levels.get(n);
        if (l != null) return l;
        int max = 0;
        if (!isBoundary(n)) {
            Deque<String> stack = new ArrayDeque<>();
            stack.push(n);
            while (!stack.isEmpty()) {
                String x = stack.peek();
                if (levels.containsKey(x)) {
                    stack.pop();
                    continue;
                }
                boolean ready = true;
                int lx = 0;
                if (!isBoundary(x)) {
                    for (CircuitNode d : c.getNode(x).getFanin()) {
                        Integer ld = levels.get(d.getName());
                        if (ld == null) {
                            ready = false;
                            stack.push(d.getName());
                        } else {
                            lx = Math.max(lx, ld + 1);
                        }
                    }
                }
                if (ready) {
                    levels.put(x, lx);
                    stack.pop();
                }
            }
            max = levels.get(n);
        }
        levels.put(n, max);
        return max;
    }
}
