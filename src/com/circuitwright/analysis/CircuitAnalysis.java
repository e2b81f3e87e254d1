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

package com.circuitwright.analysis;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.circuitwright.circuit.Circuit;
import com.circuitwright.circuit.CircuitNode;
import com.circuitwright.circuit.CircuitTools;
import com.circuitwright.circuit.StructuralException;
import com.circuitwright.sat.CircuitSolver;
import com.circuitwright.transform.CircuitTransforms;
import com.circuitwright.transform.Supergate;
import com.circuitwright.transform.Supergates;

/**
 * Boolean properties of circuit nodes, computed by building a transform and
 * asking the injected {@link CircuitSolver} about it. Circuits with
 * blackboxes are analyzed with the blackboxes stripped, so blackbox outputs
 * count as free startpoints.
 */
public class CircuitAnalysis {

    /** Default tolerance of approximate counts */
    public static final double DEFAULT_EPSILON = 0.8;

    /** Default confidence parameter of approximate counts */
    public static final double DEFAULT_DELTA = 0.2;

    private final CircuitSolver solver;

    public CircuitAnalysis(CircuitSolver solver) {
        this.solver = solver;
    }

    public CircuitSolver getSolver() {
        return solver;
    }

    /**
     * Finds a startpoint assignment under which complementing n changes an
     * output.
     * @param c The circuit.
     * @param n The node to flip.
     * @param assumptions Extra constraints on the startpoints, may be null.
     * @return A value for every startpoint of the circuit, or null if the
     *         flip can never be observed under the assumptions.
     */
    public Map<String, Boolean> sensitize(Circuit c, String n, Map<String, Boolean> assumptions) {
        Circuit s = CircuitTransforms.sensitizationTransform(c, n);
        Map<String, Boolean> all = new HashMap<>();
        if (assumptions != null) all.putAll(assumptions);
        all.put(CircuitTransforms.SENSITIZE, true);
        Map<String, Boolean> result = solver.solve(s, all);
        if (result == null) return null;
        Map<String, Boolean> witness = new LinkedHashMap<>();
        for (String sp : s.startpoints()) {
            witness.put(sp, result.get(sp));
        }
        return witness;
    }

    /**
     * Gets the largest number of startpoints of n that can each flip n on
     * their own, over all assignments. The search starts at the number of
     * startpoints and stops at the first count some assignment achieves.
     * @return 1 if n is a startpoint, 0 if n has no startpoints or is constant.
     */
    public int sensitivity(Circuit c, String n) {
        Circuit stripped = stripped(c);
        Set<String> sp = stripped.startpoints(n);
        if (sp.contains(n)) return 1;
        if (sp.isEmpty()) return 0;

        Circuit s = CircuitTransforms.sensitivityTransform(stripped, n);
        int width = CircuitTools.clog2(sp.size() + 1);
        for (int k = sp.size(); k > 0; k--) {
            boolean[] bits = CircuitTools.toBinary(k, width);
            Map<String, Boolean> assumptions = new HashMap<>();
            for (int i = 0; i < width; i++) {
                assumptions.put(CircuitTransforms.SEN_OUT + i, bits[i]);
            }
            if (solver.solve(s, assumptions) != null) {
                return k;
            }
        }
        return 0;
    }

    /**
     * Computes the influence of every startpoint of n, the probability over
     * uniform startpoint assignments that flipping it changes n.
     * @param supergates If true, the influence on each supergate is computed
     *                   separately and multiplied along the supergate tree.
     *                   The supergates' inputs are taken to be uniform, which
     *                   is exact when they are startpoints or balanced.
     * @param approx If true, counts come from the approximate counter.
     */
    public Map<String, Double> influence(Circuit c, String n, boolean supergates, boolean approx,
            double epsilon, double delta) {
        Circuit stripped = stripped(c);
        Set<String> sp = stripped.startpoints(n);
        Map<String, Double> influences = new LinkedHashMap<>();
        if (sp.contains(n)) {
            influences.put(n, 1.0);
            return influences;
        }
        if (!supergates) {
            for (String s : sp) {
                influences.put(s, influenceOf(stripped, n, s, approx, epsilon, delta));
            }
            return influences;
        }

        List<Supergate> sgs = Supergates.compute(stripped, n, null);
        Map<String, String> consumer = new HashMap<>();
        Map<String, Map<String, Double>> local = new HashMap<>();
        for (Supergate sg : sgs) {
            Map<String, Double> m = new HashMap<>();
            for (String i : sg.getInputs()) {
                consumer.put(i, sg.getRoot());
                m.put(i, influenceOf(sg.getCircuit(), sg.getRoot(), i, approx, epsilon, delta));
            }
            local.put(sg.getRoot(), m);
        }
        for (String s : sp) {
            double infl = 1.0;
            String cur = s;
            while (!cur.equals(n)) {
                String root = consumer.get(cur);
                infl *= local.get(root).get(cur);
                cur = root;
            }
            influences.put(s, infl);
        }
        return influences;
    }

    public Map<String, Double> influence(Circuit c, String n, boolean approx) {
        return influence(c, n, false, approx, DEFAULT_EPSILON, DEFAULT_DELTA);
    }

    private double influenceOf(Circuit c, String n, String s, boolean approx, double epsilon, double delta) {
        Circuit inf = CircuitTransforms.influenceTransform(c, n, s);
        Map<String, Boolean> sat = Collections.singletonMap(CircuitTransforms.SAT, true);
        BigInteger count = approx ? solver.approxModelCount(inf, sat, epsilon, delta) : solver.modelCount(inf, sat);
        return fraction(count, inf.startpoints().size());
    }

    /**
     * Gets the average sensitivity of n, the sum of its startpoints' influences.
     */
    public double avgSensitivity(Circuit c, String n, boolean supergates, boolean approx, double epsilon,
            double delta) {
        double total = 0;
        for (double v : influence(c, n, supergates, approx, epsilon, delta).values()) {
            total += v;
        }
        return total;
    }

    public double avgSensitivity(Circuit c, String n, boolean approx) {
        return avgSensitivity(c, n, false, approx, DEFAULT_EPSILON, DEFAULT_DELTA);
    }

    /**
     * Gets the probability that n is true over uniform assignments of its own
     * startpoints.
     */
    public double signalProbability(Circuit c, String n, boolean approx, double epsilon, double delta) {
        Circuit cone = CircuitTransforms.cone(stripped(c), n);
        Map<String, Boolean> assumptions = Collections.singletonMap(n, true);
        BigInteger count = approx ? solver.approxModelCount(cone, assumptions, epsilon, delta)
                : solver.modelCount(cone, assumptions);
        return fraction(count, cone.startpoints().size());
    }

    public double signalProbability(Circuit c, String n, boolean approx) {
        return signalProbability(c, n, approx, DEFAULT_EPSILON, DEFAULT_DELTA);
    }

    /**
     * Gets the logic level of every node: 0 for nodes without drivers, one
     * more than the deepest driver otherwise. Sequential blackboxes break
     * paths.
     * @throws StructuralException if the circuit has a combinational cycle.
     */
    public static Map<String, Integer> levelize(Circuit c) {
        if (c.isCyclic()) {
            throw new StructuralException("Cannot levelize cyclic circuit '" + c.getName() + "'");
        }
        Map<String, Integer> levels = new LinkedHashMap<>();
        for (String n : c.topologicalOrder()) {
            int level = 0;
            for (CircuitNode d : c.getNode(n).getFanin()) {
                level = Math.max(level, levels.get(d.getName()) + 1);
            }
            levels.put(n, level);
        }
        return levels;
    }

    private static Circuit stripped(Circuit c) {
        return c.getBlackBoxes().isEmpty() ? c : CircuitTransforms.stripBlackBoxes(c);
    }

    private static double fraction(BigInteger count, int bits) {
        return new BigDecimal(count).divide(new BigDecimal(BigInteger.ONE.shiftLeft(bits))).doubleValue();
    }
}
