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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.ArrayList;
import java.util.Map;

import com.circuitwright.circuit.StructuralException;

/**
 * The CNF encoding of a circuit together with the variable of each node.
 * Instances are shared through the encoder's cache and must not be modified.
 */
public class CircuitCnf {

    private final String circuitName;

    private final Cnf cnf;

    private final Map<String, Integer> variables;

    private final String[] names;

    CircuitCnf(String circuitName, Cnf cnf, Map<String, Integer> variables) {
        this.circuitName = circuitName;
        this.cnf = cnf;
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        this.names = new String[cnf.getNumVariables() + 1];
        for (Map.Entry<String, Integer> e : variables.entrySet()) {
            names[e.getValue()] = e.getKey();
        }
    }

    public Cnf getCnf() {
        return cnf;
    }

    /**
     * Gets the variable of every node, in node creation order.
     */
    public Map<String, Integer> getVariables() {
        return variables;
    }

    /**
     * @throws StructuralException if the circuit has no such node.
     */
    public int getVariable(String node) {
        Integer v = variables.get(node);
        if (v == null) {
            throw new StructuralException("Node '" + node + "' does not exist in circuit '" + circuitName + "'");
        }
        return v;
    }

    /**
     * @return The node a variable stands for, or null for an auxiliary variable.
     */
    public String getNodeName(int variable) {
        return variable > 0 && variable < names.length ? names[variable] : null;
    }

    /**
     * Translates node assumptions into literals.
     * @throws StructuralException if an assumption names an unknown node.
     */
    public int[] toLiterals(Map<String, Boolean> assumptions) {
        if (assumptions == null) return new int[0];
        int[] lits = new int[assumptions.size()];
        int i = 0;
        for (Map.Entry<String, Boolean> e : assumptions.entrySet()) {
            int v = getVariable(e.getKey());
            lits[i++] = e.getValue() ? v : -v;
        }
        return lits;
    }

    public List<Integer> getVariables(Collection<String> nodes) {
        List<Integer> vars = new ArrayList<>(nodes.size());
        for (String n : nodes) {
            vars.add(getVariable(n));
        }
        return vars;
    }

    /**
     * Reads the value of every node from a satisfying result.
     */
    public Map<String, Boolean> getNodeValues(SolverResult result) {
        Map<String, Boolean> values = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> e : variables.entrySet()) {
            values.put(e.getKey(), result.getValue(e.getValue()));
        }
        return values;
    }
}
