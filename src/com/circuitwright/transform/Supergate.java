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

import java.util.Collections;
import java.util.List;
import java.util.Set;

import com.circuitwright.circuit.Circuit;

/**
 * A region of a circuit with a single root whose inputs have pairwise
 * disjoint startpoint support, so the inputs are independent of one another.
 */
public class Supergate {

    private final String root;

    private final Set<String> nodes;

    private final List<String> inputs;

    private final Circuit circuit;

    Supergate(String root, Set<String> nodes, List<String> inputs, Circuit circuit) {
        this.root = root;
        this.nodes = Collections.unmodifiableSet(nodes);
        this.inputs = Collections.unmodifiableList(inputs);
        this.circuit = circuit;
    }

    /**
     * @return The node whose value the supergate computes.
     */
    public String getRoot() {
        return root;
    }

    /**
     * @return The nodes inside the region, root included.
     */
    public Set<String> getNodes() {
        return nodes;
    }

    /**
     * @return The nodes driving the region from outside, in creation order.
     */
    public List<String> getInputs() {
        return inputs;
    }

    /**
     * Gets a stand-alone copy of the region named {@code sg_<root>}, with an
     * input per supergate input and the root as its only output. Node names
     * are those of the source circuit.
     */
    public Circuit getCircuit() {
        return circuit;
    }

    @Override
    public String toString() {
        return "Supergate(" + root + " <- " + inputs + ")";
    }
}
