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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Definition of an opaque sub-module. A {@link Circuit} refers to a blackbox
 * by instance name; each instance is materialized as one {@link GateType#BB_INPUT}
 * node per input port and one {@link GateType#BB_OUTPUT} node per output port,
 * named {@code <instance>.<port>}.
 * <p>
 * Whether a blackbox is sequential is part of its definition and is never
 * guessed. A combinational blackbox forwards its inputs to its outputs within
 * the same cycle, so a loop through it is a combinational loop.
 */
public class BlackBox {

    /** Built-in positive-edge D flip-flop used for the parser's flip-flop idiom */
    public static final BlackBox DFF = new BlackBox("dff", Arrays.asList("D", "CK"), Arrays.asList("Q"), true);

    private final String name;
    private final List<String> inputs;
    private final List<String> outputs;
    private final boolean sequential;

    /**
     * Creates a blackbox definition.
     * @param name Name of the module this blackbox stands for.
     * @param inputs Ordered input port names.
     * @param outputs Ordered output port names.
     * @param sequential True if outputs only change on a clock edge (registered).
     */
    public BlackBox(String name, List<String> inputs, List<String> outputs, boolean sequential) {
        Set<String> seen = new HashSet<>();
        for (String p : inputs) {
            if (!seen.add(p)) throw new StructuralException("Blackbox " + name + " has duplicate port " + p);
        }
        for (String p : outputs) {
            if (!seen.add(p)) throw new StructuralException("Blackbox " + name + " has duplicate port " + p);
        }
        this.name = name;
        this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
        this.outputs = Collections.unmodifiableList(new ArrayList<>(outputs));
        this.sequential = sequential;
    }

    public String getName() {
        return name;
    }

    public List<String> getInputs() {
        return inputs;
    }

    public List<String> getOutputs() {
        return outputs;
    }

    /**
     * @return All ports, inputs first.
     */
    public List<String> getPorts() {
        List<String> io = new ArrayList<>(inputs);
        io.addAll(outputs);
        return io;
    }

    public boolean isInput(String port) {
        return inputs.contains(port);
    }

    public boolean isOutput(String port) {
        return outputs.contains(port);
    }

    public boolean isSequential() {
        return sequential;
    }

    /**
     * Gets the name of the pin node for a port of an instance of a blackbox.
     */
    public static String getPinName(String instance, String port) {
        return instance + "." + port;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BlackBox)) return false;
        BlackBox other = (BlackBox) o;
        return sequential == other.sequential && name.equals(other.name)
                && inputs.equals(other.inputs) && outputs.equals(other.outputs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, inputs, outputs, sequential);
    }

    @Override
    public String toString() {
        return "BlackBox(" + name + ", in=" + inputs + ", out=" + outputs
                + (sequential ? ", sequential" : "") + ")";
    }
}
