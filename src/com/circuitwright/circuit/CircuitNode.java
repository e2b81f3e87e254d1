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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A node of a {@link Circuit}: a gate, a primary input, a constant tie, an
 * unknown value or a blackbox pin. Connectivity is held as direct references
 * in both directions so neighbours are visited without name lookups. All
 * mutation goes through the owning {@link Circuit}.
 */
public class CircuitNode {

    private final int index;

    private String name;

    private GateType type;

    private boolean output;

    private final Set<CircuitNode> fanin = new LinkedHashSet<>();

    private final Set<CircuitNode> fanout = new LinkedHashSet<>();

    /** Owning blackbox instance and port, for pins only */
    private final String instance;
    private final String port;

    CircuitNode(int index, String name, GateType type, String instance, String port) {
        this.index = index;
        this.name = name;
        this.type = type;
        this.instance = instance;
        this.port = port;
    }

    /**
     * Gets the creation index of this node within its circuit. Indices are
     * unique and increase in creation order but are not contiguous after removals.
     */
    public int getIndex() {
        return index;
    }

    public String getName() {
        return name;
    }

    void setName(String name) {
        this.name = name;
    }

    public GateType getType() {
        return type;
    }

    void setType(GateType type) {
        this.type = type;
    }

    public boolean isOutput() {
        return output;
    }

    void setOutput(boolean output) {
        this.output = output;
    }

    public Set<CircuitNode> getFanin() {
        return Collections.unmodifiableSet(fanin);
    }

    public Set<CircuitNode> getFanout() {
        return Collections.unmodifiableSet(fanout);
    }

    Set<CircuitNode> fanin() {
        return fanin;
    }

    Set<CircuitNode> fanout() {
        return fanout;
    }

    /**
     * @return The blackbox instance name this pin belongs to, null for other nodes.
     */
    public String getBlackBoxInstance() {
        return instance;
    }

    /**
     * @return The blackbox port name of this pin, null for other nodes.
     */
    public String getBlackBoxPort() {
        return port;
    }

    public boolean isStartpoint() {
        return type == GateType.INPUT;
    }

    public boolean isEndpoint() {
        return output;
    }

    @Override
    public String toString() {
        return name + "(" + type.getShortName() + (output ? ", output" : "") + ")";
    }
}
