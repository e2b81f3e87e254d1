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
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.circuitwright.circuit.BlackBox;

/**
 * Port layout of a blackbox definition as seen from an instantiation: ports
 * grouped by base name, with the bits of vector ports (ports named
 * {@code name[i]}) ordered least significant first. The group order is the
 * order used for positional connections.
 */
class BlackBoxPorts {

    private static final Pattern BIT_PORT = Pattern.compile("(.+)\\[(-?\\d+)\\]");

    final BlackBox def;

    final Map<String, List<String>> ports;

    private BlackBoxPorts(BlackBox def, Map<String, List<String>> ports) {
        this.def = def;
        this.ports = Collections.unmodifiableMap(ports);
    }

    /**
     * Groups the ports of a caller-supplied or built-in definition.
     */
    static BlackBoxPorts of(BlackBox def) {
        Map<String, TreeMap<Integer, String>> vectors = new LinkedHashMap<>();
        Set<String> order = new LinkedHashSet<>();
        Set<String> scalars = new HashSet<>();
        for (String p : def.getPorts()) {
            Matcher m = BIT_PORT.matcher(p);
            String base = m.matches() ? m.group(1) : p;
            if (m.matches() ? scalars.contains(base) : vectors.containsKey(base)) {
                throw new VerilogParseException("Blackbox " + def.getName() + " uses '" + base
                        + "' as both a scalar and a vector port", 0, 0);
            }
            if (m.matches()) {
                vectors.computeIfAbsent(base, k -> new TreeMap<>()).put(Integer.parseInt(m.group(2)), p);
            } else {
                scalars.add(p);
            }
            order.add(base);
        }
        Map<String, List<String>> ports = new LinkedHashMap<>();
        for (String base : order) {
            ports.put(base, scalars.contains(base) ? Collections.singletonList(base)
                    : new ArrayList<>(vectors.get(base).values()));
        }
        return new BlackBoxPorts(def, ports);
    }

    /**
     * Pairs a definition with an explicit port grouping.
     * @param ports Port groups in positional order, covering every port of def.
     */
    static BlackBoxPorts of(BlackBox def, Map<String, List<String>> ports) {
        return new BlackBoxPorts(def, new LinkedHashMap<>(ports));
    }

    /**
     * Derives a definition from the header of a module defined in the same text.
     */
    static BlackBoxPorts of(VerilogModule module, boolean sequential) {
        List<String> inputs = new ArrayList<>();
        List<String> outputs = new ArrayList<>();
        Map<String, List<String>> ports = new LinkedHashMap<>();
        for (String p : module.ports) {
            VerilogModule.NetDecl decl = module.nets.get(p);
            if (decl == null || decl.direction == VerilogModule.Direction.WIRE) {
                throw new VerilogParseException("Parsing Error: Port '" + p + "' of module " + module.name
                        + " has no direction", module.line, 1);
            }
            List<String> bits = decl.getBitNames();
            ports.put(p, bits);
            (decl.direction == VerilogModule.Direction.INPUT ? inputs : outputs).addAll(bits);
        }
        return new BlackBoxPorts(new BlackBox(module.name, inputs, outputs, sequential), ports);
    }
}
