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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import org.jgrapht.Graph;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.traverse.TopologicalOrderIterator;

/**
 * A mutable gate-level netlist: a directed graph of named {@link CircuitNode}s
 * where an edge runs from a driver to a load. Blackbox instances are
 * referenced by instance name and appear in the graph only as their pins.
 * <p>
 * Upper-bound arity, single-driver, pin and cycle rules are enforced as soon
 * as an edge or node is added. Lower-bound arity (a gate that still has no
 * driver) can only be judged once a netlist is complete and is checked by
 * {@link #validate()}.
 * <p>
 * Instances are not thread-safe.
 */
public class Circuit {

    private String name;

    private final Map<String, CircuitNode> nodes = new LinkedHashMap<>();

    private final Map<String, BlackBox> blackBoxes = new LinkedHashMap<>();

    private int nextIndex = 0;

    private long modCount = 0;

    private long cacheModCount = -1;

    private final Map<String, Set<String>> startpointCache = new HashMap<>();

    private final Map<String, Set<String>> endpointCache = new HashMap<>();

    private static final Comparator<CircuitNode> CREATION_ORDER = Comparator.comparingInt(CircuitNode::getIndex);

    public Circuit() {
        this("circuit");
    }

    public Circuit(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /**
     * Gets a counter that changes whenever the structure of the circuit
     * (nodes, edges, kinds, output flags, blackboxes) changes. Derived data
     * keyed on a circuit can compare it to detect staleness.
     */
    public long getModificationCount() {
        return modCount;
    }

    //------------------------------------------------------------------------
    // Node creation and removal
    //------------------------------------------------------------------------

    /**
     * Adds a node with no connections. Only kinds that need no drivers
     * (inputs, constants and unknowns) can be added this way, see
     * {@link #addUnconnected(String, GateType)} for gates wired afterwards.
     * @param name Unique node name.
     * @param type Kind of the node.
     * @return The new node.
     * @throws StructuralException if the kind needs drivers.
     */
    public CircuitNode add(String name, GateType type) {
        return add(name, type, Collections.emptyList(), Collections.emptyList(), false);
    }

    /**
     * Adds a node driven by the named existing nodes.
     * @param name Unique node name.
     * @param type Kind of the node, any kind but a blackbox pin.
     * @param fanin Names of the drivers.
     * @return The new node.
     */
    public CircuitNode add(String name, GateType type, String... fanin) {
        return add(name, type, Arrays.asList(fanin), Collections.emptyList(), false);
    }

    /**
     * Adds a node and connects it. Either the node is added with all of its
     * connections or the circuit is left unchanged.
     * @param name Unique node name, not starting with a digit.
     * @param type Kind of the node, any kind but a blackbox pin (see
     *             {@link #addBlackBox(BlackBox, String, Map)}).
     * @param fanin Names of existing nodes that will drive the new node.
     * @param fanout Names of existing nodes the new node will drive.
     * @param output True to mark the new node as a primary output.
     * @return The new node.
     * @throws StructuralException if the name is taken or invalid, a connected
     *         node does not exist, or a connection breaks an arity, pin or cycle rule.
     */
    public CircuitNode add(String name, GateType type, Collection<String> fanin, Collection<String> fanout,
            boolean output) {
        if (fanin.size() < type.getMinFanin()) {
            throw new StructuralException("Node '" + name + "' of type " + type.getShortName()
                    + " needs at least " + type.getMinFanin() + " drivers, got " + fanin.size());
        }
        return addNode(name, type, fanin, fanout, output);
    }

    /**
     * Adds a node with no drivers yet, for builders that create nodes before
     * wiring them. The usual arity rule is deferred: {@link #validate()}
     * reports the node if it is still short of drivers.
     * @param name Unique node name.
     * @param type Kind of the node, any kind but a blackbox pin.
     * @param output True to mark the new node as a primary output.
     * @return The new node.
     * @throws StructuralException if the name is taken or invalid.
     */
    public CircuitNode addUnconnected(String name, GateType type, boolean output) {
        return addNode(name, type, Collections.emptyList(), Collections.emptyList(), output);
    }

    public CircuitNode addUnconnected(String name, GateType type) {
        return addUnconnected(name, type, false);
    }

    private CircuitNode addNode(String name, GateType type, Collection<String> fanin, Collection<String> fanout,
            boolean output) {
        checkName(name);
        if (type.isBlackBoxPin()) {
            throw new StructuralException("Cannot add blackbox pin '" + name + "' directly, use addBlackBox()");
        }
        for (String n : fanin) getExistingNode(n);
        for (String n : fanout) getExistingNode(n);
        if (fanin.size() > type.getMaxFanin()) {
            throw new StructuralException("Node '" + name + "' of type " + type.getShortName()
                    + " cannot have " + fanin.size() + " drivers");
        }
        CircuitNode node = createNode(name, type, null, null);
        node.setOutput(output);
        try {
            for (String n : fanin) {
                connect(n, name);
            }
            for (String n : fanout) {
                connect(name, n);
            }
        } catch (StructuralException e) {
            detach(node);
            nodes.remove(name);
            throw e;
        }
        return node;
    }

    /**
     * Removes a node that drives nothing. Its connections to its drivers are
     * dropped.
     * @param name Name of the node.
     * @throws StructuralException if the node still has loads or is a blackbox pin.
     */
    public void remove(String name) {
        remove(name, false);
    }

    /**
     * Removes a node.
     * @param name Name of the node.
     * @param cascade If true, the node is first disconnected from its loads,
     *                which may leave them under-driven. If false, a node with
     *                loads is rejected.
     * @throws StructuralException if the node is a blackbox pin, or has loads
     *         and cascade is false.
     */
    public void remove(String name, boolean cascade) {
        CircuitNode node = getExistingNode(name);
        if (node.getType().isBlackBoxPin()) {
            throw new StructuralException("Cannot remove blackbox pin '" + name
                    + "', use removeBlackBox(\"" + node.getBlackBoxInstance() + "\")");
        }
        if (!cascade && !node.fanout().isEmpty()) {
            throw new StructuralException("Cannot remove '" + name + "', it still drives "
                    + names(node.fanout()));
        }
        detach(node);
        nodes.remove(name);
        modCount++;
    }

    /**
     * Repeatedly removes nodes that drive nothing and are not outputs until no
     * such node is left. Blackbox pins are never removed.
     * @param inputs If true, unloaded inputs are removed too.
     * @return The names of the removed nodes.
     */
    public Set<String> removeUnloaded(boolean inputs) {
        Set<String> removed = new LinkedHashSet<>();
        Deque<CircuitNode> unloaded = new ArrayDeque<>();
        for (CircuitNode n : nodes.values()) {
            if (isRemovableWhenUnloaded(n, inputs)) unloaded.add(n);
        }
        while (!unloaded.isEmpty()) {
            CircuitNode n = unloaded.pop();
            if (!nodes.containsKey(n.getName()) || !isRemovableWhenUnloaded(n, inputs)) continue;
            List<CircuitNode> drivers = new ArrayList<>(n.fanin());
            remove(n.getName());
            removed.add(n.getName());
            for (CircuitNode d : drivers) {
                if (isRemovableWhenUnloaded(d, inputs)) unloaded.push(d);
            }
        }
        return removed;
    }

    private static boolean isRemovableWhenUnloaded(CircuitNode n, boolean inputs) {
        if (n.isOutput() || !n.fanout().isEmpty() || n.getType().isBlackBoxPin()) return false;
        return inputs || n.getType() != GateType.INPUT;
    }

    /**
     * Renames a node that is not a blackbox pin.
     */
    public void relabel(String oldName, String newName) {
        CircuitNode node = getExistingNode(oldName);
        if (oldName.equals(newName)) return;
        if (node.getType().isBlackBoxPin()) {
            throw new StructuralException("Cannot rename blackbox pin '" + oldName + "'");
        }
        checkName(newName);
        nodes.remove(oldName);
        node.setName(newName);
        nodes.put(newName, node);
        modCount++;
    }

    /**
     * Gets a node name based on the given one that is not used in this circuit.
     * @param base Preferred name.
     * @return base if unused, otherwise base_0, base_1, ... whichever is free first.
     */
    public String uniqueName(String base) {
        if (!nodes.containsKey(base)) return base;
        int i = 0;
        while (nodes.containsKey(base + "_" + i)) {
            i++;
        }
        return base + "_" + i;
    }

    //------------------------------------------------------------------------
    // Edges
    //------------------------------------------------------------------------

    /**
     * Connects driver to load. Connecting an existing edge again is a no-op.
     * @throws StructuralException if either node does not exist, the load
     *         cannot take (another) driver, a blackbox pin rule is broken, or
     *         the edge would close a combinational cycle.
     */
    public void connect(String driver, String load) {
        CircuitNode d = getExistingNode(driver);
        CircuitNode l = getExistingNode(load);
        if (d.fanout().contains(l)) return;
        if (d == l) {
            throw new StructuralException("Cannot connect '" + driver + "' to itself");
        }
        GateType lt = l.getType();
        if (lt.isNullary()) {
            throw new StructuralException("Cannot connect to " + lt.getShortName() + " '" + load + "'");
        }
        if (d.getType() == GateType.BB_INPUT) {
            throw new StructuralException("Blackbox input pin '" + driver + "' cannot drive '" + load + "'");
        }
        if (lt.isSingleDriver() && !l.fanin().isEmpty()) {
            throw new StructuralException("'" + load + "' is already driven by "
                    + names(l.fanin()) + ", cannot add driver '" + driver + "'");
        }
        if (d.getType() == GateType.BB_OUTPUT) {
            if (lt != GateType.BUF) {
                throw new StructuralException("Blackbox output pin '" + driver + "' may only drive a buf, not "
                        + lt.getShortName() + " '" + load + "'");
            }
            if (!d.fanout().isEmpty()) {
                throw new StructuralException("Blackbox output pin '" + driver + "' already drives "
                        + names(d.fanout()));
            }
        }
        if (reaches(l, d)) {
            throw new StructuralException("Connecting '" + driver + "' to '" + load
                    + "' would create a combinational cycle");
        }
        d.fanout().add(l);
        l.fanin().add(d);
        modCount++;
    }

    /**
     * Removes the edge from driver to load.
     * @throws StructuralException if either node or the edge does not exist.
     */
    public void disconnect(String driver, String load) {
        CircuitNode d = getExistingNode(driver);
        CircuitNode l = getExistingNode(load);
        if (!d.fanout().remove(l)) {
            throw new StructuralException("'" + driver + "' does not drive '" + load + "'");
        }
        l.fanin().remove(d);
        modCount++;
    }

    //------------------------------------------------------------------------
    // Attributes
    //------------------------------------------------------------------------

    public boolean contains(String name) {
        return nodes.containsKey(name);
    }

    /**
     * @return The named node or null if there is none.
     */
    public CircuitNode getNode(String name) {
        return nodes.get(name);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Gets a read-only view of all nodes in creation order.
     */
    public Collection<CircuitNode> getNodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    /**
     * Gets a snapshot of all node names in creation order.
     */
    public Set<String> getNodeNames() {
        return new LinkedHashSet<>(nodes.keySet());
    }

    public GateType getType(String name) {
        return getExistingNode(name).getType();
    }

    /**
     * Changes the kind of a node, keeping its connections.
     * @throws StructuralException if the node has more drivers than the new kind
     *         allows, is driven by a blackbox output and the new kind is not buf,
     *         or either kind is a blackbox pin.
     */
    public void setType(String name, GateType type) {
        CircuitNode node = getExistingNode(name);
        if (node.getType() == type) return;
        if (type.isBlackBoxPin() || node.getType().isBlackBoxPin()) {
            throw new StructuralException("Cannot change the type of '" + name + "' to or from a blackbox pin");
        }
        if (node.fanin().size() > type.getMaxFanin()) {
            throw new StructuralException("Cannot make '" + name + "' a " + type.getShortName()
                    + ", it has " + node.fanin().size() + " drivers");
        }
        if (type != GateType.BUF) {
            for (CircuitNode d : node.fanin()) {
                if (d.getType() == GateType.BB_OUTPUT) {
                    throw new StructuralException("'" + name + "' is driven by blackbox output '" + d.getName()
                            + "' and must stay a buf");
                }
            }
        }
        node.setType(type);
        modCount++;
    }

    public boolean isOutput(String name) {
        return getExistingNode(name).isOutput();
    }

    public void setOutput(String name, boolean output) {
        CircuitNode node = getExistingNode(name);
        if (node.isOutput() == output) return;
        node.setOutput(output);
        modCount++;
    }

    //------------------------------------------------------------------------
    // Traversal
    //------------------------------------------------------------------------

    public Set<String> fanin(String name) {
        return names(getExistingNode(name).fanin());
    }

    public Set<String> fanout(String name) {
        return names(getExistingNode(name).fanout());
    }

    /**
     * Gets the names of all nodes of the given kinds, in creation order.
     */
    public Set<String> filterType(GateType... types) {
        Set<GateType> typeSet = new HashSet<>(Arrays.asList(types));
        Set<String> result = new LinkedHashSet<>();
        for (CircuitNode n : nodes.values()) {
            if (typeSet.contains(n.getType())) result.add(n.getName());
        }
        return result;
    }

    public Set<String> inputs() {
        return filterType(GateType.INPUT);
    }

    public Set<String> outputs() {
        Set<String> result = new LinkedHashSet<>();
        for (CircuitNode n : nodes.values()) {
            if (n.isOutput()) result.add(n.getName());
        }
        return result;
    }

    /**
     * Gets every node that drives the given node directly or indirectly. The
     * node itself is not included unless it lies on a cycle.
     */
    public Set<String> transitiveFanin(String name) {
        return transitiveFanin(Collections.singleton(name), Collections.emptySet());
    }

    /**
     * Gets every node that drives one of the given nodes directly or
     * indirectly, not looking past the stop nodes (which are included if reached).
     */
    public Set<String> transitiveFanin(Collection<String> names, Set<String> stopAt) {
        return names(traverse(names, stopAt, true));
    }

    /**
     * Gets every node driven by the given node directly or indirectly.
     */
    public Set<String> transitiveFanout(String name) {
        return transitiveFanout(Collections.singleton(name), Collections.emptySet());
    }

    public Set<String> transitiveFanout(Collection<String> names, Set<String> stopAt) {
        return names(traverse(names, stopAt, false));
    }

    private List<CircuitNode> traverse(Collection<String> names, Set<String> stopAt, boolean backward) {
        Set<CircuitNode> visited = new HashSet<>();
        Deque<CircuitNode> stack = new ArrayDeque<>();
        for (String n : names) {
            stack.push(getExistingNode(n));
        }
        while (!stack.isEmpty()) {
            CircuitNode n = stack.pop();
            for (CircuitNode next : backward ? n.fanin() : n.fanout()) {
                if (visited.add(next) && !stopAt.contains(next.getName())) {
                    stack.push(next);
                }
            }
        }
        List<CircuitNode> result = new ArrayList<>(visited);
        result.sort(CREATION_ORDER);
        return result;
    }

    /**
     * Gets all startpoints of the circuit, which are its primary inputs.
     */
    public Set<String> startpoints() {
        return inputs();
    }

    /**
     * Gets the inputs in the transitive fanin of a node (the node itself if it
     * is an input). Backward traversal ends at blackbox output pins, so inputs
     * feeding a blackbox are not startpoints of the logic it drives. Results
     * are cached until the circuit changes.
     * @return Read-only set of startpoint names in creation order.
     */
    public Set<String> startpoints(String name) {
        refreshCaches();
        Set<String> sp = startpointCache.get(name);
        if (sp == null) {
            CircuitNode node = getExistingNode(name);
            List<CircuitNode> cone = traverse(Collections.singleton(name), Collections.emptySet(), true);
            cone.add(node);
            cone.sort(CREATION_ORDER);
            sp = new LinkedHashSet<>();
            for (CircuitNode n : cone) {
                if (n.isStartpoint()) sp.add(n.getName());
            }
            sp = Collections.unmodifiableSet(sp);
            startpointCache.put(name, sp);
        }
        return sp;
    }

    /**
     * Gets the union of the startpoints of several nodes.
     */
    public Set<String> startpoints(Collection<String> names) {
        Set<String> result = new LinkedHashSet<>();
        for (String n : names) {
            result.addAll(startpoints(n));
        }
        return result;
    }

    /**
     * Gets all endpoints of the circuit, which are its output-marked nodes.
     */
    public Set<String> endpoints() {
        return outputs();
    }

    /**
     * Gets the output-marked nodes in the transitive fanout of a node (the node
     * itself if it is an output). Forward traversal ends at blackbox input
     * pins. Results are cached until the circuit changes.
     */
    public Set<String> endpoints(String name) {
        refreshCaches();
        Set<String> ep = endpointCache.get(name);
        if (ep == null) {
            CircuitNode node = getExistingNode(name);
            List<CircuitNode> cone = traverse(Collections.singleton(name), Collections.emptySet(), false);
            cone.add(node);
            cone.sort(CREATION_ORDER);
            ep = new LinkedHashSet<>();
            for (CircuitNode n : cone) {
                if (n.isEndpoint()) ep.add(n.getName());
            }
            ep = Collections.unmodifiableSet(ep);
            endpointCache.put(name, ep);
        }
        return ep;
    }

    public Set<String> endpoints(Collection<String> names) {
        Set<String> result = new LinkedHashSet<>();
        for (String n : names) {
            result.addAll(endpoints(n));
        }
        return result;
    }

    private void refreshCaches() {
        if (cacheModCount != modCount) {
            startpointCache.clear();
            endpointCache.clear();
            cacheModCount = modCount;
        }
    }

    //------------------------------------------------------------------------
    // Blackboxes
    //------------------------------------------------------------------------

    /**
     * Instantiates a blackbox, creating its pins and connecting them.
     * @param def The blackbox definition.
     * @param instance Unique instance name.
     * @param connections Map from port name to circuit node. Input ports are
     *                    driven by the named node. Output ports drive the named
     *                    node, which is created as a buf if it does not exist.
     *                    Ports left out are not connected. May be null.
     * @throws StructuralException on a duplicate instance, a pin name clash, an
     *         unknown port, or an illegal connection.
     */
    public void addBlackBox(BlackBox def, String instance, Map<String, String> connections) {
        if (blackBoxes.containsKey(instance)) {
            throw new StructuralException("Blackbox instance '" + instance + "' already exists");
        }
        for (String port : def.getPorts()) {
            String pin = BlackBox.getPinName(instance, port);
            if (nodes.containsKey(pin)) {
                throw new StructuralException("Blackbox pin '" + pin + "' clashes with an existing node");
            }
        }
        if (connections != null) {
            for (String port : connections.keySet()) {
                if (!def.isInput(port) && !def.isOutput(port)) {
                    throw new StructuralException("Port '" + port + "' is not defined for blackbox "
                            + def.getName() + " (instance '" + instance + "')");
                }
            }
        }
        checkNameSyntax(instance);
        blackBoxes.put(instance, def);
        for (String port : def.getInputs()) {
            createNode(BlackBox.getPinName(instance, port), GateType.BB_INPUT, instance, port);
        }
        for (String port : def.getOutputs()) {
            createNode(BlackBox.getPinName(instance, port), GateType.BB_OUTPUT, instance, port);
        }
        if (connections == null) return;
        for (Map.Entry<String, String> e : connections.entrySet()) {
            String pin = BlackBox.getPinName(instance, e.getKey());
            if (def.isInput(e.getKey())) {
                connect(e.getValue(), pin);
            } else {
                if (!nodes.containsKey(e.getValue())) {
                    addUnconnected(e.getValue(), GateType.BUF);
                }
                connect(pin, e.getValue());
            }
        }
    }

    /**
     * Gets a read-only view of the blackbox instances, keyed by instance name.
     */
    public Map<String, BlackBox> getBlackBoxes() {
        return Collections.unmodifiableMap(blackBoxes);
    }

    /**
     * @return The definition of the named instance or null if there is none.
     */
    public BlackBox getBlackBox(String instance) {
        return blackBoxes.get(instance);
    }

    /**
     * Removes a blackbox instance and all of its pins. Nodes its outputs drove
     * are left without a driver.
     */
    public void removeBlackBox(String instance) {
        BlackBox def = blackBoxes.get(instance);
        if (def == null) {
            throw new StructuralException("Blackbox instance '" + instance + "' does not exist");
        }
        for (String port : def.getPorts()) {
            CircuitNode pin = nodes.remove(BlackBox.getPinName(instance, port));
            if (pin != null) detach(pin);
        }
        blackBoxes.remove(instance);
        modCount++;
    }

    /**
     * Replaces a blackbox instance with a circuit implementing it. The
     * implementation's nodes are added with the prefix {@code <instance>_}; its
     * inputs and outputs must be named exactly like the blackbox ports.
     * @param instance Name of the blackbox instance.
     * @param impl The implementation.
     * @return Mapping from implementation node names to their new names.
     */
    public Map<String, String> fillBlackBox(String instance, Circuit impl) {
        BlackBox def = blackBoxes.get(instance);
        if (def == null) {
            throw new StructuralException("Blackbox instance '" + instance + "' does not exist");
        }
        if (!impl.inputs().equals(new HashSet<>(def.getInputs()))) {
            throw new StructuralException("Circuit inputs " + impl.inputs() + " do not match blackbox '"
                    + instance + "' inputs " + def.getInputs());
        }
        if (!impl.outputs().equals(new HashSet<>(def.getOutputs()))) {
            throw new StructuralException("Circuit outputs " + impl.outputs() + " do not match blackbox '"
                    + instance + "' outputs " + def.getOutputs());
        }
        Map<String, String> connections = new LinkedHashMap<>();
        for (String port : def.getInputs()) {
            CircuitNode pin = nodes.get(BlackBox.getPinName(instance, port));
            if (!pin.fanin().isEmpty()) {
                connections.put(port, pin.fanin().iterator().next().getName());
            }
        }
        for (String port : def.getOutputs()) {
            CircuitNode pin = nodes.get(BlackBox.getPinName(instance, port));
            if (!pin.fanout().isEmpty()) {
                connections.put(port, pin.fanout().iterator().next().getName());
            }
        }
        removeBlackBox(instance);
        Map<String, String> mapping = addSubcircuit(impl, instance, connections);
        // Unconnected input ports have no defined value
        for (String port : def.getInputs()) {
            String n = mapping.get(port);
            if (getExistingNode(n).fanin().isEmpty()) {
                setType(n, GateType.X);
            }
        }
        return mapping;
    }

    //------------------------------------------------------------------------
    // Composition and copying
    //------------------------------------------------------------------------

    /**
     * Adds a renamed copy of another circuit with its inputs turned into
     * buffers and its outputs unmarked.
     * @see #addSubcircuit(Circuit, String, Map, boolean)
     */
    public Map<String, String> addSubcircuit(Circuit other, String prefix) {
        return addSubcircuit(other, prefix, null, true);
    }

    /**
     * Adds a renamed copy of another circuit with its inputs turned into
     * buffers and its outputs unmarked, then makes the given connections.
     * @see #addSubcircuit(Circuit, String, Map, boolean)
     */
    public Map<String, String> addSubcircuit(Circuit other, String prefix, Map<String, String> connections) {
        return addSubcircuit(other, prefix, connections, true);
    }

    /**
     * Adds a copy of another circuit in which every node and blackbox instance
     * {@code n} is renamed {@code <prefix>_n}.
     * @param other The circuit to copy in, left unchanged.
     * @param prefix Instance name used as prefix.
     * @param connections Optional map from inputs/outputs of other to nodes of
     *                    this circuit. An input of other is driven by the named
     *                    node. An output of other drives the named node, which
     *                    is created as a buf if it does not exist. May be null.
     * @param stripIo If true, inputs of other become buffers (to be driven) and
     *                outputs of other are unmarked.
     * @return Mapping from the names in other to the new names in this circuit.
     */
    public Map<String, String> addSubcircuit(Circuit other, String prefix, Map<String, String> connections,
            boolean stripIo) {
        Function<String, String> renamer = n -> prefix + "_" + n;
        for (String bb : other.blackBoxes.keySet()) {
            if (blackBoxes.containsKey(renamer.apply(bb))) {
                throw new StructuralException("Blackbox instance '" + renamer.apply(bb) + "' already exists");
            }
        }
        Map<String, String> mapping = new LinkedHashMap<>();
        for (CircuitNode n : other.nodes.values()) {
            String newName = n.getType().isBlackBoxPin()
                    ? BlackBox.getPinName(renamer.apply(n.getBlackBoxInstance()), n.getBlackBoxPort())
                    : renamer.apply(n.getName());
            if (nodes.containsKey(newName)) {
                throw new StructuralException("Node '" + n.getName() + "' of subcircuit '" + prefix
                        + "' overlaps with existing node '" + newName + "'");
            }
            mapping.put(n.getName(), newName);
        }
        Set<String> otherInputs = other.inputs();
        Set<String> otherOutputs = other.outputs();
        if (connections != null) {
            for (String n : connections.keySet()) {
                if (!otherInputs.contains(n) && !otherOutputs.contains(n)) {
                    throw new StructuralException("Node '" + n + "' is not an input or output of subcircuit '"
                            + prefix + "'");
                }
            }
        }

        absorb(other, mapping, renamer);
        if (stripIo) {
            for (String n : otherInputs) {
                nodes.get(mapping.get(n)).setType(GateType.BUF);
            }
            for (String n : otherOutputs) {
                nodes.get(mapping.get(n)).setOutput(false);
            }
        }

        if (connections != null) {
            for (Map.Entry<String, String> e : connections.entrySet()) {
                if (otherInputs.contains(e.getKey())) {
                    connect(e.getValue(), mapping.get(e.getKey()));
                } else {
                    if (!nodes.containsKey(e.getValue())) {
                        addUnconnected(e.getValue(), GateType.BUF);
                    }
                    connect(mapping.get(e.getKey()), e.getValue());
                }
            }
        }
        return mapping;
    }

    /**
     * Creates an independent copy of this circuit.
     */
    public Circuit copy() {
        return copy(Function.identity());
    }

    /**
     * Creates an independent copy of this circuit in which every node and
     * blackbox instance is renamed by the given function. Pin names follow
     * their renamed instance.
     * @throws StructuralException if the renamer maps two nodes to one name.
     */
    public Circuit copy(Function<String, String> renamer) {
        Circuit c = new Circuit(name);
        Map<String, String> mapping = new LinkedHashMap<>();
        Set<String> used = new HashSet<>();
        for (CircuitNode n : nodes.values()) {
            String newName = n.getType().isBlackBoxPin()
                    ? BlackBox.getPinName(renamer.apply(n.getBlackBoxInstance()), n.getBlackBoxPort())
                    : renamer.apply(n.getName());
            if (!used.add(newName)) {
                throw new StructuralException("Renaming maps more than one node to '" + newName + "'");
            }
            mapping.put(n.getName(), newName);
        }
        c.absorb(this, mapping, renamer);
        return c;
    }

    private void absorb(Circuit other, Map<String, String> mapping, Function<String, String> renamer) {
        for (Map.Entry<String, BlackBox> e : other.blackBoxes.entrySet()) {
            blackBoxes.put(renamer.apply(e.getKey()), e.getValue());
        }
        for (CircuitNode n : other.nodes.values()) {
            String inst = n.getBlackBoxInstance() == null ? null : renamer.apply(n.getBlackBoxInstance());
            CircuitNode copy = createNode(mapping.get(n.getName()), n.getType(), inst, n.getBlackBoxPort());
            copy.setOutput(n.isOutput());
        }
        for (CircuitNode n : other.nodes.values()) {
            CircuitNode d = nodes.get(mapping.get(n.getName()));
            for (CircuitNode load : n.fanout()) {
                CircuitNode l = nodes.get(mapping.get(load.getName()));
                d.fanout().add(l);
                l.fanin().add(d);
            }
        }
        modCount++;
    }

    //------------------------------------------------------------------------
    // Whole-circuit checks
    //------------------------------------------------------------------------

    /**
     * Checks the invariants that cannot be enforced while a circuit is being
     * built: every gate has as many drivers as its kind needs, every blackbox
     * instance has its complete set of pins, and no cycle runs through a
     * combinational blackbox.
     * @throws StructuralException describing the first violation found.
     */
    public void validate() {
        for (CircuitNode n : nodes.values()) {
            if (n.fanin().size() < n.getType().getMinFanin()) {
                throw new StructuralException("Node '" + n.getName() + "' of type " + n.getType().getShortName()
                        + " has " + n.fanin().size() + " drivers, needs at least " + n.getType().getMinFanin());
            }
        }
        for (Map.Entry<String, BlackBox> e : blackBoxes.entrySet()) {
            BlackBox def = e.getValue();
            for (String port : def.getPorts()) {
                String pinName = BlackBox.getPinName(e.getKey(), port);
                CircuitNode pin = nodes.get(pinName);
                GateType expected = def.isInput(port) ? GateType.BB_INPUT : GateType.BB_OUTPUT;
                if (pin == null || pin.getType() != expected || !e.getKey().equals(pin.getBlackBoxInstance())) {
                    throw new StructuralException("Blackbox instance '" + e.getKey() + "' is missing pin '"
                            + pinName + "'");
                }
            }
        }
        if (isCyclic()) {
            throw new StructuralException("Circuit '" + name + "' has a combinational cycle");
        }
    }

    /**
     * Checks for a combinational cycle, counting paths through combinational
     * blackboxes but not through sequential ones.
     */
    public boolean isCyclic() {
        CycleDetector<String, DefaultEdge> cycleDetector = new CycleDetector<>(toGraph(true));
        return cycleDetector.detectCycles();
    }

    /**
     * Builds a jgrapht view of the circuit's connectivity.
     * @param throughCombinationalBlackBoxes If true, each input pin of a
     *        combinational blackbox gets an edge to each of its output pins.
     * @return A new graph whose vertices are node names.
     */
    public Graph<String, DefaultEdge> toGraph(boolean throughCombinationalBlackBoxes) {
        Graph<String, DefaultEdge> graph = new DefaultDirectedGraph<>(DefaultEdge.class);
        for (String n : nodes.keySet()) {
            graph.addVertex(n);
        }
        for (CircuitNode n : nodes.values()) {
            for (CircuitNode l : n.fanout()) {
                graph.addEdge(n.getName(), l.getName());
            }
        }
        if (throughCombinationalBlackBoxes) {
            for (Map.Entry<String, BlackBox> e : blackBoxes.entrySet()) {
                if (e.getValue().isSequential()) continue;
                for (String in : e.getValue().getInputs()) {
                    for (String out : e.getValue().getOutputs()) {
                        String i = BlackBox.getPinName(e.getKey(), in);
                        String o = BlackBox.getPinName(e.getKey(), out);
                        if (graph.containsVertex(i) && graph.containsVertex(o)) {
                            graph.addEdge(i, o);
                        }
                    }
                }
            }
        }
        return graph;
    }

    /**
     * Gets all node names ordered so that every node comes after its drivers.
     */
    public List<String> topologicalOrder() {
        List<String> order = new ArrayList<>(nodes.size());
        Iterator<String> it = new TopologicalOrderIterator<>(toGraph(false));
        while (it.hasNext()) {
            order.add(it.next());
        }
        return order;
    }

    //------------------------------------------------------------------------
    // Internals
    //------------------------------------------------------------------------

    private CircuitNode createNode(String name, GateType type, String instance, String port) {
        if (nodes.containsKey(name)) {
            throw new StructuralException("Node '" + name + "' already exists");
        }
        CircuitNode node = new CircuitNode(nextIndex++, name, type, instance, port);
        nodes.put(name, node);
        modCount++;
        return node;
    }

    private void detach(CircuitNode node) {
        for (CircuitNode d : node.fanin()) {
            d.fanout().remove(node);
        }
        for (CircuitNode l : node.fanout()) {
            l.fanin().remove(node);
        }
        node.fanin().clear();
        node.fanout().clear();
        modCount++;
    }

    /**
     * Checks whether target can be reached from start following edges forward,
     * including through combinational blackboxes.
     */
    private boolean reaches(CircuitNode start, CircuitNode target) {
        Set<CircuitNode> visited = new HashSet<>();
        Deque<CircuitNode> stack = new ArrayDeque<>();
        stack.push(start);
        visited.add(start);
        while (!stack.isEmpty()) {
            CircuitNode n = stack.pop();
            if (n == target) return true;
            for (CircuitNode next : n.fanout()) {
                if (visited.add(next)) stack.push(next);
            }
            if (n.getType() == GateType.BB_INPUT) {
                BlackBox def = blackBoxes.get(n.getBlackBoxInstance());
                if (def != null && !def.isSequential()) {
                    for (String out : def.getOutputs()) {
                        CircuitNode o = nodes.get(BlackBox.getPinName(n.getBlackBoxInstance(), out));
                        if (o != null && visited.add(o)) stack.push(o);
                    }
                }
            }
        }
        return false;
    }

    CircuitNode getExistingNode(String name) {
        CircuitNode node = nodes.get(name);
        if (node == null) {
            throw new StructuralException("Node '" + name + "' does not exist in circuit '" + this.name + "'");
        }
        return node;
    }

    private void checkName(String name) {
        checkNameSyntax(name);
        if (nodes.containsKey(name)) {
            throw new StructuralException("Node '" + name + "' already exists");
        }
    }

    private static void checkNameSyntax(String name) {
        if (name == null || name.isEmpty()) {
            throw new StructuralException("Node names cannot be empty");
        }
        if (Character.isDigit(name.charAt(0))) {
            throw new StructuralException("Node name '" + name + "' cannot start with a digit");
        }
        for (int i = 0; i < name.length(); i++) {
            if (Character.isWhitespace(name.charAt(i))) {
                throw new StructuralException("Node name '" + name + "' cannot contain whitespace");
            }
        }
    }

    private static Set<String> names(Collection<CircuitNode> ns) {
        Set<String> result = new LinkedHashSet<>();
        for (CircuitNode n : ns) {
            result.add(n.getName());
        }
        return result;
    }

    @Override
    public String toString() {
        return "Circuit(" + name + ", " + nodes.size() + " nodes, " + blackBoxes.size() + " blackboxes)";
    }
}
