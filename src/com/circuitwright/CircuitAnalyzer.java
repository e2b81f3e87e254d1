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

package com.circuitwright;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

import com.circuitwright.analysis.CircuitAnalysis;
import com.circuitwright.circuit.Circuit;
import com.circuitwright.circuit.CircuitNode;
import com.circuitwright.circuit.GateType;
import com.circuitwright.sat.CircuitSolver;
import com.circuitwright.transform.CircuitTransforms;
import com.circuitwright.util.CodePerfTracker;
import com.circuitwright.util.FileTools;
import com.circuitwright.util.MessageGenerator;
import com.circuitwright.verilog.VerilogParser;
import com.circuitwright.verilog.VerilogTools;

import joptsimple.OptionParser;
import joptsimple.OptionSet;

/**
 * CLI tool for inspecting, rewriting and analyzing structural Verilog
 * circuits.
 */
public final class CircuitAnalyzer {

    private static final String STATS_CMD = "Stats";
    private static final String WRITE_CMD = "Write";
    private static final String SENSITIVITY_CMD = "Sensitivity";
    private static final String SIGNAL_PROBABILITY_CMD = "SignalProbability";

    private static final String INPUT_OPT = "i";
    private static final String MODULE_OPT = "m";
    private static final String OUTPUT_OPT = "o";
    private static final String NODE_OPT = "n";
    private static final String LIMIT_FANIN_OPT = "limit-fanin";
    private static final String STRIP_BLACKBOXES_OPT = "strip-blackboxes";
    private static final String AVG_OPT = "avg";
    private static final String SUPERGATES_OPT = "supergates";
    private static final String APPROX_OPT = "approx";
    private static final String EPSILON_OPT = "epsilon";
    private static final String DELTA_OPT = "delta";
    private static final String HELP_OPT = "h";

    private static final String DESC_INPUT = "Input Verilog file";
    private static final String DESC_MODULE = "Module to load (default: the top module)";

    private CircuitAnalyzer() {
    }

    private static void printMainHelp() {
        MessageGenerator.printHeader("CircuitAnalyzer");
        System.out.println("Inspect, rewrite and analyze structural Verilog circuits.\n");
        System.out.println("Usage: CircuitAnalyzer <command> [options]\n");
        System.out.println("Available commands:");
        System.out.println("  " + STATS_CMD + "                Print node, gate and level statistics");
        System.out.println("  " + WRITE_CMD + "                Rewrite a circuit as structural Verilog");
        System.out.println("  " + SENSITIVITY_CMD + "          Compute the (average) sensitivity of a node");
        System.out.println("  " + SIGNAL_PROBABILITY_CMD + "    Compute the probability of a node being true");
        System.out.println();
        System.out.println("Use 'CircuitAnalyzer <command> --help' for command-specific options.");
    }

    /**
     * Entry point. Dispatches to the appropriate subcommand handler.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        if (args.length == 0 || args[0].equals("-h") || args[0].equals("--help") || args[0].equals("-?")) {
            printMainHelp();
            return;
        }
        String command = args[0];
        String[] commandArgs = Arrays.copyOfRange(args, 1, args.length);
        if (command.equalsIgnoreCase(STATS_CMD)) {
            runStats(commandArgs);
        } else if (command.equalsIgnoreCase(WRITE_CMD)) {
            runWrite(commandArgs);
        } else if (command.equalsIgnoreCase(SENSITIVITY_CMD)) {
            runSensitivity(commandArgs);
        } else if (command.equalsIgnoreCase(SIGNAL_PROBABILITY_CMD)) {
            runSignalProbability(commandArgs);
        } else {
            System.err.println("ERROR: Unknown command '" + command + "'");
            printMainHelp();
            System.exit(1);
        }
    }

    private static OptionParser createOptionParser() {
        OptionParser optParser = new OptionParser();
        optParser.acceptsAll(Arrays.asList(INPUT_OPT, "input"))
                .withRequiredArg()
                .required()
                .describedAs(DESC_INPUT);
        optParser.acceptsAll(Arrays.asList(MODULE_OPT, "module"))
                .withRequiredArg()
                .describedAs(DESC_MODULE);
        optParser.acceptsAll(Arrays.asList(HELP_OPT, "help", "?"), "Print Help")
                .forHelp();
        return optParser;
    }

    private static void addCountingOptions(OptionParser optParser) {
        optParser.acceptsAll(Arrays.asList(NODE_OPT, "node"))
                .withRequiredArg()
                .required()
                .describedAs("Node to analyze");
        optParser.accepts(APPROX_OPT, "Use the approximate model counter");
        optParser.accepts(EPSILON_OPT)
                .withRequiredArg()
                .ofType(Double.class)
                .defaultsTo(CircuitAnalysis.DEFAULT_EPSILON)
                .describedAs("Tolerance of approximate counts");
        optParser.accepts(DELTA_OPT)
                .withRequiredArg()
                .ofType(Double.class)
                .defaultsTo(CircuitAnalysis.DEFAULT_DELTA)
                .describedAs("Confidence parameter of approximate counts");
    }

    private static void printHelp(String command, String description, OptionParser optParser) {
        MessageGenerator.printHeader(command);
        System.out.println(description + "\n");
        try {
            optParser.printHelpOn(System.out);
        } catch (IOException ioException) {
            ioException.printStackTrace();
        }
    }

    /**
     * Parses the subcommand options, printing help and returning null if they
     * are invalid or help was requested.
     */
    private static OptionSet parseOptions(String command, String description, OptionParser optParser,
            String[] args) {
        OptionSet opts;
        try {
            opts = optParser.parse(args);
        } catch (Exception parseException) {
            System.err.println("ERROR: " + parseException.getMessage());
            printHelp(command, description, optParser);
            return null;
        }
        if (opts.has(HELP_OPT)) {
            printHelp(command, description, optParser);
            return null;
        }
        return opts;
    }

    private static Circuit loadCircuit(OptionSet opts) {
        Path inputPath = Paths.get((String) opts.valueOf(INPUT_OPT));
        String text = FileTools.readTextFile(inputPath.toString());
        VerilogParser parser = new VerilogParser(text);
        if (opts.has(MODULE_OPT)) {
            return parser.parse((String) opts.valueOf(MODULE_OPT));
        }
        return parser.parse();
    }

    private static void runStats(String[] args) {
        OptionParser optParser = createOptionParser();
        OptionSet opts = parseOptions(STATS_CMD, "Print node, gate and level statistics of a circuit.", optParser,
                args);
        if (opts == null) return;

        Circuit c = loadCircuit(opts);
        Map<GateType, Integer> counts = new EnumMap<>(GateType.class);
        for (CircuitNode n : c.getNodes()) {
            counts.merge(n.getType(), 1, Integer::sum);
        }
        int depth = 0;
        for (int level : CircuitAnalysis.levelize(c).values()) {
            depth = Math.max(depth, level);
        }

        System.out.println("-----------------------------------------------------------");
        System.out.println("Circuit Statistics");
        System.out.println("Module     : " + c.getName());
        System.out.println("-----------------------------------------------------------");
        System.out.printf("Nodes      : %,d%n", c.size());
        System.out.printf("Inputs     : %,d%n", c.inputs().size());
        System.out.printf("Outputs    : %,d%n", c.outputs().size());
        System.out.printf("Blackboxes : %,d%n", c.getBlackBoxes().size());
        System.out.printf("Depth      : %,d%n", depth);
        System.out.println();
        for (Map.Entry<GateType, Integer> e : counts.entrySet()) {
            System.out.printf("  %-10s %,d%n", e.getKey().getShortName(), e.getValue());
        }
    }

    private static void runWrite(String[] args) {
        OptionParser optParser = createOptionParser();
        optParser.acceptsAll(Arrays.asList(OUTPUT_OPT, "output"))
                .withRequiredArg()
                .required()
                .describedAs("Output Verilog file");
        optParser.accepts(LIMIT_FANIN_OPT)
                .withRequiredArg()
                .ofType(Integer.class)
                .describedAs("Split gates to at most this many drivers");
        optParser.accepts(STRIP_BLACKBOXES_OPT, "Replace blackbox instances with inputs and outputs");
        OptionSet opts = parseOptions(WRITE_CMD, "Rewrite a circuit as structural Verilog.", optParser, args);
        if (opts == null) return;

        Circuit c = loadCircuit(opts);
        if (opts.has(STRIP_BLACKBOXES_OPT)) {
            c = CircuitTransforms.stripBlackBoxes(c);
        }
        if (opts.has(LIMIT_FANIN_OPT)) {
            c = CircuitTransforms.limitFanin(c, (Integer) opts.valueOf(LIMIT_FANIN_OPT));
        }
        VerilogTools.writeVerilogFile(c, (String) opts.valueOf(OUTPUT_OPT));
        MessageGenerator.briefMessage("Wrote " + c.getName() + " (" + c.size() + " nodes) to "
                + opts.valueOf(OUTPUT_OPT));
    }

    private static void runSensitivity(String[] args) {
        OptionParser optParser = createOptionParser();
        addCountingOptions(optParser);
        optParser.accepts(AVG_OPT, "Compute the average sensitivity (total influence)");
        optParser.accepts(SUPERGATES_OPT, "Break the average sensitivity computation into supergates");
        OptionSet opts = parseOptions(SENSITIVITY_CMD, "Compute the sensitivity of a node.", optParser, args);
        if (opts == null) return;

        Circuit c = loadCircuit(opts);
        String n = (String) opts.valueOf(NODE_OPT);
        CircuitAnalysis analysis = new CircuitAnalysis(CircuitSolver.createDefault());
        CodePerfTracker t = new CodePerfTracker(SENSITIVITY_CMD);
        if (opts.has(AVG_OPT)) {
            t.start("Average sensitivity");
            double avg = analysis.avgSensitivity(c, n, opts.has(SUPERGATES_OPT), opts.has(APPROX_OPT),
                    (Double) opts.valueOf(EPSILON_OPT), (Double) opts.valueOf(DELTA_OPT));
            t.stop();
            System.out.println("Average sensitivity of " + n + ": " + avg);
        } else {
            t.start("Sensitivity");
            int sen = analysis.sensitivity(c, n);
            t.stop();
            System.out.println("Sensitivity of " + n + ": " + sen + " of " + c.startpoints(n).size()
                    + " startpoints");
        }
        t.printSummary();
    }

    private static void runSignalProbability(String[] args) {
        OptionParser optParser = createOptionParser();
        addCountingOptions(optParser);
        OptionSet opts = parseOptions(SIGNAL_PROBABILITY_CMD, "Compute the probability of a node being true.",
                optParser, args);
        if (opts == null) return;

        Circuit c = loadCircuit(opts);
        String n = (String) opts.valueOf(NODE_OPT);
        CircuitAnalysis analysis = new CircuitAnalysis(CircuitSolver.createDefault());
        double p = analysis.signalProbability(c, n, opts.has(APPROX_OPT), (Double) opts.valueOf(EPSILON_OPT),
                (Double) opts.valueOf(DELTA_OPT));
        System.out.println("Signal probability of " + n + ": " + p);
    }
}
