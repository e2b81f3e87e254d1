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

package com.circuitwright.synth;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.circuitwright.circuit.BlackBox;
import com.circuitwright.circuit.Circuit;
import com.circuitwright.util.FileTools;
import com.circuitwright.util.FileTools.CommandResult;
import com.circuitwright.util.MessageGenerator;
import com.circuitwright.util.Params;
import com.circuitwright.verilog.VerilogParseException;
import com.circuitwright.verilog.VerilogTools;

/**
 * Runs yosys on a circuit written as Verilog and parses the optimized netlist
 * back. Without a liberty file the logic is mapped onto the generic gates;
 * with one, onto the library's cells, which come back as blackboxes.
 */
public class YosysSynthesizer implements Synthesizer {

    public static final String INPUT_FILE = "input" + VerilogTools.VERILOG_EXTENSION;

    public static final String OUTPUT_FILE = "output" + VerilogTools.VERILOG_EXTENSION;

    public static final String GENERIC_GATES = "AND,NAND,OR,NOR,XOR,XNOR";

    private final String executable;

    private final Path liberty;

    private final int timeoutSeconds;

    public YosysSynthesizer() {
        this(null);
    }

    /**
     * @param liberty Liberty file to map onto, or null for generic gates.
     */
    public YosysSynthesizer(Path liberty) {
        this(Params.getYosysExecutable(), liberty, Params.getSolverTimeoutSeconds());
    }

    public YosysSynthesizer(String executable, Path liberty, int timeoutSeconds) {
        this.executable = executable;
        this.liberty = liberty;
        this.timeoutSeconds = timeoutSeconds;
    }

    /**
     * Builds the yosys script for a module.
     * @param top Name of the module to synthesize.
     * @param blackBoxModules Modules to keep as opaque cells.
     */
    public String getScript(String top, Set<String> blackBoxModules) {
        StringBuilder sb = new StringBuilder();
        sb.append("read_verilog ").append(INPUT_FILE).append("; ");
        if (!blackBoxModules.isEmpty()) {
            sb.append("blackbox ").append(String.join(" ", blackBoxModules)).append("; ");
        }
        sb.append("hierarchy -top ").append(top).append("; ");
        sb.append("proc; flatten; opt; techmap; opt; ");
        if (liberty == null) {
            sb.append("abc -g ").append(GENERIC_GATES).append("; ");
        } else {
            sb.append("abc -liberty ").append(liberty.toAbsolutePath()).append("; ");
        }
        sb.append("opt_clean; write_verilog -noattr ").append(OUTPUT_FILE);
        return sb.toString();
    }

    @Override
    public Circuit synthesize(Circuit c) {
        if (!FileTools.isExecutableOnPath(executable) && !Files.isExecutable(Paths.get(executable))) {
            throw new SynthesisException("Couldn't find the yosys executable '" + executable
                    + "', set " + Params.CW_YOSYS_NAME + " to its location");
        }
        String top = c.getName();
        Set<String> blackBoxModules = new LinkedHashSet<>();
        for (BlackBox def : c.getBlackBoxes().values()) {
            blackBoxModules.add(def.getName());
        }

        Path workDir = FileTools.createTempWorkDir("cw_yosys");
        try {
            VerilogTools.writeVerilogFile(c, workDir.resolve(INPUT_FILE));
            List<String> exec = new ArrayList<>();
            exec.add(executable);
            exec.add("-q");
            exec.add("-p");
            exec.add(getScript(top, blackBoxModules));
            CommandResult result = FileTools.runCommand(exec, Params.isVerbose(), workDir.toFile(), timeoutSeconds);
            if (result.isTimedOut()) {
                throw new SynthesisException("Yosys exceeded the time limit of " + timeoutSeconds + "s");
            }
            if (result.getExitCode() != 0) {
                throw new SynthesisException("Yosys exited with code: " + result.getExitCode() + "\n"
                        + String.join("\n", result.getErrorOutput()));
            }
            Path output = workDir.resolve(OUTPUT_FILE);
            if (!Files.exists(output)) {
                throw new SynthesisException("Yosys did not write " + OUTPUT_FILE);
            }
            try {
                String text = FileTools.readTextFile(output.toString());
                Circuit synthesized = VerilogTools.parseVerilog(text, top, c.getBlackBoxes().values());
                MessageGenerator.briefMessage("Synthesized " + top + ": " + c.size() + " -> "
                        + synthesized.size() + " nodes");
                return synthesized;
            } catch (VerilogParseException e) {
                throw new SynthesisException("Couldn't parse the yosys netlist: " + e.getMessage(), e);
            }
        } finally {
            FileTools.deleteFolder(workDir.toString());
        }
    }
}
