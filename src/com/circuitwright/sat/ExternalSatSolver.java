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

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.circuitwright.util.FileTools;
import com.circuitwright.util.FileTools.CommandResult;
import com.circuitwright.util.Params;

/**
 * SAT oracle that runs a SAT-competition style solver executable (cadical,
 * kissat, minisat in competition mode, ...) on a DIMACS file and parses its
 * {@code s} and {@code v} lines.
 */
public class ExternalSatSolver implements SatSolver {

    /** Exit code of a solver that found a model */
    public static final int EXIT_SATISFIABLE = 10;

    /** Exit code of a solver that proved unsatisfiability */
    public static final int EXIT_UNSATISFIABLE = 20;

    private final String executable;

    private final int timeoutSeconds;

    public ExternalSatSolver() {
        this(Params.getSatSolverExecutable(), Params.getSolverTimeoutSeconds());
    }

    public ExternalSatSolver(String executable, int timeoutSeconds) {
        this.executable = executable;
        this.timeoutSeconds = timeoutSeconds;
    }

    public String getExecutable() {
        return executable;
    }

    @Override
    public SolverResult solve(Cnf cnf, int[] assumptions) {
        Path workDir = FileTools.createTempWorkDir("cw_sat");
        try {
            Path cnfFile = workDir.resolve("formula.cnf");
            try (BufferedWriter bw = Files.newBufferedWriter(cnfFile, StandardCharsets.UTF_8)) {
                cnf.writeDimacs(bw, assumptions, null);
            } catch (IOException e) {
                throw new UncheckedIOException("ERROR: Couldn't write CNF file " + cnfFile, e);
            }
            List<String> command = new ArrayList<>();
            command.add(executable);
            command.add(cnfFile.toString());
            CommandResult result;
            try {
                result = FileTools.runCommand(command, Params.isVerbose(), workDir.toFile(), timeoutSeconds);
            } catch (UncheckedIOException e) {
                throw new SolverException("Couldn't run the SAT solver '" + executable + "', set "
                        + Params.CW_SAT_SOLVER_NAME + " to its location", e);
            }
            if (result.isTimedOut()) {
                throw new SolverException("SAT solver " + executable + " exceeded the time limit of "
                        + timeoutSeconds + "s");
            }
            int exit = result.getExitCode();
            if (exit != 0 && exit != EXIT_SATISFIABLE && exit != EXIT_UNSATISFIABLE) {
                throw new SolverException("SAT solver " + executable + " failed with exit code " + exit
                        + ": " + String.join("\n", result.getErrorOutput()));
            }
            return parseOutput(result.getOutput(), cnf.getNumVariables());
        } finally {
            FileTools.deleteFolder(workDir.toString());
        }
    }

    /**
     * Parses the output of a competition-format solver.
     * @param lines The solver's standard output.
     * @param numVariables Number of variables in the formula.
     * @throws SolverException if there is no status line or the status is UNKNOWN.
     */
    public static SolverResult parseOutput(List<String> lines, int numVariables) {
        String status = null;
        boolean[] model = new boolean[numVariables + 1];
        for (String line : lines) {
            line = line.trim();
            if (line.startsWith("s ")) {
                status = line.substring(2).trim();
            } else if (line.startsWith("v ")) {
                for (String tok : line.substring(2).trim().split("\\s+")) {
                    if (tok.isEmpty()) continue;
                    int lit;
                    try {
                        lit = Integer.parseInt(tok);
                    } catch (NumberFormatException e) {
                        throw new SolverException("Malformed model line: " + line, e);
                    }
                    int v = Math.abs(lit);
                    if (v != 0 && v <= numVariables) {
                        model[v] = lit > 0;
                    }
                }
            }
        }
        if ("SATISFIABLE".equals(status)) {
            return SolverResult.satisfiable(model);
        } else if ("UNSATISFIABLE".equals(status)) {
            return SolverResult.unsatisfiable();
        }
        throw new SolverException("SAT solver gave no answer" + (status == null ? "" : " (" + status + ")"));
    }
}
