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
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import com.circuitwright.util.FileTools;
import com.circuitwright.util.FileTools.CommandResult;
import com.circuitwright.util.Params;

/**
 * Approximate projected model counting with the ApproxMC executable. The
 * projection is passed as {@code c ind} lines in the DIMACS file.
 */
public class ApproxMcCounter implements ApproxModelCounter {

    private final String executable;

    private final int timeoutSeconds;

    /** Decides formulas with an empty projection, which have a count of 0 or 1 */
    private final SatSolver satSolver;

    public ApproxMcCounter(SatSolver satSolver) {
        this(Params.getApproxMcExecutable(), Params.getSolverTimeoutSeconds(), satSolver);
    }

    public ApproxMcCounter(String executable, int timeoutSeconds, SatSolver satSolver) {
        this.executable = executable;
        this.timeoutSeconds = timeoutSeconds;
        this.satSolver = satSolver;
    }

    @Override
    public BigInteger count(Cnf cnf, int[] assumptions, Collection<Integer> projection, double epsilon,
            double delta) {
        if (epsilon <= 0) {
            throw new IllegalArgumentException("epsilon must be positive, got " + epsilon);
        }
        if (delta <= 0 || delta >= 1) {
            throw new IllegalArgumentException("delta must be in (0, 1), got " + delta);
        }
        if (projection.isEmpty()) {
            return satSolver.solve(cnf, assumptions).isSatisfiable() ? BigInteger.ONE : BigInteger.ZERO;
        }
        Path workDir = FileTools.createTempWorkDir("cw_approxmc");
        try {
            Path cnfFile = workDir.resolve("formula.cnf");
            try (BufferedWriter bw = Files.newBufferedWriter(cnfFile, StandardCharsets.UTF_8)) {
                cnf.writeDimacs(bw, assumptions, projection);
            } catch (IOException e) {
                throw new UncheckedIOException("ERROR: Couldn't write CNF file " + cnfFile, e);
            }
            List<String> command = new ArrayList<>();
            command.add(executable);
            command.add("--epsilon");
            command.add(Double.toString(epsilon));
            command.add("--delta");
            command.add(Double.toString(delta));
            command.add(cnfFile.toString());
            CommandResult result;
            try {
                result = FileTools.runCommand(command, Params.isVerbose(), workDir.toFile(), timeoutSeconds);
            } catch (UncheckedIOException e) {
                throw new SolverException("Couldn't run the model counter '" + executable + "', set "
                        + Params.CW_APPROXMC_NAME + " to its location", e);
            }
            if (result.isTimedOut()) {
                throw new SolverException("Model counter " + executable + " exceeded the time limit of "
                        + timeoutSeconds + "s");
            }
            return parseOutput(result.getOutput());
        } finally {
            FileTools.deleteFolder(workDir.toString());
        }
    }

    /**
     * Reads the estimate from the counter's {@code s mc} line.
     * @throws SolverException if no count is reported.
     */
    public static BigInteger parseOutput(List<String> lines) {
        for (String line : lines) {
            line = line.trim();
            if (line.startsWith("s mc ")) {
                try {
                    return new BigInteger(line.substring(5).trim());
                } catch (NumberFormatException e) {
                    throw new SolverException("Malformed count line: " + line, e);
                }
            }
            if (line.equals("s UNSATISFIABLE")) {
                return BigInteger.ZERO;
            }
        }
        throw new SolverException("Model counter produced no count");
    }
}
