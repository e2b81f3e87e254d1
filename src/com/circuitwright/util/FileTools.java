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

package com.circuitwright.util;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.management.ManagementFactory;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * A collection of methods to operate on files and external processes.
 */
public class FileTools {

    /**
     * Outcome of an external command run with {@link #runCommand(List, boolean, File, int)}.
     */
    public static class CommandResult {
        private final Integer exitCode;
        private final List<String> output;
        private final List<String> errorOutput;

        public CommandResult(Integer exitCode, List<String> output, List<String> errorOutput) {
            this.exitCode = exitCode;
            this.output = output;
            this.errorOutput = errorOutput;
        }

        /**
         * @return The exit code of the process, or null if it was killed because it
         *         exceeded its time limit.
         */
        public Integer getExitCode() {
            return exitCode;
        }

        public boolean isTimedOut() {
            return exitCode == null;
        }

        /** Lines the process wrote to its standard out */
        public List<String> getOutput() {
            return output;
        }

        /** Lines the process wrote to its standard error */
        public List<String> getErrorOutput() {
            return errorOutput;
        }
    }

    /**
     * Writes the provided text to the file, replacing any previous contents.
     * @param text The text to write.
     * @param fileName Name of the file to write.
     */
    public static void writeStringToTextFile(String text, String fileName) {
        try (BufferedWriter bw = Files.newBufferedWriter(Paths.get(fileName), StandardCharsets.UTF_8)) {
            bw.write(text);
        } catch (IOException e) {
            throw new UncheckedIOException("Error writing file: " + fileName + " " + e.getMessage(), e);
        }
    }

    /**
     * Reads an entire text file into a string.
     * @param fileName Name of the text file to load.
     * @return The file contents.
     */
    public static String readTextFile(String fileName) {
        try {
            return new String(Files.readAllBytes(Paths.get(fileName)), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Could not read from file: " + fileName, e);
        }
    }

    /**
     * This is a simple method that will read in a text file and put each line in a
     * string and put all the lines in a list.
     * @param fileName Name of the text file to load.
     * @return A list containing strings of each line in the file.
     */
    public static List<String> getLinesFromTextFile(String fileName) {
        try {
            return new ArrayList<>(Files.readAllLines(Paths.get(fileName), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Could not read from file: " + fileName, e);
        }
    }

    /**
     * Creates a fresh temporary work directory with the given prefix.
     */
    public static Path createTempWorkDir(String prefix) {
        try {
            return Files.createTempDirectory(prefix + getUniqueProcessAndHostID().replace('@', '_'));
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Could not create a temporary directory", e);
        }
    }

    /**
     * Delete the folder and recursively files and folders below
     * @param folderName
     * @return true for successful deletion, false otherwise
     */
    public static boolean deleteFolder(String folderName) {
        File f = new File(folderName);

        if (!f.exists() || !f.isDirectory()) {
            MessageGenerator.briefError("WARNING: Attempted to delete folder " + folderName + " but it wasn't there.");
            return false;
        }

        for (File i: f.listFiles()) {
            if (i.isDirectory()) {
                deleteFolder(i.getAbsolutePath());
            } else if (i.isFile()) {
                if (!i.delete()) {
                    throw new IllegalArgumentException("Delete: deletion failed: " + i.getAbsolutePath());
                }
            }
        }
        return f.delete();
    }

    /**
     * A generic method to run a command from the system command line.
     * 
     * @param command The command and its arguments. This method blocks until the
     *                command finishes or the time limit is reached.
     * @param verbose When true, it will first print to std.out the command and also
     *                all of the command's output (both std.out and std.err) to
     *                std.out.
     * @param runDir  the working directory of the subprocess, or null if the
     *                subprocess should inherit the working directory of the current
     *                process.
     * @param timeoutSeconds Wall-clock limit in seconds, 0 or less for none. A
     *                process that exceeds it is killed.
     * @return The exit code and the captured output of the process.
     */
    public static CommandResult runCommand(List<String> command, boolean verbose, File runDir, int timeoutSeconds) {
        if (verbose) System.out.println(String.join(" ", command));
        ProcessBuilder pb = new ProcessBuilder(command);
        if (runDir != null) pb.directory(runDir);
        Process p = null;
        try {
            p = pb.start();
            StreamGobbler input = new StreamGobbler(p.getInputStream(), verbose);
            StreamGobbler err = new StreamGobbler(p.getErrorStream(), verbose);
            input.start();
            err.start();
            Integer returnValue;
            if (timeoutSeconds > 0) {
                returnValue = p.waitFor(timeoutSeconds, TimeUnit.SECONDS) ? p.exitValue() : null;
            } else {
                returnValue = p.waitFor();
            }
            if (returnValue == null) {
                p.destroyForcibly();
            }
            input.join();
            err.join();
            return new CommandResult(returnValue, input.getLines(), err.getLines());
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: In running the command \"" + command.get(0) + "\"", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("ERROR: The command was interrupted: \"" + command.get(0) + "\"", e);
        } finally {
            if (p != null) p.destroyForcibly();
        }
    }

    /**
     * Checks if the named executable can be found on the current PATH, or is
     * itself a path to an executable file.
     * @param execName Name of the executable
     * @return true if the executable was found, false otherwise.
     */
    public static boolean isExecutableOnPath(String execName) {
        if (execName.contains(File.separator)) {
            return Files.isExecutable(Paths.get(execName));
        }
        String path = System.getenv("PATH");
        if (path == null) return false;
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.isEmpty()) continue;
            if (Files.isExecutable(Paths.get(dir, execName))) {
                return true;
            }
        }
        return false;
    }

    public static String getUniqueProcessAndHostID() {
        return ManagementFactory.getRuntimeMXBean().getName() + "_" + Thread.currentThread().getId();
    }
}
