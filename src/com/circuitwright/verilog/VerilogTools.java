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

import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;

import com.circuitwright.circuit.BlackBox;
import com.circuitwright.circuit.Circuit;
import com.circuitwright.util.FileTools;

/**
 * Convenience entry points for reading and writing structural Verilog.
 */
public class VerilogTools {

    public static final String VERILOG_EXTENSION = ".v";

    /**
     * Parses the top module of Verilog text.
     */
    public static Circuit parseVerilog(String text) {
        return new VerilogParser(text).parse();
    }

    /**
     * Parses the top module of Verilog text.
     * @param blackBoxes Definitions for instantiated modules, see {@link VerilogParser}.
     */
    public static Circuit parseVerilog(String text, Collection<BlackBox> blackBoxes) {
        return new VerilogParser(text, blackBoxes).parse();
    }

    /**
     * Parses the named module of Verilog text.
     */
    public static Circuit parseVerilog(String text, String module, Collection<BlackBox> blackBoxes) {
        return new VerilogParser(text, blackBoxes).parse(module);
    }

    public static Circuit readVerilogFile(String fileName) {
        return readVerilogFile(fileName, Collections.emptyList());
    }

    public static Circuit readVerilogFile(Path path) {
        return readVerilogFile(path.toString(), Collections.emptyList());
    }

    /**
     * Reads a Verilog file and elaborates its top module.
     * @param fileName Name of the file.
     * @param blackBoxes Definitions for instantiated modules.
     * @return The circuit of the top module.
     */
    public static Circuit readVerilogFile(String fileName, Collection<BlackBox> blackBoxes) {
        return parseVerilog(FileTools.readTextFile(fileName), blackBoxes);
    }

    /**
     * Reads a Verilog file and elaborates every module in it.
     * @return Circuits keyed by module name.
     */
    public static Map<String, Circuit> readVerilogFileAll(String fileName, Collection<BlackBox> blackBoxes) {
        return new VerilogParser(FileTools.readTextFile(fileName), blackBoxes).parseAll();
    }

    /**
     * Gets the circuit as Verilog text, including an empty module for each
     * blackbox definition.
     */
    public static String toVerilog(Circuit c) {
        return new VerilogWriter(c).toVerilog();
    }

    public static void writeVerilogFile(Circuit c, String fileName) {
        FileTools.writeStringToTextFile(toVerilog(c), fileName);
    }

    public static void writeVerilogFile(Circuit c, Path path) {
        writeVerilogFile(c, path.toString());
    }
}
