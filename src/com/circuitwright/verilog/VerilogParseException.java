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

/**
 * Thrown when Verilog text is malformed. The message carries the location of
 * the offending token.
 */
public class VerilogParseException extends RuntimeException {

    private static final long serialVersionUID = 4402187763530975521L;

    private final int line;
    private final int column;

    public VerilogParseException(String message, int line, int column) {
        super(message + " (line " + line + ", column " + column + ")");
        this.line = line;
        this.column = column;
    }

    public VerilogParseException(String message, VerilogToken token) {
        this(message, token.line, token.column);
    }

    public static VerilogParseException unexpectedEOF(VerilogToken token) {
        return new VerilogParseException("Parsing Error: Unexpected end of file", token);
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
