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
 * Thrown when Verilog text is well formed but uses a construct outside the
 * structural subset this parser materializes.
 */
public class UnsupportedConstructException extends RuntimeException {

    private static final long serialVersionUID = -6011493650276312874L;

    private final String construct;
    private final int line;

    public UnsupportedConstructException(String construct, int line) {
        super("Unsupported construct: " + construct + " (line " + line + ")");
        this.construct = construct;
        this.line = line;
    }

    public String getConstruct() {
        return construct;
    }

    public int getLine() {
        return line;
    }
}
