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

import java.util.Objects;

/**
 * A single lexical token of Verilog source with its location.
 */
public class VerilogToken {

    public enum Kind {
        IDENTIFIER,
        NUMBER,
        SYMBOL,
        EOF
    }

    public final Kind kind;
    public final String text;
    public final int line;
    public final int column;
    /** True for identifiers written in escaped form (\name) */
    public final boolean escaped;

    public VerilogToken(Kind kind, String text, int line, int column, boolean escaped) {
        this.kind = kind;
        this.text = Objects.requireNonNull(text);
        this.line = line;
        this.column = column;
        this.escaped = escaped;
    }

    public boolean is(String s) {
        return kind != Kind.EOF && text.equals(s);
    }

    public boolean isSymbol(String s) {
        return kind == Kind.SYMBOL && text.equals(s);
    }

    /**
     * Checks for a keyword. Escaped identifiers never match a keyword.
     */
    public boolean isKeyword(String s) {
        return kind == Kind.IDENTIFIER && !escaped && text.equals(s);
    }

    public String getLocation() {
        return "line " + line + ", column " + column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VerilogToken t = (VerilogToken) o;
        return line == t.line && column == t.column && kind == t.kind && text.equals(t.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, line, column);
    }

    @Override
    public String toString() {
        if (kind == Kind.EOF) return "<end of file>@" + line + ":" + column;
        String displayText = text;
        if (text.length() > 120) {
            displayText = text.substring(0, 100) + "[shortened, length is " + text.length() + "]";
        }
        return (escaped ? "\\" : "") + displayText + "@" + line + ":" + column;
    }
}
