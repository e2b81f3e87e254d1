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

import java.util.ArrayList;
import java.util.List;

import com.circuitwright.verilog.VerilogToken.Kind;

/**
 * Splits Verilog source text into tokens. Comments, compiler directives
 * (`timescale, `define, ... up to the end of their line) and attribute
 * instances {@code (* ... *)} are dropped. Identifiers keep their case;
 * escaped identifiers are returned without the leading backslash.
 */
public class VerilogTokenizer {

    private static final String[] MULTI_CHAR_SYMBOLS = {
        "===", "!==", "<<<", ">>>",
        "~^", "^~", "~&", "~|", "&&", "||", "==", "!=", "<=", ">=", "<<", ">>", "**", "->", "+:", "-:",
    };

    private static final String SINGLE_CHAR_SYMBOLS = "()[]{},;:.=?@#~&|^!<>+-*/%";

    private final String text;
    private int offset = 0;
    private int line = 1;
    private int column = 1;

    public VerilogTokenizer(String text) {
        this.text = text;
    }

    /**
     * Tokenizes the whole text.
     * @return All tokens, terminated by a single {@link Kind#EOF} token.
     * @throws VerilogParseException on an unterminated comment or attribute,
     *         or a character that cannot start a token.
     */
    public List<VerilogToken> tokenize() {
        List<VerilogToken> tokens = new ArrayList<>();
        VerilogToken t;
        do {
            t = getNextToken();
            tokens.add(t);
        } while (t.kind != Kind.EOF);
        return tokens;
    }

    /**
     * Reads the next token.
     * @return The next token, or an {@link Kind#EOF} token at the end of the text.
     */
    public VerilogToken getNextToken() {
        skipIgnorable();
        int startLine = line;
        int startColumn = column;
        if (offset >= text.length()) {
            return new VerilogToken(Kind.EOF, "", startLine, startColumn, false);
        }
        char c = text.charAt(offset);
        if (c == '\\') {
            advance();
            int start = offset;
            while (offset < text.length() && !Character.isWhitespace(text.charAt(offset))) {
                advance();
            }
            if (start == offset) {
                throw new VerilogParseException("Parsing Error: Empty escaped identifier", startLine, startColumn);
            }
            return new VerilogToken(Kind.IDENTIFIER, text.substring(start, offset), startLine, startColumn, true);
        }
        if (Character.isLetter(c) || c == '_' || c == '$') {
            int start = offset;
            while (offset < text.length() && isIdentifierPart(text.charAt(offset))) {
                advance();
            }
            return new VerilogToken(Kind.IDENTIFIER, text.substring(start, offset), startLine, startColumn, false);
        }
        if (Character.isDigit(c) || c == '\'') {
            return new VerilogToken(Kind.NUMBER, readNumber(startLine, startColumn), startLine, startColumn, false);
        }
        for (String sym : MULTI_CHAR_SYMBOLS) {
            if (text.startsWith(sym, offset)) {
                for (int i = 0; i < sym.length(); i++) advance();
                return new VerilogToken(Kind.SYMBOL, sym, startLine, startColumn, false);
            }
        }
        if (SINGLE_CHAR_SYMBOLS.indexOf(c) >= 0) {
            advance();
            return new VerilogToken(Kind.SYMBOL, String.valueOf(c), startLine, startColumn, false);
        }
        throw new VerilogParseException("Parsing Error: Unexpected character '" + c + "'", startLine, startColumn);
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private String readNumber(int startLine, int startColumn) {
        StringBuilder sb = new StringBuilder();
        while (offset < text.length() && (Character.isDigit(text.charAt(offset)) || text.charAt(offset) == '_')) {
            sb.append(text.charAt(offset));
            advance();
        }
        // Size and base may be separated by white space
        int save = offset, saveLine = line, saveColumn = column;
        skipWhitespace();
        if (offset < text.length() && text.charAt(offset) == '\'') {
            sb.append('\'');
            advance();
            if (offset < text.length() && (text.charAt(offset) == 's' || text.charAt(offset) == 'S')) {
                advance();
            }
            if (offset >= text.length() || "bBoOdDhH".indexOf(text.charAt(offset)) < 0) {
                throw new VerilogParseException("Parsing Error: Malformed based number", startLine, startColumn);
            }
            sb.append(Character.toLowerCase(text.charAt(offset)));
            advance();
            skipWhitespace();
            int start = offset;
            while (offset < text.length() && "0123456789abcdefABCDEFxXzZ?_".indexOf(text.charAt(offset)) >= 0) {
                advance();
            }
            if (start == offset) {
                throw new VerilogParseException("Parsing Error: Based number without digits", startLine, startColumn);
            }
            sb.append(text, start, offset);
        } else {
            offset = save;
            line = saveLine;
            column = saveColumn;
        }
        return sb.toString();
    }

    private void skipWhitespace() {
        while (offset < text.length() && Character.isWhitespace(text.charAt(offset))) {
            advance();
        }
    }

    private void skipIgnorable() {
        while (offset < text.length()) {
            char c = text.charAt(offset);
            if (Character.isWhitespace(c)) {
                advance();
            } else if (text.startsWith("//", offset)) {
                while (offset < text.length() && text.charAt(offset) != '\n') advance();
            } else if (text.startsWith("/*", offset)) {
                skipPast("*/", "block comment");
            } else if (text.startsWith("(*", offset) && !isEventStar()) {
                skipPast("*)", "attribute");
            } else if (c == '`') {
                while (offset < text.length() && text.charAt(offset) != '\n') advance();
            } else {
                return;
            }
        }
    }

    /** Distinguishes {@code @(*)} from the start of an attribute */
    private boolean isEventStar() {
        int i = offset + 2;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) i++;
        return i < text.length() && text.charAt(i) == ')';
    }

    private void skipPast(String end, String what) {
        int startLine = line, startColumn = column;
        advance();
        advance();
        while (offset < text.length() && !text.startsWith(end, offset)) {
            advance();
        }
        if (offset >= text.length()) {
            throw new VerilogParseException("Parsing Error: Unterminated " + what, startLine, startColumn);
        }
        advance();
        advance();
    }

    private void advance() {
        if (text.charAt(offset) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        offset++;
    }
}
