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
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.circuitwright.circuit.BlackBox;
import com.circuitwright.circuit.Circuit;
import com.circuitwright.circuit.GateType;
import com.circuitwright.verilog.VerilogModule.Direction;
import com.circuitwright.verilog.VerilogToken.Kind;

/**
 * Hand-written recursive descent parser for structural Verilog. The text may
 * hold several modules; each requested module is elaborated into its own
 * {@link Circuit}. Instances of modules other than the elaborated one are
 * never inlined: they become blackboxes whose definition comes from, in order,
 * the caller-supplied {@link BlackBox}es, the built-in {@link BlackBox#DFF},
 * the module's header elsewhere in the same text, or, failing all of those,
 * inference from the instance's connections.
 */
public class VerilogParser {

    public static final String MODULE = "module";
    public static final String ENDMODULE = "endmodule";
    public static final String INPUT = "input";
    public static final String OUTPUT = "output";
    public static final String INOUT = "inout";
    public static final String WIRE = "wire";
    public static final String REG = "reg";
    public static final String ASSIGN = "assign";
    public static final String ALWAYS = "always";
    public static final String POSEDGE = "posedge";
    public static final String BEGIN = "begin";
    public static final String END = "end";

    private static final Map<String, String> UNSUPPORTED_ITEMS = new HashMap<>();

    private static final Map<String, String> UNSUPPORTED_OPERATORS = new HashMap<>();

    private static final Set<String> STRENGTHS = new HashSet<>(Arrays.asList(
            "supply0", "strong0", "pull0", "weak0", "highz0",
            "supply1", "strong1", "pull1", "weak1", "highz1"));

    static {
        for (String s : Arrays.asList("generate", "genvar", "endgenerate")) UNSUPPORTED_ITEMS.put(s, "generate block");
        UNSUPPORTED_ITEMS.put("initial", "initial block");
        UNSUPPORTED_ITEMS.put("function", "function");
        UNSUPPORTED_ITEMS.put("task", "task");
        for (String s : Arrays.asList("parameter", "localparam", "defparam")) UNSUPPORTED_ITEMS.put(s, "parameter");
        UNSUPPORTED_ITEMS.put("specify", "specify block");
        for (String s : Arrays.asList("integer", "real", "time", "event", "realtime")) {
            UNSUPPORTED_ITEMS.put(s, "variable declaration '" + s + "'");
        }
        for (String s : Arrays.asList("supply0", "supply1", "tri", "tri0", "tri1", "wand", "wor", "triand", "trior")) {
            UNSUPPORTED_ITEMS.put(s, "net type '" + s + "'");
        }
        for (String s : Arrays.asList("bufif0", "bufif1", "notif0", "notif1", "nmos", "pmos", "cmos", "rnmos",
                "rpmos", "rcmos", "tran", "tranif0", "tranif1", "rtran", "rtranif0", "rtranif1", "pullup",
                "pulldown")) {
            UNSUPPORTED_ITEMS.put(s, "tristate or switch primitive '" + s + "'");
        }
        UNSUPPORTED_ITEMS.put(INOUT, "inout port");

        for (String s : Arrays.asList("&&", "||")) UNSUPPORTED_OPERATORS.put(s, "logical operator '" + s + "'");
        for (String s : Arrays.asList("==", "!=", "===", "!==", "<", ">", "<=", ">=")) {
            UNSUPPORTED_OPERATORS.put(s, "comparison operator '" + s + "'");
        }
        for (String s : Arrays.asList("+", "-", "*", "/", "%", "**", "<<", ">>", "<<<", ">>>")) {
            UNSUPPORTED_OPERATORS.put(s, "arithmetic operator '" + s + "'");
        }
    }

    private final List<VerilogToken> tokens;

    private int pos = 0;

    private final Map<String, BlackBox> blackBoxes = new LinkedHashMap<>();

    private final Map<String, VerilogModule> modules = new LinkedHashMap<>();

    private VerilogModule current;

    /**
     * Tokenizes and parses the text. Modules are only checked for syntax here;
     * they are elaborated on request.
     * @param text Verilog source holding one or more modules.
     * @throws VerilogParseException on malformed syntax.
     * @throws UnsupportedConstructException on constructs outside the subset.
     */
    public VerilogParser(String text) {
        this(text, Collections.emptyList());
    }

    /**
     * @param text Verilog source holding one or more modules.
     * @param blackBoxes Definitions to use for instances of the named modules,
     *                   taking precedence over any other definition.
     */
    public VerilogParser(String text, Collection<BlackBox> blackBoxes) {
        for (BlackBox bb : blackBoxes) {
            this.blackBoxes.put(bb.getName(), bb);
        }
        this.tokens = new VerilogTokenizer(text).tokenize();
        while (peek().kind != Kind.EOF) {
            VerilogToken t = next();
            if (t.isKeyword(MODULE) || t.isKeyword("macromodule")) {
                VerilogModule m = parseModule();
                if (modules.put(m.name, m) != null) {
                    throw new VerilogParseException("Parsing Error: Module " + m.name + " is defined twice", t);
                }
            } else if (t.isKeyword("primitive")) {
                throw new UnsupportedConstructException("user-defined primitive", t.line);
            } else {
                throw new VerilogParseException("Parsing Error: Expected token: " + MODULE + ", encountered: " + t, t);
            }
        }
    }

    /**
     * Gets the names of all modules in the text, in order of definition.
     */
    public List<String> getModuleNames() {
        return new ArrayList<>(modules.keySet());
    }

    /**
     * Determines the top module: the only module of the text, or else the only
     * one not instantiated by another module.
     * @throws VerilogParseException if there is no module or the choice is ambiguous.
     */
    public String getTopModuleName() {
        if (modules.isEmpty()) {
            throw new VerilogParseException("Parsing Error: No module found", 1, 1);
        }
        if (modules.size() == 1) {
            return modules.keySet().iterator().next();
        }
        Set<String> candidates = new HashSet<>(modules.keySet());
        for (VerilogModule m : modules.values()) {
            for (String inst : m.getInstantiatedModules()) {
                if (!inst.equals(m.name)) candidates.remove(inst);
            }
        }
        if (candidates.size() != 1) {
            throw new VerilogParseException("Parsing Error: Cannot determine the top module among "
                    + modules.keySet() + ", please name one", 1, 1);
        }
        return candidates.iterator().next();
    }

    /**
     * Elaborates the top module.
     * @see #getTopModuleName()
     */
    public Circuit parse() {
        return parse(getTopModuleName());
    }

    /**
     * Elaborates the named module into a circuit.
     * @throws VerilogParseException if there is no such module.
     */
    public Circuit parse(String moduleName) {
        VerilogModule m = modules.get(moduleName);
        if (m == null) {
            throw new VerilogParseException("Parsing Error: Module " + moduleName + " not found, available: "
                    + modules.keySet(), 1, 1);
        }
        return new VerilogElaborator(m, getDefinitions(m)).elaborate();
    }

    /**
     * Elaborates every module of the text.
     * @return Circuits keyed by module name, in order of definition.
     */
    public Map<String, Circuit> parseAll() {
        Map<String, Circuit> result = new LinkedHashMap<>();
        for (String name : modules.keySet()) {
            result.put(name, parse(name));
        }
        return result;
    }

    private Map<String, BlackBoxPorts> getDefinitions(VerilogModule top) {
        Map<String, BlackBoxPorts> defs = new HashMap<>();
        for (VerilogModule m : modules.values()) {
            if (m != top) {
                defs.put(m.name, BlackBoxPorts.of(m, isSequential(m.name, new HashSet<>())));
            }
        }
        defs.put(BlackBox.DFF.getName(), BlackBoxPorts.of(BlackBox.DFF));
        for (BlackBox bb : blackBoxes.values()) {
            defs.put(bb.getName(), BlackBoxPorts.of(bb));
        }
        return defs;
    }

    /**
     * A module of the text is sequential if it holds a flip-flop or
     * instantiates a sequential module.
     */
    private boolean isSequential(String module, Set<String> visiting) {
        BlackBox supplied = blackBoxes.get(module);
        if (supplied != null) return supplied.isSequential();
        if (module.equals(BlackBox.DFF.getName()) && !modules.containsKey(module)) return true;
        VerilogModule m = modules.get(module);
        if (m == null || !visiting.add(module)) return false;
        if (m.hasFlipFlops()) return true;
        for (String inst : m.getInstantiatedModules()) {
            if (isSequential(inst, visiting)) return true;
        }
        return false;
    }

    //------------------------------------------------------------------------
    // Module structure
    //------------------------------------------------------------------------

    private VerilogModule parseModule() {
        VerilogToken nameToken = peek();
        current = new VerilogModule(expectIdentifier(), nameToken.line);
        if (peek().isSymbol("#")) {
            throw new UnsupportedConstructException("parameter", peek().line);
        }
        if (accept("(")) {
            if (!accept(")")) {
                if (peek().isKeyword(INPUT) || peek().isKeyword(OUTPUT) || peek().isKeyword(INOUT)) {
                    parseAnsiPorts();
                } else {
                    parseLegacyPorts();
                }
            }
        }
        expect(";");
        while (true) {
            VerilogToken t = peek();
            if (t.kind == Kind.EOF) {
                throw VerilogParseException.unexpectedEOF(t);
            }
            if (t.isKeyword(ENDMODULE)) {
                next();
                break;
            }
            parseModuleItem();
        }
        return current;
    }

    private void parseLegacyPorts() {
        while (true) {
            VerilogToken t = peek();
            if (t.isSymbol(".") || t.isSymbol("{")) {
                throw new UnsupportedConstructException("port expression", t.line);
            }
            current.ports.add(expectIdentifier());
            if (accept(",")) continue;
            expect(")");
            return;
        }
    }

    private void parseAnsiPorts() {
        Direction dir = null;
        int[] range = null;
        while (true) {
            VerilogToken t = peek();
            if (t.isKeyword(INOUT)) {
                throw new UnsupportedConstructException("inout port", t.line);
            }
            if (t.isKeyword(INPUT) || t.isKeyword(OUTPUT)) {
                next();
                dir = t.isKeyword(INPUT) ? Direction.INPUT : Direction.OUTPUT;
                if (!accept(WIRE)) accept(REG);
                accept("signed");
                range = peek().isSymbol("[") ? parseRange() : null;
            } else if (dir == null) {
                throw new VerilogParseException("Parsing Error: Expected port direction, encountered: " + t, t);
            }
            VerilogToken nameToken = peek();
            String name = expectIdentifier();
            declare(name, dir, range, nameToken);
            current.ports.add(name);
            if (accept(",")) continue;
            expect(")");
            return;
        }
    }

    private void parseModuleItem() {
        VerilogToken t = peek();
        if (t.kind != Kind.IDENTIFIER) {
            throw new VerilogParseException("Parsing Error: Expected a module item, encountered: " + t, t);
        }
        String unsupported = t.escaped ? null : UNSUPPORTED_ITEMS.get(t.text);
        if (unsupported != null) {
            throw new UnsupportedConstructException(unsupported, t.line);
        }
        GateType primitive = t.escaped ? null : GateType.fromVerilogPrimitive(t.text);
        if (t.isKeyword(INPUT)) {
            parseDeclaration(Direction.INPUT);
        } else if (t.isKeyword(OUTPUT)) {
            parseDeclaration(Direction.OUTPUT);
        } else if (t.isKeyword(WIRE) || t.isKeyword(REG) || t.isKeyword("logic")) {
            parseDeclaration(Direction.WIRE);
        } else if (t.isKeyword(ASSIGN)) {
            parseAssign();
        } else if (primitive != null) {
            parseGate(primitive);
        } else if (t.isKeyword(ALWAYS) || t.isKeyword("always_ff") || t.isKeyword("always_comb")) {
            parseAlways();
        } else if (peek(1).kind == Kind.IDENTIFIER || peek(1).isSymbol("#")) {
            parseModuleInstance();
        } else {
            throw new VerilogParseException("Parsing Error: Unexpected token " + t, t);
        }
    }

    private void parseDeclaration(Direction dir) {
        next();
        if (dir != Direction.WIRE) {
            if (!accept(WIRE)) accept(REG);
        }
        accept("signed");
        int[] range = peek().isSymbol("[") ? parseRange() : null;
        while (true) {
            VerilogToken nameToken = peek();
            String name = expectIdentifier();
            if (peek().isSymbol("[")) {
                throw new UnsupportedConstructException("memory array", peek().line);
            }
            declare(name, dir, range, nameToken);
            if (accept("=")) {
                VerilogExpr rhs = parseExpression();
                current.statements.add(new VerilogModule.Assign(VerilogExpr.identifier(name, nameToken.line), rhs,
                        nameToken.line));
            }
            if (accept(",")) continue;
            expect(";");
            return;
        }
    }

    private void declare(String name, Direction dir, int[] range, VerilogToken at) {
        current.identifiers.add(name);
        VerilogModule.NetDecl existing = current.nets.get(name);
        if (existing == null) {
            current.nets.put(name, new VerilogModule.NetDecl(name, dir, range != null,
                    range == null ? 0 : range[0], range == null ? 0 : range[1], at.line));
            return;
        }
        if (dir != Direction.WIRE) {
            if (existing.direction != Direction.WIRE && existing.direction != dir) {
                throw new VerilogParseException("Parsing Error: Conflicting directions for '" + name + "'", at);
            }
            existing.direction = dir;
        }
        if (range != null) {
            if (existing.vector && (existing.msb != range[0] || existing.lsb != range[1])) {
                throw new VerilogParseException("Parsing Error: Conflicting ranges for '" + name + "'", at);
            }
            existing.vector = true;
            existing.msb = range[0];
            existing.lsb = range[1];
        }
    }

    private int[] parseRange() {
        expect("[");
        int msb = parseInteger();
        expect(":");
        int lsb = parseInteger();
        expect("]");
        return new int[] {msb, lsb};
    }

    private int parseInteger() {
        VerilogToken t = next();
        if (t.kind == Kind.IDENTIFIER) {
            throw new UnsupportedConstructException("parameterized index '" + t.text + "'", t.line);
        }
        if (t.kind != Kind.NUMBER) {
            throw new VerilogParseException("Parsing Error: Expected an integer, encountered: " + t, t);
        }
        String bits = VerilogExpr.constant(t).bits;
        if (bits.indexOf('x') >= 0 || bits.length() > 31 && bits.substring(31).indexOf('1') >= 0) {
            throw new VerilogParseException("Parsing Error: Invalid index " + t.text, t);
        }
        int value = 0;
        for (int i = Math.min(bits.length(), 31) - 1; i >= 0; i--) {
            value = (value << 1) | (bits.charAt(i) == '1' ? 1 : 0);
        }
        return value;
    }

    //------------------------------------------------------------------------
    // Statements
    //------------------------------------------------------------------------

    private void parseAssign() {
        next();
        skipStrengthAndDelay();
        while (true) {
            VerilogToken at = peek();
            VerilogExpr lhs = parseLValue("assign left-hand side");
            expect("=");
            VerilogExpr rhs = parseExpression();
            current.statements.add(new VerilogModule.Assign(lhs, rhs, at.line));
            if (accept(",")) continue;
            expect(";");
            return;
        }
    }

    private VerilogExpr parseLValue(String context) {
        VerilogToken t = peek();
        if (t.isSymbol("{")) {
            throw new UnsupportedConstructException("concatenation on " + context, t.line);
        }
        String name = expectIdentifier();
        current.identifiers.add(name);
        if (accept("[")) {
            VerilogToken idx = peek();
            if (idx.kind == Kind.IDENTIFIER) {
                throw new UnsupportedConstructException("variable index on " + context, idx.line);
            }
            int index = parseInteger();
            if (peek().isSymbol(":") || peek().isSymbol("+:") || peek().isSymbol("-:")) {
                throw new UnsupportedConstructException("part-select on " + context, t.line);
            }
            expect("]");
            return VerilogExpr.bitSelect(name, index, t.line);
        }
        return VerilogExpr.identifier(name, t.line);
    }

    private void parseGate(GateType type) {
        VerilogToken keyword = next();
        skipStrengthAndDelay();
        while (true) {
            String instance = null;
            if (peek().kind == Kind.IDENTIFIER) {
                instance = next().text;
                if (peek().isSymbol("[")) {
                    throw new UnsupportedConstructException("instance array", peek().line);
                }
            }
            VerilogToken open = peek();
            expect("(");
            List<VerilogExpr> terminals = new ArrayList<>();
            do {
                terminals.add(parseExpression());
            } while (accept(","));
            expect(")");
            if (terminals.size() < 2) {
                throw new VerilogParseException("Parsing Error: Gate " + keyword.text
                        + " needs an output and at least one input", open);
            }
            current.statements.add(new VerilogModule.GateInstance(type, instance, terminals, open.line));
            if (accept(",")) continue;
            expect(";");
            return;
        }
    }

    private void parseAlways() {
        VerilogToken always = next();
        if (!accept("@") || !accept("(") || !peek().isKeyword(POSEDGE)) {
            throw new UnsupportedConstructException("behavioral always block", always.line);
        }
        next();
        VerilogExpr clock = parseLValue("clock");
        if (peek().isKeyword("or") || peek().isSymbol(",")) {
            throw new UnsupportedConstructException("always block with several events", always.line);
        }
        expect(")");
        boolean block = accept(BEGIN);
        if (block && accept(":")) {
            expectIdentifier();
        }
        while (true) {
            if (block && accept(END)) return;
            VerilogToken t = peek();
            if (t.kind == Kind.IDENTIFIER && !t.escaped && isBehavioralKeyword(t.text)) {
                throw new UnsupportedConstructException("behavioral statement '" + t.text + "' in always block",
                        t.line);
            }
            VerilogExpr q = parseLValue("flip-flop output");
            if (peek().isSymbol("=")) {
                throw new UnsupportedConstructException("blocking assignment in always block", peek().line);
            }
            expect("<=");
            skipStrengthAndDelay();
            VerilogExpr d = parseExpression();
            expect(";");
            current.statements.add(new VerilogModule.FlipFlop(clock, q, d, t.line));
            if (!block) return;
        }
    }

    private static boolean isBehavioralKeyword(String s) {
        switch (s) {
            case "if": case "else": case "case": case "casex": case "casez": case "for": case "while":
            case "repeat": case "forever": case "begin": case "fork": case "wait": case "disable":
                return true;
            default:
                return false;
        }
    }

    private void parseModuleInstance() {
        VerilogToken moduleToken = next();
        if (accept("#")) {
            if (peek().isSymbol("(")) {
                skipBalanced();
            } else {
                next();
            }
        }
        while (true) {
            VerilogToken instToken = peek();
            String instance = expectIdentifier();
            if (peek().isSymbol("[")) {
                throw new UnsupportedConstructException("instance array", peek().line);
            }
            VerilogModule.ModuleInstance mi = new VerilogModule.ModuleInstance(moduleToken.text, instance,
                    instToken.line);
            expect("(");
            if (!accept(")")) {
                if (peek().isSymbol(".")) {
                    parseNamedConnections(mi);
                } else {
                    parsePositionalConnections(mi);
                }
            }
            current.statements.add(mi);
            if (accept(",")) continue;
            expect(";");
            return;
        }
    }

    private void parseNamedConnections(VerilogModule.ModuleInstance mi) {
        while (true) {
            expect(".");
            if (peek().isSymbol("*")) {
                throw new UnsupportedConstructException("wildcard port connection", peek().line);
            }
            VerilogToken portToken = peek();
            String port = expectIdentifier();
            VerilogExpr expr = null;
            if (accept("(")) {
                if (!peek().isSymbol(")")) {
                    expr = parseExpression();
                }
                expect(")");
            } else {
                expr = VerilogExpr.identifier(port, portToken.line);
                current.identifiers.add(port);
            }
            if (mi.named.containsKey(port)) {
                throw new VerilogParseException("Parsing Error: Port '" + port + "' of instance " + mi.instance
                        + " connected twice", portToken);
            }
            mi.named.put(port, expr);
            if (accept(",")) continue;
            expect(")");
            return;
        }
    }

    private void parsePositionalConnections(VerilogModule.ModuleInstance mi) {
        while (true) {
            if (peek().isSymbol(",") || peek().isSymbol(")")) {
                mi.positional.add(null);
            } else {
                mi.positional.add(parseExpression());
            }
            if (accept(",")) continue;
            expect(")");
            return;
        }
    }

    /**
     * Skips drive strengths {@code (strong0, weak1)} and delays {@code #5}, {@code #(1,2)}.
     */
    private void skipStrengthAndDelay() {
        if (peek().isSymbol("(") && STRENGTHS.contains(peek(1).text)) {
            skipBalanced();
        }
        if (accept("#")) {
            if (peek().isSymbol("(")) {
                skipBalanced();
            } else {
                next();
            }
        }
    }

    private void skipBalanced() {
        expect("(");
        int depth = 1;
        while (depth > 0) {
            VerilogToken t = next();
            if (t.isSymbol("(")) depth++;
            else if (t.isSymbol(")")) depth--;
        }
    }

    //------------------------------------------------------------------------
    // Expressions
    //------------------------------------------------------------------------

    private VerilogExpr parseExpression() {
        VerilogExpr cond = parseBinary(0);
        if (accept("?")) {
            VerilogExpr ifTrue = parseExpression();
            expect(":");
            VerilogExpr ifFalse = parseExpression();
            return VerilogExpr.ternary(cond, ifTrue, ifFalse);
        }
        return cond;
    }

    /**
     * Binary operators by increasing precedence: {@code |}, then {@code ^ ~^},
     * then {@code &}.
     */
    private VerilogExpr parseBinary(int level) {
        if (level == 3) {
            return parseUnary();
        }
        VerilogExpr left = parseBinary(level + 1);
        while (true) {
            VerilogToken t = peek();
            GateType op = null;
            if (level == 0 && t.isSymbol("|")) op = GateType.OR;
            else if (level == 1 && t.isSymbol("^")) op = GateType.XOR;
            else if (level == 1 && (t.isSymbol("~^") || t.isSymbol("^~"))) op = GateType.XNOR;
            else if (level == 2 && t.isSymbol("&")) op = GateType.AND;
            if (op == null) return left;
            next();
            left = VerilogExpr.binary(op, left, parseBinary(level + 1));
        }
    }

    private VerilogExpr parseUnary() {
        VerilogToken t = peek();
        VerilogExpr result;
        if (t.isSymbol("~")) {
            next();
            result = VerilogExpr.not(parseUnary());
        } else if (t.isSymbol("!")) {
            throw new UnsupportedConstructException("logical operator '!'", t.line);
        } else if (t.isSymbol("-") || t.isSymbol("+")) {
            throw new UnsupportedConstructException("arithmetic operator '" + t.text + "'", t.line);
        } else if (reductionType(t) != null) {
            next();
            result = VerilogExpr.reduction(reductionType(t), parseUnary());
        } else {
            result = parsePrimary();
        }
        String unsupported = UNSUPPORTED_OPERATORS.get(peek().kind == Kind.SYMBOL ? peek().text : "");
        if (unsupported != null) {
            throw new UnsupportedConstructException(unsupported, peek().line);
        }
        return result;
    }

    private static GateType reductionType(VerilogToken t) {
        if (t.kind != Kind.SYMBOL) return null;
        switch (t.text) {
            case "&": return GateType.AND;
            case "|": return GateType.OR;
            case "^": return GateType.XOR;
            case "~&": return GateType.NAND;
            case "~|": return GateType.NOR;
            case "~^":
            case "^~": return GateType.XNOR;
            default: return null;
        }
    }

    private VerilogExpr parsePrimary() {
        VerilogToken t = next();
        if (t.isSymbol("(")) {
            VerilogExpr e = parseExpression();
            expect(")");
            return e;
        }
        if (t.kind == Kind.NUMBER) {
            return VerilogExpr.constant(t);
        }
        if (t.isSymbol("{")) {
            return parseConcatenation(t);
        }
        if (t.kind == Kind.IDENTIFIER) {
            if (t.text.startsWith("$") && !t.escaped) {
                throw new UnsupportedConstructException("system function " + t.text, t.line);
            }
            if (peek().isSymbol("(")) {
                throw new UnsupportedConstructException("function call " + t.text, t.line);
            }
            current.identifiers.add(t.text);
            if (accept("[")) {
                if (peek().kind == Kind.IDENTIFIER) {
                    throw new UnsupportedConstructException("variable index", t.line);
                }
                int msb = parseInteger();
                if (peek().isSymbol("+:") || peek().isSymbol("-:")) {
                    throw new UnsupportedConstructException("indexed part-select", t.line);
                }
                if (accept(":")) {
                    int lsb = parseInteger();
                    expect("]");
                    return VerilogExpr.partSelect(t.text, msb, lsb, t.line);
                }
                expect("]");
                return VerilogExpr.bitSelect(t.text, msb, t.line);
            }
            return VerilogExpr.identifier(t.text, t.line);
        }
        if (t.kind == Kind.EOF) {
            throw VerilogParseException.unexpectedEOF(t);
        }
        throw new VerilogParseException("Parsing Error: Expected an expression, encountered: " + t, t);
    }

    private VerilogExpr parseConcatenation(VerilogToken open) {
        if (peek().kind == Kind.NUMBER && peek(1).isSymbol("{")) {
            int count = parseInteger();
            next();
            VerilogExpr inner = parseConcatenation(open);
            expect("}");
            List<VerilogExpr> parts = new ArrayList<>();
            for (int i = 0; i < count; i++) parts.add(inner);
            return VerilogExpr.concat(parts, open.line);
        }
        List<VerilogExpr> parts = new ArrayList<>();
        do {
            parts.add(parseExpression());
        } while (accept(","));
        expect("}");
        return VerilogExpr.concat(parts, open.line);
    }

    //------------------------------------------------------------------------
    // Tokens
    //------------------------------------------------------------------------

    private VerilogToken peek() {
        return tokens.get(pos);
    }

    private VerilogToken peek(int ahead) {
        return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
    }

    private VerilogToken next() {
        VerilogToken t = tokens.get(pos);
        if (t.kind == Kind.EOF) {
            throw VerilogParseException.unexpectedEOF(t);
        }
        pos++;
        return t;
    }

    private boolean accept(String text) {
        VerilogToken t = peek();
        if (t.kind != Kind.EOF && !t.escaped && t.text.equals(text)) {
            pos++;
            return true;
        }
        return false;
    }

    private void expect(String expected) {
        VerilogToken t = peek();
        if (t.kind == Kind.EOF) {
            throw VerilogParseException.unexpectedEOF(t);
        }
        if (t.escaped || !t.text.equals(expected)) {
            throw new VerilogParseException("Parsing Error: Expected token: " + expected + ", encountered: " + t, t);
        }
        pos++;
    }

    private String expectIdentifier() {
        VerilogToken t = next();
        if (t.kind != Kind.IDENTIFIER) {
            throw new VerilogParseException("Parsing Error: Expected an identifier, encountered: " + t, t);
        }
        return t.text;
    }
}
