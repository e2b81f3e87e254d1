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

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * A formula in conjunctive normal form. Variables are numbered from 1; a
 * literal is a variable number, negative for the negated variable.
 */
public class Cnf {

    private int numVariables;

    private final List<int[]> clauses;

    public Cnf() {
        this.clauses = new ArrayList<>();
    }

    /**
     * Creates an independent copy of another formula.
     */
    public Cnf(Cnf other) {
        this.numVariables = other.numVariables;
        this.clauses = new ArrayList<>(other.clauses);
    }

    /**
     * Allocates a fresh variable.
     * @return The new variable's number.
     */
    public int newVariable() {
        return ++numVariables;
    }

    public int getNumVariables() {
        return numVariables;
    }

    /**
     * Adds a clause, the disjunction of the given literals.
     * @throws IllegalArgumentException if a literal is 0 or names an unallocated variable.
     */
    public void addClause(int... literals) {
        for (int lit : literals) {
            if (lit == 0 || Math.abs(lit) > numVariables) {
                throw new IllegalArgumentException("Invalid literal " + lit + " for a formula with "
                        + numVariables + " variables");
            }
        }
        clauses.add(literals.clone());
    }

    public List<int[]> getClauses() {
        return Collections.unmodifiableList(clauses);
    }

    public int getNumClauses() {
        return clauses.size();
    }

    /**
     * Writes the formula in DIMACS format, with each assumption as a unit clause.
     * @param assumptions Literals to add as unit clauses, may be empty.
     * @param samplingSet Variables to list on {@code c ind} lines for
     *                    projected model counting, or null for none.
     */
    public void writeDimacs(Writer out, int[] assumptions, Collection<Integer> samplingSet) throws IOException {
        if (samplingSet != null && !samplingSet.isEmpty()) {
            StringBuilder sb = new StringBuilder();
            int onLine = 0;
            for (int v : samplingSet) {
                if (onLine == 0) sb.append("c ind");
                sb.append(' ').append(v);
                if (++onLine == 10) {
                    sb.append(" 0\n");
                    onLine = 0;
                }
            }
            if (onLine > 0) sb.append(" 0\n");
            out.write(sb.toString());
        }
        out.write("p cnf " + numVariables + " " + (clauses.size() + assumptions.length) + "\n");
        StringBuilder sb = new StringBuilder();
        for (int[] clause : clauses) {
            sb.setLength(0);
            for (int lit : clause) {
                sb.append(lit).append(' ');
            }
            sb.append("0\n");
            out.write(sb.toString());
        }
        for (int lit : assumptions) {
            out.write(lit + " 0\n");
        }
        out.flush();
    }

    public String toDimacs() {
        StringWriter sw = new StringWriter();
        try {
            writeDimacs(sw, new int[0], null);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return sw.toString();
    }

    @Override
    public String toString() {
        return "Cnf(" + numVariables + " variables, " + clauses.size() + " clauses)";
    }
}
