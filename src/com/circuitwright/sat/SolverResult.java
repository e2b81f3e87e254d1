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

/**
 * Outcome of a satisfiability query.
 */
public class SolverResult {

    public enum Status {
        SATISFIABLE,
        UNSATISFIABLE
    }

    private static final SolverResult UNSAT = new SolverResult(Status.UNSATISFIABLE, null);

    private final Status status;

    /** Value of each variable, index 0 unused */
    private final boolean[] model;

    private SolverResult(Status status, boolean[] model) {
        this.status = status;
        this.model = model;
    }

    /**
     * @param model Value of each variable, indexed by variable number (index 0 is unused).
     */
    public static SolverResult satisfiable(boolean[] model) {
        return new SolverResult(Status.SATISFIABLE, model);
    }

    public static SolverResult unsatisfiable() {
        return UNSAT;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSatisfiable() {
        return status == Status.SATISFIABLE;
    }

    /**
     * Gets the value of a variable in the satisfying assignment.
     * @throws IllegalStateException if the result is unsatisfiable.
     */
    public boolean getValue(int variable) {
        if (model == null) {
            throw new IllegalStateException("No model for an unsatisfiable result");
        }
        return model[variable];
    }

    /**
     * Checks whether a literal is true in the satisfying assignment.
     */
    public boolean isTrue(int literal) {
        return literal > 0 ? getValue(literal) : !getValue(-literal);
    }

    @Override
    public String toString() {
        return status.name();
    }
}
