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

import java.math.BigInteger;
import java.util.Collection;

/**
 * An exact projected model counter.
 */
public interface ModelCounter {

    /**
     * Counts the distinct assignments to the projection variables that extend
     * to a model of the formula under the assumptions.
     * @param cnf The formula, left unchanged.
     * @param assumptions Literals that must hold, may be empty.
     * @param projection Variables to count over.
     * @return The count, 0 if unsatisfiable.
     * @throws SolverException if the oracle fails or runs out of time.
     */
    BigInteger count(Cnf cnf, int[] assumptions, Collection<Integer> projection);
}
