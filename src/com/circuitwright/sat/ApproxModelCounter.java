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
 * A probabilistic approximate projected model counter.
 */
public interface ApproxModelCounter {

    /**
     * Estimates the projected model count. With probability at least
     * {@code 1 - delta} the estimate is within a factor {@code 1 + epsilon} of
     * the exact count.
     * @param cnf The formula, left unchanged.
     * @param assumptions Literals that must hold, may be empty.
     * @param projection Variables to count over.
     * @param epsilon Tolerance, greater than 0.
     * @param delta Confidence parameter, between 0 and 1.
     * @return The estimate.
     * @throws SolverException if the oracle fails or runs out of time.
     */
    BigInteger count(Cnf cnf, int[] assumptions, Collection<Integer> projection, double epsilon, double delta);
}
