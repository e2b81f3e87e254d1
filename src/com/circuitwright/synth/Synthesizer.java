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

package com.circuitwright.synth;

import com.circuitwright.circuit.Circuit;

/**
 * Logic optimization of a circuit by an external tool.
 */
public interface Synthesizer {

    /**
     * Optimizes a circuit. The result has the same inputs, outputs and
     * blackbox instances, and computes the same output functions.
     * @param c The circuit, left unchanged.
     * @return A new circuit.
     * @throws SynthesisException if the tool fails.
     */
    Circuit synthesize(Circuit c);
}
