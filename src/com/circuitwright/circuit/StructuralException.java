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

package com.circuitwright.circuit;

/**
 * Thrown when an operation on a {@link Circuit} would break one of its
 * structural invariants (unique names, arity, single drivers, blackbox pin
 * rules, combinational cycles).
 */
public class StructuralException extends RuntimeException {

    private static final long serialVersionUID = -2915287411733409874L;

    public StructuralException(String message) {
        super(message);
    }
}
