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

package com.circuitwright.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Simple runtime tracker that reports the wall-clock time of named segments
 * of a command line flow.
 */
public class CodePerfTracker {

    private String name;

    private List<Long> runtimes;

    private List<String> segmentNames;

    private boolean printProgress;

    public CodePerfTracker(String name) {
        this(name, true);
    }

    public CodePerfTracker(String name, boolean printProgress) {
        this.name = name;
        this.printProgress = printProgress;
        runtimes = new ArrayList<>();
        segmentNames = new ArrayList<>();
        if (printProgress && name != null) {
            MessageGenerator.printHeader(name);
        }
    }

    public CodePerfTracker start(String segmentName) {
        segmentNames.add(segmentName);
        runtimes.add(System.nanoTime());
        return this;
    }

    public CodePerfTracker stop() {
        long end = System.nanoTime();
        int idx = runtimes.size()-1;
        if (idx < 0) return this;
        runtimes.set(idx, end - runtimes.get(idx));
        if (printProgress) {
            print(idx);
        }
        return this;
    }

    /**
     * Gets the runtime of a finished segment in nanoseconds.
     */
    public Long getRuntime(String segmentName) {
        int i = segmentNames.indexOf(segmentName);
        return i == -1 ? null : runtimes.get(i);
    }

    private void print(int idx) {
        System.out.printf("%24s: %9.3fs%n", segmentNames.get(idx), runtimes.get(idx) / 1000000000.0);
    }

    public void printSummary() {
        if (!printProgress) return;
        long total = 0;
        for (Long l : runtimes) {
            total += l;
        }
        System.out.println("------------------------------------------------------------------------------");
        System.out.printf("%24s: %9.3fs%n", "[" + name + "] Total", total / 1000000000.0);
    }
}
