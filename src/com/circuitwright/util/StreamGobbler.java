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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Class to help concurrent threads read stdio/stderr. Lines are optionally
 * echoed to standard out and always retained so that callers can parse a
 * tool's response once the process has finished.
 */
public class StreamGobbler extends Thread {
    private final InputStream is;
    private final boolean verbose;
    private final List<String> lines = Collections.synchronizedList(new ArrayList<>());

    public StreamGobbler(InputStream is, boolean verbose) {
        this.is = is;
        this.verbose = verbose;
        setDaemon(true);
    }

    public void run() {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
            String str = null;
            while ((str = br.readLine()) != null) {
                lines.add(str);
                if (verbose) {
                    System.out.println(str);
                }
            }
        } catch (IOException ioe) {
            ioe.printStackTrace();
        }
    }

    /**
     * Gets a snapshot of the lines read so far. Call after {@link #join()} for the
     * complete output.
     */
    public List<String> getLines() {
        synchronized (lines) {
            return new ArrayList<>(lines);
        }
    }
}
