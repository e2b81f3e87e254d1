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

/**
 * Common class for generating console messages.
 */
public class MessageGenerator {

    /**
     * Used as a general way to create an error message and send it to
     * std.err. 
     * @param msg The message to print to standard error
     */
    public static void briefError(String msg) {
        System.err.println(msg);
    }

    /**
     * Used as a general way to create a message and send it to
     * std.out. 
     * @param msg The message to print to standard out
     */
    public static void briefMessage(String msg) {
        System.out.println(msg);
    }

    /**
     * Prints a warning line prefixed with "WARNING: " to std.err.
     * @param msg The warning text
     */
    public static void warning(String msg) {
        System.err.println("WARNING: " + msg);
    }

    /**
     * Prints a generic header to standard out to separate operations.
     * @param s Title of the header
     */
    public static void printHeader(String s) {
        String bar = "==============================================================================";
        String left;
        String right;
        double whiteSpace = (72 - s.length())/2.0;
        left = MessageGenerator.makeWhiteSpace((int)(whiteSpace));
        right = MessageGenerator.makeWhiteSpace((int)(whiteSpace+0.5));
        System.out.println(bar);
        System.out.println("== "+ left + s + right +" ==");
        System.out.println(bar);
    }

    /**
     * Creates a whitespace string with length number of spaces.
     * @param length Number of spaces in the string.
     * @return The newly created whitespace string.
     */
    public static String makeWhiteSpace(int length) {
        if (length < 1)
            return "";
        StringBuilder sb = new StringBuilder(length);
        for (int i=0; i<length; i++) {
            sb.append(" ");
        }
        return sb.toString();
    }
}
