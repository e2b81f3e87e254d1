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
 * Aims to be a centralized helper class to manage global CircuitWright settings.
 * Each setting can be provided either as an environment variable or as a JVM
 * property (-Dname=value) of the same name. The environment variable wins if
 * both are present.
 */
public class Params {

    public static String CW_SAT_SOLVER_NAME = "CW_SAT_SOLVER";

    public static String CW_APPROXMC_NAME = "CW_APPROXMC";

    public static String CW_YOSYS_NAME = "CW_YOSYS";

    public static String CW_SOLVER_TIMEOUT_NAME = "CW_SOLVER_TIMEOUT";

    public static String CW_VERBOSE_NAME = "CW_VERBOSE";

    public static String CW_DEFAULT_SAT_SOLVER = "cadical";

    public static String CW_DEFAULT_APPROXMC = "approxmc";

    public static String CW_DEFAULT_YOSYS = "yosys";

    /**
     * Name (or path) of the competition-format SAT solver executable used by
     * {@link com.circuitwright.sat.ExternalSatSolver}.
     * @return The configured executable, or {@link #CW_DEFAULT_SAT_SOLVER}.
     */
    public static String getSatSolverExecutable() {
        return getParamOrDefault(CW_SAT_SOLVER_NAME, CW_DEFAULT_SAT_SOLVER);
    }

    /**
     * Name (or path) of the approximate model counter executable.
     * @return The configured executable, or {@link #CW_DEFAULT_APPROXMC}.
     */
    public static String getApproxMcExecutable() {
        return getParamOrDefault(CW_APPROXMC_NAME, CW_DEFAULT_APPROXMC);
    }

    /**
     * Name (or path) of the yosys executable.
     * @return The configured executable, or {@link #CW_DEFAULT_YOSYS}.
     */
    public static String getYosysExecutable() {
        return getParamOrDefault(CW_YOSYS_NAME, CW_DEFAULT_YOSYS);
    }

    /**
     * Wall-clock limit for a single oracle call, in seconds. A value of 0 (the
     * default) means no limit.
     * @return The timeout in seconds.
     */
    public static int getSolverTimeoutSeconds() {
        return getParamOrDefaultIntSetting(CW_SOLVER_TIMEOUT_NAME, 0);
    }

    /**
     * @return True if external tool output should be echoed to standard out.
     */
    public static boolean isVerbose() {
        return isParamSet(CW_VERBOSE_NAME);
    }

    /**
     * Checks if the named CircuitWright parameter is set via an environment variable
     * or by a JVM parameter of the same name.
     * 
     * @param key Name of the global CircuitWright parameter
     * @return True if the parameter is set (as defined by {@link #isSet(String)}),
     *         false otherwise
     */
    public static boolean isParamSet(String key) {
        return isSet(System.getenv(key)) || isSet(System.getProperty(key));
    }

    /**
     * Checks if a parameter is set by examining the provided value.
     * 
     * @param value An environment variable or JVM parameter value
     * @return True if (1) value is not null, (2) is not an empty string, (3) is not
     *         0 and (4) is not false (case-insensitive).
     */
    public static boolean isSet(String value) {
        return !( value == null 
               || value.length() == 0 
               || value.equals("0") 
               || value.toLowerCase().equals("false")
               );         
    }

    /**
     * Gets the integer value of the provided parameter name.
     * 
     * @param key Name of the system parameter to get.
     * @return The set integer value of the parameter, or null if none was set. If
     *         the property is set to a value that is not a parsable integer, a
     *         warning message is produced and returns null.
     */
    public static Integer getParamIntValue(String key) {
        String envValue = getParamValue(key);
        if (envValue != null) {
            try {
                return Integer.parseInt(envValue.trim());
            } catch (NumberFormatException e) {
                System.err.println("WARNING: Couldn't interpret the value '" + envValue 
                        + "' from the parameter '" + key + "' as an integer.");
            }
        }
        return null;
    }

    /**
     * Gets the string value of the provided parameter name.
     * 
     * @param key Name of the system parameter to get.
     * @return The set string value of the parameter, or null if none was set.
     */
    public static String getParamValue(String key) {
        String value = System.getenv(key);
        if (value == null) {
            value = System.getProperty(key);
        }
        return value;
    }

    /**
     * Returns the string value of the parameter, or the default if it is unset or empty.
     */
    public static String getParamOrDefault(String key, String defaultValue) {
        String value = getParamValue(key);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    /**
     * Checks the parameter value of the provided key. If it is set, it returns the
     * set value. Otherwise it will return the default value.
     * 
     * @param key          Name of the system parameter to check.
     * @param defaultValue The default value to return if the paramter is not set.
     * @return The system parameter value if is set, otherwise it returns
     *         defaultValue.
     */
    public static int getParamOrDefaultIntSetting(String key, int defaultValue) {
        Integer setValue = getParamIntValue(key);
        return setValue == null ? defaultValue : setValue;
    }

}
