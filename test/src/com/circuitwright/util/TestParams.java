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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class TestParams {

    private static final String KEY = "CW_TEST_PARAM";

    @AfterEach
    public void clearProperty() {
        System.clearProperty(KEY);
    }

    @ParameterizedTest
    @CsvSource({
            "1, true",
            "true, true",
            "yes, true",
            "0, false",
            "false, false",
            "FALSE, false",
            "'', false",
    })
    public void testIsSet(String value, boolean expected) {
        Assertions.assertEquals(expected, Params.isSet(value));
    }

    @Test
    public void testIsSetNull() {
        Assertions.assertFalse(Params.isSet(null));
    }

    @Test
    public void testPropertyValues() {
        Assertions.assertNull(Params.getParamValue(KEY));
        Assertions.assertFalse(Params.isParamSet(KEY));
        Assertions.assertEquals("dflt", Params.getParamOrDefault(KEY, "dflt"));
        Assertions.assertEquals(7, Params.getParamOrDefaultIntSetting(KEY, 7));

        System.setProperty(KEY, " 42 ");
        Assertions.assertTrue(Params.isParamSet(KEY));
        Assertions.assertEquals(42, Params.getParamOrDefaultIntSetting(KEY, 7));

        System.setProperty(KEY, "many");
        Assertions.assertNull(Params.getParamIntValue(KEY));
        Assertions.assertEquals(7, Params.getParamOrDefaultIntSetting(KEY, 7));
        Assertions.assertEquals("many", Params.getParamOrDefault(KEY, "dflt"));
    }
}
