/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.quickunit.core;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Suite-level events (SUITE_ENTER, SUITE_EXIT).
 */
public record SuiteRunEvent(
        RunEventType type,
        TestSuite<?> suite,
        SuiteResult result  // null for ENTER
) implements RunEvent {

    public static SuiteRunEvent enter(TestSuite<?> suite) {
        return new SuiteRunEvent(RunEventType.SUITE_ENTER, suite, null);
    }

    public static SuiteRunEvent exit(TestSuite<?> suite, SuiteResult result) {
        return new SuiteRunEvent(RunEventType.SUITE_EXIT, suite, result);
    }

    @Override
    public RunEventType getType() {
        return type;
    }

    @Override
    public String getSuiteName() {
        return suite == null ? null : suite.getName();
    }

    @Override
    public Map<String, Object> toJson() {
        if (type == RunEventType.SUITE_EXIT && result != null) {
            Map<String, Object> map = result.toJson();
            // case results are streamed as CASE_EXIT events already
            map.remove("caseResults");
            return map;
        }
        Map<String, Object> map = new LinkedHashMap<>();
        if (suite != null) {
            map.put("name", suite.getName());
        }
        return map;
    }
}
