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
 * Case-level events (CASE_ENTER, CASE_EXIT). Disabled cases only get a CASE_EXIT with a skipped
 * result.
 */
public record CaseRunEvent(
        RunEventType type,
        TestCase<?> testCase,
        CaseResult result  // null for ENTER
) implements RunEvent {

    public static CaseRunEvent enter(TestCase<?> testCase) {
        return new CaseRunEvent(RunEventType.CASE_ENTER, testCase, null);
    }

    public static CaseRunEvent exit(CaseResult result) {
        return new CaseRunEvent(RunEventType.CASE_EXIT, result.getTestCase(), result);
    }

    @Override
    public RunEventType getType() {
        return type;
    }

    @Override
    public String getSuiteName() {
        return testCase == null ? null : testCase.getSuiteName();
    }

    @Override
    public Map<String, Object> toJson() {
        if (type == RunEventType.CASE_EXIT && result != null) {
            return result.toJson();
        }
        return testCase == null ? new LinkedHashMap<>() : testCase.toJson();
    }
}
