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
 * One non-passing phase outcome, as listed in the run summary.
 * {@code caseName} is null for suite-level phases (construction, before-all, after-all).
 */
public record FailureEntry(
        Phase phase,
        String suiteName,
        String caseName,
        Outcome outcome
) {

    public String getLabel() {
        return phase.label(caseName);
    }

    public boolean isFailure() {
        return outcome.isFailed();
    }

    public boolean isError() {
        return outcome.isErrored();
    }

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("phase", getLabel());
        map.put("suite", suiteName);
        if (caseName != null) {
            map.put("case", caseName);
        }
        map.putAll(outcome.toJson());
        return map;
    }

}
