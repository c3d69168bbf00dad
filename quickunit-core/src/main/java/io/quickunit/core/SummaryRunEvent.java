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
 * Run-level events (RUN_ENTER, RUN_EXIT).
 */
public record SummaryRunEvent(
        RunEventType type,
        Selection selection,
        RunSummary summary  // null for ENTER
) implements RunEvent {

    public static SummaryRunEvent enter(Selection selection) {
        return new SummaryRunEvent(RunEventType.RUN_ENTER, selection, null);
    }

    public static SummaryRunEvent exit(Selection selection, RunSummary summary) {
        return new SummaryRunEvent(RunEventType.RUN_EXIT, selection, summary);
    }

    @Override
    public RunEventType getType() {
        return type;
    }

    @Override
    public String getSuiteName() {
        return null;
    }

    @Override
    public Map<String, Object> toJson() {
        if (type == RunEventType.RUN_EXIT && summary != null) {
            return summary.toJson();
        }
        Map<String, Object> map = new LinkedHashMap<>();
        if (selection != null) {
            map.put("suites", selection.suiteNames().size());
            map.put("cases", selection.size());
        }
        return map;
    }
}
