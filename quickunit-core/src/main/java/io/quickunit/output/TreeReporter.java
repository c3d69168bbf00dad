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
package io.quickunit.output;

import io.quickunit.assertion.AssertionFailure;
import io.quickunit.core.CaseResult;
import io.quickunit.core.CaseRunEvent;
import io.quickunit.core.FailureEntry;
import io.quickunit.core.FixtureRunEvent;
import io.quickunit.core.Outcome;
import io.quickunit.core.RunEvent;
import io.quickunit.core.RunListener;
import io.quickunit.core.RunSummary;
import io.quickunit.core.SummaryRunEvent;

import java.util.Locale;

/**
 * Verbose console reporter, one line per suite and per case.
 * <pre>
 * Unit tests:
 *     StackTest
 *         OK:   0.12 ms  testPush()
 *    FAILURE: testPop: io.quickunit.assertion.AssertionFailure@StackTest.java(42): expected: &lt;1&gt; but was: &lt;2&gt;
 *     IGNORE: testPeek()
 * </pre>
 */
public class TreeReporter implements RunListener {

    @Override
    public void onEvent(RunEvent event) {
        switch (event.getType()) {
            case RUN_ENTER:
                Console.println(Console.Style.HEADING.apply("Unit tests: "));
                break;
            case SUITE_ENTER:
                Console.println("    " + Console.Style.SUITE.apply(event.getSuiteName()));
                break;
            case FIXTURE_FAILED:
                printEntry(((FixtureRunEvent) event).entry());
                break;
            case CASE_EXIT:
                onCaseExit(((CaseRunEvent) event).result());
                break;
            case RUN_EXIT:
                onRunExit(((SummaryRunEvent) event).summary());
                break;
            default:
        }
    }

    private void onCaseExit(CaseResult result) {
        Outcome outcome = result.getOutcome();
        if (outcome.isSkipped()) {
            String line = "    IGNORE: " + result.getName() + "()";
            if (outcome.getReason() != null) {
                line = line + " " + outcome.getReason();
            }
            Console.println(Console.Style.IGNORED.apply(line));
        } else if (outcome.isPassed()) {
            Console.println(Console.Style.PASSED.apply(String.format(Locale.ROOT, "        OK: %6.2f ms  %s()", result.getBodyMillis(), result.getName())));
        } else {
            for (FailureEntry entry : result.getEntries()) {
                printEntry(entry);
            }
        }
    }

    private static void printEntry(FailureEntry entry) {
        String prefix = entry.isFailure() ? "   FAILURE: " : "     ERROR: ";
        Console.println(Console.Style.FAILED.apply(prefix + formatEntry(entry)));
    }

    static String formatEntry(FailureEntry entry) {
        return entry.getLabel() + ": " + AssertionFailure.describe(entry.outcome().getError());
    }

    private void onRunExit(RunSummary summary) {
        String counts = String.format("Tests run: %d, Failures: %d, Errors: %d, Skipped: %d (%d ms)",
                summary.getExecutedCount(), summary.getFailureCount(), summary.getErrorCount(),
                summary.getSkippedCount(), summary.getDurationMillis());
        Console.println(Console.verdict(summary.isPassed()) + " " + counts);
    }

}
