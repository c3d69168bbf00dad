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
import io.quickunit.core.CaseRunEvent;
import io.quickunit.core.FailureEntry;
import io.quickunit.core.RunEvent;
import io.quickunit.core.RunListener;
import io.quickunit.core.RunSummary;
import io.quickunit.core.SummaryRunEvent;

import java.util.List;

/**
 * Terse console reporter: one symbol per case ({@code .} passed, {@code F} failed or errored,
 * {@code I} ignored) followed by the numbered errors and failures and a one-line verdict.
 * <pre>
 * ..F.I
 * There was 1 failure:
 * 1) testPop(StackTest) io.quickunit.assertion.AssertionFailure@StackTest.java(42): expected: &lt;1&gt; but was: &lt;2&gt;
 *
 * NOT OK
 * Tests run: 4, Failures: 1, Errors: 0
 * </pre>
 */
public class ProgressReporter implements RunListener {

    @Override
    public void onEvent(RunEvent event) {
        switch (event.getType()) {
            case CASE_EXIT:
                Console.print(Console.progressMark(((CaseRunEvent) event).result()));
                break;
            case FIXTURE_FAILED:
                Console.print(Console.failureMark());
                break;
            case RUN_EXIT:
                onRunExit(((SummaryRunEvent) event).summary());
                break;
            default:
        }
    }

    private void onRunExit(RunSummary summary) {
        Console.println();
        printEntries(summary.getErrors(), "error");
        printEntries(summary.getFailures(), "failure");
        if (summary.isPassed()) {
            int count = summary.getExecutedCount();
            Console.println(Console.verdict(true) + " (" + count + (count == 1 ? " Test)" : " Tests)"));
        } else {
            Console.println();
            Console.println(Console.verdict(false));
            Console.println(String.format("Tests run: %d, Failures: %d, Errors: %d",
                    summary.getExecutedCount(), summary.getFailureCount(), summary.getErrorCount()));
        }
        if (summary.getSkippedCount() > 0) {
            Console.println(Console.Style.IGNORED.apply("Skipped: " + summary.getSkippedCount()));
        }
    }

    private static void printEntries(List<FailureEntry> entries, String noun) {
        if (entries.isEmpty()) {
            return;
        }
        if (entries.size() == 1) {
            Console.println("There was 1 " + noun + ":");
        } else {
            Console.println("There were " + entries.size() + " " + noun + "s:");
        }
        int i = 1;
        for (FailureEntry entry : entries) {
            Console.println(formatEntry(i++, entry));
        }
    }

    static String formatEntry(int index, FailureEntry entry) {
        return String.format("%d) %s(%s) %s", index, entry.getLabel(), entry.suiteName(),
                AssertionFailure.describe(entry.outcome().getError()));
    }

}
