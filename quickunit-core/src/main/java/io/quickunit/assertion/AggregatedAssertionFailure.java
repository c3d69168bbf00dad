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
package io.quickunit.assertion;

import java.util.Collections;
import java.util.List;

/**
 * Thrown by {@link Assertions#assertAll} when one or more of the checks failed.
 * The individual failures are kept in evaluation order.
 */
public class AggregatedAssertionFailure extends AssertionFailure {

    private final List<AssertionFailure> failures;

    public AggregatedAssertionFailure(List<AssertionFailure> failures) {
        super(message(failures));
        this.failures = Collections.unmodifiableList(failures);
    }

    public static String heading(int count) {
        return count == 1 ? "1 assertion failure:" : count + " assertion failures:";
    }

    private static String message(List<AssertionFailure> failures) {
        StringBuilder sb = new StringBuilder(heading(failures.size()));
        for (AssertionFailure failure : failures) {
            sb.append('\n').append(failure.getDescription());
        }
        return sb.toString();
    }

    public List<AssertionFailure> getFailures() {
        return failures;
    }

}
