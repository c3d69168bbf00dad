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

import java.util.Set;

/**
 * Thrown on an assertion failure.
 * <p>
 * This is the only failure kind the runtime reports as a test <em>failure</em>. Anything else
 * thrown by a test, a hook or a suite factory is reported as an <em>error</em>.
 * The location is the first stack frame outside the assertion classes, i.e. the line of test
 * code that called the assertion.
 */
public class AssertionFailure extends RuntimeException {

    public static final String DEFAULT_MESSAGE = "Assertion failure";

    private static final Set<String> INTERNAL_CLASSES = Set.of(
            Assertions.class.getName(),
            AssertionFailure.class.getName(),
            AggregatedAssertionFailure.class.getName()
    );

    private final String file;
    private final int line;

    public AssertionFailure(String message) {
        super(message == null || message.isEmpty() ? DEFAULT_MESSAGE : message);
        StackTraceElement caller = callSite(getStackTrace());
        this.file = caller == null ? null : caller.getFileName();
        this.line = caller == null ? 0 : caller.getLineNumber();
    }

    static StackTraceElement callSite(StackTraceElement[] trace) {
        for (StackTraceElement element : trace) {
            if (!INTERNAL_CLASSES.contains(element.getClassName())) {
                return element;
            }
        }
        return trace.length > 0 ? trace[0] : null;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    /**
     * Returns the call-site as {@code File.java(42)}, or null if unknown.
     */
    public String getLocation() {
        return file == null ? null : file + "(" + line + ")";
    }

    /**
     * One-line description used when failures are listed, e.g. by {@link AggregatedAssertionFailure}.
     */
    public String getDescription() {
        return describe(this);
    }

    public static String describe(Throwable throwable) {
        String name = throwable.getClass().getName();
        if (throwable instanceof AssertionFailure) {
            AssertionFailure failure = (AssertionFailure) throwable;
            if (failure.getLocation() != null) {
                return name + "@" + failure.getLocation() + ": " + throwable.getMessage();
            }
        }
        return name + ": " + throwable.getMessage();
    }

}
