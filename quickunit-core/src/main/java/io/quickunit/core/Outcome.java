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

import io.quickunit.assertion.AssertionFailure;
import io.quickunit.assertion.FailureKind;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The classification of one lifecycle phase or one whole test case.
 */
public final class Outcome {

    public enum Status {
        PASSED, FAILED, ERRORED, SKIPPED
    }

    private static final Outcome PASSED = new Outcome(Status.PASSED, null, null);

    private final Status status;
    private final Throwable error;
    private final String reason;

    private Outcome(Status status, Throwable error, String reason) {
        this.status = status;
        this.error = error;
        this.reason = reason;
    }

    public static Outcome passed() {
        return PASSED;
    }

    public static Outcome failed(AssertionFailure failure) {
        return new Outcome(Status.FAILED, failure, null);
    }

    public static Outcome errored(Throwable error) {
        return new Outcome(Status.ERRORED, error, null);
    }

    public static Outcome skipped(String reason) {
        return new Outcome(Status.SKIPPED, null, reason);
    }

    /**
     * Assertion failures become {@link Status#FAILED}, anything else {@link Status#ERRORED}.
     */
    public static Outcome of(Throwable error) {
        if (FailureKind.of(error) == FailureKind.ASSERTION) {
            return failed((AssertionFailure) error);
        }
        return errored(error);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isPassed() {
        return status == Status.PASSED;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    public boolean isErrored() {
        return status == Status.ERRORED;
    }

    public boolean isSkipped() {
        return status == Status.SKIPPED;
    }

    /**
     * True for failed and errored outcomes.
     */
    public boolean isNotOk() {
        return status == Status.FAILED || status == Status.ERRORED;
    }

    public Throwable getError() {
        return error;
    }

    public FailureKind getFailureKind() {
        return error == null ? null : FailureKind.of(error);
    }

    public String getReason() {
        return reason;
    }

    public String getMessage() {
        return error == null ? null : error.getMessage();
    }

    public String getLocation() {
        if (error instanceof AssertionFailure) {
            return ((AssertionFailure) error).getLocation();
        }
        if (error != null && error.getStackTrace().length > 0) {
            StackTraceElement top = error.getStackTrace()[0];
            return top.getFileName() == null ? null : top.getFileName() + "(" + top.getLineNumber() + ")";
        }
        return null;
    }

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("status", status.name().toLowerCase());
        if (error != null) {
            map.put("kind", getFailureKind().name().toLowerCase());
            map.put("type", error.getClass().getName());
            map.put("message", error.getMessage());
            String location = getLocation();
            if (location != null) {
                map.put("location", location);
            }
        }
        if (reason != null) {
            map.put("reason", reason);
        }
        return map;
    }

    @Override
    public String toString() {
        switch (status) {
            case FAILED:
            case ERRORED:
                return status + ": " + AssertionFailure.describe(error);
            case SKIPPED:
                return reason == null ? status.toString() : status + ": " + reason;
            default:
                return status.toString();
        }
    }

}
