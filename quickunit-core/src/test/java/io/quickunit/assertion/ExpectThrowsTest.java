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

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;

import static org.junit.jupiter.api.Assertions.*;

class ExpectThrowsTest {

    @Test
    void testReturnsMatchingThrowable() {
        IllegalArgumentException e = Assertions.expectThrows(IllegalArgumentException.class, () -> {
            throw new IllegalArgumentException("bad arg");
        });
        assertEquals("bad arg", e.getMessage());
    }

    @Test
    void testSubclassMatches() {
        RuntimeException e = Assertions.expectThrows(RuntimeException.class, () -> {
            throw new UncheckedIOException(new IOException("io"));
        });
        assertInstanceOf(UncheckedIOException.class, e);
    }

    @Test
    void testNothingThrown() {
        AssertionFailure af = assertThrows(AssertionFailure.class,
                () -> Assertions.expectThrows(IllegalStateException.class, () -> {
                }));
        assertEquals("expected <IllegalStateException> was not thrown", af.getMessage());
        af = assertThrows(AssertionFailure.class,
                () -> Assertions.expectThrows(IllegalStateException.class, () -> {
                }, "parse"));
        assertEquals("parse; expected <IllegalStateException> was not thrown", af.getMessage());
        assertEquals("ExpectThrowsTest.java", af.getFile());
    }

    @Test
    void testOtherThrowablePropagatesUnchanged() {
        IllegalStateException original = new IllegalStateException("other");
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> Assertions.expectThrows(IllegalArgumentException.class, () -> {
                    throw original;
                }));
        assertSame(original, e);
    }

    @Test
    void testExpectAssertionFailure() {
        AssertionFailure af = Assertions.expectThrows(AssertionFailure.class, () -> Assertions.fail("inner"));
        assertEquals("inner", af.getMessage());
    }

    @Test
    void testAssertThrows() {
        Assertions.assertThrows(IOException.class, () -> {
            throw new IOException();
        });
        AssertionFailure af = assertThrows(AssertionFailure.class,
                () -> Assertions.assertThrows(IOException.class, () -> {
                }));
        assertEquals("expected exception: <java.io.IOException> was not thrown", af.getMessage());
        Error error = new Error("fatal");
        assertSame(error, assertThrows(Error.class, () -> Assertions.assertThrows(IOException.class, () -> {
            throw error;
        })));
    }

}
