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

import io.quickunit.assertion.Assertions;
import io.quickunit.core.Registry;
import io.quickunit.core.Runner;
import io.quickunit.core.TestSuite;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TreeReporterTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    @BeforeEach
    void setup() {
        Console.setColorsEnabled(false);
        Console.setOutput(new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void cleanup() {
        Console.setOutput(System.out);
    }

    private List<String> run(TestSuite<?>... suites) {
        Runner.builder(Registry.of(suites)).listener(new TreeReporter()).run();
        return Arrays.asList(buffer.toString(StandardCharsets.UTF_8).split("\\R"));
    }

    @Test
    void testTree() {
        TestSuite<Object> stack = TestSuite.builder("StackTest", Object::new)
                .test("testPush", o -> {
                })
                .test("testPop", o -> Assertions.fail("empty"))
                .disabled("testPeek", "not implemented", o -> {
                })
                .build();
        TestSuite<Object> queue = TestSuite.builder("QueueTest", Object::new)
                .afterEach(o -> {
                    throw new IllegalStateException("leak");
                })
                .test("testOffer", o -> {
                })
                .build();
        List<String> lines = run(stack, queue);
        assertEquals("Unit tests: ", lines.get(0));
        assertEquals("    StackTest", lines.get(1));
        assertTrue(lines.get(2).matches(" {8}OK: +\\d+\\.\\d{2} ms  testPush\\(\\)"), lines.get(2));
        assertTrue(lines.get(3).startsWith("   FAILURE: testPop: io.quickunit.assertion.AssertionFailure@TreeReporterTest.java("));
        assertTrue(lines.get(3).endsWith("): empty"));
        assertEquals("    IGNORE: testPeek() not implemented", lines.get(4));
        assertEquals("    QueueTest", lines.get(5));
        assertEquals("     ERROR: AfterEach: java.lang.IllegalStateException: leak", lines.get(6));
        assertTrue(lines.get(7).startsWith("NOT OK Tests run: 3, Failures: 1, Errors: 1, Skipped: 1 ("));
        assertEquals(8, lines.size());
    }

    @Test
    void testSuiteLevelFailure() {
        TestSuite<Object> suite = TestSuite.builder("Foo", Object::new)
                .beforeAll(o -> Assertions.assertTrue(false, "no fixture"))
                .test("a", o -> {
                })
                .build();
        List<String> lines = run(suite);
        assertEquals("    Foo", lines.get(1));
        assertTrue(lines.get(2).startsWith("   FAILURE: BeforeAll: "));
        assertTrue(lines.get(2).endsWith(": no fixture"));
        assertTrue(lines.get(3).startsWith("NOT OK Tests run: 0, Failures: 1, Errors: 0"));
    }

    @Test
    void testPassed() {
        TestSuite<Object> suite = TestSuite.builder("Foo", Object::new)
                .test("a", o -> {
                })
                .build();
        List<String> lines = run(suite);
        assertTrue(lines.get(lines.size() - 1).startsWith("OK Tests run: 1, Failures: 0, Errors: 0, Skipped: 0"));
    }

    @Test
    void testColors() {
        Console.setColorsEnabled(true);
        TestSuite<Object> suite = TestSuite.builder("Foo", Object::new)
                .test("a", o -> Assertions.fail())
                .build();
        String output = String.join("\n", run(suite));
        assertTrue(output.contains(Console.Style.FAILED.code()));
        assertTrue(output.contains("\u001B[0m"));
        assertFalse(Console.stripAnsi(output).contains("\u001B"));
    }

}
