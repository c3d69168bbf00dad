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

import java.lang.reflect.Array;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.function.BooleanSupplier;

/**
 * Assertion primitives for test code.
 * <p>
 * Every assertion reports a problem by throwing {@link AssertionFailure} via {@link #fail(String)},
 * which the runtime reports as a failure rather than an error. Typical use is a static import:
 * <pre>
 * import static io.quickunit.assertion.Assertions.*;
 *
 * assertEquals(42, answer);
 * assertAll(
 *     () -&gt; assertTrue(list.isEmpty()),
 *     () -&gt; assertEquals("foo", name)
 * );
 * </pre>
 */
public final class Assertions {

    static final double RELATIVE_TOLERANCE = 1e-2;
    static final double ABSOLUTE_TOLERANCE = 1e-5;

    public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(500);
    public static final Duration DEFAULT_DELAY = Duration.ofMillis(10);

    private Assertions() {
    }

    /**
     * A block of test code that may throw anything.
     */
    @FunctionalInterface
    public interface Executable {
        void execute() throws Throwable;
    }

    public enum Op {

        LESS_THAN("<"),
        LESS_THAN_OR_EQUAL("<="),
        GREATER_THAN(">"),
        GREATER_THAN_OR_EQUAL(">=");

        private final String symbol;

        Op(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }

        boolean test(int comparison) {
            switch (this) {
                case LESS_THAN:
                    return comparison < 0;
                case LESS_THAN_OR_EQUAL:
                    return comparison <= 0;
                case GREATER_THAN:
                    return comparison > 0;
                default:
                    return comparison >= 0;
            }
        }

        @Override
        public String toString() {
            return symbol;
        }

    }

    // ========== fail ==========

    public static void fail() {
        fail(null);
    }

    public static void fail(String message) {
        throw new AssertionFailure(message);
    }

    // ========== conditions ==========

    public static void assertTrue(boolean condition) {
        assertTrue(condition, null);
    }

    public static void assertTrue(boolean condition, String message) {
        if (!condition) {
            fail(message);
        }
    }

    public static void assertFalse(boolean condition) {
        assertFalse(condition, null);
    }

    public static void assertFalse(boolean condition, String message) {
        if (condition) {
            fail(message);
        }
    }

    // ========== equality ==========

    public static void assertEquals(Object expected, Object actual) {
        assertEquals(expected, actual, null);
    }

    /**
     * Value equality. Arrays are compared by content and floating-point numbers approximately.
     */
    public static void assertEquals(Object expected, Object actual, String message) {
        if (isEqual(expected, actual)) {
            return;
        }
        fail(header(message) + "expected: <" + render(expected) + "> but was: <" + render(actual) + ">");
    }

    static boolean isEqual(Object expected, Object actual) {
        if (isFloatingPoint(expected) || isFloatingPoint(actual)) {
            if (expected instanceof Number && actual instanceof Number) {
                return approxEquals(((Number) expected).doubleValue(), ((Number) actual).doubleValue());
            }
        }
        if (isArray(expected) && isArray(actual)) {
            return isElementwiseEqual(arrayToList(expected), arrayToList(actual));
        }
        if (expected instanceof List && actual instanceof List) {
            return isElementwiseEqual((List<?>) expected, (List<?>) actual);
        }
        return Objects.deepEquals(expected, actual);
    }

    // nested reals keep the tolerance
    private static boolean isElementwiseEqual(List<?> expected, List<?> actual) {
        if (expected.size() != actual.size()) {
            return false;
        }
        Iterator<?> a = actual.iterator();
        for (Object e : expected) {
            if (!isEqual(e, a.next())) {
                return false;
            }
        }
        return true;
    }

    private static boolean isArray(Object o) {
        return o != null && o.getClass().isArray();
    }

    private static boolean isFloatingPoint(Object o) {
        return o instanceof Double || o instanceof Float;
    }

    static boolean approxEquals(double expected, double actual) {
        if (Double.compare(expected, actual) == 0) {
            return true;
        }
        if (Double.isNaN(expected) || Double.isNaN(actual)
                || Double.isInfinite(expected) || Double.isInfinite(actual)) {
            return false;
        }
        double diff = Math.abs(expected - actual);
        return diff <= ABSOLUTE_TOLERANCE || diff <= RELATIVE_TOLERANCE * Math.abs(actual);
    }

    // ========== sequences ==========

    public static void assertArrayEquals(Object[] expected, Object[] actual) {
        assertArrayEquals(expected, actual, null);
    }

    public static void assertArrayEquals(Object[] expected, Object[] actual, String message) {
        assertRangeEquals(Arrays.asList(expected), Arrays.asList(actual), message);
    }

    public static void assertArrayEquals(int[] expected, int[] actual) {
        assertArrayEquals(expected, actual, null);
    }

    public static void assertArrayEquals(int[] expected, int[] actual, String message) {
        assertRangeEquals(toList(expected), toList(actual), message);
    }

    public static void assertArrayEquals(long[] expected, long[] actual) {
        assertArrayEquals(expected, actual, null);
    }

    public static void assertArrayEquals(long[] expected, long[] actual, String message) {
        assertRangeEquals(toList(expected), toList(actual), message);
    }

    public static void assertArrayEquals(double[] expected, double[] actual) {
        assertArrayEquals(expected, actual, null);
    }

    public static void assertArrayEquals(double[] expected, double[] actual, String message) {
        assertRangeEquals(toList(expected), toList(actual), message);
    }

    public static void assertRangeEquals(Iterable<?> expected, Iterable<?> actual) {
        assertRangeEquals(expected, actual, null);
    }

    /**
     * Compares element by element and reports the first divergence only.
     */
    public static void assertRangeEquals(Iterable<?> expected, Iterable<?> actual, String message) {
        String header = header(message);
        Iterator<?> e = expected.iterator();
        Iterator<?> a = actual.iterator();
        int index = 0;
        for (; e.hasNext() && a.hasNext(); index++) {
            assertEquals(e.next(), a.next(), header + "mismatch at index " + index);
        }
        if (e.hasNext()) {
            fail(header + "length mismatch at index " + index
                    + "; expected: <" + render(e.next()) + "> but was: empty");
        }
        if (a.hasNext()) {
            fail(header + "length mismatch at index " + index
                    + "; expected: empty but was: <" + render(a.next()) + ">");
        }
    }

    public static void assertArrayEquals(Map<?, ?> expected, Map<?, ?> actual) {
        assertArrayEquals(expected, actual, null);
    }

    /**
     * Compares values key by key, then fails if the key sets differ.
     * The message prefix applies to value mismatches only.
     */
    public static void assertArrayEquals(Map<?, ?> expected, Map<?, ?> actual, String message) {
        String header = header(message);
        for (Map.Entry<?, ?> entry : expected.entrySet()) {
            Object key = entry.getKey();
            if (actual.containsKey(key)) {
                assertEquals(entry.getValue(), actual.get(key), header + "mismatch at key " + renderKey(key));
            }
        }
        TreeSet<String> difference = new TreeSet<>();
        for (Object key : expected.keySet()) {
            if (!actual.containsKey(key)) {
                difference.add(renderKey(key));
            }
        }
        for (Object key : actual.keySet()) {
            if (!expected.containsKey(key)) {
                difference.add(renderKey(key));
            }
        }
        if (!difference.isEmpty()) {
            fail("key mismatch; difference: " + String.join(", ", difference));
        }
    }

    // ========== containers ==========

    public static void assertEmpty(Object actual) {
        assertEmpty(actual, null);
    }

    public static void assertEmpty(Object actual, String message) {
        if (!isEmpty(actual)) {
            fail(message);
        }
    }

    public static void assertNotEmpty(Object actual) {
        assertNotEmpty(actual, null);
    }

    public static void assertNotEmpty(Object actual, String message) {
        if (isEmpty(actual)) {
            fail(message);
        }
    }

    static boolean isEmpty(Object o) {
        if (o instanceof Collection) {
            return ((Collection<?>) o).isEmpty();
        }
        if (o instanceof Map) {
            return ((Map<?, ?>) o).isEmpty();
        }
        if (o instanceof CharSequence) {
            return ((CharSequence) o).length() == 0;
        }
        if (o instanceof Iterable) {
            return !((Iterable<?>) o).iterator().hasNext();
        }
        if (o != null && o.getClass().isArray()) {
            return Array.getLength(o) == 0;
        }
        throw new IllegalArgumentException("not a collection, map, string or array: " + o);
    }

    // ========== null and identity ==========

    public static void assertNull(Object actual) {
        assertNull(actual, null);
    }

    public static void assertNull(Object actual, String message) {
        if (actual != null) {
            fail(message);
        }
    }

    public static void assertNotNull(Object actual) {
        assertNotNull(actual, null);
    }

    public static void assertNotNull(Object actual, String message) {
        if (actual == null) {
            fail(message);
        }
    }

    public static void assertSame(Object expected, Object actual) {
        assertSame(expected, actual, null);
    }

    public static void assertSame(Object expected, Object actual, String message) {
        if (expected != actual) {
            fail(header(message) + "expected same: <" + render(expected) + "> was not: <" + render(actual) + ">");
        }
    }

    public static void assertNotSame(Object expected, Object actual) {
        assertNotSame(expected, actual, null);
    }

    public static void assertNotSame(Object expected, Object actual, String message) {
        if (expected == actual) {
            fail(header(message) + "expected not same");
        }
    }

    // ========== ordering ==========

    public static <T extends Comparable<? super T>> void assertOp(T lhs, Op op, T rhs) {
        assertOp(lhs, op, rhs, null);
    }

    public static <T extends Comparable<? super T>> void assertOp(T lhs, Op op, T rhs, String message) {
        if (op.test(lhs.compareTo(rhs))) {
            return;
        }
        fail(header(message) + "condition (" + render(lhs) + " " + op.getSymbol() + " " + render(rhs) + ") not satisfied");
    }

    public static <T extends Comparable<? super T>> void assertGreaterThan(T lhs, T rhs) {
        assertOp(lhs, Op.GREATER_THAN, rhs, null);
    }

    public static <T extends Comparable<? super T>> void assertGreaterThanOrEqual(T lhs, T rhs) {
        assertOp(lhs, Op.GREATER_THAN_OR_EQUAL, rhs, null);
    }

    public static <T extends Comparable<? super T>> void assertLessThan(T lhs, T rhs) {
        assertOp(lhs, Op.LESS_THAN, rhs, null);
    }

    public static <T extends Comparable<? super T>> void assertLessThanOrEqual(T lhs, T rhs) {
        assertOp(lhs, Op.LESS_THAN_OR_EQUAL, rhs, null);
    }

    // ========== aggregation ==========

    /**
     * Runs every check in order and collects the assertion failures.
     * Any other throwable propagates right away.
     *
     * @throws AggregatedAssertionFailure if at least one check failed
     */
    public static void assertAll(Executable... checks) {
        List<AssertionFailure> failures = new ArrayList<>();
        for (Executable check : checks) {
            try {
                check.execute();
            } catch (AssertionFailure failure) {
                failures.add(failure);
            } catch (Throwable t) {
                throw Assertions.<RuntimeException>sneakyThrow(t);
            }
        }
        if (!failures.isEmpty()) {
            throw new AggregatedAssertionFailure(failures);
        }
    }

    // ========== exceptions ==========

    public static <T extends Throwable> T expectThrows(Class<T> type, Executable expression) {
        return expectThrows(type, expression, null);
    }

    /**
     * Returns the throwable raised by the expression if it is an instance of {@code type}.
     * A throwable of any other type is rethrown unchanged.
     */
    public static <T extends Throwable> T expectThrows(Class<T> type, Executable expression, String message) {
        try {
            expression.execute();
        } catch (Throwable t) {
            if (type.isInstance(t)) {
                return type.cast(t);
            }
            throw Assertions.<RuntimeException>sneakyThrow(t);
        }
        throw new AssertionFailure(header(message) + "expected <" + type.getSimpleName() + "> was not thrown");
    }

    public static void assertThrows(Class<? extends Throwable> type, Executable expression) {
        assertThrows(type, expression, null);
    }

    public static void assertThrows(Class<? extends Throwable> type, Executable expression, String message) {
        try {
            expression.execute();
        } catch (Throwable t) {
            if (type.isInstance(t)) {
                return;
            }
            throw Assertions.<RuntimeException>sneakyThrow(t);
        }
        fail(header(message) + "expected exception: <" + type.getName() + "> was not thrown");
    }

    // ========== polling ==========

    public static void assertEventually(BooleanSupplier condition) {
        assertEventually(condition, DEFAULT_TIMEOUT, DEFAULT_DELAY, null);
    }

    public static void assertEventually(BooleanSupplier condition, Duration timeout, Duration delay) {
        assertEventually(condition, timeout, delay, null);
    }

    /**
     * Polls the condition until it returns true, sleeping {@code delay} between polls.
     * Useful for checking on work done by another thread.
     *
     * @throws AssertionFailure if the condition is still false once {@code timeout} has elapsed
     */
    public static void assertEventually(BooleanSupplier condition, Duration timeout, Duration delay, String message) {
        String timeoutMessage = message == null || message.isEmpty() ? "timed out" : message;
        long start = System.nanoTime();
        long timeoutNanos = timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() - start >= timeoutNanos) {
                fail(timeoutMessage);
            }
            try {
                Thread.sleep(delay.toMillis(), delay.toNanosPart() % 1_000_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail(timeoutMessage);
            }
        }
    }

    // ========== rendering ==========

    private static String header(String message) {
        return message == null || message.isEmpty() ? "" : message + "; ";
    }

    /**
     * Canonical string form of a value as used in failure messages.
     */
    public static String render(Object o) {
        if (o == null) {
            return "null";
        }
        if (isFloatingPoint(o)) {
            double d = ((Number) o).doubleValue();
            if (!Double.isInfinite(d) && d == Math.rint(d) && Math.abs(d) < 1e15) {
                return Long.toString((long) d);
            }
            return o.toString();
        }
        if (o instanceof Object[]) {
            return Arrays.deepToString((Object[]) o);
        }
        if (o.getClass().isArray()) {
            return arrayToList(o).toString();
        }
        return o.toString();
    }

    private static List<Object> arrayToList(Object array) {
        int length = Array.getLength(array);
        List<Object> list = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            list.add(Array.get(array, i));
        }
        return list;
    }

    private static String renderKey(Object key) {
        if (key instanceof CharSequence) {
            return "\"" + key + "\"";
        }
        return render(key);
    }

    private static List<Integer> toList(int[] values) {
        List<Integer> list = new ArrayList<>(values.length);
        for (int v : values) {
            list.add(v);
        }
        return list;
    }

    private static List<Long> toList(long[] values) {
        List<Long> list = new ArrayList<>(values.length);
        for (long v : values) {
            list.add(v);
        }
        return list;
    }

    private static List<Double> toList(double[] values) {
        List<Double> list = new ArrayList<>(values.length);
        for (double v : values) {
            list.add(v);
        }
        return list;
    }

    @SuppressWarnings("unchecked")
    private static <E extends Throwable> E sneakyThrow(Throwable t) throws E {
        throw (E) t;
    }

}
