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

import io.quickunit.core.CaseResult;
import org.slf4j.Logger;

import java.io.PrintStream;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Console sink shared by the reporters. Knows how each kind of result is styled, and how a case
 * shows up in the progress line and in the final verdict. Every line is also copied, without
 * ANSI codes, to the quickunit.console logger at TRACE level.
 */
public final class Console {

    private static final Logger logger = LogContext.CONSOLE_LOGGER;

    private static final String RESET = "\u001B[0m";
    private static final Pattern ANSI_PATTERN = Pattern.compile("\u001B\\[[;\\d]*m");

    /**
     * How a piece of report text is rendered when colors are on.
     */
    public enum Style {

        PASSED("\u001B[92m"),
        FAILED("\u001B[91m\u001B[1m"),
        IGNORED("\u001B[93m"),
        SUITE("\u001B[36m"),
        HEADING("\u001B[1m");

        private final String code;

        Style(String code) {
            this.code = code;
        }

        public String apply(String text) {
            return colorsEnabled ? code + text + RESET : text;
        }

        public String code() {
            return code;
        }

    }

    private static boolean colorsEnabled = colorsByDefault(System.getenv(), System.console() != null);
    private static PrintStream out = System.out;

    private Console() {
    }

    /**
     * NO_COLOR (https://no-color.org/) wins, then FORCE_COLOR, then a dumb terminal turns colors
     * off; otherwise colors follow whether there is an interactive console.
     */
    static boolean colorsByDefault(Map<String, String> env, boolean interactive) {
        if (env.containsKey("NO_COLOR")) {
            return false;
        }
        String force = env.get("FORCE_COLOR");
        if (force != null) {
            return !force.equals("0");
        }
        if ("dumb".equals(env.get("TERM"))) {
            return false;
        }
        return interactive || env.containsKey("COLORTERM");
    }

    public static void setColorsEnabled(boolean enabled) {
        colorsEnabled = enabled;
    }

    public static boolean isColorsEnabled() {
        return colorsEnabled;
    }

    public static void setOutput(PrintStream output) {
        out = output;
    }

    public static PrintStream getOutput() {
        return out;
    }

    // ========== report vocabulary ==========

    /**
     * Single character for the progress line: {@code .} passed, {@code I} ignored, {@code F} otherwise.
     */
    public static String progressMark(CaseResult result) {
        if (result.isSkipped()) {
            return Style.IGNORED.apply("I");
        }
        return result.isPassed() ? "." : failureMark();
    }

    /**
     * Progress mark of a failed construction, before-all or after-all phase.
     */
    public static String failureMark() {
        return Style.FAILED.apply("F");
    }

    public static String verdict(boolean passed) {
        return passed ? Style.PASSED.apply("OK") : Style.FAILED.apply("NOT OK");
    }

    static String stripAnsi(String text) {
        return ANSI_PATTERN.matcher(text).replaceAll("");
    }

    // ========== output ==========

    public static void println(String text) {
        out.println(text);
        trace(text);
    }

    public static void println() {
        out.println();
    }

    /**
     * Prints without a line break and flushes, so progress marks show up as cases finish.
     */
    public static void print(String text) {
        out.print(text);
        out.flush();
        trace(text);
    }

    private static void trace(String text) {
        if (logger.isTraceEnabled()) {
            logger.trace(stripAnsi(text));
        }
    }

}
