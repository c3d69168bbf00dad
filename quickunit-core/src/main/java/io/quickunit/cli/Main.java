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
package io.quickunit.cli;

import io.quickunit.core.Registry;
import io.quickunit.core.RunSummary;
import io.quickunit.core.Runner;
import io.quickunit.core.Selection;
import io.quickunit.output.Console;
import io.quickunit.output.JsonLinesReporter;
import io.quickunit.output.LogContext;
import io.quickunit.output.ProgressReporter;
import io.quickunit.output.TreeReporter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command line front end for a test program. The program builds its {@link Registry} and hands
 * over its arguments:
 * <pre>
 * public static void main(String[] args) {
 *     Registry registry = Registry.of(StackTest.SUITE, QueueTest.SUITE);
 *     Main.main(registry, args);
 * }
 * </pre>
 * Usage examples:
 * <pre>
 * # run everything, terse output
 * java -cp ... StackTests
 *
 * # list what the filters select, without running
 * java -cp ... StackTests --list -f "^StackTest\.testP"
 *
 * # tree output and a JSON Lines event file
 * java -cp ... StackTests -v --jsonl target/quickunit.jsonl
 * </pre>
 */
@Command(
        name = "quickunit",
        mixinStandardHelpOptions = true,
        versionProvider = Main.VersionProvider.class,
        description = "Run the registered unit tests"
)
public class Main implements Callable<Integer> {

    public static final String VERSION = "1.0.0";

    static class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            return new String[]{"quickunit " + VERSION};
        }
    }

    private final Registry registry;

    @Option(
            names = {"-f", "--filter"},
            paramLabel = "REGEX",
            description = "Select the cases whose Suite.case name matches, repeatable (default: all)"
    )
    List<String> filters;

    @Option(
            names = {"-l", "--list"},
            description = "Print the selected case names and exit"
    )
    boolean list;

    @Option(
            names = {"-v", "--verbose"},
            description = "Print one line per suite and case"
    )
    boolean verbose;

    @Option(
            names = {"--no-color"},
            description = "Disable colored output"
    )
    boolean noColor;

    @Option(
            names = {"--jsonl"},
            paramLabel = "FILE",
            description = "Also stream run events to this JSON Lines file"
    )
    Path jsonl;

    @Option(
            names = {"--duplicates"},
            description = "Run a case once per matching filter"
    )
    boolean duplicates;

    @Option(
            names = {"--log-level"},
            description = "Log level for the quickunit loggers (trace, debug, info, warn, error)"
    )
    String logLevel;

    public Main(Registry registry) {
        this.registry = registry;
    }

    /**
     * Parse the arguments, run and return the exit code without exiting.
     */
    public static int run(Registry registry, String... args) {
        return new CommandLine(new Main(registry)).execute(args);
    }

    public static void main(Registry registry, String... args) {
        System.exit(run(registry, args));
    }

    @Override
    public Integer call() {
        if (noColor) {
            Console.setColorsEnabled(false);
        }
        if (logLevel != null) {
            LogContext.setRuntimeLogLevel(logLevel);
        }
        Runner.Builder builder = Runner.builder(registry).filters(filters);
        if (duplicates) {
            builder.duplicates(true);
        }
        try {
            if (list) {
                Selection selection = builder.select();
                for (String name : selection.fullyQualifiedNames()) {
                    Console.println(name);
                }
                return CommandLine.ExitCode.OK;
            }
            builder.listener(verbose ? new TreeReporter() : new ProgressReporter());
            if (jsonl != null) {
                builder.listener(new JsonLinesReporter(jsonl));
            }
            RunSummary summary = builder.run();
            return summary.exitCode();
        } catch (IllegalArgumentException e) {
            Console.println(Console.Style.FAILED.apply(e.getMessage()));
            return CommandLine.ExitCode.USAGE;
        }
    }

    public Registry getRegistry() {
        return registry;
    }

}
