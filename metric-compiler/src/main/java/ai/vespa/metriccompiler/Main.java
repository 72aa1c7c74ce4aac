// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler;

import ai.vespa.metriccompiler.builtin.BuiltinQuantities;
import ai.vespa.metriccompiler.emit.DebugDump;
import ai.vespa.metriccompiler.level.LevelPropagator;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The vespa-metric-compiler tool compiles a ranking metric description into native code, and prints it to stdout.
 *
 * @author mcomp
 */
public class Main {

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURE = 2;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** Runs the compiler with the given arguments and returns the exit status */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        CommandLineOptions options = new CommandLineOptions();
        CompilerParameters params;
        try {
            params = options.parseCommandLineArguments(args);
        } catch (IllegalArgumentException e) {
            err.printf("Failed to parse command line arguments: %s.\n", e.getMessage());
            options.printUsage(err);
            return EXIT_FAILURE;
        }

        if (params.help) {
            options.printHelp(out);
            return EXIT_SUCCESS;
        }
        if (params.version) {
            out.println(CommandLineOptions.versionText);
            return EXIT_SUCCESS;
        }

        setLogLevel(params.verbose ? Level.FINE : Level.WARNING);
        try {
            MetricCompiler compiler = new MetricCompiler(BuiltinQuantities.standard(),
                                                         LevelPropagator.named(params.propagation),
                                                         Clock.systemUTC());
            Path descriptionFile = Path.of(params.descriptionFile);
            String output = params.debug ? DebugDump.of(compiler.analyze(descriptionFile))
                                         : compiler.compile(descriptionFile, Path.of(params.templateFile));
            out.print(output);
            out.flush();
            return EXIT_SUCCESS;
        } catch (MetricCompileException e) {
            err.println(e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException e) {
            err.printf("Failed to compile metric: %s\n", e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static void setLogLevel(Level level) {
        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler handler : root.getHandlers())
            handler.setLevel(level);
    }

}
