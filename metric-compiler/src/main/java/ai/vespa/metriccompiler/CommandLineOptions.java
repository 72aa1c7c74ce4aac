// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler;

import ai.vespa.metriccompiler.builtin.BuiltinQuantities;
import ai.vespa.metriccompiler.builtin.BuiltinQuantity;
import ai.vespa.metriccompiler.level.BlockLevelPropagator;
import ai.vespa.metriccompiler.level.LevelPropagator;
import ai.vespa.metriccompiler.level.LinearLevelPropagator;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Parses the command line arguments of the metric compiler and prints its help page.
 *
 * @author mcomp
 */
public class CommandLineOptions {

    public static final String HELP_OPTION = "help";
    public static final String VERSION_OPTION = "version";
    public static final String DEBUG_OPTION = "debug";
    public static final String VERBOSE_OPTION = "verbose";
    public static final String PROPAGATION_OPTION = "propagation";

    static final String programName = "vespa-metric-compiler";
    static final String versionText = programName + " version 0.2";
    static final String syntax = programName + " [options] <description-file> <template-file>";

    private final Options options = createOptions();
    private final BuiltinQuantities builtins;

    public CommandLineOptions(BuiltinQuantities builtins) {
        this.builtins = builtins;
    }

    public CommandLineOptions() {
        this(BuiltinQuantities.standard());
    }

    private static Options createOptions() {
        Options options = new Options();

        options.addOption(Option.builder("h")
                .hasArg(false)
                .desc("Show this syntax page.")
                .longOpt(HELP_OPTION)
                .build());

        options.addOption(Option.builder("v")
                .hasArg(false)
                .desc("Show the version of this program.")
                .longOpt(VERSION_OPTION)
                .build());

        options.addOption(Option.builder()
                .hasArg(false)
                .desc("Print the analyzed description instead of generating code. The template file is not read.")
                .longOpt(DEBUG_OPTION)
                .build());

        options.addOption(Option.builder()
                .hasArg(false)
                .desc("Log diagnostics to standard error.")
                .longOpt(VERBOSE_OPTION)
                .build());

        options.addOption(Option.builder()
                .hasArg(true)
                .desc("How statement levels are propagated within brace groups: '" + BlockLevelPropagator.name +
                      "' or '" + LinearLevelPropagator.name + "' (default '" + BlockLevelPropagator.name + "').")
                .longOpt(PROPAGATION_OPTION)
                .argName("strategy")
                .build());

        return options;
    }

    public void printHelp(PrintStream out) {
        HelpFormatter formatter = new HelpFormatter();
        PrintWriter writer = new PrintWriter(out);
        formatter.printHelp(writer, formatter.getWidth(),
                            syntax,
                            "Compile a ranking metric description into native code by filling in a template.",
                            options, formatter.getLeftPadding(), formatter.getDescPadding(),
                            "\n" + builtinHelp(), false);
        writer.flush();
    }

    /** Prints the one line syntax of this program, followed by a pointer to the help page */
    public void printUsage(PrintStream out) {
        HelpFormatter formatter = new HelpFormatter();
        PrintWriter writer = new PrintWriter(out);
        formatter.printUsage(writer, formatter.getWidth(), syntax);
        writer.println("Run '" + programName + " --help' for the options and available quantities.");
        writer.flush();
    }

    /** Returns a listing of the quantities available in decode and post bodies */
    String builtinHelp() {
        return "Quantities available in decode():\n" + listing(quantity -> true) +
               "Quantities available in post():\n" + listing(quantity -> ! quantity.decodeOnly());
    }

    private String listing(Predicate<BuiltinQuantity> filter) {
        List<BuiltinQuantity> quantities = builtins.quantities().stream()
                                                   .filter(filter)
                                                   .sorted(Comparator.comparing(BuiltinQuantity::name))
                                                   .collect(Collectors.toList());
        StringBuilder b = new StringBuilder();
        for (BuiltinQuantity quantity : quantities)
            b.append(String.format("  %-14s %s\n", quantity.name(), quantity.description()));
        return b.toString();
    }

    public CompilerParameters parseCommandLineArguments(String[] args) throws IllegalArgumentException {
        try {
            CommandLineParser clp = new DefaultParser();
            CommandLine cl = clp.parse(options, args);

            boolean help = cl.hasOption(HELP_OPTION);
            boolean version = cl.hasOption(VERSION_OPTION);
            boolean debug = cl.hasOption(DEBUG_OPTION);
            boolean verbose = cl.hasOption(VERBOSE_OPTION);
            String propagation = cl.getOptionValue(PROPAGATION_OPTION, BlockLevelPropagator.name);
            List<String> files = cl.getArgList();

            CompilerParameters.Builder paramsBuilder = new CompilerParameters.Builder()
                    .setHelp(help)
                    .setVersion(version)
                    .setDebug(debug)
                    .setVerbose(verbose)
                    .setPropagation(propagation);
            LevelPropagator.named(propagation); // validates the name, also when only help or version is asked for
            if (help || version)
                return paramsBuilder.build();

            if (files.size() < 2)
                throw new IllegalArgumentException("Expected a description file and a template file");
            if (files.size() > 2)
                throw new IllegalArgumentException("Unexpected argument '" + files.get(files.size() - 1) + "'");

            return paramsBuilder
                    .setDescriptionFile(files.get(0))
                    .setTemplateFile(files.get(1))
                    .build();
        } catch (ParseException pe) {
            throw new IllegalArgumentException(pe.getMessage());
        }
    }

}
