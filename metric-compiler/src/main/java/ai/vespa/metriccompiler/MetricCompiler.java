// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler;

import ai.vespa.metriccompiler.builtin.BuiltinQuantities;
import ai.vespa.metriccompiler.emit.GeneratedHeader;
import ai.vespa.metriccompiler.emit.TemplateWeaver;
import ai.vespa.metriccompiler.level.BlockLevelPropagator;
import ai.vespa.metriccompiler.level.LevelPropagator;
import ai.vespa.metriccompiler.model.MetricDescription;
import ai.vespa.metriccompiler.parse.MetricParser;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Compiles a metric description into native code: parses the description, assigns each statement
 * the level it must run at, and weaves the resulting code into a template.
 *
 * <p>Instances are stateless and may be reused. All output is returned as text, so nothing
 * is produced when compilation fails.</p>
 *
 * @author mcomp
 */
public class MetricCompiler {

    private static final Logger log = Logger.getLogger(MetricCompiler.class.getName());

    private final BuiltinQuantities builtins;
    private final LevelPropagator propagator;
    private final Clock clock;

    public MetricCompiler(BuiltinQuantities builtins, LevelPropagator propagator, Clock clock) {
        this.builtins = builtins;
        this.propagator = propagator;
        this.clock = clock;
    }

    public MetricCompiler() {
        this(BuiltinQuantities.standard(), new BlockLevelPropagator(), Clock.systemUTC());
    }

    /** Returns the metric name of a description file: its file name up to the first '.' */
    public static String metricName(Path descriptionFile) {
        String fileName = descriptionFile.getFileName().toString();
        int dot = fileName.indexOf('.');
        return dot < 0 ? fileName : fileName.substring(0, dot);
    }

    /** Parses and levels the given description file */
    public MetricDescription analyze(Path descriptionFile) throws IOException, MetricCompileException {
        return analyze(read(descriptionFile), descriptionFile.toString(), metricName(descriptionFile));
    }

    /**
     * Parses and levels a description.
     *
     * @param description the description text
     * @param sourceName the name used in error messages
     * @param metricName the name of the metric
     */
    public MetricDescription analyze(String description, String sourceName, String metricName) throws MetricCompileException {
        try (Reader reader = new StringReader(description)) {
            MetricDescription metric = new MetricParser(new CompilationContext(sourceName), builtins).parse(reader, metricName);
            propagator.propagate(metric.decode().statements());
            propagator.propagate(metric.post().statements());
            log.log(Level.FINE, () -> "Analyzed " + metric + ": " + metric.decode() + ", " + metric.post());
            return metric;
        }
        catch (IOException e) {
            throw new IllegalStateException("Reading from a string failed", e);
        }
    }

    /** Compiles the given description file into the given template and returns the resulting native code */
    public String compile(Path descriptionFile, Path templateFile) throws IOException, MetricCompileException {
        MetricDescription metric = analyze(descriptionFile);
        return weave(metric, read(templateFile), descriptionFile.toString(), templateFile.toString());
    }

    /** Weaves code generated from an analyzed description into a template */
    public String weave(MetricDescription metric, String template, String descriptionPath, String templatePath) {
        return new TemplateWeaver(metric, new GeneratedHeader(descriptionPath, templatePath, clock)).weave(template);
    }

    private static String read(Path file) throws IOException {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        }
        catch (IOException e) {
            throw new IOException("Could not read '" + file + "': " + e.getMessage(), e);
        }
    }

}
