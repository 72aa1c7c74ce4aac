// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler;

import ai.vespa.metriccompiler.level.BlockLevelPropagator;

/**
 * The program parameters of the metric compiler.
 *
 * @author mcomp
 */
public class CompilerParameters {

    // Determines if the help page should be presented
    public final boolean help;
    // Print the version and exit
    public final boolean version;
    // Dump the analyzed description instead of generating code
    public final boolean debug;
    // Log diagnostics to standard error
    public final boolean verbose;
    // Name of the level propagation strategy
    public final String propagation;
    // The metric description to compile
    public final String descriptionFile;
    // The native code template to weave into. Empty when debugging.
    public final String templateFile;

    private CompilerParameters(boolean help, boolean version, boolean debug, boolean verbose,
                               String propagation, String descriptionFile, String templateFile) {
        this.help = help;
        this.version = version;
        this.debug = debug;
        this.verbose = verbose;
        this.propagation = propagation;
        this.descriptionFile = descriptionFile;
        this.templateFile = templateFile;
    }

    public static class Builder {

        private boolean help;
        private boolean version;
        private boolean debug;
        private boolean verbose;
        private String propagation = BlockLevelPropagator.name;
        private String descriptionFile = "";
        private String templateFile = "";

        public Builder setHelp(boolean help) {
            this.help = help;
            return this;
        }

        public Builder setVersion(boolean version) {
            this.version = version;
            return this;
        }

        public Builder setDebug(boolean debug) {
            this.debug = debug;
            return this;
        }

        public Builder setVerbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public Builder setPropagation(String propagation) {
            this.propagation = propagation;
            return this;
        }

        public Builder setDescriptionFile(String descriptionFile) {
            this.descriptionFile = descriptionFile;
            return this;
        }

        public Builder setTemplateFile(String templateFile) {
            this.templateFile = templateFile;
            return this;
        }

        public CompilerParameters build() {
            return new CompilerParameters(help, version, debug, verbose, propagation, descriptionFile, templateFile);
        }

    }

}
