// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler.emit;

import ai.vespa.metriccompiler.model.MetricDescription;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * The comment which replaces the leading comment of a template in generated code.
 *
 * @author mcomp
 */
public class GeneratedHeader {

    static final String generator = "vespa-metric-compiler";

    private static final DateTimeFormatter timestampFormat =
            DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.ENGLISH).withZone(ZoneOffset.UTC);

    private final String descriptionPath;
    private final String templatePath;
    private final Clock clock;

    public GeneratedHeader(String descriptionPath, String templatePath, Clock clock) {
        this.descriptionPath = descriptionPath;
        this.templatePath = templatePath;
        this.clock = clock;
    }

    public String render(MetricDescription metric) {
        StringBuilder b = new StringBuilder();
        b.append("/* ").append(metric.name().toLowerCase(Locale.ENGLISH)).append(".c implements the ")
         .append(metric.name()).append(" metric for the query\n");
        b.append(" * subsystem.  This file was automatically generated from\n");
        b.append(" * ").append(descriptionPath).append(" and ").append(templatePath).append("\n");
        b.append(" * by ").append(generator).append(" on ").append(timestampFormat.format(clock.instant())).append(".\n");
        b.append(" *\n");
        b.append(" * DO NOT MODIFY THIS FILE, as changes will be lost upon\n");
        b.append(" * subsequent regeneration.\n");
        b.append(" * Go modify ").append(descriptionPath).append(" or ").append(templatePath).append(" instead.\n");
        b.append(" *\n");
        if ( ! metric.headerComments().isEmpty()) {
            b.append(" * Comments from ").append(metric.name()).append(".metric:\n");
            b.append(" *\n");
            for (String comment : metric.headerComments())
                b.append(comment.isEmpty() ? " *" : " * " + comment).append("\n");
            b.append(" *\n");
        }
        b.append(" */\n");
        b.append("\n");
        return b.toString();
    }

}
