// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A parsed and analysed metric description: its name, header comments, parameters and its
 * decode and post bodies.
 *
 * @author mcomp
 */
public class MetricDescription {

    private final String name;
    private final List<String> headerComments;
    private final Scope parameters;
    private final Body decode;
    private final Body post;

    public MetricDescription(String name, List<String> headerComments, Scope parameters, Body decode, Body post) {
        this.name = name;
        this.headerComments = List.copyOf(headerComments);
        this.parameters = parameters;
        this.decode = decode;
        this.post = post;
    }

    /** The base name of the metric, taken from the description file name */
    public String name() { return name; }

    /** The leading comment lines of the description file */
    public List<String> headerComments() { return headerComments; }

    public Scope parameters() { return parameters; }

    public Body decode() { return decode; }

    public Body post() { return post; }

    /** Returns the pre-requisite code blocks of post followed by those of decode */
    public List<String> prerequisites() {
        List<String> prerequisites = new ArrayList<>(post.prerequisites());
        prerequisites.addAll(decode.prerequisites());
        return prerequisites;
    }

    @Override
    public String toString() { return "metric '" + name + "'"; }

}
