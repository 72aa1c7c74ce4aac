// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler.emit;

import com.google.common.collect.ImmutableMap;

import java.util.Optional;

/**
 * The insertion points a template may mark with a comment such as <code>/&#42; METRIC_PER_DOC &#42;/</code>.
 *
 * @author mcomp
 */
public enum Marker {

    /** The base name of the metric, on the marker line */
    NAME("METRIC_NAME"),
    /** The number of post statements, on the marker line */
    DEPENDS_POST("METRIC_DEPENDS_POST"),
    /** One-time setup code required by the quantities used */
    PRE("METRIC_PRE"),
    /** Post declarations and level 1 post statements */
    POST("METRIC_POST"),
    /** Level 2 post statements */
    POST_PER_DOC("METRIC_POST_PER_DOC"),
    /** Decode declarations */
    DECL("METRIC_DECL"),
    /** Level 1 decode statements */
    PER_CALL("METRIC_PER_CALL"),
    /** Level 2 and 3 decode statements */
    PER_DOC("METRIC_PER_DOC"),
    /** Level 2 and 3 decode statements with document quantities replaced by collection averages */
    CONTRIB("METRIC_CONTRIB");

    private static final ImmutableMap<String, Marker> byIdentifier;

    static {
        ImmutableMap.Builder<String, Marker> builder = ImmutableMap.builder();
        for (Marker marker : values())
            builder.put(marker.identifier, marker);
        byIdentifier = builder.build();
    }

    private final String identifier;

    Marker(String identifier) {
        this.identifier = identifier;
    }

    /** The word inside the marker comment */
    public String identifier() { return identifier; }

    /** Returns the marker comment as written to output */
    public String comment() { return "/* " + identifier + " */"; }

    public static Optional<Marker> fromIdentifier(String identifier) {
        return Optional.ofNullable(byIdentifier.get(identifier));
    }

}
