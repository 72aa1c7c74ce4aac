// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A namespace paired with the set of its names which are referenced.
 * The used set decides which declarations and pre-requisites are emitted.
 *
 * @author mcomp
 */
public class Scope {

    private final Namespace namespace;
    private final Set<String> used = new LinkedHashSet<>();

    public Scope(String name) {
        this.namespace = new Namespace(name);
    }

    public String name() { return namespace.name(); }

    public Namespace namespace() { return namespace; }

    /** Marks the given name as used in this scope */
    public void use(String name) { used.add(name); }

    public boolean isUsed(String name) { return used.contains(name); }

    /** The used names in the order they were first used */
    public Set<String> used() { return Collections.unmodifiableSet(used); }

    @Override
    public String toString() { return "scope " + name(); }

}
