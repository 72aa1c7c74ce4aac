// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A mapping from names to the declarations visible in one scope.
 * Iteration follows insertion order.
 *
 * @author mcomp
 */
public class Namespace {

    private final String name;
    private final Map<String, Declaration> declarations = new LinkedHashMap<>();

    public Namespace(String name) {
        this.name = name;
    }

    public String name() { return name; }

    public boolean contains(String name) { return declarations.containsKey(name); }

    public Optional<Declaration> get(String name) {
        return Optional.ofNullable(declarations.get(name));
    }

    /**
     * Adds a declaration to this.
     *
     * @throws IllegalStateException if the name is already declared here. Callers report collisions as
     *         compile errors before adding, so this indicates a bug.
     */
    public void add(Declaration declaration) {
        Declaration previous = declarations.putIfAbsent(declaration.name(), declaration);
        if (previous != null)
            throw new IllegalStateException("'" + declaration.name() + "' is already declared in " + name);
    }

    public Collection<Declaration> declarations() { return Collections.unmodifiableCollection(declarations.values()); }

    public int size() { return declarations.size(); }

    @Override
    public String toString() { return name + " " + declarations; }

}
