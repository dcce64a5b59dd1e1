package com.raditha.astcore.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Lexical scope record shared by all tokens of one block.
 * The qualified name (for example {@code "ns :: Foo"}) is fixed once the
 * scope is opened; the set of active {@code using namespace} directives
 * only grows as directives are inserted into the block.
 */
public final class ScopeInfo {

    private final String name;
    private final Token bodyEnd;
    private final Set<String> usingNamespaces;

    public ScopeInfo(String name, Token bodyEnd, Set<String> usingNamespaces) {
        this.name = name == null ? "" : name;
        this.bodyEnd = bodyEnd;
        this.usingNamespaces = new LinkedHashSet<>(usingNamespaces == null ? Set.of() : usingNamespaces);
    }

    /**
     * Root scope of a translation unit.
     */
    public static ScopeInfo root() {
        return new ScopeInfo("", null, Set.of());
    }

    public String name() {
        return name;
    }

    public Token bodyEnd() {
        return bodyEnd;
    }

    public Set<String> usingNamespaces() {
        return Collections.unmodifiableSet(usingNamespaces);
    }

    void addUsingNamespace(String nameSpace) {
        usingNamespaces.add(nameSpace);
    }

    @Override
    public String toString() {
        return name.isEmpty() ? "<global>" : name;
    }
}
