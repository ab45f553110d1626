package me.christianrobert.pystyle.transformer.ast;

/**
 * Qualified scope identifiers: {@code <module>}, {@code <module>.Greeter},
 * {@code <module>.Greeter.greet}.
 */
public final class ScopeNames {

    public static final String MODULE = "<module>";

    private ScopeNames() {
    }

    public static String child(String parentScopeId, String name) {
        return parentScopeId + "." + name;
    }
}
