package me.christianrobert.pystyle.transformer.type;

import me.christianrobert.pystyle.transformer.ast.SyntaxNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Result of type inference: every scope with its frozen bindings, plus the names the
 * module defines itself (classes and functions).
 */
public class TypeEnvironment {

    private final Scope moduleScope;
    private final Map<String, Scope> scopesById;
    private final Map<SyntaxNode, Scope> scopesByDefinition;
    private final Set<String> classNames;
    private final Set<String> functionNames;
    private final ExpressionTypeResolver resolver;

    TypeEnvironment(Scope moduleScope, Map<String, Scope> scopesById, IdentityHashMap<SyntaxNode, Scope> scopesByDefinition,
                    Set<String> classNames, Set<String> functionNames, ExpressionTypeResolver resolver) {
        this.moduleScope = moduleScope;
        this.scopesById = Collections.unmodifiableMap(new LinkedHashMap<>(scopesById));
        this.scopesByDefinition = Collections.unmodifiableMap(new IdentityHashMap<>(scopesByDefinition));
        this.classNames = Collections.unmodifiableSet(classNames);
        this.functionNames = Collections.unmodifiableSet(functionNames);
        this.resolver = resolver;
    }

    public Scope getModuleScope() {
        return moduleScope;
    }

    public Scope getScope(String scopeId) {
        return scopesById.get(scopeId);
    }

    public List<Scope> getScopes() {
        return new ArrayList<>(scopesById.values());
    }

    /**
     * Scope opened by a module, class or function node, or {@code null} for a node the
     * inference pass never saw (e.g. one substituted at render time).
     */
    public Scope scopeOf(SyntaxNode definition) {
        return scopesByDefinition.get(definition);
    }

    /**
     * Looks up a binding by scope id and name, through the visible scope chain.
     */
    public Binding lookup(String scopeId, String name) {
        Scope scope = scopesById.get(scopeId);
        return scope != null ? scope.lookup(name) : null;
    }

    public boolean isModuleClass(String name) {
        return classNames.contains(name);
    }

    /**
     * True for names the module defines as class or function; these shadow builtins.
     */
    public boolean isUserDefined(String name) {
        return classNames.contains(name) || functionNames.contains(name);
    }

    public InferredType typeOf(SyntaxNode expression, Scope scope) {
        return resolver.resolve(expression, scope);
    }

    public ExpressionTypeResolver getResolver() {
        return resolver;
    }

    public int getBindingCount() {
        int count = 0;
        for (Scope scope : scopesById.values()) {
            count += scope.getBindings().size();
        }
        return count;
    }
}
