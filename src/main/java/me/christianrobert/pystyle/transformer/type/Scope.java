package me.christianrobert.pystyle.transformer.type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bindings of one module, class or function body, in declaration order.
 *
 * <p>Name lookup walks the parent chain the way the origin language resolves names:
 * a function body sees its enclosing functions and the module, but not the body of
 * the class it is defined in. Class attributes are reached through {@code self.x}
 * via {@link #getEnclosingClass()}.</p>
 */
public class Scope {

    public enum ScopeKind {
        MODULE,
        CLASS,
        FUNCTION
    }

    private final String id;
    private final ScopeKind scopeKind;
    private final Scope parent;
    private final String receiverName;  // "self" of an instance method, else null
    private final Map<String, Binding> bindings = new LinkedHashMap<>();
    private boolean finalized;

    public Scope(String id, ScopeKind scopeKind, Scope parent, String receiverName) {
        this.id = id;
        this.scopeKind = scopeKind;
        this.parent = parent;
        this.receiverName = receiverName;
    }

    public Scope(String id, ScopeKind scopeKind, Scope parent) {
        this(id, scopeKind, parent, null);
    }

    public String getId() {
        return id;
    }

    public ScopeKind getScopeKind() {
        return scopeKind;
    }

    public Scope getParent() {
        return parent;
    }

    public boolean isFinalized() {
        return finalized;
    }

    /**
     * Receiver name visible here: the instance method's own, or the one of the method
     * a nested function is defined in. {@code null} outside instance methods.
     */
    public String getReceiverName() {
        Scope current = this;
        while (current != null && current.scopeKind == ScopeKind.FUNCTION) {
            if (current.receiverName != null) {
                return current.receiverName;
            }
            current = current.parent;
        }
        return null;
    }

    /**
     * Binding declared directly in this scope, or {@code null}.
     */
    public Binding resolveLocal(String name) {
        return bindings.get(name);
    }

    /**
     * Resolves a name through this scope and its visible ancestors.
     *
     * @return the binding, or {@code null} if the name is unbound
     */
    public Binding lookup(String name) {
        Binding local = bindings.get(name);
        if (local != null) {
            return local;
        }
        Scope current = parent;
        while (current != null) {
            // enclosing class bodies are never visible
            if (current.scopeKind != ScopeKind.CLASS) {
                Binding binding = current.bindings.get(name);
                if (binding != null) {
                    return binding;
                }
            }
            current = current.parent;
        }
        return null;
    }

    /**
     * Nearest enclosing class scope (this scope if it is one), or {@code null}.
     */
    public Scope getEnclosingClass() {
        Scope current = this;
        while (current != null && current.scopeKind != ScopeKind.CLASS) {
            current = current.parent;
        }
        return current;
    }

    public List<Binding> getBindings() {
        return Collections.unmodifiableList(new ArrayList<>(bindings.values()));
    }

    void declare(Binding binding) {
        if (finalized) {
            throw new IllegalStateException("Scope " + id + " is finalized; cannot declare " + binding.getName());
        }
        bindings.put(binding.getName(), binding);
    }

    void markFinalized() {
        finalized = true;
    }

    @Override
    public String toString() {
        return "Scope{" + id + ", " + scopeKind + ", bindings=" + bindings.keySet() + "}";
    }
}
