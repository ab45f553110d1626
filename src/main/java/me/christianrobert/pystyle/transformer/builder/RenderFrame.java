package me.christianrobert.pystyle.transformer.builder;

import me.christianrobert.pystyle.transformer.context.RenderState;
import me.christianrobert.pystyle.transformer.type.Scope;

import java.util.HashSet;
import java.util.Set;

/**
 * One entry of the renderer's scope stack.
 *
 * <p>Module, class and function bodies open a frame on their own inference scope.
 * Nested blocks (if/for/while bodies, comprehension loops) open a {@link RenderState#BLOCK_BODY}
 * frame that copies the declared names of its parent. Names declared inside a block are not
 * visible after it, the same as in the target dialect.</p>
 */
class RenderFrame {

    private final RenderState state;
    private final Scope scope;
    private final String className;
    private final String receiverName;
    private final String receiverText;
    private final Set<String> declaredNames;

    private RenderFrame(RenderState state, Scope scope, String className, String receiverName,
                        String receiverText, Set<String> declaredNames) {
        this.state = state;
        this.scope = scope;
        this.className = className;
        this.receiverName = receiverName;
        this.receiverText = receiverText;
        this.declaredNames = declaredNames;
    }

    static RenderFrame module(Scope scope) {
        return new RenderFrame(RenderState.MODULE_LEVEL, scope, null, null, null, new HashSet<>());
    }

    static RenderFrame classBody(Scope scope, String className) {
        return new RenderFrame(RenderState.CLASS_BODY, scope, className, null, null, new HashSet<>());
    }

    /**
     * @param receiverName name of the receiver parameter ({@code self}, {@code cls}), or null
     * @param receiverText what the receiver renders as ({@code this} or the class name)
     */
    static RenderFrame function(Scope scope, String className, String receiverName, String receiverText) {
        return new RenderFrame(RenderState.FUNCTION_BODY, scope, className, receiverName, receiverText,
                new HashSet<>());
    }

    RenderFrame block() {
        return block(scope);
    }

    RenderFrame block(Scope blockScope) {
        return new RenderFrame(RenderState.BLOCK_BODY, blockScope, className, receiverName, receiverText,
                new HashSet<>(declaredNames));
    }

    RenderState getState() {
        return state;
    }

    Scope getScope() {
        return scope;
    }

    String getClassName() {
        return className;
    }

    String getReceiverName() {
        return receiverName;
    }

    String getReceiverText() {
        return receiverText;
    }

    boolean isDeclared(String name) {
        return declaredNames.contains(name);
    }

    /**
     * Marks a name as declared in this frame.
     *
     * @return true if the name was not declared before
     */
    boolean declare(String name) {
        return declaredNames.add(name);
    }
}
