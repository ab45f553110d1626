package me.christianrobert.pystyle.transformer.context;

/**
 * Scope state of the renderer. Every block the renderer opens pushes one of these;
 * the run ends when the module-level frame is popped.
 */
public enum RenderState {
    MODULE_LEVEL,
    CLASS_BODY,
    FUNCTION_BODY,
    BLOCK_BODY
}
