package com.frame.render;

/**
 * Renders the current scene. Supplied by the rendering backend.
 */
@FunctionalInterface
public interface Renderer {

    void render();
}
