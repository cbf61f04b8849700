package com.pmatrix.common.exception;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Base for every failure the encoder raises on purpose. The message is
 * prefixed with the {@link Component} that rejected the work, and callers at
 * the edge (HTTP error bodies, CLI output) report that component as-is.
 */
public class PmatrixException extends RuntimeException {

    /** Where in the pipeline a failure originated. */
    public enum Component {
        EMITTER("emitter"),
        CODEC("codec"),
        SERVICE("encoder-service");

        private final String label;

        Component(String label) {
            this.label = label;
        }

        @JsonValue
        public String label() {
            return label;
        }

        @Override
        public String toString() {
            return label;
        }
    }

    private final Component component;

    public PmatrixException(Component component, String message) {
        super("[" + component.label() + "] " + message);
        this.component = component;
    }

    public PmatrixException(Component component, String message, Throwable cause) {
        super("[" + component.label() + "] " + message, cause);
        this.component = component;
    }

    public Component getComponent() {
        return component;
    }
}
