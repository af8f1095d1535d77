package com.taxengine.registry;

/**
 * Outcome of resolving a raw term against the registry.
 */
public sealed interface Resolution {

    /** Canonical key when mapped, otherwise the normalized term. */
    String key();

    boolean isMapped();

    record Mapped(String key) implements Resolution {
        @Override
        public boolean isMapped() {
            return true;
        }
    }

    record Unmapped(String key, String synonymId) implements Resolution {
        @Override
        public boolean isMapped() {
            return false;
        }
    }
}
