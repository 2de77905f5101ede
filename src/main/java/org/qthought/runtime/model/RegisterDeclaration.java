package org.qthought.runtime.model;

import java.util.Objects;

/**
 * A register as requested by the requirements ledger, before it has a position in a state vector.
 *
 * @param name  unique register name, e.g. {@code "s"} or {@code "Alice_memory"}
 * @param role  the role of the register
 * @param width the number of bits, always positive
 */
public record RegisterDeclaration(String name, RegisterRole role, int width) {

    public RegisterDeclaration {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(role, "role");
        if (width <= 0) {
            throw new IllegalArgumentException("Register width must be positive, got " + width + " for " + name);
        }
    }
}
