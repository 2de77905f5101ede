package org.qthought.runtime.model;

import org.qthought.runtime.api.ConflictException;
import org.qthought.runtime.api.DimensionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Arena of register descriptors with a name-to-index map built once at allocation time.
 * Hot paths address registers through the resolved {@link Register} (integer offsets), never
 * through repeated string lookups.
 */
public final class RegisterLayout {

    private final List<Register> registers;
    private final Map<String, Integer> indexByName;
    private final int totalWidth;

    /**
     * Lays out the declared registers in the given order, the first one occupying the least
     * significant bits.
     *
     * @param declarations registers in storage order.
     * @throws ConflictException if two declarations share a name.
     */
    public RegisterLayout(List<RegisterDeclaration> declarations) {
        List<Register> placed = new ArrayList<>(declarations.size());
        Map<String, Integer> byName = new HashMap<>();
        int offset = 0;
        for (RegisterDeclaration declaration : declarations) {
            if (byName.containsKey(declaration.name())) {
                throw new ConflictException("Register '" + declaration.name() + "' is declared twice");
            }
            byName.put(declaration.name(), placed.size());
            placed.add(new Register(declaration.name(), declaration.role(), declaration.width(), offset, placed.size()));
            offset += declaration.width();
        }
        this.registers = Collections.unmodifiableList(placed);
        this.indexByName = Collections.unmodifiableMap(byName);
        this.totalWidth = offset;
    }

    /**
     * Resolves a register by name.
     * @param name the register name.
     * @return the register.
     * @throws DimensionException if no register has that name.
     */
    public Register register(String name) {
        Integer index = indexByName.get(name);
        if (index == null) {
            throw new DimensionException("Unknown register '" + name + "', known registers: " + indexByName.keySet());
        }
        return registers.get(index);
    }

    /**
     * @param name a register name.
     * @return true if the layout contains a register with that name.
     */
    public boolean contains(String name) {
        return indexByName.containsKey(name);
    }

    /**
     * @return all registers in storage order (least significant first).
     */
    public List<Register> registers() {
        return registers;
    }

    /**
     * @return the sum of all register widths.
     */
    public int totalWidth() {
        return totalWidth;
    }
}
