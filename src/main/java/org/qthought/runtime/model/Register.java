package org.qthought.runtime.model;

/**
 * A register placed inside a {@link RegisterLayout}.
 * Bit {@code i} of the register is bit {@code offset + i} of the basis state index.
 *
 * @param name   unique register name
 * @param role   the role of the register
 * @param width  number of bits
 * @param offset position of the register's least significant bit in the basis state index
 * @param index  position of the register in the layout's storage order
 */
public record Register(String name, RegisterRole role, int width, int offset, int index) {

    /**
     * @return the number of classical values the register can hold, {@code 2^width}.
     */
    public int valueCount() {
        return 1 << width;
    }

    /**
     * @return a bit mask selecting this register's bits in a basis state index.
     */
    public int mask() {
        return ((1 << width) - 1) << offset;
    }

    /**
     * Extracts this register's value from a basis state index.
     * @param basisIndex the full basis state index.
     * @return the register value.
     */
    public int valueOf(int basisIndex) {
        return (basisIndex >>> offset) & ((1 << width) - 1);
    }
}
