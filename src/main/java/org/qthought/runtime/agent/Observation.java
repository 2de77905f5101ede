package org.qthought.runtime.agent;

import java.util.Objects;

/**
 * A register looked at a given protocol time: one side of an inference table.
 *
 * @param register the register name
 * @param time     the protocol time
 */
public record Observation(String register, int time) {

    public Observation {
        Objects.requireNonNull(register, "register");
    }

    @Override
    public String toString() {
        return register + ":t" + time;
    }
}
