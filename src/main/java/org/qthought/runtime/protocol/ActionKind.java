package org.qthought.runtime.protocol;

/**
 * The variants of {@link StepAction}.
 */
public enum ActionKind {
    APPLY_UNITARY,
    OBSERVE,
    PREP_INFERENCE,
    MAKE_INFERENCE,
    MEASURE,
    LOG_STATE,
    CUSTOM
}
