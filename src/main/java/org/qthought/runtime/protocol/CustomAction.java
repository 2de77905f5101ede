package org.qthought.runtime.protocol;

import org.qthought.runtime.internal.services.ExecutionContext;

/**
 * A user-defined step body, bound to an identifier in a {@link Protocol}'s custom action table.
 * It only sees the registers of its step's domain through the context.
 */
@FunctionalInterface
public interface CustomAction {

    /**
     * @param context the domain-scoped execution context.
     */
    void execute(ExecutionContext context);
}
