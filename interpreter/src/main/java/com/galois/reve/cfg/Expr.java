package com.galois.reve.cfg;

import com.galois.reve.Typed;

/**
 * Interface that all expressions referenced in control flow graph must implement.
 *
 * <p>
 * Expressions are small handles compared by value, so they can key the
 * bindings of an {@link com.galois.reve.Environment}.
 */
public interface Expr extends Typed {
    /**
     * Return the name used for this expression in recorded states.
     * @return the name
     */
    String getName();
}
