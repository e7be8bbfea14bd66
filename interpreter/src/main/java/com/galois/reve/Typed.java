package com.galois.reve;

/**
 * An object with an IR type associated.
 */
public interface Typed {
    /**
     * Return type of object.
     * @return the type
     */
    Type type();
}
