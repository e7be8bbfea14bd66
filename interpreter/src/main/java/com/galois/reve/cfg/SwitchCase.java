package com.galois.reve.cfg;

/**
 * One case of a switch: the block control goes to when the scrutinee equals
 * the case value.
 */
public final class SwitchCase {
    private final IntConstant value;
    private final Block target;

    SwitchCase(IntConstant value, Block target) {
        this.value = value;
        this.target = target;
    }

    public IntConstant getValue() {
        return value;
    }

    public Block getTarget() {
        return target;
    }

    public String toString() {
        return value.getValue() + " -> " + target.getName();
    }
}
