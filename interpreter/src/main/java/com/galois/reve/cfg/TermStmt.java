package com.galois.reve.cfg;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The statement ending a block.
 */
public abstract class TermStmt {
    TermStmt() {}

    /** Return from the procedure, with or without a value. */
    public static final class Return extends TermStmt {
        private final Expr value;

        Return(Expr value) {
            this.value = value;
        }

        /**
         * Return the returned expression, or <code>null</code> for a void
         * return.
         */
        public Expr getValue() {
            return value;
        }
    }

    /** Unconditional jump. */
    public static final class Jump extends TermStmt {
        private final Block target;

        Jump(Block target) {
            this.target = target;
        }

        public Block getTarget() {
            return target;
        }
    }

    /** Conditional branch on a Boolean. */
    public static final class Branch extends TermStmt {
        private final Expr condition;
        private final Block ifTrue;
        private final Block ifFalse;

        Branch(Expr condition, Block ifTrue, Block ifFalse) {
            this.condition = condition;
            this.ifTrue = ifTrue;
            this.ifFalse = ifFalse;
        }

        public Expr getCondition() { return condition; }
        public Block getTrueTarget() { return ifTrue; }
        public Block getFalseTarget() { return ifFalse; }
    }

    /**
     * Multi-way branch on an integer.  Cases are tried in the order they
     * were added.
     */
    public static final class Switch extends TermStmt {
        private final Expr scrutinee;
        private final Block defaultTarget;
        private final List<SwitchCase> cases = new ArrayList<SwitchCase>();

        Switch(Expr scrutinee, Block defaultTarget) {
            this.scrutinee = scrutinee;
            this.defaultTarget = defaultTarget;
        }

        /**
         * Add a case.  The value has the width of the scrutinee.
         * @param value the case value
         * @param target where control goes when the scrutinee equals value
         * @return this switch
         */
        public Switch addCase(BigInteger value, Block target) {
            if (value == null) throw new NullPointerException("value");
            Block owner = defaultTarget;
            owner.checkTarget("target", target);
            cases.add(new SwitchCase(new IntConstant(scrutinee.type().getWidth(), value), target));
            return this;
        }

        public Switch addCase(long value, Block target) {
            return addCase(BigInteger.valueOf(value), target);
        }

        public Expr getScrutinee() { return scrutinee; }
        public Block getDefaultTarget() { return defaultTarget; }

        public List<SwitchCase> getCases() {
            return Collections.unmodifiableList(cases);
        }
    }
}
