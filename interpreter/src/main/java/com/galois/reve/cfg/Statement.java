package com.galois.reve.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A non-terminating statement in a block.  Statements are created by the
 * builder methods of {@link Block}.
 */
public abstract class Statement {
    private final StatementResult result;

    Statement(StatementResult result) {
        this.result = result;
    }

    /**
     * Return the expression holding the value computed by this statement, or
     * <code>null</code> if it computes nothing.
     * @return the result
     */
    public StatementResult getResult() {
        return result;
    }

    /** Integer and Boolean binary operations. */
    public enum BinaryOpcode {
        ADD, SUB, MUL, SDIV, UDIV, SREM, UREM, SHL, LSHR, ASHR, AND, OR, XOR
    }

    /** Integer comparison predicates. */
    public enum Predicate {
        EQ, NE, SGE, SGT, SLE, SLT, UGE, UGT, ULE, ULT
    }

    /** Conversions between integer widths and pointers. */
    public enum CastOpcode {
        ZEXT, SEXT, TRUNC, PTR_TO_INT, INT_TO_PTR
    }

    /**
     * Selects a value depending on the block control came from.  PHI
     * statements come before all other statements of a block.
     */
    public static final class Phi extends Statement {
        private final Block block;
        private final Map<Block,Expr> incoming = new LinkedHashMap<Block,Expr>();

        Phi(StatementResult result, Block block) {
            super(result);
            this.block = block;
        }

        /**
         * Add the value taken when control arrives from <code>pred</code>.
         * @param pred the predecessor block
         * @param value the value
         * @return this statement
         */
        public Phi addIncoming(Block pred, Expr value) {
            if (pred == null) throw new NullPointerException("pred");
            Block.checkTypeEquals("value", value, getResult().type());
            if (pred.getProcedure() != block.getProcedure()) {
                throw new IllegalArgumentException("Incoming block belongs to another procedure.");
            }
            if (incoming.containsKey(pred)) {
                throw new IllegalArgumentException("Duplicate incoming block " + pred.getName() + ".");
            }
            incoming.put(pred, value);
            return this;
        }

        /**
         * Return the value for <code>pred</code>, or <code>null</code> if
         * there is none.
         */
        public Expr getIncoming(Block pred) {
            return incoming.get(pred);
        }

        public Map<Block,Expr> getIncomingValues() {
            return Collections.unmodifiableMap(incoming);
        }
    }

    /** Binary arithmetic or bitwise operation. */
    public static final class BinaryOp extends Statement {
        private final BinaryOpcode opcode;
        private final Expr lhs;
        private final Expr rhs;

        BinaryOp(StatementResult result, BinaryOpcode opcode, Expr lhs, Expr rhs) {
            super(result);
            this.opcode = opcode;
            this.lhs = lhs;
            this.rhs = rhs;
        }

        public BinaryOpcode getOpcode() { return opcode; }
        public Expr getLhs() { return lhs; }
        public Expr getRhs() { return rhs; }
    }

    /** Integer comparison. */
    public static final class Compare extends Statement {
        private final Predicate predicate;
        private final Expr lhs;
        private final Expr rhs;

        Compare(StatementResult result, Predicate predicate, Expr lhs, Expr rhs) {
            super(result);
            this.predicate = predicate;
            this.lhs = lhs;
            this.rhs = rhs;
        }

        public Predicate getPredicate() { return predicate; }
        public Expr getLhs() { return lhs; }
        public Expr getRhs() { return rhs; }
    }

    /** Width or pointer conversion.  The target type is the result type. */
    public static final class Cast extends Statement {
        private final CastOpcode opcode;
        private final Expr operand;

        Cast(StatementResult result, CastOpcode opcode, Expr operand) {
            super(result);
            this.opcode = opcode;
            this.operand = operand;
        }

        public CastOpcode getOpcode() { return opcode; }
        public Expr getOperand() { return operand; }
    }

    /** Indexed address computation. */
    public static final class AddressOf extends Statement {
        private final AddressLayout layout;
        private final Expr base;
        private final List<Expr> indices;

        AddressOf(StatementResult result, AddressLayout layout, Expr base, List<Expr> indices) {
            super(result);
            this.layout = layout;
            this.base = base;
            this.indices = Collections.unmodifiableList(new ArrayList<Expr>(indices));
        }

        public AddressLayout getLayout() { return layout; }
        public Expr getBase() { return base; }
        public List<Expr> getIndices() { return indices; }
    }

    /** Heap read.  The width read is the width of the result type. */
    public static final class Load extends Statement {
        private final Expr address;

        Load(StatementResult result, Expr address) {
            super(result);
            this.address = address;
        }

        public Expr getAddress() { return address; }
    }

    /** Heap write. */
    public static final class Store extends Statement {
        private final Expr address;
        private final Expr value;

        Store(Expr address, Expr value) {
            super(null);
            this.address = address;
            this.value = value;
        }

        public Expr getAddress() { return address; }
        public Expr getValue() { return value; }
    }

    /** Choice between two values on a Boolean condition. */
    public static final class Select extends Statement {
        private final Expr condition;
        private final Expr ifTrue;
        private final Expr ifFalse;

        Select(StatementResult result, Expr condition, Expr ifTrue, Expr ifFalse) {
            super(result);
            this.condition = condition;
            this.ifTrue = ifTrue;
            this.ifFalse = ifFalse;
        }

        public Expr getCondition() { return condition; }
        public Expr getTrueValue() { return ifTrue; }
        public Expr getFalseValue() { return ifFalse; }
    }

    /** Call of another procedure.  Void calls have no result. */
    public static final class Call extends Statement {
        private final Procedure callee;
        private final List<Expr> args;

        Call(StatementResult result, Procedure callee, List<Expr> args) {
            super(result);
            this.callee = callee;
            this.args = Collections.unmodifiableList(new ArrayList<Expr>(args));
        }

        public Procedure getCallee() { return callee; }
        public List<Expr> getArgs() { return args; }
    }
}
