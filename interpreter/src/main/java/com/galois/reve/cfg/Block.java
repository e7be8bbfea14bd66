package com.galois.reve.cfg;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.galois.reve.Type;
import com.galois.reve.Typed;

/**
 * A contiguous set of statements in a control flow graph: PHI statements,
 * then ordinary statements, then one terminator.
 */
public final class Block {
    private final Procedure procedure;
    /** The index of this block in the CFG. */
    private final int blockIndex;
    private final String name;

    private final List<Statement.Phi> phis;
    private final List<Statement> statements;

    /**
     * The terminal statement of this block or <code>null</code>
     * if it has not been defined.
     */
    private TermStmt termStmt;

    /**
     * Internal method for creating a block
     */
    Block(Procedure procedure, int blockIndex, String name) {
        this.procedure = procedure;
        this.blockIndex = blockIndex;
        this.name = name;
        this.phis = new ArrayList<Statement.Phi>();
        this.statements = new ArrayList<Statement>();
        this.termStmt = null;
    }

    /**
     * Get control-flow graph that this block is part of.
     */
    public Procedure getProcedure() {
        return procedure;
    }

    public int getIndex() {
        return blockIndex;
    }

    public String getName() {
        return name;
    }

    public List<Statement.Phi> getPhis() {
        return Collections.unmodifiableList(phis);
    }

    /**
     * Return the statements following the PHI statements.
     */
    public List<Statement> getStatements() {
        return Collections.unmodifiableList(statements);
    }

    /**
     * Return the terminator, or <code>null</code> if the block is not
     * terminated yet.
     */
    public TermStmt getTermStmt() {
        return termStmt;
    }

    public boolean isTerminated() {
        return termStmt != null;
    }

    // Check value is non-null and have type equal to tp.
    static void checkTypeEquals(String nm, Typed v, Type tp) {
        checkNotNull(nm, v);
        if (!v.type().equals(tp)) {
            String msg = String.format("%s has incorrect type. Expected %s, but got %s", nm, tp.toString(), v.type().toString());
            throw new IllegalArgumentException(msg);
        }
    }

    private static void checkNotNull(String nm, Object v) {
        if (v == null) {
            String msg = String.format("%s must not be null.", nm);
            throw new NullPointerException(msg);
        }
    }

    // Check value is an integer wider than one bit or a pointer.
    private static void checkIntLike(String nm, Typed v) {
        checkNotNull(nm, v);
        if (!v.type().isIntLike()) {
            String msg = String.format("%s must be an integer or pointer, but has type %s", nm, v.type().toString());
            throw new IllegalArgumentException(msg);
        }
    }

    void checkTarget(String nm, Block target) {
        checkNotNull(nm, target);
        if (target.procedure != procedure) {
            throw new IllegalArgumentException(nm + " belongs to another procedure.");
        }
    }

    private void checkOpen() {
        if (this.termStmt != null) {
            throw new IllegalStateException("This block has already been terminated.");
        }
    }

    private StatementResult newResult(Type type) {
        return new StatementResult(procedure.getId(), blockIndex, phis.size() + statements.size(), type);
    }

    private StatementResult addStatement(Statement stmt) {
        checkOpen();
        statements.add(stmt);
        return stmt.getResult();
    }

    private void setTermStmt(TermStmt termStmt) {
        checkOpen();
        this.termStmt = termStmt;
    }

    public Expr boolLiteral(boolean val) {
        return new IntConstant(1, val ? 1 : 0);
    }

    public Expr intLiteral(long width, long val) {
        return new IntConstant(width, val);
    }

    public Expr intLiteral(long width, BigInteger val) {
        return new IntConstant(width, val);
    }

    /**
     * Add a PHI statement.  Incoming values are added to the returned
     * statement.
     * @param type the type of the value
     * @return the statement
     */
    public Statement.Phi phi(Type type) {
        checkOpen();
        checkNotNull("type", type);
        if (type.isVoid()) {
            throw new IllegalArgumentException("PHI statements cannot have void type.");
        }
        if (!statements.isEmpty()) {
            throw new IllegalStateException("PHI statements must come before other statements.");
        }
        Statement.Phi p = new Statement.Phi(newResult(type), this);
        phis.add(p);
        return p;
    }

    /**
     * Add a binary operation.  Both operands must have the same type.
     */
    public StatementResult binaryOp(Statement.BinaryOpcode op, Expr lhs, Expr rhs) {
        checkNotNull("op", op);
        checkNotNull("lhs", lhs);
        if (!(lhs.type().isInteger() || lhs.type().isPointer())) {
            throw new IllegalArgumentException("lhs must be an integer, but has type " + lhs.type());
        }
        checkTypeEquals("rhs", rhs, lhs.type());
        return addStatement(new Statement.BinaryOp(newResult(lhs.type()), op, lhs, rhs));
    }

    public StatementResult add(Expr lhs, Expr rhs) {
        return binaryOp(Statement.BinaryOpcode.ADD, lhs, rhs);
    }

    public StatementResult sub(Expr lhs, Expr rhs) {
        return binaryOp(Statement.BinaryOpcode.SUB, lhs, rhs);
    }

    public StatementResult mul(Expr lhs, Expr rhs) {
        return binaryOp(Statement.BinaryOpcode.MUL, lhs, rhs);
    }

    /**
     * Add a comparison.  The result is a Boolean.
     */
    public StatementResult icmp(Statement.Predicate pred, Expr lhs, Expr rhs) {
        checkNotNull("pred", pred);
        checkNotNull("lhs", lhs);
        if (lhs.type().isVoid()) {
            throw new IllegalArgumentException("lhs cannot have void type.");
        }
        checkTypeEquals("rhs", rhs, lhs.type());
        return addStatement(new Statement.Compare(newResult(Type.BOOL), pred, lhs, rhs));
    }

    /**
     * Add a conversion of <code>operand</code> to <code>type</code>.
     */
    public StatementResult cast(Statement.CastOpcode op, Expr operand, Type type) {
        checkNotNull("op", op);
        checkNotNull("operand", operand);
        checkNotNull("type", type);
        Type from = operand.type();
        boolean ok;
        switch (op) {
        case ZEXT:
        case SEXT:
            ok = from.isInteger() && type.isInteger() && type.getWidth() >= from.getWidth();
            break;
        case TRUNC:
            ok = from.isInteger() && type.isInteger() && type.getWidth() <= from.getWidth();
            break;
        case PTR_TO_INT:
            ok = from.isPointer() && type.isIntLike() && type.isInteger();
            break;
        default:
            ok = from.isIntLike() && type.isPointer();
            break;
        }
        if (!ok) {
            String msg = String.format("Cannot %s from %s to %s", op, from, type);
            throw new IllegalArgumentException(msg);
        }
        return addStatement(new Statement.Cast(newResult(type), op, operand));
    }

    /**
     * Add an indexed address computation.  The result is a pointer.
     */
    public StatementResult addressOf(AddressLayout layout, Expr base, Expr... indices) {
        checkNotNull("layout", layout);
        checkTypeEquals("base", base, Type.POINTER);
        for (Expr i : indices) {
            checkIntLike("index", i);
        }
        return addStatement(new Statement.AddressOf(newResult(Type.POINTER), layout, base, Arrays.asList(indices)));
    }

    /**
     * Add a heap read of a value of the given type.
     */
    public StatementResult load(Expr address, Type type) {
        checkIntLike("address", address);
        checkNotNull("type", type);
        if (!type.isIntLike()) {
            throw new IllegalArgumentException("Cannot load a value of type " + type);
        }
        return addStatement(new Statement.Load(newResult(type), address));
    }

    /**
     * Add a heap write.
     */
    public void store(Expr address, Expr value) {
        checkIntLike("address", address);
        checkIntLike("value", value);
        addStatement(new Statement.Store(address, value));
    }

    /**
     * Add a choice between two values of the same type.
     */
    public StatementResult select(Expr cond, Expr ifTrue, Expr ifFalse) {
        checkTypeEquals("cond", cond, Type.BOOL);
        checkNotNull("ifTrue", ifTrue);
        checkTypeEquals("ifFalse", ifFalse, ifTrue.type());
        return addStatement(new Statement.Select(newResult(ifTrue.type()), cond, ifTrue, ifFalse));
    }

    /**
     * Add a call to <code>callee</code>.
     * @return the result, or <code>null</code> if the callee returns void
     */
    public StatementResult call(Procedure callee, Expr... args) {
        checkNotNull("callee", callee);
        int cnt = callee.getArgCount();
        if (cnt != args.length) {
            throw new IllegalArgumentException("Incorrect number of arguments.");
        }
        for (int i = 0; i != cnt; ++i) {
            checkTypeEquals("arg", args[i], callee.getArg(i).type());
        }
        Type rt = callee.getReturnType();
        StatementResult r = rt.isVoid() ? null : newResult(rt);
        checkOpen();
        statements.add(new Statement.Call(r, callee, Arrays.asList(args)));
        return r;
    }

    /**
     * End block with a return of <code>value</code>.
     */
    public void returnExpr(Expr value) {
        checkTypeEquals("value", value, procedure.getReturnType());
        setTermStmt(new TermStmt.Return(value));
    }

    /**
     * End block with a return from a void procedure.
     */
    public void returnVoid() {
        if (!procedure.getReturnType().isVoid()) {
            throw new IllegalArgumentException("Procedure must return a value of type " + procedure.getReturnType());
        }
        setTermStmt(new TermStmt.Return(null));
    }

    /**
     * End block with jump to <code>target</code>.
     */
    public void jump(Block target) {
        checkTarget("target", target);
        setTermStmt(new TermStmt.Jump(target));
    }

    /**
     * End block with a branch on <code>cond</code>.
     */
    public void branch(Expr cond, Block ifTrue, Block ifFalse) {
        checkTypeEquals("cond", cond, Type.BOOL);
        checkTarget("ifTrue", ifTrue);
        checkTarget("ifFalse", ifFalse);
        setTermStmt(new TermStmt.Branch(cond, ifTrue, ifFalse));
    }

    /**
     * End block with a switch on <code>scrutinee</code>.  Cases are added to
     * the returned terminator.
     */
    public TermStmt.Switch switchOn(Expr scrutinee, Block defaultTarget) {
        checkNotNull("scrutinee", scrutinee);
        if (!scrutinee.type().isInteger() || scrutinee.type().isBool()) {
            throw new IllegalArgumentException("Switch scrutinee must be an integer, but has type " + scrutinee.type());
        }
        checkTarget("defaultTarget", defaultTarget);
        TermStmt.Switch s = new TermStmt.Switch(scrutinee, defaultTarget);
        setTermStmt(s);
        return s;
    }

    public String toString() {
        return procedure.getName() + ":" + name;
    }
}
