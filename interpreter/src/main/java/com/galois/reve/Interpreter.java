package com.galois.reve;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.galois.reve.cfg.Block;
import com.galois.reve.cfg.Expr;
import com.galois.reve.cfg.IntConstant;
import com.galois.reve.cfg.NullPointer;
import com.galois.reve.cfg.Procedure;
import com.galois.reve.cfg.ReturnValue;
import com.galois.reve.cfg.Statement;
import com.galois.reve.cfg.StatementResult;
import com.galois.reve.cfg.SwitchCase;
import com.galois.reve.cfg.TermStmt;

/**
 * Executes procedures concretely and records what happened.
 *
 * <p>
 * Execution proceeds block by block from the entry block.  Every visited
 * block is recorded as a {@link BlockStep} holding the state right after its
 * PHI statements.  Block visits are counted against a {@link StepBudget}
 * shared by the whole call tree; when it runs out every active call stops and
 * is marked as an early exit.
 */
public final class Interpreter {
    private final RunConfig config;

    /** Stream to write any status messages to.  Null indicates no logging */
    private PrintStream statusStream = null;

    public Interpreter(RunConfig config) {
        if (config == null) throw new NullPointerException("config");
        this.config = config;
    }

    public RunConfig getConfig() {
        return config;
    }

    /**
     * Set the stream to write logging messages to.
     * @param s The stream.
     */
    public void setStatusStream(PrintStream s) {
        statusStream = s;
    }

    private void logStatus(String msg) {
        if (statusStream != null) {
            statusStream.printf("reve-interpreter: %s\n", msg);
            statusStream.flush();
        }
    }

    /**
     * Interpret <code>fun</code> visiting at most <code>maxSteps</code>
     * blocks in total, nested calls included.
     * @param fun the procedure
     * @param entry bindings of the arguments and the initial heap; updated in
     *   place
     * @param maxSteps the step budget
     * @return the record of the call
     * @throws InterpreterFailedException if the program cannot be executed
     */
    public Call<Expr> interpretFunction(Procedure fun, Environment entry, int maxSteps) {
        return interpretFunction(fun, entry, new StepBudget(maxSteps));
    }

    /**
     * Interpret <code>fun</code>, taking block visits from <code>budget</code>.
     */
    public Call<Expr> interpretFunction(Procedure fun, Environment env, StepBudget budget) {
        if (env.heap().getConfig().isBounded() != config.isBounded()) {
            throw new InterpreterFailedException(
                "Heap of " + fun.getName() + " does not match the run configuration: " + config);
        }
        logStatus("interpreting " + fun.getName());

        int usedBefore = budget.used();
        State<Expr> entryState = env.snapshot(fun.getArgs());
        List<BlockStep<Expr>> steps = new ArrayList<BlockStep<Expr>>();
        Block previous = null;
        Block current = fun.getEntryBlock();
        boolean earlyExit = false;
        while (true) {
            if (!budget.tryConsume()) {
                logStatus("step budget exhausted in " + fun.getName() + " before " + current.getName());
                earlyExit = true;
                break;
            }
            BlockUpdate update = interpretBlock(current, previous, env, budget);
            steps.add(new BlockStep<Expr>(current.getName(), update.getState(), update.getCalls()));
            if (update.isEarlyExit()) {
                earlyExit = true;
                break;
            }
            if (update.getNextBlock() == null) {
                break;
            }
            previous = current;
            current = update.getNextBlock();
        }
        State<Expr> returnState =
            env.snapshot(Collections.<Expr>singletonList(ReturnValue.INSTANCE));
        return new Call<Expr>(fun.getName(), entryState, returnState, steps,
                              earlyExit, budget.used() - usedBefore);
    }

    /**
     * Interpret two variants independently, each with its own budget of
     * <code>maxSteps</code>.
     */
    public CallPair<Expr> interpretFunctionPair(Procedure first, Procedure second,
                                                Environment firstEnv, Environment secondEnv,
                                                int maxSteps) {
        Call<Expr> c1 = interpretFunction(first, firstEnv, maxSteps);
        Call<Expr> c2 = interpretFunction(second, secondEnv, maxSteps);
        return new CallPair<Expr>(c1, c2);
    }

    /**
     * Interpret one visit of <code>block</code>.  The visit itself must
     * already have been taken from <code>budget</code>; nested calls take
     * their visits from it.
     * @param block the block
     * @param previous the block control came from, <code>null</code> for the
     *   entry block
     * @param env the environment, updated in place
     * @param budget the shared budget
     * @return the state after PHI resolution, the calls made, and the next
     *   block
     */
    public BlockUpdate interpretBlock(Block block, Block previous, Environment env, StepBudget budget) {
        if (!block.isTerminated()) {
            throw new InterpreterFailedException("Block " + block + " is unterminated.");
        }

        // PHI statements read their operands before any of them is bound.
        List<Statement.Phi> phis = block.getPhis();
        List<TypedValue> phiValues = new ArrayList<TypedValue>(phis.size());
        for (Statement.Phi p : phis) {
            Expr incoming = previous == null ? null : p.getIncoming(previous);
            if (incoming == null) {
                String from = previous == null ? "procedure entry" : previous.getName();
                throw new InterpreterFailedException(
                    "PHI " + p.getResult().getName() + " in " + block + " has no value for " + from);
            }
            phiValues.add(resolve(incoming, env));
        }
        for (int i = 0; i != phis.size(); ++i) {
            env.bind(phis.get(i).getResult(), phiValues.get(i));
        }

        State<Expr> state = env.snapshot();
        List<Call<Expr>> calls = new ArrayList<Call<Expr>>();

        for (Statement s : block.getStatements()) {
            if (s instanceof Statement.Call) {
                Statement.Call c = (Statement.Call) s;
                Call<Expr> record = interpretCall(c, env, budget);
                calls.add(record);
                if (record.isEarlyExit()) {
                    return new BlockUpdate(state, calls, null, true);
                }
            } else {
                interpretStatement(s, env);
            }
        }

        Block next = interpretTerminator(block.getTermStmt(), env);
        return new BlockUpdate(state, calls, next, false);
    }

    private Call<Expr> interpretCall(Statement.Call c, Environment env, StepBudget budget) {
        Procedure callee = c.getCallee();
        List<TypedValue> args = new ArrayList<TypedValue>(c.getArgs().size());
        for (Expr a : c.getArgs()) {
            args.add(resolve(a, env));
        }
        Environment calleeEnv = Environment.forCall(callee.getArgs(), args, env.heap());
        Call<Expr> record = interpretFunction(callee, calleeEnv, budget);
        if (!record.isEarlyExit() && c.getResult() != null) {
            if (!calleeEnv.isBound(ReturnValue.INSTANCE)) {
                throw new InterpreterFailedException(callee.getName() + " returned no value.");
            }
            env.bind(c.getResult(), calleeEnv.lookup(ReturnValue.INSTANCE));
        }
        return record;
    }

    /**
     * Return the value of <code>e</code>: a constant, or the binding in
     * <code>env</code>.
     */
    public TypedValue resolve(Expr e, Environment env) {
        if (e instanceof IntConstant) {
            IntConstant c = (IntConstant) e;
            if (c.getWidth() == 1) {
                return TypedValue.of(c.getValue().testBit(0));
            }
            return TypedValue.of(config.intOf(c.getWidth(), c.getValue()));
        } else if (e instanceof NullPointer) {
            return TypedValue.of(config.zeroAddress());
        }
        return env.lookup(e);
    }

    private IntValue resolveInt(Expr e, Environment env) {
        return resolve(e, env).asInt();
    }

    private void interpretStatement(Statement s, Environment env) {
        StatementResult r = s.getResult();
        if (s instanceof Statement.BinaryOp) {
            env.bind(r, binaryOp((Statement.BinaryOp) s, env));
        } else if (s instanceof Statement.Compare) {
            env.bind(r, TypedValue.of(compare((Statement.Compare) s, env)));
        } else if (s instanceof Statement.Cast) {
            env.bind(r, cast((Statement.Cast) s, env));
        } else if (s instanceof Statement.AddressOf) {
            Statement.AddressOf a = (Statement.AddressOf) s;
            IntValue base = resolveInt(a.getBase(), env);
            List<IntValue> indices = new ArrayList<IntValue>(a.getIndices().size());
            for (Expr i : a.getIndices()) {
                indices.add(resolveInt(i, env));
            }
            env.bind(r, TypedValue.of(a.getLayout().address(config, base, indices)));
        } else if (s instanceof Statement.Load) {
            Statement.Load l = (Statement.Load) s;
            IntValue addr = resolveInt(l.getAddress(), env);
            env.bind(r, TypedValue.of(env.heap().load(addr, r.type().getWidth())));
        } else if (s instanceof Statement.Store) {
            Statement.Store st = (Statement.Store) s;
            IntValue addr = resolveInt(st.getAddress(), env);
            env.heap().store(addr, resolveInt(st.getValue(), env));
        } else if (s instanceof Statement.Select) {
            Statement.Select sel = (Statement.Select) s;
            boolean cond = resolve(sel.getCondition(), env).asBool();
            TypedValue t = resolve(sel.getTrueValue(), env);
            TypedValue f = resolve(sel.getFalseValue(), env);
            env.bind(r, cond ? t : f);
        } else {
            throw new UnsupportedConstructException(
                "Unsupported statement " + s.getClass().getSimpleName());
        }
    }

    private TypedValue binaryOp(Statement.BinaryOp s, Environment env) {
        TypedValue lhs = resolve(s.getLhs(), env);
        TypedValue rhs = resolve(s.getRhs(), env);
        if (s.getResult().type().isBool()) {
            boolean x = lhs.asBool();
            boolean y = rhs.asBool();
            switch (s.getOpcode()) {
            case AND:
                return TypedValue.of(x && y);
            case OR:
                return TypedValue.of(x || y);
            case XOR:
                return TypedValue.of(x ^ y);
            default:
                throw new UnsupportedConstructException(
                    "Unsupported Boolean operation " + s.getOpcode());
            }
        }
        IntValue x = lhs.asInt();
        IntValue y = rhs.asInt();
        switch (s.getOpcode()) {
        case ADD:  return TypedValue.of(x.add(y));
        case SUB:  return TypedValue.of(x.sub(y));
        case MUL:  return TypedValue.of(x.mul(y));
        case SDIV: return TypedValue.of(x.sdiv(y));
        case UDIV: return TypedValue.of(x.udiv(y));
        case SREM: return TypedValue.of(x.srem(y));
        case UREM: return TypedValue.of(x.urem(y));
        case SHL:  return TypedValue.of(x.shl(y));
        case LSHR: return TypedValue.of(x.lshr(y));
        case ASHR: return TypedValue.of(x.ashr(y));
        case AND:  return TypedValue.of(x.and(y));
        case OR:   return TypedValue.of(x.or(y));
        case XOR:  return TypedValue.of(x.xor(y));
        default:
            throw new UnsupportedConstructException("Unsupported operation " + s.getOpcode());
        }
    }

    private boolean compare(Statement.Compare s, Environment env) {
        TypedValue lhs = resolve(s.getLhs(), env);
        TypedValue rhs = resolve(s.getRhs(), env);
        if (lhs.kind() == ValueKind.BOOL) {
            switch (s.getPredicate()) {
            case EQ:
                return lhs.asBool() == rhs.asBool();
            case NE:
                return lhs.asBool() != rhs.asBool();
            default:
                throw new UnsupportedConstructException(
                    "Unsupported Boolean comparison " + s.getPredicate());
            }
        }
        IntValue x = lhs.asInt();
        IntValue y = rhs.asInt();
        switch (s.getPredicate()) {
        case EQ:  return x.eq(y);
        case NE:  return x.ne(y);
        case SGE: return x.sge(y);
        case SGT: return x.sgt(y);
        case SLE: return x.sle(y);
        case SLT: return x.slt(y);
        case UGE: return x.uge(y);
        case UGT: return x.ugt(y);
        case ULE: return x.ule(y);
        case ULT: return x.ult(y);
        default:
            throw new UnsupportedConstructException("Unsupported predicate " + s.getPredicate());
        }
    }

    private TypedValue cast(Statement.Cast s, Environment env) {
        TypedValue v = resolve(s.getOperand(), env);
        long width = s.getResult().type().getWidth();
        if (v.kind() == ValueKind.BOOL && width > 1) {
            // Booleans widen to 0 or 1 whatever the opcode.
            return TypedValue.of(config.intOf(width, v.asBool() ? 1 : 0));
        }
        IntValue i = v.asInt();
        switch (s.getOpcode()) {
        case ZEXT:
            return TypedValue.of(i.zext(width));
        case SEXT:
            return TypedValue.of(i.sext(width));
        case TRUNC:
            if (width == 1) {
                return TypedValue.of(i.toUnsignedBigInteger().testBit(0));
            }
            return TypedValue.of(i.trunc(width));
        case PTR_TO_INT:
            return TypedValue.of(i.zextOrTrunc(width));
        case INT_TO_PTR:
            return TypedValue.of(i.zextOrTrunc(64));
        default:
            throw new UnsupportedConstructException("Unsupported cast " + s.getOpcode());
        }
    }

    private Block interpretTerminator(TermStmt t, Environment env) {
        if (t instanceof TermStmt.Return) {
            Expr value = ((TermStmt.Return) t).getValue();
            if (value != null) {
                env.bind(ReturnValue.INSTANCE, resolve(value, env));
            }
            return null;
        } else if (t instanceof TermStmt.Jump) {
            return ((TermStmt.Jump) t).getTarget();
        } else if (t instanceof TermStmt.Branch) {
            TermStmt.Branch b = (TermStmt.Branch) t;
            return resolve(b.getCondition(), env).asBool() ? b.getTrueTarget() : b.getFalseTarget();
        } else if (t instanceof TermStmt.Switch) {
            TermStmt.Switch sw = (TermStmt.Switch) t;
            IntValue scrutinee = resolveInt(sw.getScrutinee(), env);
            for (SwitchCase c : sw.getCases()) {
                if (scrutinee.eq(resolveInt(c.getValue(), env))) {
                    return c.getTarget();
                }
            }
            return sw.getDefaultTarget();
        }
        throw new UnsupportedConstructException(
            "Unsupported terminator " + t.getClass().getSimpleName());
    }

    /**
     * The outcome of one block visit.
     */
    public static final class BlockUpdate {
        private final State<Expr> state;
        private final List<Call<Expr>> calls;
        private final Block nextBlock;
        private final boolean earlyExit;

        BlockUpdate(State<Expr> state, List<Call<Expr>> calls, Block nextBlock, boolean earlyExit) {
            this.state = state;
            this.calls = Collections.unmodifiableList(calls);
            this.nextBlock = nextBlock;
            this.earlyExit = earlyExit;
        }

        /** The state right after PHI resolution. */
        public State<Expr> getState() {
            return state;
        }

        public List<Call<Expr>> getCalls() {
            return calls;
        }

        /** The successor, or <code>null</code> after a return or early exit. */
        public Block getNextBlock() {
            return nextBlock;
        }

        public boolean isEarlyExit() {
            return earlyExit;
        }
    }
}
