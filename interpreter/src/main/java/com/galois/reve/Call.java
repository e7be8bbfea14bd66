package com.galois.reve;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.galois.reve.proto.Protos;

/**
 * The record of one interpreted function call.
 *
 * <p>
 * The entry state holds the arguments and the heap at entry; the return
 * state holds the return value (if any) and the heap at the end.  When
 * {@link #isEarlyExit()} is true the step budget ran out and the record
 * describes the execution only up to that point.
 *
 * @param <K> the variable keys of the recorded states
 */
public final class Call<K> {
    /** Largest count the wire format holds (an unsigned 32-bit field). */
    public static final long MAX_BLOCKS_VISITED = 0xFFFFFFFFL;

    private final String functionName;
    private final State<K> entryState;
    private final State<K> returnState;
    private final List<BlockStep<K>> steps;
    private final boolean earlyExit;
    private final long blocksVisited;

    public Call(String functionName, State<K> entryState, State<K> returnState,
                List<BlockStep<K>> steps, boolean earlyExit, long blocksVisited) {
        if (functionName == null) throw new NullPointerException("functionName");
        if (entryState == null) throw new NullPointerException("entryState");
        if (returnState == null) throw new NullPointerException("returnState");
        if (blocksVisited < 0 || blocksVisited > MAX_BLOCKS_VISITED) {
            throw new IllegalArgumentException("blocksVisited out of range: " + blocksVisited);
        }
        this.functionName = functionName;
        this.entryState = entryState;
        this.returnState = returnState;
        this.steps = Collections.unmodifiableList(new ArrayList<BlockStep<K>>(steps));
        this.earlyExit = earlyExit;
        this.blocksVisited = blocksVisited;
    }

    public String getFunctionName() {
        return functionName;
    }

    public State<K> getEntryState() {
        return entryState;
    }

    public State<K> getReturnState() {
        return returnState;
    }

    public List<BlockStep<K>> getSteps() {
        return steps;
    }

    public boolean isEarlyExit() {
        return earlyExit;
    }

    /**
     * Return the number of blocks visited in this call and the calls nested
     * in it.
     */
    public long getBlocksVisited() {
        return blocksVisited;
    }

    /**
     * Return the record with every state in portable form.
     */
    public Call<String> toPortable() {
        List<BlockStep<String>> psteps = new ArrayList<BlockStep<String>>(steps.size());
        for (BlockStep<K> s : steps) {
            psteps.add(s.toPortable());
        }
        return new Call<String>(functionName, entryState.toPortable(), returnState.toPortable(),
                                psteps, earlyExit, blocksVisited);
    }

    public Protos.Call getCallRep() {
        Protos.Call.Builder b = Protos.Call.newBuilder()
            .setFunctionName(functionName)
            .setEntryState(entryState.getStateRep())
            .setReturnState(returnState.getStateRep())
            .setEarlyExit(earlyExit)
            .setBlocksVisited((int) blocksVisited);
        for (BlockStep<K> s : steps) {
            b.addSteps(s.getBlockStepRep());
        }
        return b.build();
    }

    /**
     * Decode a call record.
     * @throws TraceFormatException if a state is missing or malformed
     */
    public static Call<String> fromProto(Protos.Call rep) {
        if (!rep.hasEntryState()) {
            throw new TraceFormatException("Call of " + rep.getFunctionName() + " has no entry state.");
        }
        if (!rep.hasReturnState()) {
            throw new TraceFormatException("Call of " + rep.getFunctionName() + " has no return state.");
        }
        checkNoUnknownFields(rep, "Call of " + rep.getFunctionName());
        List<BlockStep<String>> steps = new ArrayList<BlockStep<String>>(rep.getStepsCount());
        for (Protos.BlockStep s : rep.getStepsList()) {
            steps.add(BlockStep.fromProto(s));
        }
        return new Call<String>(rep.getFunctionName(),
                                State.fromProto(rep.getEntryState()),
                                State.fromProto(rep.getReturnState()),
                                steps,
                                rep.getEarlyExit(),
                                Integer.toUnsignedLong(rep.getBlocksVisited()));
    }

    /**
     * Reject fields this reader does not know.
     * @throws TraceFormatException if <code>rep</code> has unknown fields
     */
    static void checkNoUnknownFields(com.google.protobuf.Message rep, String what) {
        if (!rep.getUnknownFields().asMap().isEmpty()) {
            throw new TraceFormatException(what + " has unknown fields "
                                           + rep.getUnknownFields().asMap().keySet() + ".");
        }
    }

    public String toString() {
        return String.format("Call %s entry %s return %s steps %s earlyExit %b blocksVisited %d",
                             functionName, entryState, returnState, steps, earlyExit, blocksVisited);
    }

    public boolean equals(Object o) {
        if (!(o instanceof Call)) return false;
        Call<?> r = (Call<?>) o;
        return functionName.equals(r.functionName)
            && entryState.equals(r.entryState)
            && returnState.equals(r.returnState)
            && steps.equals(r.steps)
            && earlyExit == r.earlyExit
            && blocksVisited == r.blocksVisited;
    }

    public int hashCode() {
        int h = functionName.hashCode();
        h = h * 31 + entryState.hashCode();
        h = h * 31 + returnState.hashCode();
        h = h * 31 + steps.hashCode();
        h = h * 31 + (earlyExit ? 1 : 0);
        return h * 31 + Long.hashCode(blocksVisited);
    }
}
