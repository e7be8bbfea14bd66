package com.galois.reve;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.galois.reve.proto.Protos;

/**
 * The record of one visit of a block: its name, the state right after PHI
 * resolution, and the calls made from the block in order.
 */
public final class BlockStep<K> {
    private final String blockName;
    private final State<K> state;
    private final List<Call<K>> calls;

    public BlockStep(String blockName, State<K> state, List<Call<K>> calls) {
        if (blockName == null) throw new NullPointerException("blockName");
        if (state == null) throw new NullPointerException("state");
        this.blockName = blockName;
        this.state = state;
        this.calls = Collections.unmodifiableList(new ArrayList<Call<K>>(calls));
    }

    public String getBlockName() {
        return blockName;
    }

    public State<K> getState() {
        return state;
    }

    public List<Call<K>> getCalls() {
        return calls;
    }

    public BlockStep<String> toPortable() {
        List<Call<String>> pcalls = new ArrayList<Call<String>>(calls.size());
        for (Call<K> c : calls) {
            pcalls.add(c.toPortable());
        }
        return new BlockStep<String>(blockName, state.toPortable(), pcalls);
    }

    public Protos.BlockStep getBlockStepRep() {
        Protos.BlockStep.Builder b = Protos.BlockStep.newBuilder()
            .setBlockName(blockName)
            .setState(state.getStateRep());
        for (Call<K> c : calls) {
            b.addCalls(c.getCallRep());
        }
        return b.build();
    }

    /**
     * Decode a block step.
     * @throws TraceFormatException if the state is missing or malformed
     */
    public static BlockStep<String> fromProto(Protos.BlockStep rep) {
        if (!rep.hasState()) {
            throw new TraceFormatException("Block step " + rep.getBlockName() + " has no state.");
        }
        Call.checkNoUnknownFields(rep, "Block step " + rep.getBlockName());
        List<Call<String>> calls = new ArrayList<Call<String>>(rep.getCallsCount());
        for (Protos.Call c : rep.getCallsList()) {
            calls.add(Call.fromProto(c));
        }
        return new BlockStep<String>(rep.getBlockName(), State.fromProto(rep.getState()), calls);
    }

    public String toString() {
        return "BlockStep " + blockName + " " + state + " calls " + calls;
    }

    public boolean equals(Object o) {
        if (!(o instanceof BlockStep)) return false;
        BlockStep<?> r = (BlockStep<?>) o;
        return blockName.equals(r.blockName) && state.equals(r.state) && calls.equals(r.calls);
    }

    public int hashCode() {
        return (blockName.hashCode() * 31 + state.hashCode()) * 31 + calls.hashCode();
    }
}
