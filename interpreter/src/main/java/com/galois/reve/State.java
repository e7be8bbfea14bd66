package com.galois.reve;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import com.galois.reve.cfg.Expr;
import com.galois.reve.proto.Protos;

/**
 * An immutable snapshot of variable bindings and heap.
 *
 * @param <K> the variable keys: {@link Expr} while interpreting,
 *   <code>String</code> in portable form
 */
public final class State<K> {
    private final Map<K,TypedValue> variables;
    private final SortedMap<IntValue,IntValue> heap;

    public State(Map<K,TypedValue> variables, SortedMap<IntValue,IntValue> heap) {
        if (variables == null) throw new NullPointerException("variables");
        if (heap == null) throw new NullPointerException("heap");
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<K,TypedValue>(variables));
        this.heap = Collections.unmodifiableSortedMap(new TreeMap<IntValue,IntValue>(heap));
    }

    public Map<K,TypedValue> getVariables() {
        return variables;
    }

    public SortedMap<IntValue,IntValue> getHeap() {
        return heap;
    }

    /**
     * Return the value of <code>key</code>, or <code>null</code> if it is not
     * recorded.
     */
    public TypedValue get(K key) {
        return variables.get(key);
    }

    static String keyName(Object key) {
        if (key instanceof Expr) {
            return ((Expr) key).getName();
        }
        return key.toString();
    }

    // Map every variable to its name; two variables may not share one.
    private <V> Map<String,V> byName(Map<K,V> vars) {
        Map<String,V> r = new LinkedHashMap<String,V>();
        for (Map.Entry<K,V> e : vars.entrySet()) {
            String name = keyName(e.getKey());
            if (r.containsKey(name)) {
                throw new InterpreterFailedException("Two variables are named " + name + ".");
            }
            r.put(name, e.getValue());
        }
        return r;
    }

    /**
     * Return the portable form: variables keyed by name, every integer
     * unbounded.
     */
    public State<String> toPortable() {
        Map<String,TypedValue> vars = byName(variables);
        for (Map.Entry<String,TypedValue> e : vars.entrySet()) {
            e.setValue(e.getValue().toPortable());
        }
        SortedMap<IntValue,IntValue> h = new TreeMap<IntValue,IntValue>();
        for (Map.Entry<IntValue,IntValue> e : heap.entrySet()) {
            h.put(new IntegerValue(e.getKey().toSignedBigInteger()),
                  new IntegerValue(e.getValue().toSignedBigInteger()));
        }
        return new State<String>(vars, h);
    }

    /**
     * Return the protocol buffer representation.
     */
    public Protos.State getStateRep() {
        Protos.State.Builder b = Protos.State.newBuilder();
        for (Map.Entry<String,TypedValue> e : byName(variables).entrySet()) {
            b.putVariables(e.getKey(), e.getValue().getValueRep());
        }
        for (Map.Entry<IntValue,IntValue> e : heap.entrySet()) {
            b.putHeap(e.getKey().toSignedBigInteger().toString(),
                      e.getValue().toSignedBigInteger().toString());
        }
        return b.build();
    }

    /**
     * Decode a state.  Integers are decoded as unbounded integers and
     * variables keep the order they have in <code>rep</code>.
     * @throws TraceFormatException if a value is malformed
     */
    public static State<String> fromProto(Protos.State rep) {
        Call.checkNoUnknownFields(rep, "State");
        Map<String,TypedValue> vars = new LinkedHashMap<String,TypedValue>();
        for (Map.Entry<String,com.google.protobuf.Value> e : rep.getVariablesMap().entrySet()) {
            vars.put(e.getKey(), TypedValue.fromProto(e.getValue()));
        }
        SortedMap<IntValue,IntValue> h = new TreeMap<IntValue,IntValue>();
        for (Map.Entry<String,String> e : rep.getHeapMap().entrySet()) {
            h.put(new IntegerValue(TypedValue.parseDecimal(e.getKey())),
                  new IntegerValue(TypedValue.parseDecimal(e.getValue())));
        }
        return new State<String>(vars, h);
    }

    public String toString() {
        return "State " + variables + " heap " + heap;
    }

    public boolean equals(Object o) {
        if (!(o instanceof State)) return false;
        State<?> r = (State<?>) o;
        return variables.equals(r.variables) && heap.equals(r.heap);
    }

    public int hashCode() {
        return variables.hashCode() * 31 + heap.hashCode();
    }
}
