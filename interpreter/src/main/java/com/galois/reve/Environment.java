package com.galois.reve;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.galois.reve.cfg.Expr;

/**
 * Bindings of one call frame together with the heap of the call tree.
 *
 * <p>
 * Bindings are private to the frame; the heap is shared by reference with
 * every frame of the same interpretation.
 */
public final class Environment {
    private final Map<Expr,TypedValue> bindings;
    private final Heap heap;

    /**
     * Create an environment with no bindings.
     * @param heap the heap, shared not copied
     */
    public Environment(Heap heap) {
        if (heap == null) throw new NullPointerException("heap");
        this.bindings = new LinkedHashMap<Expr,TypedValue>();
        this.heap = heap;
    }

    /**
     * Create the environment of a called function: parameter <code>i</code>
     * is bound to argument <code>i</code>.
     * @param params the callee's parameters
     * @param args the argument values
     * @param sharedHeap the caller's heap
     * @return the environment
     */
    public static Environment forCall(List<? extends Expr> params,
                                      List<TypedValue> args,
                                      Heap sharedHeap) {
        if (params.size() != args.size()) {
            String msg = String.format("Expected %d arguments, got %d.", params.size(), args.size());
            throw new InterpreterFailedException(msg);
        }
        Environment env = new Environment(sharedHeap);
        for (int i = 0; i != params.size(); ++i) {
            env.bind(params.get(i), args.get(i));
        }
        return env;
    }

    /**
     * Bind <code>ref</code> to <code>value</code>, replacing an earlier binding.
     */
    public void bind(Expr ref, TypedValue value) {
        if (ref == null) throw new NullPointerException("ref");
        if (value == null) throw new NullPointerException("value");
        bindings.put(ref, value);
    }

    /**
     * Return the value bound to <code>ref</code>.
     * @throws InterpreterFailedException if <code>ref</code> is unbound
     */
    public TypedValue lookup(Expr ref) {
        TypedValue v = bindings.get(ref);
        if (v == null) {
            throw new InterpreterFailedException("Unbound value " + ref.getName());
        }
        return v;
    }

    public boolean isBound(Expr ref) {
        return bindings.containsKey(ref);
    }

    public Heap heap() {
        return heap;
    }

    public Map<Expr,TypedValue> bindings() {
        return Collections.unmodifiableMap(bindings);
    }

    /**
     * Return the current bindings and heap.
     */
    public State<Expr> snapshot() {
        return new State<Expr>(bindings, heap.snapshot());
    }

    /**
     * Return the bindings of <code>refs</code> that are bound, and the heap.
     */
    public State<Expr> snapshot(Collection<? extends Expr> refs) {
        Map<Expr,TypedValue> vars = new LinkedHashMap<Expr,TypedValue>();
        for (Expr r : refs) {
            TypedValue v = bindings.get(r);
            if (v != null) {
                vars.put(r, v);
            }
        }
        return new State<Expr>(vars, heap.snapshot());
    }

    public String toString() {
        return "Environment " + bindings + " " + heap;
    }
}
