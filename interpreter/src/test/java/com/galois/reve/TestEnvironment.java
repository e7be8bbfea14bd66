package com.galois.reve;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Assert;
import org.junit.Test;

import com.galois.reve.cfg.Expr;
import com.galois.reve.cfg.FunctionArg;
import com.galois.reve.cfg.Procedure;

public class TestEnvironment {
    private final Procedure p =
        new Procedure("f", new String[] { "x", "y" },
                      new Type[] { Type.integer(32), Type.BOOL }, Type.VOID);

    @Test
    public void bindAndLookup() {
        Environment env = new Environment(new Heap(RunConfig.unbounded()));
        FunctionArg x = p.getArg(0);
        Assert.assertFalse(env.isBound(x));
        env.bind(x, TypedValue.of(new IntegerValue(4)));
        Assert.assertTrue(env.isBound(x));
        Assert.assertEquals(TypedValue.of(new IntegerValue(4)), env.lookup(x));
        env.bind(x, TypedValue.of(new IntegerValue(5)));
        Assert.assertEquals(TypedValue.of(new IntegerValue(5)), env.lookup(x));
    }

    @Test(expected=InterpreterFailedException.class)
    public void unboundLookup() {
        new Environment(new Heap(RunConfig.unbounded())).lookup(p.getArg(1));
    }

    @Test
    public void callFramesShareTheHeap() {
        Heap heap = new Heap(RunConfig.unbounded());
        Environment env = Environment.forCall(
            p.getArgs(),
            Arrays.asList(TypedValue.of(new IntegerValue(1)), TypedValue.of(true)),
            heap);
        Assert.assertSame(heap, env.heap());
        Assert.assertEquals(TypedValue.of(true), env.lookup(p.getArg(1)));
    }

    @Test(expected=InterpreterFailedException.class)
    public void wrongArgumentCount() {
        Environment.forCall(p.getArgs(),
                            Collections.singletonList(TypedValue.of(true)),
                            new Heap(RunConfig.unbounded()));
    }

    @Test
    public void filteredSnapshot() {
        Heap heap = new Heap(RunConfig.unbounded());
        heap.store(new IntegerValue(1), new IntegerValue(2));
        Environment env = new Environment(heap);
        env.bind(p.getArg(0), TypedValue.of(new IntegerValue(1)));
        env.bind(p.getArg(1), TypedValue.of(false));

        State<Expr> s = env.snapshot(Collections.<Expr>singletonList(p.getArg(1)));
        Assert.assertEquals(1, s.getVariables().size());
        Assert.assertEquals(TypedValue.of(false), s.get(p.getArg(1)));
        Assert.assertEquals(1, s.getHeap().size());

        heap.store(new IntegerValue(3), new IntegerValue(4));
        Assert.assertEquals(1, s.getHeap().size());
        Assert.assertEquals(2, env.snapshot().getVariables().size());
    }
}
