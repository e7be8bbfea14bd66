package com.galois.reve.cfg;

import org.junit.Assert;
import org.junit.Test;

import com.galois.reve.Type;

public class TestBlock {
    private static final Type I32 = Type.integer(32);

    private static Procedure proc() {
        return new Procedure("f", new String[] { "x", "y" }, new Type[] { I32, I32 }, I32);
    }

    @Test
    public void argumentsAndBlocks() {
        Procedure p = proc();
        Assert.assertEquals(2, p.getArgCount());
        Assert.assertEquals("y", p.getArg(1).getName());
        Assert.assertEquals("entry", p.getEntryBlock().getName());
        Assert.assertEquals("bb1", p.newBlock().getName());
        Assert.assertEquals("exit", p.newBlock("exit").getName());
        Assert.assertEquals(3, p.getBlocks().size());
        Assert.assertEquals("arg0", new Procedure("g", new Type[] { I32 }, Type.VOID).getArg(0).getName());
    }

    @Test(expected=IllegalArgumentException.class)
    public void badArgumentIndex() {
        proc().getArg(2);
    }

    @Test
    public void resultsAreHandles() {
        Procedure p = proc();
        Block b = p.getEntryBlock();
        StatementResult r = b.add(p.getArg(0), p.getArg(1));
        StatementResult s = b.sub(r, p.getArg(1));
        Assert.assertFalse(r.equals(s));
        Assert.assertEquals("%0.0", r.getName());
        Assert.assertEquals(r, r.setName("sum"));
        Assert.assertEquals("sum", r.getName());
        Assert.assertEquals(2, b.getStatements().size());

        // Arguments of different procedures differ even with equal indices.
        Assert.assertFalse(p.getArg(0).equals(proc().getArg(0)));
        Assert.assertEquals(new IntConstant(8, 3), new IntConstant(8, 3));
        Assert.assertEquals(Type.BOOL, b.boolLiteral(true).type());
        Assert.assertEquals("return", ReturnValue.INSTANCE.getName());
    }

    @Test
    public void literalsAreSignedInTheirWidth() {
        Assert.assertEquals(new IntConstant(8, -1), new IntConstant(8, 255));
        Assert.assertEquals("-1", new IntConstant(8, 255).getName());
        Assert.assertEquals(-128, new IntConstant(8, 128).getValue().longValue());
        Assert.assertEquals(127, new IntConstant(8, -129).getValue().longValue());
        Assert.assertEquals(1, new IntConstant(1, 3).getValue().longValue());

        Procedure p = new Procedure("g", new Type[] { Type.integer(8) }, I32);
        Block d = p.newBlock();
        TermStmt.Switch sw = p.getEntryBlock().switchOn(p.getArg(0), d).addCase(255, d);
        Assert.assertEquals(new IntConstant(8, -1), sw.getCases().get(0).getValue());
    }

    @Test(expected=IllegalStateException.class)
    public void terminatedBlocksAreClosed() {
        Procedure p = proc();
        Block b = p.getEntryBlock();
        b.returnExpr(p.getArg(0));
        b.add(p.getArg(0), p.getArg(1));
    }

    @Test(expected=IllegalStateException.class)
    public void onlyOneTerminator() {
        Procedure p = proc();
        Block b = p.getEntryBlock();
        b.returnExpr(p.getArg(0));
        b.jump(p.newBlock());
    }

    @Test(expected=IllegalArgumentException.class)
    public void operandTypesMustMatch() {
        Procedure p = proc();
        Block b = p.getEntryBlock();
        b.add(p.getArg(0), b.intLiteral(8, 1));
    }

    @Test(expected=NullPointerException.class)
    public void operandsMustNotBeNull() {
        Procedure p = proc();
        p.getEntryBlock().add(p.getArg(0), null);
    }

    @Test(expected=IllegalStateException.class)
    public void phisComeFirst() {
        Procedure p = proc();
        Block b = p.newBlock();
        b.add(p.getArg(0), p.getArg(1));
        b.phi(I32);
    }

    @Test(expected=IllegalArgumentException.class)
    public void phiIncomingTypeMustMatch() {
        Procedure p = proc();
        Block b = p.newBlock();
        b.phi(I32).addIncoming(p.getEntryBlock(), b.boolLiteral(true));
    }

    @Test
    public void phiIncomingValues() {
        Procedure p = proc();
        Block b = p.newBlock();
        Statement.Phi phi = b.phi(I32).addIncoming(p.getEntryBlock(), p.getArg(0));
        Assert.assertEquals(p.getArg(0), phi.getIncoming(p.getEntryBlock()));
        Assert.assertNull(phi.getIncoming(b));
        Assert.assertEquals(1, b.getPhis().size());
    }

    @Test(expected=IllegalArgumentException.class)
    public void callArgumentCount() {
        Procedure p = proc();
        p.getEntryBlock().call(proc(), p.getArg(0));
    }

    @Test(expected=IllegalArgumentException.class)
    public void returnTypeMustMatch() {
        Procedure p = proc();
        p.getEntryBlock().returnVoid();
    }

    @Test(expected=IllegalArgumentException.class)
    public void jumpTargetMustBeLocal() {
        proc().getEntryBlock().jump(proc().newBlock());
    }

    @Test(expected=IllegalArgumentException.class)
    public void branchConditionMustBeBoolean() {
        Procedure p = proc();
        Block t = p.newBlock();
        p.getEntryBlock().branch(p.getArg(0), t, t);
    }

    @Test(expected=IllegalArgumentException.class)
    public void castWidthsMustBeConsistent() {
        Procedure p = proc();
        p.getEntryBlock().cast(Statement.CastOpcode.TRUNC, p.getArg(0), Type.integer(64));
    }

    @Test(expected=IllegalArgumentException.class)
    public void loadsNeedAnAddress() {
        Procedure p = proc();
        Block b = p.getEntryBlock();
        b.load(b.boolLiteral(false), I32);
    }

    @Test
    public void switchCasesKeepOrder() {
        Procedure p = proc();
        Block a = p.newBlock();
        Block d = p.newBlock();
        TermStmt.Switch s = p.getEntryBlock().switchOn(p.getArg(0), d).addCase(5, a).addCase(3, d);
        Assert.assertEquals(2, s.getCases().size());
        Assert.assertEquals(new IntConstant(32, 5), s.getCases().get(0).getValue());
        Assert.assertSame(d, s.getCases().get(1).getTarget());
        Assert.assertTrue(p.getEntryBlock().isTerminated());
    }
}
