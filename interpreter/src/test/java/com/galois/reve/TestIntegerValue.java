package com.galois.reve;

import java.math.BigInteger;

import org.junit.Assert;
import org.junit.Test;

public class TestIntegerValue {
    private static IntegerValue i(long v) {
        return new IntegerValue(v);
    }

    @Test
    public void addDoesNotWrap() {
        Assert.assertEquals(i(300), i(200).add(i(100)));
    }

    @Test
    public void divisionTruncatesTowardZero() {
        Assert.assertEquals(i(-3), i(-7).sdiv(i(2)));
        Assert.assertEquals(i(-1), i(-7).srem(i(2)));
        Assert.assertEquals(i(-3), i(-7).udiv(i(2)));
        Assert.assertEquals(i(-1), i(-7).urem(i(2)));
    }

    @Test(expected=InterpreterFailedException.class)
    public void divisionByZero() {
        i(5).sdiv(IntegerValue.ZERO);
    }

    @Test
    public void shifts() {
        Assert.assertEquals(new IntegerValue(BigInteger.ONE.shiftLeft(100)), i(1).shl(i(100)));
        Assert.assertEquals(i(-4), i(-7).ashr(i(1)));
        Assert.assertEquals(i(-4), i(-7).lshr(i(1)));
    }

    @Test(expected=InterpreterFailedException.class)
    public void negativeShift() {
        i(1).shl(i(-1));
    }

    @Test
    public void unsignedComparisonsAreSigned() {
        Assert.assertTrue(i(-1).ult(i(1)));
        Assert.assertTrue(i(-1).slt(i(1)));
        Assert.assertTrue(i(2).uge(i(2)));
    }

    @Test
    public void widthConversionsAreIdentity() {
        IntegerValue big = new IntegerValue(BigInteger.ONE.shiftLeft(80).negate());
        Assert.assertSame(big, big.trunc(8));
        Assert.assertSame(big, big.zext(128));
        Assert.assertSame(big, big.sext(128));
        Assert.assertSame(big, big.asPointer());
    }

    @Test(expected=InterpreterFailedException.class)
    public void modeMismatch() {
        i(1).mul(new BitvectorValue(8, 1));
    }

    @Test
    public void ordering() {
        Assert.assertTrue(i(-5).compareTo(i(3)) < 0);
        Assert.assertEquals(0, i(3).compareTo(i(3)));
        Assert.assertEquals("-5", i(-5).toString());
    }
}
