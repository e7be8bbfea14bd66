package com.galois.reve;

import java.math.BigInteger;

import org.junit.Assert;
import org.junit.Test;

public class TestBitvectorValue {
    private static BitvectorValue bv(long width, long v) {
        return new BitvectorValue(width, v);
    }

    @Test
    public void addWraps() {
        Assert.assertEquals(bv(8, 44), bv(8, 200).add(bv(8, 100)));
    }

    @Test
    public void negativeValuesAreStoredModuloWidth() {
        BitvectorValue x = bv(8, -2);
        Assert.assertEquals(BigInteger.valueOf(254), x.getValue());
        Assert.assertEquals(BigInteger.valueOf(-2), x.toSignedBigInteger());
        Assert.assertEquals(x, bv(8, 3).sub(bv(8, 5)));
    }

    @Test
    public void signedAndUnsignedDivision() {
        Assert.assertEquals(bv(8, -3), bv(8, -7).sdiv(bv(8, 2)));
        Assert.assertEquals(bv(8, -1), bv(8, -7).srem(bv(8, 2)));
        Assert.assertEquals(bv(8, 124), bv(8, 249).udiv(bv(8, 2)));
        Assert.assertEquals(bv(8, 1), bv(8, 249).urem(bv(8, 2)));
    }

    @Test(expected=InterpreterFailedException.class)
    public void divisionByZero() {
        bv(32, 1).sdiv(bv(32, 0));
    }

    @Test(expected=InterpreterFailedException.class)
    public void remainderByZero() {
        bv(32, 1).urem(bv(32, 0));
    }

    @Test
    public void shifts() {
        Assert.assertEquals(bv(8, 0x10), bv(8, 1).shl(bv(8, 4)));
        Assert.assertEquals(bv(8, 0), bv(8, 1).shl(bv(8, 8)));
        Assert.assertEquals(bv(8, 0), bv(8, 0x80).lshr(bv(8, 9)));
        Assert.assertEquals(bv(8, 0xF0), bv(8, 0x80).ashr(bv(8, 3)));
        Assert.assertEquals(bv(8, 0xFF), bv(8, 0x80).ashr(bv(8, 200)));
        Assert.assertEquals(bv(8, 0x10), bv(8, 0x40).ashr(bv(8, 2)));
    }

    @Test
    public void bitwise() {
        Assert.assertEquals(bv(8, 0x0C), bv(8, 0x0F).and(bv(8, 0x3C)));
        Assert.assertEquals(bv(8, 0x3F), bv(8, 0x0F).or(bv(8, 0x3C)));
        Assert.assertEquals(bv(8, 0x33), bv(8, 0x0F).xor(bv(8, 0x3C)));
    }

    @Test
    public void comparisons() {
        BitvectorValue minusOne = bv(8, 0xFF);
        BitvectorValue one = bv(8, 1);
        Assert.assertTrue(minusOne.slt(one));
        Assert.assertTrue(minusOne.sle(one));
        Assert.assertFalse(minusOne.sgt(one));
        Assert.assertTrue(minusOne.ugt(one));
        Assert.assertTrue(minusOne.uge(one));
        Assert.assertFalse(minusOne.ult(one));
        Assert.assertTrue(one.eq(bv(8, 257)));
        Assert.assertTrue(one.ne(minusOne));
        Assert.assertTrue(one.sge(one));
        Assert.assertTrue(one.ule(one));
    }

    @Test
    public void widthConversions() {
        Assert.assertEquals(bv(16, 0xFF), bv(8, 0xFF).zext(16));
        Assert.assertEquals(bv(16, 0xFFFF), bv(8, 0xFF).sext(16));
        Assert.assertEquals(bv(16, 0x7F), bv(8, 0x7F).sext(16));
        Assert.assertEquals(bv(8, 0x34), bv(16, 0x1234).trunc(8));
        Assert.assertEquals(bv(8, 0x34), bv(16, 0x1234).zextOrTrunc(8));
        Assert.assertEquals(bv(32, 0x1234), bv(16, 0x1234).zextOrTrunc(32));
        Assert.assertEquals(bv(64, 5), bv(32, 5).asPointer());
    }

    @Test(expected=InterpreterFailedException.class)
    public void truncateToWiderFails() {
        bv(8, 1).trunc(16);
    }

    @Test(expected=InterpreterFailedException.class)
    public void widthMismatch() {
        bv(8, 1).add(bv(16, 1));
    }

    @Test(expected=InterpreterFailedException.class)
    public void modeMismatch() {
        bv(8, 1).add(new IntegerValue(1));
    }

    @Test(expected=IllegalArgumentException.class)
    public void zeroWidth() {
        new BitvectorValue(0, BigInteger.ONE);
    }

    @Test
    public void printsHex() {
        Assert.assertEquals("0xff:[8]", bv(8, -1).toString());
    }
}
