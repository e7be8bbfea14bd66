package com.galois.reve;

import java.math.BigInteger;

import org.junit.Assert;
import org.junit.Test;

import com.galois.reve.proto.Protos;

public class TestRunConfig {
    @Test
    public void defaults() {
        RunConfig c = RunConfig.newBuilder().build();
        Assert.assertFalse(c.isBounded());
        Assert.assertEquals(8, c.getHeapElemSize());
        Assert.assertEquals(c, RunConfig.unbounded());
        Assert.assertTrue(RunConfig.bounded().isBounded());
    }

    @Test
    public void integersFollowTheMode() {
        Assert.assertEquals(new BitvectorValue(16, 0xFFFF), RunConfig.bounded().intOf(16, -1));
        Assert.assertEquals(new IntegerValue(-1), RunConfig.unbounded().intOf(16, -1));
        Assert.assertEquals(new BitvectorValue(64, 0), RunConfig.bounded().zeroAddress());
        Assert.assertEquals(new BitvectorValue(8, 0), RunConfig.bounded().zeroCell());
        Assert.assertEquals(IntegerValue.ZERO, RunConfig.unbounded().zeroAddress());
        Assert.assertEquals(new IntegerValue(BigInteger.TEN),
                            RunConfig.unbounded().intOf(1, BigInteger.TEN));
    }

    @Test(expected=IllegalArgumentException.class)
    public void heapElemSizeMustBeWholeBytes() {
        RunConfig.newBuilder().setHeapElemSize(12);
    }

    @Test
    public void fromProto() {
        RunConfig c = RunConfig.fromProto(Protos.RunOptions.newBuilder().setBounded(true).build());
        Assert.assertTrue(c.isBounded());
        Assert.assertEquals(8, c.getHeapElemSize());
        c = RunConfig.fromProto(Protos.RunOptions.newBuilder().setHeapElemSize(32).build());
        Assert.assertEquals(32, c.getHeapElemSize());
        Assert.assertEquals(c, RunConfig.fromProto(c.getRep()));
    }

    @Test
    public void fromSystemProperties() {
        String oldBounded = System.getProperty(RunConfig.BOUNDED_PROPERTY);
        String oldSize = System.getProperty(RunConfig.HEAP_ELEM_SIZE_PROPERTY);
        try {
            System.setProperty(RunConfig.BOUNDED_PROPERTY, "true");
            System.setProperty(RunConfig.HEAP_ELEM_SIZE_PROPERTY, "16");
            RunConfig c = RunConfig.fromSystemProperties();
            Assert.assertTrue(c.isBounded());
            Assert.assertEquals(16, c.getHeapElemSize());

            System.clearProperty(RunConfig.BOUNDED_PROPERTY);
            System.clearProperty(RunConfig.HEAP_ELEM_SIZE_PROPERTY);
            Assert.assertEquals(RunConfig.unbounded(), RunConfig.fromSystemProperties());
        } finally {
            restore(RunConfig.BOUNDED_PROPERTY, oldBounded);
            restore(RunConfig.HEAP_ELEM_SIZE_PROPERTY, oldSize);
        }
    }

    @Test(expected=IllegalArgumentException.class)
    public void badHeapElemSizeProperty() {
        String old = System.getProperty(RunConfig.HEAP_ELEM_SIZE_PROPERTY);
        try {
            System.setProperty(RunConfig.HEAP_ELEM_SIZE_PROPERTY, "wide");
            RunConfig.fromSystemProperties();
        } finally {
            restore(RunConfig.HEAP_ELEM_SIZE_PROPERTY, old);
        }
    }

    private static void restore(String key, String value) {
        if (value == null) {
            System.clearProperty(key);
        } else {
            System.setProperty(key, value);
        }
    }
}
