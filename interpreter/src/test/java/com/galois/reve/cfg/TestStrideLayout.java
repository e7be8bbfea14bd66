package com.galois.reve.cfg;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Assert;
import org.junit.Test;

import com.galois.reve.BitvectorValue;
import com.galois.reve.IntValue;
import com.galois.reve.IntegerValue;
import com.galois.reve.InterpreterFailedException;
import com.galois.reve.RunConfig;

public class TestStrideLayout {
    @Test
    public void boundedIndicesAreSigned() {
        StrideLayout l = new StrideLayout(16, 4);
        IntValue a = l.address(RunConfig.bounded(), new BitvectorValue(64, 1000),
                               Arrays.<IntValue>asList(new BitvectorValue(32, -1),
                                                       new BitvectorValue(8, 3)));
        Assert.assertEquals(new BitvectorValue(64, 1000 - 16 + 12), a);
    }

    @Test
    public void unbounded() {
        StrideLayout l = new StrideLayout(8);
        IntValue a = l.address(RunConfig.unbounded(), new IntegerValue(0),
                               Collections.<IntValue>singletonList(new IntegerValue(5)));
        Assert.assertEquals(new IntegerValue(40), a);
    }

    @Test(expected=InterpreterFailedException.class)
    public void indexCount() {
        new StrideLayout(8).address(RunConfig.unbounded(), new IntegerValue(0),
                                    Collections.<IntValue>emptyList());
    }
}
