package com.galois.reve;

import org.junit.Assert;
import org.junit.Test;

public class TestTypedValue {
    @Test
    public void kinds() {
        Assert.assertEquals(ValueKind.BOOL, TypedValue.of(true).kind());
        Assert.assertEquals(ValueKind.INT, TypedValue.of(new IntegerValue(1)).kind());
        Assert.assertTrue(TypedValue.of(true).asBool());
        Assert.assertEquals("False", TypedValue.of(false).toString());
    }

    @Test(expected=InterpreterFailedException.class)
    public void boolIsNotAnInteger() {
        TypedValue.of(true).asInt();
    }

    @Test(expected=InterpreterFailedException.class)
    public void integerIsNotABool() {
        TypedValue.of(new IntegerValue(1)).asBool();
    }

    @Test
    public void portableIntegersAreSigned() {
        TypedValue v = TypedValue.of(new BitvectorValue(8, 255));
        Assert.assertEquals(TypedValue.of(new IntegerValue(-1)), v.toPortable());
        Assert.assertEquals("-1", v.getValueRep().getStringValue());
        Assert.assertFalse(v.equals(v.toPortable()));
    }

    @Test
    public void decode() {
        com.google.protobuf.Value b = com.google.protobuf.Value.newBuilder().setBoolValue(true).build();
        Assert.assertEquals(TypedValue.of(true), TypedValue.fromProto(b));
        com.google.protobuf.Value s = com.google.protobuf.Value.newBuilder()
            .setStringValue("-123456789012345678901234567890").build();
        Assert.assertEquals("-123456789012345678901234567890",
                            TypedValue.fromProto(s).asInt().toString());
    }

    @Test(expected=TraceFormatException.class)
    public void numbersAreRejected() {
        TypedValue.fromProto(com.google.protobuf.Value.newBuilder().setNumberValue(3).build());
    }

    @Test(expected=TraceFormatException.class)
    public void nonDecimalStringsAreRejected() {
        TypedValue.fromProto(com.google.protobuf.Value.newBuilder().setStringValue("0x10").build());
    }
}
