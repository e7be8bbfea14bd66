package com.galois.reve;

import java.math.BigInteger;

/**
 * The value of a variable: either an integer ({@link TypedValue.Int}) or a
 * Boolean ({@link TypedValue.Bool}).
 *
 * <p>
 * Booleans are never converted to integers implicitly.  Asking a Boolean for
 * its integer (or an integer for its Boolean) throws an
 * {@link InterpreterFailedException}, since well-formed programs never mix
 * the two.
 */
public abstract class TypedValue {
    private TypedValue() {}

    /**
     * Return which kind of value this is.
     * @return the kind
     */
    public abstract ValueKind kind();

    /**
     * Return the integer held by this value.
     * @return the integer
     * @throws InterpreterFailedException if this is a Boolean
     */
    public abstract IntValue asInt();

    /**
     * Return the Boolean held by this value.
     * @return the Boolean
     * @throws InterpreterFailedException if this is an integer
     */
    public abstract boolean asBool();

    /**
     * Return the portable form of this value, in which every integer is an
     * unbounded integer holding its signed value.
     * @return the portable value
     */
    public abstract TypedValue toPortable();

    /**
     * Return the protocol buffer representation of this value.  Booleans are
     * Boolean values; integers are their signed decimal text.
     * @return the representation
     */
    public abstract com.google.protobuf.Value getValueRep();

    public static TypedValue of(IntValue i) {
        return new Int(i);
    }

    public static TypedValue of(boolean b) {
        return b ? Bool.TRUE : Bool.FALSE;
    }

    /**
     * Decode a value from its protocol buffer representation.  Integers are
     * decoded as unbounded integers.
     * @param rep the representation
     * @return the value
     * @throws TraceFormatException if the representation is neither a Boolean
     *   nor a decimal string
     */
    public static TypedValue fromProto(com.google.protobuf.Value rep) {
        Call.checkNoUnknownFields(rep, "Value");
        switch (rep.getKindCase()) {
        case BOOL_VALUE:
            return of(rep.getBoolValue());
        case STRING_VALUE:
            return of(new IntegerValue(parseDecimal(rep.getStringValue())));
        default:
            throw new TraceFormatException("Unexpected value kind: " + rep.getKindCase());
        }
    }

    static BigInteger parseDecimal(String s) {
        try {
            return new BigInteger(s, 10);
        } catch (NumberFormatException e) {
            throw new TraceFormatException("Not a decimal integer: \"" + s + "\"", e);
        }
    }

    /** An integer value. */
    public static final class Int extends TypedValue {
        private final IntValue value;

        Int(IntValue value) {
            if (value == null) throw new NullPointerException("value");
            this.value = value;
        }

        public ValueKind kind() {
            return ValueKind.INT;
        }

        public IntValue asInt() {
            return value;
        }

        public boolean asBool() {
            throw new InterpreterFailedException("Expected a Boolean but got integer " + value);
        }

        public TypedValue toPortable() {
            if (value instanceof IntegerValue) {
                return this;
            }
            return new Int(new IntegerValue(value.toSignedBigInteger()));
        }

        public com.google.protobuf.Value getValueRep() {
            return com.google.protobuf.Value.newBuilder()
                .setStringValue(value.toSignedBigInteger().toString())
                .build();
        }

        public String toString() {
            return value.toString();
        }

        public boolean equals(Object o) {
            if (!(o instanceof Int)) return false;
            return value.equals(((Int) o).value);
        }

        public int hashCode() {
            return value.hashCode();
        }
    }

    /** A Boolean value. */
    public static final class Bool extends TypedValue {
        public static final Bool TRUE = new Bool(true);
        public static final Bool FALSE = new Bool(false);

        private final boolean value;

        private Bool(boolean value) {
            this.value = value;
        }

        public ValueKind kind() {
            return ValueKind.BOOL;
        }

        public IntValue asInt() {
            throw new InterpreterFailedException("Expected an integer but got Boolean " + value);
        }

        public boolean asBool() {
            return value;
        }

        public TypedValue toPortable() {
            return this;
        }

        public com.google.protobuf.Value getValueRep() {
            return com.google.protobuf.Value.newBuilder()
                .setBoolValue(value)
                .build();
        }

        /**
         * Return string "True" or "False" based on value.
         */
        public String toString() {
            return value ? "True" : "False";
        }

        public boolean equals(Object o) {
            if (!(o instanceof Bool)) return false;
            return value == ((Bool) o).value;
        }

        public int hashCode() {
            return value ? 1231 : 1237;
        }
    }
}
