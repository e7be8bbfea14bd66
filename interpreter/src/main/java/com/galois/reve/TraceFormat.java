package com.galois.reve;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.util.JsonFormat;

import com.galois.reve.proto.Protos;

/**
 * Encoding of call records.
 *
 * <p>
 * The compact form is the protocol buffer encoding of {@link Protos.Call}.
 * The readable form is its JSON mapping, with the field names of the
 * message definition, Booleans as JSON Booleans and integers as decimal
 * strings.  Records decode in portable form.
 */
public final class TraceFormat {
    private TraceFormat() {}

    private static final JsonFormat.Printer printer =
        JsonFormat.printer()
        .preservingProtoFieldNames()
        .includingDefaultValueFields();

    private static final JsonFormat.Parser parser = JsonFormat.parser();

    public static byte[] toBytes(Call<?> call) {
        return call.getCallRep().toByteArray();
    }

    /**
     * Decode the compact form.
     * @throws TraceFormatException if <code>bytes</code> is not a call record
     */
    public static Call<String> fromBytes(byte[] bytes) {
        Protos.Call rep;
        try {
            rep = Protos.Call.parseFrom(bytes);
        } catch (InvalidProtocolBufferException e) {
            throw new TraceFormatException("Could not parse call record.", e);
        }
        return Call.fromProto(rep);
    }

    public static String toJson(Call<?> call) {
        try {
            return printer.print(call.getCallRep());
        } catch (InvalidProtocolBufferException e) {
            throw new TraceFormatException("Could not print call record.", e);
        }
    }

    /**
     * Decode the readable form.
     * @throws TraceFormatException if <code>json</code> is not a call record
     */
    public static Call<String> fromJson(String json) {
        Protos.Call.Builder b = Protos.Call.newBuilder();
        try {
            parser.merge(json, b);
        } catch (InvalidProtocolBufferException e) {
            throw new TraceFormatException("Could not parse call record.", e);
        }
        return Call.fromProto(b.build());
    }

    /**
     * Write <code>call</code> to <code>out</code> preceded by its length, so
     * that several records can share a stream.
     */
    public static void writeDelimited(Call<?> call, OutputStream out) throws IOException {
        call.getCallRep().writeDelimitedTo(out);
    }

    /**
     * Read a record written by {@link #writeDelimited}.
     * @return the record, or <code>null</code> at the end of the stream
     * @throws TraceFormatException if the stream holds a malformed record
     */
    public static Call<String> readDelimited(InputStream in) throws IOException {
        Protos.Call rep;
        try {
            rep = Protos.Call.parseDelimitedFrom(in);
        } catch (InvalidProtocolBufferException e) {
            throw new TraceFormatException("Could not parse call record.", e);
        }
        if (rep == null) {
            return null;
        }
        return Call.fromProto(rep);
    }
}
