package com.galois.reve.cfg;

import java.util.Arrays;
import java.util.List;

import com.galois.reve.BitvectorValue;
import com.galois.reve.IntValue;
import com.galois.reve.InterpreterFailedException;
import com.galois.reve.RunConfig;

/**
 * Layout in which index <code>i</code> advances the address by a fixed
 * stride: the address is <code>base + index_0 * stride_0 + index_1 *
 * stride_1 + ...</code>.  Indices are signed.
 */
public final class StrideLayout implements AddressLayout {
    private final long[] strides;

    public StrideLayout(long... strides) {
        this.strides = strides.clone();
    }

    public int getIndexCount() {
        return strides.length;
    }

    public IntValue address(RunConfig config, IntValue base, List<IntValue> indices) {
        if (indices.size() != strides.length) {
            String msg = String.format("Expected %d indices, got %d.", strides.length, indices.size());
            throw new InterpreterFailedException(msg);
        }
        IntValue addr = base.asPointer();
        for (int i = 0; i != strides.length; ++i) {
            IntValue stride = config.intOf(64, strides[i]);
            addr = addr.add(toPointerWidth(indices.get(i)).mul(stride));
        }
        return addr;
    }

    private static IntValue toPointerWidth(IntValue index) {
        if (index instanceof BitvectorValue && ((BitvectorValue) index).getWidth() < 64) {
            return index.sext(64);
        }
        return index.asPointer();
    }

    public String toString() {
        return "stride " + Arrays.toString(strides);
    }
}
