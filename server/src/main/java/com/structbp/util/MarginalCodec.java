package com.structbp.util;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;

/**
 * Encodes a probability vector as a 4-byte count followed by big-endian doubles.
 */
public class MarginalCodec {

    public static byte[] toBytes(double[] probabilities) {
        if (probabilities == null) {
            return null;
        }
        ByteBuffer buffer = ByteBuffer.allocate(Integer.BYTES + probabilities.length * Double.BYTES);
        buffer.putInt(probabilities.length);
        buffer.asDoubleBuffer().put(probabilities);
        return buffer.array();
    }

    public static double[] fromBytes(byte[] bytes) {
        if (bytes == null) {
            return null;
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        try {
            int count = buffer.getInt();
            if (count < 0 || buffer.remaining() != count * Double.BYTES) {
                throw new IllegalArgumentException("Marginal blob length " + bytes.length
                        + " does not match declared count " + count);
            }
            double[] probabilities = new double[count];
            buffer.asDoubleBuffer().get(probabilities);
            return probabilities;
        } catch (BufferUnderflowException e) {
            throw new IllegalArgumentException("Truncated marginal blob of " + bytes.length + " bytes", e);
        }
    }
}
