package com.vtb.auditor.snapshot;

import com.vtb.auditor.chain.PublicKeys;

import java.math.BigInteger;
import java.util.Arrays;

final class ByteReader {

    private ByteReader() {
    }

    static BigInteger readUnsigned(byte[] data, int offset, int size) {
        BigInteger value = BigInteger.ZERO;
        for (int i = size - 1; i >= 0; i--) {
            value = value.shiftLeft(8).or(BigInteger.valueOf(data[offset + i] & 0xFF));
        }
        return value;
    }

    static BigInteger readSigned(byte[] data, int offset, int size) {
        BigInteger unsigned = readUnsigned(data, offset, size);
        if (unsigned.testBit(size * 8 - 1)) {
            return unsigned.subtract(BigInteger.ONE.shiftLeft(size * 8));
        }
        return unsigned;
    }

    static String readPublicKey(byte[] data, int offset) {
        return PublicKeys.encode(Arrays.copyOfRange(data, offset, offset + PublicKeys.KEY_LENGTH));
    }
}
