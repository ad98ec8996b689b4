package com.vtb.auditor.catalog;

import com.vtb.auditor.chain.InstructionBuildException;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

/**
 * Little-endian кодирование аргументов в формате Borsh
 */
class BorshWriter {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    BorshWriter writeRaw(byte[] bytes) {
        out.writeBytes(bytes);
        return this;
    }

    BorshWriter writeUnsigned(BigInteger value, int size, String name) {
        if (value.signum() < 0 || value.bitLength() > size * 8) {
            throw new InstructionBuildException("Аргумент " + name + " вне диапазона u" + (size * 8) + ": " + value);
        }
        writeLittleEndian(value, size);
        return this;
    }

    BorshWriter writeSigned(BigInteger value, int size, String name) {
        BigInteger min = BigInteger.ONE.shiftLeft(size * 8 - 1).negate();
        BigInteger max = BigInteger.ONE.shiftLeft(size * 8 - 1).subtract(BigInteger.ONE);
        if (value.compareTo(min) < 0 || value.compareTo(max) > 0) {
            throw new InstructionBuildException("Аргумент " + name + " вне диапазона i" + (size * 8) + ": " + value);
        }
        BigInteger unsigned = value.signum() < 0 ? value.add(BigInteger.ONE.shiftLeft(size * 8)) : value;
        writeLittleEndian(unsigned, size);
        return this;
    }

    BorshWriter writeBool(boolean value) {
        out.write(value ? 1 : 0);
        return this;
    }

    BorshWriter writeString(String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        writeUnsigned(BigInteger.valueOf(bytes.length), 4, "string length");
        out.writeBytes(bytes);
        return this;
    }

    byte[] toByteArray() {
        return out.toByteArray();
    }

    private void writeLittleEndian(BigInteger value, int size) {
        for (int i = 0; i < size; i++) {
            out.write(value.shiftRight(8 * i).and(BigInteger.valueOf(0xFF)).intValue());
        }
    }
}
