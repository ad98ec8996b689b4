package com.vtb.auditor.chain;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Чтение keypair-файла Solana CLI (JSON массив из 64 чисел)
 */
@Slf4j
public final class KeypairLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private KeypairLoader() {
    }

    public static SignerIdentity load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Keypair файл не найден: " + path);
        }
        int[] values;
        try {
            values = MAPPER.readValue(path.toFile(), int[].class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Не удалось прочитать keypair " + path + ": " + e.getMessage(), e);
        }
        byte[] secretKey = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            if (values[i] < 0 || values[i] > 255) {
                throw new IllegalArgumentException("Keypair " + path + " содержит не байт: " + values[i]);
            }
            secretKey[i] = (byte) values[i];
        }
        SignerIdentity identity = SignerIdentity.fromSecretKey(secretKey);
        log.debug("Загружен keypair {} из {}", identity.address(), path);
        return identity;
    }
}
