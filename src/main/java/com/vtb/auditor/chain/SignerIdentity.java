package com.vtb.auditor.chain;

import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.crypto.generators.Ed25519KeyPairGenerator;
import org.bouncycastle.crypto.params.Ed25519KeyGenerationParameters;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

import java.security.SecureRandom;
import java.util.Arrays;

/**
 * Ed25519 ключ, от имени которого подписываются транзакции атак.
 * Секрет наружу не отдается.
 */
public final class SignerIdentity {

    private final Ed25519PrivateKeyParameters privateKey;
    private final String address;

    private SignerIdentity(Ed25519PrivateKeyParameters privateKey) {
        this.privateKey = privateKey;
        this.address = PublicKeys.encode(privateKey.generatePublicKey().getEncoded());
    }

    public static SignerIdentity generate() {
        Ed25519KeyPairGenerator generator = new Ed25519KeyPairGenerator();
        generator.init(new Ed25519KeyGenerationParameters(new SecureRandom()));
        AsymmetricCipherKeyPair pair = generator.generateKeyPair();
        return new SignerIdentity((Ed25519PrivateKeyParameters) pair.getPrivate());
    }

    public static SignerIdentity fromSeed(byte[] seed) {
        if (seed == null || seed.length != Ed25519PrivateKeyParameters.KEY_SIZE) {
            throw new IllegalArgumentException("Seed должен содержать 32 байта");
        }
        return new SignerIdentity(new Ed25519PrivateKeyParameters(seed, 0));
    }

    /**
     * Ключ в формате Solana CLI: 32 байта seed, затем 32 байта публичного ключа
     */
    public static SignerIdentity fromSecretKey(byte[] secretKey) {
        if (secretKey == null || secretKey.length != 2 * Ed25519PrivateKeyParameters.KEY_SIZE) {
            throw new IllegalArgumentException("Секретный ключ должен содержать 64 байта");
        }
        SignerIdentity identity = fromSeed(Arrays.copyOfRange(secretKey, 0, Ed25519PrivateKeyParameters.KEY_SIZE));
        byte[] publicKey = Arrays.copyOfRange(secretKey, Ed25519PrivateKeyParameters.KEY_SIZE, secretKey.length);
        if (!identity.address().equals(PublicKeys.encode(publicKey))) {
            throw new IllegalArgumentException("Публичная часть ключа не соответствует seed");
        }
        return identity;
    }

    public String address() {
        return address;
    }

    public byte[] sign(byte[] message) {
        Ed25519Signer signer = new Ed25519Signer();
        signer.init(true, privateKey);
        signer.update(message, 0, message.length);
        return signer.generateSignature();
    }

    @Override
    public String toString() {
        return "SignerIdentity[" + address + "]";
    }
}
