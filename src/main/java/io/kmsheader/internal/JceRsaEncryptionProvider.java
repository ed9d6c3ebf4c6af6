// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader.internal;

import io.kmsheader.RsaEncryptionProvider;
import io.kmsheader.algorithm.EncryptionAlgorithm;
import io.kmsheader.exception.KmsHeaderException;

import javax.crypto.Cipher;
import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.security.SecureRandom;

import static java.util.Objects.requireNonNull;

/**
 * This API is internal and subject to change. An {@link RsaEncryptionProvider} backed by the JCE
 * {@code RSA/ECB/OAEPPadding} cipher.
 */
public final class JceRsaEncryptionProvider implements RsaEncryptionProvider {

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    @Override
    public byte[] encrypt(PublicKey publicKey, byte[] plaintext, EncryptionAlgorithm algorithm) {
        requireNonNull(publicKey, "publicKey is required");
        requireNonNull(plaintext, "plaintext is required");
        requireNonNull(algorithm, "algorithm is required");

        try {
            final Cipher cipher = Cipher.getInstance(EncryptionAlgorithm.TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, publicKey, algorithm.getOaepParameterSpec(), SECURE_RANDOM);
            return cipher.doFinal(plaintext);
        } catch (final GeneralSecurityException e) {
            throw new KmsHeaderException("Unable to encrypt with " + algorithm, e);
        }
    }
}
