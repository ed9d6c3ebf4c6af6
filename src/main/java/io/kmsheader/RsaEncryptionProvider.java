// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader;

import io.kmsheader.algorithm.EncryptionAlgorithm;

import java.security.PublicKey;

/**
 * Performs the local RSA-OAEP encryption of the data a {@link KmsHeader} wraps. AWS KMS is not involved in
 * encryption; only the public half of the KMS key is needed.
 */
@FunctionalInterface
public interface RsaEncryptionProvider {

    /**
     * @param publicKey The RSA public key of the KMS key
     * @param plaintext The data to wrap, small enough for the key size and algorithm
     * @param algorithm The OAEP variant, which selects both the OAEP digest and the MGF1 digest
     * @return The RSA cipher text, exactly as long as the key's modulus
     */
    byte[] encrypt(PublicKey publicKey, byte[] plaintext, EncryptionAlgorithm algorithm);
}
