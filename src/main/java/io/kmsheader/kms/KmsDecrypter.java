// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader.kms;

import io.kmsheader.algorithm.EncryptionAlgorithm;
import io.kmsheader.arn.KmsKeyArn;
import io.kmsheader.exception.DecryptionFailedException;

/**
 * Calls AWS KMS to decrypt the RSA cipher data of a KMS header with the private half of the key. The private key
 * never leaves KMS.
 */
@FunctionalInterface
public interface KmsDecrypter {

    /**
     * @param keyArn     The asymmetric KMS key the data was encrypted for
     * @param ciphertext The RSA cipher data
     * @param algorithm  The RSA-OAEP algorithm the data was encrypted with
     * @return The plaintext exactly as KMS returned it
     * @throws DecryptionFailedException if KMS or the SDK reported a failure; the cause is the original exception
     */
    byte[] decrypt(KmsKeyArn keyArn, byte[] ciphertext, EncryptionAlgorithm algorithm) throws DecryptionFailedException;
}
