// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader;

import io.kmsheader.algorithm.AlgorithmCodec;
import io.kmsheader.algorithm.AlgorithmInfo;
import io.kmsheader.algorithm.EncryptionAlgorithm;
import io.kmsheader.algorithm.KeySpec;
import io.kmsheader.arn.AwsRegion;
import io.kmsheader.arn.KmsKeyArnCodec;
import io.kmsheader.exception.HeaderTooShortException;
import io.kmsheader.exception.InvalidPrefixLengthException;

import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;

import static java.util.Objects.requireNonNull;

/**
 * Decodes the leading fields of a KMS header without reading the cipher data. Useful for finding which key or
 * account encrypted an object by fetching only a byte range of it.
 */
public final class KmsHeaderInspector {

    public static final int KEY_ID_PREFIX = KmsKeyArnCodec.KEY_ID_LENGTH;
    public static final int ACCOUNT_ID_PREFIX = KmsKeyArnCodec.REGION_OFFSET;
    public static final int ARN_PREFIX = KmsHeader.ARN_LENGTH;
    public static final int ALGORITHM_PREFIX = KmsHeader.ALGORITHM_LENGTH;

    private KmsHeaderInspector() {
        // Prevent instantiation
    }

    /**
     * @param prefix The first 16, 32, 35 or 36 bytes of a header
     * @return The fields contained in the prefix
     * @throws InvalidPrefixLengthException if the prefix has any other length
     */
    public static PartialKmsHeader inspect(byte[] prefix) {
        requireNonNull(prefix, "prefix is required");
        checkPrefixLength(prefix.length);

        final String keyId = KmsKeyArnCodec.decodeKeyId(prefix, KmsKeyArnCodec.KEY_ID_OFFSET);
        String accountId = null;
        AwsRegion region = null;
        EncryptionAlgorithm algorithm = null;
        KeySpec keySpec = null;

        if (prefix.length >= ACCOUNT_ID_PREFIX) {
            accountId = KmsKeyArnCodec.decodeAccountId(prefix, KmsKeyArnCodec.ACCOUNT_ID_OFFSET);
        }
        if (prefix.length >= ARN_PREFIX) {
            region = KmsKeyArnCodec.decodeRegion(prefix, KmsKeyArnCodec.REGION_OFFSET);
        }
        if (prefix.length >= ALGORITHM_PREFIX) {
            final AlgorithmInfo info = AlgorithmCodec.decode(prefix[ARN_PREFIX]);
            // same default as KmsHeader.fromBytes for an absent algorithm nibble
            algorithm = info.getAlgorithm().orElse(KmsHeader.DEFAULT_ALGORITHM);
            keySpec = info.getKeySpec().orElse(null);
        }
        return new PartialKmsHeader(prefix.length, keyId, accountId, region, algorithm, keySpec);
    }

    /**
     * Reads exactly {@code prefixLength} bytes from {@code in} and inspects them.
     *
     * @throws InvalidPrefixLengthException if {@code prefixLength} is not 16, 32, 35 or 36
     * @throws HeaderTooShortException      if the stream ends first
     * @throws IOException                  if reading fails
     */
    public static PartialKmsHeader inspect(InputStream in, int prefixLength) throws IOException {
        requireNonNull(in, "in is required");
        checkPrefixLength(prefixLength);

        final byte[] prefix = new byte[prefixLength];
        try {
            new DataInputStream(in).readFully(prefix);
        } catch (EOFException e) {
            throw new HeaderTooShortException(
                    String.format("Stream ended before %d header bytes were read", prefixLength), e);
        }
        return inspect(prefix);
    }

    private static void checkPrefixLength(int length) {
        if (length != KEY_ID_PREFIX && length != ACCOUNT_ID_PREFIX
                && length != ARN_PREFIX && length != ALGORITHM_PREFIX) {
            throw new InvalidPrefixLengthException(String.format(
                    "A header prefix must be %d, %d, %d or %d bytes, got %d",
                    KEY_ID_PREFIX, ACCOUNT_ID_PREFIX, ARN_PREFIX, ALGORITHM_PREFIX, length));
        }
    }
}
