// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader.kms;

import com.amazonaws.AmazonClientException;
import com.amazonaws.AmazonWebServiceRequest;
import com.amazonaws.services.kms.AWSKMS;
import com.amazonaws.services.kms.model.DecryptRequest;
import com.amazonaws.services.kms.model.DecryptResult;
import io.kmsheader.algorithm.EncryptionAlgorithm;
import io.kmsheader.arn.KmsKeyArn;
import io.kmsheader.exception.DecryptionFailedException;
import io.kmsheader.internal.LibraryInfo;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * A {@link KmsDecrypter} that uses an AWS SDK for Java v1 {@code AWSKMS} client. Use
 * {@link io.kmsheader.kmssdkv2.KmsClientDecrypter} with the AWS SDK for Java v2.
 */
public class AwsKmsDecrypter implements KmsDecrypter {

    private final AWSKMS client;
    private final boolean canAppendUserAgentString;
    private final List<String> grantTokens;

    public AwsKmsDecrypter(AWSKMS client) {
        // Assume the user agent string cannot be appended (default)
        this(client, null, false);
    }

    public AwsKmsDecrypter(AWSKMS client, List<String> grantTokens, boolean canAppendUserAgentString) {
        requireNonNull(client, "client is required");

        this.client = client;
        this.canAppendUserAgentString = canAppendUserAgentString;
        this.grantTokens = grantTokens == null ? new ArrayList<>() : new ArrayList<>(grantTokens);
    }

    /**
     * Builds a {@link KmsDecrypterSupplier} that hands out a decrypter for whichever client the given function
     * returns for a region.
     */
    public static KmsDecrypterSupplier supplier(Function<String, AWSKMS> clientsByRegion) {
        requireNonNull(clientsByRegion, "clientsByRegion is required");
        return regionId -> new AwsKmsDecrypter(clientsByRegion.apply(regionId));
    }

    @Override
    public byte[] decrypt(KmsKeyArn keyArn, byte[] ciphertext, EncryptionAlgorithm algorithm) {
        requireNonNull(keyArn, "keyArn is required");
        requireNonNull(ciphertext, "ciphertext is required");
        requireNonNull(algorithm, "algorithm is required");

        final DecryptResult kmsResult;
        try {
            kmsResult = client.decrypt(updateUserAgent(
                new DecryptRequest()
                    .withCiphertextBlob(ByteBuffer.wrap(ciphertext))
                    .withKeyId(keyArn.toString())
                    .withEncryptionAlgorithm(algorithm.getKmsAlgorithmSpec())
                    .withGrantTokens(grantTokens)));
        } catch (final AmazonClientException ex) {
            throw new DecryptionFailedException(ex);
        }
        if (kmsResult == null) {
            throw new DecryptionFailedException("Received an empty response from KMS");
        }
        if (!keyArn.toString().equals(kmsResult.getKeyId())) {
            throw new DecryptionFailedException("Received an unexpected key Id from KMS: " + kmsResult.getKeyId());
        }

        final ByteBuffer plaintext = kmsResult.getPlaintext();
        final byte[] rawData = new byte[plaintext.remaining()];
        plaintext.get(rawData);
        return rawData;
    }

    public List<String> getGrantTokens() {
        return Collections.unmodifiableList(grantTokens);
    }

    private <T extends AmazonWebServiceRequest> T updateUserAgent(T request) {
        if (this.canAppendUserAgentString) {
            request.getRequestClientOptions().appendUserAgent(LibraryInfo.userAgent());
        }
        return request;
    }
}
