// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader.kms;

import io.kmsheader.arn.KmsKeyArn;
import io.kmsheader.exception.UnsupportedRegionException;

import static java.util.Objects.requireNonNull;

/**
 * Represents a function that accepts an AWS region and returns a {@code KmsDecrypter} bound to a KMS client for
 * that region.
 */
@FunctionalInterface
public interface KmsDecrypterSupplier {

    /**
     * Gets a {@code KmsDecrypter} for the given regionId.
     *
     * @param regionId The AWS region, e.g. {@code us-east-1}
     * @return The decrypter
     * @throws UnsupportedRegionException if a regionId is specified that this
     *                                    supplier is configured to not allow.
     */
    KmsDecrypter getDecrypter(String regionId) throws UnsupportedRegionException;

    /**
     * Passes the region of the given key ARN to the given supplier to produce a {@code KmsDecrypter}.
     *
     * @param keyArn   The key ARN
     * @param supplier The decrypter supplier
     * @return The decrypter
     */
    static KmsDecrypter getDecrypterByArn(KmsKeyArn keyArn, KmsDecrypterSupplier supplier) {
        requireNonNull(keyArn, "keyArn is required");
        requireNonNull(supplier, "supplier is required");

        return supplier.getDecrypter(keyArn.getRegion().toString());
    }
}
