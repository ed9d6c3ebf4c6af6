// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader.kmssdkv2;

import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.kms.KmsClient;

/**
 * Caller managed source of AWS SDK v2 KMS clients, one per region named in a header's key ARN.
 * Adapted by {@link StandardKmsDecrypterSuppliers#fromRegionalClientSupplier(RegionalClientSupplier)}, which neither
 * caches nor closes the clients it is given.
 */
@FunctionalInterface
public interface RegionalClientSupplier {

    /**
     * @param region region of the key ARN being decrypted
     * @return a client for {@code region}, or null to refuse the region
     */
    KmsClient getClient(Region region);
}
