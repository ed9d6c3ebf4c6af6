// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader;

import io.kmsheader.algorithm.EncryptionAlgorithm;
import io.kmsheader.algorithm.KeySpec;
import io.kmsheader.arn.AwsRegion;
import io.kmsheader.arn.KmsKeyArn;

import javax.annotation.Nullable;
import java.util.Objects;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * The fields decoded from a prefix of a KMS header by {@link KmsHeaderInspector}. Only the key id is always present.
 */
public final class PartialKmsHeader {

    private final int prefixLength;
    private final String keyId;
    @Nullable
    private final String accountId;
    @Nullable
    private final AwsRegion region;
    @Nullable
    private final EncryptionAlgorithm algorithm;
    @Nullable
    private final KeySpec keySpec;

    PartialKmsHeader(int prefixLength, String keyId, @Nullable String accountId, @Nullable AwsRegion region,
                     @Nullable EncryptionAlgorithm algorithm, @Nullable KeySpec keySpec) {
        this.prefixLength = prefixLength;
        this.keyId = requireNonNull(keyId, "keyId is required");
        this.accountId = accountId;
        this.region = region;
        this.algorithm = algorithm;
        this.keySpec = keySpec;
    }

    /**
     * @return the number of header bytes this was decoded from
     */
    public int getPrefixLength() {
        return prefixLength;
    }

    public String getKeyId() {
        return keyId;
    }

    public Optional<String> getAccountId() {
        return Optional.ofNullable(accountId);
    }

    public Optional<AwsRegion> getRegion() {
        return Optional.ofNullable(region);
    }

    public Optional<EncryptionAlgorithm> getAlgorithm() {
        return Optional.ofNullable(algorithm);
    }

    public Optional<KeySpec> getKeySpec() {
        return Optional.ofNullable(keySpec);
    }

    /**
     * @return the full key ARN, if the prefix was long enough to contain one
     */
    public Optional<KmsKeyArn> getArn() {
        if (accountId == null || region == null) {
            return Optional.empty();
        }
        return Optional.of(KmsKeyArn.of(region, accountId, keyId));
    }

    /**
     * Checks whether every field decoded so far agrees with {@code arn}.
     */
    public boolean matches(KmsKeyArn arn) {
        requireNonNull(arn, "arn is required");
        return keyId.equals(arn.getKeyId())
                && (accountId == null || accountId.equals(arn.getAccountId()))
                && (region == null || region.equals(arn.getRegion()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PartialKmsHeader that = (PartialKmsHeader) o;
        return prefixLength == that.prefixLength
                && keyId.equals(that.keyId)
                && Objects.equals(accountId, that.accountId)
                && Objects.equals(region, that.region)
                && algorithm == that.algorithm
                && keySpec == that.keySpec;
    }

    @Override
    public int hashCode() {
        return Objects.hash(prefixLength, keyId, accountId, region, algorithm, keySpec);
    }

    @Override
    public String toString() {
        return "PartialKmsHeader{prefixLength=" + prefixLength + ", keyId=" + keyId + ", accountId=" + accountId
                + ", region=" + region + ", algorithm=" + algorithm + ", keySpec=" + keySpec + "}";
    }
}
