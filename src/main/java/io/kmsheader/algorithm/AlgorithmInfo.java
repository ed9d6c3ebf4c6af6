// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader.algorithm;

import javax.annotation.Nullable;
import java.util.Objects;
import java.util.Optional;

/**
 * The two halves of a decoded algorithm byte. Either half may be absent.
 */
public final class AlgorithmInfo {

    private final EncryptionAlgorithm algorithm;
    private final KeySpec keySpec;

    public AlgorithmInfo(@Nullable EncryptionAlgorithm algorithm, @Nullable KeySpec keySpec) {
        this.algorithm = algorithm;
        this.keySpec = keySpec;
    }

    public Optional<EncryptionAlgorithm> getAlgorithm() {
        return Optional.ofNullable(algorithm);
    }

    public Optional<KeySpec> getKeySpec() {
        return Optional.ofNullable(keySpec);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AlgorithmInfo that = (AlgorithmInfo) o;
        return algorithm == that.algorithm && keySpec == that.keySpec;
    }

    @Override
    public int hashCode() {
        return Objects.hash(algorithm, keySpec);
    }

    @Override
    public String toString() {
        return "AlgorithmInfo{algorithm=" + algorithm + ", keySpec=" + keySpec + "}";
    }
}
