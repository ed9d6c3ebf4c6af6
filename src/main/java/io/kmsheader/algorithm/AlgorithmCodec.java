// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader.algorithm;

import io.kmsheader.exception.UnrecognizedCodeException;

import javax.annotation.Nullable;

/**
 * Packs an {@link EncryptionAlgorithm} and a {@link KeySpec} into the header's single algorithm byte:
 * bits 7-4 hold the algorithm code and bits 3-0 the key spec code. A zero nibble means the value is absent.
 */
public final class AlgorithmCodec {

    private static final int ALGORITHM_MASK = 0xF0;
    private static final int KEY_SPEC_MASK = 0x0F;
    private static final int ALGORITHM_SHIFT = 4;

    private AlgorithmCodec() {
    }

    public static byte encode(@Nullable EncryptionAlgorithm algorithm, @Nullable KeySpec keySpec) {
        int value = 0;
        if (algorithm != null) {
            value |= algorithm.getCode() << ALGORITHM_SHIFT;
        }
        if (keySpec != null) {
            value |= keySpec.getCode();
        }
        return (byte) value;
    }

    /**
     * @throws UnrecognizedCodeException if a non-zero nibble matches no algorithm or key spec
     */
    public static AlgorithmInfo decode(byte value) throws UnrecognizedCodeException {
        final int algorithmCode = (value & ALGORITHM_MASK) >>> ALGORITHM_SHIFT;
        final int keySpecCode = value & KEY_SPEC_MASK;

        EncryptionAlgorithm algorithm = null;
        if (algorithmCode != 0) {
            algorithm = EncryptionAlgorithm.fromCode(algorithmCode);
            if (algorithm == null) {
                throw new UnrecognizedCodeException(String.format("Unrecognized algorithm code 0x%x", algorithmCode));
            }
        }

        KeySpec keySpec = null;
        if (keySpecCode != 0) {
            keySpec = KeySpec.fromCode(keySpecCode);
            if (keySpec == null) {
                throw new UnrecognizedCodeException(String.format("Unrecognized key spec code 0x%x", keySpecCode));
            }
        }

        return new AlgorithmInfo(algorithm, keySpec);
    }
}
