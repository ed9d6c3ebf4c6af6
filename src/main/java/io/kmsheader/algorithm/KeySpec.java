// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader.algorithm;

import io.kmsheader.exception.UnsupportedKeySpecException;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * The RSA key specs a KMS header can describe, with the lower nibble code each one has in the algorithm byte.
 */
public enum KeySpec {

    RSA_2048(0x1, 2048),
    RSA_3072(0x2, 3072),
    RSA_4096(0x3, 4096);

    private final int code;
    private final int keySize;

    KeySpec(int code, int keySize) {
        this.code = code;
        this.keySize = keySize;
    }

    public int getCode() {
        return code;
    }

    /**
     * @return the modulus size in bits
     */
    public int getKeySize() {
        return keySize;
    }

    /**
     * @return the number of bytes RSA produces with a key of this size, which is the header's cipher data length
     */
    public int getCipherLength() {
        return keySize / Byte.SIZE;
    }

    @Nullable
    static KeySpec fromCode(int code) {
        for (KeySpec keySpec : values()) {
            if (keySpec.code == code) {
                return keySpec;
            }
        }
        return null;
    }

    /**
     * @param name a key spec name such as {@code RSA_2048}
     * @throws UnsupportedKeySpecException if the name is not a supported key spec
     */
    public static KeySpec fromName(String name) throws UnsupportedKeySpecException {
        for (KeySpec keySpec : values()) {
            if (keySpec.name().equals(name)) {
                return keySpec;
            }
        }
        throw new UnsupportedKeySpecException(String.format("key spec %s must be one of: %s", name, supportedNames()));
    }

    /**
     * @param keySize an RSA modulus size in bits
     * @throws UnsupportedKeySpecException if no key spec has that size
     */
    public static KeySpec fromKeySize(int keySize) throws UnsupportedKeySpecException {
        for (KeySpec keySpec : values()) {
            if (keySpec.keySize == keySize) {
                return keySpec;
            }
        }
        throw new UnsupportedKeySpecException(String.format("RSA_%d must be one of: %s", keySize, supportedNames()));
    }

    private static String supportedNames() {
        return Arrays.stream(values()).map(Enum::name).collect(Collectors.joining(", "));
    }
}
