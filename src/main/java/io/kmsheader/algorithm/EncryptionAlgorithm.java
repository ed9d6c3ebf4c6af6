// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader.algorithm;

import io.kmsheader.exception.UnsupportedAlgorithmException;

import javax.annotation.Nullable;
import javax.crypto.spec.OAEPParameterSpec;
import javax.crypto.spec.PSource;
import java.security.spec.MGF1ParameterSpec;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * The RSA-OAEP encryption algorithms AWS KMS supports for RSA keys, with the upper nibble code each one has in the
 * header's algorithm byte.
 */
public enum EncryptionAlgorithm {

    RSAES_OAEP_SHA_1(0x1, 42, "SHA-1", MGF1ParameterSpec.SHA1),
    RSAES_OAEP_SHA_256(0x2, 66, "SHA-256", MGF1ParameterSpec.SHA256);

    /**
     * The Cipher transformation; the digest and MGF1 parameters come from {@link #getOaepParameterSpec()}.
     */
    public static final String TRANSFORMATION = "RSA/ECB/OAEPPadding";

    private final int code;
    private final int oaepOverhead;
    private final String digestName;
    private final MGF1ParameterSpec mgfSpec;

    EncryptionAlgorithm(int code, int oaepOverhead, String digestName, MGF1ParameterSpec mgfSpec) {
        this.code = code;
        this.oaepOverhead = oaepOverhead;
        this.digestName = digestName;
        this.mgfSpec = mgfSpec;
    }

    /**
     * @return the 4 bit code, before shifting into the upper nibble
     */
    public int getCode() {
        return code;
    }

    /**
     * Bytes of an RSA block consumed by OAEP padding: twice the digest length plus two.
     */
    public int getOaepOverhead() {
        return oaepOverhead;
    }

    /**
     * Note: the hash function used with MGF1 is the same as the hash function used directly with the message,
     * which is what AWS KMS expects. The JCE default for {@code OAEPWithSHA-256AndMGF1Padding} uses SHA-1 for
     * MGF1 and would not be decryptable by KMS.
     *
     * @return OAEP parameters for {@link #TRANSFORMATION}
     */
    public OAEPParameterSpec getOaepParameterSpec() {
        return new OAEPParameterSpec(digestName, "MGF1", mgfSpec, PSource.PSpecified.DEFAULT);
    }

    /**
     * @return the AWS KMS {@code EncryptionAlgorithmSpec} value
     */
    public String getKmsAlgorithmSpec() {
        return name();
    }

    @Nullable
    static EncryptionAlgorithm fromCode(int code) {
        for (EncryptionAlgorithm algorithm : values()) {
            if (algorithm.code == code) {
                return algorithm;
            }
        }
        return null;
    }

    /**
     * @param name an algorithm name such as {@code RSAES_OAEP_SHA_256}
     * @throws UnsupportedAlgorithmException if the name is not a supported algorithm
     */
    public static EncryptionAlgorithm fromName(String name) throws UnsupportedAlgorithmException {
        for (EncryptionAlgorithm algorithm : values()) {
            if (algorithm.name().equals(name)) {
                return algorithm;
            }
        }
        throw new UnsupportedAlgorithmException(String.format("algorithm %s must be one of: %s", name,
                Arrays.stream(values()).map(Enum::name).collect(Collectors.joining(", "))));
    }
}
