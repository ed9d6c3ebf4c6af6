// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader.internal;

import io.kmsheader.exception.InvalidPublicKeyException;
import org.bouncycastle.asn1.pkcs.RSAPublicKey;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemReader;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.interfaces.RSAKey;
import java.security.spec.KeySpec;
import java.security.spec.RSAPublicKeySpec;
import java.security.spec.X509EncodedKeySpec;

import static java.util.Objects.requireNonNull;

/**
 * This API is internal and subject to change. Loads RSA public keys from PEM text or PEM files, as exported by
 * {@code aws kms get-public-key} or {@code openssl rsa -pubout}.
 */
public final class PublicKeys {

    static final String PEM_BEGIN = "-----BEGIN";
    private static final String SUBJECT_PUBLIC_KEY_INFO = "PUBLIC KEY";
    private static final String PKCS1_PUBLIC_KEY = "RSA PUBLIC KEY";

    private PublicKeys() {
    }

    /**
     * @param pemOrPath PEM text, or the path of a file containing PEM text
     * @throws InvalidPublicKeyException if no RSA public key can be read
     */
    public static PublicKey load(String pemOrPath) throws InvalidPublicKeyException {
        requireNonNull(pemOrPath, "pemOrPath is required");

        if (pemOrPath.contains(PEM_BEGIN)) {
            return fromPem(pemOrPath);
        }

        final Path path;
        try {
            path = Paths.get(pemOrPath);
        } catch (InvalidPathException e) {
            throw new InvalidPublicKeyException("public key does not appear to contain a PEM encoded public key", e);
        }
        if (!Files.isRegularFile(path)) {
            throw new InvalidPublicKeyException("public key does not appear to contain a PEM encoded public key");
        }
        return fromFile(path);
    }

    public static PublicKey fromFile(Path path) throws InvalidPublicKeyException {
        requireNonNull(path, "path is required");
        try {
            return fromPem(new String(Files.readAllBytes(path), StandardCharsets.US_ASCII));
        } catch (IOException e) {
            throw new InvalidPublicKeyException("Unable to read public key from " + path, e);
        }
    }

    public static PublicKey fromPem(String pem) throws InvalidPublicKeyException {
        requireNonNull(pem, "pem is required");

        final PemObject pemObject;
        try (PemReader reader = new PemReader(new StringReader(pem))) {
            pemObject = reader.readPemObject();
        } catch (IOException | DecoderException e) {
            throw new InvalidPublicKeyException("Unable to parse PEM public key", e);
        }
        if (pemObject == null) {
            throw new InvalidPublicKeyException("No PEM object found in public key");
        }

        final KeySpec keySpec;
        if (SUBJECT_PUBLIC_KEY_INFO.equals(pemObject.getType())) {
            keySpec = new X509EncodedKeySpec(pemObject.getContent());
        } else if (PKCS1_PUBLIC_KEY.equals(pemObject.getType())) {
            final RSAPublicKey rsaPublicKey;
            try {
                rsaPublicKey = RSAPublicKey.getInstance(pemObject.getContent());
            } catch (IllegalArgumentException e) {
                throw new InvalidPublicKeyException("Malformed PKCS#1 RSA public key", e);
            }
            keySpec = new RSAPublicKeySpec(rsaPublicKey.getModulus(), rsaPublicKey.getPublicExponent());
        } else {
            throw new InvalidPublicKeyException("Unsupported PEM type " + pemObject.getType());
        }

        try {
            return KeyFactory.getInstance("RSA").generatePublic(keySpec);
        } catch (GeneralSecurityException e) {
            throw new InvalidPublicKeyException("PEM does not contain an RSA public key", e);
        }
    }

    /**
     * @return the modulus size in bits
     * @throws InvalidPublicKeyException if the key is not an RSA key
     */
    public static int keySize(PublicKey publicKey) throws InvalidPublicKeyException {
        requireNonNull(publicKey, "publicKey is required");
        if (!(publicKey instanceof RSAKey)) {
            throw new InvalidPublicKeyException("Only RSA public keys are supported, got " + publicKey.getAlgorithm());
        }
        return ((RSAKey) publicKey).getModulus().bitLength();
    }
}
