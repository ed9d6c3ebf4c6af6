// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader.exception;

/**
 * Thrown when an RSA key spec other than 2048, 3072 or 4096 bits is requested, including through a public key.
 */
public class UnsupportedKeySpecException extends KmsHeaderException {

    private static final long serialVersionUID = -1L;

    public UnsupportedKeySpecException(final String message) {
        super(message);
    }

    public UnsupportedKeySpecException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
