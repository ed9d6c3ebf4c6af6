// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader.exception;

/**
 * Thrown when a public key cannot be loaded from a PEM string or file, or is not an RSA key.
 */
public class InvalidPublicKeyException extends KmsHeaderException {

    private static final long serialVersionUID = -1L;

    public InvalidPublicKeyException(final String message) {
        super(message);
    }

    public InvalidPublicKeyException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
