// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader.exception;

/**
 * Thrown when an encryption algorithm other than {@code RSAES_OAEP_SHA_1} or {@code RSAES_OAEP_SHA_256} is requested.
 */
public class UnsupportedAlgorithmException extends KmsHeaderException {

    private static final long serialVersionUID = -1L;

    public UnsupportedAlgorithmException(final String message) {
        super(message);
    }

    public UnsupportedAlgorithmException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
