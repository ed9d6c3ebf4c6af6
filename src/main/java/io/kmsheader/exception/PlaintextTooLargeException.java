// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader.exception;

/**
 * Thrown when data exceeds what RSA-OAEP can encrypt for the header's key spec and algorithm.
 */
public class PlaintextTooLargeException extends KmsHeaderException {

    private static final long serialVersionUID = -1L;

    public PlaintextTooLargeException(final String message) {
        super(message);
    }

    public PlaintextTooLargeException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
