// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader.exception;

/**
 * Thrown when a partial header is not 16, 32, 35 or 36 bytes long.
 */
public class InvalidPrefixLengthException extends KmsHeaderException {

    private static final long serialVersionUID = -1L;

    public InvalidPrefixLengthException(final String message) {
        super(message);
    }

    public InvalidPrefixLengthException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
