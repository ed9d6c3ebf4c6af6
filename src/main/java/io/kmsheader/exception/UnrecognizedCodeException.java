// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader.exception;

/**
 * Thrown when a non-zero nibble of the algorithm byte matches no known algorithm or key spec.
 */
public class UnrecognizedCodeException extends KmsHeaderException {

    private static final long serialVersionUID = -1L;

    public UnrecognizedCodeException(final String message) {
        super(message);
    }

    public UnrecognizedCodeException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
