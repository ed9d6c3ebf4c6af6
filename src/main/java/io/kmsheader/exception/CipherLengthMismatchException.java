// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader.exception;

/**
 * Thrown when cipher data does not have exactly the length implied by the key spec.
 */
public class CipherLengthMismatchException extends KmsHeaderException {

    private static final long serialVersionUID = -1L;

    public CipherLengthMismatchException(final String message) {
        super(message);
    }

    public CipherLengthMismatchException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
