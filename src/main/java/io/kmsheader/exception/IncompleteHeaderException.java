// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader.exception;

/**
 * Thrown when an operation needs header fields that have not been set yet.
 */
public class IncompleteHeaderException extends KmsHeaderException {

    private static final long serialVersionUID = -1L;

    public IncompleteHeaderException(final String message) {
        super(message);
    }

    public IncompleteHeaderException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
