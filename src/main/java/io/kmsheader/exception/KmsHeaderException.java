// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader.exception;

/**
 * Base class for every failure raised while building, parsing, encrypting or decrypting a KMS header.
 */
public class KmsHeaderException extends RuntimeException {

    private static final long serialVersionUID = -1L;

    public KmsHeaderException() {
        super();
    }

    public KmsHeaderException(final String message) {
        super(message);
    }

    public KmsHeaderException(final Throwable cause) {
        super(cause);
    }

    public KmsHeaderException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
