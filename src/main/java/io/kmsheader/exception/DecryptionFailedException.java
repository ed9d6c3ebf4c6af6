// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader.exception;

/**
 * Thrown when AWS KMS could not decrypt the cipher data. The cause is the SDK or region failure, unmodified.
 */
public class DecryptionFailedException extends KmsHeaderException {

    private static final long serialVersionUID = -1L;

    public DecryptionFailedException(final Throwable cause) {
        super(cause);
    }

    public DecryptionFailedException(final String message) {
        super(message);
    }

    public DecryptionFailedException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
