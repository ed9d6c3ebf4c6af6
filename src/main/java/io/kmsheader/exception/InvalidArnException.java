// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader.exception;

/**
 * Thrown when a KMS key ARN string does not match {@code arn:aws:kms:<region>:<account>:key/<key id>}.
 */
public class InvalidArnException extends KmsHeaderException {

    private static final long serialVersionUID = -1L;

    public InvalidArnException(final String message) {
        super(message);
    }

    public InvalidArnException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
