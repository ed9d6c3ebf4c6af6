// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader.exception;

/**
 * Thrown when the 35 binary ARN bytes of a header do not decode to a KMS key ARN.
 */
public class MalformedArnException extends KmsHeaderException {

    private static final long serialVersionUID = -1L;

    public MalformedArnException(final String message) {
        super(message);
    }

    public MalformedArnException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
