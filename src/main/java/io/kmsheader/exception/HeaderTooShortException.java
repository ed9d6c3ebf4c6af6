// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader.exception;

/**
 * Thrown when fewer bytes than the 35 byte ARN section are available to parse a header.
 */
public class HeaderTooShortException extends KmsHeaderException {

    private static final long serialVersionUID = -1L;

    public HeaderTooShortException(final String message) {
        super(message);
    }

    public HeaderTooShortException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
