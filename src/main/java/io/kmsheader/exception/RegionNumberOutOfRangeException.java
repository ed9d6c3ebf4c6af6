// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader.exception;

/**
 * Thrown when a region ordinal does not fit in the single byte the header reserves for it.
 */
public class RegionNumberOutOfRangeException extends InvalidArnException {

    private static final long serialVersionUID = -1L;

    public RegionNumberOutOfRangeException(final String message) {
        super(message);
    }

    public RegionNumberOutOfRangeException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
