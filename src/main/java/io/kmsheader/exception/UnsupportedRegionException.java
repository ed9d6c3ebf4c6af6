// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader.exception;

/**
 * This exception is thrown when a region is requested that a decrypter supplier is configured not to allow.
 */
public class UnsupportedRegionException extends KmsHeaderException {

    private static final long serialVersionUID = -1L;

    public UnsupportedRegionException(final String message) {
        super(message);
    }

    public UnsupportedRegionException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
