// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader.internal;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * This API is internal and subject to change. Name and version under which the library identifies itself to
 * AWS KMS: a user agent suffix for AWS SDK v1 and an {@code ApiName} for AWS SDK v2.
 */
public final class LibraryInfo {

    public static final String API_NAME = "KmsHeader";
    public static final String USER_AGENT_PREFIX = API_NAME + "/";
    public static final String UNKNOWN_VERSION = "unknown";

    static final String PROPERTIES_RESOURCE = "project.properties";

    private static final Logger LOGGER = Logger.getLogger(LibraryInfo.class.getName());
    private static final String VERSION = readVersion(LibraryInfo.class.getClassLoader());

    private LibraryInfo() {
    }

    /**
     * @return the library version, e.g. {@code 1.0.0}, or {@value #UNKNOWN_VERSION} if it was not packaged
     */
    public static String version() {
        return VERSION;
    }

    /**
     * @return {@code KmsHeader/<version>}
     */
    public static String userAgent() {
        return USER_AGENT_PREFIX + VERSION;
    }

    static String readVersion(ClassLoader loader) {
        try (InputStream in = loader.getResourceAsStream(PROPERTIES_RESOURCE)) {
            if (in == null) {
                LOGGER.fine(() -> PROPERTIES_RESOURCE + " not found, version is " + UNKNOWN_VERSION);
                return UNKNOWN_VERSION;
            }
            final Properties properties = new Properties();
            properties.load(in);
            return properties.getProperty("version", UNKNOWN_VERSION);
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Unable to read " + PROPERTIES_RESOURCE, e);
            return UNKNOWN_VERSION;
        }
    }
}
