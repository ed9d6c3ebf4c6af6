// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader.arn;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Map;

/**
 * The leading part of an AWS region name ({@code us} in {@code us-east-1}) and its single byte header code.
 */
public enum MajorRegion {
    AF("af", 0x00),
    AP("ap", 0x01),
    CA("ca", 0x02),
    EU("eu", 0x03),
    IL("il", 0x04),
    ME("me", 0x05),
    SA("sa", 0x06),
    US("us", 0x07),
    US_GOV("us-gov", 0x08);

    private static final Map<String, MajorRegion> BY_NAME = new HashMap<>();
    private static final Map<Integer, MajorRegion> BY_CODE = new HashMap<>();

    static {
        for (MajorRegion region : values()) {
            BY_NAME.put(region.name, region);
            BY_CODE.put(region.code, region);
        }
    }

    private final String name;
    private final int code;

    MajorRegion(String name, int code) {
        this.name = name;
        this.code = code;
    }

    public String getName() {
        return name;
    }

    public byte getCode() {
        return (byte) code;
    }

    @Nullable
    public static MajorRegion fromName(String name) {
        return BY_NAME.get(name);
    }

    @Nullable
    public static MajorRegion fromCode(byte code) {
        return BY_CODE.get(code & 0xFF);
    }

    @Override
    public String toString() {
        return name;
    }
}
