// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader.arn;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Map;

/**
 * The direction part of an AWS region name ({@code east} in {@code us-east-1}) and its single byte header code.
 */
public enum CardinalDirection {
    NORTH("north", 0x00),
    EAST("east", 0x01),
    SOUTH("south", 0x02),
    WEST("west", 0x03),
    CENTRAL("central", 0x04),
    NORTHEAST("northeast", 0x05),
    SOUTHEAST("southeast", 0x06),
    SOUTHWEST("southwest", 0x07),
    NORTHWEST("northwest", 0x08);

    private static final Map<String, CardinalDirection> BY_NAME = new HashMap<>();
    private static final Map<Integer, CardinalDirection> BY_CODE = new HashMap<>();

    static {
        for (CardinalDirection direction : values()) {
            BY_NAME.put(direction.name, direction);
            BY_CODE.put(direction.code, direction);
        }
    }

    private final String name;
    private final int code;

    CardinalDirection(String name, int code) {
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
    public static CardinalDirection fromName(String name) {
        return BY_NAME.get(name);
    }

    @Nullable
    public static CardinalDirection fromCode(byte code) {
        return BY_CODE.get(code & 0xFF);
    }

    @Override
    public String toString() {
        return name;
    }
}
