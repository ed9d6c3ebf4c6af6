// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader.arn;

import io.kmsheader.exception.InvalidArnException;
import io.kmsheader.exception.RegionNumberOutOfRangeException;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * An AWS region in the {@code <major>-<direction>-<number>} form the KMS header can store in three bytes,
 * for example {@code us-east-1} or {@code us-gov-west-1}.
 */
public final class AwsRegion {

    /**
     * Largest ordinal that fits in the region's last header byte.
     */
    public static final int MAX_NUMBER = 0xFF;

    // The major part is greedy so that "us-gov-west-1" splits as "us-gov", "west", "1".
    private static final Pattern REGION_PATTERN = Pattern.compile("^(.+)-([a-z]+)-(0|[1-9][0-9]*)$");

    private final MajorRegion majorRegion;
    private final CardinalDirection direction;
    private final int number;

    private AwsRegion(MajorRegion majorRegion, CardinalDirection direction, int number) {
        this.majorRegion = majorRegion;
        this.direction = direction;
        this.number = number;
    }

    /**
     * @throws RegionNumberOutOfRangeException if {@code number} is outside 0-255
     */
    public static AwsRegion of(MajorRegion majorRegion, CardinalDirection direction, int number) {
        requireNonNull(majorRegion, "majorRegion is required");
        requireNonNull(direction, "direction is required");
        if (number < 0 || number > MAX_NUMBER) {
            throw new RegionNumberOutOfRangeException(
                    String.format("Region number %d must be between 0 and %d", number, MAX_NUMBER));
        }
        return new AwsRegion(majorRegion, direction, number);
    }

    /**
     * Parses a region id such as {@code eu-central-1}.
     *
     * @param regionId the region id
     * @return the region
     * @throws InvalidArnException             if the id is not {@code <major>-<direction>-<number>} or names an
     *                                         unknown major region or direction
     * @throws RegionNumberOutOfRangeException if the number does not fit in one byte
     */
    public static AwsRegion fromString(String regionId) {
        requireNonNull(regionId, "regionId is required");

        final Matcher matcher = REGION_PATTERN.matcher(regionId);
        if (!matcher.matches()) {
            throw new InvalidArnException("Region " + regionId + " does not match <major>-<direction>-<number>");
        }

        final MajorRegion major = MajorRegion.fromName(matcher.group(1));
        if (major == null) {
            throw new InvalidArnException("Unknown major region in " + regionId);
        }
        final CardinalDirection direction = CardinalDirection.fromName(matcher.group(2));
        if (direction == null) {
            throw new InvalidArnException("Unknown region direction in " + regionId);
        }

        final String digits = matcher.group(3);
        // more than three digits can never fit, and would overflow an int past nine
        if (digits.length() > 3) {
            throw new RegionNumberOutOfRangeException(
                    String.format("Region number %s must be between 0 and %d", digits, MAX_NUMBER));
        }
        return of(major, direction, Integer.parseInt(digits));
    }

    public MajorRegion getMajorRegion() {
        return majorRegion;
    }

    public CardinalDirection getDirection() {
        return direction;
    }

    public int getNumber() {
        return number;
    }

    /**
     * @return the region id, e.g. {@code us-east-1}, suitable for AWS SDK clients
     */
    @Override
    public String toString() {
        return majorRegion.getName() + "-" + direction.getName() + "-" + number;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AwsRegion that = (AwsRegion) o;
        return number == that.number && majorRegion == that.majorRegion && direction == that.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(majorRegion, direction, number);
    }
}
