// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader.arn;

import io.kmsheader.exception.InvalidArnException;
import org.apache.commons.lang3.StringUtils;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * A representation of an AWS KMS key ARN as stored in a KMS header: a region, a 12 digit account id and a key id.
 * Only key ARNs in the {@code aws} partition can be stored; aliases and alias ARNs have no binary form.
 */
public final class KmsKeyArn {

    private static final Pattern ARN_PATTERN = Pattern.compile("^arn:aws:kms:([^:]+):([^:]+):key/([^:/]+)$");
    private static final Pattern ACCOUNT_PATTERN = Pattern.compile("^[0-9]{12}$");
    private static final Pattern KEY_ID_PATTERN =
            Pattern.compile("^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$");

    /**
     * Number of decimal digits in an AWS account id.
     */
    public static final int ACCOUNT_ID_DIGITS = 12;

    private final AwsRegion region;
    private final String accountId;
    private final String keyId;

    private KmsKeyArn(AwsRegion region, String accountId, String keyId) {
        this.region = region;
        this.accountId = accountId;
        this.keyId = keyId;
    }

    /**
     * <p>
     * Constructs a {@code KmsKeyArn} from a key ARN string.
     * </p>
     * <p>
     * For example: <code>arn:aws:kms:us-east-2:111122223333:key/1234abcd-12ab-34cd-56ef-1234567890ab</code>
     * </p>
     *
     * @param arn The key ARN
     * @return The {@code KmsKeyArn}
     * @throws InvalidArnException if the string is not a key ARN the header can store
     */
    public static KmsKeyArn fromString(String arn) throws InvalidArnException {
        if (StringUtils.isBlank(arn)) {
            throw new InvalidArnException("arn must be neither null, empty nor whitespace");
        }

        final Matcher matcher = ARN_PATTERN.matcher(arn);
        if (!matcher.matches()) {
            throw new InvalidArnException("arn format does not match. It must match " + ARN_PATTERN.pattern());
        }

        return of(AwsRegion.fromString(matcher.group(1)), matcher.group(2), matcher.group(3));
    }

    /**
     * @param region    The region of the key
     * @param accountId The 12 digit AWS account id
     * @param keyId     The key id, lowercase 8-4-4-4-12 hex
     * @return The {@code KmsKeyArn}
     * @throws InvalidArnException if the account id or key id is malformed
     */
    public static KmsKeyArn of(AwsRegion region, String accountId, String keyId) throws InvalidArnException {
        requireNonNull(region, "region is required");
        if (accountId == null || !ACCOUNT_PATTERN.matcher(accountId).matches()) {
            throw new InvalidArnException("An invalid account number was provided in the arn: " + accountId);
        }
        if (keyId == null || !KEY_ID_PATTERN.matcher(keyId).matches()) {
            throw new InvalidArnException("An invalid key id was provided in the arn: " + keyId);
        }
        return new KmsKeyArn(region, accountId, keyId);
    }

    /**
     * Returns true if the given string is a key ARN that {@link #fromString(String)} accepts.
     *
     * @param arn The candidate ARN
     * @return True if well formed, false otherwise
     */
    public static boolean isArnWellFormed(String arn) {
        try {
            fromString(arn);
            return true;
        } catch (InvalidArnException e) {
            return false;
        }
    }

    public AwsRegion getRegion() {
        return region;
    }

    public String getAccountId() {
        return accountId;
    }

    public String getKeyId() {
        return keyId;
    }

    @Override
    public String toString() {
        return "arn:aws:kms:" + region + ":" + accountId + ":key/" + keyId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        KmsKeyArn that = (KmsKeyArn) o;
        return region.equals(that.region) && accountId.equals(that.accountId) && keyId.equals(that.keyId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(region, accountId, keyId);
    }
}
