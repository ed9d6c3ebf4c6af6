// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader.arn;

import io.kmsheader.exception.InvalidArnException;
import io.kmsheader.exception.MalformedArnException;
import org.apache.commons.lang3.StringUtils;
import org.bouncycastle.util.encoders.Hex;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;
import static org.apache.commons.lang3.Validate.isTrue;

/**
 * Converts between {@link KmsKeyArn} and its 35 byte binary form:
 *
 * <pre>
 * offset  size  field
 * 0       16    key id
 * 16      16    account id, big-endian unsigned
 * 32      1     major region code
 * 33      1     direction code
 * 34      1     region number
 * </pre>
 *
 * The key id comes first so that a 16 byte read of an object identifies its key.
 */
public final class KmsKeyArnCodec {

    public static final int KEY_ID_LENGTH = 16;
    public static final int ACCOUNT_ID_LENGTH = 16;
    public static final int REGION_LENGTH = 3;
    public static final int ARN_LENGTH = KEY_ID_LENGTH + ACCOUNT_ID_LENGTH + REGION_LENGTH;

    public static final int KEY_ID_OFFSET = 0;
    public static final int ACCOUNT_ID_OFFSET = KEY_ID_OFFSET + KEY_ID_LENGTH;
    public static final int REGION_OFFSET = ACCOUNT_ID_OFFSET + ACCOUNT_ID_LENGTH;

    private static final Pattern ARN_HEX_PATTERN = Pattern.compile("^[0-9a-f]{" + (ARN_LENGTH * 2) + "}$");

    private KmsKeyArnCodec() {
    }

    /**
     * @param arn the ARN to encode
     * @return exactly {@value #ARN_LENGTH} bytes
     */
    public static byte[] encode(KmsKeyArn arn) {
        requireNonNull(arn, "arn is required");

        final ByteBuffer buffer = ByteBuffer.allocate(ARN_LENGTH);
        buffer.put(Hex.decode(StringUtils.remove(arn.getKeyId(), '-')));
        buffer.put(accountIdToBytes(arn.getAccountId()));
        buffer.put(arn.getRegion().getMajorRegion().getCode());
        buffer.put(arn.getRegion().getDirection().getCode());
        buffer.put((byte) arn.getRegion().getNumber());
        return buffer.array();
    }

    /**
     * @param arn the ARN to encode
     * @return the binary form as {@value #ARN_LENGTH}*2 lowercase hex characters
     */
    public static String encodeHex(KmsKeyArn arn) {
        return Hex.toHexString(encode(arn));
    }

    /**
     * Decodes the first {@value #ARN_LENGTH} bytes of {@code data}.
     *
     * @throws MalformedArnException if the bytes do not describe a KMS key ARN
     */
    public static KmsKeyArn decode(byte[] data) throws MalformedArnException {
        requireNonNull(data, "data is required");
        isTrue(data.length >= ARN_LENGTH, "At least %d bytes are required, got %d", ARN_LENGTH, data.length);

        final AwsRegion region = decodeRegion(data, REGION_OFFSET);
        final String accountId = decodeAccountId(data, ACCOUNT_ID_OFFSET);
        final String keyId = decodeKeyId(data, KEY_ID_OFFSET);
        try {
            return KmsKeyArn.of(region, accountId, keyId);
        } catch (InvalidArnException e) {
            throw new MalformedArnException("Binary ARN does not describe a KMS key", e);
        }
    }

    /**
     * @param arnHex {@value #ARN_LENGTH}*2 lowercase hex characters
     * @throws MalformedArnException if the string is not 70 hex characters or does not decode
     */
    public static KmsKeyArn decodeHex(String arnHex) throws MalformedArnException {
        if (arnHex == null || !ARN_HEX_PATTERN.matcher(arnHex).matches()) {
            throw new MalformedArnException(ARN_LENGTH + "-byte arn hex expected (" + ARN_LENGTH * 2 + " chars)");
        }
        return decode(Hex.decode(arnHex));
    }

    /**
     * Reads a key id from {@value #KEY_ID_LENGTH} bytes starting at {@code offset}.
     *
     * @return the key id in 8-4-4-4-12 form
     */
    public static String decodeKeyId(byte[] data, int offset) {
        final String hex = Hex.toHexString(data, offset, KEY_ID_LENGTH);
        return String.join("-",
                hex.substring(0, 8),
                hex.substring(8, 12),
                hex.substring(12, 16),
                hex.substring(16, 20),
                hex.substring(20));
    }

    /**
     * Reads an account id from {@value #ACCOUNT_ID_LENGTH} bytes starting at {@code offset}.
     *
     * @return the account id, zero padded to 12 digits
     * @throws MalformedArnException if the value needs more than 12 digits
     */
    public static String decodeAccountId(byte[] data, int offset) throws MalformedArnException {
        final byte[] raw = new byte[ACCOUNT_ID_LENGTH];
        System.arraycopy(data, offset, raw, 0, ACCOUNT_ID_LENGTH);

        final String digits = new BigInteger(1, raw).toString();
        if (digits.length() > KmsKeyArn.ACCOUNT_ID_DIGITS) {
            throw new MalformedArnException("Account id " + digits + " is longer than "
                    + KmsKeyArn.ACCOUNT_ID_DIGITS + " digits");
        }
        return StringUtils.leftPad(digits, KmsKeyArn.ACCOUNT_ID_DIGITS, '0');
    }

    /**
     * Reads a region from {@value #REGION_LENGTH} bytes starting at {@code offset}.
     *
     * @throws MalformedArnException if the major region or direction code is unknown
     */
    public static AwsRegion decodeRegion(byte[] data, int offset) throws MalformedArnException {
        final MajorRegion major = MajorRegion.fromCode(data[offset]);
        if (major == null) {
            throw new MalformedArnException(String.format("Unknown major region code 0x%02x", data[offset]));
        }
        final CardinalDirection direction = CardinalDirection.fromCode(data[offset + 1]);
        if (direction == null) {
            throw new MalformedArnException(String.format("Unknown region direction code 0x%02x", data[offset + 1]));
        }
        return AwsRegion.of(major, direction, data[offset + 2] & 0xFF);
    }

    private static byte[] accountIdToBytes(String accountId) {
        final byte[] magnitude = new BigInteger(accountId).toByteArray();
        final byte[] result = new byte[ACCOUNT_ID_LENGTH];
        // BigInteger may prepend a sign byte; a 12 digit value always fits in the last 6 bytes
        final int length = Math.min(magnitude.length, ACCOUNT_ID_LENGTH);
        System.arraycopy(magnitude, magnitude.length - length, result, ACCOUNT_ID_LENGTH - length, length);
        return result;
    }
}
