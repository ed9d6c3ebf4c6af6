// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader;

import io.kmsheader.algorithm.AlgorithmCodec;
import io.kmsheader.algorithm.AlgorithmInfo;
import io.kmsheader.algorithm.EncryptionAlgorithm;
import io.kmsheader.algorithm.KeySpec;
import io.kmsheader.arn.KmsKeyArn;
import io.kmsheader.arn.KmsKeyArnCodec;
import io.kmsheader.exception.CipherLengthMismatchException;
import io.kmsheader.exception.DecryptionFailedException;
import io.kmsheader.exception.HeaderTooShortException;
import io.kmsheader.exception.IncompleteHeaderException;
import io.kmsheader.exception.InvalidArnException;
import io.kmsheader.exception.InvalidPublicKeyException;
import io.kmsheader.exception.PlaintextTooLargeException;
import io.kmsheader.exception.UnsupportedAlgorithmException;
import io.kmsheader.exception.UnsupportedKeySpecException;
import io.kmsheader.exception.UnsupportedRegionException;
import io.kmsheader.internal.JceRsaEncryptionProvider;
import io.kmsheader.internal.PublicKeys;
import io.kmsheader.kms.KmsDecrypter;
import io.kmsheader.kms.KmsDecrypterSupplier;
import io.kmsheader.kmssdkv2.StandardKmsDecrypterSuppliers;
import software.amazon.awssdk.core.exception.SdkException;

import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.security.PublicKey;
import java.util.Arrays;
import java.util.Base64;
import java.util.Optional;
import java.util.logging.Logger;

import static java.util.Objects.requireNonNull;

/**
 * A KMS header: the binary prefix of symmetrically encrypted data that names the asymmetric AWS KMS key, the RSA
 * algorithm and key spec, and holds the RSA encrypted symmetric key material.
 *
 * <pre>
 * offset  size  field
 * 0       16    KMS key id
 * 16      16    AWS account id
 * 32      3     AWS region
 * 35      1     algorithm (bits 7-4) and key spec (bits 3-0)
 * 36      N     RSA cipher data, N = 256 | 384 | 512
 * 36+N    ...   symmetrically encrypted payload, not part of the header
 * </pre>
 *
 * <p>A header is filled in stages. Encrypting side:
 * <pre>
 * KmsHeader header = KmsHeader.fromArn("arn:aws:kms:us-east-1:111122223333:key/...");
 * header.setPublicKey(publicKeyPem);
 * header.encrypt(symmetricKeys);
 * byte[] blob = concat(header.toByteArray(), symmetricCiphertext);
 * </pre>
 * Decrypting side:
 * <pre>
 * KmsHeader header = KmsHeader.fromBytes(blob);
 * byte[] symmetricKeys = header.decrypt();
 * byte[] symmetricCiphertext = Arrays.copyOfRange(blob, header.length(), blob.length);
 * </pre>
 *
 * <p>Instances are not safe for concurrent mutation. Setters that fail leave the header unchanged.
 */
public final class KmsHeader {

    /**
     * Length of a header holding only a key ARN.
     */
    public static final int ARN_LENGTH = KmsKeyArnCodec.ARN_LENGTH;

    /**
     * Length of a header holding a key ARN and the algorithm byte.
     */
    public static final int ALGORITHM_LENGTH = ARN_LENGTH + 1;

    public static final EncryptionAlgorithm DEFAULT_ALGORITHM = EncryptionAlgorithm.RSAES_OAEP_SHA_256;

    private static final Logger LOGGER = Logger.getLogger(KmsHeader.class.getName());

    /**
     * How far a header has been filled in. Each state corresponds to one header length.
     */
    public enum State {
        /** No key ARN; exports zero bytes. */
        EMPTY,
        /** Key ARN only; 35 bytes. */
        HAS_ARN,
        /** Key ARN and algorithm byte; 36 bytes. */
        HAS_ALGORITHM,
        /** Complete header; 36 bytes plus the key spec's cipher length. */
        HAS_CIPHER_DATA
    }

    private KmsKeyArn arn;
    private EncryptionAlgorithm algorithm = DEFAULT_ALGORITHM;
    private KeySpec keySpec;
    private byte[] cipherData;
    private PublicKey publicKey;
    private RsaEncryptionProvider encryptionProvider = new JceRsaEncryptionProvider();

    /**
     * Creates an empty header using {@link #DEFAULT_ALGORITHM}.
     */
    public KmsHeader() {
    }

    /**
     * @param arn A KMS key ARN
     * @return A header holding the ARN and {@link #DEFAULT_ALGORITHM}
     * @throws InvalidArnException if the ARN cannot be stored in a header
     */
    public static KmsHeader fromArn(String arn) throws InvalidArnException {
        final KmsHeader header = new KmsHeader();
        header.setArn(arn);
        return header;
    }

    /**
     * @param arn       A KMS key ARN
     * @param algorithm The RSA-OAEP algorithm KMS will decrypt with
     * @param keySpec   The key spec of the KMS key
     * @return A 36 byte header
     * @throws InvalidArnException if the ARN cannot be stored in a header
     */
    public static KmsHeader fromArn(String arn, EncryptionAlgorithm algorithm, KeySpec keySpec)
            throws InvalidArnException {
        final KmsHeader header = fromArn(arn);
        header.setAlgorithm(algorithm);
        header.setKeySpec(keySpec);
        return header;
    }

    /**
     * Parses as much of a header as {@code data} contains. Bytes past the header are the symmetric payload and
     * are ignored.
     *
     * @param data At least the 35 ARN bytes of a header
     * @return The header
     * @throws HeaderTooShortException if fewer than 35 bytes are given
     */
    public static KmsHeader fromBytes(byte[] data) {
        requireNonNull(data, "data is required");
        if (data.length < ARN_LENGTH) {
            throw new HeaderTooShortException(String.format(
                    "A KMS header must be %d bytes or larger, got %d", ARN_LENGTH, data.length));
        }

        final KmsHeader header = new KmsHeader();
        header.arn = KmsKeyArnCodec.decode(data);

        if (data.length >= ALGORITHM_LENGTH) {
            final AlgorithmInfo info = AlgorithmCodec.decode(data[ARN_LENGTH]);
            info.getAlgorithm().ifPresent(a -> header.algorithm = a);
            info.getKeySpec().ifPresent(k -> header.keySpec = k);
        }

        if (header.keySpec != null) {
            final int headerLength = ALGORITHM_LENGTH + header.keySpec.getCipherLength();
            if (data.length >= headerLength) {
                header.cipherData = Arrays.copyOfRange(data, ALGORITHM_LENGTH, headerLength);
            }
        }
        return header;
    }

    /**
     * @param base64 A base64 encoded header
     * @return The header
     * @throws IllegalArgumentException if the string is not valid base64
     */
    public static KmsHeader fromBase64(String base64) {
        requireNonNull(base64, "base64 is required");
        return fromBytes(Base64.getDecoder().decode(base64));
    }

    /**
     * Reads exactly one complete header from {@code in}, leaving the stream positioned at the symmetric payload.
     *
     * @param in The stream
     * @return The complete header
     * @throws HeaderTooShortException   if the stream ends inside the header
     * @throws IncompleteHeaderException if the header has no key spec, so its end cannot be found
     * @throws IOException               if reading fails
     */
    public static KmsHeader readFrom(InputStream in) throws IOException {
        requireNonNull(in, "in is required");
        final DataInputStream dataIn = new DataInputStream(in);

        final byte[] prefix = new byte[ALGORITHM_LENGTH];
        readFully(dataIn, prefix);
        final KeySpec spec = AlgorithmCodec.decode(prefix[ARN_LENGTH]).getKeySpec()
                .orElseThrow(() -> new IncompleteHeaderException("Header in stream has no key spec"));

        final byte[] header = Arrays.copyOf(prefix, ALGORITHM_LENGTH + spec.getCipherLength());
        readFully(dataIn, header, ALGORITHM_LENGTH, spec.getCipherLength());
        return fromBytes(header);
    }

    /**
     * @param blob A complete header followed by the symmetric payload
     * @return The bytes following the header
     * @throws IncompleteHeaderException if {@code blob} does not start with a complete header
     */
    public static byte[] payloadOf(byte[] blob) {
        final KmsHeader header = fromBytes(blob);
        if (header.getState() != State.HAS_CIPHER_DATA) {
            throw new IncompleteHeaderException("blob does not start with a complete KMS header");
        }
        return Arrays.copyOfRange(blob, header.length(), blob.length);
    }

    /**
     * Get the current size in bytes of the binary header:
     * <ul>
     * <li>0 bytes: no ARN.</li>
     * <li>35 bytes: just the ARN.</li>
     * <li>36 bytes: ARN and algorithm, no cipher data.</li>
     * <li>292, 420 or 548 bytes: complete header for RSA_2048, RSA_3072 or RSA_4096.</li>
     * </ul>
     *
     * @return the number of bytes {@link #toByteArray()} returns, which is where the symmetric payload starts
     */
    public int length() {
        switch (getState()) {
            case EMPTY:
                return 0;
            case HAS_ARN:
                return ARN_LENGTH;
            case HAS_ALGORITHM:
                return ALGORITHM_LENGTH;
            default:
                return ALGORITHM_LENGTH + keySpec.getCipherLength();
        }
    }

    public State getState() {
        if (arn == null) {
            return State.EMPTY;
        }
        if (keySpec == null) {
            return State.HAS_ARN;
        }
        if (cipherData == null) {
            return State.HAS_ALGORITHM;
        }
        return State.HAS_CIPHER_DATA;
    }

    /**
     * Exports the header. Trailing sections that are not set yet are omitted; see {@link #length()}.
     *
     * @return The binary header, empty when no ARN is set
     */
    public byte[] toByteArray() {
        final ByteBuffer buffer = ByteBuffer.allocate(length());
        if (arn == null) {
            return buffer.array();
        }
        buffer.put(KmsKeyArnCodec.encode(arn));
        if (keySpec != null) {
            buffer.put(AlgorithmCodec.encode(algorithm, keySpec));
            if (cipherData != null) {
                buffer.put(cipherData);
            }
        }
        return buffer.array();
    }

    public String toBase64() {
        return Base64.getEncoder().encodeToString(toByteArray());
    }

    public Optional<KmsKeyArn> getArn() {
        return Optional.ofNullable(arn);
    }

    public Optional<EncryptionAlgorithm> getAlgorithm() {
        return Optional.ofNullable(algorithm);
    }

    public Optional<KeySpec> getKeySpec() {
        return Optional.ofNullable(keySpec);
    }

    /**
     * @return a copy of the RSA cipher data
     */
    public Optional<byte[]> getCipherData() {
        return Optional.ofNullable(cipherData).map(byte[]::clone);
    }

    public Optional<PublicKey> getPublicKey() {
        return Optional.ofNullable(publicKey);
    }

    /**
     * @throws InvalidArnException if the ARN cannot be stored in a header
     */
    public void setArn(String arn) throws InvalidArnException {
        setArn(KmsKeyArn.fromString(arn));
    }

    public void setArn(KmsKeyArn arn) {
        this.arn = requireNonNull(arn, "arn is required");
    }

    public void setAlgorithm(EncryptionAlgorithm algorithm) {
        this.algorithm = requireNonNull(algorithm, "algorithm is required");
    }

    /**
     * Sets either the algorithm or the key spec by name, e.g. {@code RSAES_OAEP_SHA_1} or {@code RSA_4096}.
     *
     * @throws UnsupportedAlgorithmException if the name is neither an algorithm nor a key spec
     */
    public void setAlgorithm(String name) throws UnsupportedAlgorithmException {
        requireNonNull(name, "name is required");
        for (EncryptionAlgorithm candidate : EncryptionAlgorithm.values()) {
            if (candidate.name().equals(name)) {
                setAlgorithm(candidate);
                return;
            }
        }
        for (KeySpec candidate : KeySpec.values()) {
            if (candidate.name().equals(name)) {
                setKeySpec(candidate);
                return;
            }
        }
        throw new UnsupportedAlgorithmException(String.format("algorithm %s must be one of: %s, %s",
                name, Arrays.toString(EncryptionAlgorithm.values()), Arrays.toString(KeySpec.values())));
    }

    /**
     * @throws UnsupportedKeySpecException   if a public key of another size is loaded
     * @throws CipherLengthMismatchException if cipher data is already set and has a different length than
     *                                       {@code keySpec} implies
     */
    public void setKeySpec(KeySpec keySpec) throws CipherLengthMismatchException {
        requireNonNull(keySpec, "keySpec is required");
        if (publicKey != null && PublicKeys.keySize(publicKey) != keySpec.getKeySize()) {
            throw new UnsupportedKeySpecException(String.format(
                    "%s does not match the loaded %d bit public key", keySpec, PublicKeys.keySize(publicKey)));
        }
        checkCipherDataLength(keySpec);
        this.keySpec = keySpec;
    }

    /**
     * Adds RSA encrypted data to the header.
     *
     * @param cipherData RSA encrypted data, exactly as long as the key spec's modulus
     * @throws IncompleteHeaderException     if no key spec is set
     * @throws CipherLengthMismatchException if the length does not match the key spec
     */
    public void setCipherData(byte[] cipherData) {
        requireNonNull(cipherData, "cipherData is required");
        if (keySpec == null) {
            throw new IncompleteHeaderException("A key spec must be set before cipher data");
        }
        if (cipherData.length != keySpec.getCipherLength()) {
            throw new CipherLengthMismatchException(String.format(
                    "cipher data was %d bytes but must be exactly %d bytes because key spec is %s",
                    cipherData.length, keySpec.getCipherLength(), keySpec));
        }
        this.cipherData = cipherData.clone();
    }

    /**
     * Sets the RSA public key used by {@link #encrypt(byte[])} and the key spec matching its size.
     *
     * @throws InvalidPublicKeyException     if the key is not an RSA key
     * @throws UnsupportedKeySpecException   if the key size is not 2048, 3072 or 4096 bits
     * @throws CipherLengthMismatchException if cipher data set for another key size is present
     */
    public void setPublicKey(PublicKey publicKey) {
        requireNonNull(publicKey, "publicKey is required");
        final KeySpec spec = KeySpec.fromKeySize(PublicKeys.keySize(publicKey));
        checkCipherDataLength(spec);
        this.keySpec = spec;
        this.publicKey = publicKey;
    }

    /**
     * @param pemOrPath A PEM encoded RSA public key, or the path of a file containing one
     * @see #setPublicKey(PublicKey)
     */
    public void setPublicKey(String pemOrPath) {
        setPublicKey(PublicKeys.load(pemOrPath));
    }

    /**
     * @param pemFile A file containing a PEM encoded RSA public key
     * @see #setPublicKey(PublicKey)
     */
    public void setPublicKey(Path pemFile) {
        setPublicKey(PublicKeys.fromFile(pemFile));
    }

    public void setEncryptionProvider(RsaEncryptionProvider encryptionProvider) {
        this.encryptionProvider = requireNonNull(encryptionProvider, "encryptionProvider is required");
    }

    /**
     * The largest input {@link #encrypt(byte[])} accepts: the public key's modulus length in bytes, or the key
     * spec's when no key is loaded, minus the OAEP overhead of the algorithm (42 bytes for SHA-1, 66 bytes for
     * SHA-256).
     *
     * @throws IncompleteHeaderException if neither a public key nor a key spec is set
     */
    public int getMaxPlaintextLength() {
        final int modulusLength;
        if (publicKey != null) {
            modulusLength = PublicKeys.keySize(publicKey) / Byte.SIZE;
        } else if (keySpec != null) {
            modulusLength = keySpec.getCipherLength();
        } else {
            throw new IncompleteHeaderException("A key spec must be set to compute the plaintext limit");
        }
        return modulusLength - algorithm.getOaepOverhead();
    }

    /**
     * Encrypts data with the RSA public key and stores the result as the header's cipher data.
     *
     * @param plaintext The data to encrypt, usually symmetric keys
     * @throws IncompleteHeaderException  if no public key has been added
     * @throws PlaintextTooLargeException if the data exceeds {@link #getMaxPlaintextLength()}
     */
    public void encrypt(byte[] plaintext) {
        requireNonNull(plaintext, "plaintext is required");
        if (publicKey == null) {
            throw new IncompleteHeaderException("public key has not been added. Cannot encrypt.");
        }

        final int maxLength = getMaxPlaintextLength();
        if (plaintext.length > maxLength) {
            throw new PlaintextTooLargeException(String.format(
                    "You attempted to encrypt %d bytes but you cannot encrypt more than %d bytes with %s %s",
                    plaintext.length, maxLength, keySpec, algorithm));
        }

        LOGGER.fine(() -> String.format("Encrypting %d bytes with %s %s", plaintext.length, keySpec, algorithm));
        setCipherData(encryptionProvider.encrypt(publicKey, plaintext, algorithm));
    }

    /**
     * Decrypts the cipher data with AWS KMS using a client for the ARN's region from the default supplier.
     *
     * @see #decrypt(KmsDecrypterSupplier)
     */
    public byte[] decrypt() {
        return decrypt(DefaultSupplierHolder.DEFAULT_SUPPLIER);
    }

    /**
     * Decrypts the cipher data with AWS KMS.
     *
     * @param decrypterSupplier supplies the decrypter for the ARN's region
     * @return the plaintext as returned by KMS
     * @throws IncompleteHeaderException  if the ARN, key spec or cipher data is missing
     * @throws DecryptionFailedException  if KMS could not decrypt, the region may not be used, or the SDK failed
     *                                    to build a client; the cause is the original exception
     */
    public byte[] decrypt(KmsDecrypterSupplier decrypterSupplier) {
        requireNonNull(decrypterSupplier, "decrypterSupplier is required");
        if (arn == null || keySpec == null || cipherData == null) {
            throw new IncompleteHeaderException("arn, algorithm, and cipher data need to be loaded");
        }

        LOGGER.fine(() -> String.format("Decrypting %s cipher data with %s using %s", keySpec, arn, algorithm));
        try {
            final KmsDecrypter decrypter = KmsDecrypterSupplier.getDecrypterByArn(arn, decrypterSupplier);
            return decrypter.decrypt(arn, cipherData.clone(), algorithm);
        } catch (UnsupportedRegionException | SdkException e) {
            throw new DecryptionFailedException(e);
        }
    }

    @Override
    public String toString() {
        return "KmsHeader{arn=" + arn + ", algorithm=" + algorithm + ", keySpec=" + keySpec
                + ", state=" + getState() + "}";
    }

    private void checkCipherDataLength(KeySpec spec) {
        if (cipherData != null && cipherData.length != spec.getCipherLength()) {
            throw new CipherLengthMismatchException(String.format(
                    "cipher data is %d bytes but %s requires exactly %d bytes",
                    cipherData.length, spec, spec.getCipherLength()));
        }
    }

    private static void readFully(DataInputStream in, byte[] buffer) throws IOException {
        readFully(in, buffer, 0, buffer.length);
    }

    private static void readFully(DataInputStream in, byte[] buffer, int offset, int length) throws IOException {
        try {
            in.readFully(buffer, offset, length);
        } catch (EOFException e) {
            throw new HeaderTooShortException("Stream ended inside the KMS header", e);
        }
    }

    private static final class DefaultSupplierHolder {
        static final KmsDecrypterSupplier DEFAULT_SUPPLIER = StandardKmsDecrypterSuppliers.defaultBuilder().build();
    }
}
