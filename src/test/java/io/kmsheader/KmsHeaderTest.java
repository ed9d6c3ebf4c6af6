// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader;

import io.kmsheader.algorithm.EncryptionAlgorithm;
import io.kmsheader.algorithm.KeySpec;
import io.kmsheader.arn.KmsKeyArn;
import io.kmsheader.exception.CipherLengthMismatchException;
import io.kmsheader.exception.DecryptionFailedException;
import io.kmsheader.exception.HeaderTooShortException;
import io.kmsheader.exception.IncompleteHeaderException;
import io.kmsheader.exception.InvalidArnException;
import io.kmsheader.exception.InvalidPublicKeyException;
import io.kmsheader.exception.PlaintextTooLargeException;
import io.kmsheader.exception.UnrecognizedCodeException;
import io.kmsheader.exception.UnsupportedAlgorithmException;
import io.kmsheader.exception.UnsupportedKeySpecException;
import io.kmsheader.exception.UnsupportedRegionException;
import io.kmsheader.kms.KmsDecrypter;
import io.kmsheader.kms.KmsDecrypterSupplier;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.exception.SdkClientException;

import javax.crypto.Cipher;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.util.Arrays;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class KmsHeaderTest {

    private static final String ARN = "arn:aws:kms:us-east-1:111122223333:key/1234abcd-12ab-34cd-56ef-1234567890ab";
    private static final byte[] SYMMETRIC_KEYS = "0123456789abcdef0123456789abcdef".getBytes(StandardCharsets.US_ASCII);

    private static KeyPair keyPair;

    @Mock KmsDecrypterSupplier decrypterSupplier;
    @Mock KmsDecrypter decrypter;
    @Mock RsaEncryptionProvider encryptionProvider;

    @BeforeAll
    static void setup() throws Exception {
        final KeyPairGenerator keyPairGenerator = KeyPairGenerator.getInstance("RSA");
        keyPairGenerator.initialize(2048);
        keyPair = keyPairGenerator.generateKeyPair();
    }

    @Test
    void emptyHeader() {
        KmsHeader header = new KmsHeader();

        assertEquals(KmsHeader.State.EMPTY, header.getState());
        assertEquals(0, header.length());
        assertEquals(0, header.toByteArray().length);
        assertEquals("", header.toBase64());
        assertEquals(Optional.of(EncryptionAlgorithm.RSAES_OAEP_SHA_256), header.getAlgorithm());
    }

    @Test
    void arnOnlyHeader() {
        KmsHeader header = KmsHeader.fromArn(ARN);

        assertEquals(KmsHeader.State.HAS_ARN, header.getState());
        assertEquals(35, header.length());
        assertEquals(35, header.toByteArray().length);
        assertEquals(ARN, header.getArn().get().toString());
    }

    @Test
    void algorithmByteFollowsCodeTable() {
        byte[] rsa2048 = KmsHeader.fromArn(ARN, EncryptionAlgorithm.RSAES_OAEP_SHA_256, KeySpec.RSA_2048).toByteArray();
        byte[] rsa3072 = KmsHeader.fromArn(ARN, EncryptionAlgorithm.RSAES_OAEP_SHA_256, KeySpec.RSA_3072).toByteArray();
        byte[] rsa4096Sha1 = KmsHeader.fromArn(ARN, EncryptionAlgorithm.RSAES_OAEP_SHA_1, KeySpec.RSA_4096).toByteArray();

        assertEquals(36, rsa2048.length);
        assertEquals((byte) 0x21, rsa2048[35]);
        assertEquals((byte) 0x22, rsa3072[35]);
        assertEquals((byte) 0x13, rsa4096Sha1[35]);
    }

    @Test
    void completeHeaderLengths() {
        int[] expected = {292, 420, 548};
        KeySpec[] keySpecs = KeySpec.values();
        for (int i = 0; i < keySpecs.length; i++) {
            KmsHeader header = KmsHeader.fromArn(ARN, EncryptionAlgorithm.RSAES_OAEP_SHA_256, keySpecs[i]);
            header.setCipherData(new byte[keySpecs[i].getCipherLength()]);

            assertEquals(KmsHeader.State.HAS_CIPHER_DATA, header.getState());
            assertEquals(expected[i], header.length());
            assertEquals(expected[i], header.toByteArray().length);
        }
    }

    @Test
    void roundTripsThroughBytesAndBase64() {
        KmsHeader header = KmsHeader.fromArn(ARN, EncryptionAlgorithm.RSAES_OAEP_SHA_1, KeySpec.RSA_3072);
        byte[] cipherData = new byte[384];
        Arrays.fill(cipherData, (byte) 0x5A);
        header.setCipherData(cipherData);

        KmsHeader fromBytes = KmsHeader.fromBytes(header.toByteArray());
        KmsHeader fromBase64 = KmsHeader.fromBase64(header.toBase64());

        for (KmsHeader parsed : Arrays.asList(fromBytes, fromBase64)) {
            assertEquals(header.getArn(), parsed.getArn());
            assertEquals(Optional.of(EncryptionAlgorithm.RSAES_OAEP_SHA_1), parsed.getAlgorithm());
            assertEquals(Optional.of(KeySpec.RSA_3072), parsed.getKeySpec());
            assertArrayEquals(cipherData, parsed.getCipherData().get());
            assertArrayEquals(header.toByteArray(), parsed.toByteArray());
        }
    }

    @Test
    void fromBytesRejectsShortInput() {
        assertThrows(HeaderTooShortException.class, () -> KmsHeader.fromBytes(new byte[34]));
        assertThrows(HeaderTooShortException.class, () -> KmsHeader.fromBytes(new byte[0]));
    }

    @Test
    void fromBytesRejectsUnknownAlgorithmCode() {
        byte[] data = KmsHeader.fromArn(ARN, EncryptionAlgorithm.RSAES_OAEP_SHA_256, KeySpec.RSA_2048).toByteArray();
        data[35] = (byte) 0x51;

        assertThrows(UnrecognizedCodeException.class, () -> KmsHeader.fromBytes(data));
    }

    @Test
    void fromBytesWithTruncatedCipherDataStopsAtAlgorithm() {
        byte[] complete = completeHeader(KeySpec.RSA_2048).toByteArray();

        KmsHeader header = KmsHeader.fromBytes(Arrays.copyOf(complete, 100));

        assertEquals(KmsHeader.State.HAS_ALGORITHM, header.getState());
        assertEquals(36, header.length());
        assertFalse(header.getCipherData().isPresent());
    }

    @Test
    void fromBytesWithoutKeySpecKeepsArnOnly() {
        byte[] data = Arrays.copyOf(KmsHeader.fromArn(ARN).toByteArray(), 36);
        data[35] = (byte) 0x10;

        KmsHeader header = KmsHeader.fromBytes(data);

        assertEquals(KmsHeader.State.HAS_ARN, header.getState());
        assertEquals(Optional.of(EncryptionAlgorithm.RSAES_OAEP_SHA_1), header.getAlgorithm());
        assertEquals(35, header.length());
    }

    @Test
    void payloadFollowsHeader() {
        byte[] header = completeHeader(KeySpec.RSA_2048).toByteArray();
        byte[] payload = "symmetric ciphertext".getBytes(StandardCharsets.UTF_8);
        byte[] blob = ByteBuffer.allocate(header.length + payload.length).put(header).put(payload).array();

        assertEquals(292, KmsHeader.fromBytes(blob).length());
        assertArrayEquals(payload, KmsHeader.payloadOf(blob));
        assertThrows(IncompleteHeaderException.class, () -> KmsHeader.payloadOf(Arrays.copyOf(header, 200)));
    }

    @Test
    void readFromLeavesStreamAtPayload() throws IOException {
        byte[] header = completeHeader(KeySpec.RSA_2048).toByteArray();
        byte[] blob = Arrays.copyOf(header, header.length + 3);
        blob[header.length] = 7;

        InputStream in = new ByteArrayInputStream(blob);
        KmsHeader parsed = KmsHeader.readFrom(in);

        assertArrayEquals(header, parsed.toByteArray());
        assertEquals(7, in.read());
        assertEquals(2, in.available());
    }

    @Test
    void readFromRejectsTruncatedAndIncompleteStreams() {
        byte[] header = completeHeader(KeySpec.RSA_2048).toByteArray();
        byte[] noKeySpec = Arrays.copyOf(KmsHeader.fromArn(ARN).toByteArray(), 36);
        noKeySpec[35] = (byte) 0x20;

        assertThrows(HeaderTooShortException.class,
                () -> KmsHeader.readFrom(new ByteArrayInputStream(Arrays.copyOf(header, 20))));
        assertThrows(HeaderTooShortException.class,
                () -> KmsHeader.readFrom(new ByteArrayInputStream(Arrays.copyOf(header, 291))));
        assertThrows(IncompleteHeaderException.class, () -> KmsHeader.readFrom(new ByteArrayInputStream(noKeySpec)));
    }

    @Test
    void setArnRejectsInvalidArn() {
        KmsHeader header = KmsHeader.fromArn(ARN);

        assertThrows(InvalidArnException.class, () -> header.setArn("arn:aws:kms:us-east-1:111122223333:alias/x"));
        assertEquals(ARN, header.getArn().get().toString());
    }

    @Test
    void setAlgorithmByName() {
        KmsHeader header = KmsHeader.fromArn(ARN);

        header.setAlgorithm("RSA_4096");
        header.setAlgorithm("RSAES_OAEP_SHA_1");

        assertEquals(Optional.of(KeySpec.RSA_4096), header.getKeySpec());
        assertEquals(Optional.of(EncryptionAlgorithm.RSAES_OAEP_SHA_1), header.getAlgorithm());
        assertThrows(UnsupportedAlgorithmException.class, () -> header.setAlgorithm("SYMMETRIC_DEFAULT"));
    }

    @Test
    void setCipherDataRequiresKeySpec() {
        KmsHeader header = KmsHeader.fromArn(ARN);

        assertThrows(IncompleteHeaderException.class, () -> header.setCipherData(new byte[256]));
    }

    @Test
    void setCipherDataRejectsWrongLengthWithoutMutation() {
        KmsHeader header = completeHeader(KeySpec.RSA_2048);
        byte[] before = header.toByteArray();

        assertThrows(CipherLengthMismatchException.class, () -> header.setCipherData(new byte[255]));
        assertThrows(CipherLengthMismatchException.class, () -> header.setCipherData(new byte[384]));
        assertArrayEquals(before, header.toByteArray());
    }

    @Test
    void setKeySpecRejectsMismatchWithCipherData() {
        KmsHeader header = completeHeader(KeySpec.RSA_2048);

        assertThrows(CipherLengthMismatchException.class, () -> header.setKeySpec(KeySpec.RSA_4096));
        assertEquals(Optional.of(KeySpec.RSA_2048), header.getKeySpec());
    }

    @Test
    void setKeySpecMustMatchLoadedPublicKey() {
        KmsHeader header = KmsHeader.fromArn(ARN);
        header.setPublicKey(keyPair.getPublic());

        assertThrows(UnsupportedKeySpecException.class, () -> header.setKeySpec(KeySpec.RSA_4096));
        assertThrows(UnsupportedKeySpecException.class, () -> header.setAlgorithm("RSA_4096"));
        assertEquals(Optional.of(KeySpec.RSA_2048), header.getKeySpec());

        header.setKeySpec(KeySpec.RSA_2048);
        assertEquals(190, header.getMaxPlaintextLength());
        assertThrows(PlaintextTooLargeException.class, () -> header.encrypt(new byte[300]));

        header.encrypt(new byte[32]);
        assertEquals(292, header.length());
    }

    @Test
    void cipherDataIsCopied() {
        KmsHeader header = KmsHeader.fromArn(ARN, EncryptionAlgorithm.RSAES_OAEP_SHA_256, KeySpec.RSA_2048);
        byte[] cipherData = new byte[256];
        header.setCipherData(cipherData);

        cipherData[0] = 1;
        header.getCipherData().get()[1] = 1;

        assertArrayEquals(new byte[256], header.getCipherData().get());
    }

    @Test
    void setPublicKeySetsKeySpec() {
        KmsHeader header = KmsHeader.fromArn(ARN);

        header.setPublicKey(keyPair.getPublic());

        assertEquals(Optional.of(KeySpec.RSA_2048), header.getKeySpec());
        assertEquals(36, header.length());
    }

    @Test
    void setPublicKeyIsAtomic() throws Exception {
        KmsHeader header = KmsHeader.fromArn(ARN, EncryptionAlgorithm.RSAES_OAEP_SHA_256, KeySpec.RSA_3072);
        header.setCipherData(new byte[384]);

        assertThrows(CipherLengthMismatchException.class, () -> header.setPublicKey(keyPair.getPublic()));
        assertThrows(InvalidPublicKeyException.class, () -> header.setPublicKey("not a pem"));

        final KeyPairGenerator smallKeys = KeyPairGenerator.getInstance("RSA");
        smallKeys.initialize(1024);
        assertThrows(UnsupportedKeySpecException.class,
                () -> header.setPublicKey(smallKeys.generateKeyPair().getPublic()));

        assertFalse(header.getPublicKey().isPresent());
        assertEquals(Optional.of(KeySpec.RSA_3072), header.getKeySpec());
        assertEquals(420, header.length());
    }

    @Test
    void encryptRequiresPublicKey() {
        KmsHeader header = KmsHeader.fromArn(ARN, EncryptionAlgorithm.RSAES_OAEP_SHA_256, KeySpec.RSA_2048);

        assertThrows(IncompleteHeaderException.class, () -> header.encrypt(SYMMETRIC_KEYS));
    }

    @Test
    void encryptsWithinOaepLimit() throws GeneralSecurityException {
        KmsHeader header = KmsHeader.fromArn(ARN);
        header.setPublicKey(keyPair.getPublic());

        header.encrypt(SYMMETRIC_KEYS);

        assertEquals(KmsHeader.State.HAS_CIPHER_DATA, header.getState());
        assertEquals(292, header.length());
        assertArrayEquals(SYMMETRIC_KEYS, rsaDecrypt(keyPair.getPrivate(), header.getCipherData().get(),
                EncryptionAlgorithm.RSAES_OAEP_SHA_256));
    }

    @Test
    void encryptRejectsPlaintextOverOaepLimit() {
        KmsHeader header = KmsHeader.fromArn(ARN);
        header.setPublicKey(keyPair.getPublic());

        assertEquals(190, header.getMaxPlaintextLength());
        header.encrypt(new byte[190]);
        assertThrows(PlaintextTooLargeException.class, () -> header.encrypt(new byte[191]));
        assertThrows(PlaintextTooLargeException.class, () -> header.encrypt(new byte[200]));

        header.setAlgorithm(EncryptionAlgorithm.RSAES_OAEP_SHA_1);
        assertEquals(214, header.getMaxPlaintextLength());
        header.encrypt(new byte[200]);
    }

    @Test
    void encryptUsesConfiguredProvider() {
        byte[] cipherData = new byte[256];
        cipherData[0] = 42;
        when(encryptionProvider.encrypt(keyPair.getPublic(), SYMMETRIC_KEYS, EncryptionAlgorithm.RSAES_OAEP_SHA_256))
                .thenReturn(cipherData);
        KmsHeader header = KmsHeader.fromArn(ARN);
        header.setPublicKey(keyPair.getPublic());
        header.setEncryptionProvider(encryptionProvider);

        header.encrypt(SYMMETRIC_KEYS);

        assertArrayEquals(cipherData, header.getCipherData().get());
    }

    @Test
    void decryptAsksRegionalDecrypter() {
        KmsHeader header = completeHeader(KeySpec.RSA_2048);
        KmsKeyArn arn = header.getArn().get();
        when(decrypterSupplier.getDecrypter("us-east-1")).thenReturn(decrypter);
        when(decrypter.decrypt(eq(arn), any(byte[].class), eq(EncryptionAlgorithm.RSAES_OAEP_SHA_256)))
                .thenReturn(SYMMETRIC_KEYS);

        assertArrayEquals(SYMMETRIC_KEYS, header.decrypt(decrypterSupplier));

        ArgumentCaptor<byte[]> ciphertext = ArgumentCaptor.forClass(byte[].class);
        verify(decrypter).decrypt(eq(arn), ciphertext.capture(), eq(EncryptionAlgorithm.RSAES_OAEP_SHA_256));
        assertArrayEquals(header.getCipherData().get(), ciphertext.getValue());
    }

    @Test
    void encryptThenDecryptWithPrivateKey() {
        KmsHeader sender = KmsHeader.fromArn(ARN);
        sender.setAlgorithm(EncryptionAlgorithm.RSAES_OAEP_SHA_1);
        sender.setPublicKey(keyPair.getPublic());
        sender.encrypt(SYMMETRIC_KEYS);

        KmsHeader receiver = KmsHeader.fromBytes(sender.toByteArray());
        KmsDecrypterSupplier localKms = regionId -> (arn, ciphertext, algorithm) -> {
            try {
                return rsaDecrypt(keyPair.getPrivate(), ciphertext, algorithm);
            } catch (GeneralSecurityException e) {
                throw new DecryptionFailedException(e);
            }
        };

        assertArrayEquals(SYMMETRIC_KEYS, receiver.decrypt(localKms));
    }

    @Test
    void decryptRequiresCompleteHeader() {
        KmsHeader header = KmsHeader.fromArn(ARN, EncryptionAlgorithm.RSAES_OAEP_SHA_256, KeySpec.RSA_2048);

        assertThrows(IncompleteHeaderException.class, () -> header.decrypt(decrypterSupplier));
        assertThrows(IncompleteHeaderException.class, () -> new KmsHeader().decrypt(decrypterSupplier));
    }

    @Test
    void decryptWrapsRegionFailure() {
        UnsupportedRegionException regionFailure = new UnsupportedRegionException("denied");
        when(decrypterSupplier.getDecrypter("us-east-1")).thenThrow(regionFailure);

        DecryptionFailedException ex = assertThrows(DecryptionFailedException.class,
                () -> completeHeader(KeySpec.RSA_2048).decrypt(decrypterSupplier));
        assertSame(regionFailure, ex.getCause());
    }

    @Test
    void decryptWrapsSdkFailureFromSupplier() {
        SdkClientException clientFailure = SdkClientException.create("no credentials");
        when(decrypterSupplier.getDecrypter("us-east-1")).thenThrow(clientFailure);

        DecryptionFailedException ex = assertThrows(DecryptionFailedException.class,
                () -> completeHeader(KeySpec.RSA_2048).decrypt(decrypterSupplier));
        assertSame(clientFailure, ex.getCause());
    }

    @Test
    void decryptWrapsSdkFailureFromDecrypter() {
        SdkClientException clientFailure = SdkClientException.create("unable to connect");
        when(decrypterSupplier.getDecrypter("us-east-1")).thenReturn(decrypter);
        when(decrypter.decrypt(any(KmsKeyArn.class), any(byte[].class), any(EncryptionAlgorithm.class)))
                .thenThrow(clientFailure);

        DecryptionFailedException ex = assertThrows(DecryptionFailedException.class,
                () -> completeHeader(KeySpec.RSA_2048).decrypt(decrypterSupplier));
        assertSame(clientFailure, ex.getCause());
    }

    @Test
    void decryptPropagatesKmsFailure() {
        DecryptionFailedException kmsFailure = new DecryptionFailedException("KMS said no");
        when(decrypterSupplier.getDecrypter("us-east-1")).thenReturn(decrypter);
        when(decrypter.decrypt(any(KmsKeyArn.class), any(byte[].class), any(EncryptionAlgorithm.class)))
                .thenThrow(kmsFailure);

        DecryptionFailedException ex = assertThrows(DecryptionFailedException.class,
                () -> completeHeader(KeySpec.RSA_2048).decrypt(decrypterSupplier));
        assertSame(kmsFailure, ex);
    }

    @Test
    void toStringNamesStateWithoutCipherData() {
        String description = completeHeader(KeySpec.RSA_2048).toString();

        assertTrue(description.contains(ARN));
        assertTrue(description.contains("HAS_CIPHER_DATA"));
    }

    private static KmsHeader completeHeader(KeySpec keySpec) {
        KmsHeader header = KmsHeader.fromArn(ARN, EncryptionAlgorithm.RSAES_OAEP_SHA_256, keySpec);
        byte[] cipherData = new byte[keySpec.getCipherLength()];
        Arrays.fill(cipherData, (byte) 0x33);
        header.setCipherData(cipherData);
        return header;
    }

    private static byte[] rsaDecrypt(PrivateKey privateKey, byte[] ciphertext, EncryptionAlgorithm algorithm)
            throws GeneralSecurityException {
        Cipher cipher = Cipher.getInstance(EncryptionAlgorithm.TRANSFORMATION);
        cipher.init(Cipher.DECRYPT_MODE, privateKey, algorithm.getOaepParameterSpec());
        return cipher.doFinal(ciphertext);
    }
}
