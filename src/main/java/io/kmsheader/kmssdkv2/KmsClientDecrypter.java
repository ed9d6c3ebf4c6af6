// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader.kmssdkv2;

import io.kmsheader.algorithm.EncryptionAlgorithm;
import io.kmsheader.arn.KmsKeyArn;
import io.kmsheader.exception.DecryptionFailedException;
import io.kmsheader.internal.LibraryInfo;
import io.kmsheader.kms.KmsDecrypter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import software.amazon.awssdk.awscore.AwsRequestOverrideConfiguration;
import software.amazon.awssdk.core.ApiName;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.kms.KmsClient;
import software.amazon.awssdk.services.kms.model.DecryptRequest;
import software.amazon.awssdk.services.kms.model.DecryptResponse;

import static java.util.Objects.requireNonNull;

/**
 * A {@link KmsDecrypter} that uses an AWS SDK for Java v2 {@link KmsClient}. Every request is tagged with the
 * library's API name.
 */
public final class KmsClientDecrypter implements KmsDecrypter {
  private static final ApiName API_NAME =
      ApiName.builder().name(LibraryInfo.API_NAME).version(LibraryInfo.version()).build();
  private static final Consumer<AwsRequestOverrideConfiguration.Builder> API_NAME_INTERCEPTOR =
      builder -> builder.addApiName(API_NAME);

  private final KmsClient client_;
  private final List<String> grantTokens_;

  public KmsClientDecrypter(final KmsClient client) {
    this(client, null);
  }

  public KmsClientDecrypter(final KmsClient client, final List<String> grantTokens) {
    client_ = requireNonNull(client, "client is required");
    grantTokens_ = grantTokens == null ? new ArrayList<>() : new ArrayList<>(grantTokens);
  }

  @Override
  public byte[] decrypt(
      final KmsKeyArn keyArn, final byte[] ciphertext, final EncryptionAlgorithm algorithm) {
    requireNonNull(keyArn, "keyArn is required");
    requireNonNull(ciphertext, "ciphertext is required");
    requireNonNull(algorithm, "algorithm is required");

    final DecryptResponse decryptResponse;
    try {
      decryptResponse =
          client_.decrypt(
              DecryptRequest.builder()
                  .overrideConfiguration(API_NAME_INTERCEPTOR)
                  .ciphertextBlob(SdkBytes.fromByteArray(ciphertext))
                  .keyId(keyArn.toString())
                  .encryptionAlgorithm(algorithm.getKmsAlgorithmSpec())
                  .grantTokens(grantTokens_)
                  .build());
    } catch (final SdkException ex) {
      throw new DecryptionFailedException(ex);
    }

    final String decryptResponseKeyId = decryptResponse.keyId();
    if (decryptResponseKeyId == null) {
      throw new DecryptionFailedException("Received an empty keyId from KMS");
    }
    if (!decryptResponseKeyId.equals(keyArn.toString())) {
      throw new DecryptionFailedException("Received an unexpected key Id from KMS: " + decryptResponseKeyId);
    }
    return decryptResponse.plaintext().asByteArray();
  }

  public List<String> getGrantTokens() {
    return Collections.unmodifiableList(grantTokens_);
  }
}
