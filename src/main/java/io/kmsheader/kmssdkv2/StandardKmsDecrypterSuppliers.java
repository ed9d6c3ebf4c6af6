// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

package io.kmsheader.kmssdkv2;

import io.kmsheader.exception.DecryptionFailedException;
import io.kmsheader.exception.UnsupportedRegionException;
import io.kmsheader.kms.KmsDecrypter;
import io.kmsheader.kms.KmsDecrypterSupplier;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.kms.KmsClient;
import software.amazon.awssdk.services.kms.KmsClientBuilder;
import software.amazon.awssdk.services.kms.model.KmsException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.logging.Logger;

import static java.util.Objects.requireNonNull;
import static org.apache.commons.lang3.Validate.notEmpty;

/**
 * Factory methods for instantiating the standard {@code KmsDecrypterSupplier}s, backed by the AWS SDK for Java v2.
 */
public class StandardKmsDecrypterSuppliers {

    private static final Logger LOGGER = Logger.getLogger(StandardKmsDecrypterSuppliers.class.getName());

    private StandardKmsDecrypterSuppliers() {
    }

    /**
     * A builder to construct the default KmsDecrypterSupplier that will create and cache clients
     * for any region. Credentials, client override configuration and a call timeout may be specified if necessary.
     *
     * @return The builder
     */
    public static DefaultKmsDecrypterSupplierBuilder defaultBuilder() {
        return new DefaultKmsDecrypterSupplierBuilder(KmsClient::builder);
    }

    /**
     * A builder to construct a KmsDecrypterSupplier that will
     * only supply decrypters for a given set of AWS regions.
     *
     * @param allowedRegions the AWS regions that the supplier is allowed to supply decrypters for
     * @return The builder
     */
    public static AllowRegionsKmsDecrypterSupplierBuilder allowRegionsBuilder(Set<String> allowedRegions) {
        return new AllowRegionsKmsDecrypterSupplierBuilder(allowedRegions);
    }

    /**
     * A builder to construct a KmsDecrypterSupplier that will
     * supply decrypters for all AWS regions except the given set of regions.
     *
     * @param deniedRegions the AWS regions that the supplier will not supply decrypters for
     * @return The builder
     */
    public static DenyRegionsKmsDecrypterSupplierBuilder denyRegionsBuilder(Set<String> deniedRegions) {
        return new DenyRegionsKmsDecrypterSupplierBuilder(deniedRegions);
    }

    /**
     * Adapts a caller managed {@link RegionalClientSupplier}. Clients are not cached.
     *
     * @param clientSupplier supplies the client for a region, or null if the region must not be used
     * @return The KmsDecrypterSupplier
     */
    public static KmsDecrypterSupplier fromRegionalClientSupplier(RegionalClientSupplier clientSupplier) {
        requireNonNull(clientSupplier, "clientSupplier is required");

        return regionId -> {
            final KmsClient client = clientSupplier.getClient(Region.of(regionId));
            if (client == null) {
                throw new UnsupportedRegionException("No KMS client is available for region " + regionId);
            }
            return new KmsClientDecrypter(client);
        };
    }

    /**
     * Builder to construct a KmsDecrypterSupplier that will create and cache clients
     * for any region. CredentialsProvider and ClientOverrideConfiguration are optional and may
     * be configured if necessary. A retry policy is injected through the override configuration.
     */
    public static class DefaultKmsDecrypterSupplierBuilder {

        private static final String NULL_REGION = "null-region";

        private final Supplier<KmsClientBuilder> kmsClientBuilderSupplier;
        private final Map<String, KmsDecrypter> decrypterCache = new ConcurrentHashMap<>();
        private AwsCredentialsProvider credentialsProvider;
        private ClientOverrideConfiguration overrideConfiguration;
        private Duration apiCallTimeout;
        private List<String> grantTokens = new ArrayList<>();

        DefaultKmsDecrypterSupplierBuilder(Supplier<KmsClientBuilder> kmsClientBuilderSupplier) {
            this.kmsClientBuilderSupplier = kmsClientBuilderSupplier;
        }

        public KmsDecrypterSupplier build() {
            final ClientOverrideConfiguration effectiveOverrideConfiguration = effectiveOverrideConfiguration();

            return requestedRegionId -> {
                final String regionId = requestedRegionId == null ? NULL_REGION : requestedRegionId;

                final KmsDecrypter cached = decrypterCache.get(regionId);
                if (cached != null) {
                    return cached;
                }

                KmsClientBuilder kmsClientBuilder = kmsClientBuilderSupplier.get();

                if (credentialsProvider != null) {
                    kmsClientBuilder = kmsClientBuilder.credentialsProvider(credentialsProvider);
                }

                if (effectiveOverrideConfiguration != null) {
                    kmsClientBuilder = kmsClientBuilder.overrideConfiguration(effectiveOverrideConfiguration);
                }

                if (!regionId.equals(NULL_REGION)) {
                    kmsClientBuilder = kmsClientBuilder.region(Region.of(regionId));
                }

                LOGGER.fine(() -> "Creating KMS client for region " + regionId);
                final KmsClient client = kmsClientBuilder.build();
                return newCachingDecrypter(client, new KmsClientDecrypter(client, grantTokens), regionId);
            };
        }

        /**
         * Sets the AwsCredentialsProvider used by the client.
         *
         * @param credentialsProvider New AwsCredentialsProvider to use.
         */
        public DefaultKmsDecrypterSupplierBuilder credentialsProvider(AwsCredentialsProvider credentialsProvider) {
            this.credentialsProvider = credentialsProvider;
            return this;
        }

        /**
         * Sets the ClientOverrideConfiguration to be used by the client, e.g. to install a retry policy.
         *
         * @param overrideConfiguration Custom configuration to use.
         */
        public DefaultKmsDecrypterSupplierBuilder overrideConfiguration(ClientOverrideConfiguration overrideConfiguration) {
            this.overrideConfiguration = overrideConfiguration;
            return this;
        }

        /**
         * Bounds the total time of a decrypt call, retries included.
         *
         * @param apiCallTimeout The timeout
         */
        public DefaultKmsDecrypterSupplierBuilder apiCallTimeout(Duration apiCallTimeout) {
            this.apiCallTimeout = apiCallTimeout;
            return this;
        }

        /**
         * Sets a list of string grant tokens to be included in all AWS KMS calls.
         *
         * @param grantTokens The list of grant tokens.
         */
        public DefaultKmsDecrypterSupplierBuilder grantTokens(List<String> grantTokens) {
            this.grantTokens = new ArrayList<>(grantTokens);
            return this;
        }

        ClientOverrideConfiguration effectiveOverrideConfiguration() {
            if (apiCallTimeout == null) {
                return overrideConfiguration;
            }
            final ClientOverrideConfiguration.Builder builder = overrideConfiguration == null
                    ? ClientOverrideConfiguration.builder()
                    : overrideConfiguration.toBuilder();
            return builder.apiCallTimeout(apiCallTimeout).build();
        }

        /**
         * Wraps the decrypter so that it is placed in the cache after a decrypt call completes or KMS itself
         * rejects the call. A client that never reached KMS is not cached, and is closed unless an earlier
         * call through the same wrapper already cached it.
         *
         * @param client    The client owned by the decrypter
         * @param decrypter The decrypter to wrap
         * @param regionId  The region the decrypter's client is associated with
         * @return The wrapping decrypter
         */
        private KmsDecrypter newCachingDecrypter(KmsClient client, KmsDecrypter decrypter, String regionId) {
            return (keyArn, ciphertext, algorithm) -> {
                try {
                    final byte[] result = decrypter.decrypt(keyArn, ciphertext, algorithm);
                    decrypterCache.put(regionId, decrypter);
                    return result;
                } catch (DecryptionFailedException e) {
                    if (e.getCause() instanceof KmsException) {
                        decrypterCache.put(regionId, decrypter);
                    } else if (decrypterCache.get(regionId) != decrypter) {
                        LOGGER.fine(() -> "Closing uncached KMS client for region " + regionId);
                        client.close();
                    }
                    throw e;
                }
            };
        }
    }

    /**
     * A KmsDecrypterSupplier that will only supply decrypters for a given set of AWS regions.
     */
    public static class AllowRegionsKmsDecrypterSupplierBuilder {

        private final Set<String> allowedRegions;
        private KmsDecrypterSupplier baseSupplier = StandardKmsDecrypterSuppliers.defaultBuilder().build();

        private AllowRegionsKmsDecrypterSupplierBuilder(Set<String> allowedRegions) {
            notEmpty(allowedRegions, "At least one region is required");

            this.allowedRegions = allowedRegions;
        }

        /**
         * Constructs the KmsDecrypterSupplier.
         *
         * @return The KmsDecrypterSupplier
         */
        public KmsDecrypterSupplier build() {
            requireNonNull(baseSupplier, "baseSupplier is required");

            return regionId -> {

                if (!allowedRegions.contains(regionId)) {
                    throw new UnsupportedRegionException(String.format("Region %s is not in the set of allowed regions %s",
                            regionId, allowedRegions));
                }

                return baseSupplier.getDecrypter(regionId);
            };
        }

        /**
         * Sets the supplier that will supply the decrypter if the region is allowed.
         *
         * @param baseSupplier the supplier that will supply the decrypter if the region is allowed.
         */
        public AllowRegionsKmsDecrypterSupplierBuilder baseSupplier(KmsDecrypterSupplier baseSupplier) {
            this.baseSupplier = baseSupplier;
            return this;
        }
    }

    /**
     * A KmsDecrypterSupplier that supplies decrypters for any region except the specified AWS regions.
     */
    public static class DenyRegionsKmsDecrypterSupplierBuilder {

        private final Set<String> deniedRegions;
        private KmsDecrypterSupplier baseSupplier = StandardKmsDecrypterSuppliers.defaultBuilder().build();

        private DenyRegionsKmsDecrypterSupplierBuilder(Set<String> deniedRegions) {
            notEmpty(deniedRegions, "At least one region is required");

            this.deniedRegions = deniedRegions;
        }

        /**
         * Sets the supplier that will supply the decrypter if the region is allowed.
         *
         * @param baseSupplier the supplier that will supply the decrypter if the region is allowed.
         */
        public DenyRegionsKmsDecrypterSupplierBuilder baseSupplier(KmsDecrypterSupplier baseSupplier) {
            this.baseSupplier = baseSupplier;
            return this;
        }

        public KmsDecrypterSupplier build() {
            requireNonNull(baseSupplier, "baseSupplier is required");

            return regionId -> {

                if (deniedRegions.contains(regionId)) {
                    throw new UnsupportedRegionException(String.format("Region %s is in the set of denied regions %s",
                            regionId, deniedRegions));
                }

                return baseSupplier.getDecrypter(regionId);
            };
        }
    }
}
