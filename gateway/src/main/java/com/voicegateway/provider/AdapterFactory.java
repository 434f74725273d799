package com.voicegateway.provider;

import com.voicegateway.model.AdapterDescriptor;
import com.voicegateway.model.CapabilityKind;

import java.util.Set;
import java.util.function.Function;

/**
 * Builds a fresh adapter from a descriptor. One factory per (capability, provider) pair.
 */
public interface AdapterFactory {

    CapabilityKind capability();

    String providerName();

    /**
     * Credential keys that must be present and non-empty
     */
    Set<String> requiredCredentials();

    ProviderAdapter create(AdapterDescriptor descriptor);

    static AdapterFactory of(CapabilityKind capability,
                             String providerName,
                             Set<String> requiredCredentials,
                             Function<AdapterDescriptor, ? extends ProviderAdapter> constructor) {
        return new AdapterFactory() {
            @Override
            public CapabilityKind capability() {
                return capability;
            }

            @Override
            public String providerName() {
                return providerName;
            }

            @Override
            public Set<String> requiredCredentials() {
                return requiredCredentials;
            }

            @Override
            public ProviderAdapter create(AdapterDescriptor descriptor) {
                return constructor.apply(descriptor);
            }

            @Override
            public String toString() {
                return "AdapterFactory[" + capability.key() + "/" + providerName + "]";
            }
        };
    }
}
