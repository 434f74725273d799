package com.voicegateway.provider;

import com.voicegateway.model.CapabilityKind;

/**
 * Vendor-specific implementation of one capability.
 *
 * <p>Contract for every implementation:
 * <ul>
 *   <li>one outbound vendor call per invocation, no internal retries</li>
 *   <li>failures surface only as {@link com.voicegateway.exception.UpstreamException}</li>
 *   <li>credentials are never logged</li>
 * </ul>
 */
public interface ProviderAdapter {

    /**
     * Provider name this adapter was registered under
     */
    String getName();

    CapabilityKind getCapability();

    /**
     * Largest input this adapter accepts, and whether it may be truncated to fit
     */
    PayloadLimit getPayloadLimit();
}
