package com.voicegateway.exception;

/**
 * Raised by provider adapters. The diagnostic carries vendor error text as an opaque,
 * length-capped string: it is shown to operators but never parsed.
 */
public class UpstreamException extends GatewayException {

    private static final int MAX_DIAGNOSTIC_LENGTH = 300;

    private final String providerName;
    private final String diagnostic;

    public UpstreamException(ErrorKind kind, String providerName, String diagnostic) {
        this(kind, providerName, diagnostic, null);
    }

    public UpstreamException(ErrorKind kind, String providerName, String diagnostic, Throwable cause) {
        super(requireUpstream(kind), "Provider " + providerName + " failed: " + kind.code(), cause);
        this.providerName = providerName;
        this.diagnostic = cap(diagnostic);
    }

    public String getProviderName() {
        return providerName;
    }

    public String getDiagnostic() {
        return diagnostic;
    }

    private static ErrorKind requireUpstream(ErrorKind kind) {
        if (!kind.isUpstream()) {
            throw new IllegalArgumentException("Not an upstream error kind: " + kind);
        }
        return kind;
    }

    private static String cap(String diagnostic) {
        if (diagnostic == null) {
            return null;
        }
        String flattened = diagnostic.replaceAll("\\s+", " ").trim();
        return flattened.length() <= MAX_DIAGNOSTIC_LENGTH
                ? flattened
                : flattened.substring(0, MAX_DIAGNOSTIC_LENGTH) + "...";
    }
}
