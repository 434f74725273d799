package com.voicegateway.exception;

/**
 * A configuration snapshot was built against a version that is no longer current.
 */
public class ConfigConflictException extends GatewayException {

    private final long attemptedVersion;
    private final long currentVersion;

    public ConfigConflictException(long attemptedVersion, long currentVersion) {
        super(ErrorKind.CONFIG_CONFLICT,
                "Configuration version " + attemptedVersion + " conflicts with current version " + currentVersion);
        this.attemptedVersion = attemptedVersion;
        this.currentVersion = currentVersion;
    }

    public long getAttemptedVersion() {
        return attemptedVersion;
    }

    public long getCurrentVersion() {
        return currentVersion;
    }
}
