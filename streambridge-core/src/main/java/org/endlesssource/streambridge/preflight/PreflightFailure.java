package org.endlesssource.streambridge.preflight;

/**
 * A readiness precondition that is not met, with the message shown to the user.
 */
public enum PreflightFailure {
    NOT_LOGGED_IN("not-ready", "Sign in to the provider extension before browsing."),
    DECRYPTION_COMPONENT_MISSING("decryption-missing", "Install the stream decryption component."),
    DECRYPTION_COMPONENT_DISABLED("decryption-disabled", "Enable the stream decryption component."),
    DRM_UNAVAILABLE("drm-unavailable", "Protected playback is not available on this device.");

    private final String code;
    private final String remediation;

    PreflightFailure(String code, String remediation) {
        this.code = code;
        this.remediation = remediation;
    }

    public String code() {
        return code;
    }

    public String remediation() {
        return remediation;
    }
}
