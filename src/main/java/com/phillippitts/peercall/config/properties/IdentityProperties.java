package com.phillippitts.peercall.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

/**
 * Typed properties for identity attachment.
 */
@ConfigurationProperties(prefix = "identity")
public class IdentityProperties {

    /** Stable installation id; a random one is generated and persisted when blank. */
    private final String installId;

    /** Nickname sent with the first attach. */
    private final String nick;

    /** Attach automatically on the first connect when no userId is known yet. */
    private final boolean attachOnConnect;

    @ConstructorBinding
    public IdentityProperties(String installId, String nick, Boolean attachOnConnect) {
        this.installId = installId;
        this.nick = nick;
        this.attachOnConnect = attachOnConnect == null || attachOnConnect;
    }

    public String getInstallId() {
        return installId;
    }

    public String getNick() {
        return nick;
    }

    public boolean isAttachOnConnect() {
        return attachOnConnect;
    }
}
