package com.bastion.settings;

/**
 * Upstream HTTP proxy used for feed fetches.
 */
public final class ProxySettings {

    private static final ProxySettings DISABLED = new ProxySettings(false, null, 0, null, null);

    private final boolean enabled;
    private final String host;
    private final int port;
    private final String username;
    private final String password;

    public ProxySettings(boolean enabled, String host, int port, String username, String password) {
        this.enabled = enabled;
        this.host = host;
        this.port = port;
        this.username = username;
        this.password = password;
    }

    public static ProxySettings disabled() {
        return DISABLED;
    }

    /**
     * True when the proxy is switched on and has somewhere to point at.
     */
    public boolean isUsable() {
        return enabled && host != null && !host.isBlank() && port > 0;
    }

    public boolean hasCredentials() {
        return username != null && !username.isBlank();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    @Override
    public String toString() {
        return "ProxySettings{enabled=" + enabled + ", host='" + host + "', port=" + port
            + ", username='" + username + "'}";
    }
}
