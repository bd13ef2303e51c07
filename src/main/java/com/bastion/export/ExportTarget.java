package com.bastion.export;

import com.bastion.domain.IndicatorType;

/**
 * Published file families: the sub-directory and file-name prefix for each
 * indicator type, plus the two proxy-format families.
 */
public enum ExportTarget {

    IP("IP", "BlackIP", IndicatorType.IP, false),

    DOMAIN("Domain", "BlackDomain", IndicatorType.DOMAIN, false),

    HASH("Hash", "BlackHash", IndicatorType.HASH, false),

    URL("URL", "BlackURL", IndicatorType.URL, false),

    SOAR_URL("SoarURL", "BlackSoarURL", IndicatorType.SOAR_URL, false),

    PROXY_DOMAIN("Proxy", "ProxyDomain", IndicatorType.DOMAIN, true),

    PROXY_URL("Proxy", "ProxyURL", IndicatorType.URL, true);

    private final String directory;
    private final String prefix;
    private final IndicatorType type;
    private final boolean proxyFormat;

    ExportTarget(String directory, String prefix, IndicatorType type, boolean proxyFormat) {
        this.directory = directory;
        this.prefix = prefix;
        this.type = type;
        this.proxyFormat = proxyFormat;
    }

    public String getDirectory() {
        return directory;
    }

    public String getPrefix() {
        return prefix;
    }

    public IndicatorType getType() {
        return type;
    }

    public boolean isProxyFormat() {
        return proxyFormat;
    }

    public String fileName(int index) {
        return prefix + index + ".txt";
    }
}
