package com.bastion.classification;

import com.bastion.domain.IndicatorType;
import com.google.common.net.InetAddresses;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.util.Optional;

/**
 * IPv4 and IPv6 literals, optionally with a CIDR prefix length.
 *
 * Addresses are canonicalised with Guava, so {@code 2001:DB8:0:0::1} is
 * stored as {@code 2001:db8::1}.
 */
public class IpDetector implements TypeDetector {

    @Override
    public Optional<Classification> detect(String value) {
        String address = value;
        Integer prefix = null;

        int slash = value.indexOf('/');
        if (slash >= 0) {
            address = value.substring(0, slash);
            prefix = parsePrefix(value.substring(slash + 1));
            if (prefix == null) {
                return Optional.empty();
            }
        }

        if (!InetAddresses.isInetAddress(address)) {
            return Optional.empty();
        }

        InetAddress inet = InetAddresses.forString(address);
        if (prefix != null && prefix > maxPrefix(inet)) {
            return Optional.empty();
        }

        String canonical = InetAddresses.toAddrString(inet);
        return Optional.of(Classification.of(prefix == null ? canonical : canonical + "/" + prefix,
            IndicatorType.IP));
    }

    @Override
    public IndicatorType family() {
        return IndicatorType.IP;
    }

    static int maxPrefix(InetAddress inet) {
        return inet instanceof Inet4Address ? 32 : 128;
    }

    private static Integer parsePrefix(String raw) {
        if (raw.isEmpty() || raw.length() > 3) {
            return null;
        }
        for (int i = 0; i < raw.length(); i++) {
            if (!Character.isDigit(raw.charAt(i))) {
                return null;
            }
        }
        return Integer.parseInt(raw);
    }
}
