package com.bastion.whitelist;

import com.google.common.net.InetAddresses;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.util.Arrays;

/**
 * An IPv4 or IPv6 network given in CIDR notation. A bare address is treated
 * as a single-host range (/32 or /128).
 */
public final class CidrRange {

    private final byte[] network;
    private final int prefixLength;
    private final String notation;

    private CidrRange(byte[] network, int prefixLength, String notation) {
        this.network = network;
        this.prefixLength = prefixLength;
        this.notation = notation;
    }

    /**
     * @throws IllegalArgumentException if {@code value} is not an address or a valid CIDR block
     */
    public static CidrRange parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("CIDR value must not be empty");
        }
        String trimmed = value.trim();
        String address = trimmed;
        int prefix = -1;

        int slash = trimmed.indexOf('/');
        if (slash >= 0) {
            address = trimmed.substring(0, slash);
            try {
                prefix = Integer.parseInt(trimmed.substring(slash + 1));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid CIDR prefix length: " + value);
            }
        }

        if (!InetAddresses.isInetAddress(address)) {
            throw new IllegalArgumentException("Invalid IP address in CIDR: " + value);
        }
        InetAddress inet = InetAddresses.forString(address);
        int maxPrefix = inet instanceof Inet4Address ? 32 : 128;
        if (prefix == -1) {
            prefix = maxPrefix;
        }
        if (prefix < 0 || prefix > maxPrefix) {
            throw new IllegalArgumentException("Invalid CIDR prefix length: " + value);
        }

        return new CidrRange(mask(inet.getAddress(), prefix), prefix, trimmed);
    }

    public static boolean isValid(String value) {
        try {
            parse(value);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * True if every address of {@code other} lies inside this range. Ranges of
     * different address families never contain each other.
     */
    public boolean contains(CidrRange other) {
        if (other.network.length != network.length || other.prefixLength < prefixLength) {
            return false;
        }
        return Arrays.equals(mask(other.network, prefixLength), network);
    }

    public int getPrefixLength() {
        return prefixLength;
    }

    public boolean isIpv4() {
        return network.length == 4;
    }

    private static byte[] mask(byte[] address, int prefix) {
        byte[] masked = Arrays.copyOf(address, address.length);
        for (int i = 0; i < masked.length; i++) {
            int bitsInByte = Math.max(0, Math.min(8, prefix - i * 8));
            int byteMask = bitsInByte == 0 ? 0 : (0xFF << (8 - bitsInByte)) & 0xFF;
            masked[i] = (byte) (masked[i] & byteMask);
        }
        return masked;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CidrRange)) {
            return false;
        }
        CidrRange that = (CidrRange) o;
        return prefixLength == that.prefixLength && Arrays.equals(network, that.network);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(network) + prefixLength;
    }

    @Override
    public String toString() {
        return notation;
    }
}
