package org.luxbulb.webinfo.models.ip;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.net.InetAddresses;
import org.jetbrains.annotations.NotNull;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * A CIDR network block. The address is always the first address of the block (host bits cleared).
 *
 * @param address      The network address.
 * @param prefixLength The number of leading bits that make up the network prefix.
 */
public record IpNetwork(@NotNull InetAddress address, int prefixLength) {

    public IpNetwork {
        final var bytes = address.getAddress();
        if (prefixLength < 0 || prefixLength > bytes.length * 8)
            throw new IllegalArgumentException("Invalid prefix length %d for %s"
                    .formatted(prefixLength, InetAddresses.toAddrString(address)));

        address = toAddress(mask(bytes, prefixLength));
    }

    /**
     * Parses a network in the {@code address/prefix} notation.
     *
     * @param cidr The CIDR string, e.g. {@code 192.0.2.0/24} or {@code 2001:db8::/32}.
     * @return The parsed network.
     * @throws IllegalArgumentException If the string is not a valid CIDR block.
     */
    @JsonCreator
    public static IpNetwork of(@NotNull String cidr) {
        final var slash = cidr.indexOf('/');
        if (slash < 0)
            throw new IllegalArgumentException("Not a CIDR block: " + cidr);

        final var address = InetAddresses.forString(cidr.substring(0, slash));
        try {
            return new IpNetwork(address, Integer.parseInt(cidr.substring(slash + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a CIDR block: " + cidr, e);
        }
    }

    /**
     * Checks whether the network contains the given address. Addresses of the other family are never contained.
     */
    public boolean contains(@NotNull InetAddress other) {
        final var otherBytes = other.getAddress();
        if (otherBytes.length != address.getAddress().length)
            return false;

        return address.equals(toAddress(mask(otherBytes, prefixLength)));
    }

    @JsonValue
    @Override
    public String toString() {
        return InetAddresses.toAddrString(address) + "/" + prefixLength;
    }

    private static byte[] mask(byte[] bytes, int prefixLength) {
        final var result = bytes.clone();
        for (int i = 0; i < result.length; i++) {
            final var bitsInByte = Math.max(0, Math.min(8, prefixLength - i * 8));
            result[i] &= (byte) (0xFF << (8 - bitsInByte));
        }
        return result;
    }

    private static InetAddress toAddress(byte[] bytes) {
        try {
            return InetAddress.getByAddress(bytes);
        } catch (UnknownHostException e) {
            // Shouldn't happen, the length is always 4 or 16
            throw new IllegalStateException(e);
        }
    }
}
