package org.luxbulb.webinfo.enricher.asn;

import com.google.common.base.Splitter;
import com.google.common.net.InetAddresses;
import org.jetbrains.annotations.NotNull;
import org.luxbulb.webinfo.Common;
import org.luxbulb.webinfo.models.ip.IpNetwork;

import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.math.BigInteger;
import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.zip.GZIPInputStream;

/**
 * An {@link AsnLookupTable} built from the iptoasn.com {@code ip2asn-combined.tsv} table.
 * <p>
 * Each line of the table describes an address range:
 * {@code range_start \t range_end \t AS_number \t country_code \t AS_description}.
 * The ranges are kept sorted by their first address, separately for IPv4 and IPv6, and looked up using
 * binary search. Ranges with AS number 0 are not routed and are left out.
 */
public class Ip2AsnTable implements AsnLookupTable {
    public static final String COMPONENT_NAME = "asn-table";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(Ip2AsnTable.class);

    private static final Splitter TAB_SPLITTER = Splitter.on('\t').limit(5);

    private record Range(BigInteger start, BigInteger end, long asn, String countryCode, String organization) {
    }

    private final List<Range> _ipv4Ranges;
    private final List<Range> _ipv6Ranges;
    private final long _skippedRows;

    private Ip2AsnTable(List<Range> ipv4Ranges, List<Range> ipv6Ranges, long skippedRows) {
        _ipv4Ranges = ipv4Ranges;
        _ipv6Ranges = ipv6Ranges;
        _skippedRows = skippedRows;
    }

    /**
     * Loads the table from a file. The file may be gzip-compressed.
     *
     * @param path The path of the table.
     * @return The loaded table.
     * @throws IOException If the file cannot be read.
     */
    public static Ip2AsnTable load(@NotNull Path path) throws IOException {
        try (var stream = Files.newInputStream(path)) {
            final var table = read(stream);
            Logger.info("Loaded ASN table {}: {} IPv4 ranges, {} IPv6 ranges, {} rows skipped",
                    path, table._ipv4Ranges.size(), table._ipv6Ranges.size(), table._skippedRows);
            return table;
        }
    }

    /**
     * Reads the table from a stream. Gzip compression is detected from the first two bytes of the stream.
     * The stream is not closed.
     *
     * @param stream The input stream.
     * @return The loaded table.
     * @throws IOException If the stream cannot be read.
     */
    public static Ip2AsnTable read(@NotNull InputStream stream) throws IOException {
        final var buffered = new BufferedInputStream(stream);
        final InputStream source = isGzip(buffered) ? new GZIPInputStream(buffered) : buffered;
        final var reader = new BufferedReader(new InputStreamReader(source, StandardCharsets.UTF_8));

        final var ipv4 = new ArrayList<Range>();
        final var ipv6 = new ArrayList<Range>();
        long skipped = 0;
        long lineNumber = 0;

        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank())
                continue;

            final var fields = TAB_SPLITTER.splitToList(line);
            if (fields.size() < 5) {
                Logger.trace("Line {}: too few fields", lineNumber);
                skipped++;
                continue;
            }

            final InetAddress start, end;
            final long asn;
            try {
                start = InetAddresses.forString(fields.get(0));
                end = InetAddresses.forString(fields.get(1));
                asn = Long.parseLong(fields.get(2));
            } catch (IllegalArgumentException e) {
                Logger.trace("Line {}: {}", lineNumber, e.getMessage());
                skipped++;
                continue;
            }

            // Not routed
            if (asn == 0) {
                skipped++;
                continue;
            }

            // IPv4-mapped IPv6 addresses are parsed to Inet4Address, so the textual form decides the family
            final var v6 = fields.get(0).contains(":");
            if (v6 != (start instanceof Inet6Address) || start.getClass() != end.getClass()) {
                Logger.trace("Line {}: unsupported address range", lineNumber);
                skipped++;
                continue;
            }

            final var range = new Range(InetAddresses.toBigInteger(start), InetAddresses.toBigInteger(end),
                    asn, fields.get(3).trim(), fields.get(4).trim());
            if (range.start.compareTo(range.end) > 0) {
                Logger.trace("Line {}: range start is above its end", lineNumber);
                skipped++;
                continue;
            }

            (v6 ? ipv6 : ipv4).add(range);
        }

        ipv4.sort(Comparator.comparing(Range::start));
        ipv6.sort(Comparator.comparing(Range::start));
        ipv4.trimToSize();
        ipv6.trimToSize();
        return new Ip2AsnTable(ipv4, ipv6, skipped);
    }

    private static boolean isGzip(BufferedInputStream stream) throws IOException {
        stream.mark(2);
        final var first = stream.read();
        final var second = stream.read();
        stream.reset();
        return first == (GZIPInputStream.GZIP_MAGIC & 0xFF) && second == (GZIPInputStream.GZIP_MAGIC >> 8);
    }

    @Override
    public @NotNull Optional<AsnTableEntry> lookup(@NotNull InetAddress address) {
        final var v4 = address instanceof Inet4Address;
        final var ranges = v4 ? _ipv4Ranges : _ipv6Ranges;
        final var value = InetAddresses.toBigInteger(address);

        // Find the last range that starts at or before the address
        int low = 0, high = ranges.size() - 1, found = -1;
        while (low <= high) {
            final var mid = (low + high) >>> 1;
            if (ranges.get(mid).start.compareTo(value) <= 0) {
                found = mid;
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }

        if (found < 0)
            return Optional.empty();

        final var range = ranges.get(found);
        if (range.end.compareTo(value) < 0)
            return Optional.empty();

        final var network = coveringBlock(range.start, range.end, value, v4 ? 32 : 128);
        return Optional.of(new AsnTableEntry(network, range.asn, range.organization, range.countryCode));
    }

    /**
     * Splits the range [start, end] into the minimal sequence of CIDR blocks and returns the one that contains
     * the given value.
     */
    static IpNetwork coveringBlock(BigInteger start, BigInteger end, BigInteger value, int bits) {
        var current = start;
        while (current.compareTo(end) <= 0) {
            // The largest block aligned at the current address
            var hostBits = current.signum() == 0 ? bits : Math.min(current.getLowestSetBit(), bits);
            while (hostBits > 0 && current.add(BigInteger.ONE.shiftLeft(hostBits)).subtract(BigInteger.ONE)
                    .compareTo(end) > 0) {
                hostBits--;
            }

            final var next = current.add(BigInteger.ONE.shiftLeft(hostBits));
            if (value.compareTo(next) < 0)
                return new IpNetwork(toAddress(current, bits), bits - hostBits);

            current = next;
        }

        throw new IllegalArgumentException("The value is not in the range");
    }

    private static InetAddress toAddress(BigInteger value, int bits) {
        return bits == 32 ? InetAddresses.fromIPv4BigInteger(value) : InetAddresses.fromIPv6BigInteger(value);
    }

    public int size() {
        return _ipv4Ranges.size() + _ipv6Ranges.size();
    }

    /**
     * The number of rows that were not included in the table: unrouted ranges and malformed lines.
     */
    public long skippedRows() {
        return _skippedRows;
    }
}
