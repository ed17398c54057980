package org.luxbulb.webinfo.models.ip;

import com.google.common.net.InetAddresses;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.luxbulb.webinfo.Common;

import static org.junit.jupiter.api.Assertions.*;

class IpNetworkTest {

    @ParameterizedTest(name = "{0} => {1}")
    @CsvSource({
            "192.0.2.0/24, 192.0.2.0/24",
            "192.0.2.77/24, 192.0.2.0/24",
            "10.1.2.3/8, 10.0.0.0/8",
            "10.1.2.3/32, 10.1.2.3/32",
            "0.0.0.0/0, 0.0.0.0/0",
            "2001:db8:1:2::1/32, 2001:db8::/32",
            "2a01:e0c:1::/48, 2a01:e0c:1::/48"
    })
    void parsesAndNormalizes(String input, String expected) {
        assertEquals(expected, IpNetwork.of(input).toString());
    }

    @Test
    void rejectsInvalidBlocks() {
        assertThrows(IllegalArgumentException.class, () -> IpNetwork.of("192.0.2.0"));
        assertThrows(IllegalArgumentException.class, () -> IpNetwork.of("192.0.2.0/33"));
        assertThrows(IllegalArgumentException.class, () -> IpNetwork.of("192.0.2.0/x"));
        assertThrows(IllegalArgumentException.class, () -> IpNetwork.of("not-an-ip/8"));
    }

    @Test
    void containsAddressesOfTheSameFamily() {
        final var network = IpNetwork.of("212.27.32.0/19");

        assertTrue(network.contains(InetAddresses.forString("212.27.48.10")));
        assertFalse(network.contains(InetAddresses.forString("212.27.64.1")));
        assertFalse(network.contains(InetAddresses.forString("2a01:e0c::1")));
    }

    @Test
    void equalBlocksAreEqual() {
        assertEquals(IpNetwork.of("192.0.2.1/24"), IpNetwork.of("192.0.2.200/24"));
        assertNotEquals(IpNetwork.of("192.0.2.0/24"), IpNetwork.of("192.0.2.0/25"));
    }

    @Test
    void serializesAsCidrString() throws Exception {
        final var mapper = Common.makeMapper().build();

        assertEquals("\"2001:db8::/32\"", mapper.writeValueAsString(IpNetwork.of("2001:db8::/32")));
        assertEquals(IpNetwork.of("192.0.2.0/24"), mapper.readValue("\"192.0.2.0/24\"", IpNetwork.class));
    }
}
