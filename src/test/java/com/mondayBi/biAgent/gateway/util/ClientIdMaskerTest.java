package com.mondayBi.biAgent.gateway.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class ClientIdMaskerTest {

    @Test
    public void shouldKeepFirstTwoOctetsOfIpv4Address() {
        assertEquals("10.12.*.*", ClientIdMasker.mask("10.12.34.56"));
        assertEquals("127.0.*.*", ClientIdMasker.mask(" 127.0.0.1 "));
    }

    @Test
    public void shouldKeepFirstGroupOfIpv6Address() {
        assertEquals("2001:****", ClientIdMasker.mask("2001:db8:0:0:0:0:2:1"));
        assertEquals("0:****", ClientIdMasker.mask("0:0:0:0:0:0:0:1"));
    }

    @Test
    public void shouldKeepPrefixAndLengthOfOtherIds() {
        assertEquals("we****(12)", ClientIdMasker.mask("web-frontend"));
    }

    @Test
    public void shouldHideShortAndMissingIds() {
        assertEquals("****", ClientIdMasker.mask("abcd"));
        assertEquals("****", ClientIdMasker.mask("  "));
        assertEquals("****", ClientIdMasker.mask(null));
    }
}
