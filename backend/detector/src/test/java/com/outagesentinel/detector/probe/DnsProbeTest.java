package com.outagesentinel.detector.probe;

import com.outagesentinel.core.model.Signal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DnsProbeTest {
    private final ExecutorService executor = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void resolvedIpv4AddressPasses() throws Exception {
        InetAddress v4 = InetAddress.getByAddress("carrier.example", new byte[]{10, 0, 0, 7});
        DnsProbe probe = new DnsProbe(host -> new InetAddress[]{v4}, executor);

        Signal signal = probe.check("dns:carrier.example", "carrier.example", Duration.ofSeconds(1));

        assertTrue(signal.ok());
        assertEquals("A=10.0.0.7", signal.detail());
    }

    @Test
    void ipv6OnlyAnswerHasNoRecords() throws Exception {
        InetAddress v6 = InetAddress.getByAddress("carrier.example",
                new byte[]{0x20, 0x01, 0x0d, (byte) 0xb8, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 1});
        DnsProbe probe = new DnsProbe(host -> new InetAddress[]{v6}, executor);

        Signal signal = probe.check("dns:carrier.example", "carrier.example", Duration.ofSeconds(1));

        assertFalse(signal.ok());
        assertEquals("no_records", signal.detail());
    }

    @Test
    void unknownHostFails() {
        DnsProbe probe = new DnsProbe(host -> {
            throw new UnknownHostException(host);
        }, executor);

        Signal signal = probe.check("dns:missing.invalid", "missing.invalid", Duration.ofSeconds(1));

        assertFalse(signal.ok());
        assertTrue(signal.detail().startsWith("unknown_host"), signal.detail());
    }

    @Test
    void hangingResolverTimesOut() {
        DnsProbe probe = new DnsProbe(host -> {
            try {
                Thread.sleep(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new InetAddress[0];
        }, executor);

        Signal signal = probe.check("dns:slow.example", "slow.example", Duration.ofMillis(100));

        assertFalse(signal.ok());
        assertEquals("timeout", signal.detail());
    }
}
