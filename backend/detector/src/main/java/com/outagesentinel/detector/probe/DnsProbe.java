package com.outagesentinel.detector.probe;

import com.outagesentinel.core.model.Signal;
import com.outagesentinel.detector.api.Probe;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * IPv4 resolution check. The platform resolver has no timeout of its own, so the lookup
 * runs on the supplied executor and the probe stops waiting once the timeout elapses.
 * The caller owns the executor and shuts it down.
 */
public class DnsProbe implements Probe {
    private final HostResolver resolver;
    private final Executor executor;

    public DnsProbe(HostResolver resolver, Executor executor) {
        this.resolver = resolver;
        this.executor = executor;
    }

    @Override
    public Signal check(String signalName, String target, Duration timeout) {
        long startedAt = System.nanoTime();
        return CompletableFuture.supplyAsync(() -> resolve(target), executor)
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((addresses, error) -> {
                    long elapsedMillis = HttpProbe.elapsedMillis(startedAt);
                    if (error != null) {
                        return Signal.failed(signalName, elapsedMillis, FailureDetails.describe(error));
                    }
                    Optional<InetAddress> firstV4 = Arrays.stream(addresses)
                            .filter(address -> address instanceof Inet4Address)
                            .findFirst();
                    return firstV4
                            .map(address -> Signal.passed(signalName, elapsedMillis, "A=" + address.getHostAddress()))
                            .orElseGet(() -> Signal.failed(signalName, elapsedMillis, "no_records"));
                })
                .join();
    }

    private InetAddress[] resolve(String host) {
        try {
            InetAddress[] addresses = resolver.resolve(host);
            return addresses == null ? new InetAddress[0] : addresses;
        } catch (UnknownHostException e) {
            throw new CompletionException(e);
        }
    }

    @FunctionalInterface
    public interface HostResolver {
        InetAddress[] resolve(String host) throws UnknownHostException;
    }
}
