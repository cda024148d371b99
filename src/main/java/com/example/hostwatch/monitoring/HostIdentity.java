package com.example.hostwatch.monitoring;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * The name of the monitored host, resolved once at startup.
 */
@Slf4j
@Component
public class HostIdentity {

    private final String hostname;

    public HostIdentity() {
        this(resolveHostname());
    }

    public HostIdentity(String hostname) {
        this.hostname = hostname;
    }

    public String hostname() {
        return hostname;
    }

    public int availableProcessors() {
        return Runtime.getRuntime().availableProcessors();
    }

    private static String resolveHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Could not resolve local hostname, using 'localhost': {}", e.getMessage());
            return "localhost";
        }
    }
}
