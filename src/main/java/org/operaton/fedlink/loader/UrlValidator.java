package org.operaton.fedlink.loader;

import lombok.extern.slf4j.Slf4j;

import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;

/**
 * Rejects URLs that must not be fetched from a federated server (SSRF protection).
 */
@Slf4j
public class UrlValidator {

    private final boolean allowPrivateIps;

    public UrlValidator(boolean allowPrivateIps) {
        this.allowPrivateIps = allowPrivateIps;
    }

    /**
     * Validates that a URL uses HTTP(S) and does not point to a private or loopback address.
     *
     * @param url the URL to validate
     * @throws IllegalArgumentException if the URL is not allowed
     */
    public void validate(URI url) {
        String scheme = url.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            throw new IllegalArgumentException("Unsupported URL scheme: " + url);
        }
        String host = url.getHost();
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("URL has no host: " + url);
        }

        // If private IPs are allowed (local testing mode), skip SSRF protection
        if (allowPrivateIps) {
            log.debug("Private IPs allowed - skipping SSRF validation for: {}", url);
            return;
        }

        try {
            InetAddress address = InetAddress.getByName(host);

            // Block loopback addresses (127.0.0.0/8, ::1)
            if (address.isLoopbackAddress()) {
                throw new IllegalArgumentException("Loopback addresses are not allowed: " + host);
            }

            // Block site-local addresses (private IPs: 10.0.0.0/8, 172.16.0.0/12, 192.168.0.0/16)
            if (address.isSiteLocalAddress()) {
                throw new IllegalArgumentException("Private IP addresses are not allowed: " + host);
            }

            // Block link-local addresses (169.254.0.0/16, fe80::/10)
            if (address.isLinkLocalAddress()) {
                throw new IllegalArgumentException("Link-local addresses are not allowed: " + host);
            }

            if (address.isMulticastAddress()) {
                throw new IllegalArgumentException("Multicast addresses are not allowed: " + host);
            }

            if (address.isAnyLocalAddress()) {
                throw new IllegalArgumentException("Wildcard addresses are not allowed: " + host);
            }

            log.debug("URL validation passed for: {} (resolved to {})", url, address.getHostAddress());

        } catch (UnknownHostException e) {
            throw new IllegalArgumentException("Unable to resolve domain: " + host, e);
        }
    }
}
