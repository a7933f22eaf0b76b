package com.botwire.api.transport;

import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;
import java.net.Proxy;
import java.net.URI;
import java.util.function.Function;

/**
 * Resolves the HTTP proxy for API calls from config or the usual environment variables.
 */
@Slf4j
public final class ProxySupport {

    private ProxySupport() {
    }

    /**
     * @return configured URL if set, else HTTPS_PROXY, HTTP_PROXY, ALL_PROXY (upper or lower case); null for none
     */
    public static String resolveProxyUrl(String configured, Function<String, String> env) {
        if (configured != null && !configured.isBlank())
            return configured.trim();
        for (String name : new String[] { "HTTPS_PROXY", "https_proxy", "HTTP_PROXY", "http_proxy",
                "ALL_PROXY", "all_proxy" }) {
            String v = env.apply(name);
            if (v != null && !v.isBlank())
                return v.trim();
        }
        return null;
    }

    /**
     * Build a {@link Proxy} from a URL such as {@code http://127.0.0.1:3128} or {@code socks5://host:1080}.
     *
     * @return null when the URL is missing or cannot be parsed
     */
    public static Proxy toProxy(String proxyUrl) {
        if (proxyUrl == null)
            return null;
        try {
            URI uri = URI.create(proxyUrl);
            String host = uri.getHost();
            int port = uri.getPort();
            if (host == null || port <= 0) {
                log.warn("Ignoring proxy URL without host or port: {}", proxyUrl);
                return null;
            }
            String scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase() : "http";
            Proxy.Type type = scheme.startsWith("socks") ? Proxy.Type.SOCKS : Proxy.Type.HTTP;
            return new Proxy(type, InetSocketAddress.createUnresolved(host, port));
        } catch (IllegalArgumentException e) {
            log.warn("Failed to parse proxy URL: {}", proxyUrl);
            return null;
        }
    }
}
