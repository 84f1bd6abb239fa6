package com.example.boundary.common.util;

import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.net.InetSocketAddress;
import java.util.regex.Pattern;

/**
 * Resolves the client IP recorded on audit entries.
 * X-Forwarded-For is honoured only when the direct peer is a private-network proxy.
 */
public final class ClientIpExtractor {

    private static final String X_FORWARDED_FOR = "X-Forwarded-For";
    private static final String UNKNOWN = "unknown";
    private static final Pattern IP_ADDRESS_PATTERN = Pattern.compile(
            "^([0-9]{1,3}\\.){3}[0-9]{1,3}$|^([0-9a-fA-F]{0,4}:){2,7}[0-9a-fA-F]{0,4}$");

    private ClientIpExtractor() {}

    @NonNull
    public static String extract(@NonNull ServerHttpRequest request) {
        InetSocketAddress remoteAddress = request.getRemoteAddress();
        String directIp = remoteAddress != null && remoteAddress.getAddress() != null
                ? remoteAddress.getAddress().getHostAddress()
                : UNKNOWN;

        if (!isTrustedProxy(directIp)) {
            return directIp;
        }

        String forwardedFor = request.getHeaders().getFirst(X_FORWARDED_FOR);
        if (forwardedFor == null || forwardedFor.isBlank()) {
            return directIp;
        }

        // rightmost hop that is not one of our proxies
        String[] hops = forwardedFor.split(",");
        for (int i = hops.length - 1; i >= 0; i--) {
            String ip = hops[i].trim();
            if (isValidIp(ip) && !isTrustedProxy(ip)) {
                return ip;
            }
        }
        String first = hops[0].trim();
        return isValidIp(first) ? first : directIp;
    }

    public static boolean isValidIp(@Nullable String ip) {
        return ip != null && !ip.isBlank() && IP_ADDRESS_PATTERN.matcher(ip).matches();
    }

    /**
     * Private ranges: 10/8, 172.16/12, 192.168/16, loopback, IPv6 link-local and unique-local.
     */
    public static boolean isTrustedProxy(@Nullable String ip) {
        if (ip == null) {
            return false;
        }
        if (ip.startsWith("10.") || ip.startsWith("192.168.") || ip.equals("127.0.0.1") || ip.equals("::1")
                || ip.equals("0:0:0:0:0:0:0:1")) {
            return true;
        }
        if (ip.startsWith("172.")) {
            String[] octets = ip.split("\\.");
            if (octets.length >= 2) {
                try {
                    int second = Integer.parseInt(octets[1]);
                    return second >= 16 && second <= 31;
                } catch (NumberFormatException e) {
                    return false;
                }
            }
        }
        return ip.startsWith("fe80:") || ip.startsWith("fc") || ip.startsWith("fd");
    }
}
