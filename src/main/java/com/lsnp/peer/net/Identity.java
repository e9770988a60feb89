package com.lsnp.peer.net;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.regex.Pattern;

/**
 * Helpers for {@code username@ipv4} identities.
 */
public final class Identity {

    private static final Logger log = LoggerFactory.getLogger(Identity.class);
    private static final Pattern IPV4 = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");

    private Identity() {}

    public static String of(String username, String ip) {
        return username + "@" + ip;
    }

    public static String username(String identity) {
        int at = identity.lastIndexOf('@');
        return at < 0 ? identity : identity.substring(0, at);
    }

    /**
     * @return the IPv4 literal after the last '@', or null if there is none
     */
    public static String embeddedIp(String identity) {
        if (identity == null) {
            return null;
        }
        int at = identity.lastIndexOf('@');
        if (at < 0) {
            return null;
        }
        String candidate = identity.substring(at + 1);
        if (!IPV4.matcher(candidate).matches()) {
            return null;
        }
        for (String octet : candidate.split("\\.")) {
            if (Integer.parseInt(octet) > 255) {
                return null;
            }
        }
        return candidate;
    }

    public static InetAddress embeddedAddress(String identity) {
        String ip = embeddedIp(identity);
        if (ip == null) {
            return null;
        }
        try {
            return InetAddress.getByName(ip);
        } catch (UnknownHostException e) {
            log.debug("Unusable address in identity {}: {}", identity, e.getMessage());
            return null;
        }
    }
}
