package com.lsnp.peer.net;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.InterfaceAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;

/**
 * Local address and broadcast address discovery.
 */
public final class NetworkUtil {

    private static final Logger log = LoggerFactory.getLogger(NetworkUtil.class);

    private static final String[] VIRTUAL_PATTERNS = {
            "vmware", "virtualbox", "vbox", "hyper-v", "vethernet",
            "docker", "virbr", "vnic", "vmnet", "veth", "wsl"
    };

    private NetworkUtil() {}

    /**
     * Local IPv4 address, preferring site-local addresses on physical interfaces.
     * Falls back to the host address, then to 127.0.0.1.
     */
    public static InetAddress localIpv4Address() {
        try {
            Enumeration<NetworkInterface> interfaces = NetworkInterface.getNetworkInterfaces();
            while (interfaces.hasMoreElements()) {
                NetworkInterface iface = interfaces.nextElement();
                if (iface.isLoopback() || !iface.isUp() || isVirtualInterface(iface)) {
                    continue;
                }
                Enumeration<InetAddress> addresses = iface.getInetAddresses();
                while (addresses.hasMoreElements()) {
                    InetAddress addr = addresses.nextElement();
                    if (addr instanceof Inet4Address && addr.isSiteLocalAddress()) {
                        return addr;
                    }
                }
            }
            return InetAddress.getLocalHost();
        } catch (IOException e) {
            log.warn("Failed to resolve local IP, falling back to loopback: {}", e.getMessage());
            return InetAddress.getLoopbackAddress();
        }
    }

    /**
     * Broadcast targets for {@code local}: its subnet broadcast address (x.x.x.255 when the
     * interface does not report one) and the limited broadcast address 255.255.255.255.
     */
    public static List<InetAddress> broadcastAddresses(InetAddress local) {
        List<InetAddress> targets = new ArrayList<>();
        InetAddress subnet = subnetBroadcast(local);
        if (subnet != null) {
            targets.add(subnet);
        }
        try {
            InetAddress limited = InetAddress.getByName("255.255.255.255");
            if (!targets.contains(limited)) {
                targets.add(limited);
            }
        } catch (UnknownHostException e) {
            throw new IllegalStateException("limited broadcast address not resolvable", e);
        }
        return targets;
    }

    private static InetAddress subnetBroadcast(InetAddress local) {
        try {
            NetworkInterface iface = NetworkInterface.getByInetAddress(local);
            if (iface != null) {
                for (InterfaceAddress ia : iface.getInterfaceAddresses()) {
                    if (local.equals(ia.getAddress()) && ia.getBroadcast() != null) {
                        return ia.getBroadcast();
                    }
                }
            }
        } catch (SocketException e) {
            log.debug("Cannot inspect interface for {}: {}", local.getHostAddress(), e.getMessage());
        }
        byte[] octets = local.getAddress();
        if (octets.length != 4) {
            return null;
        }
        octets[3] = (byte) 0xFF;
        try {
            return InetAddress.getByAddress(octets);
        } catch (UnknownHostException e) {
            log.debug("Cannot derive broadcast address for {}: {}", local.getHostAddress(), e.getMessage());
            return null;
        }
    }

    private static boolean isVirtualInterface(NetworkInterface iface) {
        if (iface.isVirtual()) {
            return true;
        }
        String name = iface.getName().toLowerCase();
        String displayName = iface.getDisplayName() == null ? "" : iface.getDisplayName().toLowerCase();
        for (String pattern : VIRTUAL_PATTERNS) {
            if (name.contains(pattern) || displayName.contains(pattern)) {
                return true;
            }
        }
        return false;
    }
}
