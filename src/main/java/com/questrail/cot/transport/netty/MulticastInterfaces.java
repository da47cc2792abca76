package com.questrail.cot.transport.netty;

import com.questrail.cot.transport.SocketBindException;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.util.Collections;
import java.util.List;

/**
 * Chooses the network interface used to join or send to a multicast group.
 */
final class MulticastInterfaces
{
    private MulticastInterfaces() {}

    /**
     * Returns the interface owning {@code local}, or, when {@code local} is the
     * wildcard address, the first interface that is up, supports multicast and has
     * an address of the group's family. Loopback is used only as a last resort.
     *
     * @throws SocketBindException if no suitable interface exists
     */
    static NetworkInterface select(InetAddress local, InetAddress group)
    {
        try {
            if (!local.isAnyLocalAddress()) {
                NetworkInterface ni = NetworkInterface.getByInetAddress(local);
                if (ni == null) {
                    throw new SocketBindException("No network interface has address " + local.getHostAddress());
                }
                return ni;
            }

            boolean ipv6 = group instanceof Inet6Address;
            NetworkInterface loopback = null;
            List<NetworkInterface> all = Collections.list(NetworkInterface.getNetworkInterfaces());
            for (NetworkInterface ni : all) {
                if (!ni.isUp() || !hasFamily(ni, ipv6)) {
                    continue;
                }
                if (ni.isLoopback()) {
                    // Linux leaves the multicast flag off lo; host-local groups still work.
                    if (loopback == null) {
                        loopback = ni;
                    }
                    continue;
                }
                if (ni.supportsMulticast()) {
                    return ni;
                }
            }
            if (loopback != null) {
                return loopback;
            }
            throw new SocketBindException("No multicast-capable network interface is up");
        } catch (SocketException e) {
            throw new SocketBindException("Cannot enumerate network interfaces", e);
        }
    }

    private static boolean hasFamily(NetworkInterface ni, boolean ipv6)
    {
        for (InetAddress a : Collections.list(ni.getInetAddresses())) {
            if (ipv6 ? a instanceof Inet6Address : a instanceof Inet4Address) {
                return true;
            }
        }
        return false;
    }
}
