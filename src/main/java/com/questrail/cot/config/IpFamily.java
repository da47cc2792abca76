package com.questrail.cot.config;

import java.util.Locale;

/**
 * Address family used for UDP sockets.
 */
public enum IpFamily {
    IPV4,
    IPV6;

    public static IpFamily parse(String value) {
        switch (value.toLowerCase(Locale.ROOT)) {
            case "ipv4":
            case "inet":
            case "4":
                return IPV4;
            case "ipv6":
            case "inet6":
            case "6":
                return IPV6;
            default:
                throw new IllegalArgumentException("Unknown IP family: " + value);
        }
    }
}
