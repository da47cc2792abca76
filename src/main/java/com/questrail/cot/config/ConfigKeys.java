package com.questrail.cot.config;

/**
 * Names and defaults of the configuration keys understood by the client.
 */
public final class ConfigKeys
{
    private ConfigKeys() {}

    public static final String COT_URL = "COT_URL";
    public static final String TAK_PROTO = "TAK_PROTO";
    public static final String COT_STALE = "COT_STALE";
    public static final String COT_HOST_ID = "COT_HOST_ID";
    public static final String NO_HELLO = "NO_HELLO";

    public static final String COT_SLEEP = "COT_SLEEP";
    public static final String FTS_COMPAT = "FTS_COMPAT";
    public static final String COT_SLEEP_MAX = "COT_SLEEP_MAX";

    public static final String MULTICAST_TTL = "MULTICAST_TTL";
    public static final String MULTICAST_LOCAL_ADDR = "MULTICAST_LOCAL_ADDR";
    public static final String IP_FAMILY = "IP_FAMILY";
    public static final String CONNECT_TIMEOUT = "CONNECT_TIMEOUT";

    public static final String MAX_IN_QUEUE = "MAX_IN_QUEUE";
    public static final String MAX_OUT_QUEUE = "MAX_OUT_QUEUE";
    public static final String MAX_FRAME_LENGTH = "MAX_FRAME_LENGTH";

    public static final String PREF_PACKAGE = "PREF_PACKAGE";

    public static final String TLS_CLIENT_CERT = "TLS_CLIENT_CERT";
    public static final String TLS_CLIENT_KEY = "TLS_CLIENT_KEY";
    public static final String TLS_CLIENT_PASSWORD = "TLS_CLIENT_PASSWORD";
    public static final String TLS_CLIENT_KEY_PASSPHRASE = "TLS_CLIENT_KEY_PASSPHRASE";
    public static final String TLS_CLIENT_CAFILE = "TLS_CLIENT_CAFILE";
    public static final String TLS_CA_PASSWORD = "TLS_CA_PASSWORD";
    public static final String TLS_CLIENT_CIPHERS = "TLS_CLIENT_CIPHERS";
    public static final String TLS_DONT_VERIFY = "TLS_DONT_VERIFY";
    public static final String TLS_DONT_CHECK_HOSTNAME = "TLS_DONT_CHECK_HOSTNAME";
    public static final String TLS_SERVER_EXPECTED_HOSTNAME = "TLS_SERVER_EXPECTED_HOSTNAME";
    public static final String TLS_HANDSHAKE_TIMEOUT = "TLS_HANDSHAKE_TIMEOUT";

    /** ATAK's default situational-awareness multicast group, write-only. */
    public static final String DEFAULT_COT_URL = "udp+wo://239.2.3.1:6969";
    public static final int DEFAULT_COT_STALE_SECONDS = 120;
    public static final int DEFAULT_TAK_PROTO = 0;
    public static final int DEFAULT_MULTICAST_TTL = 1;
    public static final String DEFAULT_MULTICAST_LOCAL_ADDR = "0.0.0.0";
    public static final int DEFAULT_MAX_IN_QUEUE = 500;
    public static final int DEFAULT_MAX_OUT_QUEUE = 100;
    public static final int DEFAULT_MAX_FRAME_LENGTH = 1024 * 1024;
    public static final int DEFAULT_SLEEP_MAX_SECONDS = 5;
    public static final int DEFAULT_CONNECT_TIMEOUT_SECONDS = 10;
    public static final int DEFAULT_TLS_HANDSHAKE_TIMEOUT_SECONDS = 10;
}
