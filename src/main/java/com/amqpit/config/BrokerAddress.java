package com.amqpit.config;

import com.amqpit.errors.InteropTestException;

/**
 * Broker endpoint given on the command line.
 *
 * Accepts {@code host:port}, optionally prefixed with {@code amqp://} and with
 * {@code user:password@} credentials. IPv6 hosts are written in brackets. The port
 * defaults to 5672.
 */
public class BrokerAddress {

    public static final int DEFAULT_PORT = 5672;
    private static final String SCHEME = "amqp://";

    private final String host;
    private final int port;
    private final String username;
    private final String password;

    public BrokerAddress(String host, int port, String username, String password) {
        this.host = host;
        this.port = port;
        this.username = username;
        this.password = password;
    }

    public static BrokerAddress parse(String address) {
        if (address == null || address.isBlank()) {
            throw InteropTestException.argument("Broker address must not be empty");
        }
        String rest = address.trim();
        if (rest.regionMatches(true, 0, SCHEME, 0, SCHEME.length())) {
            rest = rest.substring(SCHEME.length());
        }
        if (rest.endsWith("/")) {
            rest = rest.substring(0, rest.length() - 1);
        }

        String username = null;
        String password = null;
        int at = rest.lastIndexOf('@');
        if (at >= 0) {
            String userInfo = rest.substring(0, at);
            rest = rest.substring(at + 1);
            int colon = userInfo.indexOf(':');
            username = colon >= 0 ? userInfo.substring(0, colon) : userInfo;
            password = colon >= 0 ? userInfo.substring(colon + 1) : "";
        }

        String host;
        String portText = null;
        if (rest.startsWith("[")) {
            int close = rest.indexOf(']');
            if (close < 0) {
                throw InteropTestException.argument("Unterminated IPv6 host in broker address: " + address);
            }
            host = rest.substring(1, close);
            String tail = rest.substring(close + 1);
            if (tail.startsWith(":")) {
                portText = tail.substring(1);
            } else if (!tail.isEmpty()) {
                throw InteropTestException.argument("Invalid broker address: " + address);
            }
        } else {
            int colon = rest.lastIndexOf(':');
            if (colon >= 0) {
                host = rest.substring(0, colon);
                portText = rest.substring(colon + 1);
            } else {
                host = rest;
            }
        }

        if (host.isEmpty()) {
            throw InteropTestException.argument("Broker address has no host: " + address);
        }
        return new BrokerAddress(host, parsePort(portText, address), username, password);
    }

    private static int parsePort(String portText, String address) {
        if (portText == null || portText.isEmpty()) {
            return DEFAULT_PORT;
        }
        try {
            int port = Integer.parseInt(portText);
            if (port < 1 || port > 65535) {
                throw InteropTestException.argument("Broker port out of range: " + address);
            }
            return port;
        } catch (NumberFormatException e) {
            throw InteropTestException.argument("Invalid broker port: " + address);
        }
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public boolean hasCredentials() {
        return username != null;
    }

    @Override
    public String toString() {
        String hostPart = host.indexOf(':') >= 0 ? "[" + host + "]" : host;
        return hostPart + ":" + port;
    }
}
