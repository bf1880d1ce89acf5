package com.acme.pgprecheck;

import com.acme.pgprecheck.exceptions.InputValidationException;

import java.util.Set;
import java.util.regex.Pattern;

public final class PrecheckContext {

    public static final Set<Integer> SUPPORTED_TARGET_VERSIONS = Set.of(11, 12, 13, 14, 15, 16, 17);

    private static final Pattern HOST = Pattern.compile("^[a-zA-Z0-9._-]+$");
    private static final Pattern PORT = Pattern.compile("^[0-9]+$");
    private static final Pattern USER = Pattern.compile("^[a-zA-Z0-9_-]+$");

    public final String host;
    public final int port;
    public final String user;
    public final int targetVersion;

    public PrecheckContext(String host, int port, String user, int targetVersion) {
        this.host = host;
        this.port = port;
        this.user = user;
        this.targetVersion = targetVersion;
    }

    /** Validates the raw positional arguments before any connection attempt. */
    public static PrecheckContext fromArgs(String host, String port, String user, String targetVersion)
            throws InputValidationException {
        if (isBlank(host) || isBlank(port) || isBlank(user) || isBlank(targetVersion)) {
            throw new InputValidationException("Usage: pg-upgrade-precheck <HOST> <PORT> <USER> <TARGET_VERSION>");
        }
        if (host.length() > 253 || !HOST.matcher(host).matches()) {
            throw new InputValidationException("Invalid hostname format");
        }
        if (port.length() > 5 || !PORT.matcher(port).matches()) {
            throw new InputValidationException("Invalid port number (must be 1-65535)");
        }
        int portNum = Integer.parseInt(port);
        if (portNum < 1 || portNum > 65535) {
            throw new InputValidationException("Invalid port number (must be 1-65535)");
        }
        if (user.length() > 63 || !USER.matcher(user).matches()) {
            throw new InputValidationException("Invalid username format");
        }
        int target = parseTargetVersion(targetVersion);
        return new PrecheckContext(host, portNum, user, target);
    }

    static int parseTargetVersion(String raw) throws InputValidationException {
        int target;
        try {
            target = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            target = -1;
        }
        if (!SUPPORTED_TARGET_VERSIONS.contains(target) || raw.trim().length() != 2) {
            throw new InputValidationException("Invalid target version '" + raw + "'. Supported versions: 11, 12, 13, 14, 15, 16, 17");
        }
        return target;
    }

    private static boolean isBlank(String s) { return s == null || s.isBlank(); }
}
