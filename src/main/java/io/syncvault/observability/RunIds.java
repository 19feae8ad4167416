package io.syncvault.observability;

import java.security.SecureRandom;

public final class RunIds {
    private static final SecureRandom RANDOM = new SecureRandom();

    private RunIds() {
    }

    public static String newRunId() {
        return "run_" + randomHex(12);
    }

    public static String newReportId() {
        return "rpt_" + randomHex(12);
    }

    public static String newConflictId() {
        return "cfl_" + randomHex(12);
    }

    private static String randomHex(int bytes) {
        byte[] value = new byte[bytes];
        RANDOM.nextBytes(value);
        StringBuilder sb = new StringBuilder(bytes * 2);
        for (byte b : value) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
