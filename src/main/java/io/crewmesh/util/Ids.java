package io.crewmesh.util;

import java.util.UUID;
import java.util.regex.Pattern;

public final class Ids {
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_.-]{0,127}");

    private Ids() {
    }

    public static String newTaskId() {
        return "tsk_" + UUID.randomUUID().toString().replace("-", "");
    }

    /**
     * Worker ids end up in file names (mailboxes, overrides, markers), so they are restricted
     * to a conservative character set.
     */
    public static String requireSafe(String id, String what) {
        if (id == null || !SAFE_ID.matcher(id).matches()) {
            throw new IllegalArgumentException("invalid " + what + ": " + id);
        }
        return id;
    }
}
