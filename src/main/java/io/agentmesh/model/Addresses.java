package io.agentmesh.model;

public final class Addresses {
    public static final String SYSTEM = "system";
    public static final String BROADCAST = "broadcast";

    private Addresses() {
    }

    public static boolean isReserved(String id) {
        return SYSTEM.equals(id) || BROADCAST.equals(id);
    }
}
