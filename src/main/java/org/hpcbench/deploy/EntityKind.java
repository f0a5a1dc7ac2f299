package org.hpcbench.deploy;

/**
 * Deployment category; doubles as the entity-store container name.
 */
public enum EntityKind {
    SERVICE("service"),
    CLIENT("client");

    private final String storeKind;

    EntityKind(String storeKind) {
        this.storeKind = storeKind;
    }

    public String storeKind() {
        return storeKind;
    }
}
