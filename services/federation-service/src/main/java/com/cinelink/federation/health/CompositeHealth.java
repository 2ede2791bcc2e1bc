package com.cinelink.federation.health;

public record CompositeHealth(StoreHealth document, StoreHealth graph) {

    public boolean healthy() {
        return document.connected() && graph.connected();
    }
}
