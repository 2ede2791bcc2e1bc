package com.cinelink.federation.health;

public record StoreHealth(boolean connected, String error) {

    public static StoreHealth up() {
        return new StoreHealth(true, null);
    }

    public static StoreHealth down(String error) {
        return new StoreHealth(false, error);
    }
}
