package com.storeforecast.model;

public record SmoothingConfig(boolean enabled, int window) {

    public static final SmoothingConfig DISABLED = new SmoothingConfig(false, 1);
}
