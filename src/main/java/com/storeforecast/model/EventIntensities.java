package com.storeforecast.model;

public record EventIntensities(double promo, double holiday, double event, double closure) {

    public static final double MAX = 2.0;
    public static final EventIntensities NONE = new EventIntensities(0, 0, 0, 0);

    public EventIntensities {
        promo = clamp(promo);
        holiday = clamp(holiday);
        event = clamp(event);
        closure = clamp(closure);
    }

    public boolean isEmpty() {
        return promo == 0 && holiday == 0 && event == 0 && closure == 0;
    }

    private static double clamp(double v) {
        if (!Double.isFinite(v)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(MAX, v));
    }
}
