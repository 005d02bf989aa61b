package org.carball.rightsizer.model.sku;

public final class PriceMath {

    public static final double HOURS_PER_MONTH = 730;

    private PriceMath() {
    }

    public static double toMonthly(double hourlyPrice) {
        return hourlyPrice * HOURS_PER_MONTH;
    }

    public static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }
}
