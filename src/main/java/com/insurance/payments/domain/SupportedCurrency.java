package com.insurance.payments.domain;

/**
 * ISO 4217 currencies accepted for policy payments.
 */
public enum SupportedCurrency {
    USD,
    /** Zimbabwe Gold. */
    ZWG;

    public static boolean isSupported(String code) {
        if (code == null) {
            return false;
        }
        for (SupportedCurrency currency : values()) {
            if (currency.name().equals(code)) {
                return true;
            }
        }
        return false;
    }
}
