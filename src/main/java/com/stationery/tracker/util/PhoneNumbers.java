package com.stationery.tracker.util;

public final class PhoneNumbers {

    private PhoneNumbers() {
    }

    public static String toInternational(String phone, String defaultCountryCode) {
        if (phone == null || phone.isBlank()) {
            throw new IllegalArgumentException("Phone number is empty");
        }
        String cleaned = phone.replaceAll("[\\s-]", "");
        if (cleaned.startsWith("+")) {
            return cleaned;
        }
        if (cleaned.startsWith("0")) {
            return defaultCountryCode + cleaned.substring(1);
        }
        return "+" + cleaned;
    }
}
