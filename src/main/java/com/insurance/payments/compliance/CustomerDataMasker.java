package com.insurance.payments.compliance;

/**
 * Redacts customer contact details so they are safe to include in logs.
 */
public final class CustomerDataMasker {

    private static final String MASKED = "***";

    private CustomerDataMasker() {}

    /** "jane.doe@example.com" -> "j***@example.com". */
    public static String maskEmail(String email) {
        if (email == null || email.isBlank()) return null;
        int at = email.indexOf('@');
        if (at <= 0) return MASKED;
        return email.charAt(0) + MASKED + email.substring(at);
    }

    /** Keeps the last three digits: "+263771234567" -> "***567". */
    public static String maskMobile(String mobile) {
        if (mobile == null || mobile.isBlank()) return null;
        String trimmed = mobile.trim();
        if (trimmed.length() <= 3) return MASKED;
        return MASKED + trimmed.substring(trimmed.length() - 3);
    }

    /** Keeps the first character of each name part: "Jane Doe" -> "J*** D***". */
    public static String maskName(String name) {
        if (name == null || name.isBlank()) return null;
        StringBuilder masked = new StringBuilder();
        for (String part : name.trim().split("\\s+")) {
            if (masked.length() > 0) masked.append(' ');
            masked.append(part.charAt(0)).append(MASKED);
        }
        return masked.toString();
    }
}
