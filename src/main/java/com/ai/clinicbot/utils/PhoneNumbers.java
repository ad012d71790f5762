package com.ai.clinicbot.utils;

import org.apache.commons.lang3.StringUtils;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Phone number helpers. Default country is Honduras (+504); numbers of eight digits
 * or fewer without a leading plus are treated as local.
 */
public final class PhoneNumbers {

    public static final String DEFAULT_COUNTRY_CODE = "504";
    private static final int LOCAL_NUMBER_LENGTH = 8;

    private PhoneNumbers() {
    }

    /**
     * "whatsapp:+50493133496", "50493133496", " 9313-3496 " all become "+50493133496".
     * Returns an empty string for blank input.
     */
    public static String normalizeToE164(String phone) {
        if (StringUtils.isBlank(phone)) return "";
        String cleaned = StringUtils.removeStartIgnoreCase(phone.trim(), "whatsapp:").trim();
        boolean hasPlus = cleaned.startsWith("+");
        String digits = cleaned.replaceAll("\\D", "");
        if (digits.isEmpty()) return "";
        if (!hasPlus && digits.length() <= LOCAL_NUMBER_LENGTH) {
            digits = DEFAULT_COUNTRY_CODE + digits;
        }
        return "+" + digits;
    }

    public static String toTwilio(String phone) {
        return "whatsapp:" + normalizeToE164(phone);
    }

    public static String toMeta(String phone) {
        return StringUtils.removeStart(normalizeToE164(phone), "+");
    }

    /** Last eight digits, the way staff usually type local numbers. */
    public static String localPart(String phone) {
        String digits = normalizeToE164(phone).replaceAll("\\D", "");
        return digits.length() > LOCAL_NUMBER_LENGTH ? digits.substring(digits.length() - LOCAL_NUMBER_LENGTH) : digits;
    }

    /** Stored forms a patient record may carry for the same number. */
    public static Set<String> lookupVariants(String phone) {
        Set<String> variants = new LinkedHashSet<>();
        String e164 = normalizeToE164(phone);
        if (e164.isEmpty()) return variants;
        variants.add(e164);
        variants.add(e164.substring(1));
        variants.add(localPart(phone));
        return variants;
    }
}
