package com.realtime.chatstore.common;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

@Component
public class Normalizer {

    private static final Pattern EMAIL_RE  = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
    private static final Pattern PHONE_RE  = Pattern.compile("^\\+?\\d{7,15}$");

    public String normalizeEmail(String email) {
        if (email == null) return null;
        return email.trim().toLowerCase(Locale.ROOT);
    }

    /** 숫자와 선행 '+'만 남긴다. 빈 값은 null (전화번호는 선택 항목) */
    public String normalizePhone(String phone) {
        if (phone == null) return null;
        String digits = phone.trim().replaceAll("[^0-9+]", "");
        return digits.isEmpty() ? null : digits;
    }

    public String normalizeUsername(String username) {
        return username == null ? null : username.trim();
    }

    public boolean looksLikeEmail(String s) {
        return s != null && EMAIL_RE.matcher(s.trim()).matches();
    }

    public boolean looksLikePhone(String s) {
        return s != null && PHONE_RE.matcher(s.trim().replaceAll("[\\s-]", "")).matches();
    }
}
