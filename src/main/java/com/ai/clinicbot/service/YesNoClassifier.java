package com.ai.clinicbot.service;

import com.ai.clinicbot.utils.YesNoResult;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Classifies patient replies into YES, NO, or UNKNOWN. Spanish first, with the
 * common English forms patients also type.
 */
@Service
public class YesNoClassifier {

    private static final Set<String> AFFIRMATIVE_EXACT = Set.of(
            "si", "sí", "s", "claro", "ok", "okay", "dale", "de acuerdo", "correcto",
            "confirmo", "confirmar", "afirmativo", "yes", "va", "esta bien", "está bien"
    );

    private static final Set<String> NEGATIVE_EXACT = Set.of(
            "no", "n", "nel", "negativo", "mejor no", "todavia no", "todavía no",
            "aun no", "aún no", "espera", "no gracias"
    );

    private static final Pattern AFFIRMATIVE_PATTERN = Pattern.compile(
            "\\b(si|claro|ok|okay|dale|correcto|confirmo|confirmar|afirmativo|yes)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern NEGATIVE_PATTERN = Pattern.compile(
            "\\b(no|nel|negativo|espera|todavia)\\b",
            Pattern.CASE_INSENSITIVE
    );

    public YesNoResult classify(String userInput) {
        if (userInput == null || userInput.isBlank()) {
            return YesNoResult.UNKNOWN;
        }
        String normalized = userInput.trim().toLowerCase(Locale.ROOT);
        if (normalized.length() <= 15) {
            if (AFFIRMATIVE_EXACT.contains(normalized)) {
                return YesNoResult.YES;
            }
            if (NEGATIVE_EXACT.contains(normalized)) {
                return YesNoResult.NO;
            }
        }

        String plain = StringUtils.stripAccents(normalized);
        boolean yes = AFFIRMATIVE_PATTERN.matcher(plain).find();
        boolean no = NEGATIVE_PATTERN.matcher(plain).find();
        if (yes && no) return YesNoResult.UNKNOWN;
        if (yes) return YesNoResult.YES;
        if (no) return YesNoResult.NO;
        return YesNoResult.UNKNOWN;
    }
}
