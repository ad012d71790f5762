package com.ai.clinicbot.service;

import com.ai.clinicbot.entity.FaqEntry;
import com.ai.clinicbot.repository.FaqEntryRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Scoped keyword lookup over active FAQ entries. Doctor entries beat clinic entries,
 * which beat organization-wide ones, when scores tie.
 */
@Service
public class FaqMatcherService {

    private static final Logger log = LoggerFactory.getLogger(FaqMatcherService.class);
    private static final double KEYWORD_WEIGHT = 1.0;
    private static final double QUESTION_WORD_WEIGHT = 0.5;
    private static final int MIN_WORD_LENGTH = 3;

    private final FaqEntryRepository repository;

    public FaqMatcherService(FaqEntryRepository repository) {
        this.repository = repository;
    }

    @Transactional(readOnly = true)
    public Optional<FaqMatch> search(String query, UUID organizationId, UUID doctorId, UUID clinicId) {
        String normalizedQuery = normalize(query);
        if (normalizedQuery.isEmpty() || organizationId == null) return Optional.empty();

        List<FaqEntry> candidates = repository
                .findByOrganizationIdAndActiveTrueOrderByScopePriorityAscDisplayOrderAsc(organizationId)
                .stream()
                .filter(FaqEntry::isActive)
                .filter(f -> inScope(f, doctorId, clinicId))
                .sorted(Comparator.comparingInt(FaqEntry::getScopePriority))
                .toList();

        FaqEntry best = null;
        double bestScore = 0;
        for (FaqEntry faq : candidates) {
            double score = score(normalizedQuery, faq);
            if (score > bestScore) {
                bestScore = score;
                best = faq;
            }
        }
        log.debug("FAQ search over {} entries, best score {}", candidates.size(), bestScore);
        return best == null ? Optional.empty() : Optional.of(new FaqMatch(best, bestScore));
    }

    static double score(String normalizedQuery, FaqEntry faq) {
        double score = 0;
        for (String keyword : faq.getKeywords()) {
            String k = normalize(keyword);
            if (!k.isEmpty() && normalizedQuery.contains(k)) {
                score += KEYWORD_WEIGHT;
            }
        }
        String question = normalize(faq.getQuestion());
        for (String word : normalizedQuery.split("\\s+")) {
            if (word.length() >= MIN_WORD_LENGTH && question.contains(word)) {
                score += QUESTION_WORD_WEIGHT;
            }
        }
        return score;
    }

    /** Lowercase, accents stripped, whitespace collapsed. */
    static String normalize(String text) {
        if (text == null) return "";
        return StringUtils.normalizeSpace(StringUtils.stripAccents(text).toLowerCase(Locale.ROOT));
    }

    private static boolean inScope(FaqEntry faq, UUID doctorId, UUID clinicId) {
        if (faq.getDoctorId() != null) return Objects.equals(faq.getDoctorId(), doctorId);
        if (faq.getClinicId() != null) return Objects.equals(faq.getClinicId(), clinicId);
        return true;
    }

    public record FaqMatch(FaqEntry entry, double score) {
    }
}
