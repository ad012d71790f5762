package com.ai.clinicbot.service;

import com.ai.clinicbot.conversation.ConversationState;
import com.ai.clinicbot.conversation.context.ConversationContext;
import com.ai.clinicbot.conversation.context.ConversationContextConverter;
import com.ai.clinicbot.entity.BotSession;
import com.ai.clinicbot.repository.BotSessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Session store: one row per (line, patient phone) with an absolute expiry.
 */
@Service
public class BotSessionService {

    private static final Logger log = LoggerFactory.getLogger(BotSessionService.class);

    private final BotSessionRepository repository;
    private final Clock clock;
    private final Duration ttl;

    public BotSessionService(BotSessionRepository repository,
                             Clock clock,
                             @Value("${clinicbot.session.ttl-minutes:45}") long ttlMinutes) {
        this.repository = repository;
        this.clock = clock;
        this.ttl = Duration.ofMinutes(ttlMinutes);
    }

    @Transactional(readOnly = true)
    public Optional<BotSession> load(UUID lineId, String patientPhone) {
        return repository.findByLineIdAndPatientPhone(lineId, patientPhone);
    }

    /**
     * Returns the existing session for (line, phone) or inserts a fresh one. Losing an
     * insert race to a concurrent first message reloads the winner's row.
     */
    public BotSession create(UUID lineId, String patientPhone, UUID organizationId) {
        Optional<BotSession> existing = repository.findByLineIdAndPatientPhone(lineId, patientPhone);
        if (existing.isPresent()) return existing.get();
        Instant now = clock.instant();
        BotSession session = BotSession.builder()
                .lineId(lineId)
                .patientPhone(patientPhone)
                .organizationId(organizationId)
                .state(ConversationState.GREETING)
                .context(new ConversationContext())
                .createdAt(now)
                .lastMessageAt(now)
                .expiresAt(now.plus(ttl))
                .build();
        try {
            BotSession saved = repository.saveAndFlush(session);
            log.info("Created bot session {} for line {}", saved.getId(), lineId);
            return saved;
        } catch (DataIntegrityViolationException e) {
            log.info("Session for line {} created concurrently, reloading", lineId);
            return repository.findByLineIdAndPatientPhone(lineId, patientPhone)
                    .orElseThrow(() -> new IllegalStateException("Session vanished after unique violation", e));
        }
    }

    @Transactional
    public BotSession reset(UUID sessionId) {
        BotSession session = repository.findById(sessionId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown session " + sessionId));
        Instant now = clock.instant();
        session.setState(ConversationState.GREETING);
        session.setContext(new ConversationContext());
        session.setLastMessageAt(now);
        session.setExpiresAt(now.plus(ttl));
        log.debug("Reset bot session {}", sessionId);
        return repository.save(session);
    }

    /**
     * Persists the outcome of a turn. {@code complete} forces the terminal state whatever
     * {@code nextState} says.
     */
    @Transactional
    public BotSession update(UUID sessionId, ConversationState nextState, ConversationContext context, boolean complete) {
        BotSession session = repository.findById(sessionId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown session " + sessionId));
        ConversationState state = complete ? ConversationState.COMPLETED : nextState;
        log.debug("Session {} {} -> {}", sessionId, session.getState(), state);
        session.setState(state);
        session.setContext(ConversationContextConverter.copy(context));
        session.setLastMessageAt(clock.instant());
        return repository.save(session);
    }

    public boolean isExpired(BotSession session) {
        return session.getExpiresAt() != null && clock.instant().isAfter(session.getExpiresAt());
    }
}
