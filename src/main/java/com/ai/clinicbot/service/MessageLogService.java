package com.ai.clinicbot.service;

import com.ai.clinicbot.entity.DeliveryStatus;
import com.ai.clinicbot.entity.MessageLog;
import com.ai.clinicbot.repository.MessageLogRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Append and status-update access to the message log. Status only moves forward.
 */
@Service
public class MessageLogService {

    private static final Logger log = LoggerFactory.getLogger(MessageLogService.class);

    public enum StatusUpdate { APPLIED, REGRESSION_IGNORED, UNKNOWN_MESSAGE }

    private final MessageLogRepository repository;

    public MessageLogService(MessageLogRepository repository) {
        this.repository = repository;
    }

    public MessageLog record(MessageLog entry) {
        return repository.save(entry);
    }

    @Transactional(readOnly = true)
    public boolean isLogged(String providerMessageId) {
        return StringUtils.isNotBlank(providerMessageId) && repository.existsByProviderMessageId(providerMessageId);
    }

    /**
     * Inserts an inbound row keyed by its provider message id. Returns false when the id is
     * already logged, which is how redelivered webhooks are detected.
     */
    public boolean claimInbound(MessageLog inbound) {
        if (isLogged(inbound.getProviderMessageId())) return false;
        try {
            repository.saveAndFlush(inbound);
            return true;
        } catch (DataIntegrityViolationException e) {
            log.info("Inbound message {} claimed concurrently", inbound.getProviderMessageId());
            return false;
        }
    }

    @Transactional
    public StatusUpdate applyStatus(String providerMessageId, DeliveryStatus status, String errorCode, String errorMessage) {
        MessageLog entry = repository.findByProviderMessageIdForUpdate(providerMessageId).orElse(null);
        if (entry == null) {
            log.debug("Status {} for unknown message {}", status, providerMessageId);
            return StatusUpdate.UNKNOWN_MESSAGE;
        }
        if (status.regresses(entry.getStatus())) {
            log.info("Ignoring {} for message {}: already {}", status, providerMessageId, entry.getStatus());
            return StatusUpdate.REGRESSION_IGNORED;
        }
        entry.setStatus(status);
        if (status == DeliveryStatus.FAILED) {
            entry.setErrorCode(errorCode);
            entry.setErrorMessage(errorMessage);
        }
        repository.save(entry);
        return StatusUpdate.APPLIED;
    }
}
