package com.flagship.settlement_engine.ticket;

import com.flagship.settlement_engine.catalog.CatalogRepository;
import com.flagship.settlement_engine.catalog.EventInfo;
import com.flagship.settlement_engine.common.actor.Actor;
import com.flagship.settlement_engine.common.exception.ErrorCode;
import com.flagship.settlement_engine.common.exception.SettlementException;
import com.flagship.settlement_engine.common.random.RandomCodes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Organizer management of agent codes, plus the activation call door staff make
 * before scanning.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentCodeService {

    static final int CODE_LENGTH = 9;
    private static final int MAX_ATTEMPTS = 5;

    private final AgentCodeRepository agentCodeRepository;
    private final CatalogRepository catalogRepository;
    private final Clock clock;

    @Transactional
    public AgentCode create(UUID eventId, String label, Actor actor) {
        EventInfo event = catalogRepository.getEvent(eventId);
        actor.requireActsFor(event.getOrganizerId());

        AgentCode agentCode = AgentCode.create(UUID.randomUUID(), eventId, uniqueCode(), label, clock.instant());
        AgentCode saved = agentCodeRepository.saveAndFlush(AgentCodeEntity.fromDomain(agentCode)).toDomain();
        log.info("Agent code created: eventId={}, label={}", eventId, label);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<AgentCode> list(UUID eventId, Actor actor) {
        EventInfo event = catalogRepository.getEvent(eventId);
        actor.requireActsFor(event.getOrganizerId());
        return agentCodeRepository.findByEventIdOrderByCreatedAtAsc(eventId).stream()
            .map(AgentCodeEntity::toDomain)
            .toList();
    }

    @Transactional
    public AgentCode deactivate(UUID agentCodeId, Actor actor) {
        return setActive(agentCodeId, false, actor);
    }

    @Transactional
    public AgentCode reactivate(UUID agentCodeId, Actor actor) {
        return setActive(agentCodeId, true, actor);
    }

    /**
     * Deletes a code that never checked anyone in.
     *
     * @throws SettlementException AGENT_CODE_IN_USE once the code has been used
     */
    @Transactional
    public void delete(UUID agentCodeId, Actor actor) {
        AgentCode agentCode = getOwned(agentCodeId, actor);
        if (agentCode.hasBeenUsed()) {
            throw new SettlementException(ErrorCode.AGENT_CODE_IN_USE,
                "Agent code has checked in " + agentCode.getCheckInCount() + " tickets; deactivate it instead");
        }
        agentCodeRepository.deleteById(agentCodeId);
        log.info("Agent code deleted: eventId={}, code={}", agentCode.getEventId(), agentCode.getCode());
    }

    /**
     * Validates a code presented by door staff and returns its event scope.
     * The first activation is stamped; later ones leave the stamp alone.
     */
    @Transactional
    public AgentCode activate(String code) {
        AgentCode agentCode = findActive(code);
        if (agentCode.getActivatedAt() == null && agentCodeRepository.markActivated(agentCode.getId(), clock.instant()) > 0) {
            log.info("Agent code activated for the first time: eventId={}, label={}",
                agentCode.getEventId(), agentCode.getLabel());
        }
        return agentCodeRepository.findById(agentCode.getId())
            .map(AgentCodeEntity::toDomain)
            .orElseThrow(() -> new SettlementException(ErrorCode.AGENT_CODE_NOT_FOUND));
    }

    /**
     * @throws SettlementException AGENT_CODE_NOT_FOUND or AGENT_CODE_INACTIVE
     */
    @Transactional(readOnly = true)
    public AgentCode findActive(String code) {
        AgentCode agentCode = agentCodeRepository.findByCode(normalize(code))
            .map(AgentCodeEntity::toDomain)
            .orElseThrow(() -> new SettlementException(ErrorCode.AGENT_CODE_NOT_FOUND, "Unknown agent code"));
        if (!agentCode.isActive()) {
            throw new SettlementException(ErrorCode.AGENT_CODE_INACTIVE);
        }
        return agentCode;
    }

    static String normalize(String code) {
        if (code == null || code.isBlank()) {
            throw new SettlementException(ErrorCode.AGENT_CODE_NOT_FOUND, "Agent code is empty");
        }
        return code.trim().toUpperCase(Locale.ROOT);
    }

    private AgentCode setActive(UUID agentCodeId, boolean active, Actor actor) {
        AgentCode agentCode = getOwned(agentCodeId, actor);
        agentCodeRepository.updateActive(agentCodeId, active);
        log.info("Agent code {}: eventId={}, label={}", active ? "reactivated" : "deactivated",
            agentCode.getEventId(), agentCode.getLabel());
        return agentCodeRepository.findById(agentCodeId)
            .map(AgentCodeEntity::toDomain)
            .orElseThrow(() -> new SettlementException(ErrorCode.AGENT_CODE_NOT_FOUND));
    }

    private AgentCode getOwned(UUID agentCodeId, Actor actor) {
        AgentCode agentCode = agentCodeRepository.findById(agentCodeId)
            .map(AgentCodeEntity::toDomain)
            .orElseThrow(() -> new SettlementException(ErrorCode.AGENT_CODE_NOT_FOUND, "Agent code not found: " + agentCodeId));
        actor.requireActsFor(catalogRepository.getEvent(agentCode.getEventId()).getOrganizerId());
        return agentCode;
    }

    private String uniqueCode() {
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            String candidate = RandomCodes.alphanumeric(CODE_LENGTH);
            if (!agentCodeRepository.existsByCode(candidate)) {
                return candidate;
            }
        }
        throw new SettlementException(ErrorCode.AGENT_CODE_GENERATION_FAILED);
    }
}
