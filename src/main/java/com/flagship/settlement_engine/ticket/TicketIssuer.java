package com.flagship.settlement_engine.ticket;

import com.flagship.settlement_engine.common.random.RandomCodes;
import com.flagship.settlement_engine.payment.Payment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

/**
 * Issues the ticket for a payment that just succeeded. Runs inside the
 * confirmation transaction so the ticket exists if and only if the payment is SUCCESS.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TicketIssuer {

    static final String PREFIX = "TKT-";
    static final int CODE_LENGTH = 10;
    private static final int MAX_ATTEMPTS = 5;

    private final TicketRepository ticketRepository;

    @Transactional(propagation = Propagation.MANDATORY)
    public Ticket issue(Payment payment, Instant now) {
        Ticket ticket = Ticket.issue(
            UUID.randomUUID(),
            uniqueTicketNumber(),
            payment.getEventId(),
            payment.getTierId(),
            payment.getBuyerId(),
            payment.getBuyerEmail(),
            payment.getAmount(),
            payment.getId(),
            now
        );
        Ticket saved = ticketRepository.saveAndFlush(TicketEntity.fromDomain(ticket)).toDomain();
        log.info("Ticket issued: ticketNumber={}, paymentReference={}", saved.getTicketNumber(), payment.getReference());
        return saved;
    }

    private String uniqueTicketNumber() {
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            String candidate = PREFIX + RandomCodes.alphanumeric(CODE_LENGTH);
            if (!ticketRepository.existsByTicketNumber(candidate)) {
                return candidate;
            }
            log.debug("Ticket number collision on attempt {}", attempt);
        }
        throw new IllegalStateException("Could not generate a unique ticket number after " + MAX_ATTEMPTS + " attempts");
    }
}
