package com.flagship.settlement_engine.payment;

import com.flagship.settlement_engine.common.exception.ErrorCode;
import com.flagship.settlement_engine.common.exception.SettlementException;
import com.flagship.settlement_engine.ledger.LedgerEntry;
import com.flagship.settlement_engine.ledger.LedgerService;
import com.flagship.settlement_engine.observability.CorrelationContext;
import com.flagship.settlement_engine.ticket.Ticket;
import com.flagship.settlement_engine.ticket.TicketEntity;
import com.flagship.settlement_engine.ticket.TicketRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;

/**
 * Admin-recorded chargebacks. The sale stays in the ledger; a CHARGEBACK entry
 * debits whichever bucket holds it and an unused ticket is cancelled.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChargebackService {

    private final LedgerService ledgerService;
    private final TicketRepository ticketRepository;
    private final Clock clock;

    @Transactional
    public LedgerEntry recordChargeback(UUID ticketId, String reason) {
        try (MDC.MDCCloseable ignored = CorrelationContext.put(CorrelationContext.TICKET_ID_MDC_KEY, ticketId)) {
            Ticket ticket = ticketRepository.findById(ticketId)
                .map(TicketEntity::toDomain)
                .orElseThrow(() -> new SettlementException(ErrorCode.TICKET_NOT_FOUND, "Ticket not found: " + ticketId));

            LedgerEntry entry = ledgerService.recordChargeback(ticketId, reason);

            if (ticket.isActive()) {
                ticketRepository.markCancelled(ticketId, clock.instant());
            }

            log.warn("Chargeback recorded: ticketNumber={}, amount={}, bucket={}, ticketStatusBefore={}",
                ticket.getTicketNumber(), entry.getAmount(), entry.getBalanceBucket(), ticket.getStatus());
            return entry;
        }
    }
}
