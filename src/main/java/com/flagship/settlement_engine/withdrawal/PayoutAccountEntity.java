package com.flagship.settlement_engine.withdrawal;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "organizer_payout_accounts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PayoutAccountEntity {

    @Id
    @Column(name = "organizer_id", nullable = false, updatable = false)
    private UUID organizerId;

    @Column(name = "bank_code", nullable = false, length = 20)
    private String bankCode;

    @Column(name = "account_number", nullable = false, length = 20)
    private String accountNumber;

    @Column(name = "account_name", nullable = false, length = 200)
    private String accountName;

    @Column(name = "verified_at", nullable = false)
    private Instant verifiedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static PayoutAccountEntity create(UUID organizerId) {
        PayoutAccountEntity entity = new PayoutAccountEntity();
        entity.organizerId = organizerId;
        return entity;
    }

    void apply(PayoutAccount account, Instant now) {
        this.bankCode = account.getBankCode();
        this.accountNumber = account.getAccountNumber();
        this.accountName = account.getAccountName();
        this.verifiedAt = account.getVerifiedAt();
        this.updatedAt = now;
    }

    public PayoutAccount toDomain() {
        return new PayoutAccount(organizerId, bankCode, accountNumber, accountName, verifiedAt);
    }
}
