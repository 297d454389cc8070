package com.flagship.settlement_engine.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "settlement")
public class SettlementProperties {

    private final Fees fees = new Fees();
    private final Maturation maturation = new Maturation();
    private final Reconciliation reconciliation = new Reconciliation();
    private final Withdrawal withdrawal = new Withdrawal();
    private final CheckIn checkIn = new CheckIn();
    private final Idempotency idempotency = new Idempotency();
    private final Kafka kafka = new Kafka();

    @Getter
    @Setter
    public static class Fees {
        /** Share of each sale kept by the platform. */
        private BigDecimal platformRate = new BigDecimal("0.05");
    }

    @Getter
    @Setter
    public static class Maturation {
        /** How long a sale stays in the pending bucket before it can be withdrawn. */
        private Duration holdingPeriod = Duration.ofHours(24);
    }

    @Getter
    @Setter
    public static class Reconciliation {
        private Duration staleAfter = Duration.ofMinutes(5);
        private int batchSize = 100;
    }

    @Getter
    @Setter
    public static class Withdrawal {
        private BigDecimal minimumAmount = new BigDecimal("1000");
        private BigDecimal maximumAmount = new BigDecimal("10000000");
        private Duration otpTtl = Duration.ofMinutes(10);
        private int maxOtpAttempts = 5;
        /** Withdrawals stuck in PROCESSING longer than this are re-checked with the gateway. */
        private Duration payoutStatusCheckAfter = Duration.ofMinutes(2);
    }

    @Getter
    @Setter
    public static class CheckIn {
        private Duration opensBeforeStart = Duration.ofHours(5);
        private Duration closesAfterEnd = Duration.ofHours(24);
    }

    @Getter
    @Setter
    public static class Idempotency {
        private boolean redisEnabled = true;
    }

    @Getter
    public static class Kafka {
        private final Topics topics = new Topics();

        @Getter
        @Setter
        public static class Topics {
            private String payments = "settlement.payments";
            private String tickets = "settlement.tickets";
            private String refunds = "settlement.refunds";
            private String withdrawals = "settlement.withdrawals";
        }
    }
}
