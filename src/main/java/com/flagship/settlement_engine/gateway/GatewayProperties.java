package com.flagship.settlement_engine.gateway;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "settlement.gateway")
public class GatewayProperties {

    private String baseUrl = "https://sandbox.monnify.com";
    private String apiKey;
    /** Also the webhook signing secret. */
    private String secretKey;
    private String contractCode;
    /** Wallet that funds payouts. */
    private String walletAccountNumber;
    private String currency = "NGN";
    private Duration connectTimeout = Duration.ofSeconds(3);
    private Duration readTimeout = Duration.ofSeconds(10);
    /** Refresh the access token this long before the gateway says it expires. */
    private Duration tokenRefreshMargin = Duration.ofSeconds(60);
}
