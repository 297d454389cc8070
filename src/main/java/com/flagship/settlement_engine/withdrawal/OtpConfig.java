package com.flagship.settlement_engine.withdrawal;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OtpConfig {

    @Bean
    @ConditionalOnMissingBean(OtpSender.class)
    public OtpSender otpSender() {
        return new LoggingOtpSender();
    }
}
