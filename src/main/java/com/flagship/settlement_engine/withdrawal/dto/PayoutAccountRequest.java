package com.flagship.settlement_engine.withdrawal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class PayoutAccountRequest {

    @NotBlank(message = "Bank code is required")
    @Pattern(regexp = "^[0-9A-Za-z]{3,10}$", message = "Bank code must be 3 to 10 alphanumeric characters")
    @JsonProperty("bank_code")
    private String bankCode;

    @NotBlank(message = "Account number is required")
    @Pattern(regexp = "^[0-9]{10}$", message = "Account number must be 10 digits")
    @JsonProperty("account_number")
    private String accountNumber;
}
