package com.flagship.bank_transfer.api.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class BalanceResponse {

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @JsonProperty("balance")
    BigDecimal balance;
}
