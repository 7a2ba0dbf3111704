package com.flagship.bank_transfer.api.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bank_transfer.transfer.TransferResult;
import lombok.Value;

import java.math.BigDecimal;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TransferResultResponse {

    @JsonProperty("transfer_id")
    String transferId;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @JsonProperty("fee")
    BigDecimal fee;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @JsonProperty("new_balance")
    BigDecimal newBalance;

    @JsonProperty("status")
    String status;

    @JsonProperty("reason")
    String reason;

    public static TransferResultResponse from(TransferResult result) {
        return new TransferResultResponse(
            result.getTransferId(),
            result.getFee(),
            result.getNewSenderBalance(),
            result.getStatus().name(),
            result.getReason()
        );
    }
}
