package com.flagship.bank_transfer.api.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bank_transfer.ledger.Transfer;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TransferResponse {

    @JsonProperty("transfer_id")
    String transferId;

    @JsonProperty("from_user")
    String fromUser;

    @JsonProperty("to_user")
    String toUser;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @JsonProperty("fee")
    BigDecimal fee;

    @JsonProperty("reference")
    String reference;

    @JsonProperty("status")
    String status;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static TransferResponse from(Transfer transfer) {
        return new TransferResponse(
            transfer.getTransferId(),
            transfer.getFromUser(),
            transfer.getToUser(),
            transfer.getAmount(),
            transfer.getFee(),
            transfer.getReference(),
            transfer.getStatus().name(),
            transfer.getReason(),
            transfer.getCreatedAt(),
            transfer.getUpdatedAt()
        );
    }
}
