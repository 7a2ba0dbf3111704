package com.flagship.bank_transfer.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Transfer submission. The amount is exact-decimal text, e.g. {@code "100.00"};
 * it is validated by the transfer engine after the session check, so this DTO
 * carries no constraints.
 */
@Value
public class SubmitTransferRequest {

    @JsonProperty("recipient")
    String recipient;

    @JsonProperty("amount")
    String amount;

    @JsonProperty("reference")
    String reference;
}
