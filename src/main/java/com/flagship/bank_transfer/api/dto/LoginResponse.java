package com.flagship.bank_transfer.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class LoginResponse {

    @JsonProperty("token")
    String token;

    @JsonProperty("username")
    String username;
}
