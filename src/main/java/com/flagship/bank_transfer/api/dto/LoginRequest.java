package com.flagship.bank_transfer.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.Value;

/**
 * Blank or overlong usernames are not rejected here: they fail like any other bad login.
 */
@Value
public class LoginRequest {

    @JsonProperty("username")
    String username;

    @Size(max = 128, message = "Password must be at most 128 characters")
    @JsonProperty("password")
    String password;
}
