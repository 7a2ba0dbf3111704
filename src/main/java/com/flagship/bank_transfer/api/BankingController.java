package com.flagship.bank_transfer.api;

import com.flagship.bank_transfer.api.dto.BalanceResponse;
import com.flagship.bank_transfer.api.dto.LoginRequest;
import com.flagship.bank_transfer.api.dto.LoginResponse;
import com.flagship.bank_transfer.api.dto.SubmitTransferRequest;
import com.flagship.bank_transfer.api.dto.TransferResponse;
import com.flagship.bank_transfer.api.dto.TransferResultResponse;
import com.flagship.bank_transfer.facade.BankingFacade;
import com.flagship.bank_transfer.transfer.TransferResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * HTTP transport over {@link BankingFacade}.
 *
 * The session token travels as {@code Authorization: Bearer <token>}. A missing
 * header is passed through as a null token so the facade reports it as
 * {@code UNAUTHORIZED}. A transfer that fails for insufficient funds is a
 * reported outcome: it comes back as 422 with the FAILED result in the body.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class BankingController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    private static final String BEARER_PREFIX = "Bearer ";

    private final BankingFacade facade;

    @PostMapping("/sessions")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        String token = facade.login(request.getUsername(), request.getPassword());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new LoginResponse(token, request.getUsername()));
    }

    @DeleteMapping("/sessions")
    public ResponseEntity<Void> logout(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        facade.logout(bearerToken(authorization));
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/balance")
    public BalanceResponse getBalance(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return new BalanceResponse(facade.getBalance(bearerToken(authorization)));
    }

    @PostMapping("/transfers")
    public ResponseEntity<TransferResultResponse> submitTransfer(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @RequestBody(required = false) SubmitTransferRequest request) {
        String token = bearerToken(authorization);
        SubmitTransferRequest body = request != null ? request : new SubmitTransferRequest(null, null, null);

        TransferResult result = facade.submitTransfer(token, body.getRecipient(), body.getAmount(),
                body.getReference(), idempotencyKey);

        HttpStatus status = result.isCompleted() ? HttpStatus.CREATED : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(TransferResultResponse.from(result));
    }

    @GetMapping("/transfers/{transferId}")
    public TransferResponse getTransfer(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable("transferId") String transferId) {
        return TransferResponse.from(facade.getTransferStatus(bearerToken(authorization), transferId));
    }

    @GetMapping("/transfers")
    public List<TransferResponse> listTransfers(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return facade.listTransfers(bearerToken(authorization))
                .stream()
                .map(TransferResponse::from)
                .toList();
    }

    static String bearerToken(String authorization) {
        if (authorization == null || authorization.isBlank()) {
            return null;
        }
        String value = authorization.trim();
        if (value.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return value.substring(BEARER_PREFIX.length()).trim();
        }
        return value;
    }
}
