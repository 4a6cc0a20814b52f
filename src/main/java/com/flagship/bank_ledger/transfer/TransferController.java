package com.flagship.bank_ledger.transfer;

import com.flagship.bank_ledger.transfer.dto.TransactionResponse;
import com.flagship.bank_ledger.transfer.dto.TransferRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * HTTP entry points for transfers and per-account transaction history.
 *
 * Failures are thrown as typed ledger exceptions and rendered by
 * {@link com.flagship.bank_ledger.exception.GlobalExceptionHandler}.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class TransferController {

    private final TransferService transferService;

    @PostMapping("/transactions")
    public ResponseEntity<TransactionResponse> transfer(@Valid @RequestBody TransferRequest request) {
        log.info("Received transfer request: from={}, to={}, amount={}",
                request.getFromAccount(), request.getToAccount(), request.getAmount());

        TransactionRecord record = transferService.transfer(
            request.getFromAccount(),
            request.getToAccount(),
            request.getAmount()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(record));
    }

    @GetMapping("/accounts/{id}/transactions")
    public ResponseEntity<List<TransactionResponse>> history(@PathVariable("id") UUID accountId) {
        List<TransactionResponse> records = transferService.history(accountId).stream()
            .map(TransactionResponse::from)
            .toList();
        return ResponseEntity.ok(records);
    }
}
