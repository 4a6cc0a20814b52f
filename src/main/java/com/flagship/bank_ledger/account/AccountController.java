package com.flagship.bank_ledger.account;

import com.flagship.bank_ledger.account.dto.AccountResponse;
import com.flagship.bank_ledger.account.dto.CreateAccountRequest;
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

@RestController
@RequiredArgsConstructor
@Slf4j
public class AccountController {

    private final AccountService accountService;

    @PostMapping("/accounts")
    public ResponseEntity<AccountResponse> createAccount(@Valid @RequestBody CreateAccountRequest request) {
        log.info("Received account creation request: userId={}", request.getUserId());
        Account account = accountService.createAccount(request.getUserId());
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }

    @GetMapping("/accounts/{id}")
    public ResponseEntity<AccountResponse> getAccount(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(AccountResponse.from(accountService.getAccount(id)));
    }

    @GetMapping("/users/{userId}/accounts")
    public ResponseEntity<List<AccountResponse>> getAccountsForUser(@PathVariable("userId") UUID userId) {
        List<AccountResponse> accounts = accountService.getAccountsForUser(userId).stream()
            .map(AccountResponse::from)
            .toList();
        return ResponseEntity.ok(accounts);
    }
}
