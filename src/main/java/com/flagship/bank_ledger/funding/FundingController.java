package com.flagship.bank_ledger.funding;

import com.flagship.bank_ledger.account.Account;
import com.flagship.bank_ledger.funding.dto.AddFundsRequest;
import com.flagship.bank_ledger.funding.dto.FundingResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@Slf4j
public class FundingController {

    private final FundingService fundingService;

    @PostMapping("/addmoney")
    public ResponseEntity<FundingResponse> addMoney(@Valid @RequestBody AddFundsRequest request) {
        log.info("Received funding request: accountId={}, amount={}", request.getAccountId(), request.getAmount());
        Account account = fundingService.addFunds(request.getAccountId(), request.getAmount());
        return ResponseEntity.ok(FundingResponse.from(account));
    }
}
