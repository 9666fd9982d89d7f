package com.cred.freestyle.jewelryauction.api.controller;

import com.cred.freestyle.jewelryauction.api.dto.CreateFeeScheduleRequest;
import com.cred.freestyle.jewelryauction.api.dto.FeeScheduleResponse;
import com.cred.freestyle.jewelryauction.domain.model.TransactionFee;
import com.cred.freestyle.jewelryauction.security.SecurityUtils;
import com.cred.freestyle.jewelryauction.service.FeeCalculator.FeeSchedule;
import com.cred.freestyle.jewelryauction.service.TransactionFeeService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

/**
 * Buyer premium and seller commission schedules.
 *
 * @author Jewelry Auction Team
 */
@RestController
@RequestMapping("/api/v1/fees")
@PreAuthorize("isAuthenticated()")
public class FeeController {

    private final TransactionFeeService transactionFeeService;

    public FeeController(TransactionFeeService transactionFeeService) {
        this.transactionFeeService = transactionFeeService;
    }

    /**
     * Install a new schedule. The previous active schedule is deactivated; existing
     * settlements keep the schedule they were priced with.
     */
    @PostMapping
    public ResponseEntity<FeeScheduleResponse> create(@Valid @RequestBody CreateFeeScheduleRequest request) {
        TransactionFee fee = transactionFeeService.createSchedule(request, SecurityUtils.currentActor());
        return ResponseEntity.status(HttpStatus.CREATED).body(FeeScheduleResponse.from(FeeSchedule.from(fee)));
    }

    @GetMapping("/active")
    public ResponseEntity<FeeScheduleResponse> active() {
        return ResponseEntity.ok(FeeScheduleResponse.from(transactionFeeService.activeSchedule()));
    }
}
