package com.cred.freestyle.jewelryauction.service;

import com.cred.freestyle.jewelryauction.api.dto.CreateFeeScheduleRequest;
import com.cred.freestyle.jewelryauction.domain.model.Role;
import com.cred.freestyle.jewelryauction.domain.model.TransactionFee;
import com.cred.freestyle.jewelryauction.exception.ValidationException;
import com.cred.freestyle.jewelryauction.repository.TransactionFeeRepository;
import com.cred.freestyle.jewelryauction.security.AuthenticatedUser;
import com.cred.freestyle.jewelryauction.security.AuthorizationGate;
import com.cred.freestyle.jewelryauction.service.FeeCalculator.FeeSchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Fee schedule administration. Creating a schedule activates it and retires the previous one.
 *
 * @author Jewelry Auction Team
 */
@Service
public class TransactionFeeService {

    private static final Logger logger = LoggerFactory.getLogger(TransactionFeeService.class);

    private final TransactionFeeRepository transactionFeeRepository;
    private final FeeCalculator feeCalculator;

    public TransactionFeeService(TransactionFeeRepository transactionFeeRepository, FeeCalculator feeCalculator) {
        this.transactionFeeRepository = transactionFeeRepository;
        this.feeCalculator = feeCalculator;
    }

    @Transactional
    public TransactionFee createSchedule(CreateFeeScheduleRequest request, AuthenticatedUser actor) {
        AuthorizationGate.requireAtLeast(actor, Role.ADMIN, "Create fee schedule");
        if (request.getMinFee() != null && request.getMaxFee() != null
                && request.getMinFee().compareTo(request.getMaxFee()) > 0) {
            throw new ValidationException("minFee", "Minimum fee must not exceed maximum fee");
        }

        int retired = transactionFeeRepository.deactivateAll();

        TransactionFee fee = TransactionFee.builder()
                .name(request.getName())
                .buyerPercentage(request.getBuyerPercentage())
                .sellerPercentage(request.getSellerPercentage())
                .minFee(request.getMinFee())
                .maxFee(request.getMaxFee())
                .active(true)
                .build();
        fee = transactionFeeRepository.save(fee);

        logger.info("Fee schedule {} ({}) activated by {}, {} previous schedule(s) retired",
                fee.getFeeId(), fee.getName(), actor.getUserId(), retired);
        return fee;
    }

    @Transactional(readOnly = true)
    public FeeSchedule activeSchedule() {
        return feeCalculator.currentSchedule();
    }
}
