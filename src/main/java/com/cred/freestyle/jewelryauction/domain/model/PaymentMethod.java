package com.cred.freestyle.jewelryauction.domain.model;

/**
 * Payment instruments accepted from buyers.
 *
 * @author Jewelry Auction Team
 */
public enum PaymentMethod {
    CREDIT_CARD,
    DEBIT_CARD,
    BANK_TRANSFER,
    DIGITAL_WALLET,
    CASH
}
