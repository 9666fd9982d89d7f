package com.cred.freestyle.jewelryauction.service;

import com.cred.freestyle.jewelryauction.repository.AuctionSessionRepository;
import com.cred.freestyle.jewelryauction.repository.JewelryItemRepository;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.function.Predicate;

/**
 * Generates human-facing codes for jewelry items (JWL + 7 digits) and sessions (AUC + 5 digits).
 * Codes are drawn at random and re-drawn while taken; the unique column still guards the race.
 *
 * @author Jewelry Auction Team
 */
@Component
public class CodeGenerator {

    static final String JEWELRY_PREFIX = "JWL";
    static final String SESSION_PREFIX = "AUC";
    private static final int MAX_ATTEMPTS = 20;

    private final JewelryItemRepository jewelryItemRepository;
    private final AuctionSessionRepository sessionRepository;
    private final SecureRandom random = new SecureRandom();

    public CodeGenerator(JewelryItemRepository jewelryItemRepository,
                         AuctionSessionRepository sessionRepository) {
        this.jewelryItemRepository = jewelryItemRepository;
        this.sessionRepository = sessionRepository;
    }

    public String nextJewelryCode() {
        return next(JEWELRY_PREFIX, 7, jewelryItemRepository::existsByCode);
    }

    public String nextSessionCode() {
        return next(SESSION_PREFIX, 5, sessionRepository::existsByCode);
    }

    private String next(String prefix, int digits, Predicate<String> taken) {
        int bound = (int) Math.pow(10, digits);
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            String candidate = prefix + String.format("%0" + digits + "d", random.nextInt(bound));
            if (!taken.test(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException("Could not generate a free " + prefix + " code after "
                + MAX_ATTEMPTS + " attempts");
    }
}
