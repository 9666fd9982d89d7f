package com.cred.freestyle.jewelryauction;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for the jewelry consignment auction.
 *
 * System Overview:
 * - Sellers consign jewelry through a staged sell-request workflow
 * - Staff assemble approved items into auction sessions as numbered lots
 * - Enrolled members bid on open lots; bids are serialized per lot
 * - Closing a lot settles it into a buyer payment and a seller payout
 * - Payments, payouts and refunds are dispatched to the gateway via Kafka
 *
 * Architecture:
 * - API Layer: REST controllers with validation
 * - Service Layer: Workflow, bidding and settlement rules
 * - Data Access Layer: JPA repositories with pessimistic row locks
 * - Infrastructure Layer: Kafka messaging, Redis rate limiting, CloudWatch metrics
 *
 * @author Jewelry Auction Team
 */
@SpringBootApplication
@EnableJpaRepositories
@EnableTransactionManagement
@EnableKafka
public class JewelryAuctionApplication {

    public static void main(String[] args) {
        SpringApplication.run(JewelryAuctionApplication.class, args);
    }
}
