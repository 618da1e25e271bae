package com.lendingpool.config;

/**
 * Centralized Kafka topic names.
 */
public class KafkaTopics {

    // Deposits, withdrawals, borrows, repayments, reserve withdrawals
    public static final String LENDING_ACTIVITY = "lending.activity";

    // Liquidations get their own topic so risk monitors can subscribe to just these
    public static final String LENDING_LIQUIDATIONS = "lending.liquidations";

    private KafkaTopics() {
    }
}
