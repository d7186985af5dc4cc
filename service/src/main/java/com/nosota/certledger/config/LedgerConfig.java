package com.nosota.certledger.config;

import com.nosota.certledger.chain.Chain;
import com.nosota.certledger.chain.TransactionPool;
import com.nosota.certledger.crypto.AddressGenerator;
import com.nosota.certledger.crypto.ContentHasher;
import com.nosota.certledger.crypto.RandomAddressGenerator;
import com.nosota.certledger.service.GasModel;
import com.nosota.certledger.service.TransactionStatusStateMachine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;

/**
 * Wires the in-memory chain.
 *
 * <p>The chain is a singleton for the lifetime of the process and starts from genesis on
 * every restart; only institutions and certificates survive in the database.
 */
@Configuration
public class LedgerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TransactionPool transactionPool() {
        return new TransactionPool();
    }

    @Bean
    public Chain chain(TransactionPool transactionPool,
                       ContentHasher contentHasher,
                       GasModel gasModel,
                       TransactionStatusStateMachine statusStateMachine,
                       Clock clock,
                       @Value("${ledger.gas.price:20000000000}") long gasPrice,
                       @Value("${ledger.block.gas-limit:8000000}") long blockGasLimit) {
        return new Chain(transactionPool, contentHasher, gasModel, statusStateMachine,
                clock, gasPrice, blockGasLimit);
    }

    @Bean
    public AddressGenerator addressGenerator() {
        return new RandomAddressGenerator(new SecureRandom());
    }
}
