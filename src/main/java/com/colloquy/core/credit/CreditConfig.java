package com.colloquy.core.credit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;

/**
 * Credit ledger, pricing table and estimators.
 * <p>
 * When a {@link DataSource} is available the ledger lives in the database; otherwise an
 * in-memory ledger is used, which loses balances on restart.
 */
@Configuration
public class CreditConfig {

    private static final Logger log = LoggerFactory.getLogger(CreditConfig.class);

    @Bean
    public CreditLedger creditLedger(ObjectProvider<DataSource> dataSource) throws SQLException {
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) {
            log.info("No DataSource available; using in-memory credit ledger (balances will not persist across restarts)");
            return new InMemoryCreditLedger();
        }
        log.info("Configuring JDBC credit ledger");
        var ledger = new JdbcCreditLedger(ds);
        ledger.createTables();
        return ledger;
    }

    @Bean
    public PricingCatalog pricingCatalog(CreditProperties properties) {
        var catalog = new DefaultPricingCatalog(properties.pricingOverrides());
        log.info("Pricing catalog loaded with {} models", catalog.all().size());
        return catalog;
    }

    @Bean
    public TokenEstimator tokenEstimator() {
        return TokenEstimator.charactersPerToken();
    }

    @Bean
    public InputLengthEstimator inputLengthEstimator(CreditProperties properties) {
        return InputLengthEstimator.fixed(properties.getEstimatedInputCharacters());
    }
}
