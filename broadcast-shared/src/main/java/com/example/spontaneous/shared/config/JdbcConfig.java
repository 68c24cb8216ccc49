package com.example.spontaneous.shared.config;

import com.example.spontaneous.shared.converter.TimestampToOffsetDateTimeConverter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.transaction.TransactionManagerCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jdbc.core.convert.JdbcCustomConversions;
import org.springframework.transaction.support.AbstractPlatformTransactionManager;

import java.util.List;

@Configuration
@Slf4j
public class JdbcConfig {

    @Bean
    public JdbcCustomConversions jdbcCustomConversions() {
        return new JdbcCustomConversions(List.of(
            new TimestampToOffsetDateTimeConverter()
        ));
    }

    /**
     * Bounds every store transaction; a transaction running past it fails with
     * {@code TransactionTimedOutException} and the caller sees 503.
     */
    @Bean
    public TransactionManagerCustomizer<AbstractPlatformTransactionManager> transactionTimeoutCustomizer(AppProperties appProperties) {
        return transactionManager -> {
            int timeoutSeconds = (int) Math.max(1, appProperties.getStore().getTransactionTimeout().toSeconds());
            log.info("Store transaction timeout set to {}s", timeoutSeconds);
            transactionManager.setDefaultTimeout(timeoutSeconds);
        };
    }
}
