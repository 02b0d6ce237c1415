package io.taro.assetstore.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class AppConfig {

    @Bean
    @ConfigurationProperties(prefix = "store")
    public Store store() {
        return new Store();
    }

    @Data
    public static class Store {

        /**
         * Deadline for one batch import, including commit
         */
        private Duration txTimeout = Duration.ofSeconds(30);

        /**
         * What to do when a raw key is stored again with a different family/index
         */
        private KeyConflictPolicy internalKeyConflict = KeyConflictPolicy.KEEP_FIRST;
    }

    public enum KeyConflictPolicy {

        /**
         * Keep the family/index written first and log the mismatch
         */
        KEEP_FIRST,

        /**
         * Fail the import. Keys taken from proofs, whose path is unknown, never conflict
         */
        REJECT
    }
}
