package com.catalogsync;

import com.catalogsync.worldcat.auth.TokenLifecycleManager;
import com.catalogsync.worldcat.config.WorldCatProperties;
import com.catalogsync.worldcat.job.CatalogOperations;
import io.github.resilience4j.ratelimiter.RateLimiter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class CatalogSyncApplicationTest {

    @Autowired private CatalogOperations catalogOperations;
    @Autowired private TokenLifecycleManager tokenLifecycleManager;
    @Autowired private WorldCatProperties properties;
    @Autowired @Qualifier("worldcatRateLimiter") private RateLimiter rateLimiter;

    @Test
    void contextLoads_withTestProfile() {
        assertThat(catalogOperations).isNotNull();
        assertThat(tokenLifecycleManager).isNotNull();
        assertThat(properties.getInstitutionSymbol()).isEqualTo("TST");
        assertThat(properties.getMaxRecordsPerRequest()).isEqualTo(50);
        assertThat(rateLimiter.getRateLimiterConfig().getLimitForPeriod()).isEqualTo(10);
    }
}
