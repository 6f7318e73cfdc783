package com.logvault;

import com.logvault.ingestion.IngestionPipeline;
import com.logvault.ingestion.IngestionRunner;
import com.logvault.observability.IngestionMetrics;
import com.logvault.query.WebClientLogSearchTransport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Application context")
class LogVaultApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Test
    void wiresPipelineWithoutRunningIt() {
        assertThat(context.getBean(IngestionPipeline.class)).isNotNull();
        assertThat(context.getBean(WebClientLogSearchTransport.class)).isNotNull();
        assertThat(context.getBean(IngestionMetrics.class)).isNotNull();
        assertThat(context.getBeansOfType(IngestionRunner.class)).isEmpty();
    }
}
