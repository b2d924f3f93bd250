package net.gridcollate;

import net.gridcollate.config.CollateProperties;
import net.gridcollate.service.image.DctPerceptualHasher;
import net.gridcollate.service.image.PerceptualHasher;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

/**
 * Application context smoke test. The runner is disabled so no collation starts.
 */
@SpringBootTest(properties = {
    "collate.run-on-startup=false",
    "collate.worker-threads=2",
    "collate.grid-rows=3"
})
@ActiveProfiles("test")
class GridCollateApplicationTests {

    @Autowired
    @Qualifier("featureExtractionExecutor")
    private ThreadPoolTaskExecutor featureExtractionExecutor;

    @Autowired
    private PerceptualHasher perceptualHasher;

    @Autowired
    private CollateProperties properties;

    @Test
    void contextLoads() {
        // passes when every bean wires up
    }

    @Test
    void should_SizeExtractionPool_When_WorkerThreadsConfigured() {
        assertEquals("FeatureExtract-", featureExtractionExecutor.getThreadNamePrefix());
        assertEquals(2, featureExtractionExecutor.getCorePoolSize());
        assertEquals(2, featureExtractionExecutor.getMaxPoolSize());
    }

    @Test
    void should_BindCollateProperties_When_ContextLoads() {
        assertEquals(3, properties.getGridRows());
        assertEquals(4, properties.getGridCols());
        assertFalse(properties.isRunOnStartup());
        assertInstanceOf(DctPerceptualHasher.class, perceptualHasher);
    }
}
