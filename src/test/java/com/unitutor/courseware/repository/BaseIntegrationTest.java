package com.unitutor.courseware.repository;

import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest(properties = {
    "app.gemini.api-key=fake-key-value-for-testing",
    "app.pipeline.page-delay=0s",
    "app.storage.upload-dir=${java.io.tmpdir}/courseware-test-uploads",
    "app.worker.stale-check-interval-ms=3600000"
})
@Testcontainers(disabledWithoutDocker = true)
public abstract class BaseIntegrationTest {

    // shared by every context, stopped by the Ryuk reaper at JVM exit
    @ServiceConnection
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine");

    static {
        if (DockerClientFactory.instance().isDockerAvailable()) {
            postgres.start();
        }
    }
}
