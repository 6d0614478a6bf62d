package com.shlawgathon.specmerge.backend;

import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;

/**
 * Base class for E2E tests with TestContainers MongoDB.
 * One replica-set container is shared by every test class, so the cached Spring
 * context never points at a stopped container.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
public abstract class BaseE2ETest {

    static final MongoDBContainer mongoDBContainer = new MongoDBContainer("mongo:7.0");

    static {
        mongoDBContainer.start();
    }

    @DynamicPropertySource
    static void setProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongoDBContainer::getReplicaSetUrl);
        registry.add("spring.data.mongodb.database", () -> "specmerge-test");
        registry.add("spring.security.oauth2.client.registration.github.client-id", () -> "test-client-id");
        registry.add("spring.security.oauth2.client.registration.github.client-secret", () -> "test-client-secret");
        registry.add("ingestion.api.key", () -> "");
    }
}
