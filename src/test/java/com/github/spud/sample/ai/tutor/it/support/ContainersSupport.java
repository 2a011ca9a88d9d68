package com.github.spud.sample.ai.tutor.it.support;

import lombok.extern.slf4j.Slf4j;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * Testcontainers support for integration tests
 * Provides a production-like Postgres (with pgvector) and points Spring AI at the OpenAI mock
 */
@Slf4j
public abstract class ContainersSupport {

  // Shared across all tests (start once per JVM)
  private static final PostgreSQLContainer<?> POSTGRES;

  static {
    POSTGRES = new PostgreSQLContainer<>(DockerImageName.parse("pgvector/pgvector:pg16")
      .asCompatibleSubstituteFor("postgres"))
      .withDatabaseName("tutor_test")
      .withUsername("tutor_test")
      .withPassword("tutor_test")
      .withReuse(true);

    log.info("Starting Testcontainers: Postgres");
    POSTGRES.start();
    log.info("Testcontainers started: Postgres at {}", POSTGRES.getJdbcUrl());
  }

  @DynamicPropertySource
  static void configureContainers(DynamicPropertyRegistry registry) {
    registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
    registry.add("spring.datasource.username", POSTGRES::getUsername);
    registry.add("spring.datasource.password", POSTGRES::getPassword);

    // Spring AI appends /v1/chat/completions to the base url
    String mockServerUrl = OpenAiMockSupport.getServer().url("").toString();
    if (mockServerUrl.endsWith("/")) {
      mockServerUrl = mockServerUrl.substring(0, mockServerUrl.length() - 1);
    }
    final String finalUrl = mockServerUrl;
    registry.add("spring.ai.openai.base-url", () -> finalUrl);

    log.info("Injected container properties: DB={}, OpenAI MockServer={}",
      POSTGRES.getJdbcUrl(), finalUrl);
  }

  public static PostgreSQLContainer<?> getPostgres() {
    return POSTGRES;
  }
}
