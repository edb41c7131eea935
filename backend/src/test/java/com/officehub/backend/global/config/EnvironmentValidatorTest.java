package com.officehub.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    private static MockEnvironment validEnvironment() {
        return new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://localhost:5432/officehub")
                .withProperty("jwt.secret", "0123456789abcdef0123456789abcdef-prod")
                .withProperty("jwt.expiration", "900000")
                .withProperty("app.office-zone", "Asia/Seoul");
    }

    @Test
    void acceptsCompleteConfiguration() {
        EnvironmentValidator validator = new EnvironmentValidator(validEnvironment());

        assertThat(validator.collectProblems()).isEmpty();
    }

    @Test
    void reportsEveryProblemAtOnce() {
        MockEnvironment environment = validEnvironment()
                .withProperty("spring.datasource.url", " ")
                .withProperty("jwt.secret", "short")
                .withProperty("jwt.expiration", "soon");

        assertThat(new EnvironmentValidator(environment).collectProblems())
                .containsExactlyInAnyOrder(
                        "spring.datasource.url is missing",
                        "jwt.expiration must be numeric",
                        "jwt.secret must be at least 32 characters");
    }

    @Test
    void rejectsTokenLifetimeOutOfRange() {
        MockEnvironment environment = validEnvironment().withProperty("jwt.expiration", "1000");

        assertThat(new EnvironmentValidator(environment).collectProblems())
                .containsExactly("jwt.expiration must be between 300000 and 86400000 ms");
    }

    @Test
    void prodProfileRequiresOverriddenSecret() {
        MockEnvironment environment = validEnvironment()
                .withProperty("jwt.secret", EnvironmentValidator.DEFAULT_DEV_SECRET);
        environment.setActiveProfiles("prod");

        assertThatThrownBy(() -> new EnvironmentValidator(environment).validateEnvironment())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("prod");
    }
}
