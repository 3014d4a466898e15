package io.nexus.server.validation;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.util.Set;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class ValidQueryValidatorTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setup() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void tearDown() {
        factory.close();
    }

    record QueryDto(@ValidQuery String query) {}

    record ShortQueryDto(@ValidQuery(maxLength = 8) String query) {}

    @Test
    void shouldAcceptOrdinaryQuery() {
        assertThat(validator.validate(new QueryDto("What is 2 + 2?"))).isEmpty();
    }

    @Test
    void shouldAcceptTabsAndNewlines() {
        assertThat(validator.validate(new QueryDto("line one\n\tline two\r\n"))).isEmpty();
    }

    @Test
    void shouldRejectNullQuery() {
        assertSingleViolation(validator.validate(new QueryDto(null)), "Query is required");
    }

    @Test
    void shouldRejectBlankQuery() {
        assertSingleViolation(validator.validate(new QueryDto("  \t ")), "Query is required");
    }

    @Test
    void shouldRejectOverlongQuery() {
        assertSingleViolation(
                validator.validate(new ShortQueryDto("x".repeat(9))), "Query exceeds 8 characters");
    }

    @Test
    void shouldAcceptQueryAtExactLimit() {
        assertThat(validator.validate(new ShortQueryDto("x".repeat(8)))).isEmpty();
    }

    @Test
    void shouldApplyDefaultLimit() {
        String oversized = "x".repeat(InputValidator.MAX_QUERY_LENGTH + 1);
        assertSingleViolation(
                validator.validate(new QueryDto(oversized)), "Query exceeds 10000 characters");
    }

    @Test
    void shouldRejectControlCharacters() {
        assertSingleViolation(
                validator.validate(new QueryDto("hello\0world")),
                "Query contains illegal control characters");
    }

    private static <T> void assertSingleViolation(
            Set<ConstraintViolation<T>> violations, String expectedMessage) {
        assertThat(violations).hasSize(1);
        assertThat(violations.iterator().next().getMessage()).isEqualTo(expectedMessage);
    }
}
