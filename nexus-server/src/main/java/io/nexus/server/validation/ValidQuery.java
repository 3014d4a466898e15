package io.nexus.server.validation;

import static java.lang.annotation.ElementType.*;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;
import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

/// Validates a natural-language query submitted to the router.
///
/// A valid query:
/// - Is not null or blank
/// - Does not exceed {@link #maxLength()} characters
/// - Contains no dangerous control characters
///
/// ### Usage
/// ```java
/// public record QueryRequest(@ValidQuery String query) {}
/// ```
///
/// @see ValidQueryValidator
/// @see InputValidator
@Target({FIELD, PARAMETER, RECORD_COMPONENT, TYPE_USE})
@Retention(RUNTIME)
@Constraint(validatedBy = ValidQueryValidator.class)
@Documented
public @interface ValidQuery {

    String message() default "invalid query";

    /// Maximum allowed length in characters. Defaults to 10000.
    int maxLength() default InputValidator.MAX_QUERY_LENGTH;

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
