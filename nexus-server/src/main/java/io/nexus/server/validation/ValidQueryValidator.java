package io.nexus.server.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

/// Validates a query string against the rules of {@link ValidQuery}.
///
/// Each failing condition produces a distinct violation message.
///
/// @see InputValidator
public class ValidQueryValidator implements ConstraintValidator<ValidQuery, String> {

    private int maxLength;

    @Override
    public void initialize(ValidQuery annotation) {
        this.maxLength = annotation.maxLength();
    }

    @Override
    public boolean isValid(String value, ConstraintValidatorContext ctx) {
        if (value == null || value.isBlank()) {
            replaceMessage(ctx, "Query is required");
            return false;
        }

        if (InputValidator.exceedsLength(value, maxLength)) {
            replaceMessage(ctx, "Query exceeds " + maxLength + " characters");
            return false;
        }

        if (InputValidator.containsDangerousChars(value)) {
            replaceMessage(ctx, "Query contains illegal control characters");
            return false;
        }

        return true;
    }

    private static void replaceMessage(ConstraintValidatorContext ctx, String message) {
        ctx.disableDefaultConstraintViolation();
        ctx.buildConstraintViolationWithTemplate(message).addConstraintViolation();
    }
}
