package io.mapperxform.core.template;

import java.util.Optional;

/**
 * Outcome of {@link TemplateParams#validate(String)}.
 *
 * @param valid {@code true} if the template is usable
 * @param error reason the template was rejected, {@code null} when valid
 */
public record TemplateValidation(boolean valid, String error) {

    private static final TemplateValidation OK = new TemplateValidation(true, null);

    public static TemplateValidation ok() {
        return OK;
    }

    public static TemplateValidation invalid(String error) {
        return new TemplateValidation(false, error);
    }

    /** The rejection reason, empty when valid. */
    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }
}
