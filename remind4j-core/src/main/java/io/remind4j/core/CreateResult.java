package io.remind4j.core;

import java.util.List;

public record CreateResult(
        String scheduleId,
        List<String> errors
) {

    public CreateResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static CreateResult created(String scheduleId) {
        return new CreateResult(scheduleId, List.of());
    }

    public static CreateResult rejected(List<String> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("rejected result needs at least one error");
        }
        return new CreateResult(null, errors);
    }

    public boolean isCreated() {
        return scheduleId != null;
    }
}
