package io.fieldledger.core.payload;

import java.util.Set;

public record MealsServedIncrement(Long count, String location, String mealType) implements Payload, CounterDelta {
    public static final Set<String> MEAL_TYPES = Set.of("breakfast", "lunch", "dinner", "snack");

    @Override public String target() { return "metric:meals_served"; }
    @Override public long delta() { return count; }

    @Override
    public void validate(int schemaVersion) {
        Fields.requirePositive(count, "count");
        Fields.optionalOneOf(mealType, "mealType", MEAL_TYPES);
    }
}
