package com.travel.tripgraph.graph.node;

/**
 * The six activity fields of an annotated day plan, in the order they are written.
 * Meal slots carry the meal_type tag stored on their Meal node.
 */
public enum ActivitySlot {

    TRANSPORTATION("transportation", ActivityKind.TRANSPORTATION, null),
    BREAKFAST("breakfast", ActivityKind.MEAL, "Breakfast"),
    LUNCH("lunch", ActivityKind.MEAL, "Lunch"),
    DINNER("dinner", ActivityKind.MEAL, "Dinner"),
    ATTRACTION("attraction", ActivityKind.ATTRACTION, null),
    ACCOMMODATION("accommodation", ActivityKind.ACCOMMODATION, null);

    private final String fieldName;
    private final ActivityKind kind;
    private final String mealType;

    ActivitySlot(String fieldName, ActivityKind kind, String mealType) {
        this.fieldName = fieldName;
        this.kind = kind;
        this.mealType = mealType;
    }

    /**
     * Key of this slot inside an annotated_plan day entry
     */
    public String getFieldName() {
        return fieldName;
    }

    public ActivityKind getKind() {
        return kind;
    }

    /**
     * Breakfast/Lunch/Dinner for meal slots, null otherwise
     */
    public String getMealType() {
        return mealType;
    }
}
