package org.mides.routing.model;

import lombok.Getter;

@Getter
public enum Priority {
    HIGH(1),
    MEDIUM(2),
    LOW(3);

    private final int level;

    Priority(int level) {
        this.level = level;
    }

    public static Priority fromLevel(int level) {
        for (Priority priority : values()) {
            if (priority.level == level)
                return priority;
        }
        throw new IllegalArgumentException("priority must be between 1 and 3 but got " + level);
    }
}
