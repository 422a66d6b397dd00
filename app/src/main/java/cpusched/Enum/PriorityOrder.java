package cpusched.Enum;

import java.util.Comparator;

/**
 * Which end of the priority scale wins.
 */
public enum PriorityOrder {
    /** 0 beats 1 (the usual textbook convention) */
    LOWER_IS_HIGHER,
    HIGHER_IS_HIGHER;

    /**
     * Orders priorities so that the best one sorts first.
     */
    public Comparator<Integer> bestFirst() {
        return this == LOWER_IS_HIGHER ? Comparator.naturalOrder() : Comparator.reverseOrder();
    }
}
