package com.finsight.backend.enums;

/**
 * How a budget is matched to the transactions it constrains.
 */
public enum CategoryMatching {
    /** Match on category id when both sides carry one, otherwise on the exact name. */
    CATEGORY_ID,
    /** Legacy behaviour: case-sensitive equality of the category name. */
    EXACT_NAME
}
