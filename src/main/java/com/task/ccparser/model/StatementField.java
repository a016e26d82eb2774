package com.task.ccparser.model;

import java.util.Arrays;
import java.util.List;

/**
 * The six fields requested from the model, in prompt order.
 */
public enum StatementField {

    ISSUER("issuer", "bank name", false),
    CARD_LAST4("card_last4", "last 4 digits of card number", true),
    STATEMENT_DATE("statement_date", "billing cycle or statement period", true),
    DUE_DATE("due_date", "payment due date", true),
    TOTAL_BALANCE("total_balance", "total amount due or outstanding balance", true),
    MINIMUM_PAYMENT("minimum_payment", "minimum payment amount", true);

    private final String key;
    private final String description;
    private final boolean required;

    StatementField(String key, String description, boolean required) {
        this.key = key;
        this.description = description;
        this.required = required;
    }

    public String key() {
        return key;
    }

    public String description() {
        return description;
    }

    /**
     * Whether the field counts towards the success rate. Issuer is always derivable from
     * keyword rules so it is left out.
     */
    public boolean required() {
        return required;
    }

    public static List<StatementField> requiredFields() {
        return Arrays.stream(values()).filter(StatementField::required).toList();
    }
}
