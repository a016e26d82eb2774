package com.task.ccparser.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

public record ExtractedFields(
        @JsonProperty("issuer")
        String issuer,

        @JsonProperty("card_last4")
        String cardLast4,

        @JsonProperty("statement_date")
        String statementDate,

        @JsonProperty("due_date")
        String dueDate,

        @JsonProperty("total_balance")
        String totalBalance,

        @JsonProperty("minimum_payment")
        String minimumPayment
) {

    /** Value the model is told to use for anything it cannot locate. */
    public static final String NOT_FOUND = "Not found";

    public String value(StatementField field) {
        return switch (field) {
            case ISSUER -> issuer;
            case CARD_LAST4 -> cardLast4;
            case STATEMENT_DATE -> statementDate;
            case DUE_DATE -> dueDate;
            case TOTAL_BALANCE -> totalBalance;
            case MINIMUM_PAYMENT -> minimumPayment;
        };
    }

    public boolean isFound(StatementField field) {
        String value = value(field);
        return value != null && !value.isBlank() && !NOT_FOUND.equals(value);
    }

    public ExtractedFields withIssuer(String newIssuer) {
        return new ExtractedFields(newIssuer, cardLast4, statementDate, dueDate, totalBalance, minimumPayment);
    }

    public ExtractedFields withAmounts(String newTotalBalance, String newMinimumPayment) {
        return new ExtractedFields(issuer, cardLast4, statementDate, dueDate, newTotalBalance, newMinimumPayment);
    }

    public Map<String, String> asMap() {
        Map<String, String> map = new LinkedHashMap<>();
        for (StatementField field : StatementField.values()) {
            map.put(field.key(), value(field));
        }
        return map;
    }

    public static ExtractedFields fromMap(Map<StatementField, String> values) {
        return new ExtractedFields(
                values.getOrDefault(StatementField.ISSUER, NOT_FOUND),
                values.getOrDefault(StatementField.CARD_LAST4, NOT_FOUND),
                values.getOrDefault(StatementField.STATEMENT_DATE, NOT_FOUND),
                values.getOrDefault(StatementField.DUE_DATE, NOT_FOUND),
                values.getOrDefault(StatementField.TOTAL_BALANCE, NOT_FOUND),
                values.getOrDefault(StatementField.MINIMUM_PAYMENT, NOT_FOUND)
        );
    }
}
