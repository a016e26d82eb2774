package com.task.ccparser.service;

import com.task.ccparser.model.ExtractedFields;
import com.task.ccparser.model.StatementField;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps the model payload onto the six statement fields, fills in a missing issuer from keyword
 * rules and strips currency formatting from the amount fields.
 */
@Component
public class FieldNormalizer {

    static final String UNKNOWN_ISSUER = "Unknown";

    /** Evaluated in order; the first rule with a matching keyword wins. */
    public static final List<IssuerRule> ISSUER_RULES = List.of(
            new IssuerRule("HSBC", List.of("hsbc")),
            new IssuerRule("Chase", List.of("chase")),
            new IssuerRule("American Express", List.of("amex", "american express")),
            new IssuerRule("Citi", List.of("citi")),
            new IssuerRule("Discover", List.of("discover")),
            new IssuerRule("Capital One", List.of("capital one"))
    );

    public ExtractedFields normalize(Map<String, Object> payload, String documentText) {
        ExtractedFields fields = toFields(payload);

        if (!fields.isFound(StatementField.ISSUER)) {
            fields = fields.withIssuer(inferIssuer(documentText));
        }

        return fields.withAmounts(cleanAmount(fields.totalBalance()), cleanAmount(fields.minimumPayment()));
    }

    public String inferIssuer(String documentText) {
        String text = documentText == null ? "" : documentText.toLowerCase(Locale.ROOT);
        for (IssuerRule rule : ISSUER_RULES) {
            if (rule.matches(text)) {
                return rule.issuer();
            }
        }
        return UNKNOWN_ISSUER;
    }

    static String cleanAmount(String value) {
        if (value == null || ExtractedFields.NOT_FOUND.equals(value)) {
            return value;
        }
        return value.replaceAll("[\\p{Sc},]", "").trim();
    }

    private ExtractedFields toFields(Map<String, Object> payload) {
        Map<StatementField, String> values = new EnumMap<>(StatementField.class);
        for (StatementField field : StatementField.values()) {
            Object raw = payload == null ? null : payload.get(field.key());
            String text = raw == null ? null : asText(raw);
            values.put(field, text == null || text.isBlank() ? ExtractedFields.NOT_FOUND : text);
        }
        return ExtractedFields.fromMap(values);
    }

    private static String asText(Object raw) {
        if (raw instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        if (raw instanceof Double || raw instanceof Float) {
            return BigDecimal.valueOf(((Number) raw).doubleValue()).toPlainString();
        }
        return String.valueOf(raw);
    }

    public record IssuerRule(String issuer, List<String> keywords) {

        boolean matches(String lowerCaseText) {
            return keywords.stream().anyMatch(lowerCaseText::contains);
        }
    }
}
