package com.task.ccparser.service;

import com.task.ccparser.model.Insight;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Derives payment guidance from the statement balance and minimum payment. Amounts that do not
 * parse as positive numbers produce no insights.
 *
 * <p>Interest figures assume an 18% nominal annual rate with simple interest.
 */
@Component
public class InsightGenerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(InsightGenerator.class);

    private static final MathContext MC = MathContext.DECIMAL64;
    static final BigDecimal HIGH_BALANCE = new BigDecimal("5000");
    static final BigDecimal LONG_PAYOFF_MONTHS = new BigDecimal("24");
    static final BigDecimal ANNUAL_RATE = new BigDecimal("0.18");
    private static final BigDecimal MONTHS_PER_YEAR = new BigDecimal("12");
    private static final String CURRENCY = "₹";

    public List<Insight> generate(String totalBalance, String minimumPayment) {
        Optional<BigDecimal> balance = parseAmount(totalBalance);
        Optional<BigDecimal> minPayment = parseAmount(minimumPayment);
        if (balance.isEmpty() || minPayment.isEmpty()) {
            LOGGER.debug("Skipping insights: balance '{}' or minimum payment '{}' is not numeric",
                    totalBalance, minimumPayment);
            return List.of();
        }
        return generateFor(balance.get(), minPayment.get());
    }

    List<Insight> generateFor(BigDecimal balance, BigDecimal minPayment) {
        List<Insight> insights = new ArrayList<>();
        if (balance.signum() <= 0 || minPayment.signum() <= 0) {
            return insights;
        }

        if (balance.compareTo(HIGH_BALANCE) > 0) {
            insights.add(new Insight(
                    Insight.Type.WARNING,
                    "High Balance Alert",
                    "Balance of " + money(balance) + " is significant. Consider paying more than minimum.",
                    Insight.Priority.HIGH));
        }

        BigDecimal monthsToPayoff = balance.divide(minPayment, MC);
        BigDecimal estimatedInterest = balance.multiply(ANNUAL_RATE, MC)
                .multiply(monthsToPayoff.divide(MONTHS_PER_YEAR, MC), MC);

        if (monthsToPayoff.compareTo(LONG_PAYOFF_MONTHS) > 0) {
            insights.add(new Insight(
                    Insight.Type.CRITICAL,
                    "Long Payoff Period",
                    "Paying minimum only will take " + monthsToPayoff.toBigInteger() + " months. Estimated interest: "
                            + money(estimatedInterest),
                    Insight.Priority.CRITICAL));
        }

        BigDecimal recommendedPayment = balance.divide(MONTHS_PER_YEAR, MC);
        if (recommendedPayment.compareTo(minPayment) > 0) {
            BigDecimal savings = estimatedInterest.subtract(balance.multiply(ANNUAL_RATE, MC), MC);
            if (savings.signum() > 0) {
                insights.add(new Insight(
                        Insight.Type.INFO,
                        "Smart Payment Tip",
                        "Pay " + money(recommendedPayment) + "/month to save ~" + money(savings) + " in interest",
                        Insight.Priority.MEDIUM));
            }
        }
        return insights;
    }

    static Optional<BigDecimal> parseAmount(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String cleaned = value.replaceAll("[\\p{Sc},]", "").trim();
        try {
            return Optional.of(new BigDecimal(cleaned));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    private static String money(BigDecimal amount) {
        return CURRENCY + String.format(Locale.US, "%,.2f", amount);
    }
}
