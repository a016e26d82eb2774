package com.task.ccparser.service;

import com.task.ccparser.model.ExtractedFields;
import com.task.ccparser.model.HistoryEntry;
import com.task.ccparser.model.HistoryStats;
import com.task.ccparser.model.ParseResult;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory record of the most recent successful parses, newest first.
 */
@Component
public class ParseHistory {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final int maxEntries;
    private final Deque<HistoryEntry> entries = new ArrayDeque<>();

    public ParseHistory(@Value("${history.max-entries:20}") int maxEntries) {
        this.maxEntries = maxEntries;
    }

    public synchronized HistoryEntry record(String fileName, ParseResult result) {
        LocalDateTime now = LocalDateTime.now();
        HistoryEntry entry = new HistoryEntry(now.toString(), fileName, now.format(TIMESTAMP), result);
        entries.addFirst(entry);
        while (entries.size() > maxEntries) {
            entries.removeLast();
        }
        return entry;
    }

    public synchronized List<HistoryEntry> entries() {
        return List.copyOf(entries);
    }

    public synchronized void clear() {
        entries.clear();
    }

    public Optional<HistoryStats> stats() {
        List<HistoryEntry> snapshot = entries();
        if (snapshot.isEmpty()) {
            return Optional.empty();
        }

        Map<String, Integer> issuers = new LinkedHashMap<>();
        BigDecimal totalBalance = BigDecimal.ZERO;
        double rateSum = 0;
        for (HistoryEntry entry : snapshot) {
            ParseResult result = entry.result();
            if (!result.success() || result.data() == null) {
                continue;
            }
            ExtractedFields data = result.data();
            String issuer = data.issuer() == null ? FieldNormalizer.UNKNOWN_ISSUER : data.issuer();
            issuers.merge(issuer, 1, Integer::sum);
            totalBalance = totalBalance.add(InsightGenerator.parseAmount(data.totalBalance()).orElse(BigDecimal.ZERO));
            rateSum += result.successRate() == null ? 0 : result.successRate();
        }

        double averageRate = BigDecimal.valueOf(rateSum / snapshot.size())
                .setScale(1, RoundingMode.HALF_UP)
                .doubleValue();
        return Optional.of(new HistoryStats(snapshot.size(), issuers,
                totalBalance.setScale(2, RoundingMode.HALF_UP).doubleValue(), averageRate));
    }
}
