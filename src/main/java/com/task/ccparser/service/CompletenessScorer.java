package com.task.ccparser.service;

import com.task.ccparser.model.Completeness;
import com.task.ccparser.model.ExtractedFields;
import com.task.ccparser.model.StatementField;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

@Component
public class CompletenessScorer {

    private static final List<StatementField> REQUIRED = StatementField.requiredFields();

    public Completeness score(ExtractedFields fields) {
        int extracted = (int) REQUIRED.stream().filter(fields::isFound).count();
        double rate = BigDecimal.valueOf(extracted * 100.0 / REQUIRED.size())
                .setScale(1, RoundingMode.HALF_UP)
                .doubleValue();
        return new Completeness(extracted, REQUIRED.size(), rate);
    }
}
