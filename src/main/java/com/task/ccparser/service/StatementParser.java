package com.task.ccparser.service;

import com.task.ccparser.model.Completeness;
import com.task.ccparser.model.DocumentText;
import com.task.ccparser.model.ExtractedFields;
import com.task.ccparser.model.ExtractionPrompt;
import com.task.ccparser.model.ModelResponse;
import com.task.ccparser.model.ParseResult;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Statement extraction pipeline: PDF text, model prompt, JSON recovery, normalization and scoring.
 *
 * <p>Unreadable documents, a missing API key and model call failures are thrown. A response without
 * a usable JSON object, or a document without any text, yields a failed {@link ParseResult}.
 */
@Service
public class StatementParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(StatementParser.class);

    public static final String METHOD = "AI-Powered (Groq Llama-3.1)";
    static final String NO_TEXT = "Could not extract text from PDF";
    private static final int TRACE_ATTRIBUTE_LIMIT = 10000;

    private final PdfTextExtractor textExtractor;
    private final ExtractionPromptBuilder promptBuilder;
    private final ChatCompletionClient chatClient;
    private final JsonResponseExtractor responseExtractor;
    private final FieldNormalizer normalizer;
    private final CompletenessScorer scorer;
    private final Tracer tracer;

    public StatementParser(
            PdfTextExtractor textExtractor,
            ExtractionPromptBuilder promptBuilder,
            ChatCompletionClient chatClient,
            JsonResponseExtractor responseExtractor,
            FieldNormalizer normalizer,
            CompletenessScorer scorer,
            Tracer tracer
    ) {
        this.textExtractor = textExtractor;
        this.promptBuilder = promptBuilder;
        this.chatClient = chatClient;
        this.responseExtractor = responseExtractor;
        this.normalizer = normalizer;
        this.scorer = scorer;
        this.tracer = tracer;
    }

    public ParseResult parse(byte[] pdfBytes, String fileName) {
        Span root = tracer.spanBuilder("statement.parse")
                .setAttribute("file.name", fileName == null ? "" : fileName)
                .startSpan();

        try {
            LOGGER.info("Starting AI-powered parsing of '{}'", fileName);

            // Step 1: PDF text with OCR fallback
            Span textSpan = tracer.spanBuilder("pdf.extract_text").startSpan();
            DocumentText document;
            try {
                document = textExtractor.extract(pdfBytes);
            } finally {
                textSpan.end();
            }

            String fullText = document.fullText();
            if (fullText.isBlank()) {
                LOGGER.warn("No text could be extracted from '{}'", fileName);
                return ParseResult.failure(NO_TEXT);
            }

            // Step 2: prompt
            ExtractionPrompt prompt = promptBuilder.build(fullText);
            if (prompt.truncated()) {
                LOGGER.info("Statement text of {} characters truncated for the prompt", fullText.length());
            }

            // Step 3: model call
            Span llmSpan = tracer.spanBuilder("llm.extraction").startSpan();
            String rawResponse;
            try (var scope = llmSpan.makeCurrent()) {
                rawResponse = callModel(prompt, llmSpan, root);
            } finally {
                llmSpan.end();
            }

            // Step 4: recover JSON
            ModelResponse response = responseExtractor.extract(rawResponse);
            if (!response.isParsed()) {
                return ParseResult.failure(response.error(), response.rawText());
            }

            // Step 5-7: normalize and score
            ExtractedFields fields = normalizer.normalize(response.payload(), fullText);
            Completeness completeness = scorer.score(fields);
            LOGGER.info("Final extraction for '{}': {}", fileName, fields.asMap());
            LOGGER.info("Success rate: {}/{} ({}%)", completeness.extractedCount(), completeness.totalRequired(),
                    completeness.successRate());

            return ParseResult.success(fields, completeness, METHOD);
        } finally {
            root.end();
        }
    }

    private String callModel(ExtractionPrompt prompt, Span llmSpan, Span rootSpan) {
        String input = truncateForTrace(prompt.text());
        rootSpan.setAttribute("input", input);
        llmSpan.setAttribute("langfuse.observation.input", input);
        llmSpan.setAttribute("langfuse.observation.type", "generation");
        llmSpan.setAttribute("langfuse.observation.model", chatClient.modelName());

        try {
            String responseText = chatClient.complete(prompt.text());
            String output = truncateForTrace(responseText);
            rootSpan.setAttribute("output", output);
            llmSpan.setAttribute("langfuse.observation.output", output);
            LOGGER.debug("AI raw response: {}", responseText);
            return responseText;
        } catch (RuntimeException ex) {
            llmSpan.setAttribute("error", true);
            llmSpan.setAttribute("error.message", String.valueOf(ex.getMessage()));
            throw ex;
        }
    }

    private static String truncateForTrace(String value) {
        return value.length() > TRACE_ATTRIBUTE_LIMIT
                ? value.substring(0, TRACE_ATTRIBUTE_LIMIT) + "... (truncated)"
                : value;
    }
}
