package com.task.ccparser.service;

import com.task.ccparser.exception.DocumentReadException;
import com.task.ccparser.exception.UpstreamServiceException;
import com.task.ccparser.model.DocumentText;
import com.task.ccparser.model.PageText;
import com.task.ccparser.model.ParseResult;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class StatementParserTest {

    private static final byte[] PDF = {'%', 'P', 'D', 'F'};

    @Mock
    private PdfTextExtractor textExtractor;

    @Mock
    private ChatCompletionClient chatClient;

    @Mock
    private Tracer tracer;

    @Mock
    private SpanBuilder spanBuilder;

    @Mock
    private Span span;

    private StatementParser parser;

    @BeforeEach
    public void setUp() {
        lenient().when(tracer.spanBuilder(anyString())).thenReturn(spanBuilder);
        lenient().when(spanBuilder.setAttribute(anyString(), anyString())).thenReturn(spanBuilder);
        lenient().when(spanBuilder.startSpan()).thenReturn(span);
        lenient().when(chatClient.modelName()).thenReturn("llama-3.1-8b-instant");

        parser = new StatementParser(textExtractor, new ExtractionPromptBuilder(), chatClient,
                new JsonResponseExtractor(), new FieldNormalizer(), new CompletenessScorer(), tracer);
    }

    private static DocumentText document(String... pages) {
        List<PageText> pageTexts = new java.util.ArrayList<>();
        for (int i = 0; i < pages.length; i++) {
            pageTexts.add(new PageText(i + 1, pages[i], pages[i], PageText.Source.EMBEDDED));
        }
        return new DocumentText(pageTexts);
    }

    @Test
    public void testParse_RepairsIssuerAndScores() {
        when(textExtractor.extract(PDF)).thenReturn(document(
                "HSBC Visa Platinum statement for the period ending 2024-01-01",
                "Payment due 2024-01-25. New balance $500.00"));
        when(chatClient.complete(anyString())).thenReturn("""
                Sure, here is the JSON:
                {"issuer":"Not found","card_last4":"1234","statement_date":"2024-01-01","due_date":"2024-01-25","total_balance":"$500","minimum_payment":"$25"}
                Let me know if you need more.""");

        ParseResult result = parser.parse(PDF, "hsbc.pdf");

        assertTrue(result.success());
        assertEquals("HSBC", result.data().issuer());
        assertEquals("1234", result.data().cardLast4());
        assertEquals("500", result.data().totalBalance());
        assertEquals("25", result.data().minimumPayment());
        assertEquals(5, result.extractedFields());
        assertEquals(5, result.totalFields());
        assertEquals(100.0, result.successRate());
        assertEquals(StatementParser.METHOD, result.method());
        assertNull(result.error());

        verify(chatClient).complete(argThat(prompt -> prompt.contains("HSBC Visa Platinum")
                && prompt.contains("Payment due 2024-01-25")));
        verify(span, atLeastOnce()).end();
    }

    @Test
    public void testParse_NoJsonInResponse() {
        when(textExtractor.extract(PDF)).thenReturn(document("Chase Sapphire statement with enough text on the page"));
        when(chatClient.complete(anyString())).thenReturn("I could not extract data.");

        ParseResult result = parser.parse(PDF, "chase.pdf");

        assertFalse(result.success());
        assertTrue(result.error().contains("No JSON object"));
        assertEquals("I could not extract data.", result.rawResponse());
        assertNull(result.data());
    }

    @Test
    public void testParse_InvalidJsonKeepsRawResponse() {
        when(textExtractor.extract(PDF)).thenReturn(document("Citi statement text long enough to be kept as-is"));
        when(chatClient.complete(anyString())).thenReturn("{\"issuer\": \"Citi\",, }");

        ParseResult result = parser.parse(PDF, "citi.pdf");

        assertFalse(result.success());
        assertTrue(result.error().startsWith("AI returned invalid JSON"));
        assertEquals("{\"issuer\": \"Citi\",, }", result.rawResponse());
    }

    @Test
    public void testParse_NoTextSkipsModel() {
        when(textExtractor.extract(PDF)).thenReturn(new DocumentText(List.of(
                new PageText(1, "", "", PageText.Source.OCR_FAILED))));

        ParseResult result = parser.parse(PDF, "scan.pdf");

        assertFalse(result.success());
        assertEquals(StatementParser.NO_TEXT, result.error());
        verify(chatClient, never()).complete(anyString());
    }

    @Test
    public void testParse_UpstreamFailurePropagates() {
        when(textExtractor.extract(PDF)).thenReturn(document("Discover statement text long enough to be kept"));
        when(chatClient.complete(anyString()))
                .thenThrow(new UpstreamServiceException("Groq API Error: timeout", new RuntimeException("timeout")));

        assertThrows(UpstreamServiceException.class, () -> parser.parse(PDF, "discover.pdf"));
        verify(span, atLeastOnce()).setAttribute("error", true);
    }

    @Test
    public void testParse_UnreadableDocumentPropagates() {
        when(textExtractor.extract(PDF)).thenThrow(new DocumentReadException("Error reading PDF: bad header", null));

        assertThrows(DocumentReadException.class, () -> parser.parse(PDF, "broken.pdf"));
        verifyNoInteractions(chatClient);
    }
}
