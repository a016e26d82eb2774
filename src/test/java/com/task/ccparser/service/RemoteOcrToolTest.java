package com.task.ccparser.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class RemoteOcrToolTest {

    private final ObjectMapper om = new ObjectMapper();
    private final RemoteOcrTool tool = new RemoteOcrTool(new OkHttpClient(), "http://localhost:8000/upload");

    @Test
    public void testReadText_PlainText() throws Exception {
        assertEquals("HSBC Statement", tool.readText(om.readTree("{\"text\": \"HSBC Statement\"}")));
    }

    @Test
    public void testReadText_WrappedPagesWithLines() throws Exception {
        String body = "{\"extracted_data\": {\"pages\": ["
                + "{\"lines\": [\"Total Balance 1,234.56\", \"Minimum Payment 50.00\"]},"
                + "{\"text\": \"Due Date 2024-01-25\"}]}}";

        assertEquals("Total Balance 1,234.56\nMinimum Payment 50.00\nDue Date 2024-01-25",
                tool.readText(om.readTree(body)));
    }

    @Test
    public void testReadText_TextualPayload() throws Exception {
        assertEquals("Card ending 1234", tool.readText(om.readTree("{\"ocr-extract\": \"Card ending 1234\"}")));
    }
}
