package com.task.ccparser.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Delegates recognition to an OCR HTTP service. The page is uploaded as a PNG multipart part
 * named {@code file}; the service may answer with plain {@code text}, a list of {@code pages}
 * or {@code lines}, optionally wrapped in {@code extracted_data}.
 */
@Service
@ConditionalOnProperty(name = "ocr.engine", havingValue = "remote")
public class RemoteOcrTool implements OcrTool {

    private static final MediaType PNG = MediaType.parse("image/png");

    private final OkHttpClient http;
    private final ObjectMapper om = new ObjectMapper();
    private final String ocrUrl;

    public RemoteOcrTool(
            OkHttpClient http,
            @Value("${ocr.remote.url:http://ocr-service:8000/upload}") String ocrUrl
    ) {
        this.http = http;
        this.ocrUrl = ocrUrl;
    }

    @Override
    public String recognize(BufferedImage image, int pageNumber) throws IOException {
        RequestBody fileBody = RequestBody.create(toPng(image), PNG);
        MultipartBody requestBody = new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart("file", "page-" + pageNumber + ".png", fileBody)
                .build();

        Request request = new Request.Builder()
                .url(ocrUrl)
                .post(requestBody)
                .build();

        try (Response response = http.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("OCR service returned: " + response.code() + " - " + response.message());
            }
            String body = response.body() == null ? "" : response.body().string();
            return readText(om.readTree(body));
        }
    }

    String readText(JsonNode root) {
        JsonNode extracted = root;
        if (root.has("extracted_data")) extracted = root.get("extracted_data");
        else if (root.has("ocr-extract")) extracted = root.get("ocr-extract");

        if (extracted.isTextual()) {
            return extracted.asText("");
        }

        List<String> parts = new ArrayList<>();
        if (extracted.has("pages") && extracted.get("pages").isArray()) {
            for (JsonNode pageNode : extracted.get("pages")) {
                collect(pageNode, parts);
            }
        } else {
            collect(extracted, parts);
        }
        return String.join("\n", parts);
    }

    private void collect(JsonNode node, List<String> parts) {
        if (node.isTextual()) {
            parts.add(node.asText(""));
            return;
        }
        if (node.has("text")) {
            parts.add(node.get("text").asText(""));
        }
        if (node.has("lines") && node.get("lines").isArray()) {
            for (JsonNode ln : node.get("lines")) parts.add(ln.asText(""));
        }
    }

    private byte[] toPng(BufferedImage image) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        return out.toByteArray();
    }
}
