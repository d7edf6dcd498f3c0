package com.labtrace.lims.api.service.report;

import com.labtrace.lims.api.config.ReportProperties;
import com.labtrace.lims.api.service.error.UpstreamFailureException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Sends rendered HTML to a headless-Chromium conversion service (Gotenberg form API) and returns the PDF bytes.
 */
@Component
public class RemoteDocumentConverter implements DocumentConverter {

    private static final Logger log = LoggerFactory.getLogger(RemoteDocumentConverter.class);

    static final String FILE_PART = "files";
    static final String INDEX_FILE = "index.html";

    // width x height in inches
    private static final Map<String, String[]> PAPER_SIZES = Map.of(
        "A4",
        new String[] { "8.27", "11.7" },
        "A3",
        new String[] { "11.7", "16.54" },
        "LETTER",
        new String[] { "8.5", "11" },
        "LEGAL",
        new String[] { "8.5", "14" }
    );

    private final RestTemplate restTemplate;
    private final String endpoint;

    @Autowired
    public RemoteDocumentConverter(RestTemplateBuilder builder, ReportProperties properties) {
        this(
            builder
                .setConnectTimeout(properties.getConverter().getConnectTimeout())
                .setReadTimeout(properties.getConverter().getReadTimeout())
                .build(),
            properties
        );
    }

    RemoteDocumentConverter(RestTemplate restTemplate, ReportProperties properties) {
        this.restTemplate = restTemplate;
        this.endpoint = properties.getConverter().getEndpoint();
    }

    @Override
    public byte[] convert(String markup, ConversionOptions options) {
        if (StringUtils.isBlank(endpoint)) {
            throw new UpstreamFailureException("Document converter endpoint is not configured");
        }
        ByteArrayResource index = new ByteArrayResource(markup.getBytes(StandardCharsets.UTF_8)) {
            @Override
            public String getFilename() {
                return INDEX_FILE;
            }
        };
        MultiValueMap<String, Object> form = new LinkedMultiValueMap<>();
        form.add(FILE_PART, index);
        String[] paper = PAPER_SIZES.getOrDefault(StringUtils.upperCase(options.paperFormat(), Locale.ROOT), PAPER_SIZES.get("A4"));
        form.add("paperWidth", paper[0]);
        form.add("paperHeight", paper[1]);
        form.add("marginTop", options.marginVertical());
        form.add("marginBottom", options.marginVertical());
        form.add("marginLeft", options.marginHorizontal());
        form.add("marginRight", options.marginHorizontal());
        form.add("printBackground", String.valueOf(options.printBackground()));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);
        headers.setAccept(List.of(MediaType.APPLICATION_PDF));

        ResponseEntity<byte[]> response;
        try {
            response = restTemplate.postForEntity(endpoint, new HttpEntity<>(form, headers), byte[].class);
        } catch (RestClientException ex) {
            log.warn("Document conversion failed at {}: {}", endpoint, ex.getMessage());
            throw new UpstreamFailureException("Document conversion failed: " + ex.getMessage(), ex);
        }
        byte[] body = response.getBody();
        if (!response.getStatusCode().is2xxSuccessful() || body == null || body.length == 0) {
            throw new UpstreamFailureException("Document converter returned " + response.getStatusCode().value() + " with an empty document");
        }
        log.debug("Converted {} chars of markup into {} bytes", markup.length(), body.length);
        return body;
    }
}
