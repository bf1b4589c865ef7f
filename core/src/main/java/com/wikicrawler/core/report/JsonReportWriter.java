package com.wikicrawler.core.report;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** CrawlReport JSON 입출력. 날짜는 ISO-8601 문자열. */
public final class JsonReportWriter {
    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public Path write(CrawlReport report, Path file) throws IOException {
        if (report == null) throw new IllegalArgumentException("report is null");
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        om.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), report);
        return file;
    }

    public String toJson(CrawlReport report) throws IOException {
        return om.writerWithDefaultPrettyPrinter().writeValueAsString(report);
    }

    public CrawlReport read(Path file) throws IOException {
        CrawlReport r = om.readValue(file.toFile(), CrawlReport.class);
        if (!"1".equals(r.v)) {
            throw new IllegalArgumentException("Unsupported report version: " + r.v);
        }
        return r;
    }
}
