package com.rotalog.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;

/**
 * JSON form of a {@link LogConfig}. Every field is optional and names match regardless of case.
 */
final class ConfigJson {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();

    private ConfigJson() {
    }

    /**
     * The document as written by users. Absent fields stay null.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"rootDir", "numFiles", "fileNumBytes", "priority", "suppressedFiles"})
    static final class Document {
        public String rootDir;
        public Integer numFiles;
        public Long fileNumBytes;
        public String priority;
        public String suppressedFiles;
    }

    static Document parse(byte[] json) throws IOException {
        Document document = MAPPER.readValue(json, Document.class);
        // "null" is valid JSON and maps to no document at all
        return document == null ? new Document() : document;
    }

    static String render(LogConfig config) {
        Document document = new Document();
        document.rootDir = config.getRootDir();
        document.numFiles = config.getMaxFiles();
        document.fileNumBytes = config.getMaxFileBytes();
        document.priority = config.getPriority().name();
        document.suppressedFiles = config.getSuppressedFilesText();
        try {
            return MAPPER.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render log configuration", e);
        }
    }
}
