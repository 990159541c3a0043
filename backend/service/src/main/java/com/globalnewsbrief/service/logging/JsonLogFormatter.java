package com.globalnewsbrief.service.logging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.globalnewsbrief.core.util.JsonUtils;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Formatter;
import java.util.logging.LogRecord;

/**
 * Renders each log record as a single-line JSON object for log shippers.
 *
 * <p>A record whose only parameter is a {@link Map} carries it as {@code context}; its values are
 * written as JSON scalars where they are strings, numbers or booleans and by their text form
 * otherwise.
 */
public class JsonLogFormatter extends Formatter {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    @Override
    public String format(LogRecord record) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("timestamp", record.getInstant().toString());
        entry.put("level", record.getLevel().getName());
        entry.put("logger", record.getLoggerName());
        entry.put("message", formatMessage(record));
        entry.put("source_class", record.getSourceClassName());
        entry.put("source_method", record.getSourceMethodName());
        if (record.getThrown() != null) {
            entry.put("exception", stackTrace(record.getThrown()));
        }
        Map<String, Object> context = context(record);
        if (!context.isEmpty()) {
            entry.put("context", context);
        }
        try {
            return MAPPER.writeValueAsString(entry) + System.lineSeparator();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize log record", e);
        }
    }

    private static Map<String, Object> context(LogRecord record) {
        Object[] parameters = record.getParameters();
        Map<String, Object> context = new LinkedHashMap<>();
        if (parameters == null || parameters.length != 1 || !(parameters[0] instanceof Map<?, ?> raw)) {
            return context;
        }
        for (Map.Entry<?, ?> item : raw.entrySet()) {
            Object value = item.getValue();
            boolean scalar = value == null || value instanceof String || value instanceof Number || value instanceof Boolean;
            context.put(String.valueOf(item.getKey()), scalar ? value : String.valueOf(value));
        }
        return context;
    }

    private static String stackTrace(Throwable thrown) {
        StringWriter out = new StringWriter();
        thrown.printStackTrace(new PrintWriter(out));
        return out.toString().trim();
    }
}
