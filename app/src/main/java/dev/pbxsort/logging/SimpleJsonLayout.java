package dev.pbxsort.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import ch.qos.logback.core.LayoutBase;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * One JSON object per log line. The project file being processed, taken from the MDC, is promoted to a
 * top-level {@code file} field; a logged exception becomes an {@code exception} field.
 */
public class SimpleJsonLayout extends LayoutBase<ILoggingEvent> {

    /** MDC key under which the project file being processed is published. */
    public static final String MDC_PROJECT_FILE = "projectFile";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    @Override
    public String doLayout(ILoggingEvent event) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("timestamp", TIMESTAMP.format(Instant.ofEpochMilli(event.getTimeStamp()).atOffset(ZoneOffset.UTC)));
        fields.put("level", event.getLevel().toString());
        fields.put("logger", event.getLoggerName());
        fields.put("message", event.getFormattedMessage());

        String projectFile = mdc(event).get(MDC_PROJECT_FILE);
        if (projectFile != null) {
            fields.put("file", projectFile);
        }
        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            fields.put("exception", ThrowableProxyUtil.asString(throwable));
        }

        return fields.entrySet().stream()
                .map(field -> jsonString(field.getKey()) + ':' + jsonString(field.getValue()))
                .collect(Collectors.joining(",", "{", "}"))
                + System.lineSeparator();
    }

    // events built outside a logger context throw when asked for their MDC
    private Map<String, String> mdc(ILoggingEvent event) {
        try {
            Map<String, String> map = event.getMDCPropertyMap();
            return map == null ? Map.of() : map;
        } catch (RuntimeException ex) {
            return Map.of();
        }
    }

    private static String jsonString(String value) {
        if (value == null) {
            return "null";
        }
        StringBuilder json = new StringBuilder(value.length() + 2).append('"');
        value.chars().forEach(ch -> {
            switch (ch) {
                case '"', '\\' -> json.append('\\').append((char) ch);
                case '\n' -> json.append("\\n");
                case '\r' -> json.append("\\r");
                case '\t' -> json.append("\\t");
                default -> json.append(ch < 0x20 ? String.format("\\u%04x", ch) : String.valueOf((char) ch));
            }
        });
        return json.append('"').toString();
    }
}
