package com.linlay.agentengine.tool;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Component
public class CurrentTimeTool implements BaseTool {

    private final Clock clock;

    public CurrentTimeTool() {
        this(Clock.systemUTC());
    }

    CurrentTimeTool(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String name() {
        return "current_time";
    }

    @Override
    public String description() {
        return "Current date and time, optionally in an IANA time zone such as Europe/Berlin.";
    }

    @Override
    public ToolParameterSchema parametersSchema() {
        return ToolParameterSchema.builder()
                .optional("timezone", "string", "IANA time zone id, defaults to UTC")
                .build();
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters) {
        Object raw = parameters.get("timezone");
        ZoneId zoneId;
        try {
            zoneId = raw == null || String.valueOf(raw).isBlank() ? ZoneId.of("UTC") : ZoneId.of(String.valueOf(raw).trim());
        } catch (DateTimeException ex) {
            return ToolResult.failure("Unknown time zone: " + raw);
        }
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zoneId));
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("timezone", zoneId.getId());
        data.put("date", now.toLocalDate().toString());
        data.put("weekday", now.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH));
        data.put("time", now.toLocalTime().format(DateTimeFormatter.ofPattern("HH:mm:ss")));
        data.put("iso", now.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        return ToolResult.success(now.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME), data);
    }
}
