package org.queuescheduler.config.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.LayoutBase;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.queuescheduler.utils.JsonUtil;
import org.slf4j.event.KeyValuePair;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders each event as one compact JSON object followed by a newline.
 * Fields are the configured providers, in registration order, then the event's key/value pairs.
 * Keys are flat: "meta.name" is a single key, not a nested object.
 */
public class JsonLineLayout extends LayoutBase<ILoggingEvent> {

    private final List<Map.Entry<String, FieldProvider>> fields = new ArrayList<>();

    public JsonLineLayout addField(String name, FieldProvider provider) {
        fields.add(Map.entry(name, provider));
        return this;
    }

    @Override
    public String doLayout(ILoggingEvent event) {
        Map<String, Object> record = new LinkedHashMap<>();
        for (Map.Entry<String, FieldProvider> field : fields) {
            record.put(field.getKey(), field.getValue().valueFor(event));
        }

        List<KeyValuePair> pairs = event.getKeyValuePairs();
        if (pairs != null) {
            for (KeyValuePair pair : pairs) {
                record.put(pair.key, pair.value);
            }
        }

        try {
            return JsonUtil.mapper().writeValueAsString(record) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize log record: " + e.getMessage(), e);
        }
    }

    @Override
    public String getContentType() {
        return "application/json";
    }
}
