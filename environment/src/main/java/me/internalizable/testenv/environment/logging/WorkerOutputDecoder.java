package me.internalizable.testenv.environment.logging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.internalizable.testenv.api.ServerLogger;

import javax.annotation.Nonnull;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Turns lines printed by worker processes into log records.
 *
 * <p>A line holding a JSON object with a {@code message} becomes a record at
 * its {@code level} (default {@code info}) with its remaining keys as fields.
 * Any other line is logged verbatim at {@code info}.</p>
 */
public class WorkerOutputDecoder {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ServerLogger logger;

    public WorkerOutputDecoder(@Nonnull ServerLogger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    /**
     * Decode one line of worker output and enqueue it.
     *
     * @param workerId worker the line came from
     * @param line the output line
     */
    public void accept(@Nonnull String workerId, @Nonnull String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return;
        }

        if (trimmed.startsWith("{")) {
            ObjectNode node = parseObject(trimmed);
            if (node != null && node.hasNonNull("message")) {
                LogLevel level = LogLevel.fromName(node.path("level").asText(null));
                Map<String, Object> fields = new LinkedHashMap<>();
                fields.put("worker", workerId);
                Iterator<Map.Entry<String, JsonNode>> it = node.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> entry = it.next();
                    String key = entry.getKey();
                    if (!"level".equals(key) && !"message".equals(key)) {
                        fields.put(key, MAPPER.convertValue(entry.getValue(), Object.class));
                    }
                }
                emit(level != null ? level : LogLevel.INFO, node.get("message").asText(), fields);
                return;
            }
        }

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("worker", workerId);
        emit(LogLevel.INFO, line, fields);
    }

    private void emit(LogLevel level, String message, Map<String, Object> fields) {
        switch (level) {
            case CRITICAL -> logger.critical(message, fields);
            case ERROR -> logger.error(message, fields);
            case WARNING -> logger.warning(message, fields);
            case INFO -> logger.info(message, fields);
            default -> logger.debug(message, fields);
        }
    }

    private static ObjectNode parseObject(String text) {
        try {
            JsonNode node = MAPPER.readTree(text);
            return node instanceof ObjectNode ? (ObjectNode) node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
