package in.elpyfi.infrastructure.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.Map;

/**
 * Outward notification after a successful write: {type, data, timestamp}.
 */
public record StoreNotification(
    String type,
    Map<String, Object> data,
    Instant timestamp
) {
    public static final String POSITION_OPENED = "position.opened";
    public static final String POSITION_CLOSED = "position.closed";
    public static final String SIGNAL_GENERATED = "signal.generated";

    public ObjectNode toJson(ObjectMapper mapper) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", type);
        node.set("data", mapper.valueToTree(data));
        node.put("timestamp", timestamp.toString());
        return node;
    }
}
