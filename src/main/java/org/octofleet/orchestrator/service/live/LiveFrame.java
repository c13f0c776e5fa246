package org.octofleet.orchestrator.service.live;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One relayed unit: a metrics sample, a log batch, a shell output chunk, a screen frame,
 * or a control message (info, ack, closed, error, pong).
 *
 * @param seq upstream sequence number, 0 when the frame carries none
 */
public record LiveFrame(String type, long seq, Map<String, Object> fields) {

    public static LiveFrame control(String type, Map<String, Object> fields) {
        return new LiveFrame(type, 0, fields == null ? Map.of() : fields);
    }

    /** Wire form: {@code {type, seq?, ...fields}}. */
    public Map<String, Object> toMessage() {
        var m = new LinkedHashMap<String, Object>();
        m.put("type", type);
        if (seq > 0) m.put("seq", seq);
        fields.forEach((k, v) -> {
            if (!"type".equals(k) && !"seq".equals(k)) m.put(k, v);
        });
        return m;
    }

    static LiveFrame fromMessage(Map<String, Object> msg) {
        var type = String.valueOf(msg.getOrDefault("type", "data"));
        long seq = 0;
        var raw = msg.get("seq");
        if (raw instanceof Number n) {
            seq = n.longValue();
        } else if (raw != null) {
            try {
                seq = Long.parseLong(raw.toString());
            } catch (NumberFormatException ignored) {
                seq = 0;
            }
        }
        var fields = new LinkedHashMap<String, Object>(msg);
        fields.remove("type");
        fields.remove("seq");
        return new LiveFrame(type, seq, fields);
    }
}
