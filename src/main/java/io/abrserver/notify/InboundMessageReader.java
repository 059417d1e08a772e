package io.abrserver.notify;

import com.fasterxml.jackson.databind.JsonNode;
import io.abrserver.state.SchemaValidator;
import io.abrserver.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

public final class InboundMessageReader {
    private static final Logger LOG = LoggerFactory.getLogger(InboundMessageReader.class);

    private final Notifier notifier;
    private final SchemaValidator incomingSchema;

    public InboundMessageReader(Notifier notifier, SchemaValidator incomingSchema) {
        this.notifier = notifier;
        this.incomingSchema = incomingSchema;
    }

    public boolean receive(String raw, String senderId) {
        if (raw == null || raw.isBlank()) {
            return false;
        }
        JsonNode message;
        try {
            message = Jsons.parse(raw);
        } catch (IllegalArgumentException e) {
            LOG.error("Incoming message from {} is not JSON", senderId);
            return false;
        }
        Optional<SchemaValidator.Violation> violation = incomingSchema.firstViolation(message);
        if (violation.isPresent()) {
            LOG.error("Incoming message from {} failed to validate: {}", senderId, violation.get());
            return false;
        }
        notifier.dispatchInbound(message, senderId);
        return true;
    }
}
