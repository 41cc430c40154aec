package com.chatbridge.gateway.http;

import com.chatbridge.engine.BridgeEngine;
import com.chatbridge.engine.MediaInput;
import com.chatbridge.protocol.ChatAddress;
import com.chatbridge.protocol.PresenceMedia;
import com.chatbridge.shared.model.SendResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.nio.file.Path;

/** Outbound control surface of the engine. Every endpoint answers {@code {success, message}}. */
@RestController
@ConditionalOnProperty(name = "chatbridge.role", havingValue = "engine", matchIfMissing = true)
public class ControlController {

    private static final Logger log = LoggerFactory.getLogger(ControlController.class);

    private final BridgeEngine engine;

    public ControlController(BridgeEngine engine) {
        this.engine = engine;
    }

    @PostMapping("/api/send")
    public ResponseEntity<SendResult> send(@RequestBody ControlRequests.SendMessage req) {
        if (blank(req.recipient())) return badRequest("recipient required");
        var to = ChatAddress.parse(req.recipient());
        try {
            if (req.hasMedia()) {
                var id = engine.sendMedia(to, mediaOf(req));
                return ResponseEntity.ok(SendResult.ok("Media sent to " + req.recipient() + " id=" + id));
            }
            if (blank(req.message())) return badRequest("message or media_path required");
            var id = engine.sendText(to, req.message());
            return ResponseEntity.ok(SendResult.ok("Message sent to " + req.recipient() + " id=" + id));
        } catch (IOException e) {
            return failed("cannot read media: " + e.getMessage());
        } catch (RuntimeException e) {
            log.warn("send failed to={}: {}", req.recipient(), e.getMessage());
            return failed(e.getMessage());
        }
    }

    @PostMapping("/api/typing")
    public ResponseEntity<SendResult> typing(@RequestBody ControlRequests.Typing req) {
        if (blank(req.recipient())) return badRequest("recipient required");
        try {
            engine.setTyping(ChatAddress.parse(req.recipient()), req.typing(), PresenceMedia.parse(req.media()));
            return ResponseEntity.ok(SendResult.ok(req.typing() ? "typing on" : "typing off"));
        } catch (RuntimeException e) {
            log.warn("typing failed to={}: {}", req.recipient(), e.getMessage());
            return failed(e.getMessage());
        }
    }

    @PostMapping("/api/markread")
    public ResponseEntity<SendResult> markRead(@RequestBody ControlRequests.MarkRead req) {
        if (blank(req.recipient())) return badRequest("recipient required");
        if (req.messageIds() == null || req.messageIds().stream().allMatch(ControlController::blank)) {
            return badRequest("message_ids required");
        }
        var chat = ChatAddress.parse(req.recipient());
        var sender = blank(req.sender()) ? null : ChatAddress.parse(req.sender());
        try {
            engine.markRead(chat, req.messageIds(), sender, req.receiptType());
            return ResponseEntity.ok(SendResult.ok("Marked " + req.messageIds().size() + " message(s) as read"));
        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage());
        } catch (RuntimeException e) {
            log.warn("markread failed chat={}: {}", req.recipient(), e.getMessage());
            return failed(e.getMessage());
        }
    }

    @PostMapping("/api/status")
    public ResponseEntity<SendResult> status(@RequestBody ControlRequests.Status req) {
        if (blank(req.message())) return badRequest("message required");
        try {
            var id = engine.postStatus(req.message());
            return ResponseEntity.ok(SendResult.ok("Status posted id=" + id));
        } catch (UnsupportedOperationException e) {
            return ResponseEntity.status(HttpStatus.NOT_IMPLEMENTED).body(SendResult.failed("unsupported"));
        } catch (RuntimeException e) {
            log.warn("status failed: {}", e.getMessage());
            return failed(e.getMessage());
        }
    }

    private static MediaInput mediaOf(ControlRequests.SendMessage req) throws IOException {
        if (!blank(req.mediaPath())) {
            var fromFile = MediaInput.fromFile(Path.of(req.mediaPath()), req.message());
            if (blank(req.mimetype())) return fromFile;
            return MediaInput.of(fromFile.data(), fromFile.fileName(), req.message(), req.mimetype());
        }
        var name = blank(req.fileName()) ? "file" : req.fileName();
        return MediaInput.of(req.mediaData(), name, req.message(), req.mimetype());
    }

    private static boolean blank(String s) {
        return s == null || s.isBlank();
    }

    private static ResponseEntity<SendResult> badRequest(String message) {
        return ResponseEntity.badRequest().body(SendResult.failed(message));
    }

    private static ResponseEntity<SendResult> failed(String message) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(SendResult.failed(message));
    }
}
