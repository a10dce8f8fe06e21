package io.crewmesh.bus;

import io.crewmesh.config.CrewMeshConfig;
import io.crewmesh.model.MailboxMessage;
import io.crewmesh.model.MessageType;
import io.crewmesh.storage.AdvisoryLock;
import io.crewmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * One append-only JSONL log per recipient under {@code mailboxes/}.
 *
 * <p>Sends append under the recipient's lock. A drain moves the log aside to
 * {@code <id>.jsonl.processing}, parses it and deletes it. A {@code .processing} file left by a
 * crashed reader is delivered again on the next drain, so delivery is at-least-once and FIFO per
 * recipient.
 */
public final class Mailbox {
    private static final Logger LOG = LoggerFactory.getLogger(Mailbox.class);
    private static final String PROCESSING_SUFFIX = ".processing";

    private final CrewMeshConfig config;
    private final Duration lockTimeout;
    private final Clock clock;

    public Mailbox(CrewMeshConfig config, Duration lockTimeout, Clock clock) {
        this.config = config;
        this.lockTimeout = lockTimeout;
        this.clock = clock;
    }

    public MailboxMessage send(String toId, String fromId, MessageType type, String content) {
        Path mailbox = config.mailboxFile(toId);
        MailboxMessage message = new MailboxMessage(fromId, type, content == null ? "" : content, clock.millis());
        String line = Jsons.toCompactJson(message) + "\n";
        try (AdvisoryLock ignored = AdvisoryLock.acquire(CrewMeshConfig.lockFileFor(mailbox), lockTimeout)) {
            Files.createDirectories(mailbox.getParent());
            Files.writeString(mailbox, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to send mail to " + toId, e);
        }
        return message;
    }

    /**
     * Returns every pending message for {@code workerId} in send order and empties the mailbox.
     */
    public List<MailboxMessage> readAndDrain(String workerId) {
        Path mailbox = config.mailboxFile(workerId);
        Path processing = processingFile(mailbox);
        try (AdvisoryLock ignored = AdvisoryLock.acquire(CrewMeshConfig.lockFileFor(mailbox), lockTimeout)) {
            List<MailboxMessage> messages = new ArrayList<>();
            if (Files.exists(processing)) {
                LOG.warn("[{}] recovering undelivered mail from {}", workerId, processing.getFileName());
                messages.addAll(parse(workerId, processing));
                Files.delete(processing);
            }
            if (Files.exists(mailbox)) {
                moveAside(mailbox, processing);
                messages.addAll(parse(workerId, processing));
                Files.delete(processing);
            }
            return messages;
        } catch (IOException e) {
            throw new RuntimeException("Failed to drain mailbox of " + workerId, e);
        }
    }

    /**
     * Puts drained but unhandled messages back ahead of anything sent since. They land in the
     * {@code .processing} file, which the next drain reads first.
     */
    public void requeue(String workerId, List<MailboxMessage> messages) {
        if (messages.isEmpty()) {
            return;
        }
        Path mailbox = config.mailboxFile(workerId);
        Path processing = processingFile(mailbox);
        StringBuilder lines = new StringBuilder();
        for (MailboxMessage message : messages) {
            lines.append(Jsons.toCompactJson(message)).append('\n');
        }
        try (AdvisoryLock ignored = AdvisoryLock.acquire(CrewMeshConfig.lockFileFor(mailbox), lockTimeout)) {
            Files.createDirectories(processing.getParent());
            Files.writeString(processing, lines.toString(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to requeue mail for " + workerId, e);
        }
        LOG.info("[{}] requeued {} unhandled message(s)", workerId, messages.size());
    }

    /**
     * Pending messages without draining them.
     */
    public List<MailboxMessage> peek(String workerId) {
        Path mailbox = config.mailboxFile(workerId);
        try (AdvisoryLock ignored = AdvisoryLock.acquire(CrewMeshConfig.lockFileFor(mailbox), lockTimeout)) {
            List<MailboxMessage> messages = new ArrayList<>();
            Path processing = processingFile(mailbox);
            if (Files.exists(processing)) {
                messages.addAll(parse(workerId, processing));
            }
            if (Files.exists(mailbox)) {
                messages.addAll(parse(workerId, mailbox));
            }
            return messages;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read mailbox of " + workerId, e);
        }
    }

    private static List<MailboxMessage> parse(String workerId, Path file) throws IOException {
        List<MailboxMessage> messages = new ArrayList<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            if (line.isBlank()) {
                continue;
            }
            try {
                MailboxMessage message = Jsons.mapper().readValue(line, MailboxMessage.class);
                messages.add(message.type() == null
                        ? new MailboxMessage(message.from(), MessageType.MESSAGE, message.content(), message.timestampMs())
                        : message);
            } catch (IOException e) {
                LOG.warn("[{}] skipping corrupt mailbox line: {}", workerId, e.getMessage());
            }
        }
        return messages;
    }

    private static void moveAside(Path mailbox, Path processing) throws IOException {
        try {
            Files.move(mailbox, processing, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(mailbox, processing, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static Path processingFile(Path mailbox) {
        return mailbox.resolveSibling(mailbox.getFileName().toString() + PROCESSING_SUFFIX);
    }
}
