package com.strata.core.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Validated command mailbox of one running workflow.
 * <p>
 * Any number of producers may enqueue; the workflow's scheduler is the single consumer.
 * Commands are checked against their variant's rules before they are admitted. An
 * invalid command is counted as rejected and reported with {@link InvalidCommandException};
 * it is never dropped silently.
 */
public class CommandQueue {

    private static final Logger log = LoggerFactory.getLogger(CommandQueue.class);

    private final AsyncQueue<Command> queue = new AsyncQueue<>();
    private final ObjectMapper objectMapper;

    private final AtomicLong total = new AtomicLong();
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();

    public CommandQueue(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public CommandQueue() {
        this(new ObjectMapper());
    }

    public void enqueue(Command command) {
        List<String> violations = command == null
                ? List.of("command must not be null")
                : command.violations();
        if (!violations.isEmpty()) {
            rejected.incrementAndGet();
            String message = "Invalid command " + describe(command) + ": " + String.join("; ", violations);
            log.warn(message);
            throw new InvalidCommandException(message);
        }
        queue.enqueue(command);
        total.incrementAndGet();
        log.debug("Command enqueued: {}", command.type().wireName());
    }

    /**
     * Decodes a command from its JSON form and enqueues it.
     *
     * @return the admitted command
     */
    public Command enqueueJson(String json) {
        Command command;
        try {
            command = objectMapper.readValue(json, Command.class);
        } catch (JsonProcessingException e) {
            rejected.incrementAndGet();
            log.warn("Rejected undecodable command: {}", e.getOriginalMessage());
            throw new InvalidCommandException("Invalid command: " + e.getOriginalMessage(), e);
        }
        enqueue(command);
        return command;
    }

    /**
     * Takes every command queued at call time without waiting for more.
     */
    public List<Command> processCommands() {
        List<Command> commands = queue.drainSync();
        recordProcessed(commands.size());
        return commands;
    }

    /**
     * Takes commands until the queue is empty, consuming each through the waiting path.
     * Returns immediately with an empty list when nothing is queued.
     */
    public List<Command> processCommandsAsync() throws InterruptedException {
        var commands = new ArrayList<Command>();
        while (!queue.isEmpty()) {
            Command next = queue.poll(Duration.ZERO);
            if (next == null) {
                break;
            }
            commands.add(next);
        }
        recordProcessed(commands.size());
        return commands;
    }

    /**
     * Takes only commands of the given types; the rest stay queued in their original order.
     */
    public List<Command> processCommandsByType(Set<CommandType> types) {
        Set<CommandType> wanted = types.isEmpty() ? EnumSet.noneOf(CommandType.class) : EnumSet.copyOf(types);
        List<Command> matching = queue.drainMatching(c -> wanted.contains(c.type()));
        if (!matching.isEmpty()) {
            processed.addAndGet(matching.size());
            log.info("Processed {} command(s) of types {}", matching.size(), wanted);
        }
        return matching;
    }

    /**
     * Waits for the next command without polling.
     *
     * @return the command, or {@code null} when {@code timeout} elapses first
     */
    public Command waitForCommand(Duration timeout) throws InterruptedException {
        Command command = queue.poll(timeout);
        if (command != null) {
            processed.incrementAndGet();
            log.debug("Command received: {}", command.type().wireName());
        }
        return command;
    }

    public boolean hasPendingCommands() {
        return !queue.isEmpty();
    }

    public int size() {
        return queue.size();
    }

    public void clear() {
        queue.clear();
    }

    public CommandQueueStats getStats() {
        return new CommandQueueStats(total.get(), processed.get(), rejected.get());
    }

    private void recordProcessed(int count) {
        if (count > 0) {
            processed.addAndGet(count);
            log.info("Processed {} command(s)", count);
        }
    }

    private static String describe(Command command) {
        return command == null ? "null" : command.type().wireName();
    }
}
