package io.teamrelay.mailbox;

import io.teamrelay.config.TeamRelayConfig;
import io.teamrelay.config.TeamRelayContext;
import io.teamrelay.model.Mailbox;
import io.teamrelay.model.Message;
import io.teamrelay.model.MessageType;
import io.teamrelay.storage.DocumentStore;
import io.teamrelay.storage.StoreException;
import io.teamrelay.util.Names;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-agent mailbox documents. Appends and read-marking of every mailbox in a team share the
 * {@code inboxes/.lock} marker, so ids within one mailbox are gap-free and strictly increasing.
 */
public final class MailboxEngine {
    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private final TeamRelayContext context;
    private final Clock clock;

    public MailboxEngine(TeamRelayContext context) {
        this(context, Clock.systemUTC());
    }

    public MailboxEngine(TeamRelayContext context, Clock clock) {
        this.context = context;
        this.clock = clock;
    }

    public void ensureMailbox(String team, String agent) {
        Path file = inboxFile(team, agent);
        requireTeam(team);
        store().modify(file, layout().inboxLock(team), Mailbox.class, current -> {
            requireTeam(team);
            return current.orElse(Mailbox.empty());
        }, timeout());
    }

    public Message send(String team, String recipient, MessageDraft draft) {
        Path file = inboxFile(team, recipient);
        requireTeam(team);
        String storedRecipient = draft.type() == MessageType.BROADCAST ? null : recipient;
        AtomicReference<Message> appended = new AtomicReference<>();
        store().modify(file, layout().inboxLock(team), Mailbox.class, current -> {
            requireTeam(team);
            Mailbox mailbox = current.orElse(Mailbox.empty());
            Message message = new Message(
                    mailbox.lastId() + 1L,
                    draft.type(),
                    draft.sender(),
                    storedRecipient,
                    draft.content(),
                    draft.summary(),
                    draft.requestId(),
                    draft.approve(),
                    draft.color(),
                    false,
                    TIMESTAMP.format(clock.instant())
            );
            appended.set(message);
            return mailbox.append(message);
        }, timeout());
        return appended.get();
    }

    /**
     * Appends {@code draft} to each recipient in turn. A failure part-way leaves the earlier
     * recipients' copies in place.
     */
    public List<Message> broadcast(String team, Collection<String> recipients, MessageDraft draft) {
        MessageDraft broadcast = draft.withType(MessageType.BROADCAST);
        List<Message> delivered = new ArrayList<>();
        for (String recipient : recipients) {
            delivered.add(send(team, recipient, broadcast));
        }
        return delivered;
    }

    /**
     * Returns the agent's messages in id order, optionally only unread ones. With {@code markAsRead}
     * the returned messages are flagged read in the same locked step.
     */
    public List<Message> read(String team, String agent, boolean unreadOnly, boolean markAsRead) {
        Path file = inboxFile(team, agent);
        requireTeam(team);
        if (!markAsRead) {
            return select(store().read(file, Mailbox.class).orElse(Mailbox.empty()), unreadOnly);
        }
        AtomicReference<List<Message>> selected = new AtomicReference<>(List.of());
        store().modify(file, layout().inboxLock(team), Mailbox.class, current -> {
            requireTeam(team);
            if (current.isEmpty()) {
                return null;
            }
            Mailbox mailbox = current.get();
            List<Message> picked = select(mailbox, unreadOnly);
            selected.set(picked);
            if (picked.stream().allMatch(Message::read)) {
                return mailbox;
            }
            return mailbox.withMessages(mailbox.messages().stream().map(message -> message.withRead(true)).toList());
        }, timeout());
        List<Message> out = new ArrayList<>(selected.get().size());
        for (Message message : selected.get()) {
            out.add(message.withRead(true));
        }
        return out;
    }

    /**
     * Lock-free snapshot of messages with an id above {@code sinceId}. Read flags are left alone.
     */
    public List<Message> readSince(String team, String agent, long sinceId) {
        Mailbox mailbox = store().read(inboxFile(team, agent), Mailbox.class).orElse(Mailbox.empty());
        List<Message> out = new ArrayList<>();
        for (Message message : mailbox.messages()) {
            if (message.id() > sinceId) {
                out.add(message);
            }
        }
        return out;
    }

    public long lastId(String team, String agent) {
        return store().read(inboxFile(team, agent), Mailbox.class).map(Mailbox::lastId).orElse(0L);
    }

    /**
     * Also re-run inside every locked mailbox edit: a team delete holds the inbox lock while it
     * removes the mailboxes, so an edit that waited on it must not recreate them.
     */
    void requireTeam(String team) {
        if (!store().exists(layout().configFile(team))) {
            throw StoreException.notFound("Team '" + team + "' not found");
        }
    }

    private static List<Message> select(Mailbox mailbox, boolean unreadOnly) {
        if (!unreadOnly) {
            return mailbox.messages();
        }
        return mailbox.messages().stream().filter(message -> !message.read()).toList();
    }

    private Path inboxFile(String team, String agent) {
        return layout().inboxFile(Names.requireValid(team, "Team"), Names.requireValid(agent, "Agent"));
    }

    private TeamRelayConfig layout() {
        return context.config();
    }

    private Duration timeout() {
        return context.settings().lockTimeout();
    }

    private DocumentStore store() {
        return context.store();
    }
}
