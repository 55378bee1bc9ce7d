package io.teamrelay.runtime;

import io.teamrelay.backend.Backend;
import io.teamrelay.backend.BackendRegistry;
import io.teamrelay.backend.HealthStatus;
import io.teamrelay.backend.ProcessBackend;
import io.teamrelay.backend.SpawnRequest;
import io.teamrelay.backend.SpawnResult;
import io.teamrelay.config.TeamRelayConfig;
import io.teamrelay.config.TeamRelayContext;
import io.teamrelay.mailbox.InboxPoller;
import io.teamrelay.mailbox.MailboxEngine;
import io.teamrelay.mailbox.MessageDraft;
import io.teamrelay.model.Member;
import io.teamrelay.model.MemberStatus;
import io.teamrelay.model.Message;
import io.teamrelay.model.MessageType;
import io.teamrelay.model.Task;
import io.teamrelay.model.TaskStatus;
import io.teamrelay.model.TeamConfig;
import io.teamrelay.observability.AuditLogger;
import io.teamrelay.observability.AuditLogger.AuditEvent;
import io.teamrelay.storage.StoreException;
import io.teamrelay.task.TaskGraphEngine;
import io.teamrelay.task.TaskUpdate;
import io.teamrelay.team.HealthProbe;
import io.teamrelay.team.TeamRegistry;
import io.teamrelay.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

public final class TeamRelayRuntime implements AutoCloseable {
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(10);

    private final TeamRelayContext context;
    private final TeamRegistry teams;
    private final TaskGraphEngine tasks;
    private final MailboxEngine mailboxes;
    private final InboxPoller poller;
    private final TeammateResultRelay resultRelay;
    private final Map<String, CompletableFuture<Message>> pendingResults = new ConcurrentHashMap<>();
    private final BackendRegistry backends;
    private final AuditLogger auditLogger;
    private final Clock clock;
    private final List<StoreException> auditWarnings = new CopyOnWriteArrayList<>();

    public TeamRelayRuntime(TeamRelayContext context, BackendRegistry backends) {
        this(context, backends, Clock.systemUTC());
    }

    public TeamRelayRuntime(TeamRelayContext context, BackendRegistry backends, Clock clock) {
        this.context = context;
        this.clock = clock;
        this.teams = new TeamRegistry(context, clock);
        this.tasks = new TaskGraphEngine(context, teams);
        this.mailboxes = new MailboxEngine(context, clock);
        this.poller = new InboxPoller(mailboxes, context.settings());
        this.resultRelay = new TeammateResultRelay(mailboxes, context.settings());
        this.backends = backends;
        this.auditLogger = new AuditLogger(
                context.config().auditRoot().resolve("audit.log"),
                context.store().lockManager(),
                context.settings().lockTimeout(),
                clock
        );
    }

    public static TeamRelayRuntime open(TeamRelayConfig config) {
        return new TeamRelayRuntime(TeamRelayContext.open(config), BackendRegistry.loadDefaults());
    }

    public TeamRelayContext context() {
        return context;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    /**
     * Audit appends that failed after their operation had already committed. Those rows are written
     * ahead of the next successful append, or on {@link #close()}.
     */
    public List<StoreException> auditWarnings() {
        return List.copyOf(auditWarnings);
    }

    public TeamConfig createTeam(String name, String description) {
        return audited("team.create", TeamRelayConfig.LEAD_NAME, name, name, () -> {
            TeamConfig created = teams.create(name, description);
            mailboxes.ensureMailbox(name, TeamRelayConfig.LEAD_NAME);
            return created;
        });
    }

    /**
     * Deletes the team when no teammate process is alive. Liveness comes from each member's backend
     * when it has a process handle and from the recorded status otherwise.
     */
    public TeamConfig deleteTeam(String name) {
        return audited("team.delete", TeamRelayConfig.LEAD_NAME, name, name,
                () -> teams.delete(name, this::probe));
    }

    public TeamConfig readConfig(String team) {
        return teams.readConfig(team);
    }

    public Member addMember(String team, MemberSpec spec) {
        return audited("member.add", TeamRelayConfig.LEAD_NAME, team, spec.name(), () -> {
            Member member = teams.addMember(team, spec.toMember(resolveModel(spec)));
            mailboxes.ensureMailbox(team, member.name());
            return member;
        });
    }

    /**
     * Drops the member from the config and returns its unfinished tasks to the pool.
     */
    public RemovalOutcome removeMember(String team, String name) {
        return audited("member.remove", TeamRelayConfig.LEAD_NAME, team, name, () -> {
            Member removed = teams.removeMember(team, name);
            List<Task> reset = tasks.resetOwnerTasks(team, name);
            return new RemovalOutcome(removed, reset);
        });
    }

    /**
     * Kills the member's process through its backend, then removes it like {@link #removeMember}.
     */
    public RemovalOutcome forceKill(String team, String name) {
        Member member = requireTeammate(team, name);
        if (!member.processHandle().isBlank()) {
            backends.find(member.backend()).ifPresent(backend -> backend.kill(member.processHandle()));
        }
        return removeMember(team, name);
    }

    public Task createTask(
            String team,
            String title,
            String description,
            String owner,
            Collection<Long> blockedBy,
            Map<String, Object> metadata
    ) {
        return audited("task.create", TeamRelayConfig.LEAD_NAME, team, title, () -> {
            Task created = tasks.create(team, title, description, owner, blockedBy, metadata);
            if (created.owner() != null) {
                notifyAssignment(team, created);
            }
            return created;
        });
    }

    public Task updateTask(String team, long id, TaskUpdate update) {
        return audited("task.update", TeamRelayConfig.LEAD_NAME, team, String.valueOf(id), () -> {
            Task updated = tasks.update(team, id, update);
            if (update.changesOwner() && updated.owner() != null && updated.status() != TaskStatus.DELETED) {
                notifyAssignment(team, updated);
            }
            return updated;
        });
    }

    public List<Task> listTasks(String team) {
        return tasks.list(team);
    }

    public Task getTask(String team, long id) {
        return tasks.get(team, id);
    }

    public SendOutcome sendMessage(String team, SendCommand command) {
        String sender = command.sender() == null || command.sender().isBlank()
                ? TeamRelayConfig.LEAD_NAME
                : command.sender();
        String resource = command.recipient() == null ? command.type().wire() : command.recipient();
        return audited("message." + command.type().wire(), sender, team, resource,
                () -> route(team, sender, command));
    }

    public List<Message> readInbox(String team, String agent, boolean unreadOnly, boolean markAsRead) {
        return mailboxes.read(team, agent, unreadOnly, markAsRead);
    }

    public CompletableFuture<List<Message>> pollInboxAsync(String team, String agent, long sinceId, Duration maxWait) {
        return poller.poll(team, agent, sinceId, maxWait);
    }

    public List<Message> pollInbox(String team, String agent, long sinceId, Duration maxWait) {
        return poller.await(team, agent, sinceId, maxWait);
    }

    public List<BackendInfo> listBackends() {
        List<BackendInfo> out = new ArrayList<>();
        for (String name : backends.listNames()) {
            Backend backend = backends.get(name);
            out.add(new BackendInfo(
                    name,
                    backend.binaryName(),
                    backend.isAvailable(),
                    backend.defaultModel(),
                    backend.supportedModels()
            ));
        }
        return out;
    }

    /**
     * Asks the member's backend whether its process is alive and records the answer in the config.
     */
    public MemberHealth checkHealth(String team, String name) {
        Member member = requireTeammate(team, name);
        if (member.processHandle().isBlank()) {
            throw StoreException.invalidArgument("No process handle for teammate '" + name + "'");
        }
        Backend backend = backends.get(member.backend());
        HealthStatus status = backend.healthCheck(member.processHandle());
        MemberStatus observed = status.alive() ? MemberStatus.ALIVE : MemberStatus.DEAD;
        teams.updateMember(team, name, current -> current.withStatus(observed));
        return new MemberHealth(name, status.alive(), backend.name(), status.detail());
    }

    /**
     * Registers the member, queues its prompt in its inbox and starts it through the backend. When
     * the backend cannot start it the registration is rolled back.
     *
     * <p>A one-shot backend writes its output under the team's {@code runs} directory. Once the
     * process exits, the output is sent to the lead's inbox; see {@link #pendingResult}.
     */
    public Member spawnTeammate(String team, MemberSpec spec, String cwd) {
        return audited("member.spawn", TeamRelayConfig.LEAD_NAME, team, spec.name(), () -> {
            String backendName = spec.backend() == null || spec.backend().isBlank()
                    ? backends.defaultBackend()
                    : spec.backend();
            Backend backend = backends.get(backendName);
            MemberSpec resolved = spec.withBackend(backendName);
            Member member = teams.addMember(team, resolved.toMember(resolveModel(resolved)));
            try {
                mailboxes.ensureMailbox(team, member.name());
                mailboxes.send(team, member.name(), MessageDraft.direct(
                        TeamRelayConfig.LEAD_NAME, member.prompt(), "initial prompt"));
                Path outputFile = null;
                Map<String, String> extra = Map.of();
                if (!backend.isInteractive()) {
                    outputFile = context.config().runOutputFile(team, member.name(), clock.millis());
                    Files.createDirectories(outputFile.getParent());
                    extra = Map.of(ProcessBackend.OUTPUT_PATH_KEY, outputFile.toString());
                }
                SpawnResult result = backend.spawn(new SpawnRequest(
                        member.name() + "@" + team,
                        member.name(),
                        team,
                        member.prompt(),
                        member.model(),
                        member.agentType(),
                        member.color(),
                        cwd,
                        TeamRelayConfig.LEAD_NAME + "@" + team,
                        member.planModeRequired(),
                        extra
                ));
                Member started = teams.updateMember(team, member.name(), current -> current
                        .withProcessHandle(result.processHandle())
                        .withStatus(MemberStatus.ALIVE));
                if (outputFile != null) {
                    pendingResults.put(resultKey(team, started.name()),
                            resultRelay.watch(team, started, backend, outputFile));
                }
                return started;
            } catch (IOException e) {
                throw rollback(team, member, StoreException.io("Failed to spawn " + member.name(), e));
            } catch (IllegalArgumentException | IllegalStateException e) {
                throw rollback(team, member, StoreException.invalidArgument(e.getMessage()));
            } catch (StoreException e) {
                throw rollback(team, member, e);
            }
        });
    }

    /**
     * The relay of a one-shot teammate's output, started by {@link #spawnTeammate} in this runtime.
     * The future completes with the message delivered to the lead.
     */
    public Optional<CompletableFuture<Message>> pendingResult(String team, String name) {
        return Optional.ofNullable(pendingResults.get(resultKey(team, name)));
    }

    /**
     * Final step of an approved shutdown: stop the process if it still runs, then remove the member.
     */
    public RemovalOutcome processShutdownApproved(String team, String name) {
        Member member = requireTeammate(team, name);
        if (!member.processHandle().isBlank()) {
            backends.find(member.backend())
                    .ifPresent(backend -> backend.gracefulShutdown(member.processHandle(), SHUTDOWN_GRACE));
        }
        return removeMember(team, name);
    }

    @Override
    public void close() {
        poller.close();
        resultRelay.close();
        if (auditLogger.deferredCount() > 0) {
            try {
                auditLogger.flushDeferred();
            } catch (StoreException e) {
                auditWarnings.add(e);
            }
        }
    }

    private SendOutcome route(String team, String sender, SendCommand command) {
        TeamConfig config = teams.readConfig(team);
        switch (command.type()) {
            case DIRECT: {
                requireText(command.content(), "Message content");
                requireText(command.summary(), "Message summary");
                Member target = requireRecipient(config, command.recipient());
                Message sent = mailboxes.send(team, target.name(), new MessageDraft(
                        MessageType.DIRECT, sender, command.content(), command.summary(), null, null, target.color()));
                return new SendOutcome("Message sent to " + target.name(), null, List.of(sent));
            }
            case BROADCAST: {
                requireText(command.summary(), "Broadcast summary");
                List<String> recipients = config.teammates().stream()
                        .map(Member::name)
                        .filter(name -> !name.equals(sender))
                        .toList();
                List<Message> sent = mailboxes.broadcast(team, recipients, new MessageDraft(
                        MessageType.BROADCAST, sender, command.content(), command.summary(), null, null, null));
                return new SendOutcome("Broadcast sent to " + sent.size() + " teammate(s)", null, sent);
            }
            case SHUTDOWN_REQUEST: {
                if (TeamRelayConfig.LEAD_NAME.equals(command.recipient())) {
                    throw StoreException.invalidArgument("Cannot send shutdown request to " + TeamRelayConfig.LEAD_NAME);
                }
                Member target = requireRecipient(config, command.recipient());
                String requestId = "shutdown-" + clock.millis() + "@" + target.name();
                Message sent = mailboxes.send(team, target.name(), new MessageDraft(
                        MessageType.SHUTDOWN_REQUEST, TeamRelayConfig.LEAD_NAME, command.content(),
                        "shutdown_request", requestId, null, null));
                return new SendOutcome("Shutdown request sent to " + target.name(), requestId, List.of(sent));
            }
            case SHUTDOWN_RESPONSE: {
                requireText(command.requestId(), "Shutdown response request id");
                boolean approve = Boolean.TRUE.equals(command.approve());
                String content;
                if (approve) {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("type", "shutdown_approved");
                    body.put("requestId", command.requestId());
                    body.put("from", sender);
                    config.findMember(sender).ifPresent(member -> {
                        body.put("backend", member.backend());
                        body.put("processHandle", member.processHandle());
                    });
                    content = Jsons.toCompactJson(body);
                } else {
                    content = blankToDefault(command.content(), "Shutdown rejected");
                }
                Message sent = mailboxes.send(team, TeamRelayConfig.LEAD_NAME, new MessageDraft(
                        MessageType.SHUTDOWN_RESPONSE, sender, content,
                        approve ? "shutdown_approved" : "shutdown_rejected", command.requestId(), approve, null));
                return new SendOutcome(
                        "Shutdown " + (approve ? "approved" : "rejected") + " for request " + command.requestId(),
                        command.requestId(),
                        List.of(sent));
            }
            case PLAN_APPROVAL_RESPONSE: {
                Member target = requireRecipient(config, command.recipient());
                boolean approve = Boolean.TRUE.equals(command.approve());
                String content = approve
                        ? "{\"type\":\"plan_approval\",\"approved\":true}"
                        : blankToDefault(command.content(), "Plan rejected");
                Message sent = mailboxes.send(team, target.name(), new MessageDraft(
                        MessageType.PLAN_APPROVAL_RESPONSE, sender, content,
                        approve ? "plan_approved" : "plan_rejected", command.requestId(), approve, null));
                return new SendOutcome(
                        "Plan " + (approve ? "approved" : "rejected") + " for " + target.name(),
                        command.requestId(),
                        List.of(sent));
            }
            default:
                throw StoreException.invalidArgument("Unknown message type: " + command.type());
        }
    }

    private void notifyAssignment(String team, Task task) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", "task_assignment");
        body.put("taskId", task.id());
        body.put("title", task.title());
        body.put("description", task.description());
        body.put("assignedBy", TeamRelayConfig.LEAD_NAME);
        mailboxes.send(team, task.owner(), MessageDraft.direct(
                TeamRelayConfig.LEAD_NAME, Jsons.toCompactJson(body), "task_assignment"));
    }

    private MemberStatus probe(Member member) {
        if (member.processHandle().isBlank()) {
            return member.status();
        }
        Optional<Backend> backend = backends.find(member.backend());
        if (backend.isEmpty()) {
            return member.status();
        }
        return backend.get().healthCheck(member.processHandle()).alive() ? MemberStatus.ALIVE : MemberStatus.DEAD;
    }

    private String resolveModel(MemberSpec spec) {
        if (spec.backend() == null || spec.backend().isBlank()) {
            return spec.model() == null ? "" : spec.model();
        }
        Backend backend = backends.get(spec.backend());
        try {
            return backend.resolveModel(spec.model());
        } catch (IllegalArgumentException e) {
            throw StoreException.invalidArgument(e.getMessage());
        }
    }

    private Member requireTeammate(String team, String name) {
        if (TeamRelayConfig.LEAD_NAME.equals(name)) {
            throw StoreException.invalidName("Operation not allowed on " + TeamRelayConfig.LEAD_NAME);
        }
        return teams.readConfig(team).findMember(name).orElseThrow(() ->
                StoreException.notFound("Teammate '" + name + "' not found in team '" + team + "'"));
    }

    private static Member requireRecipient(TeamConfig config, String recipient) {
        requireText(recipient, "Message recipient");
        return config.findMember(recipient).orElseThrow(() -> StoreException.invalidArgument(
                "Recipient '" + recipient + "' is not a member of team '" + config.name() + "'"));
    }

    private static void requireText(String value, String what) {
        if (value == null || value.isBlank()) {
            throw StoreException.invalidArgument(what + " must not be empty");
        }
    }

    private static String blankToDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    private static String resultKey(String team, String name) {
        return team + "/" + name;
    }

    private StoreException rollback(String team, Member member, StoreException failure) {
        try {
            teams.removeMember(team, member.name());
        } catch (StoreException cleanup) {
            failure.addSuppressed(cleanup);
        }
        return failure;
    }

    /**
     * Runs {@code operation} and records its outcome. An audit append that fails after the operation
     * committed does not change the operation's result; the row is deferred and the failure is kept
     * in {@link #auditWarnings()}.
     */
    private <T> T audited(String action, String actor, String team, String resource, Supplier<T> operation) {
        T result;
        try {
            result = operation.get();
        } catch (StoreException e) {
            auditLogger.logOrDefer(AuditEvent.rejected(action, actor, team, resource, e)).ifPresent(auditFailure -> {
                auditWarnings.add(auditFailure);
                e.addSuppressed(auditFailure);
            });
            throw e;
        }
        auditLogger.logOrDefer(AuditEvent.ok(action, actor, team, resource, Map.of())).ifPresent(auditWarnings::add);
        return result;
    }

    public record MemberSpec(
            String name,
            String backend,
            String model,
            String agentType,
            String prompt,
            boolean planModeRequired
    ) {
        public MemberSpec withBackend(String next) {
            return new MemberSpec(name, next, model, agentType, prompt, planModeRequired);
        }

        Member toMember(String resolvedModel) {
            return new Member(
                    name,
                    agentType == null || agentType.isBlank() ? "general-purpose" : agentType,
                    backend == null ? "" : backend,
                    resolvedModel,
                    null,
                    prompt == null ? "" : prompt,
                    planModeRequired,
                    0L,
                    "",
                    MemberStatus.UNKNOWN
            );
        }
    }

    public record SendCommand(
            MessageType type,
            String sender,
            String recipient,
            String content,
            String summary,
            String requestId,
            Boolean approve
    ) {
        public SendCommand {
            type = type == null ? MessageType.DIRECT : type;
        }

        public static SendCommand direct(String recipient, String content, String summary) {
            return new SendCommand(MessageType.DIRECT, null, recipient, content, summary, null, null);
        }
    }

    public record SendOutcome(String message, String requestId, List<Message> delivered) {
    }

    public record RemovalOutcome(Member member, List<Task> resetTasks) {
    }

    public record MemberHealth(String agentName, boolean alive, String backend, String detail) {
    }

    public record BackendInfo(
            String name,
            String binary,
            boolean available,
            String defaultModel,
            List<String> supportedModels
    ) {
    }
}
