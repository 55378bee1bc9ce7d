package io.teamrelay.cli;

import io.teamrelay.config.TeamRelayConfig;
import io.teamrelay.model.Member;
import io.teamrelay.model.Message;
import io.teamrelay.model.MessageType;
import io.teamrelay.model.Task;
import io.teamrelay.model.TaskStatus;
import io.teamrelay.observability.AuditLogger;
import io.teamrelay.runtime.TeamRelayRuntime;
import io.teamrelay.storage.StoreException;
import io.teamrelay.task.TaskUpdate;
import io.teamrelay.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

@Command(
        name = "teamrelay",
        mixinStandardHelpOptions = true,
        description = "File-backed coordination store for agent teams",
        subcommands = {
                TeamRelayCommand.TeamCreateCommand.class,
                TeamRelayCommand.TeamDeleteCommand.class,
                TeamRelayCommand.ConfigCommand.class,
                TeamRelayCommand.MemberAddCommand.class,
                TeamRelayCommand.MemberRemoveCommand.class,
                TeamRelayCommand.TaskCreateCommand.class,
                TeamRelayCommand.TaskUpdateCommand.class,
                TeamRelayCommand.TaskListCommand.class,
                TeamRelayCommand.TaskGetCommand.class,
                TeamRelayCommand.SendCommand.class,
                TeamRelayCommand.InboxCommand.class,
                TeamRelayCommand.PollCommand.class,
                TeamRelayCommand.BackendsCommand.class,
                TeamRelayCommand.HealthCommand.class,
                TeamRelayCommand.SpawnCommand.class,
                TeamRelayCommand.KillCommand.class,
                TeamRelayCommand.ShutdownApprovedCommand.class,
                TeamRelayCommand.AuditVerifyCommand.class
        }
)
public final class TeamRelayCommand implements Runnable {
    static final int EXIT_RETRYABLE = 2;

    @Spec
    CommandSpec spec;

    @Option(names = {"--root"}, description = "Coordination root directory (default: ~/.teamrelay)", defaultValue = "")
    String root;

    private final List<TeamRelayRuntime> opened = new ArrayList<>();

    /**
     * Command line with the JSON error contract: a {@link StoreException} prints
     * {@code {"error":kind,"message":...}} and exits 1, or 2 when retrying may succeed.
     */
    public static CommandLine newCommandLine() {
        CommandLine cli = new CommandLine(new TeamRelayCommand());
        cli.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            PrintWriter out = commandLine.getOut();
            if (ex instanceof StoreException store) {
                out.println(errorJson(store.kind().code(), store.getMessage()));
                out.flush();
                return store.retryable() ? EXIT_RETRYABLE : 1;
            }
            out.println(errorJson("internal", String.valueOf(ex.getMessage())));
            out.flush();
            return 1;
        });
        cli.setExecutionStrategy(parseResult -> {
            try {
                return new CommandLine.RunLast().execute(parseResult);
            } finally {
                cli.<TeamRelayCommand>getCommand().reportAuditWarnings(cli.getErr());
            }
        });
        return cli;
    }

    @Override
    public void run() {
        print("Use subcommands: team-create | team-delete | config | member-add | member-remove | task-create | task-update | task-list | task-get | send | inbox | poll | backends | health | spawn | kill | shutdown-approved | audit-verify");
    }

    TeamRelayRuntime runtime() {
        TeamRelayRuntime runtime = TeamRelayRuntime.open(TeamRelayConfig.fromRoot(root));
        opened.add(runtime);
        return runtime;
    }

    /**
     * The command's own output is already final when this runs; a failed audit append only adds a
     * warning line on stderr and does not change the exit code.
     */
    void reportAuditWarnings(PrintWriter err) {
        for (TeamRelayRuntime runtime : opened) {
            for (StoreException warning : runtime.auditWarnings()) {
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("warning", "audit_deferred");
                body.put("error", warning.kind().code());
                body.put("message", warning.getMessage());
                err.println(Jsons.toCompactJson(body));
            }
        }
        err.flush();
    }

    void print(Object value) {
        PrintWriter out = spec.commandLine().getOut();
        out.println(value instanceof String text ? text : Jsons.toJson(value));
        out.flush();
    }

    static String errorJson(String kind, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", kind);
        body.put("message", message);
        return Jsons.toCompactJson(body);
    }

    static TaskStatus parseStatus(String raw) {
        try {
            return TaskStatus.fromString(raw);
        } catch (IllegalArgumentException e) {
            throw StoreException.invalidArgument(e.getMessage());
        }
    }

    static MessageType parseMessageType(String raw) {
        try {
            return MessageType.fromString(raw);
        } catch (IllegalArgumentException e) {
            throw StoreException.invalidArgument(e.getMessage());
        }
    }

    @Command(name = "team-create", description = "Create a team with its lead member")
    static final class TeamCreateCommand implements Callable<Integer> {
        @ParentCommand
        TeamRelayCommand parent;

        @Parameters(index = "0", description = "Team name")
        String team;

        @Option(names = {"--description"}, defaultValue = "", description = "Team description")
        String description;

        @Override
        public Integer call() {
            try (TeamRelayRuntime runtime = parent.runtime()) {
                parent.print(runtime.createTeam(team, description));
                return 0;
            }
        }
    }

    @Command(name = "team-delete", description = "Delete a team once no teammate is alive")
    static final class TeamDeleteCommand implements Callable<Integer> {
        @ParentCommand
        TeamRelayCommand parent;

        @Parameters(index = "0", description = "Team name")
        String team;

        @Override
        public Integer call() {
            try (TeamRelayRuntime runtime = parent.runtime()) {
                runtime.deleteTeam(team);
                parent.print(Map.of("success", true, "message", "Team '" + team + "' deleted"));
                return 0;
            }
        }
    }

    @Command(name = "config", description = "Show a team config")
    static final class ConfigCommand implements Callable<Integer> {
        @ParentCommand
        TeamRelayCommand parent;

        @Parameters(index = "0", description = "Team name")
        String team;

        @Override
        public Integer call() {
            try (TeamRelayRuntime runtime = parent.runtime()) {
                parent.print(runtime.readConfig(team));
                return 0;
            }
        }
    }

    @Command(name = "member-add", description = "Register a teammate without spawning it")
    static final class MemberAddCommand implements Callable<Integer> {
        @ParentCommand
        TeamRelayCommand parent;

        @Parameters(index = "0", description = "Team name")
        String team;

        @Parameters(index = "1", description = "Member name")
        String name;

        @Option(names = {"--backend"}, defaultValue = "", description = "Backend name")
        String backend;

        @Option(names = {"--model"}, defaultValue = "", description = "Model or tier: fast|balanced|powerful")
        String model;

        @Option(names = {"--agent-type"}, defaultValue = "general-purpose", description = "Agent type")
        String agentType;

        @Option(names = {"--prompt"}, defaultValue = "", description = "Initial prompt")
        String prompt;

        @Option(names = {"--plan-mode"}, description = "Require plan approval")
        boolean planMode;

        @Override
        public Integer call() {
            try (TeamRelayRuntime runtime = parent.runtime()) {
                parent.print(runtime.addMember(team,
                        new TeamRelayRuntime.MemberSpec(name, backend, model, agentType, prompt, planMode)));
                return 0;
            }
        }
    }

    @Command(name = "member-remove", description = "Remove a teammate and reset its tasks")
    static final class MemberRemoveCommand implements Callable<Integer> {
        @ParentCommand
        TeamRelayCommand parent;

        @Parameters(index = "0", description = "Team name")
        String team;

        @Parameters(index = "1", description = "Member name")
        String name;

        @Override
        public Integer call() {
            try (TeamRelayRuntime runtime = parent.runtime()) {
                parent.print(runtime.removeMember(team, name));
                return 0;
            }
        }
    }

    @Command(name = "task-create", description = "Create a pending task")
    static final class TaskCreateCommand implements Callable<Integer> {
        @ParentCommand
        TeamRelayCommand parent;

        @Parameters(index = "0", description = "Team name")
        String team;

        @Option(names = {"--title"}, required = true, description = "Task title")
        String title;

        @Option(names = {"--description"}, defaultValue = "", description = "Task description")
        String description;

        @Option(names = {"--owner"}, description = "Owning member")
        String owner;

        @Option(names = {"--blocked-by"}, split = ",", description = "Ids of tasks that must complete first")
        List<Long> blockedBy = new ArrayList<>();

        @Option(names = {"--meta"}, description = "Metadata entry key=value")
        Map<String, String> metadata = new LinkedHashMap<>();

        @Override
        public Integer call() {
            try (TeamRelayRuntime runtime = parent.runtime()) {
                Task task = runtime.createTask(team, title, description, owner, blockedBy, new LinkedHashMap<>(metadata));
                parent.print(task);
                return 0;
            }
        }
    }

    @Command(name = "task-update", description = "Change status, owner, fields or dependencies of a task")
    static final class TaskUpdateCommand implements Callable<Integer> {
        @ParentCommand
        TeamRelayCommand parent;

        @Parameters(index = "0", description = "Team name")
        String team;

        @Parameters(index = "1", description = "Task id")
        long taskId;

        @Option(names = {"--status"}, description = "pending|in_progress|completed|deleted")
        String status;

        @Option(names = {"--owner"}, description = "New owner; empty string clears it")
        String owner;

        @Option(names = {"--title"}, description = "New title")
        String title;

        @Option(names = {"--description"}, description = "New description")
        String description;

        @Option(names = {"--add-blocks"}, split = ",", description = "Ids this task blocks")
        List<Long> addBlocks = new ArrayList<>();

        @Option(names = {"--add-blocked-by"}, split = ",", description = "Ids that block this task")
        List<Long> addBlockedBy = new ArrayList<>();

        @Option(names = {"--meta"}, description = "Metadata entry key=value")
        Map<String, String> metadata = new LinkedHashMap<>();

        @Option(names = {"--unset-meta"}, description = "Metadata key to remove")
        List<String> unsetMetadata = new ArrayList<>();

        @Override
        public Integer call() {
            Map<String, Object> patch = new LinkedHashMap<>(metadata);
            for (String key : unsetMetadata) {
                patch.put(key, null);
            }
            TaskUpdate update = new TaskUpdate(
                    parseStatus(status),
                    owner,
                    title,
                    description,
                    addBlocks,
                    addBlockedBy,
                    patch.isEmpty() ? null : patch
            );
            try (TeamRelayRuntime runtime = parent.runtime()) {
                parent.print(runtime.updateTask(team, taskId, update));
                return 0;
            }
        }
    }

    @Command(name = "task-list", description = "List tasks ordered by id")
    static final class TaskListCommand implements Callable<Integer> {
        @ParentCommand
        TeamRelayCommand parent;

        @Parameters(index = "0", description = "Team name")
        String team;

        @Override
        public Integer call() {
            try (TeamRelayRuntime runtime = parent.runtime()) {
                parent.print(runtime.listTasks(team));
                return 0;
            }
        }
    }

    @Command(name = "task-get", description = "Show one task")
    static final class TaskGetCommand implements Callable<Integer> {
        @ParentCommand
        TeamRelayCommand parent;

        @Parameters(index = "0", description = "Team name")
        String team;

        @Parameters(index = "1", description = "Task id")
        long taskId;

        @Override
        public Integer call() {
            try (TeamRelayRuntime runtime = parent.runtime()) {
                parent.print(runtime.getTask(team, taskId));
                return 0;
            }
        }
    }

    @Command(name = "send", description = "Send a message or protocol response")
    static final class SendCommand implements Callable<Integer> {
        @ParentCommand
        TeamRelayCommand parent;

        @Parameters(index = "0", description = "Team name")
        String team;

        @Option(names = {"--type"}, defaultValue = "direct",
                description = "direct|broadcast|shutdown_request|shutdown_response|plan_approval_response")
        String type;

        @Option(names = {"--from"}, description = "Sender (default: team-lead)")
        String sender;

        @Option(names = {"--to"}, description = "Recipient")
        String recipient;

        @Option(names = {"--content"}, defaultValue = "", description = "Message body")
        String content;

        @Option(names = {"--summary"}, defaultValue = "", description = "Short summary")
        String summary;

        @Option(names = {"--request-id"}, description = "Request id for responses")
        String requestId;

        @Option(names = {"--approve"}, negatable = true, description = "Approve (responses only)")
        Boolean approve;

        @Override
        public Integer call() {
            TeamRelayRuntime.SendCommand command = new TeamRelayRuntime.SendCommand(
                    parseMessageType(type), sender, recipient, content, summary, requestId, approve);
            try (TeamRelayRuntime runtime = parent.runtime()) {
                parent.print(runtime.sendMessage(team, command));
                return 0;
            }
        }
    }

    @Command(name = "inbox", description = "Read an agent's inbox")
    static final class InboxCommand implements Callable<Integer> {
        @ParentCommand
        TeamRelayCommand parent;

        @Parameters(index = "0", description = "Team name")
        String team;

        @Parameters(index = "1", description = "Agent name")
        String agent;

        @Option(names = {"--unread"}, description = "Only unread messages")
        boolean unreadOnly;

        @Option(names = {"--mark-read"}, description = "Mark returned messages as read")
        boolean markAsRead;

        @Override
        public Integer call() {
            try (TeamRelayRuntime runtime = parent.runtime()) {
                parent.print(runtime.readInbox(team, agent, unreadOnly, markAsRead));
                return 0;
            }
        }
    }

    @Command(name = "poll", description = "Wait for messages newer than an id")
    static final class PollCommand implements Callable<Integer> {
        @ParentCommand
        TeamRelayCommand parent;

        @Parameters(index = "0", description = "Team name")
        String team;

        @Parameters(index = "1", description = "Agent name")
        String agent;

        @Option(names = {"--since"}, defaultValue = "0", description = "Last message id already seen")
        long sinceId;

        @Option(names = {"--timeout-ms"}, defaultValue = "30000", description = "Maximum wait, capped at 30000")
        long timeoutMs;

        @Override
        public Integer call() {
            try (TeamRelayRuntime runtime = parent.runtime()) {
                List<Message> messages = runtime.pollInbox(team, agent, sinceId, Duration.ofMillis(timeoutMs));
                parent.print(messages);
                return 0;
            }
        }
    }

    @Command(name = "backends", description = "List agent CLI backends")
    static final class BackendsCommand implements Callable<Integer> {
        @ParentCommand
        TeamRelayCommand parent;

        @Override
        public Integer call() {
            try (TeamRelayRuntime runtime = parent.runtime()) {
                parent.print(runtime.listBackends());
                return 0;
            }
        }
    }

    @Command(name = "health", description = "Check whether a teammate's process is alive")
    static final class HealthCommand implements Callable<Integer> {
        @ParentCommand
        TeamRelayCommand parent;

        @Parameters(index = "0", description = "Team name")
        String team;

        @Parameters(index = "1", description = "Member name")
        String name;

        @Override
        public Integer call() {
            try (TeamRelayRuntime runtime = parent.runtime()) {
                TeamRelayRuntime.MemberHealth health = runtime.checkHealth(team, name);
                parent.print(health);
                return health.alive() ? 0 : 1;
            }
        }
    }

    @Command(name = "spawn", description = "Register a teammate and start it through a backend")
    static final class SpawnCommand implements Callable<Integer> {
        @ParentCommand
        TeamRelayCommand parent;

        @Parameters(index = "0", description = "Team name")
        String team;

        @Parameters(index = "1", description = "Member name")
        String name;

        @Option(names = {"--prompt"}, required = true, description = "Initial prompt")
        String prompt;

        @Option(names = {"--backend"}, defaultValue = "", description = "Backend name (default: claude-code or first available)")
        String backend;

        @Option(names = {"--model"}, defaultValue = "", description = "Model or tier: fast|balanced|powerful")
        String model;

        @Option(names = {"--agent-type"}, defaultValue = "general-purpose", description = "Agent type")
        String agentType;

        @Option(names = {"--plan-mode"}, description = "Require plan approval")
        boolean planMode;

        @Option(names = {"--cwd"}, defaultValue = "", description = "Working directory for the agent")
        String cwd;

        @Option(names = {"--await-result"},
                description = "For one-shot backends, wait until the teammate's output reaches team-lead")
        boolean awaitResult;

        @Override
        public Integer call() {
            try (TeamRelayRuntime runtime = parent.runtime()) {
                Member member = runtime.spawnTeammate(team,
                        new TeamRelayRuntime.MemberSpec(name, backend, model, agentType, prompt, planMode), cwd);
                Optional<CompletableFuture<Message>> pending = runtime.pendingResult(team, member.name());
                if (!awaitResult || pending.isEmpty()) {
                    parent.print(member);
                    return 0;
                }
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("member", member);
                body.put("result", awaitRelay(pending.get()));
                parent.print(body);
                return 0;
            }
        }

        private static Message awaitRelay(CompletableFuture<Message> pending) {
            try {
                return pending.join();
            } catch (CompletionException e) {
                if (e.getCause() instanceof StoreException store) {
                    throw store;
                }
                throw e;
            }
        }
    }

    @Command(name = "kill", description = "Force-kill a teammate and remove it")
    static final class KillCommand implements Callable<Integer> {
        @ParentCommand
        TeamRelayCommand parent;

        @Parameters(index = "0", description = "Team name")
        String team;

        @Parameters(index = "1", description = "Member name")
        String name;

        @Override
        public Integer call() {
            try (TeamRelayRuntime runtime = parent.runtime()) {
                parent.print(runtime.forceKill(team, name));
                return 0;
            }
        }
    }

    @Command(name = "shutdown-approved", description = "Finish an approved shutdown: stop and remove the teammate")
    static final class ShutdownApprovedCommand implements Callable<Integer> {
        @ParentCommand
        TeamRelayCommand parent;

        @Parameters(index = "0", description = "Team name")
        String team;

        @Parameters(index = "1", description = "Member name")
        String name;

        @Override
        public Integer call() {
            try (TeamRelayRuntime runtime = parent.runtime()) {
                parent.print(runtime.processShutdownApproved(team, name));
                return 0;
            }
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        TeamRelayCommand parent;

        @Override
        public Integer call() {
            try (TeamRelayRuntime runtime = parent.runtime()) {
                AuditLogger.Verification out = runtime.auditLogger().verify();
                parent.print(out);
                return out.ok() ? 0 : 1;
            }
        }
    }
}
