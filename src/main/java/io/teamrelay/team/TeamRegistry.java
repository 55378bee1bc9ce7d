package io.teamrelay.team;

import io.teamrelay.config.TeamRelayConfig;
import io.teamrelay.config.TeamRelayContext;
import io.teamrelay.model.Member;
import io.teamrelay.model.MemberStatus;
import io.teamrelay.model.TeamConfig;
import io.teamrelay.storage.DocumentStore;
import io.teamrelay.storage.LockManager;
import io.teamrelay.storage.StoreException;
import io.teamrelay.util.Names;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Team config documents: one per team, holding the ordered member list.
 */
public final class TeamRegistry {
    public static final List<String> COLOR_PALETTE = List.of(
            "blue", "green", "yellow", "purple", "orange", "pink", "cyan", "red"
    );

    private final TeamRelayContext context;
    private final Clock clock;

    public TeamRegistry(TeamRelayContext context) {
        this(context, Clock.systemUTC());
    }

    public TeamRegistry(TeamRelayContext context, Clock clock) {
        this.context = context;
        this.clock = clock;
    }

    public TeamConfig create(String name, String description) {
        return create(name, description, "");
    }

    public TeamConfig create(String name, String description, String leadModel) {
        Names.requireValid(name, "Team");
        long now = clock.millis();
        return store().modify(configFile(name), TeamConfig.class, current -> {
            if (current.isPresent()) {
                throw StoreException.alreadyExists("Team '" + name + "' already exists");
            }
            return new TeamConfig(
                    name,
                    description,
                    now,
                    TeamRelayConfig.LEAD_NAME,
                    List.of(Member.lead(leadModel, now))
            );
        }, context.settings().lockTimeout());
    }

    /**
     * Removes the team once no teammate is alive according to {@code probe}. The lead is the caller
     * and is not probed. Task and inbox writers are shut out by taking the graph lock and then the
     * inbox lock, in that order, inside the config lock. The team directory, lock markers included,
     * goes once the locks are released.
     */
    public TeamConfig delete(String name, HealthProbe probe) {
        Names.requireValid(name, "Team");
        Path configFile = configFile(name);
        TeamRelayConfig layout = context.config();
        TeamConfig deleted = store().withLock(LockManager.lockPathFor(configFile), context.settings().lockTimeout(), () -> {
            TeamConfig config = store().read(configFile, TeamConfig.class)
                    .orElseThrow(() -> StoreException.notFound("Team '" + name + "' not found"));
            List<String> alive = config.teammates().stream()
                    .filter(member -> probe.statusOf(member) == MemberStatus.ALIVE)
                    .map(Member::name)
                    .toList();
            if (!alive.isEmpty()) {
                throw StoreException.teammatesActive(
                        "Cannot delete team '" + name + "': " + alive.size()
                                + " teammate(s) still active: " + String.join(", ", alive));
            }
            Duration timeout = context.settings().lockTimeout();
            store().withLock(layout.taskGraphLock(name), timeout, () ->
                    store().withLock(layout.inboxLock(name), timeout, () -> {
                        store().deleteTree(layout.tasksDir(name));
                        store().deleteTree(layout.inboxesDir(name));
                        store().delete(configFile);
                        return null;
                    }));
            return config;
        });
        store().deleteTree(layout.teamDir(name));
        return deleted;
    }

    public TeamConfig readConfig(String name) {
        return findConfig(name).orElseThrow(() -> StoreException.notFound("Team '" + name + "' not found"));
    }

    public Optional<TeamConfig> findConfig(String name) {
        Names.requireValid(name, "Team");
        return store().read(configFile(name), TeamConfig.class);
    }

    public boolean exists(String name) {
        return Names.isValid(name) && store().exists(configFile(name));
    }

    /**
     * Appends a teammate. The colour is taken from the palette in join order unless the candidate
     * already carries one; the join time defaults to now.
     */
    public Member addMember(String team, Member candidate) {
        String memberName = Names.requireValid(candidate.name(), "Agent");
        if (TeamRelayConfig.LEAD_NAME.equals(memberName)) {
            throw StoreException.invalidName("Agent name '" + TeamRelayConfig.LEAD_NAME + "' is reserved");
        }
        long now = clock.millis();
        AtomicReference<Member> stored = new AtomicReference<>();
        store().modify(configFile(team), TeamConfig.class, current -> {
            TeamConfig config = current.orElseThrow(() -> StoreException.notFound("Team '" + team + "' not found"));
            if (config.hasMember(memberName)) {
                throw StoreException.alreadyExists(
                        "Member '" + memberName + "' already exists in team '" + team + "'");
            }
            String color = candidate.color() == null || candidate.color().isBlank()
                    ? COLOR_PALETTE.get(config.teammates().size() % COLOR_PALETTE.size())
                    : candidate.color();
            Member member = new Member(
                    memberName,
                    candidate.agentType(),
                    candidate.backend(),
                    candidate.model(),
                    color,
                    candidate.prompt(),
                    candidate.planModeRequired(),
                    candidate.joinedAt() > 0L ? candidate.joinedAt() : now,
                    candidate.processHandle(),
                    candidate.status()
            );
            stored.set(member);
            return config.withMember(member);
        }, context.settings().lockTimeout());
        return stored.get();
    }

    public Member removeMember(String team, String memberName) {
        if (TeamRelayConfig.LEAD_NAME.equals(memberName)) {
            throw StoreException.invalidName("Cannot remove " + TeamRelayConfig.LEAD_NAME);
        }
        AtomicReference<Member> removed = new AtomicReference<>();
        store().modify(configFile(team), TeamConfig.class, current -> {
            TeamConfig config = current.orElseThrow(() -> StoreException.notFound("Team '" + team + "' not found"));
            removed.set(config.findMember(memberName).orElseThrow(() -> StoreException.notFound(
                    "Member '" + memberName + "' not found in team '" + team + "'")));
            return config.withoutMember(memberName);
        }, context.settings().lockTimeout());
        return removed.get();
    }

    public Member updateMember(String team, String memberName, UnaryOperator<Member> change) {
        AtomicReference<Member> updated = new AtomicReference<>();
        store().modify(configFile(team), TeamConfig.class, current -> {
            TeamConfig config = current.orElseThrow(() -> StoreException.notFound("Team '" + team + "' not found"));
            Member existing = config.findMember(memberName).orElseThrow(() -> StoreException.notFound(
                    "Member '" + memberName + "' not found in team '" + team + "'"));
            Member next = change.apply(existing);
            if (!existing.name().equals(next.name())) {
                throw StoreException.invalidArgument("Member name cannot change: " + existing.name());
            }
            updated.set(next);
            return config.replaceMember(next);
        }, context.settings().lockTimeout());
        return updated.get();
    }

    private Path configFile(String team) {
        return context.config().configFile(Names.requireValid(team, "Team"));
    }

    private DocumentStore store() {
        return context.store();
    }
}
