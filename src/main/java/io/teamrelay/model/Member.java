package io.teamrelay.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.teamrelay.config.TeamRelayConfig;

public record Member(
        String name,
        String agentType,
        String backend,
        String model,
        String color,
        String prompt,
        boolean planModeRequired,
        long joinedAt,
        String processHandle,
        MemberStatus status
) {
    public Member {
        if (status == null) {
            status = MemberStatus.UNKNOWN;
        }
        if (processHandle == null) {
            processHandle = "";
        }
    }

    public static Member lead(String model, long joinedAt) {
        return new Member(
                TeamRelayConfig.LEAD_NAME,
                TeamRelayConfig.LEAD_NAME,
                "",
                model == null ? "" : model,
                null,
                null,
                false,
                joinedAt,
                "",
                MemberStatus.ALIVE
        );
    }

    @JsonIgnore
    public boolean isLead() {
        return TeamRelayConfig.LEAD_NAME.equals(name);
    }

    public Member withStatus(MemberStatus next) {
        return new Member(name, agentType, backend, model, color, prompt, planModeRequired, joinedAt, processHandle, next);
    }

    public Member withProcessHandle(String handle) {
        return new Member(name, agentType, backend, model, color, prompt, planModeRequired, joinedAt, handle, status);
    }
}
