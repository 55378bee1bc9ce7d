package io.teamrelay.team;

import io.teamrelay.model.Member;
import io.teamrelay.model.MemberStatus;

/**
 * Source of liveness for a member, usually a backend health check. The registry never spawns or
 * inspects processes itself.
 */
@FunctionalInterface
public interface HealthProbe {
    MemberStatus statusOf(Member member);

    /**
     * Trusts whatever status was last recorded in the team config.
     */
    static HealthProbe recorded() {
        return Member::status;
    }
}
