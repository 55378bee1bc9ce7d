package io.teamrelay.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public record TeamConfig(
        String name,
        String description,
        long createdAt,
        String leadName,
        List<Member> members
) {
    public TeamConfig {
        description = description == null ? "" : description;
        members = members == null ? List.of() : List.copyOf(members);
    }

    public Optional<Member> findMember(String memberName) {
        return members.stream().filter(m -> m.name().equals(memberName)).findFirst();
    }

    public boolean hasMember(String memberName) {
        return findMember(memberName).isPresent();
    }

    public List<Member> teammates() {
        return members.stream().filter(m -> !m.isLead()).toList();
    }

    public TeamConfig withMembers(List<Member> replacement) {
        return new TeamConfig(name, description, createdAt, leadName, replacement);
    }

    public TeamConfig withMember(Member added) {
        List<Member> next = new ArrayList<>(members);
        next.add(added);
        return withMembers(next);
    }

    public TeamConfig replaceMember(Member updated) {
        List<Member> next = new ArrayList<>(members.size());
        for (Member member : members) {
            next.add(member.name().equals(updated.name()) ? updated : member);
        }
        return withMembers(next);
    }

    public TeamConfig withoutMember(String memberName) {
        return withMembers(members.stream().filter(m -> !m.name().equals(memberName)).toList());
    }
}
