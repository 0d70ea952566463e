package com.sitecraft.graph;

import java.nio.charset.StandardCharsets;
import java.util.List;

import com.sitecraft.source.FingerprintStore;

/**
 * Result of evaluating an aggregate predicate against the current page set. {@code digest} identifies the
 * ordered member list and stands in for the aggregate's hash in the dependency sets of outputs that
 * consulted it.
 */
public record AggregateMembership(String outputId, AggregatePredicate predicate, List<String> members, String digest) {

    public AggregateMembership {
        members = List.copyOf(members);
    }

    public static AggregateMembership of(String outputId, AggregatePredicate predicate, List<String> members) {
        return new AggregateMembership(outputId, predicate, members, digest(predicate, members));
    }

    static String digest(AggregatePredicate predicate, List<String> members) {
        StringBuilder builder = new StringBuilder(predicate.describe());
        for (String member : members) {
            builder.append('\n').append(member);
        }
        return FingerprintStore.fingerprint(builder.toString().getBytes(StandardCharsets.UTF_8));
    }
}
