package com.e2eq.pgraph.core;

import com.e2eq.pgraph.annotations.NodeField;
import com.e2eq.pgraph.annotations.NodeType;
import com.e2eq.pgraph.model.GraphEntity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Entity classes shared by the core tests.
 */
final class TestEntities {
    private TestEntities() {}

    static class Agent extends GraphEntity {
        String name;
        String role;
        Agent affiliation;

        Agent() {}

        Agent(String pid, String name) {
            setPid(pid);
            this.name = name;
        }
    }

    @NodeType(id = "Site")
    static class SamplingSite extends GraphEntity {
        @NodeField(id = "site_name")
        String siteName;
        Double elevation;
    }

    static class Sample extends GraphEntity {
        String identifier;
        List<String> keywords = new ArrayList<>();
        Instant collected;
        transient String scratch;
        static String IGNORED = "x";

        @NodeField(id = "registrant")
        Agent registrant;
        List<Agent> curators = new ArrayList<>();
        SamplingSite site;
    }

    // chain of arbitrary length for depth tests
    static class Link extends GraphEntity {
        Long ordinal;
        Link next;
    }

    static class Unregistered extends GraphEntity {
        String whatever;
    }

    // same simple name as Agent's type id, used for conflict tests
    @NodeType(id = "Agent")
    static class OtherAgent extends GraphEntity {
        Long age;
    }

    static class BadField extends GraphEntity {
        Object payload;
    }

    static Link chain(int length) {
        Link head = new Link();
        head.ordinal = 0L;
        Link cur = head;
        for (int i = 1; i < length; i++) {
            Link n = new Link();
            n.ordinal = (long) i;
            cur.next = n;
            cur = n;
        }
        return head;
    }
}
