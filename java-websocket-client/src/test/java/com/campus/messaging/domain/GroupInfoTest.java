package com.campus.messaging.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GroupInfoTest {

    private final Participant me = Participant.builder().id("7").username("me").firstName("Local").build();
    private final Participant bob = Participant.builder().id("9").username("bob").firstName("Bob").lastName("Lee").build();
    private final Participant ann = Participant.builder().id("3").username("ann").build();

    @Test
    void shouldPreferGroupName() {
        GroupInfo group = GroupInfo.builder().id("42").name("Study group").members(List.of(me, bob)).build();

        assertThat(group.displayNameFor("7")).isEqualTo("Study group");
    }

    @Test
    void shouldUseOtherMemberForDirectConversation() {
        assertThat(GroupInfo.builder().id("42").members(List.of(me, bob)).build().displayNameFor("7"))
            .isEqualTo("Bob Lee");
        assertThat(GroupInfo.builder().id("42").name(" ").members(List.of(ann, me)).build().displayNameFor("7"))
            .isEqualTo("ann");
    }

    @Test
    void shouldFallBackToChat() {
        assertThat(GroupInfo.empty("42").displayNameFor("7")).isEqualTo("Chat");
        assertThat(GroupInfo.builder().id("42").members(List.of(me)).build().displayNameFor("7")).isEqualTo("Chat");
    }
}
