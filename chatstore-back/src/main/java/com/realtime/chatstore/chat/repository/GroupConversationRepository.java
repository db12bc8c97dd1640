package com.realtime.chatstore.chat.repository;

import com.realtime.chatstore.chat.entity.GroupConversation;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface GroupConversationRepository extends JpaRepository<GroupConversation, UUID> {
}
