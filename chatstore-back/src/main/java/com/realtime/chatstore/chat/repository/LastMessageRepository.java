package com.realtime.chatstore.chat.repository;

import com.realtime.chatstore.chat.entity.LastMessage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface LastMessageRepository extends JpaRepository<LastMessage, UUID> {

    Optional<LastMessage> findByConversation_Id(UUID conversationId);

    @Query("""
           select l from LastMessage l
             join fetch l.sender
           where l.conversation.id in :conversationIds
           """)
    List<LastMessage> findByConversationIds(@Param("conversationIds") Collection<UUID> conversationIds);
}
