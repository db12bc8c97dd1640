package com.realtime.chatstore.chat.service;

import com.realtime.chatstore.chat.dto.ConversationDto;
import com.realtime.chatstore.chat.dto.GroupInfoDto;
import com.realtime.chatstore.chat.dto.LastMessageDto;
import com.realtime.chatstore.chat.dto.ParticipantDto;
import com.realtime.chatstore.chat.entity.Conversation;
import com.realtime.chatstore.chat.entity.GroupConversation;
import com.realtime.chatstore.chat.entity.LastMessage;
import com.realtime.chatstore.chat.entity.Message;
import com.realtime.chatstore.chat.entity.Participant;
import com.realtime.chatstore.chat.entity.ParticipantId;
import com.realtime.chatstore.chat.repository.ConversationRepository;
import com.realtime.chatstore.chat.repository.GroupConversationRepository;
import com.realtime.chatstore.chat.repository.LastMessageRepository;
import com.realtime.chatstore.chat.repository.MessageRepository;
import com.realtime.chatstore.chat.repository.ParticipantRepository;
import com.realtime.chatstore.common.Timestamps;
import com.realtime.chatstore.common.TransactionRunner;
import com.realtime.chatstore.common.UuidOrder;
import com.realtime.chatstore.common.error.AuthorizationException;
import com.realtime.chatstore.common.error.ConflictException;
import com.realtime.chatstore.common.error.NotFoundException;
import com.realtime.chatstore.common.error.ValidationException;
import com.realtime.chatstore.notify.NotifyEvent;
import com.realtime.chatstore.notify.NotifyPublisher;
import com.realtime.chatstore.user.entity.User;
import com.realtime.chatstore.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationService {

    private final ConversationRepository conversationRepo;
    private final GroupConversationRepository groupRepo;
    private final ParticipantRepository participantRepo;
    private final LastMessageRepository lastMessageRepo;
    private final MessageRepository messageRepo;
    private final UserRepository userRepo;
    private final NotifyPublisher notify;
    private final TransactionRunner tx;
    private final Clock clock;

    /* ===================== 생성 ===================== */

    /**
     * 1:1 방 생성. 같은 쌍에 살아있는 DIRECT 방이 이미 있으면 Conflict.
     * DB 제약으로 표현할 수 없어서 두 사용자 행을 정규 순서로 잠가 같은 쌍의 생성을 줄 세운다.
     */
    public ConversationDto createDirect(UUID me, UUID other) {
        if (me == null || other == null) throw new ValidationException("user ids are required");
        if (me.equals(other)) throw new ValidationException("cannot open a direct conversation with yourself");

        return tx.write("createDirectConversation", () -> {
            User first = lockLiveUser(UuidOrder.min(me, other));
            User second = lockLiveUser(UuidOrder.max(me, other));

            if (!conversationRepo.findLiveDirectBetween(me, other).isEmpty()) {
                throw new ConflictException("direct conversation already exists");
            }

            Instant now = Timestamps.now(clock);
            Conversation conv = conversationRepo.save(Conversation.builder()
                    .type(Conversation.Type.DIRECT)
                    .createdAt(now)
                    .updatedAt(now)
                    .build());
            insertParticipant(conv, first, now);
            insertParticipant(conv, second, now);
            participantRepo.flush();

            log.info("direct conversation {} created for {} / {}", conv.getId(), me, other);
            notify.toUser(NotifyEvent.Type.CONVERSATION_CREATED, me, other, Map.of("conversationId", conv.getId()));
            return toDetail(conv, me);
        });
    }

    /** 살아있는 1:1 방 조회 (재사용하려는 호출자용) */
    @Transactional(readOnly = true)
    public Optional<ConversationDto> findDirect(UUID me, UUID other) {
        if (me == null || other == null || me.equals(other)) return Optional.empty();
        return conversationRepo.findLiveDirectBetween(me, other).stream()
                .findFirst()
                .map(c -> toDetail(c, me));
    }

    /**
     * 그룹 방 생성. 멤버 중 하나라도 없으면 전체 롤백 (부분 생성 없음).
     */
    public ConversationDto createGroup(UUID creatorId, String name, List<UUID> memberIds) {
        if (creatorId == null) throw new ValidationException("creator is required");
        if (name == null || name.isBlank()) throw new ValidationException("group name is required");

        LinkedHashSet<UUID> all = new LinkedHashSet<>();
        all.add(creatorId);
        if (memberIds != null) {
            for (UUID id : memberIds) {
                if (id == null) throw new ValidationException("member id must not be null");
                all.add(id);
            }
        }

        return tx.write("createGroupConversation", () -> {
            Map<UUID, User> users = userRepo.findByIdInAndDeletedAtIsNull(all).stream()
                    .collect(Collectors.toMap(User::getId, Function.identity()));
            for (UUID id : all) {
                if (!users.containsKey(id)) throw new NotFoundException("user not found: " + id);
            }

            Instant now = Timestamps.now(clock);
            Conversation conv = conversationRepo.save(Conversation.builder()
                    .type(Conversation.Type.GROUP)
                    .createdAt(now)
                    .updatedAt(now)
                    .build());
            groupRepo.save(GroupConversation.builder()
                    .conversation(conv)
                    .name(name.trim())
                    .createdBy(users.get(creatorId))
                    .build());
            for (UUID id : all) {
                insertParticipant(conv, users.get(id), now);
            }
            participantRepo.flush();

            log.info("group conversation {} created by {} with {} member(s)", conv.getId(), creatorId, all.size());
            notify.toConversation(NotifyEvent.Type.CONVERSATION_CREATED, creatorId, conv.getId(), Map.of("name", name.trim()));
            return toDetail(conv, creatorId);
        });
    }

    /* ===================== 참여자 ===================== */

    /**
     * 참여자 추가. 예전에 나간 행이 있으면 되살린다 (PK 가 deleted_at 과 무관하므로 새 행 금지).
     */
    public ParticipantDto addParticipant(UUID conversationId, UUID userId) {
        return tx.write("addParticipant", () -> {
            Conversation conv = requireConversation(conversationId);
            if (conv.getType() == Conversation.Type.DIRECT) {
                throw new ValidationException("direct conversations have fixed membership");
            }
            User user = userRepo.findByIdAndDeletedAtIsNull(userId)
                    .orElseThrow(() -> new NotFoundException("user not found"));

            Instant now = Timestamps.now(clock);
            Participant p = participantRepo.findById(new ParticipantId(conversationId, userId)).orElse(null);
            if (p == null) {
                p = insertParticipant(conv, user, now);
            } else if (p.isActive()) {
                throw new ConflictException("user is already a participant");
            } else {
                p.setDeletedAt(null);
                p.setUnreadCount(0);
                p.setLastSeenMessageId(newestMessageId(conversationId));
                p.setJoinedAt(now);
            }
            participantRepo.flush();

            notify.toConversation(NotifyEvent.Type.PARTICIPANT_ADDED, userId, conversationId, Map.of("userId", userId));
            return ParticipantDto.from(p);
        });
    }

    /** soft delete. 이미 나간 경우 NotFound */
    public void removeParticipant(UUID conversationId, UUID userId) {
        tx.run("removeParticipant", () -> {
            Participant p = participantRepo.findByIdAndDeletedAtIsNull(new ParticipantId(conversationId, userId))
                    .orElseThrow(() -> new NotFoundException("participant not found"));
            p.setDeletedAt(Timestamps.now(clock));
            notify.toConversation(NotifyEvent.Type.PARTICIPANT_REMOVED, userId, conversationId, Map.of("userId", userId));
        });
    }

    /* ===================== 조회 ===================== */

    @Transactional(readOnly = true)
    public List<ConversationDto> listConversations(UUID me) {
        List<Conversation> conversations = conversationRepo.findLiveOf(me);
        if (conversations.isEmpty()) return List.of();

        List<UUID> ids = conversations.stream().map(Conversation::getId).toList();

        Map<UUID, GroupConversation> groups = groupRepo.findAllById(ids).stream()
                .collect(Collectors.toMap(GroupConversation::getConversationId, Function.identity()));
        Map<UUID, LastMessage> lasts = lastMessageRepo.findByConversationIds(ids).stream()
                .collect(Collectors.toMap(l -> l.getConversation().getId(), Function.identity()));
        Map<UUID, List<Participant>> participants = participantRepo.findLiveWithUsers(ids).stream()
                .collect(Collectors.groupingBy(p -> p.getId().getConversationId(), LinkedHashMap::new, Collectors.toList()));

        return conversations.stream()
                .map(c -> assemble(c, me, groups.get(c.getId()), lasts.get(c.getId()),
                        participants.getOrDefault(c.getId(), List.of())))
                .toList();
    }

    /** 방 단건 조회: 요청자가 살아있는 참여자인지 확인 */
    @Transactional(readOnly = true)
    public ConversationDto getConversation(UUID conversationId, UUID me) {
        Conversation conv = requireConversation(conversationId);
        requireLiveParticipant(conversationId, me);
        return toDetail(conv, me);
    }

    /* ===================== 내부 ===================== */

    public Conversation requireConversation(UUID conversationId) {
        if (conversationId == null) throw new ValidationException("conversationId is required");
        return conversationRepo.findById(conversationId)
                .orElseThrow(() -> new NotFoundException("conversation not found"));
    }

    public Participant requireLiveParticipant(UUID conversationId, UUID userId) {
        return participantRepo.findByIdAndDeletedAtIsNull(new ParticipantId(conversationId, userId))
                .orElseThrow(() -> new AuthorizationException("not a participant of this conversation"));
    }

    private User lockLiveUser(UUID id) {
        return userRepo.lockLiveById(id).orElseThrow(() -> new NotFoundException("user not found: " + id));
    }

    private Participant insertParticipant(Conversation conv, User user, Instant now) {
        return participantRepo.save(Participant.builder()
                .id(new ParticipantId(conv.getId(), user.getId()))
                .conversation(conv)
                .user(user)
                .unreadCount(0)
                .lastSeenMessageId(newestMessageId(conv.getId()))
                .joinedAt(now)
                .build());
    }

    /** 들어오는 시점의 최신 메시지까지 읽은 것으로 시작한다 (빈 방이면 null) */
    private UUID newestMessageId(UUID conversationId) {
        return messageRepo.findFirstByConversation_IdOrderByCreatedAtDescIdDesc(conversationId)
                .map(Message::getId)
                .orElse(null);
    }

    private ConversationDto toDetail(Conversation conv, UUID me) {
        GroupConversation group = conv.getType() == Conversation.Type.GROUP
                ? groupRepo.findById(conv.getId()).orElse(null)
                : null;
        LastMessage last = lastMessageRepo.findByConversation_Id(conv.getId()).orElse(null);
        List<Participant> participants = participantRepo.findLiveWithUsers(List.of(conv.getId()));
        return assemble(conv, me, group, last, participants);
    }

    private ConversationDto assemble(Conversation conv, UUID me, GroupConversation group,
                                     LastMessage last, List<Participant> participants) {
        int myUnread = participants.stream()
                .filter(p -> p.getId().getUserId().equals(me))
                .mapToInt(Participant::getUnreadCount)
                .findFirst()
                .orElse(0);

        return ConversationDto.builder()
                .id(conv.getId())
                .type(conv.getType().name())
                .group(group != null ? GroupInfoDto.from(group) : null)
                .lastMessage(last != null ? LastMessageDto.from(last) : null)
                .unreadCount(myUnread)
                .participants(participants.stream().map(ParticipantDto::from).toList())
                .createdAt(conv.getCreatedAt())
                .updatedAt(conv.getUpdatedAt())
                .build();
    }
}
