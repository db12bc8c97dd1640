package com.realtime.chatstore.chat.controller;

import com.realtime.chatstore.chat.dto.AddParticipantRequest;
import com.realtime.chatstore.chat.dto.ConversationDto;
import com.realtime.chatstore.chat.dto.CreateDirectRequest;
import com.realtime.chatstore.chat.dto.CreateGroupRequest;
import com.realtime.chatstore.chat.dto.MarkReadRequest;
import com.realtime.chatstore.chat.dto.ParticipantDto;
import com.realtime.chatstore.chat.dto.ReadAck;
import com.realtime.chatstore.chat.service.ConversationService;
import com.realtime.chatstore.chat.service.ReadStateService;
import com.realtime.chatstore.common.CurrentUser;
import com.realtime.chatstore.common.error.NotFoundException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/conversations")
@RequiredArgsConstructor
public class ConversationController {

    private final ConversationService conversationService;
    private final ReadStateService readStateService;

    /** 내 방 목록 (최근 활동순) */
    @GetMapping
    public List<ConversationDto> myConversations(Principal principal) {
        return conversationService.listConversations(CurrentUser.id(principal));
    }

    /** 방 단건 조회: 참여자만 */
    @GetMapping("/{conversationId}")
    public ConversationDto get(@PathVariable("conversationId") UUID conversationId, Principal principal) {
        return conversationService.getConversation(conversationId, CurrentUser.id(principal));
    }

    /** 1:1 방 개설. 이미 있으면 409 (조회는 GET /direct/{userId}) */
    @PostMapping("/direct")
    @ResponseStatus(HttpStatus.CREATED)
    public ConversationDto openDirect(@Valid @RequestBody CreateDirectRequest req, Principal principal) {
        return conversationService.createDirect(CurrentUser.id(principal), req.userId());
    }

    @GetMapping("/direct/{userId}")
    public ConversationDto findDirect(@PathVariable("userId") UUID userId, Principal principal) {
        return conversationService.findDirect(CurrentUser.id(principal), userId)
                .orElseThrow(() -> new NotFoundException("direct conversation not found"));
    }

    /** 그룹 방 생성 (생성자는 자동 포함) */
    @PostMapping("/groups")
    @ResponseStatus(HttpStatus.CREATED)
    public ConversationDto createGroup(@Valid @RequestBody CreateGroupRequest req, Principal principal) {
        return conversationService.createGroup(CurrentUser.id(principal), req.name(), req.memberIds());
    }

    /** 멤버 초대: 초대하는 사람이 참여자여야 한다 */
    @PostMapping("/{conversationId}/participants")
    @ResponseStatus(HttpStatus.CREATED)
    public ParticipantDto addParticipant(@PathVariable("conversationId") UUID conversationId,
                                         @Valid @RequestBody AddParticipantRequest req,
                                         Principal principal) {
        conversationService.getConversation(conversationId, CurrentUser.id(principal));
        return conversationService.addParticipant(conversationId, req.userId());
    }

    /** 나가기 / 내보내기 */
    @DeleteMapping("/{conversationId}/participants/{userId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void removeParticipant(@PathVariable("conversationId") UUID conversationId,
                                  @PathVariable("userId") UUID userId,
                                  Principal principal) {
        UUID me = CurrentUser.id(principal);
        if (!me.equals(userId)) {
            conversationService.getConversation(conversationId, me);
        }
        conversationService.removeParticipant(conversationId, userId);
    }

    /** 읽음 처리. messageId 가 없으면 최신 메시지까지 */
    @PostMapping("/{conversationId}/read")
    public ReadAck markRead(@PathVariable("conversationId") UUID conversationId,
                            @RequestBody(required = false) MarkReadRequest req,
                            Principal principal) {
        UUID me = CurrentUser.id(principal);
        if (req == null || req.messageId() == null) {
            return readStateService.markAllRead(conversationId, me);
        }
        return readStateService.markRead(conversationId, me, req.messageId());
    }
}
