package com.realtime.chatstore.chat.controller;

import com.realtime.chatstore.chat.dto.EditMessageRequest;
import com.realtime.chatstore.chat.dto.MessageCursor;
import com.realtime.chatstore.chat.dto.MessageDto;
import com.realtime.chatstore.chat.dto.MessagePage;
import com.realtime.chatstore.chat.dto.SendMessageRequest;
import com.realtime.chatstore.chat.service.MessageService;
import com.realtime.chatstore.common.CurrentUser;
import com.realtime.chatstore.common.error.ValidationException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.time.Instant;
import java.util.UUID;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class MessageController {

    private final MessageService messageService;

    /**
     * 히스토리: 최신 → 과거. 다음 페이지는 응답의 nextCursor 를 beforeAt/beforeId 로 넘긴다.
     */
    @GetMapping("/conversations/{conversationId}/messages")
    public MessagePage history(@PathVariable("conversationId") UUID conversationId,
                               @RequestParam(name = "limit", required = false) Integer limit,
                               @RequestParam(name = "beforeAt", required = false)
                               @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant beforeAt,
                               @RequestParam(name = "beforeId", required = false) UUID beforeId,
                               Principal principal) {
        if ((beforeAt == null) != (beforeId == null)) {
            throw new ValidationException("beforeAt and beforeId must be given together");
        }
        MessageCursor before = beforeAt == null ? null : new MessageCursor(beforeAt, beforeId);
        return messageService.history(conversationId, CurrentUser.id(principal), before, limit);
    }

    @PostMapping("/conversations/{conversationId}/messages")
    @ResponseStatus(HttpStatus.CREATED)
    public MessageDto send(@PathVariable("conversationId") UUID conversationId,
                           @Valid @RequestBody SendMessageRequest req,
                           Principal principal) {
        return messageService.send(conversationId, CurrentUser.id(principal),
                req.type(), req.content(), req.fileUrl(), req.replyToId());
    }

    @GetMapping("/messages/{messageId}")
    public MessageDto get(@PathVariable("messageId") UUID messageId, Principal principal) {
        return messageService.get(messageId, CurrentUser.id(principal));
    }

    @PatchMapping("/messages/{messageId}")
    public MessageDto edit(@PathVariable("messageId") UUID messageId,
                           @Valid @RequestBody EditMessageRequest req,
                           Principal principal) {
        return messageService.edit(messageId, CurrentUser.id(principal), req.content());
    }

    @DeleteMapping("/messages/{messageId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable("messageId") UUID messageId, Principal principal) {
        messageService.delete(messageId, CurrentUser.id(principal));
    }
}
