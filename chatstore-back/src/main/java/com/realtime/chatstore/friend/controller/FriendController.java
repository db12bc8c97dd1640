package com.realtime.chatstore.friend.controller;

import com.realtime.chatstore.common.CurrentUser;
import com.realtime.chatstore.common.error.NotFoundException;
import com.realtime.chatstore.common.error.ValidationException;
import com.realtime.chatstore.friend.dto.FriendBriefDto;
import com.realtime.chatstore.friend.dto.FriendRequestDto;
import com.realtime.chatstore.friend.dto.FriendshipDto;
import com.realtime.chatstore.friend.dto.SendFriendRequest;
import com.realtime.chatstore.friend.service.FriendService;
import com.realtime.chatstore.user.entity.User;
import com.realtime.chatstore.user.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/friends")
@RequiredArgsConstructor
public class FriendController {

    private final FriendService friendService;
    private final UserService userService;

    /** 내 친구 목록 */
    @GetMapping
    public List<FriendBriefDto> myFriends(Principal principal) {
        return friendService.listFriends(CurrentUser.id(principal));
    }

    /* ======= 친구 끊기 ======= */
    @DeleteMapping("/{friendId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void unfriend(@PathVariable("friendId") UUID friendId, Principal principal) {
        friendService.unfriend(CurrentUser.id(principal), friendId);
    }

    /** 친구 요청: toUserId 가 없으면 identifier(이메일/휴대폰/username)로 찾는다 */
    @PostMapping("/requests")
    @ResponseStatus(HttpStatus.CREATED)
    public FriendRequestDto send(@Valid @RequestBody SendFriendRequest body, Principal principal) {
        UUID myId = CurrentUser.id(principal);
        UUID target = body.toUserId();
        if (target == null) {
            if (body.identifier() == null || body.identifier().isBlank()) {
                throw new ValidationException("toUserId or identifier is required");
            }
            target = userService.findByIdentifier(body.identifier())
                    .map(User::getId)
                    .orElseThrow(() -> new NotFoundException("user not found"));
        }
        return friendService.sendRequest(myId, target, body.message());
    }

    /* ======= 요청 들어옴 ======= */
    @GetMapping("/requests/incoming")
    public List<FriendRequestDto> incoming(Principal principal) {
        return friendService.incoming(CurrentUser.id(principal));
    }

    /* ======= 요청 나감 ======= */
    @GetMapping("/requests/outgoing")
    public List<FriendRequestDto> outgoing(Principal principal) {
        return friendService.outgoing(CurrentUser.id(principal));
    }

    /* ======= 수락 ======= */
    @PostMapping("/requests/{id}/accept")
    public FriendshipDto accept(@PathVariable("id") UUID id, Principal principal) {
        return friendService.accept(id, CurrentUser.id(principal));
    }

    /* ======= 거절 ======= */
    @PostMapping("/requests/{id}/decline")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void decline(@PathVariable("id") UUID id, Principal principal) {
        friendService.reject(id, CurrentUser.id(principal));
    }

    /* ======= 취소 ======= */
    @DeleteMapping("/requests/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void cancel(@PathVariable("id") UUID id, Principal principal) {
        friendService.cancel(id, CurrentUser.id(principal));
    }
}
