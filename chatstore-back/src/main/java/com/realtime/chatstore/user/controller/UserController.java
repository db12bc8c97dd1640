package com.realtime.chatstore.user.controller;

import com.realtime.chatstore.common.CurrentUser;
import com.realtime.chatstore.user.dto.RegisterRequest;
import com.realtime.chatstore.user.dto.UpdateProfileRequest;
import com.realtime.chatstore.user.dto.UserDto;
import com.realtime.chatstore.user.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.util.UUID;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;

    /** 인증 계층이 가입 처리 후 호출 (passwordHash는 이미 해시된 값) */
    @PostMapping
    public ResponseEntity<UserDto> register(@Valid @RequestBody RegisterRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(userService.register(req));
    }

    @GetMapping("/me")
    public UserDto me(Principal principal) {
        return userService.getUser(CurrentUser.id(principal));
    }

    @GetMapping("/{id}")
    public UserDto get(@PathVariable("id") UUID id) {
        return userService.getUser(id);
    }

    @PatchMapping("/me")
    public UserDto update(@Valid @RequestBody UpdateProfileRequest req, Principal principal) {
        return userService.updateProfile(CurrentUser.id(principal), req);
    }

    @DeleteMapping("/me")
    public ResponseEntity<Void> delete(Principal principal) {
        userService.deleteUser(CurrentUser.id(principal));
        return ResponseEntity.noContent().build();
    }
}
