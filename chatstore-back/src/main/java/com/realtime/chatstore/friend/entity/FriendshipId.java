package com.realtime.chatstore.friend.entity;

import com.realtime.chatstore.common.UuidOrder;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

import java.io.Serializable;
import java.util.UUID;

/**
 * 정규화된 무방향 간선 키. 항상 userA &lt; userB ({@link UuidOrder}) 로만 만든다.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@EqualsAndHashCode  // JPA 키 클래스는 동치성 구현 필수
@ToString
public class FriendshipId implements Serializable {

    @Column(name = "user_a", nullable = false)
    private UUID userA;

    @Column(name = "user_b", nullable = false)
    private UUID userB;

    /** 두 사용자 순서와 무관하게 같은 키를 돌려준다 */
    public static FriendshipId of(UUID x, UUID y) {
        if (x == null || y == null) throw new IllegalArgumentException("user ids are required");
        if (x.equals(y)) throw new IllegalArgumentException("friendship needs two distinct users");
        return new FriendshipId(UuidOrder.min(x, y), UuidOrder.max(x, y));
    }

    public UUID other(UUID me) {
        return userA.equals(me) ? userB : userA;
    }
}
