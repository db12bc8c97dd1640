package com.realtime.chatstore.common;

import java.util.Comparator;
import java.util.UUID;

/**
 * UUID 전순서. 부호 없는 128비트(바이트 사전순) 비교로, PostgreSQL uuid 비교와 같은 결과를 낸다.
 * {@link UUID#compareTo}는 부호 있는 long 비교라서 정규화 간선(user_a &lt; user_b)에 쓰면 안 된다.
 */
public final class UuidOrder {

    public static final Comparator<UUID> COMPARATOR = UuidOrder::compare;

    private UuidOrder() {}

    public static int compare(UUID a, UUID b) {
        int cmp = Long.compareUnsigned(a.getMostSignificantBits(), b.getMostSignificantBits());
        return cmp != 0 ? cmp : Long.compareUnsigned(a.getLeastSignificantBits(), b.getLeastSignificantBits());
    }

    public static UUID min(UUID a, UUID b) {
        return compare(a, b) <= 0 ? a : b;
    }

    public static UUID max(UUID a, UUID b) {
        return compare(a, b) <= 0 ? b : a;
    }
}
