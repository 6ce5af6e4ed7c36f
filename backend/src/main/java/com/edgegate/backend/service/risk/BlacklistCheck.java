package com.edgegate.backend.service.risk;

public record BlacklistCheck(boolean allowed, String reason, CombinationKey matched) {

    static BlacklistCheck allow(String reason) {
        return new BlacklistCheck(true, reason, null);
    }

    static BlacklistCheck deny(BlacklistEntry entry) {
        return new BlacklistCheck(false, "blacklisted: " + entry.reason(), entry.key());
    }
}
