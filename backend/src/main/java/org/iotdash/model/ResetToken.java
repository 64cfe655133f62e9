package org.iotdash.model;

import lombok.Data;

import java.time.Instant;

@Data
public class ResetToken {
    private String email;
    private Instant expiry;
    private boolean used;
    private Instant createdAt;
    private Instant usedAt;
    private String ip;

    public boolean isExpired(Instant now) {
        return now.isAfter(expiry);
    }
}
