package org.iotdash.id;

import org.iotdash.util.BoundedMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Issues 15-digit dashboard topic identifiers: a millisecond timestamp followed by
 * random digits. Uniqueness is only checked against the most recently issued ids.
 */
public class TopicIdGenerator {
    private static final Logger logger = LoggerFactory.getLogger(TopicIdGenerator.class);

    public static final int ID_LENGTH = 15;
    public static final int DEFAULT_HISTORY_CAPACITY = 10_000;

    private static final Pattern ID_PATTERN = Pattern.compile("^\\d{" + ID_LENGTH + "}$");
    private static final int WIDEN_AFTER_ATTEMPTS = 100;
    private static final int MAX_ATTEMPTS = 1000;

    private final Clock clock;
    private final SecureRandom random;
    private final BoundedMap<String, Boolean> issued;

    public TopicIdGenerator() {
        this(Clock.systemUTC(), new SecureRandom(), DEFAULT_HISTORY_CAPACITY);
    }

    public TopicIdGenerator(Clock clock, SecureRandom random, int historyCapacity) {
        this.clock = clock;
        this.random = random;
        this.issued = new BoundedMap<>(historyCapacity);
    }

    public synchronized String generate() {
        String topicId;
        int attempts = 0;

        do {
            String timestamp = Long.toString(clock.millis());
            topicId = timestamp + randomBetween(10, 99);
            attempts++;

            if (attempts > WIDEN_AFTER_ATTEMPTS) {
                topicId = timestamp.substring(0, Math.min(11, timestamp.length())) + randomBetween(1000, 9999);
            }
        } while (issued.containsKey(topicId) && attempts < MAX_ATTEMPTS);

        if (issued.containsKey(topicId)) {
            // not rechecked against the history
            logger.warn("Topic id collisions exhausted {} attempts, using random fallback", MAX_ATTEMPTS);
            topicId = randomDigits();
        }

        topicId = fitLength(topicId);
        issued.put(topicId, Boolean.TRUE);
        logger.debug("Generated topic id {}", topicId);
        return topicId;
    }

    public static boolean validate(String topicId) {
        return topicId != null && ID_PATTERN.matcher(topicId).matches();
    }

    public synchronized TopicIdStats stats() {
        int size = issued.size();
        return new TopicIdStats(size, (long) size * ID_LENGTH, size < issued.getCapacity());
    }

    private int randomBetween(int min, int max) {
        return min + random.nextInt(max - min + 1);
    }

    private String randomDigits() {
        byte[] bytes = new byte[8];
        random.nextBytes(bytes);
        String hex = HexFormat.of().formatHex(bytes);
        StringBuilder digits = new StringBuilder();
        for (char c : hex.toCharArray()) {
            if (c >= 'a' && c <= 'f') {
                digits.append(Character.digit(c, 16) + 1);
            } else {
                digits.append(c);
            }
        }
        return digits.toString();
    }

    private static String fitLength(String topicId) {
        if (topicId.length() > ID_LENGTH) {
            return topicId.substring(0, ID_LENGTH);
        }
        if (topicId.length() < ID_LENGTH) {
            return "0".repeat(ID_LENGTH - topicId.length()) + topicId;
        }
        return topicId;
    }
}
