package com.sommerph.didvault.repository.challenge;

import com.sommerph.didvault.model.auth.Challenge;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
public class InMemoryChallengeStore implements ChallengeStore {

    private final Map<String, Challenge> challengeStore = new ConcurrentHashMap<>();

    @Override
    public Challenge get(String subjectId) {
        return challengeStore.get(subjectId);
    }

    @Override
    public Challenge put(Challenge challenge) {
        log.debug("Store challenge for subject {}", challenge.getSubjectId());
        return challengeStore.put(challenge.getSubjectId(), challenge);
    }

    @Override
    public boolean remove(String subjectId, Challenge expected) {
        return challengeStore.remove(subjectId, expected);
    }

    @Override
    public int sweep(Instant now) {
        int removed = 0;
        for (Map.Entry<String, Challenge> entry : challengeStore.entrySet()) {
            if (entry.getValue().isExpiredAt(now) && challengeStore.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public int size() {
        return challengeStore.size();
    }

}
