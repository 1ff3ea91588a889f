package com.coopledger.common;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Identity recorded as the creator of everything the engine posts on its own:
 * auto-applied penalties, excess contribution sweeps and scheduled loan closures.
 */
@Component
public class SystemActor {

    private final String id;

    public SystemActor(@Value("${cooperative.system-actor-id:system}") String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public boolean is(String actorId) {
        return id.equals(actorId);
    }
}
