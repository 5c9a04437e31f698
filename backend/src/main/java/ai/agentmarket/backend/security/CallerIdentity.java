package ai.agentmarket.backend.security;

import lombok.Value;

/**
 * The authenticated principal performing an operation.
 */
@Value
public class CallerIdentity {

    String id;

    /**
     * Whether the caller may resolve disputes and set verification levels.
     */
    boolean admin;

    public static CallerIdentity user(String id) {
        return new CallerIdentity(id, false);
    }

    public static CallerIdentity admin(String id) {
        return new CallerIdentity(id, true);
    }

    public boolean is(String user) {
        return id.equals(user);
    }
}
