package io.mistral.core.context;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import io.mistral.commons.config.Config;
import io.mistral.commons.config.ConfigFactory;
import org.immutables.value.Value;

import java.util.List;

/**
 * Security and tenant context of the caller that scheduled work.
 *
 * It's stored together with a scheduled job or delayed call and handed back to
 * the function when the job runs, possibly on another thread or another process.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableAuthContext.class)
@JsonDeserialize(as = ImmutableAuthContext.class)
public abstract class AuthContext
{
    @JsonProperty("user_id")
    public abstract Optional<String> getUserId();

    @JsonProperty("project_id")
    public abstract Optional<String> getProjectId();

    @JsonProperty("auth_token")
    public abstract Optional<String> getAuthToken();

    @JsonProperty("user_name")
    public abstract Optional<String> getUserName();

    @JsonProperty("project_name")
    public abstract Optional<String> getProjectName();

    @JsonProperty("roles")
    public abstract List<String> getRoles();

    @JsonProperty("is_admin")
    @Value.Default
    public boolean isAdmin()
    {
        return false;
    }

    @JsonProperty("is_trust_scoped")
    @Value.Default
    public boolean isTrustScoped()
    {
        return false;
    }

    public static ImmutableAuthContext.Builder builder()
    {
        return ImmutableAuthContext.builder();
    }

    public Config toConfig(ConfigFactory cf)
    {
        return cf.create(this);
    }

    /**
     * Restores an auth context from its stored form. An empty object means
     * that the work was scheduled without a context.
     */
    public static Optional<AuthContext> fromConfig(Config config)
    {
        if (config.isEmpty()) {
            return Optional.absent();
        }
        return Optional.of(config.convert(AuthContext.class));
    }

    public static Config toConfig(Optional<AuthContext> authContext, ConfigFactory cf)
    {
        if (authContext.isPresent()) {
            return authContext.get().toConfig(cf);
        }
        return cf.create();
    }
}
