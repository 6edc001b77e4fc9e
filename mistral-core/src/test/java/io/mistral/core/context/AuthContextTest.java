package io.mistral.core.context;

import com.google.common.base.Optional;
import io.mistral.commons.config.Config;
import io.mistral.commons.config.ConfigFactory;
import io.mistral.core.database.DatabaseTestingUtils;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class AuthContextTest
{
    private final ConfigFactory cf = DatabaseTestingUtils.createConfigFactory();

    @Test
    public void storedFormUsesSnakeCaseKeys()
    {
        AuthContext ctx = AuthContext.builder()
            .userId("u1")
            .projectId("p1")
            .authToken("token")
            .addRoles("admin", "member")
            .isAdmin(true)
            .build();

        Config stored = ctx.toConfig(cf);
        assertThat(stored.get("user_id", String.class), is("u1"));
        assertThat(stored.get("project_id", String.class), is("p1"));
        assertThat(stored.get("is_admin", boolean.class), is(true));
        assertThat(stored.get("is_trust_scoped", boolean.class), is(false));

        Config reloaded = cf.fromJsonString(stored.toString());
        assertThat(AuthContext.fromConfig(reloaded), is(Optional.of(ctx)));
    }

    @Test
    public void missingContextIsStoredAsEmptyObject()
    {
        Config stored = AuthContext.toConfig(Optional.absent(), cf);
        assertThat(stored.isEmpty(), is(true));
        assertThat(AuthContext.fromConfig(stored), is(Optional.absent()));
    }

    @Test
    public void unsetFieldsAreAbsent()
    {
        AuthContext ctx = AuthContext.fromConfig(cf.create().set("user_name", "alice")).get();
        assertThat(ctx.getUserName(), is(Optional.of("alice")));
        assertThat(ctx.getUserId(), is(Optional.absent()));
        assertThat(ctx.getRoles().isEmpty(), is(true));
        assertThat(ctx.isAdmin(), is(false));
    }
}
