package notestore.domain.response;

import io.smallrye.config.inject.ConfigExtension;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.Response;
import notestore.domain.exceptions.QueryFailure;
import notestore.domain.exceptions.ValidationFailed;
import notestore.domain.json.JsonDeserializerJackson;
import notestore.domain.logger.Loggers;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(RemoteResponseValidation.class)
@AddBeanClasses(JsonDeserializerJackson.class)
@AddBeanClasses(Loggers.class)
public class RemoteResponseValidationTest {

    @Inject
    RemoteResponseValidation responseValidation;

    @Test
    public void testSuccessPassesThrough() {
        final Response created = Response.status(201).build();
        final Response noContent = Response.noContent().build();

        assertSame(created, responseValidation.validate(created, "notes"));
        assertSame(noContent, responseValidation.validate(noContent, "notes/1"));
    }

    @Test
    public void testBadRequestIsValidationFailed() {
        assertThrows(ValidationFailed.class,
                () -> responseValidation.validate(Response.status(400).build(), "notes"));
    }

    @Test
    public void testOtherStatusesAreQueryFailures() {
        assertThrows(QueryFailure.class,
                () -> responseValidation.validate(Response.serverError().build(), "notes"));
        assertThrows(QueryFailure.class,
                () -> responseValidation.validate(Response.status(503).build(), "stats"));
        assertThrows(QueryFailure.class,
                () -> responseValidation.validate(Response.status(302).build(), "notes/1"));
    }
}
