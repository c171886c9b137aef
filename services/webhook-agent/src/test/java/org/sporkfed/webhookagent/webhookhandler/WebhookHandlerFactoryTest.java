package org.sporkfed.webhookagent.webhookhandler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("WebhookHandlerFactory")
class WebhookHandlerFactoryTest {

    @Test
    @DisplayName("should route an event type to the handler that supports it")
    void shouldRouteByEventType() {
        WebhookHandler pushHandler = mock(WebhookHandler.class);
        WebhookHandler otherHandler = mock(WebhookHandler.class);
        when(otherHandler.supportsEvent("push")).thenReturn(false);
        when(pushHandler.supportsEvent("push")).thenReturn(true);

        WebhookHandlerFactory factory = new WebhookHandlerFactory(List.of(otherHandler, pushHandler));

        assertThat(factory.getHandler("push")).containsSame(pushHandler);
    }

    @Test
    @DisplayName("should return empty for unsupported or missing event types")
    void shouldReturnEmptyForUnsupported() {
        WebhookHandler pushHandler = mock(WebhookHandler.class);
        when(pushHandler.supportsEvent("issues")).thenReturn(false);

        WebhookHandlerFactory factory = new WebhookHandlerFactory(List.of(pushHandler));

        assertThat(factory.getHandler("issues")).isEmpty();
        assertThat(factory.getHandler(null)).isEmpty();
    }
}
