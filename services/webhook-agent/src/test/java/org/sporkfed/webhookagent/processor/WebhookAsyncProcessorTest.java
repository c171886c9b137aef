package org.sporkfed.webhookagent.processor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.sporkfed.syncengine.model.PushEvent;
import org.sporkfed.syncengine.model.PushProcessingResult;
import org.sporkfed.syncengine.processor.PushEventProcessor;
import org.sporkfed.webhookagent.github.service.GitHubClientProvider;

import static org.assertj.core.api.Assertions.assertThatNoException;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("WebhookAsyncProcessor")
class WebhookAsyncProcessorTest {

    @Mock
    private PushEventProcessor pushEventProcessor;

    @Mock
    private GitHubClientProvider clientProvider;

    @InjectMocks
    private WebhookAsyncProcessor asyncProcessor;

    private final PushEvent event =
            new PushEvent("d1", "refs/heads/main", "c1", "main", "c1", "octo", "site", null);

    @Test
    @DisplayName("should process the push with the client provider as context factory")
    void shouldProcessPush() {
        when(pushEventProcessor.process(event, clientProvider)).thenReturn(PushProcessingResult.ignored("No sync rules configured"));

        asyncProcessor.processPushAsync(event);

        verify(pushEventProcessor).process(event, clientProvider);
    }

    @Test
    @DisplayName("should contain failures of push processing")
    void shouldContainFailures() {
        when(pushEventProcessor.process(event, clientProvider)).thenThrow(new IllegalStateException("no credentials"));

        assertThatNoException().isThrownBy(() -> asyncProcessor.processPushAsync(event));
    }
}
